package de.prgrm.cypher.ogm.runtime.literal.types;

import java.time.Duration;

public class DurationLiteralHandler extends AbstractTemporalLiteralHandler<Duration> {

    @Override
    protected Class<Duration> getSupportedType() {
        return Duration.class;
    }

    @Override
    protected String constructor() {
        return "duration";
    }

    @Override
    protected String format(Duration value) {
        return value.toString();
    }
}
