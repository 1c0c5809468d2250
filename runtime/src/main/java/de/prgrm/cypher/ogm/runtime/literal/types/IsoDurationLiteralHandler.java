package de.prgrm.cypher.ogm.runtime.literal.types;

import org.neo4j.driver.types.IsoDuration;

public class IsoDurationLiteralHandler extends AbstractTemporalLiteralHandler<IsoDuration> {

    @Override
    protected Class<IsoDuration> getSupportedType() {
        return IsoDuration.class;
    }

    @Override
    protected String constructor() {
        return "duration";
    }

    @Override
    protected String format(IsoDuration value) {
        return value.toString();
    }
}
