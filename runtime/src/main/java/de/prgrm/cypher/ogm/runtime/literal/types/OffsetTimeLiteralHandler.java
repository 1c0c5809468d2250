package de.prgrm.cypher.ogm.runtime.literal.types;

import java.time.OffsetTime;
import java.time.format.DateTimeFormatter;

public class OffsetTimeLiteralHandler extends AbstractTemporalLiteralHandler<OffsetTime> {

    @Override
    protected Class<OffsetTime> getSupportedType() {
        return OffsetTime.class;
    }

    @Override
    protected String constructor() {
        return "time";
    }

    @Override
    protected String format(OffsetTime value) {
        return value.format(DateTimeFormatter.ISO_OFFSET_TIME);
    }
}
