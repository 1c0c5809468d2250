package de.prgrm.cypher.ogm.runtime.literal.types;

import java.time.LocalTime;
import java.time.format.DateTimeFormatter;

public class LocalTimeLiteralHandler extends AbstractTemporalLiteralHandler<LocalTime> {

    @Override
    protected Class<LocalTime> getSupportedType() {
        return LocalTime.class;
    }

    @Override
    protected String constructor() {
        return "localTime";
    }

    @Override
    protected String format(LocalTime value) {
        return value.format(DateTimeFormatter.ISO_LOCAL_TIME);
    }
}
