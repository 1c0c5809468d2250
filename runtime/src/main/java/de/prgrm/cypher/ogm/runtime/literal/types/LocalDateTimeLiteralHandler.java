package de.prgrm.cypher.ogm.runtime.literal.types;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

public class LocalDateTimeLiteralHandler extends AbstractTemporalLiteralHandler<LocalDateTime> {

    @Override
    protected Class<LocalDateTime> getSupportedType() {
        return LocalDateTime.class;
    }

    @Override
    protected String constructor() {
        return "localDateTime";
    }

    @Override
    protected String format(LocalDateTime value) {
        return value.format(DateTimeFormatter.ISO_LOCAL_DATE_TIME);
    }
}
