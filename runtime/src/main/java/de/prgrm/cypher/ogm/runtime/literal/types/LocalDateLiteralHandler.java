package de.prgrm.cypher.ogm.runtime.literal.types;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;

public class LocalDateLiteralHandler extends AbstractTemporalLiteralHandler<LocalDate> {

    @Override
    protected Class<LocalDate> getSupportedType() {
        return LocalDate.class;
    }

    @Override
    protected String constructor() {
        return "date";
    }

    @Override
    protected String format(LocalDate value) {
        return value.format(DateTimeFormatter.ISO_LOCAL_DATE);
    }
}
