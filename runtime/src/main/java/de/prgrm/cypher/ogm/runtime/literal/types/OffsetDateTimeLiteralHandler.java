package de.prgrm.cypher.ogm.runtime.literal.types;

import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;

public class OffsetDateTimeLiteralHandler extends AbstractTemporalLiteralHandler<OffsetDateTime> {

    @Override
    protected Class<OffsetDateTime> getSupportedType() {
        return OffsetDateTime.class;
    }

    @Override
    protected String constructor() {
        return "datetime";
    }

    @Override
    protected String format(OffsetDateTime value) {
        return value.format(DateTimeFormatter.ISO_OFFSET_DATE_TIME);
    }
}
