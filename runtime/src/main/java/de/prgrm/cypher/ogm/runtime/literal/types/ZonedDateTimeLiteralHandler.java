package de.prgrm.cypher.ogm.runtime.literal.types;

import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;

public class ZonedDateTimeLiteralHandler extends AbstractTemporalLiteralHandler<ZonedDateTime> {

    @Override
    protected Class<ZonedDateTime> getSupportedType() {
        return ZonedDateTime.class;
    }

    @Override
    protected String constructor() {
        return "datetime";
    }

    @Override
    protected String format(ZonedDateTime value) {
        return value.format(DateTimeFormatter.ISO_ZONED_DATE_TIME);
    }
}
