package de.prgrm.cypher.ogm.runtime.literal.types;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

public class InstantLiteralHandler extends AbstractTemporalLiteralHandler<Instant> {

    @Override
    protected Class<Instant> getSupportedType() {
        return Instant.class;
    }

    @Override
    protected String constructor() {
        return "datetime";
    }

    @Override
    protected String format(Instant value) {
        return DateTimeFormatter.ISO_OFFSET_DATE_TIME.format(value.atOffset(ZoneOffset.UTC));
    }
}
