package de.prgrm.cypher.ogm.runtime.literal.types;

import java.time.Period;

public class PeriodLiteralHandler extends AbstractTemporalLiteralHandler<Period> {

    @Override
    protected Class<Period> getSupportedType() {
        return Period.class;
    }

    @Override
    protected String constructor() {
        return "duration";
    }

    @Override
    protected String format(Period value) {
        return value.toString();
    }
}
