package de.prgrm.cypher.ogm.runtime.literal.types;

import java.math.BigDecimal;

import de.prgrm.cypher.ogm.runtime.errors.SerializationException;
import de.prgrm.cypher.ogm.runtime.literal.LiteralSerializer;
import de.prgrm.cypher.ogm.runtime.literal.NanHandling;

public class NumberLiteralHandler extends AbstractTypedLiteralHandler<Number> {

    @Override
    protected Class<Number> getSupportedType() {
        return Number.class;
    }

    @Override
    protected String render(Number value, LiteralSerializer serializer) {
        if (value instanceof Double || value instanceof Float) {
            double d = value.doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                if (serializer.nanHandling() == NanHandling.AS_NULL) {
                    return "null";
                }
                throw new SerializationException("Value " + value + " has no Cypher literal");
            }
            return value.toString();
        }
        if (value instanceof BigDecimal decimal) {
            return decimal.toPlainString();
        }
        return value.toString();
    }
}
