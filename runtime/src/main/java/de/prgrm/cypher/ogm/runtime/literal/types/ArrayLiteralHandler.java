package de.prgrm.cypher.ogm.runtime.literal.types;

import java.lang.reflect.Array;
import java.util.StringJoiner;

import de.prgrm.cypher.ogm.runtime.literal.LiteralHandler;
import de.prgrm.cypher.ogm.runtime.literal.LiteralSerializer;

public class ArrayLiteralHandler implements LiteralHandler {

    @Override
    public boolean supports(Object value) {
        return value.getClass().isArray();
    }

    @Override
    public String toCypher(Object value, LiteralSerializer serializer) {
        StringJoiner joiner = new StringJoiner(", ", "[", "]");
        int length = Array.getLength(value);
        for (int i = 0; i < length; i++) {
            joiner.add(serializer.serialize(Array.get(value, i)));
        }
        return joiner.toString();
    }
}
