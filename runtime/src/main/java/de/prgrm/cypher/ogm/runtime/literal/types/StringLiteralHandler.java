package de.prgrm.cypher.ogm.runtime.literal.types;

import java.util.Locale;
import java.util.Set;

import de.prgrm.cypher.ogm.runtime.literal.LiteralSerializer;

public class StringLiteralHandler extends AbstractTypedLiteralHandler<String> {

    // strings spelling a Cypher keyword literal are passed through unquoted
    private static final Set<String> RAW_LITERALS = Set.of("null", "true", "false");

    @Override
    protected Class<String> getSupportedType() {
        return String.class;
    }

    @Override
    protected String render(String value, LiteralSerializer serializer) {
        if (RAW_LITERALS.contains(value.toLowerCase(Locale.ROOT))) {
            return value;
        }
        return serializer.quote(value);
    }
}
