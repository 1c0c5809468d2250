package de.prgrm.cypher.ogm.runtime.literal.types;

import de.prgrm.cypher.ogm.runtime.literal.LiteralSerializer;

/**
 * Cypher has no character type, a {@code char} becomes a one-character string.
 */
public class CharacterLiteralHandler extends AbstractTypedLiteralHandler<Character> {

    @Override
    protected Class<Character> getSupportedType() {
        return Character.class;
    }

    @Override
    protected String render(Character value, LiteralSerializer serializer) {
        return serializer.quote(String.valueOf(value));
    }
}
