package de.prgrm.cypher.ogm.runtime.literal.types;

import de.prgrm.cypher.ogm.runtime.literal.LiteralSerializer;

public class BooleanLiteralHandler extends AbstractTypedLiteralHandler<Boolean> {

    @Override
    protected Class<Boolean> getSupportedType() {
        return Boolean.class;
    }

    @Override
    protected String render(Boolean value, LiteralSerializer serializer) {
        return value ? "true" : "false";
    }
}
