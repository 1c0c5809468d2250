package de.prgrm.cypher.ogm.runtime.literal.types;

import de.prgrm.cypher.ogm.runtime.literal.LiteralSerializer;

@SuppressWarnings("rawtypes")
public class EnumLiteralHandler extends AbstractTypedLiteralHandler<Enum> {

    @Override
    protected Class<Enum> getSupportedType() {
        return Enum.class;
    }

    @Override
    protected String render(Enum value, LiteralSerializer serializer) {
        return serializer.quote(value.name());
    }
}
