package de.prgrm.cypher.ogm.runtime.literal.types;

import java.util.UUID;

import de.prgrm.cypher.ogm.runtime.literal.LiteralSerializer;

public class UuidLiteralHandler extends AbstractTypedLiteralHandler<UUID> {

    @Override
    protected Class<UUID> getSupportedType() {
        return UUID.class;
    }

    @Override
    protected String render(UUID value, LiteralSerializer serializer) {
        return serializer.quote(value.toString());
    }
}
