package de.prgrm.cypher.ogm.runtime.literal.types;

import java.util.Map;
import java.util.stream.Collectors;

import de.prgrm.cypher.ogm.runtime.literal.CypherLiterals;
import de.prgrm.cypher.ogm.runtime.literal.LiteralSerializer;

public class MapLiteralHandler extends AbstractTypedLiteralHandler<Map<?, ?>> {

    @Override
    @SuppressWarnings({ "unchecked", "rawtypes" })
    protected Class<Map<?, ?>> getSupportedType() {
        return (Class) Map.class;
    }

    @Override
    protected String render(Map<?, ?> value, LiteralSerializer serializer) {
        return value.entrySet().stream()
                .map(e -> CypherLiterals.identifier(String.valueOf(e.getKey())) + ": "
                        + serializer.serialize(e.getValue()))
                .collect(Collectors.joining(", ", "{", "}"));
    }
}
