package de.prgrm.cypher.ogm.runtime.literal.types;

import java.util.Collection;
import java.util.stream.Collectors;

import de.prgrm.cypher.ogm.runtime.literal.LiteralSerializer;

public class CollectionLiteralHandler extends AbstractTypedLiteralHandler<Collection<?>> {

    @Override
    @SuppressWarnings({ "unchecked", "rawtypes" })
    protected Class<Collection<?>> getSupportedType() {
        return (Class) Collection.class;
    }

    @Override
    protected String render(Collection<?> value, LiteralSerializer serializer) {
        return value.stream()
                .map(serializer::serialize)
                .collect(Collectors.joining(", ", "[", "]"));
    }
}
