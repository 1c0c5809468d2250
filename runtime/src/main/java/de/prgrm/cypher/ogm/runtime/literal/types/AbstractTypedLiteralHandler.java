package de.prgrm.cypher.ogm.runtime.literal.types;

import de.prgrm.cypher.ogm.runtime.literal.LiteralHandler;
import de.prgrm.cypher.ogm.runtime.literal.LiteralSerializer;

public abstract class AbstractTypedLiteralHandler<T> implements LiteralHandler {

    protected abstract Class<T> getSupportedType();

    protected abstract String render(T value, LiteralSerializer serializer);

    @Override
    public boolean supports(Object value) {
        return getSupportedType().isInstance(value);
    }

    @Override
    public String toCypher(Object value, LiteralSerializer serializer) {
        return render(getSupportedType().cast(value), serializer);
    }
}
