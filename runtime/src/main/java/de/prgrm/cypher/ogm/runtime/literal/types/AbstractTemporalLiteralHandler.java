package de.prgrm.cypher.ogm.runtime.literal.types;

import de.prgrm.cypher.ogm.runtime.literal.LiteralSerializer;

/**
 * Temporal values are rendered through the database's native constructor functions, e.g.
 * {@code date('2021-04-21')}. The argument is always single-quoted.
 */
public abstract class AbstractTemporalLiteralHandler<T> extends AbstractTypedLiteralHandler<T> {

    protected abstract String constructor();

    protected abstract String format(T value);

    @Override
    protected String render(T value, LiteralSerializer serializer) {
        return constructor() + "('" + format(value) + "')";
    }
}
