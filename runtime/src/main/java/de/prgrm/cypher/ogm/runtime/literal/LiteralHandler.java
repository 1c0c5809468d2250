package de.prgrm.cypher.ogm.runtime.literal;

/**
 * Renders one family of Java values as Cypher literal text.
 */
public interface LiteralHandler {

    boolean supports(Object value);

    /**
     * @param value a non-null value accepted by {@link #supports(Object)}
     * @param serializer the active serializer, used for nested values and string quoting
     */
    String toCypher(Object value, LiteralSerializer serializer);
}
