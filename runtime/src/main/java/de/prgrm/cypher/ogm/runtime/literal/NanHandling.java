package de.prgrm.cypher.ogm.runtime.literal;

/**
 * What to do with floating point values that have no Cypher literal (NaN and infinities).
 */
public enum NanHandling {
    /** Reject the value with a {@link de.prgrm.cypher.ogm.runtime.errors.SerializationException}. */
    FAIL,
    /** Render {@code null}, which removes the property when used in a SET. */
    AS_NULL
}
