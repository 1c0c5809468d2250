package de.prgrm.cypher.ogm.runtime.literal;

import de.prgrm.cypher.ogm.runtime.errors.SerializationException;

/**
 * Converts Java values into Cypher literal text. Instances are immutable and thread-safe.
 */
public final class LiteralSerializer {

    private final QuoteStyle quoteStyle;
    private final NanHandling nanHandling;

    public LiteralSerializer(QuoteStyle quoteStyle, NanHandling nanHandling) {
        this.quoteStyle = quoteStyle;
        this.nanHandling = nanHandling;
    }

    public String serialize(Object value) {
        if (value == null) {
            return "null";
        }
        return LiteralHandlerRegistry.findHandler(value)
                .orElseThrow(() -> new SerializationException(
                        "Unsupported value data type: " + value.getClass().getName()))
                .toCypher(value, this);
    }

    public String quote(String text) {
        return quoteStyle.quote(text);
    }

    public QuoteStyle quoteStyle() {
        return quoteStyle;
    }

    public NanHandling nanHandling() {
        return nanHandling;
    }

    public LiteralSerializer withNanHandling(NanHandling handling) {
        return handling == nanHandling ? this : new LiteralSerializer(quoteStyle, handling);
    }
}
