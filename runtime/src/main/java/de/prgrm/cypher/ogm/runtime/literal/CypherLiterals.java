package de.prgrm.cypher.ogm.runtime.literal;

import java.util.Collection;
import java.util.regex.Pattern;

/**
 * Entry points of the value serializer.
 * <p>
 * Two quoting styles exist on purpose: values in WHERE and SET clauses are single-quoted, values in
 * the property maps of node and relationship patterns are double-quoted.
 */
public final class CypherLiterals {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    public static final LiteralSerializer DEFAULT = new LiteralSerializer(QuoteStyle.SINGLE, NanHandling.FAIL);
    public static final LiteralSerializer PROPERTIES = new LiteralSerializer(QuoteStyle.DOUBLE, NanHandling.FAIL);

    public static String serialize(Object value) {
        return DEFAULT.serialize(value);
    }

    public static String serializeProperty(Object value) {
        return PROPERTIES.serialize(value);
    }

    /**
     * Renders a label set as {@code :L1:L2}; the empty string when there are no labels.
     */
    public static String labels(Collection<String> labels) {
        if (labels == null || labels.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        for (String label : labels) {
            sb.append(':').append(identifier(label));
        }
        return sb.toString();
    }

    /**
     * Backtick-quotes names that are not plain identifiers.
     */
    public static String identifier(String name) {
        if (IDENTIFIER.matcher(name).matches()) {
            return name;
        }
        return "`" + name.replace("`", "``") + "`";
    }

    private CypherLiterals() {
    }
}
