package de.prgrm.cypher.ogm.runtime.enums;

/**
 * Arrow direction of a relationship pattern, seen from the preceding node pattern.
 */
public enum Direction {
    /** {@code -[...]->} */
    OUTGOING("-[", "]->"),
    /** {@code <-[...]-} */
    INCOMING("<-[", "]-"),
    /** {@code -[...]-} */
    UNDIRECTED("-[", "]-");

    private final String open;
    private final String close;

    Direction(String open, String close) {
        this.open = open;
        this.close = close;
    }

    public String open() {
        return open;
    }

    public String close() {
        return close;
    }
}
