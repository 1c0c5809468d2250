package de.prgrm.cypher.ogm.runtime.literal;

public enum QuoteStyle {
    SINGLE('\''),
    DOUBLE('"');

    private final char quote;

    QuoteStyle(char quote) {
        this.quote = quote;
    }

    public String quote(String text) {
        StringBuilder sb = new StringBuilder(text.length() + 2).append(quote);
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> {
                    if (c == quote) {
                        sb.append('\\');
                    }
                    sb.append(c);
                }
            }
        }
        return sb.append(quote).toString();
    }
}
