package de.prgrm.cypher.ogm.runtime.query;

import de.prgrm.cypher.ogm.runtime.enums.Order;

public record Sort(String expression, Order order) {
    public static Sort by(String expression) {
        return new Sort(expression, null);
    }

    public static Sort asc(String expression) {
        return new Sort(expression, Order.ASC);
    }

    public static Sort desc(String expression) {
        return new Sort(expression, Order.DESC);
    }

    public String toCypher() {
        return order == null ? expression : expression + " " + order.name();
    }
}
