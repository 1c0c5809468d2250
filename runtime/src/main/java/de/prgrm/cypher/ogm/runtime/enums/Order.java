package de.prgrm.cypher.ogm.runtime.enums;

public enum Order {
    ASC,
    ASCENDING,
    DESC,
    DESCENDING
}
