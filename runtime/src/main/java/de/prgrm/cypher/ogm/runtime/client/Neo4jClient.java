package de.prgrm.cypher.ogm.runtime.client;

import java.util.*;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.jboss.logging.Logger;

import de.prgrm.cypher.ogm.runtime.config.ConnectionSettings;
import de.prgrm.cypher.ogm.runtime.errors.UsageException;
import de.prgrm.cypher.ogm.runtime.literal.CypherLiterals;
import de.prgrm.cypher.ogm.runtime.mapping.ModelRegistry;
import de.prgrm.cypher.ogm.runtime.query.QueryBuilder;
import de.prgrm.cypher.ogm.runtime.schema.Constraint;
import de.prgrm.cypher.ogm.runtime.schema.Index;

/**
 * Client for Neo4j 5. Indexes and constraints are named; names generated here are derived from
 * label and properties, existing ones are taken from {@code SHOW INDEXES}/{@code SHOW CONSTRAINTS}.
 */
public class Neo4jClient extends DatabaseClient {

    private static final Logger LOG = Logger.getLogger(Neo4jClient.class);

    public Neo4jClient() {
        this(ConnectionSettings.neo4j(), new ModelRegistry());
    }

    public Neo4jClient(ConnectionSettings settings, ModelRegistry registry) {
        super(settings, registry);
    }

    public Neo4jClient(Supplier<Connection> connectionFactory, ModelRegistry registry) {
        super(connectionFactory, registry);
    }

    @Override
    public QueryBuilder query() {
        return new QueryBuilder(this);
    }

    // ========================= Indexes =========================

    /**
     * Node property indexes. LOOKUP indexes are skipped, indexes backing a constraint are reported
     * as managed.
     */
    @Override
    public Set<Index> getIndexes() {
        String query = "SHOW INDEXES YIELD name, type, entityType, labelsOrTypes, properties, owningConstraint";
        try (Stream<Map<String, Object>> rows = executeAndFetch(query)) {
            return rows
                    .filter(row -> "NODE".equals(row.get("entityType")))
                    .filter(row -> !"LOOKUP".equals(row.get("type")))
                    .map(row -> new Index(
                            first(row.get("labelsOrTypes")),
                            strings(row.get("properties")),
                            (String) row.get("name"),
                            row.get("owningConstraint") != null))
                    .collect(Collectors.toCollection(LinkedHashSet::new));
        }
    }

    @Override
    public void createIndex(Index index) {
        if (index.properties().isEmpty()) {
            throw new UsageException("Neo4j has no label indexes, " + index + " needs a property");
        }
        LOG.debugf("Creating %s", index);
        execute("CREATE INDEX " + CypherLiterals.identifier(indexName(index)) + " IF NOT EXISTS FOR (n:"
                + CypherLiterals.identifier(index.label()) + ") ON (" + propertyList(index.properties()) + ")");
    }

    @Override
    public void dropIndex(Index index) {
        LOG.debugf("Dropping %s", index);
        execute("DROP INDEX " + CypherLiterals.identifier(indexName(index)) + " IF EXISTS");
    }

    static String indexName(Index index) {
        if (index.name() != null) {
            return index.name();
        }
        return "index_" + index.label() + "_" + String.join("_", index.properties());
    }

    // ========================= Constraints =========================

    @Override
    public Set<Constraint> getConstraints() {
        Set<Constraint> result = new LinkedHashSet<>();
        String query = "SHOW CONSTRAINTS YIELD name, type, entityType, labelsOrTypes, properties";
        try (Stream<Map<String, Object>> rows = executeAndFetch(query)) {
            rows.filter(row -> "NODE".equals(row.get("entityType"))).forEach(row -> {
                String type = String.valueOf(row.get("type"));
                Constraint.Kind kind = switch (type) {
                    case "UNIQUENESS", "NODE_PROPERTY_UNIQUENESS" -> Constraint.Kind.UNIQUE;
                    case "NODE_PROPERTY_EXISTENCE" -> Constraint.Kind.EXISTS;
                    default -> null;
                };
                if (kind == null) {
                    LOG.debugf("Ignoring %s constraint %s", type, row.get("name"));
                    return;
                }
                result.add(new Constraint(first(row.get("labelsOrTypes")), strings(row.get("properties")), kind,
                        (String) row.get("name")));
            });
        }
        return result;
    }

    @Override
    public void createConstraint(Constraint constraint) {
        LOG.debugf("Creating %s", constraint);
        String requirement = constraint.kind() == Constraint.Kind.UNIQUE
                ? " IS UNIQUE"
                : " IS NOT NULL";
        String properties = constraint.properties().size() == 1
                ? propertyList(constraint.properties())
                : "(" + propertyList(constraint.properties()) + ")";
        execute("CREATE CONSTRAINT " + CypherLiterals.identifier(constraintName(constraint))
                + " IF NOT EXISTS FOR (n:" + CypherLiterals.identifier(constraint.label()) + ") REQUIRE "
                + properties + requirement);
    }

    @Override
    public void dropConstraint(Constraint constraint) {
        LOG.debugf("Dropping %s", constraint);
        execute("DROP CONSTRAINT " + CypherLiterals.identifier(constraintName(constraint)) + " IF EXISTS");
    }

    static String constraintName(Constraint constraint) {
        if (constraint.name() != null) {
            return constraint.name();
        }
        return "constraint_" + constraint.label() + "_" + String.join("_", constraint.properties()) + "_"
                + constraint.kind().name().toLowerCase(Locale.ROOT);
    }

    private static String propertyList(List<String> properties) {
        return properties.stream()
                .map(p -> "n." + CypherLiterals.identifier(p))
                .collect(Collectors.joining(", "));
    }

    private static String first(Object labelsOrTypes) {
        List<String> values = strings(labelsOrTypes);
        return values.isEmpty() ? "" : values.get(0);
    }

    private static List<String> strings(Object value) {
        if (value instanceof Collection<?> values) {
            return values.stream().map(String::valueOf).collect(Collectors.toList());
        }
        return value == null ? List.of() : List.of(String.valueOf(value));
    }
}
