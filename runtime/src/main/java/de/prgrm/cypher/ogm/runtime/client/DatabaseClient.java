package de.prgrm.cypher.ogm.runtime.client;

import java.util.*;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.jboss.logging.Logger;

import de.prgrm.cypher.ogm.runtime.config.ConnectionSettings;
import de.prgrm.cypher.ogm.runtime.enums.Operator;
import de.prgrm.cypher.ogm.runtime.errors.DatabaseException;
import de.prgrm.cypher.ogm.runtime.errors.NotFoundException;
import de.prgrm.cypher.ogm.runtime.errors.ValidationException;
import de.prgrm.cypher.ogm.runtime.literal.CypherLiterals;
import de.prgrm.cypher.ogm.runtime.mapping.*;
import de.prgrm.cypher.ogm.runtime.query.AbstractQueryBuilder;
import de.prgrm.cypher.ogm.runtime.query.QueryBuilder;
import de.prgrm.cypher.ogm.runtime.schema.Constraint;
import de.prgrm.cypher.ogm.runtime.schema.Index;

/**
 * Vendor-neutral part of a database client: query execution over a cached {@link Connection},
 * index and constraint management, and persistence of mapped nodes and relationships. Persistence
 * is expressed with the query builder.
 * <p>
 * A client may be shared; the connection runs one statement at a time per call.
 */
public abstract class DatabaseClient implements AutoCloseable {

    private static final Logger LOG = Logger.getLogger(DatabaseClient.class);

    protected static final String NODE = "node";
    protected static final String RELATIONSHIP = "relationship";
    protected static final String START_NODE = "start_node";
    protected static final String END_NODE = "end_node";

    private final Supplier<Connection> connectionFactory;
    private final ModelRegistry registry;
    private Connection cachedConnection;

    protected DatabaseClient(Supplier<Connection> connectionFactory, ModelRegistry registry) {
        this.connectionFactory = Objects.requireNonNull(connectionFactory, "connectionFactory");
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    protected DatabaseClient(ConnectionSettings settings, ModelRegistry registry) {
        this(() -> BoltConnection.open(settings, new GraphValueMapper(registry)), registry);
    }

    public ModelRegistry registry() {
        return registry;
    }

    /**
     * A new query builder bound to this client.
     */
    public abstract AbstractQueryBuilder<?> query();

    // ========================= Execution =========================

    public void execute(String query) {
        execute(query, Map.of());
    }

    public void execute(String query, Map<String, Object> parameters) {
        connection().execute(query, parameters);
    }

    public Stream<Map<String, Object>> executeAndFetch(String query) {
        return executeAndFetch(query, Map.of());
    }

    /**
     * Streams the rows of a query; the stream must be closed.
     */
    public Stream<Map<String, Object>> executeAndFetch(String query, Map<String, Object> parameters) {
        return connection().executeAndFetch(query, parameters);
    }

    /**
     * Returns the value of {@code variable} from the only row of {@code rows} and closes the stream.
     *
     * @throws NotFoundException when there is no row
     * @throws ValidationException when there is more than one row
     */
    public Object getVariableAssumeOne(Stream<Map<String, Object>> rows, String variable) {
        try (rows) {
            Iterator<Map<String, Object>> it = rows.iterator();
            if (!it.hasNext()) {
                throw new NotFoundException("No result found. Result list is empty.");
            }
            Map<String, Object> row = it.next();
            if (it.hasNext()) {
                throw new ValidationException("One result expected, but more than one result found.");
            }
            return row.get(variable);
        }
    }

    protected synchronized Connection connection() {
        if (cachedConnection == null || !cachedConnection.isActive()) {
            cachedConnection = connectionFactory.get();
        }
        return cachedConnection;
    }

    @Override
    public synchronized void close() {
        if (cachedConnection != null) {
            cachedConnection.close();
            cachedConnection = null;
        }
    }

    // ========================= Indexes & constraints =========================

    public abstract Set<Index> getIndexes();

    public abstract void createIndex(Index index);

    public abstract void dropIndex(Index index);

    public abstract Set<Constraint> getConstraints();

    public abstract void createConstraint(Constraint constraint);

    public abstract void dropConstraint(Constraint constraint);

    public void dropIndexes() {
        for (Index index : getIndexes()) {
            if (!index.isManaged()) {
                dropIndex(index);
            }
        }
    }

    /**
     * Drops every index not in {@code desired} and creates the missing ones. Managed indexes are
     * left alone.
     */
    public void ensureIndexes(Collection<Index> desired) {
        Set<Index> current = getIndexes();
        Set<Index> wanted = new LinkedHashSet<>(desired);
        for (Index index : current) {
            if (!wanted.contains(index) && !index.isManaged()) {
                LOG.infof("Dropping index %s", index);
                dropIndex(index);
            }
        }
        for (Index index : wanted) {
            if (!current.contains(index)) {
                LOG.infof("Creating index %s", index);
                createIndex(index);
            }
        }
    }

    public Set<Constraint> getExistsConstraints() {
        return constraintsOfKind(Constraint.Kind.EXISTS);
    }

    public Set<Constraint> getUniqueConstraints() {
        return constraintsOfKind(Constraint.Kind.UNIQUE);
    }

    /**
     * Drops every constraint not in {@code desired} and creates the missing ones.
     */
    public void ensureConstraints(Collection<Constraint> desired) {
        Set<Constraint> current = getConstraints();
        Set<Constraint> wanted = new LinkedHashSet<>(desired);
        for (Constraint constraint : current) {
            if (!wanted.contains(constraint)) {
                LOG.infof("Dropping constraint %s", constraint);
                dropConstraint(constraint);
            }
        }
        for (Constraint constraint : wanted) {
            if (!current.contains(constraint)) {
                LOG.infof("Creating constraint %s", constraint);
                createConstraint(constraint);
            }
        }
    }

    /**
     * Deletes all nodes and relationships.
     */
    public void dropDatabase() {
        execute("MATCH (n) DETACH DELETE n;");
    }

    private Set<Constraint> constraintsOfKind(Constraint.Kind kind) {
        return getConstraints().stream()
                .filter(c -> c.kind() == kind)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    // ========================= Nodes =========================

    /**
     * Creates the node when it has no id, otherwise updates its properties. The id assigned by the
     * database is set on {@code node}.
     */
    public <T extends Node> T saveNode(T node) {
        node.validateRequired();
        beforeSave(node);
        if (node.id() == null) {
            createNode(node);
        } else {
            updateNode(node);
        }
        afterNodeSaved(node);
        return node;
    }

    /**
     * Saves each node in order. A failure stops the batch; nodes saved before it keep their ids.
     */
    public <T extends Node> List<T> saveNodes(List<T> nodes) {
        for (T node : nodes) {
            saveNode(node);
        }
        return nodes;
    }

    /**
     * Loads the stored state of {@code node} into it, matching by id or else by its unique and
     * indexed fields.
     *
     * @throws ValidationException when there is nothing to match by, or explicitly set fields
     *         disagree with the stored node
     * @throws NotFoundException when no node matches
     */
    public <T extends Node> T loadNode(T node) {
        beforeLoad(node);
        QueryBuilder query = new QueryBuilder(this).match().node(node.labels(), NODE, null);
        if (node.id() != null) {
            query.where("id(" + NODE + ")", Operator.EQUAL, node.id());
        } else {
            Map<String, Object> keys = node.keyProperties();
            if (keys.isEmpty()) {
                throw new ValidationException("Can't load " + node
                        + ": it has no id and none of its unique or indexed fields is set");
            }
            appendPropertyConditions(query, NODE, keys, false);
        }
        Node loaded = asNode(getVariableAssumeOne(query.returning(NODE).executeAndFetch(), NODE));
        node.refreshFrom(loaded);
        afterNodeLoaded(node);
        return node;
    }

    /**
     * Loads the node, or saves it when it does not exist. A concurrent creation of the same node is
     * reported by the database as a constraint violation and is not retried.
     */
    public <T extends Node> GetOrCreateResult<T> getOrCreateNode(T node) {
        try {
            return new GetOrCreateResult<>(loadNode(node), false);
        } catch (NotFoundException e) {
            LOG.debugf("%s not found (%s), creating it", node, e.getMessage());
            return new GetOrCreateResult<>(saveNode(node), true);
        }
    }

    private void createNode(Node node) {
        QueryBuilder query = new QueryBuilder(this)
                .create()
                .node(node.labels(), NODE, storedProperties(node))
                .returning(NODE);
        Node stored = asNode(getVariableAssumeOne(query.executeAndFetch(), NODE));
        node.setId(stored.id());
    }

    private void updateNode(Node node) {
        QueryBuilder query = new QueryBuilder(this)
                .match()
                .node(node.labels(), NODE, null)
                .where("id(" + NODE + ")", Operator.EQUAL, node.id())
                .set(NODE, Operator.INCREMENT, storedProperties(node))
                .returning(NODE);
        asNode(getVariableAssumeOne(query.executeAndFetch(), NODE));
    }

    // ========================= Relationships =========================

    /**
     * Creates the relationship between its start and end node when it has no id, otherwise updates
     * its properties.
     *
     * @throws NotFoundException when the relationship or one of its end nodes does not exist
     */
    public <T extends Relationship> T saveRelationship(T relationship) {
        relationship.validateRequired();
        beforeSave(relationship);
        if (relationship.id() == null) {
            createRelationship(relationship);
        } else {
            updateRelationship(relationship);
        }
        afterRelationshipSaved(relationship);
        return relationship;
    }

    public <T extends Relationship> List<T> saveRelationships(List<T> relationships) {
        for (T relationship : relationships) {
            saveRelationship(relationship);
        }
        return relationships;
    }

    public <T extends Relationship> T loadRelationship(T relationship) {
        beforeLoad(relationship);
        QueryBuilder query = matchRelationship(relationship);
        if (relationship.id() != null) {
            query.where("id(" + RELATIONSHIP + ")", Operator.EQUAL, relationship.id());
        } else if (relationship.startNodeId() != null && relationship.endNodeId() != null) {
            query.where("id(" + START_NODE + ")", Operator.EQUAL, relationship.startNodeId())
                    .andWhere("id(" + END_NODE + ")", Operator.EQUAL, relationship.endNodeId());
            appendPropertyConditions(query, RELATIONSHIP, relationship.graphProperties(), true);
        } else {
            throw new ValidationException("Can't load " + relationship
                    + ": it needs an id or both start and end node ids");
        }
        Relationship loaded = asRelationship(
                getVariableAssumeOne(query.returning(RELATIONSHIP).executeAndFetch(), RELATIONSHIP));
        relationship.refreshFrom(loaded);
        afterRelationshipLoaded(relationship);
        return relationship;
    }

    public <T extends Relationship> GetOrCreateResult<T> getOrCreateRelationship(T relationship) {
        try {
            return new GetOrCreateResult<>(loadRelationship(relationship), false);
        } catch (NotFoundException e) {
            LOG.debugf("%s not found (%s), creating it", relationship, e.getMessage());
            return new GetOrCreateResult<>(saveRelationship(relationship), true);
        }
    }

    private void createRelationship(Relationship relationship) {
        Long start = relationship.startNodeId();
        Long end = relationship.endNodeId();
        if (start == null || end == null) {
            throw new ValidationException("Can't create " + relationship + " without start and end node ids");
        }
        QueryBuilder query = new QueryBuilder(this)
                .match().node(List.of(), START_NODE, null)
                .match().node(List.of(), END_NODE, null)
                .where("id(" + START_NODE + ")", Operator.EQUAL, start)
                .andWhere("id(" + END_NODE + ")", Operator.EQUAL, end)
                .create()
                .node(List.of(), START_NODE, null)
                .to(relationship.type(), RELATIONSHIP, storedProperties(relationship))
                .node(List.of(), END_NODE, null)
                .returning(RELATIONSHIP);
        Relationship stored;
        try {
            stored = asRelationship(getVariableAssumeOne(query.executeAndFetch(), RELATIONSHIP));
        } catch (NotFoundException e) {
            throw new NotFoundException("Can't create " + relationship.type() + ": start node " + start
                    + " or end node " + end + " does not exist", e);
        }
        relationship.setId(stored.id());
    }

    private void updateRelationship(Relationship relationship) {
        QueryBuilder query = matchRelationship(relationship)
                .where("id(" + RELATIONSHIP + ")", Operator.EQUAL, relationship.id())
                .set(RELATIONSHIP, Operator.INCREMENT, storedProperties(relationship))
                .returning(RELATIONSHIP);
        Relationship stored = asRelationship(getVariableAssumeOne(query.executeAndFetch(), RELATIONSHIP));
        relationship.between(stored.startNodeId(), stored.endNodeId());
    }

    private QueryBuilder matchRelationship(Relationship relationship) {
        return new QueryBuilder(this)
                .match()
                .node(List.of(), START_NODE, null)
                .to(relationship.type(), RELATIONSHIP, null)
                .node(List.of(), END_NODE, null);
    }

    // ========================= Hooks =========================

    /**
     * Properties written to the graph. By default everything with a value, on-disk fields included.
     */
    protected Map<String, Object> storedProperties(GraphEntity entity) {
        return entity.properties();
    }

    protected void beforeSave(GraphEntity entity) {
    }

    protected void beforeLoad(GraphEntity entity) {
    }

    protected void afterNodeSaved(Node node) {
    }

    protected void afterNodeLoaded(Node node) {
    }

    protected void afterRelationshipSaved(Relationship relationship) {
    }

    protected void afterRelationshipLoaded(Relationship relationship) {
    }

    // ========================= Helpers =========================

    private static void appendPropertyConditions(QueryBuilder query, String variable, Map<String, Object> values,
            boolean conjunctive) {
        boolean first = !conjunctive;
        for (Map.Entry<String, Object> entry : values.entrySet()) {
            String item = variable + "." + CypherLiterals.identifier(entry.getKey());
            if (first) {
                query.where(item, Operator.EQUAL, entry.getValue());
                first = false;
            } else if (conjunctive) {
                query.andWhere(item, Operator.EQUAL, entry.getValue());
            } else {
                query.orWhere(item, Operator.EQUAL, entry.getValue());
            }
        }
    }

    private static Node asNode(Object value) {
        if (value instanceof Node node) {
            return node;
        }
        throw new DatabaseException("Expected a node but the database returned " + value);
    }

    private static Relationship asRelationship(Object value) {
        if (value instanceof Relationship relationship) {
            return relationship;
        }
        throw new DatabaseException("Expected a relationship but the database returned " + value);
    }
}
