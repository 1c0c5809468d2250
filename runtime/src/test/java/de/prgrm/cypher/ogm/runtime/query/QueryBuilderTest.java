package de.prgrm.cypher.ogm.runtime.query;

import static org.junit.jupiter.api.Assertions.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import de.prgrm.cypher.ogm.runtime.client.Neo4jClient;
import de.prgrm.cypher.ogm.runtime.client.RecordingConnection;
import de.prgrm.cypher.ogm.runtime.enums.Operator;
import de.prgrm.cypher.ogm.runtime.errors.ClauseOrderException;
import de.prgrm.cypher.ogm.runtime.errors.InvalidMatchChainException;
import de.prgrm.cypher.ogm.runtime.errors.NoVariablesMatchedException;
import de.prgrm.cypher.ogm.runtime.errors.UsageException;
import de.prgrm.cypher.ogm.runtime.literal.CypherVariable;
import de.prgrm.cypher.ogm.runtime.mapping.ModelRegistry;
import de.prgrm.cypher.ogm.runtime.mapping.Node;

public class QueryBuilderTest {

    private RecordingConnection connection;
    private Neo4jClient db;

    @BeforeEach
    void setUp() {
        connection = new RecordingConnection();
        db = new Neo4jClient(() -> connection, new ModelRegistry());
    }

    @Test
    void matchReturnStar() {
        String query = new QueryBuilder().match().node("Person", "p").returning().construct();

        assertEquals(" MATCH (p:Person) RETURN * ", query);
    }

    @Test
    void createNodeWithDoubleQuotedProperties() {
        String query = new QueryBuilder().create().node("Person", Map.of("name", "Ron")).construct();

        assertEquals(" CREATE (:Person {name: \"Ron\"})", query);
    }

    @Test
    void matchPathWithConditions() {
        String query = new QueryBuilder()
                .match()
                .node("Person", "p")
                .to("FRIENDS_WITH", "f")
                .node("Person", "q")
                .where("p.name", Operator.EQUAL, "Ron")
                .andWhere("q.age", Operator.GREATER_THAN, 30)
                .orNotWhere("q.name", Operator.STARTS_WITH, "H")
                .returning("p", "q")
                .construct();

        assertEquals(" MATCH (p:Person)-[f:FRIENDS_WITH]->(q:Person) WHERE p.name = 'Ron' AND q.age > 30 "
                + "OR NOT q.name STARTS WITH 'H' RETURN p, q ", query);
    }

    @Test
    void incomingAndUndirectedRelationships() {
        assertEquals(" MATCH (a:A)<-[:R]-(b:B)-[r]-(c)", new QueryBuilder()
                .match().node("A", "a").from("R").node("B", "b").related(null, "r").node("", "c").construct());
    }

    @Test
    void relationshipPropertiesFollowTheType() {
        Map<String, Object> since = Map.of("since", 2020);

        assertEquals(" MERGE (a)-[r:KNOWS{since: 2020}]->(b)", new QueryBuilder()
                .merge().node("", "a").to("KNOWS", "r", since).node("", "b").construct());
    }

    @Test
    void multipleLabelsAndEntityPattern() {
        Node node = new Node(List.of("Person", "User"), Map.of("name", "Ron"));

        assertEquals(" MATCH (n:Person:User)", new QueryBuilder().match().node("Person:User", "n").construct());
        assertEquals(" MATCH (n:Person:User {name: \"Ron\"})", new QueryBuilder().match().node(node, "n").construct());
    }

    @Test
    void whereBeforeMatchFailsWithoutTouchingTheDatabase() {
        assertThrows(InvalidMatchChainException.class,
                () -> db.query().where("n.name", Operator.EQUAL, "Ron").execute());

        assertTrue(connection.queries().isEmpty());
    }

    @Test
    void consecutivePatternsOfTheSameKindFail() {
        assertThrows(InvalidMatchChainException.class,
                () -> new QueryBuilder().match().node("A", "a").node("B", "b"));
        assertThrows(InvalidMatchChainException.class,
                () -> new QueryBuilder().match().node("A", "a").to("R").to("S"));
    }

    @Test
    void continuationWithoutWhereFails() {
        QueryBuilder builder = new QueryBuilder().match().node("A", "a");

        assertThrows(ClauseOrderException.class, () -> builder.andWhere("a.x", Operator.EQUAL, 1));
        assertThrows(ClauseOrderException.class, () -> builder.orWhere("a.x", Operator.EQUAL, 1));
        assertThrows(ClauseOrderException.class, () -> builder.xorWhere("a.x", Operator.EQUAL, 1));
    }

    @Test
    void undeclaredVariableFails() {
        assertThrows(InvalidMatchChainException.class, () -> new QueryBuilder()
                .match().node("Person", "p").where("q.name", Operator.EQUAL, "Ron"));
        assertThrows(InvalidMatchChainException.class, () -> new QueryBuilder()
                .match().node("Person", "p").returning("q"));
        assertThrows(InvalidMatchChainException.class, () -> new QueryBuilder()
                .match().node("Person", "p").where("p.name", Operator.EQUAL, CypherVariable.of("q.name")));
    }

    @Test
    void returnStarWithoutVariablesFails() {
        assertThrows(NoVariablesMatchedException.class,
                () -> new QueryBuilder().match().node("Person").returning());
    }

    @Test
    void modifiers() {
        String query = new QueryBuilder()
                .match().node("Person", "p")
                .returning("p")
                .orderBy(Sort.desc("p.age"), Sort.by("p.name"))
                .skip(5)
                .limit(10)
                .construct();

        assertEquals(" MATCH (p:Person) RETURN p ORDER BY p.age DESC, p.name SKIP 5 LIMIT 10 ", query);
    }

    @Test
    void misplacedModifiersFail() {
        assertThrows(ClauseOrderException.class, () -> new QueryBuilder().match().node("P", "p").limit(3));
        assertThrows(ClauseOrderException.class,
                () -> new QueryBuilder().match().node("P", "p").returning("p").limit(3).skip(1));
        assertThrows(ClauseOrderException.class,
                () -> new QueryBuilder().match().node("P", "p").returning("p").skip(1).orderBy("p.name"));
    }

    @Test
    void withNarrowsTheScope() {
        QueryBuilder builder = new QueryBuilder()
                .match().node("Person", "p")
                .with(Projection.of("p.name", "name"));

        assertThrows(InvalidMatchChainException.class, () -> builder.where("p.age", Operator.EQUAL, 3));
        assertEquals(" MATCH (p:Person) WITH p.name AS name WHERE name STARTS WITH 'R' RETURN name ",
                builder.where("name", Operator.STARTS_WITH, "R").returning("name").construct());
    }

    @Test
    void aliasMapProjection() {
        Map<String, String> aliases = new LinkedHashMap<>();
        aliases.put("p.name", "name");
        aliases.put("p", "p");

        assertEquals(" MATCH (p:Person) RETURN p.name AS name, p ",
                new QueryBuilder().match().node("Person", "p").returning(aliases).construct());
    }

    @Test
    void callAndYield() {
        assertEquals(" CALL db.labels() YIELD label RETURN label ",
                new QueryBuilder().call("db.labels").yielding("label").returning("label").construct());
        assertEquals(" CALL pagerank.get(\"graph\", 3) YIELD node, rank RETURN node, rank ", new QueryBuilder()
                .call("pagerank.get", List.of("graph", 3)).yielding("node", "rank").returning("node", "rank")
                .construct());
    }

    @Test
    void callWithoutYieldDisablesVariableChecks() {
        assertEquals(" CALL mg.procedures() RETURN * ",
                new QueryBuilder().call("mg.procedures").returning().construct());
    }

    @Test
    void yieldStarLeavesColumnsUnchecked() {
        assertEquals(" CALL pagerank.get() YIELD * RETURN * ",
                new QueryBuilder().call("pagerank.get").yielding().returning().construct());
        assertEquals(" CALL nxalg.betweenness_centrality(20, True) YIELD * RETURN node, betweenness ",
                new QueryBuilder().call("nxalg.betweenness_centrality", "20, True").yielding()
                        .returning("node", "betweenness").construct());
    }

    @Test
    void withAfterYieldStarRestoresVariableChecks() {
        QueryBuilder builder = new QueryBuilder().call("pagerank.get").yielding().with("node");

        assertEquals(" CALL pagerank.get() YIELD * WITH node RETURN node ", builder.returning("node").construct());
        assertThrows(InvalidMatchChainException.class,
                () -> new QueryBuilder().call("pagerank.get").yielding().with("node").returning("rank"));
    }

    @Test
    void unwindDeclaresItsVariable() {
        assertEquals(" UNWIND [1, 2, 3] AS x RETURN x ",
                new QueryBuilder().unwind("[1, 2, 3]", "x").returning("x").construct());
    }

    @Test
    void unionStartsAFreshScope() {
        QueryBuilder builder = new QueryBuilder()
                .match().node("A", "a").returning("a")
                .unionAll()
                .match().node("B", "b");

        assertThrows(InvalidMatchChainException.class, () -> builder.returning("a"));
        assertEquals(" MATCH (a:A) RETURN a UNION ALL MATCH (b:B) RETURN b ", builder.returning("b").construct());
    }

    @Test
    void updatingClauses() {
        Map<String, Object> props = new LinkedHashMap<>();
        props.put("name", "Ron");
        props.put("age", 3);

        assertEquals(" MATCH (p:Person) WHERE p.name = 'Ron' DETACH DELETE p ", new QueryBuilder()
                .match().node("Person", "p").where("p.name", Operator.EQUAL, "Ron").detachDelete("p").construct());
        assertEquals(" MATCH (p:Person) SET p.age = 30 SET p:Admin REMOVE p.nick ", new QueryBuilder()
                .match().node("Person", "p")
                .set("p.age", Operator.ASSIGNMENT, 30)
                .set("p", Operator.LABEL_FILTER, "Admin")
                .remove("p.nick")
                .construct());
        assertEquals(" MATCH (p) SET p += {name: 'Ron', age: 3} ", new QueryBuilder()
                .match().node("", "p")
                .set("p", Operator.INCREMENT, props)
                .construct());
    }

    @Test
    void setRejectsComparisonOperators() {
        assertThrows(UsageException.class,
                () -> new QueryBuilder().match().node("", "p").set("p.age", Operator.GREATER_THAN, 1));
    }

    @Test
    void unaryAndLabelConditions() {
        assertEquals(" MATCH (p) WHERE p.age IS NULL OR p:Admin ", new QueryBuilder()
                .match().node("", "p").where("p.age", Operator.IS_NULL).orWhere("p", Operator.LABEL_FILTER, "Admin")
                .construct());
        assertThrows(UsageException.class,
                () -> new QueryBuilder().match().node("", "p").where("p.age", Operator.EQUAL, null));
    }

    @Test
    void foreachRendersUpdateClauses() {
        assertEquals(" FOREACH ( x IN [1, 2] | CREATE (:Number {value: x}) ) ",
                new QueryBuilder().foreach("x", "[1, 2]", " CREATE (:Number {value: x}) ").construct());
    }

    @Test
    void customCypherIsVerbatim() {
        assertEquals(" MATCH (n)-[*1..3]->(m) RETURN m ",
                new QueryBuilder().addCustomCypher("MATCH (n)-[*1..3]->(m)").returning("m").construct());
    }

    @Test
    void whitespaceInsideLiteralsIsKept() {
        String query = new QueryBuilder().match().node("", "p").where("p.name", Operator.EQUAL, "a   b").construct();

        assertEquals(" MATCH (p) WHERE p.name = 'a   b' ", query);
    }

    @Test
    void parametersAreSentWithTheQuery() {
        db.query()
                .match().node("Person", "p")
                .where("p.name", Operator.EQUAL, CypherVariable.of("$name"))
                .returning("p")
                .parameter("name", "Ron")
                .executeAndFetch()
                .close();

        assertEquals(" MATCH (p:Person) WHERE p.name = $name RETURN p ", connection.lastQuery());
        assertEquals(Map.of("name", "Ron"), connection.lastParameters());
    }

    @Test
    void executedBuilderCanBeFetchedAgainButNotExtended() {
        connection.thenReturn(Map.of("x", 1)).thenReturn(Map.of("x", 1));
        QueryBuilder builder = db.query().unwind("[1]", "x").returning("x");

        try (Stream<Map<String, Object>> rows = builder.executeAndFetch()) {
            assertEquals(List.of(1), rows.map(row -> row.get("x")).collect(Collectors.toList()));
        }
        assertEquals(1, builder.getSingle("x"));
        assertEquals(2, connection.queries().size());
        assertThrows(UsageException.class, () -> builder.limit(1));
    }

    @Test
    void getSingleWithoutRowsIsNull() {
        assertNull(db.query().match().node("Person", "p").returning("p").getSingle("p"));
    }

    @Test
    void builderWithoutDatabaseCanOnlyConstruct() {
        QueryBuilder builder = new QueryBuilder().match().node("Person", "p").returning("p");

        assertThrows(UsageException.class, builder::execute);
    }

    @Test
    void emptyQueryCantBeExecuted() {
        assertThrows(UsageException.class, () -> db.query().execute());
    }

    @Test
    void collapseWhitespaceOutsideQuotes() {
        assertEquals(" a 'x   y' b ", AbstractQueryBuilder.collapseWhitespace("  a   'x   y'  b "));
        assertEquals(" \"it\\\"s  here\" ", AbstractQueryBuilder.collapseWhitespace("  \"it\\\"s  here\"   "));
        assertEquals("`odd  name`", AbstractQueryBuilder.collapseWhitespace("`odd  name`"));
    }

    @Test
    void referencedVariable() {
        assertEquals(Optional.of("n"), AbstractQueryBuilder.referencedVariable("n.name"));
        assertEquals(Optional.of("n"), AbstractQueryBuilder.referencedVariable("id(n)"));
        assertEquals(Optional.of("n"), AbstractQueryBuilder.referencedVariable("toLower(n.name)"));
        assertEquals(Optional.of("n"), AbstractQueryBuilder.referencedVariable("n:Admin"));
        assertEquals(Optional.empty(), AbstractQueryBuilder.referencedVariable("count(*)"));
        assertEquals(Optional.empty(), AbstractQueryBuilder.referencedVariable("'Ron'"));
        assertEquals(Optional.empty(), AbstractQueryBuilder.referencedVariable("true"));
        assertEquals(Optional.empty(), AbstractQueryBuilder.referencedVariable("$name"));
    }
}
