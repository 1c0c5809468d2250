package de.prgrm.cypher.ogm.runtime.query.clause;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import de.prgrm.cypher.ogm.runtime.enums.Direction;
import de.prgrm.cypher.ogm.runtime.enums.Operator;
import de.prgrm.cypher.ogm.runtime.query.Projection;
import de.prgrm.cypher.ogm.runtime.query.Sort;

class ClauseTest {

    @Test
    void nodePattern() {
        assertThat(new NodePattern(null, null, null).render()).isEqualTo("()");
        assertThat(new NodePattern("n", List.of("Person", "first name"), Map.of("age", 3)).render())
                .isEqualTo("(n:Person:`first name` {age: 3})");
        assertThat(new NodePattern("n", List.of(), null).declaredVariables()).containsExactly("n");
    }

    @Test
    void nodePatternCopiesItsInput() {
        List<String> labels = new ArrayList<>(List.of("A"));
        Map<String, Object> properties = new HashMap<>(Map.of("x", 1));
        NodePattern pattern = new NodePattern("n", labels, properties);

        labels.add("B");
        properties.put("y", 2);

        assertThat(pattern.render()).isEqualTo("(n:A {x: 1})");
    }

    @Test
    void relationshipPattern() {
        assertThat(new RelationshipPattern(null, null, null, Direction.OUTGOING).render()).isEqualTo("-[]->");
        assertThat(new RelationshipPattern("r", "KNOWS", Map.of("since", "2020"), Direction.INCOMING).render())
                .isEqualTo("<-[r:KNOWS{since: \"2020\"}]-");
        assertThat(new RelationshipPattern(null, "KNOWS", null, Direction.UNDIRECTED).declaredVariables()).isEmpty();
    }

    @Test
    void fragmentsCarryTheirOwnBlanks() {
        assertThat(new MatchClause(true).render()).isEqualTo(" OPTIONAL MATCH ");
        assertThat(new WhereClause(WhereClause.Keyword.XOR, true, "n.x", Operator.IN, "[1, 2]").render())
                .isEqualTo(" XOR NOT n.x IN [1, 2] ");
        assertThat(new ProjectionClause(ProjectionClause.Keyword.WITH,
                List.of(Projection.of("n.name", "name"), Projection.of("n"))).render())
                .isEqualTo(" WITH n.name AS name, n ");
        assertThat(new OrderByClause(List.of(Sort.asc("n.age"))).render()).isEqualTo(" ORDER BY n.age ASC ");
        assertThat(new UnionClause(false).render()).isEqualTo(" UNION ");
        assertThat(new DeleteClause(List.of("a", "b"), false).render()).isEqualTo(" DELETE a, b ");
        assertThat(new CallClause("db.labels", null).render()).isEqualTo(" CALL db.labels() ");
    }

    @Test
    void projectionDeclaresAliases() {
        ProjectionClause clause = new ProjectionClause(ProjectionClause.Keyword.YIELD,
                List.of(Projection.of("node"), Projection.of("rank", "score")));

        assertThat(clause.declaredVariables()).containsExactly("node", "score");
        assertThat(new ProjectionClause(ProjectionClause.Keyword.RETURN, List.of()).isStar()).isTrue();
    }
}
