package de.prgrm.cypher.ogm.it;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import de.prgrm.cypher.ogm.it.model.*;
import de.prgrm.cypher.ogm.runtime.enums.Operator;
import de.prgrm.cypher.ogm.runtime.mapping.ModelRegistry;
import de.prgrm.cypher.ogm.runtime.query.QueryBuilder;
import de.prgrm.cypher.ogm.runtime.schema.Constraint;
import de.prgrm.cypher.ogm.runtime.schema.Index;

/**
 * Checks the model declarations without a database.
 */
class ModelSchemaTest {

    private final ModelRegistry registry = Models.registry();

    @Test
    void indexesAndConstraintsComeFromFieldDeclarations() {
        assertThat(registry.indexes()).containsExactly(Index.of("Streamer", "followers"));
        assertThat(registry.constraints()).containsExactlyInAnyOrder(
                Constraint.exists("User", "name"),
                Constraint.unique("User", "name"),
                Constraint.unique("Language", "name"));
    }

    @Test
    void mostSpecificSchemaWinsDispatch() {
        assertThat(registry.resolveNode(List.of("User", "Streamer"))).contains(Streamer.SCHEMA);
        assertThat(registry.resolveNode(List.of("User"))).contains(User.SCHEMA);
        assertThat(registry.resolveNode(List.of("Unknown"))).isEmpty();
        assertThat(registry.resolveRelationship("SPEAKS")).contains(Speaks.SCHEMA);
    }

    @Test
    void streamerCarriesInheritedLabelsAndDefaults() {
        Streamer streamer = Streamer.named("Ron");

        assertThat(streamer.labels()).containsExactly("Streamer", "User");
        assertThat(streamer.getName()).isEqualTo("Ron");
        assertThat(new Speaks().get("fluent")).isEqualTo(false);
    }

    @Test
    void queryForStreamersSpeakingALanguage() {
        String query = new QueryBuilder()
                .match()
                .node("Streamer", "s")
                .to("SPEAKS", "r")
                .node("Language", "l", Map.of("name", "en"))
                .where("s.followers", Operator.GREATER_THAN, 100)
                .returning("s", "l")
                .construct();

        assertThat(query).isEqualTo(
                " MATCH (s:Streamer)-[r:SPEAKS]->(l:Language {name: \"en\"}) WHERE s.followers > 100 RETURN s, l ");
    }
}
