package de.prgrm.cypher.ogm.runtime.mapping;

import java.time.Duration;
import java.time.Period;
import java.util.*;

import org.neo4j.driver.Record;
import org.neo4j.driver.types.IsoDuration;

/**
 * Converts values returned by the driver into mapped entities and plain Java values.
 * <p>
 * Input is the driver's object form ({@code Value#asObject()}): nodes, relationships and paths are
 * dispatched through the {@link ModelRegistry}, lists and maps are converted element by element,
 * durations become {@link Duration} or {@link Period} when they fit. Temporal values keep the type
 * the driver produced: zoned date-times carry their zone id or offset, local types carry none.
 */
public class GraphValueMapper {

    private final ModelRegistry registry;

    public GraphValueMapper(ModelRegistry registry) {
        this.registry = registry;
    }

    public Map<String, Object> toRow(Record record) {
        Map<String, Object> row = new LinkedHashMap<>();
        for (String key : record.keys()) {
            row.put(key, toJava(record.get(key).asObject()));
        }
        return row;
    }

    public Object toJava(Object raw) {
        if (raw instanceof org.neo4j.driver.types.Node node) {
            return toNode(node);
        }
        if (raw instanceof org.neo4j.driver.types.Relationship relationship) {
            return toRelationship(relationship);
        }
        if (raw instanceof org.neo4j.driver.types.Path path) {
            return toPath(path);
        }
        if (raw instanceof List<?> list) {
            List<Object> result = new ArrayList<>(list.size());
            for (Object element : list) {
                result.add(toJava(element));
            }
            return result;
        }
        if (raw instanceof Map<?, ?> map) {
            Map<String, Object> result = new LinkedHashMap<>();
            map.forEach((k, v) -> result.put(String.valueOf(k), toJava(v)));
            return result;
        }
        if (raw instanceof IsoDuration duration) {
            return toDuration(duration);
        }
        return raw;
    }

    @SuppressWarnings("deprecation")
    public Node toNode(org.neo4j.driver.types.Node raw) {
        List<String> labels = new ArrayList<>();
        raw.labels().forEach(labels::add);

        Node node = registry.resolveNode(labels)
                .<Node> map(schema -> schema.newInstance())
                .orElseGet(() -> new Node());
        node.replaceLabels(labels);
        node.setId(raw.id());
        raw.asMap().forEach((key, value) -> node.loadProperty(key, toJava(value)));
        return node;
    }

    @SuppressWarnings("deprecation")
    public Relationship toRelationship(org.neo4j.driver.types.Relationship raw) {
        Relationship relationship = registry.resolveRelationship(raw.type())
                .<Relationship> map(schema -> schema.newInstance())
                .orElseGet(() -> new Relationship(raw.type(), null, null, null));
        relationship.setId(raw.id());
        relationship.between(raw.startNodeId(), raw.endNodeId());
        raw.asMap().forEach((key, value) -> relationship.loadProperty(key, toJava(value)));
        return relationship;
    }

    public Path toPath(org.neo4j.driver.types.Path raw) {
        List<Node> nodes = new ArrayList<>();
        List<Relationship> relationships = new ArrayList<>();
        raw.nodes().forEach(n -> nodes.add(toNode(n)));
        raw.relationships().forEach(r -> relationships.add(toRelationship(r)));
        return new Path(nodes, relationships);
    }

    private static Object toDuration(IsoDuration duration) {
        if (duration.months() == 0) {
            return Duration.ofDays(duration.days())
                    .plusSeconds(duration.seconds())
                    .plusNanos(duration.nanoseconds());
        }
        if (duration.seconds() == 0 && duration.nanoseconds() == 0) {
            return Period.of(0, Math.toIntExact(duration.months()), Math.toIntExact(duration.days()));
        }
        return duration;
    }
}
