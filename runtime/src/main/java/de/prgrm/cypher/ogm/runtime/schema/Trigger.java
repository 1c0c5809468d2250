package de.prgrm.cypher.ogm.runtime.schema;

import java.util.Arrays;
import java.util.Locale;
import java.util.Objects;

import de.prgrm.cypher.ogm.runtime.errors.UsageException;

/**
 * A Memgraph trigger: a statement run before or after a transaction commits, optionally only when
 * the transaction created, updated or deleted graph objects of one kind. Equality covers the name only.
 */
public final class Trigger {

    public enum EventType {
        CREATE,
        UPDATE,
        DELETE
    }

    public enum EventObject {
        NODE("()"),
        RELATIONSHIP("-->");

        private final String cypher;

        EventObject(String cypher) {
            this.cypher = cypher;
        }

        public String cypher() {
            return cypher;
        }

        static EventObject fromCypher(String text) {
            return Arrays.stream(values())
                    .filter(o -> o.cypher.equals(text))
                    .findFirst()
                    .orElseThrow(() -> new UsageException("Unknown trigger event object '" + text + "'"));
        }
    }

    public enum Phase {
        BEFORE,
        AFTER
    }

    private final String name;
    private final EventType eventType;
    private final EventObject eventObject;
    private final Phase phase;
    private final String statement;

    /**
     * @param eventType null to fire on any change
     * @param eventObject null to fire on both nodes and relationships; requires an event type
     */
    public Trigger(String name, EventType eventType, EventObject eventObject, Phase phase, String statement) {
        this.name = Objects.requireNonNull(name, "name");
        this.eventType = eventType;
        this.eventObject = eventObject;
        this.phase = Objects.requireNonNull(phase, "phase");
        this.statement = Objects.requireNonNull(statement, "statement");
        if (eventObject != null && eventType == null) {
            throw new UsageException("Trigger " + name + " names an event object without an event type");
        }
    }

    /**
     * Reads one row of {@code SHOW TRIGGERS}. The event type column is {@code ANY}, a bare type such
     * as {@code CREATE}, or an object followed by a type such as {@code () CREATE}; the phase column
     * reads {@code BEFORE COMMIT} or {@code AFTER COMMIT}.
     */
    public static Trigger fromShowTriggers(String name, String event, String phase, String statement) {
        EventType eventType = null;
        EventObject eventObject = null;
        if (event != null && !"ANY".equalsIgnoreCase(event.trim())) {
            String[] parts = event.trim().split("\\s+");
            if (parts.length > 1) {
                eventObject = EventObject.fromCypher(parts[0]);
            }
            eventType = EventType.valueOf(parts[parts.length - 1].toUpperCase(Locale.ROOT));
        }
        Phase executionPhase = Phase.valueOf(phase.trim().split("\\s+")[0].toUpperCase(Locale.ROOT));
        return new Trigger(name, eventType, eventObject, executionPhase, statement);
    }

    public String name() {
        return name;
    }

    public EventType eventType() {
        return eventType;
    }

    public EventObject eventObject() {
        return eventObject;
    }

    public Phase phase() {
        return phase;
    }

    public String statement() {
        return statement;
    }

    public String toCypher() {
        StringBuilder query = new StringBuilder("CREATE TRIGGER ").append(name);
        if (eventType != null) {
            query.append(" ON ");
            if (eventObject != null) {
                query.append(eventObject.cypher()).append(' ');
            }
            query.append(eventType);
        }
        return query.append(' ').append(phase).append(" COMMIT EXECUTE ").append(statement).append(';').toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof Trigger that && name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return "Trigger[" + name + "]";
    }
}
