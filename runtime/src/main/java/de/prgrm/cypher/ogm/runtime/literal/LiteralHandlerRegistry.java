package de.prgrm.cypher.ogm.runtime.literal;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

import org.jboss.logging.Logger;

import de.prgrm.cypher.ogm.runtime.literal.types.*;

/**
 * Ordered lookup of {@link LiteralHandler}s; the first handler supporting a value renders it.
 * Handlers added with {@link #register(LiteralHandler)} are consulted before the built-in ones.
 */
public class LiteralHandlerRegistry {

    private static final Logger LOG = Logger.getLogger(LiteralHandlerRegistry.class);

    private static final List<LiteralHandler> DEFAULTS = List.of(
            // CypherVariable first so raw expressions are never quoted
            new CypherVariableLiteralHandler(),
            new StringLiteralHandler(),
            new CharacterLiteralHandler(),
            new UuidLiteralHandler(),
            new BooleanLiteralHandler(),
            new NumberLiteralHandler(),
            new EnumLiteralHandler(),
            new CollectionLiteralHandler(),
            new ArrayLiteralHandler(),
            new MapLiteralHandler(),
            new LocalDateLiteralHandler(),
            new LocalTimeLiteralHandler(),
            new LocalDateTimeLiteralHandler(),
            new OffsetTimeLiteralHandler(),
            new ZonedDateTimeLiteralHandler(),
            new OffsetDateTimeLiteralHandler(),
            new InstantLiteralHandler(),
            new DurationLiteralHandler(),
            new PeriodLiteralHandler(),
            new IsoDurationLiteralHandler());

    private static final List<LiteralHandler> custom = new CopyOnWriteArrayList<>();

    public static Optional<LiteralHandler> findHandler(Object value) {
        for (LiteralHandler handler : custom) {
            if (handler.supports(value)) {
                return Optional.of(handler);
            }
        }
        return DEFAULTS.stream().filter(h -> h.supports(value)).findFirst();
    }

    /**
     * Adds a handler for application types. Later registrations take precedence over earlier ones.
     */
    public static void register(LiteralHandler handler) {
        Objects.requireNonNull(handler, "handler");
        custom.add(0, handler);
        LOG.debugf("Registered literal handler %s", handler.getClass().getName());
    }

    public static boolean unregister(LiteralHandler handler) {
        return custom.remove(handler);
    }

    private LiteralHandlerRegistry() {
    }
}
