package de.prgrm.cypher.ogm.runtime.client;

import java.util.Iterator;
import java.util.Map;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

import org.jboss.logging.Logger;
import org.neo4j.driver.*;
import org.neo4j.driver.Record;

import de.prgrm.cypher.ogm.runtime.config.ConnectionSettings;
import de.prgrm.cypher.ogm.runtime.errors.DatabaseExceptionTranslator;
import de.prgrm.cypher.ogm.runtime.mapping.GraphValueMapper;

/**
 * {@link Connection} over the Neo4j Java driver; both Memgraph and Neo4j speak Bolt. Every call
 * runs in its own auto-commit session.
 */
public class BoltConnection implements Connection {

    private static final Logger LOG = Logger.getLogger(BoltConnection.class);

    private final Driver driver;
    private final GraphValueMapper mapper;
    private volatile boolean active = true;

    public BoltConnection(Driver driver, GraphValueMapper mapper) {
        this.driver = driver;
        this.mapper = mapper;
    }

    public static BoltConnection open(ConnectionSettings settings, GraphValueMapper mapper) {
        Config.ConfigBuilder config = Config.builder().withUserAgent(settings.clientName());
        config = settings.encrypted() ? config.withEncryption() : config.withoutEncryption();
        AuthToken auth = settings.hasCredentials()
                ? AuthTokens.basic(settings.username(), settings.password() == null ? "" : settings.password())
                : AuthTokens.none();
        LOG.debugf("Opening %s", settings);
        return new BoltConnection(GraphDatabase.driver(settings.uri(), auth, config.build()), mapper);
    }

    @Override
    public void execute(String query, Map<String, Object> parameters) {
        LOG.debugf("[execute] %s", query);
        try (Session session = driver.session()) {
            session.run(query, parameters).consume();
        } catch (Exception e) {
            throw DatabaseExceptionTranslator.translate(e, query);
        }
    }

    @Override
    public Stream<Map<String, Object>> executeAndFetch(String query, Map<String, Object> parameters) {
        LOG.debugf("[fetch] %s", query);
        Session session = driver.session();
        Result result;
        try {
            result = session.run(query, parameters);
        } catch (Exception e) {
            closeQuietly(session, e);
            throw DatabaseExceptionTranslator.translate(e, query);
        }
        Iterator<Map<String, Object>> rows = new RowIterator(result, query);
        return StreamSupport.stream(Spliterators.spliteratorUnknownSize(rows, Spliterator.ORDERED), false)
                .onClose(session::close);
    }

    @Override
    public boolean isActive() {
        return active;
    }

    @Override
    public void close() {
        active = false;
        driver.close();
    }

    private static void closeQuietly(Session session, Exception primary) {
        try {
            session.close();
        } catch (Exception e) {
            primary.addSuppressed(e);
        }
    }

    /**
     * Translates driver failures raised while pulling further records.
     */
    private final class RowIterator implements Iterator<Map<String, Object>> {
        private final Result result;
        private final String query;

        private RowIterator(Result result, String query) {
            this.result = result;
            this.query = query;
        }

        @Override
        public boolean hasNext() {
            try {
                return result.hasNext();
            } catch (Exception e) {
                throw DatabaseExceptionTranslator.translate(e, query);
            }
        }

        @Override
        public Map<String, Object> next() {
            Record record;
            try {
                record = result.next();
            } catch (Exception e) {
                throw DatabaseExceptionTranslator.translate(e, query);
            }
            return mapper.toRow(record);
        }
    }
}
