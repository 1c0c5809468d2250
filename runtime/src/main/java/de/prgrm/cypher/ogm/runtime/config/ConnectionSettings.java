package de.prgrm.cypher.ogm.runtime.config;

import java.util.Locale;
import java.util.Objects;
import java.util.function.UnaryOperator;

import de.prgrm.cypher.ogm.runtime.errors.UsageException;

/**
 * Bolt connection settings.
 * <p>
 * {@link #memgraph()} and {@link #neo4j()} start from vendor defaults and apply overrides, first
 * from system properties ({@code cypher.ogm.memgraph.host}, {@code cypher.ogm.neo4j.port}, ...),
 * then from environment variables ({@code MG_HOST}, {@code NEO4J_PORT}, ...).
 */
public record ConnectionSettings(String host, int port, String username, String password, boolean encrypted,
        String clientName) {

    public static final String DEFAULT_CLIENT_NAME = "CypherOgm";

    public ConnectionSettings {
        Objects.requireNonNull(host, "host");
        if (port <= 0 || port > 65535) {
            throw new IllegalArgumentException("Invalid port " + port);
        }
    }

    public static ConnectionSettings memgraph() {
        return resolve("memgraph", "MG", new ConnectionSettings("127.0.0.1", 7687, "", "", false, DEFAULT_CLIENT_NAME),
                System::getProperty, System::getenv);
    }

    public static ConnectionSettings neo4j() {
        return resolve("neo4j", "NEO4J", new ConnectionSettings("localhost", 7687, "neo4j", "test", false,
                DEFAULT_CLIENT_NAME), System::getProperty, System::getenv);
    }

    static ConnectionSettings resolve(String vendor, String envPrefix, ConnectionSettings defaults,
            UnaryOperator<String> properties, UnaryOperator<String> environment) {
        Lookup lookup = (key, fallback) -> {
            String value = properties.apply("cypher.ogm." + vendor + "." + key);
            if (value == null) {
                value = environment.apply(envPrefix + "_" + key.toUpperCase(Locale.ROOT).replace('-', '_'));
            }
            return value == null ? fallback : value;
        };
        return new ConnectionSettings(
                lookup.get("host", defaults.host),
                parsePort(lookup.get("port", String.valueOf(defaults.port)), vendor, envPrefix),
                lookup.get("username", defaults.username),
                lookup.get("password", defaults.password),
                Boolean.parseBoolean(lookup.get("encrypted", String.valueOf(defaults.encrypted))),
                lookup.get("client-name", defaults.clientName));
    }

    private static int parsePort(String value, String vendor, String envPrefix) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new UsageException("Port '" + value + "' set by cypher.ogm." + vendor + ".port or " + envPrefix
                    + "_PORT is not a number", e);
        }
    }

    public String uri() {
        return "bolt://" + host + ":" + port;
    }

    public boolean hasCredentials() {
        return username != null && !username.isEmpty();
    }

    public ConnectionSettings withCredentials(String username, String password) {
        return new ConnectionSettings(host, port, username, password, encrypted, clientName);
    }

    @Override
    public String toString() {
        // never print the password
        return "ConnectionSettings[" + uri() + ", username=" + username + ", encrypted=" + encrypted
                + ", clientName=" + clientName + "]";
    }

    @FunctionalInterface
    private interface Lookup {
        String get(String key, String fallback);
    }
}
