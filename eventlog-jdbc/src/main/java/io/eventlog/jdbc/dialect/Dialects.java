package io.eventlog.jdbc.dialect;

import io.eventlog.StoreUnavailableException;
import io.eventlog.jdbc.spi.Dialect;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.SQLException;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.ServiceLoader;

/**
 * Finds the {@link Dialect} for a database.
 *
 * <p>Dialects are discovered once from {@code META-INF/services/io.eventlog.jdbc.spi.Dialect}.
 * A connection is matched by its JDBC URL prefix first. Drivers that wrap the real one
 * (connection proxies, tracing drivers) report their own URL, so detection falls back to
 * the database product name, compared with {@link Dialect#name()} ignoring case.
 */
public final class Dialects {
    private static final List<Dialect> DISCOVERED = ServiceLoader.load(Dialect.class, Dialects.class.getClassLoader())
            .stream()
            .map(ServiceLoader.Provider::get)
            .toList();

    private Dialects() {
    }

    public static List<Dialect> all() {
        return DISCOVERED;
    }

    /**
     * @throws IllegalArgumentException if no dialect has that name (case-insensitive)
     */
    public static Dialect get(String name) {
        Objects.requireNonNull(name, "name");
        return byName(name).orElseThrow(() ->
                new IllegalArgumentException("Unknown dialect: " + name + ". Available: " + names()));
    }

    /**
     * Detects the dialect of the database behind {@code dataSource}.
     *
     * @throws StoreUnavailableException if no connection could be opened
     * @throws IllegalArgumentException  if neither URL nor product name match a dialect
     */
    public static Dialect detect(DataSource dataSource) {
        Objects.requireNonNull(dataSource, "dataSource");
        try (Connection conn = dataSource.getConnection()) {
            return detect(conn);
        } catch (SQLException e) {
            throw new StoreUnavailableException("Failed to open a connection for dialect detection", e);
        }
    }

    /**
     * Detects the dialect of an open connection from its metadata.
     *
     * @throws IllegalArgumentException if neither URL nor product name match a dialect
     */
    public static Dialect detect(Connection conn) throws SQLException {
        DatabaseMetaData meta = conn.getMetaData();
        String url = meta.getURL();
        Optional<Dialect> dialect = url == null ? Optional.empty() : byUrl(url);
        if (dialect.isPresent()) {
            return dialect.get();
        }
        String product = meta.getDatabaseProductName();
        return Optional.ofNullable(product).flatMap(Dialects::byName).orElseThrow(() ->
                new IllegalArgumentException("No dialect for database " + product + " at " + url
                        + ". Available: " + names()));
    }

    /**
     * Detects the dialect from a JDBC URL prefix.
     *
     * @throws IllegalArgumentException if the URL is empty or matches no dialect
     */
    public static Dialect detect(String jdbcUrl) {
        if (jdbcUrl == null || jdbcUrl.isEmpty()) {
            throw new IllegalArgumentException("JDBC URL cannot be null or empty");
        }
        return byUrl(jdbcUrl).orElseThrow(() ->
                new IllegalArgumentException("No dialect found for JDBC URL: " + jdbcUrl
                        + ". Supported prefixes: " + DISCOVERED.stream()
                        .flatMap(d -> d.jdbcUrlPrefixes().stream())
                        .toList()));
    }

    private static Optional<Dialect> byUrl(String jdbcUrl) {
        return DISCOVERED.stream()
                .filter(d -> d.jdbcUrlPrefixes().stream().anyMatch(jdbcUrl::startsWith))
                .findFirst();
    }

    private static Optional<Dialect> byName(String name) {
        return DISCOVERED.stream()
                .filter(d -> d.name().equalsIgnoreCase(name))
                .findFirst();
    }

    private static List<String> names() {
        return DISCOVERED.stream().map(Dialect::name).toList();
    }
}
