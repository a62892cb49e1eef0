package io.taskqueue.jdbc.store;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.ServiceLoader;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry for JDBC message stores with auto-detection support.
 *
 * <p>Message stores are loaded via {@link ServiceLoader} from
 * {@code META-INF/services/io.taskqueue.jdbc.store.AbstractJdbcMessageStore}, in file order.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * // Auto-detect from DataSource (prefers pgmq when the extension is installed)
 * AbstractJdbcMessageStore store = JdbcMessageStores.detect(dataSource);
 *
 * // Auto-detect from JDBC URL
 * AbstractJdbcMessageStore store = JdbcMessageStores.detect("jdbc:postgresql://localhost/app");
 *
 * // Get by name
 * AbstractJdbcMessageStore store = JdbcMessageStores.get("pgmq");
 * }</pre>
 */
public final class JdbcMessageStores {

    private static final List<AbstractJdbcMessageStore> STORES;
    private static final Map<String, AbstractJdbcMessageStore> BY_NAME = new ConcurrentHashMap<>();

    static {
        STORES = ServiceLoader.load(AbstractJdbcMessageStore.class)
                .stream()
                .map(ServiceLoader.Provider::get)
                .toList();

        for (AbstractJdbcMessageStore store : STORES) {
            BY_NAME.put(store.name().toLowerCase(Locale.ROOT), store);
        }
    }

    private JdbcMessageStores() {
    }

    /**
     * Returns all registered message stores.
     */
    public static List<AbstractJdbcMessageStore> all() {
        return STORES;
    }

    /**
     * Gets a message store by name.
     *
     * @param name message store name (case-insensitive)
     * @return the message store
     * @throws IllegalArgumentException if no message store found
     */
    public static AbstractJdbcMessageStore get(String name) {
        Objects.requireNonNull(name, "name");
        AbstractJdbcMessageStore store = BY_NAME.get(name.toLowerCase(Locale.ROOT));
        if (store == null) {
            throw new IllegalArgumentException("Unknown message store: " + name +
                    ". Available: " + BY_NAME.keySet());
        }
        return store;
    }

    /**
     * Auto-detects the message store from a DataSource, probing stores that need more
     * than the JDBC URL to decide.
     *
     * @param dataSource the data source
     * @return detected message store
     * @throws IllegalStateException if detection fails or no matching message store
     */
    public static AbstractJdbcMessageStore detect(DataSource dataSource) {
        Objects.requireNonNull(dataSource, "dataSource");
        try (Connection conn = dataSource.getConnection()) {
            String url = conn.getMetaData().getURL();
            for (AbstractJdbcMessageStore store : matching(url)) {
                if (!store.probeRequired() || store.supports(conn)) {
                    return store;
                }
            }
            throw new IllegalStateException("No message store found for JDBC URL: " + url +
                    ". Supported prefixes: " + allPrefixes());
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to detect message store from DataSource", e);
        }
    }

    /**
     * Auto-detects the message store from a JDBC URL. Stores that require probing the
     * database are skipped.
     *
     * @param jdbcUrl the JDBC URL
     * @return detected message store
     * @throws IllegalArgumentException if no matching message store found
     */
    public static AbstractJdbcMessageStore detect(String jdbcUrl) {
        if (jdbcUrl == null || jdbcUrl.isEmpty()) {
            throw new IllegalArgumentException("JDBC URL cannot be null or empty");
        }
        return matching(jdbcUrl).stream()
                .filter(store -> !store.probeRequired())
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("No message store found for JDBC URL: " + jdbcUrl +
                        ". Supported prefixes: " + allPrefixes()));
    }

    private static List<AbstractJdbcMessageStore> matching(String jdbcUrl) {
        String url = jdbcUrl == null ? "" : jdbcUrl.toLowerCase(Locale.ROOT);
        return STORES.stream()
                .filter(store -> store.jdbcUrlPrefixes().stream()
                        .anyMatch(prefix -> url.startsWith(prefix.toLowerCase(Locale.ROOT))))
                .toList();
    }

    private static List<String> allPrefixes() {
        return STORES.stream()
                .flatMap(s -> s.jdbcUrlPrefixes().stream())
                .distinct()
                .toList();
    }
}
