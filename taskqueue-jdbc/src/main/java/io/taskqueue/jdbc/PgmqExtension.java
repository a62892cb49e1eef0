package io.taskqueue.jdbc;

import io.taskqueue.QueueStoreException;

import java.sql.Connection;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Checks for the PostgreSQL {@code pgmq} extension.
 */
public final class PgmqExtension {
    private static final Logger logger = Logger.getLogger(PgmqExtension.class.getName());

    public static final String NAME = "pgmq";

    private static final String VERSION_SQL = "SELECT extversion FROM pg_extension WHERE extname = ?";

    private PgmqExtension() {
    }

    /**
     * Returns {@code true} if the {@code pgmq} extension is installed in the connected database.
     * Databases without a {@code pg_extension} catalog (anything but PostgreSQL) report
     * {@code false}.
     *
     * @param conn the JDBC connection
     * @return whether pgmq is installed
     */
    public static boolean isInstalled(Connection conn) {
        try {
            return version(conn).isPresent();
        } catch (QueueStoreException e) {
            logger.log(Level.FINE, "pg_extension catalog not available", e);
            return false;
        }
    }

    /**
     * Returns the installed {@code pgmq} version.
     *
     * @param conn the JDBC connection
     * @return the extension version, or empty if not installed
     * @throws QueueStoreException if the catalog cannot be queried
     */
    public static Optional<String> version(Connection conn) {
        return JdbcTemplate.queryOne(conn, VERSION_SQL, rs -> rs.getString(1), NAME);
    }

    /**
     * Fails unless the {@code pgmq} extension is installed.
     *
     * @param conn the JDBC connection
     * @throws QueueStoreException if pgmq is missing
     */
    public static void requireInstalled(Connection conn) {
        if (!isInstalled(conn)) {
            throw new QueueStoreException("PostgreSQL extension '" + NAME + "' is not installed;"
                    + " run CREATE EXTENSION " + NAME);
        }
    }
}
