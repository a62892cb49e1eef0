package io.taskqueue.jdbc.store;

import io.taskqueue.QueueStoreException;
import io.taskqueue.jdbc.JdbcTemplate;
import io.taskqueue.jdbc.TableNames;
import io.taskqueue.model.StoredMessage;
import io.taskqueue.spi.MessageStore;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Base JDBC message store backed by three plain tables (see {@link TableNames}).
 *
 * <p>The lease is a compare-and-set on the {@code vt} column
 * ({@code UPDATE ... WHERE msg_id=? AND vt<=?}), so concurrent readers never receive the
 * same message within one visibility window. Subclasses override {@link #read} with a
 * database-specific single-statement lease where one exists.
 *
 * <p>Register custom implementations via
 * {@code META-INF/services/io.taskqueue.jdbc.store.AbstractJdbcMessageStore}.
 *
 * @see JdbcMessageStores
 */
public abstract class AbstractJdbcMessageStore implements MessageStore {
    private static final int LEASE_CANDIDATES = 10;

    protected static final String MESSAGE_COLUMNS = "msg_id, read_ct, enqueued_at, vt, message";

    protected static final JdbcTemplate.RowMapper<StoredMessage> MESSAGE_ROW_MAPPER = rs -> new StoredMessage(
            rs.getLong("msg_id"),
            rs.getInt("read_ct"),
            JdbcTemplate.getInstant(rs, "enqueued_at"),
            JdbcTemplate.getInstant(rs, "vt"),
            rs.getString("message"));

    private final TableNames tables;
    private final Clock clock;

    protected AbstractJdbcMessageStore() {
        this(TableNames.DEFAULT_PREFIX, Clock.systemUTC());
    }

    protected AbstractJdbcMessageStore(String tablePrefix, Clock clock) {
        this.tables = TableNames.of(tablePrefix);
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Unique identifier for this message store (e.g., "postgresql", "h2", "pgmq").
     */
    public abstract String name();

    /**
     * JDBC URL prefixes this message store handles (e.g., "jdbc:postgresql:").
     */
    public abstract List<String> jdbcUrlPrefixes();

    /**
     * Returns a copy of this store using different tables and clock.
     *
     * @param tablePrefix table name prefix
     * @param clock       time source for visibility timestamps
     * @return a new store instance
     */
    public abstract AbstractJdbcMessageStore withTables(String tablePrefix, Clock clock);

    /**
     * Whether this store can serve the connected database. Stores that answer based on
     * more than the JDBC URL return {@code true} from {@link #probeRequired()}.
     *
     * @param conn a connection to the target database
     * @return {@code true} if the store is usable
     */
    public boolean supports(Connection conn) {
        return true;
    }

    /**
     * Whether URL matching alone is insufficient to select this store, so
     * {@link #supports(Connection)} must be consulted.
     */
    public boolean probeRequired() {
        return false;
    }

    protected TableNames tables() {
        return tables;
    }

    protected Clock clock() {
        return clock;
    }

    /** Current time truncated to millis so stored values match query parameters. */
    protected Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MILLIS);
    }

    @Override
    public long send(Connection conn, String queue, String payloadJson) {
        Instant now = now();
        ensureQueue(conn, queue, now);
        String sql = "INSERT INTO " + tables.messages() +
                " (queue_name, read_ct, enqueued_at, vt, message) VALUES (?, 0, ?, ?, ?)";
        return JdbcTemplate.insertReturningKey(conn, sql, "msg_id", queue, now, now, payloadJson);
    }

    /**
     * Registers the queue if it is not registered yet. Concurrent registration of the same
     * queue is tolerated.
     */
    protected void ensureQueue(Connection conn, String queue, Instant now) {
        String existsSql = "SELECT 1 FROM " + tables.queues() + " WHERE queue_name=?";
        if (JdbcTemplate.queryOne(conn, existsSql, rs -> Boolean.TRUE, queue).isPresent()) {
            return;
        }
        String sql = "INSERT INTO " + tables.queues() + " (queue_name, created_at) VALUES (?, ?)";
        try {
            JdbcTemplate.update(conn, sql, queue, now);
        } catch (QueueStoreException e) {
            if (!JdbcTemplate.isUniqueViolation(e)) {
                throw e;
            }
        }
    }

    @Override
    public Optional<StoredMessage> read(Connection conn, String queue, Duration visibilityTimeout) {
        Instant now = now();
        Instant leaseUntil = now.plus(visibilityTimeout);
        String candidatesSql = "SELECT msg_id FROM " + tables.messages() +
                " WHERE queue_name=? AND vt<=? ORDER BY msg_id LIMIT ?";
        String leaseSql = "UPDATE " + tables.messages() + " SET vt=?, read_ct=read_ct+1" +
                " WHERE msg_id=? AND queue_name=? AND vt<=?";
        while (true) {
            List<Long> candidates = JdbcTemplate.query(conn, candidatesSql, rs -> rs.getLong(1),
                    queue, now, LEASE_CANDIDATES);
            if (candidates.isEmpty()) {
                return Optional.empty();
            }
            for (long msgId : candidates) {
                if (JdbcTemplate.update(conn, leaseSql, leaseUntil, msgId, queue, now) == 1) {
                    return selectById(conn, msgId);
                }
            }
            // every candidate was leased or archived by another reader; look again
        }
    }

    protected Optional<StoredMessage> selectById(Connection conn, long msgId) {
        String sql = "SELECT " + MESSAGE_COLUMNS + " FROM " + tables.messages() + " WHERE msg_id=?";
        return JdbcTemplate.queryOne(conn, sql, MESSAGE_ROW_MAPPER, msgId);
    }

    @Override
    public boolean archive(Connection conn, String queue, long msgId) {
        String copySql = "INSERT INTO " + tables.archive() +
                " (msg_id, queue_name, read_ct, enqueued_at, archived_at, vt, message)" +
                " SELECT msg_id, queue_name, read_ct, enqueued_at, CAST(? AS TIMESTAMP WITH TIME ZONE), vt, message FROM " + tables.messages() +
                " WHERE msg_id=? AND queue_name=?";
        String deleteSql = "DELETE FROM " + tables.messages() + " WHERE msg_id=? AND queue_name=?";
        Instant archivedAt = now();
        try {
            return inTransaction(conn, c -> {
                if (JdbcTemplate.update(c, copySql, archivedAt, msgId, queue) == 0) {
                    return false;
                }
                return JdbcTemplate.update(c, deleteSql, msgId, queue) == 1;
            });
        } catch (QueueStoreException e) {
            if (JdbcTemplate.isUniqueViolation(e)) {
                return false;
            }
            throw e;
        }
    }

    @Override
    public boolean dropQueue(Connection conn, String queue) {
        return inTransaction(conn, c -> {
            JdbcTemplate.update(c, "DELETE FROM " + tables.messages() + " WHERE queue_name=?", queue);
            JdbcTemplate.update(c, "DELETE FROM " + tables.archive() + " WHERE queue_name=?", queue);
            return JdbcTemplate.update(c, "DELETE FROM " + tables.queues() + " WHERE queue_name=?", queue) > 0;
        });
    }

    @Override
    public List<StoredMessage> peek(Connection conn, String queue, int limit) {
        String sql = "SELECT " + MESSAGE_COLUMNS + " FROM " + tables.messages() +
                " WHERE queue_name=? AND vt<=? ORDER BY msg_id LIMIT ?";
        return JdbcTemplate.query(conn, sql, MESSAGE_ROW_MAPPER, queue, now(), limit);
    }

    @Override
    public long queueLength(Connection conn, String queue) {
        String sql = "SELECT COUNT(*) FROM " + tables.messages() + " WHERE queue_name=?";
        return JdbcTemplate.queryOne(conn, sql, rs -> rs.getLong(1), queue).orElse(0L);
    }

    /**
     * Runs {@code work} in a local transaction on {@code conn}, restoring the previous
     * auto-commit mode afterwards.
     */
    protected static <T> T inTransaction(Connection conn, Function<Connection, T> work) {
        try {
            boolean autoCommit = conn.getAutoCommit();
            conn.setAutoCommit(false);
            try {
                T result = work.apply(conn);
                conn.commit();
                return result;
            } catch (RuntimeException e) {
                conn.rollback();
                throw e;
            } finally {
                conn.setAutoCommit(autoCommit);
            }
        } catch (SQLException e) {
            throw new QueueStoreException("Failed to complete transaction", e);
        }
    }
}
