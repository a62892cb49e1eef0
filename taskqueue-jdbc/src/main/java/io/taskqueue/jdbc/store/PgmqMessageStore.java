package io.taskqueue.jdbc.store;

import io.taskqueue.QueueNames;
import io.taskqueue.QueueStoreException;
import io.taskqueue.jdbc.JdbcTemplate;
import io.taskqueue.jdbc.PgmqExtension;
import io.taskqueue.jdbc.TableNames;
import io.taskqueue.model.StoredMessage;

import java.sql.Connection;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Message store that delegates to the PostgreSQL {@code pgmq} extension.
 *
 * <p>Queues are created with {@code pgmq.create} on first send and remembered per store
 * instance. pgmq manages its own tables, so the table prefix is not used. Visibility
 * timeouts are rounded up to whole seconds, the resolution of {@code pgmq.read}.
 *
 * <p>Selected by {@link JdbcMessageStores#detect(javax.sql.DataSource)} only when the
 * extension is installed.
 */
public final class PgmqMessageStore extends AbstractJdbcMessageStore {
    private static final Logger logger = Logger.getLogger(PgmqMessageStore.class.getName());

    private static final String PGMQ_COLUMNS = "msg_id, read_ct, enqueued_at, vt, message::text AS message";

    private final Set<String> createdQueues = ConcurrentHashMap.newKeySet();

    public PgmqMessageStore() {
        super();
    }

    @Override
    public AbstractJdbcMessageStore withTables(String tablePrefix, Clock clock) {
        TableNames.validate(tablePrefix);
        return new PgmqMessageStore();
    }

    @Override
    public String name() {
        return "pgmq";
    }

    @Override
    public List<String> jdbcUrlPrefixes() {
        return List.of("jdbc:postgresql:");
    }

    @Override
    public boolean supports(Connection conn) {
        return PgmqExtension.isInstalled(conn);
    }

    @Override
    public boolean probeRequired() {
        return true;
    }

    @Override
    public long send(Connection conn, String queue, String payloadJson) {
        if (!createdQueues.contains(queue)) {
            createQueue(conn, queue);
        }
        try {
            return doSend(conn, queue, payloadJson);
        } catch (QueueStoreException e) {
            if (!JdbcTemplate.isUndefinedTable(e)) {
                throw e;
            }
            logger.log(Level.FINE, "Queue {0} disappeared; recreating", queue);
            createdQueues.remove(queue);
            createQueue(conn, queue);
            return doSend(conn, queue, payloadJson);
        }
    }

    private long doSend(Connection conn, String queue, String payloadJson) {
        return JdbcTemplate.queryOne(conn, "SELECT * FROM pgmq.send(?, ?::jsonb)",
                        rs -> rs.getLong(1), queue, payloadJson)
                .orElseThrow(() -> new QueueStoreException("pgmq.send returned no id for queue " + queue));
    }

    private void createQueue(Connection conn, String queue) {
        JdbcTemplate.query(conn, "SELECT pgmq.create(?)", rs -> Boolean.TRUE, queue);
        createdQueues.add(queue);
        logger.log(Level.FINE, "Created pgmq queue {0}", queue);
    }

    @Override
    public Optional<StoredMessage> read(Connection conn, String queue, Duration visibilityTimeout) {
        String sql = "SELECT " + PGMQ_COLUMNS + " FROM pgmq.read(?, ?, 1)";
        try {
            return JdbcTemplate.queryOne(conn, sql, MESSAGE_ROW_MAPPER, queue, toSeconds(visibilityTimeout));
        } catch (QueueStoreException e) {
            if (JdbcTemplate.isUndefinedTable(e)) {
                return Optional.empty();
            }
            throw e;
        }
    }

    @Override
    public boolean archive(Connection conn, String queue, long msgId) {
        try {
            return JdbcTemplate.queryOne(conn, "SELECT pgmq.archive(?, ?::bigint)",
                    rs -> rs.getBoolean(1), queue, msgId).orElse(false);
        } catch (QueueStoreException e) {
            if (JdbcTemplate.isUndefinedTable(e)) {
                return false;
            }
            throw e;
        }
    }

    @Override
    public boolean dropQueue(Connection conn, String queue) {
        createdQueues.remove(queue);
        boolean exists = JdbcTemplate.queryOne(conn, "SELECT 1 FROM pgmq.meta WHERE queue_name=?",
                rs -> Boolean.TRUE, queue).isPresent();
        if (!exists) {
            return false;
        }
        return JdbcTemplate.queryOne(conn, "SELECT pgmq.drop_queue(?)", rs -> rs.getBoolean(1), queue)
                .orElse(false);
    }

    @Override
    public List<StoredMessage> peek(Connection conn, String queue, int limit) {
        String sql = "SELECT " + PGMQ_COLUMNS + " FROM pgmq.q_" + QueueNames.validate(queue) +
                " WHERE vt <= clock_timestamp() ORDER BY msg_id LIMIT ?";
        try {
            return JdbcTemplate.query(conn, sql, MESSAGE_ROW_MAPPER, limit);
        } catch (QueueStoreException e) {
            if (JdbcTemplate.isUndefinedTable(e)) {
                return List.of();
            }
            throw e;
        }
    }

    @Override
    public long queueLength(Connection conn, String queue) {
        try {
            return JdbcTemplate.queryOne(conn, "SELECT queue_length FROM pgmq.metrics(?)",
                    rs -> rs.getLong(1), queue).orElse(0L);
        } catch (QueueStoreException e) {
            if (JdbcTemplate.isUndefinedTable(e)) {
                return 0L;
            }
            throw e;
        }
    }

    static int toSeconds(Duration visibilityTimeout) {
        long seconds = visibilityTimeout.getSeconds();
        if (visibilityTimeout.getNano() > 0) {
            seconds++;
        }
        return Math.toIntExact(seconds);
    }
}
