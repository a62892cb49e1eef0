package io.taskqueue.jdbc.store;

import io.taskqueue.jdbc.JdbcTemplate;
import io.taskqueue.model.StoredMessage;

import java.sql.Connection;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * PostgreSQL message store over plain tables.
 *
 * <p>Uses {@code FOR UPDATE SKIP LOCKED} with {@code RETURNING} for a single-round-trip
 * lease, and a single {@code DELETE ... RETURNING} statement to archive.
 */
public final class PostgresMessageStore extends AbstractJdbcMessageStore {

    public PostgresMessageStore() {
        super();
    }

    public PostgresMessageStore(String tablePrefix, Clock clock) {
        super(tablePrefix, clock);
    }

    @Override
    public AbstractJdbcMessageStore withTables(String tablePrefix, Clock clock) {
        return new PostgresMessageStore(tablePrefix, clock);
    }

    @Override
    public String name() {
        return "postgresql";
    }

    @Override
    public List<String> jdbcUrlPrefixes() {
        return List.of("jdbc:postgresql:");
    }

    @Override
    protected void ensureQueue(Connection conn, String queue, Instant now) {
        String sql = "INSERT INTO " + tables().queues() + " (queue_name, created_at) VALUES (?, ?)" +
                " ON CONFLICT (queue_name) DO NOTHING";
        JdbcTemplate.update(conn, sql, queue, now);
    }

    @Override
    public Optional<StoredMessage> read(Connection conn, String queue, Duration visibilityTimeout) {
        Instant now = now();
        String sql = "UPDATE " + tables().messages() + " SET vt=?, read_ct=read_ct+1 " +
                "WHERE msg_id = (" +
                "SELECT msg_id FROM " + tables().messages() +
                " WHERE queue_name=? AND vt<=? ORDER BY msg_id LIMIT 1" +
                " FOR UPDATE SKIP LOCKED" +
                ") RETURNING " + MESSAGE_COLUMNS;
        List<StoredMessage> leased = JdbcTemplate.updateReturning(conn, sql, MESSAGE_ROW_MAPPER,
                now.plus(visibilityTimeout), queue, now);
        return leased.isEmpty() ? Optional.empty() : Optional.of(leased.get(0));
    }

    @Override
    public boolean archive(Connection conn, String queue, long msgId) {
        String sql = "WITH archived AS (" +
                "DELETE FROM " + tables().messages() + " WHERE msg_id=? AND queue_name=?" +
                " RETURNING msg_id, queue_name, read_ct, enqueued_at, vt, message" +
                ") INSERT INTO " + tables().archive() +
                " (msg_id, queue_name, read_ct, enqueued_at, archived_at, vt, message)" +
                " SELECT msg_id, queue_name, read_ct, enqueued_at, CAST(? AS TIMESTAMP WITH TIME ZONE), vt, message FROM archived";
        return JdbcTemplate.update(conn, sql, msgId, queue, now()) == 1;
    }
}
