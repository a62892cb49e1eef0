package io.taskqueue.jdbc;

import io.taskqueue.QueueStoreException;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Lightweight JDBC helper to reduce boilerplate in message store implementations.
 *
 * <p>All methods wrap {@link SQLException} in {@link QueueStoreException}; use
 * {@link #sqlState(QueueStoreException)} to inspect the original error code.
 */
public final class JdbcTemplate {

    /** SQLState for a unique or primary key violation. */
    public static final String UNIQUE_VIOLATION = "23505";

    /** SQLState for a missing table or relation (PostgreSQL). */
    public static final String UNDEFINED_TABLE = "42P01";

    @FunctionalInterface
    public interface RowMapper<T> {
        T map(ResultSet rs) throws SQLException;
    }

    private JdbcTemplate() {
    }

    /** Execute UPDATE, return rows affected. */
    public static int update(Connection conn, String sql, Object... params) {
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            bindParams(ps, params);
            return ps.executeUpdate();
        } catch (SQLException e) {
            throw new QueueStoreException("Failed to execute update", e);
        }
    }

    /** Execute SELECT, map rows. */
    public static <T> List<T> query(Connection conn, String sql, RowMapper<T> mapper, Object... params) {
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            bindParams(ps, params);
            try (ResultSet rs = ps.executeQuery()) {
                List<T> results = new ArrayList<>();
                while (rs.next()) {
                    results.add(mapper.map(rs));
                }
                return results;
            }
        } catch (SQLException e) {
            throw new QueueStoreException("Failed to execute query", e);
        }
    }

    /** Execute SELECT expected to return at most one row. */
    public static <T> Optional<T> queryOne(Connection conn, String sql, RowMapper<T> mapper, Object... params) {
        List<T> rows = query(conn, sql, mapper, params);
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    /** Execute UPDATE ... RETURNING, map returned rows (PostgreSQL). */
    public static <T> List<T> updateReturning(Connection conn, String sql, RowMapper<T> mapper, Object... params) {
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            bindParams(ps, params);
            try (ResultSet rs = ps.executeQuery()) {
                List<T> results = new ArrayList<>();
                while (rs.next()) {
                    results.add(mapper.map(rs));
                }
                return results;
            }
        } catch (SQLException e) {
            throw new QueueStoreException("Failed to execute updateReturning", e);
        }
    }

    /** Execute INSERT, return the generated value of {@code keyColumn}. */
    public static long insertReturningKey(Connection conn, String sql, String keyColumn, Object... params) {
        try (PreparedStatement ps = conn.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {
            bindParams(ps, params);
            ps.executeUpdate();
            try (ResultSet keys = ps.getGeneratedKeys()) {
                if (!keys.next()) {
                    throw new QueueStoreException("No generated key returned for " + keyColumn);
                }
                return keys.getLong(keyColumn);
            }
        } catch (SQLException e) {
            throw new QueueStoreException("Failed to execute insert", e);
        }
    }

    /**
     * Returns the SQLState of the JDBC error behind {@code e}, or {@code null} if it
     * was not caused by a {@link SQLException}.
     */
    public static String sqlState(QueueStoreException e) {
        return e.getCause() instanceof SQLException sql ? sql.getSQLState() : null;
    }

    public static boolean isUniqueViolation(QueueStoreException e) {
        return UNIQUE_VIOLATION.equals(sqlState(e));
    }

    public static boolean isUndefinedTable(QueueStoreException e) {
        return UNDEFINED_TABLE.equals(sqlState(e));
    }

    /**
     * Reads a {@code TIMESTAMP WITH TIME ZONE} column as an {@link Instant}, independent of
     * the JVM and session time zones.
     */
    public static Instant getInstant(ResultSet rs, String column) throws SQLException {
        OffsetDateTime value = rs.getObject(column, OffsetDateTime.class);
        return value == null ? null : value.toInstant();
    }

    /** Instants are bound as UTC {@link OffsetDateTime}s. */
    private static void bindParams(PreparedStatement ps, Object... params) throws SQLException {
        for (int i = 0; i < params.length; i++) {
            Object param = params[i];
            if (param == null) {
                ps.setObject(i + 1, null);
            } else if (param instanceof String s) {
                ps.setString(i + 1, s);
            } else if (param instanceof Integer n) {
                ps.setInt(i + 1, n);
            } else if (param instanceof Long n) {
                ps.setLong(i + 1, n);
            } else if (param instanceof Instant instant) {
                ps.setObject(i + 1, instant.atOffset(ZoneOffset.UTC));
            } else {
                ps.setObject(i + 1, param);
            }
        }
    }
}
