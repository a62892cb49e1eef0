package io.taskqueue.jdbc;

import java.util.Objects;

/**
 * Table naming for the table-backed message stores.
 *
 * <p>A store with prefix {@code p} uses three tables: {@code p} (queue registry),
 * {@code p_message} (active messages) and {@code p_archive} (archived messages).
 */
public final class TableNames {
    public static final String DEFAULT_PREFIX = "task_queue";
    private static final String TABLE_NAME_PATTERN = "[a-zA-Z_][a-zA-Z0-9_]*";

    private final String queues;
    private final String messages;
    private final String archive;

    private TableNames(String prefix) {
        this.queues = prefix;
        this.messages = prefix + "_message";
        this.archive = prefix + "_archive";
    }

    public static TableNames of(String prefix) {
        return new TableNames(validate(prefix));
    }

    public static String validate(String tableName) {
        Objects.requireNonNull(tableName, "tableName");
        if (!tableName.matches(TABLE_NAME_PATTERN)) {
            throw new IllegalArgumentException("Invalid table name: " + tableName);
        }
        return tableName;
    }

    public String prefix() {
        return queues;
    }

    public String queues() {
        return queues;
    }

    public String messages() {
        return messages;
    }

    public String archive() {
        return archive;
    }
}
