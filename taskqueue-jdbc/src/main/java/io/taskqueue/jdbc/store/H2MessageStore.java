package io.taskqueue.jdbc.store;

import java.time.Clock;
import java.util.List;

/**
 * H2 message store using the portable compare-and-set lease. Intended for tests and
 * local development.
 */
public final class H2MessageStore extends AbstractJdbcMessageStore {

    public H2MessageStore() {
        super();
    }

    public H2MessageStore(String tablePrefix) {
        this(tablePrefix, Clock.systemUTC());
    }

    public H2MessageStore(String tablePrefix, Clock clock) {
        super(tablePrefix, clock);
    }

    @Override
    public AbstractJdbcMessageStore withTables(String tablePrefix, Clock clock) {
        return new H2MessageStore(tablePrefix, clock);
    }

    @Override
    public String name() {
        return "h2";
    }

    @Override
    public List<String> jdbcUrlPrefixes() {
        return List.of("jdbc:h2:");
    }

    @Override
    public String toString() {
        return "H2MessageStore[" + tables().prefix() + "]";
    }
}
