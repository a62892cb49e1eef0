package io.taskqueue.jdbc;

import io.taskqueue.jdbc.store.AbstractJdbcMessageStore;
import io.taskqueue.jdbc.store.H2MessageStore;
import org.junit.jupiter.api.BeforeAll;

import javax.sql.DataSource;

class H2MessageStoreIntegrationTest extends AbstractMessageStoreIntegrationTest {

    private static final H2MessageStore STORE = new H2MessageStore();
    private static DataSource dataSource;

    @BeforeAll
    static void initSchema() throws Exception {
        dataSource = TestDatabases.h2();
    }

    @Override
    DataSource dataSource() {
        return dataSource;
    }

    @Override
    AbstractJdbcMessageStore store() {
        return STORE;
    }
}
