package io.taskqueue.jdbc;

import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.SQLException;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

class DataSourceConnectionProviderTest {

    @Test
    void delegatesToDataSource() throws SQLException {
        JdbcDataSource dataSource = TestDatabases.h2();
        DataSourceConnectionProvider provider = new DataSourceConnectionProvider(dataSource);

        try (Connection conn = provider.getConnection()) {
            assertFalse(conn.isClosed());
        }
    }

    @Test
    void rejectsNullDataSource() {
        assertThrows(NullPointerException.class, () -> new DataSourceConnectionProvider(null));
    }
}
