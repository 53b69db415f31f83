package tech.ydb.trace.host;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs pipeline statements on a JDBC connection. The connection is owned by the caller.
 */
public class JdbcStatementExecutor implements StatementExecutor {
    private static final Logger LOGGER = Logger.getLogger(JdbcStatementExecutor.class.getName());

    private final Connection connection;

    public JdbcStatementExecutor(Connection connection) {
        this.connection = Objects.requireNonNull(connection);
    }

    @Override
    public void execute(String sql) throws SQLException {
        try (Statement statement = connection.createStatement()) {
            boolean hasResultSet = statement.execute(sql);
            LOGGER.log(Level.FINEST, "Executed [{0}], result set: {1}", new Object[] {sql, hasResultSet});
        }
    }
}
