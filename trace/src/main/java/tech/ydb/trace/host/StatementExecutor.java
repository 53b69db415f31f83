package tech.ydb.trace.host;

import java.sql.SQLException;

/**
 * Executes statements on behalf of the standard run of {@link StandardExecutionPipeline}.
 */
@FunctionalInterface
public interface StatementExecutor {
    StatementExecutor NONE = sql -> { };

    void execute(String sql) throws SQLException;
}
