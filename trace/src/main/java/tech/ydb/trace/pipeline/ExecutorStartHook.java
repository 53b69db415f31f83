package tech.ydb.trace.pipeline;

import java.sql.SQLException;

@FunctionalInterface
public interface ExecutorStartHook {
    void start(PipelineQuery query) throws SQLException;
}
