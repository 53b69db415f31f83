package tech.ydb.trace.pipeline;

import java.sql.SQLException;

@FunctionalInterface
public interface ExecutorRunHook {
    void run(PipelineQuery query) throws SQLException;
}
