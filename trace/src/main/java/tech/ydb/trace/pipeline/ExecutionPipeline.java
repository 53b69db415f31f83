package tech.ydb.trace.pipeline;

import java.sql.SQLException;

import javax.annotation.Nullable;

/**
 * Statement execution pipeline with two wrappable extension points: start of a statement and run of a statement.
 * <p>
 * An installed hook replaces the standard behavior of its extension point; it is expected to call the hook it
 * replaced, or the standard behavior if there was none. Implementations are not required to be thread safe.
 */
public interface ExecutionPipeline {
    @Nullable
    ExecutorStartHook getStartHook();

    void setStartHook(@Nullable ExecutorStartHook hook);

    @Nullable
    ExecutorRunHook getRunHook();

    void setRunHook(@Nullable ExecutorRunHook hook);

    void standardStart(PipelineQuery query) throws SQLException;

    void standardRun(PipelineQuery query) throws SQLException;
}
