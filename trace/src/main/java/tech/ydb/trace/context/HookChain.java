package tech.ydb.trace.context;

import java.sql.SQLException;

import javax.annotation.Nullable;

import tech.ydb.trace.pipeline.ExecutionPipeline;
import tech.ydb.trace.pipeline.ExecutorRunHook;
import tech.ydb.trace.pipeline.ExecutorStartHook;
import tech.ydb.trace.pipeline.PipelineQuery;

/**
 * Snapshot of both hook slots of a pipeline. Also used to continue a statement through the hooks that were installed
 * before the snapshot.
 */
public final class HookChain {
    @Nullable
    private final ExecutorStartHook startHook;
    @Nullable
    private final ExecutorRunHook runHook;

    private HookChain(@Nullable ExecutorStartHook startHook, @Nullable ExecutorRunHook runHook) {
        this.startHook = startHook;
        this.runHook = runHook;
    }

    public static HookChain capture(ExecutionPipeline pipeline) {
        return new HookChain(pipeline.getStartHook(), pipeline.getRunHook());
    }

    public void restore(ExecutionPipeline pipeline) {
        pipeline.setStartHook(startHook);
        pipeline.setRunHook(runHook);
    }

    @Nullable
    public ExecutorStartHook getStartHook() {
        return startHook;
    }

    @Nullable
    public ExecutorRunHook getRunHook() {
        return runHook;
    }

    void start(ExecutionPipeline pipeline, PipelineQuery query) throws SQLException {
        if (startHook != null) {
            startHook.start(query);
        } else {
            pipeline.standardStart(query);
        }
    }

    void run(ExecutionPipeline pipeline, PipelineQuery query) throws SQLException {
        if (runHook != null) {
            runHook.run(query);
        } else {
            pipeline.standardRun(query);
        }
    }
}
