package tech.ydb.trace.host;

import java.sql.SQLException;
import java.util.logging.Level;
import java.util.logging.Logger;

import javax.annotation.Nullable;

import tech.ydb.trace.pipeline.ExecutionPipeline;
import tech.ydb.trace.pipeline.ExecutorRunHook;
import tech.ydb.trace.pipeline.ExecutorStartHook;
import tech.ydb.trace.pipeline.PipelineQuery;

/**
 * Pipeline of the in-memory host. Every statement is started and then run, each step goes through the installed hook
 * or the standard behavior. The standard run passes the statement text to a {@link StatementExecutor}.
 */
public class StandardExecutionPipeline implements ExecutionPipeline {
    private static final Logger LOGGER = Logger.getLogger(StandardExecutionPipeline.class.getName());

    private final StatementExecutor executor;

    @Nullable
    private volatile ExecutorStartHook startHook = null;
    @Nullable
    private volatile ExecutorRunHook runHook = null;

    public StandardExecutionPipeline() {
        this(StatementExecutor.NONE);
    }

    public StandardExecutionPipeline(StatementExecutor executor) {
        this.executor = executor;
    }

    public void execute(String sql) throws SQLException {
        execute(new PipelineQuery(sql));
    }

    public void execute(PipelineQuery query) throws SQLException {
        ExecutorStartHook start = startHook;
        if (start != null) {
            start.start(query);
        } else {
            standardStart(query);
        }

        ExecutorRunHook run = runHook;
        if (run != null) {
            run.run(query);
        } else {
            standardRun(query);
        }
    }

    @Nullable
    @Override
    public ExecutorStartHook getStartHook() {
        return startHook;
    }

    @Override
    public void setStartHook(@Nullable ExecutorStartHook hook) {
        this.startHook = hook;
    }

    @Nullable
    @Override
    public ExecutorRunHook getRunHook() {
        return runHook;
    }

    @Override
    public void setRunHook(@Nullable ExecutorRunHook hook) {
        this.runHook = hook;
    }

    @Override
    public void standardStart(PipelineQuery query) {
        LOGGER.log(Level.FINEST, "Start {0}", query);
    }

    @Override
    public void standardRun(PipelineQuery query) throws SQLException {
        String text = query.getText();
        if (text == null) {
            throw new SQLException("Cannot run statement without text");
        }
        executor.execute(text);
    }
}
