package tech.ydb.trace.context;

import java.sql.SQLException;
import java.time.Clock;
import java.util.logging.Level;
import java.util.logging.Logger;

import tech.ydb.trace.pipeline.ExecutionPipeline;
import tech.ydb.trace.pipeline.PipelineQuery;

/**
 * Hooks of one traced call. Installed on creation, the previous hooks are put back by {@link #close()}.
 * <p>
 * The start hook records every started statement and passes it on, the run hook only passes statements on. Neither
 * changes how a statement is executed.
 */
public final class TraceCollector implements AutoCloseable {
    private static final Logger LOGGER = Logger.getLogger(TraceCollector.class.getName());

    private final ExecutionPipeline pipeline;
    private final HookChain previous;
    private final TraceLog log;
    private final ActiveRoutineContext routine;
    private final Clock clock;
    private final String unknownRoutineLabel;

    private boolean isInstalled = false;

    private TraceCollector(ExecutionPipeline pipeline, TraceLog log, ActiveRoutineContext routine, Clock clock,
            String unknownRoutineLabel) {
        this.pipeline = pipeline;
        this.previous = HookChain.capture(pipeline);
        this.log = log;
        this.routine = routine;
        this.clock = clock;
        this.unknownRoutineLabel = unknownRoutineLabel;
    }

    public static TraceCollector install(ExecutionPipeline pipeline, TraceLog log, ActiveRoutineContext routine,
            Clock clock, String unknownRoutineLabel) {
        TraceCollector collector = new TraceCollector(pipeline, log, routine, clock, unknownRoutineLabel);
        pipeline.setStartHook(collector::onStart);
        pipeline.setRunHook(collector::onRun);
        collector.isInstalled = true;
        return collector;
    }

    public HookChain getPrevious() {
        return previous;
    }

    public boolean isInstalled() {
        return isInstalled;
    }

    void onStart(PipelineQuery query) throws SQLException {
        String text = query.getText();
        if (text != null) {
            TraceEntry entry = new TraceEntry(routine.getOrDefault(unknownRoutineLabel), text, clock.instant());
            log.add(entry);
            LOGGER.log(Level.FINEST, "Captured {0}", entry);
        }
        previous.start(pipeline, query);
    }

    void onRun(PipelineQuery query) throws SQLException {
        previous.run(pipeline, query);
    }

    @Override
    public void close() {
        if (isInstalled) {
            previous.restore(pipeline);
            isInstalled = false;
        }
    }
}
