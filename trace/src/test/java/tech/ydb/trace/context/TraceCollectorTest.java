package tech.ydb.trace.context;

import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import tech.ydb.trace.helper.RecordingExecutor;
import tech.ydb.trace.host.StandardExecutionPipeline;
import tech.ydb.trace.pipeline.ExecutorRunHook;
import tech.ydb.trace.pipeline.ExecutorStartHook;
import tech.ydb.trace.pipeline.PipelineQuery;

public class TraceCollectorTest {
    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");
    private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

    private final RecordingExecutor executor = new RecordingExecutor();
    private final StandardExecutionPipeline pipeline = new StandardExecutionPipeline(executor);
    private final TraceLog log = new TraceLog();
    private final ActiveRoutineContext active = new ActiveRoutineContext();

    private TraceCollector install() {
        return TraceCollector.install(pipeline, log, active, CLOCK, "Unknown");
    }

    @Test
    public void installAndRestoreTest() throws SQLException {
        Assertions.assertNull(pipeline.getStartHook());
        Assertions.assertNull(pipeline.getRunHook());

        try (TraceCollector collector = install()) {
            Assertions.assertTrue(collector.isInstalled());
            Assertions.assertNotNull(pipeline.getStartHook());
            Assertions.assertNotNull(pipeline.getRunHook());
            Assertions.assertNull(collector.getPrevious().getStartHook());
            Assertions.assertNull(collector.getPrevious().getRunHook());

            active.set("f");
            pipeline.execute("SELECT 1");
        }

        Assertions.assertNull(pipeline.getStartHook());
        Assertions.assertNull(pipeline.getRunHook());
        Assertions.assertEquals(Collections.singletonList(new TraceEntry("f", "SELECT 1", NOW)), log.entries());
        executor.assertExecuted("SELECT 1");

        pipeline.execute("SELECT 2");
        Assertions.assertEquals(1, log.size());
        executor.assertExecuted("SELECT 2");
    }

    @Test
    public void closeIsIdempotentTest() {
        TraceCollector collector = install();
        collector.close();
        Assertions.assertFalse(collector.isInstalled());

        ExecutorStartHook later = query -> { };
        pipeline.setStartHook(later);
        collector.close();
        Assertions.assertSame(later, pipeline.getStartHook());
    }

    @Test
    public void chainsPreviousHooksTest() throws SQLException {
        List<String> calls = new ArrayList<>();
        ExecutorStartHook start = query -> {
            calls.add("start " + query.getText());
            pipeline.standardStart(query);
        };
        ExecutorRunHook run = query -> {
            calls.add("run " + query.getText());
            pipeline.standardRun(query);
        };
        pipeline.setStartHook(start);
        pipeline.setRunHook(run);

        try (TraceCollector collector = install()) {
            Assertions.assertSame(start, collector.getPrevious().getStartHook());
            Assertions.assertSame(run, collector.getPrevious().getRunHook());

            active.set("f");
            pipeline.execute("UPDATE t SET a = 1");
        }

        Assertions.assertEquals(Arrays.asList("start UPDATE t SET a = 1", "run UPDATE t SET a = 1"), calls);
        Assertions.assertSame(start, pipeline.getStartHook());
        Assertions.assertSame(run, pipeline.getRunHook());
        Assertions.assertEquals(1, log.size());
        executor.assertExecuted("UPDATE t SET a = 1");
    }

    @Test
    public void unknownRoutineTest() throws SQLException {
        try (TraceCollector collector = install()) {
            pipeline.execute("SELECT 1");
            active.set("f");
            pipeline.execute("SELECT 2");
        }

        Assertions.assertEquals(Arrays.asList(
                new TraceEntry("f", "SELECT 2", NOW),
                new TraceEntry("Unknown", "SELECT 1", NOW)
        ), log.entries());
    }

    @Test
    public void statementWithoutTextTest() throws SQLException {
        List<PipelineQuery> started = new ArrayList<>();
        pipeline.setStartHook(started::add);
        pipeline.setRunHook(query -> { });

        try (TraceCollector collector = install()) {
            active.set("f");
            pipeline.execute(new PipelineQuery(null));
        }

        Assertions.assertTrue(log.isEmpty());
        Assertions.assertEquals(1, started.size());
        Assertions.assertNull(started.get(0).getText());
    }

    @Test
    public void failedStatementIsRecordedTest() {
        try (TraceCollector collector = install()) {
            active.set("f");
            SQLException ex = Assertions.assertThrows(SQLException.class, () -> pipeline.execute("FAIL now"));
            Assertions.assertEquals("Statement failed: FAIL now", ex.getMessage());
        }

        Assertions.assertEquals(Collections.singletonList(new TraceEntry("f", "FAIL now", NOW)), log.entries());
        Assertions.assertNull(pipeline.getStartHook());
    }
}
