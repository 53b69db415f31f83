package tech.ydb.trace.context;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class TraceLogTest {
    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    @Test
    public void newestFirstTest() {
        TraceLog log = new TraceLog();
        Assertions.assertTrue(log.isEmpty());
        Assertions.assertTrue(log.entries().isEmpty());

        TraceEntry first = new TraceEntry("f", "SELECT 1", NOW);
        TraceEntry second = new TraceEntry("f", "SELECT 2", NOW.plusSeconds(1));
        TraceEntry third = new TraceEntry("g", "SELECT 3", NOW.plusSeconds(2));
        log.add(first);
        log.add(second);
        log.add(third);

        Assertions.assertFalse(log.isEmpty());
        Assertions.assertEquals(3, log.size());
        Assertions.assertEquals(Arrays.asList(third, second, first), log.entries());
    }

    @Test
    public void snapshotTest() {
        TraceLog log = new TraceLog();
        log.add(new TraceEntry("f", "SELECT 1", NOW));

        List<TraceEntry> snapshot = log.entries();
        log.add(new TraceEntry("f", "SELECT 2", NOW));

        Assertions.assertEquals(1, snapshot.size());
        Assertions.assertThrows(UnsupportedOperationException.class, () -> snapshot.clear());
    }

    @Test
    public void drainTest() {
        TraceLog log = new TraceLog();
        log.add(new TraceEntry("f", "SELECT 1", NOW));
        log.add(new TraceEntry("f", "SELECT 2", NOW));

        Assertions.assertEquals(2, log.drain());
        Assertions.assertTrue(log.isEmpty());
        Assertions.assertEquals(0, log.drain());
    }

    @Test
    public void entryTest() {
        TraceEntry entry = new TraceEntry("f", "SELECT 1", NOW);
        Assertions.assertEquals("f", entry.getRoutineName());
        Assertions.assertEquals("SELECT 1", entry.getStatementText());
        Assertions.assertEquals(NOW, entry.getTimestamp());
        Assertions.assertEquals(new TraceEntry("f", "SELECT 1", NOW), entry);
        Assertions.assertNotEquals(new TraceEntry("g", "SELECT 1", NOW), entry);

        Assertions.assertThrows(NullPointerException.class, () -> new TraceEntry(null, "SELECT 1", NOW));
        Assertions.assertThrows(NullPointerException.class, () -> new TraceEntry("f", null, NOW));
    }
}
