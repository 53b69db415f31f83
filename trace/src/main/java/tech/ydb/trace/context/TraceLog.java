package tech.ydb.trace.context;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * Records captured during one traced call, the most recently captured record first.
 */
public class TraceLog {
    private final Deque<TraceEntry> entries = new ArrayDeque<>();

    public void add(TraceEntry entry) {
        entries.addFirst(entry);
    }

    /**
     * @return snapshot of the records, newest first
     */
    public List<TraceEntry> entries() {
        return ImmutableList.copyOf(entries);
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /**
     * Releases all records.
     *
     * @return count of released records
     */
    public int drain() {
        int count = entries.size();
        entries.clear();
        return count;
    }
}
