package tech.ydb.trace.context;

import java.time.Instant;
import java.util.Objects;

/**
 * Statement start observed while a routine was under trace.
 */
public final class TraceEntry {
    private final String routineName;
    private final String statementText;
    private final Instant timestamp;

    public TraceEntry(String routineName, String statementText, Instant timestamp) {
        this.routineName = Objects.requireNonNull(routineName);
        this.statementText = Objects.requireNonNull(statementText);
        this.timestamp = Objects.requireNonNull(timestamp);
    }

    public String getRoutineName() {
        return routineName;
    }

    public String getStatementText() {
        return statementText;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TraceEntry)) {
            return false;
        }
        TraceEntry that = (TraceEntry) o;
        return routineName.equals(that.routineName)
                && statementText.equals(that.statementText)
                && timestamp.equals(that.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(routineName, statementText, timestamp);
    }

    @Override
    public String toString() {
        return "TraceEntry[" + routineName + ", " + statementText + ", " + timestamp + "]";
    }
}
