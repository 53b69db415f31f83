package tech.ydb.trace.context;

import javax.annotation.Nullable;

/**
 * Name of the routine currently under trace.
 */
public class ActiveRoutineContext {
    @Nullable
    private String routineName = null;

    public void set(String name) {
        this.routineName = name;
    }

    public void clear() {
        this.routineName = null;
    }

    public String getOrDefault(String label) {
        return routineName != null ? routineName : label;
    }
}
