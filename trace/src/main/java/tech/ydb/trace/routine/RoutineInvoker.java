package tech.ydb.trace.routine;

import java.sql.SQLException;
import java.util.List;

import javax.annotation.Nullable;

public interface RoutineInvoker {
    /**
     * Executes the routine with positional arguments.
     *
     * @param routine resolved routine
     * @param arguments typed arguments, one per routine parameter
     * @return routine result or {@code null} if the routine produced no value
     * @throws SQLException if the routine failed
     */
    @Nullable
    Object invoke(RoutineDescriptor routine, List<Object> arguments) throws SQLException;
}
