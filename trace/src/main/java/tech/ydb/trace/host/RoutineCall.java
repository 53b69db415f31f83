package tech.ydb.trace.host;

import java.sql.SQLException;
import java.util.Arrays;
import java.util.List;

import javax.annotation.Nullable;

import com.google.common.collect.ImmutableList;

import tech.ydb.trace.routine.RoutineDescriptor;

/**
 * Arguments and execution facilities available to a running {@link RoutineBody}.
 */
public class RoutineCall {
    private final InMemoryRoutineCatalog catalog;
    private final RoutineDescriptor routine;
    private final List<Object> arguments;

    RoutineCall(InMemoryRoutineCatalog catalog, RoutineDescriptor routine, List<Object> arguments) {
        this.catalog = catalog;
        this.routine = routine;
        this.arguments = ImmutableList.copyOf(arguments);
    }

    public RoutineDescriptor getRoutine() {
        return routine;
    }

    public List<Object> getArguments() {
        return arguments;
    }

    public <T> T getArgument(int index, Class<T> clazz) {
        return clazz.cast(arguments.get(index));
    }

    /**
     * Runs a statement through the execution pipeline of the catalog.
     *
     * @param sql statement text
     * @throws SQLException if the statement failed
     */
    public void execute(String sql) throws SQLException {
        catalog.getPipeline().execute(sql);
    }

    /**
     * Calls another registered routine directly, without parsing or argument coercion.
     *
     * @param name routine name, resolved by the catalog search path
     * @param args typed arguments
     * @return result of the routine
     * @throws SQLException if routine is not found or failed
     */
    @Nullable
    public Object call(String name, Object... args) throws SQLException {
        return catalog.call(name, Arrays.asList(args));
    }
}
