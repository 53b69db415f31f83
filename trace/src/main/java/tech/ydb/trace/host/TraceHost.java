package tech.ydb.trace.host;

import java.util.Objects;

import tech.ydb.trace.pipeline.ExecutionPipeline;
import tech.ydb.trace.routine.RoutineCatalog;
import tech.ydb.trace.routine.RoutineInvoker;
import tech.ydb.trace.types.TypeCatalog;

/**
 * Services of the host environment required to trace routine calls.
 */
public final class TraceHost {
    private final RoutineCatalog routines;
    private final TypeCatalog types;
    private final ExecutionPipeline pipeline;
    private final RoutineInvoker invoker;

    public TraceHost(RoutineCatalog routines, TypeCatalog types, ExecutionPipeline pipeline, RoutineInvoker invoker) {
        this.routines = Objects.requireNonNull(routines);
        this.types = Objects.requireNonNull(types);
        this.pipeline = Objects.requireNonNull(pipeline);
        this.invoker = Objects.requireNonNull(invoker);
    }

    /**
     * Creates a host backed by an in-memory routine registry and the builtin types.
     *
     * @param catalog registry of routines
     * @return new host
     */
    public static TraceHost inMemory(InMemoryRoutineCatalog catalog) {
        return new TraceHost(catalog, new BuiltinTypeCatalog(), catalog.getPipeline(), catalog);
    }

    public RoutineCatalog getRoutines() {
        return routines;
    }

    public TypeCatalog getTypes() {
        return types;
    }

    public ExecutionPipeline getPipeline() {
        return pipeline;
    }

    public RoutineInvoker getInvoker() {
        return invoker;
    }
}
