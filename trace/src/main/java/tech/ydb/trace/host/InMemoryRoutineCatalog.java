package tech.ydb.trace.host;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

import javax.annotation.Nullable;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import tech.ydb.trace.YdbTraceConst;
import tech.ydb.trace.exception.YdbRoutineNotFoundException;
import tech.ydb.trace.query.QualifiedName;
import tech.ydb.trace.routine.RoutineCatalog;
import tech.ydb.trace.routine.RoutineDescriptor;
import tech.ydb.trace.routine.RoutineInvoker;

/**
 * Registry of routines implemented in Java. Names without schema are resolved by the search path, the first schema
 * containing a routine with the requested arity wins.
 */
public class InMemoryRoutineCatalog implements RoutineCatalog, RoutineInvoker {
    private static final Logger LOGGER = Logger.getLogger(InMemoryRoutineCatalog.class.getName());

    private static class Registered {
        private final RoutineDescriptor descriptor;
        private final RoutineBody body;

        Registered(RoutineDescriptor descriptor, RoutineBody body) {
            this.descriptor = descriptor;
            this.body = body;
        }
    }

    private final StandardExecutionPipeline pipeline;
    private final List<String> searchPath;
    private final AtomicLong idGenerator = new AtomicLong(0);
    private final Map<Long, Registered> routines = new ConcurrentSkipListMap<>();

    public InMemoryRoutineCatalog(StandardExecutionPipeline pipeline) {
        this(pipeline, ImmutableList.of(YdbTraceConst.DEFAULT_SCHEMA));
    }

    public InMemoryRoutineCatalog(StandardExecutionPipeline pipeline, List<String> searchPath) {
        Preconditions.checkArgument(!searchPath.isEmpty(), "search path must not be empty");
        this.pipeline = pipeline;
        this.searchPath = ImmutableList.copyOf(searchPath);
    }

    public StandardExecutionPipeline getPipeline() {
        return pipeline;
    }

    @VisibleForTesting
    List<String> getSearchPath() {
        return searchPath;
    }

    /**
     * Registers a new routine. A name without schema is placed into the first schema of the search path.
     *
     * @param name routine name, optionally qualified by schema
     * @param parameterTypes declared parameter types
     * @param body routine implementation
     * @return descriptor of the registered routine
     * @throws SQLException if the name is invalid
     */
    public RoutineDescriptor register(String name, List<String> parameterTypes, RoutineBody body)
            throws SQLException {
        Preconditions.checkNotNull(body, "body");
        QualifiedName parsed = QualifiedName.parse(name);
        if (!parsed.hasSchema()) {
            parsed = parsed.withSchema(searchPath.get(0));
        }

        RoutineDescriptor descriptor = new RoutineDescriptor(idGenerator.incrementAndGet(), parsed, parameterTypes);
        routines.put(descriptor.getId(), new Registered(descriptor, body));
        LOGGER.log(Level.FINE, "Registered routine {0}", descriptor);
        return descriptor;
    }

    public boolean unregister(RoutineDescriptor routine) {
        return routines.remove(routine.getId()) != null;
    }

    @Override
    public List<RoutineDescriptor> lookup(QualifiedName name, int argumentsCount) {
        if (name.hasSchema()) {
            return find(name, argumentsCount);
        }

        for (String schema: searchPath) {
            List<RoutineDescriptor> found = find(name.withSchema(schema), argumentsCount);
            if (!found.isEmpty()) {
                return found;
            }
        }
        return ImmutableList.of();
    }

    private List<RoutineDescriptor> find(QualifiedName name, int argumentsCount) {
        List<RoutineDescriptor> found = new ArrayList<>();
        for (Registered r: routines.values()) {
            if (r.descriptor.getName().equals(name) && r.descriptor.getParametersCount() == argumentsCount) {
                found.add(r.descriptor);
            }
        }
        return found;
    }

    @Nullable
    @Override
    public Object invoke(RoutineDescriptor routine, List<Object> arguments) throws SQLException {
        Registered registered = routines.get(routine.getId());
        if (registered == null) {
            throw new YdbRoutineNotFoundException(String.format(YdbTraceConst.ROUTINE_NOT_FOUND,
                    routine.getName(), arguments.size()));
        }
        return registered.body.call(new RoutineCall(this, registered.descriptor, arguments));
    }

    @Nullable
    Object call(String name, List<Object> arguments) throws SQLException {
        QualifiedName parsed = QualifiedName.parse(name);
        List<RoutineDescriptor> found = lookup(parsed, arguments.size());
        if (found.size() != 1) {
            String msg = found.isEmpty()
                    ? String.format(YdbTraceConst.ROUTINE_NOT_FOUND, parsed, arguments.size())
                    : String.format(YdbTraceConst.ROUTINE_NOT_UNIQUE, parsed, arguments.size(), found);
            throw new YdbRoutineNotFoundException(msg);
        }
        return invoke(found.get(0), arguments);
    }
}
