package tech.ydb.trace.routine;

import java.sql.SQLException;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

import tech.ydb.trace.YdbTraceConst;
import tech.ydb.trace.exception.YdbRoutineNotFoundException;
import tech.ydb.trace.query.QualifiedName;

/**
 * Resolves a routine call by name and count of arguments.
 */
public class RoutineResolver {
    private static final Logger LOGGER = Logger.getLogger(RoutineResolver.class.getName());

    private final RoutineCatalog catalog;

    public RoutineResolver(RoutineCatalog catalog) {
        this.catalog = catalog;
    }

    public RoutineDescriptor resolve(QualifiedName name, int argumentsCount) throws SQLException {
        List<RoutineDescriptor> candidates = catalog.lookup(name, argumentsCount);

        if (candidates.isEmpty()) {
            throw new YdbRoutineNotFoundException(String.format(YdbTraceConst.ROUTINE_NOT_FOUND,
                    name, argumentsCount));
        }

        // overloads with the same arity cannot be told apart until literals are typed
        if (candidates.size() > 1) {
            throw new YdbRoutineNotFoundException(String.format(YdbTraceConst.ROUTINE_NOT_UNIQUE,
                    name, argumentsCount, candidates));
        }

        RoutineDescriptor routine = candidates.get(0);
        LOGGER.log(Level.FINE, "Resolved {0} with {1} argument(s) to {2}", new Object[] {
            name, argumentsCount, routine
        });
        return routine;
    }
}
