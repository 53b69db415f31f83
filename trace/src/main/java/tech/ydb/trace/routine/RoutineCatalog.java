package tech.ydb.trace.routine;

import java.sql.SQLException;
import java.util.List;

import tech.ydb.trace.query.QualifiedName;

/**
 * Name and arity lookup of stored routines.
 */
public interface RoutineCatalog {
    /**
     * Finds routines by name and count of parameters. Parameter types are not taken into account.
     *
     * @param name routine name, the schema may be absent
     * @param argumentsCount count of arguments in the call
     * @return all matched routines, empty list if nothing is found
     * @throws SQLException if the catalog cannot be read
     */
    List<RoutineDescriptor> lookup(QualifiedName name, int argumentsCount) throws SQLException;
}
