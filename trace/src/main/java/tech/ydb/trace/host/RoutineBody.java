package tech.ydb.trace.host;

import java.sql.SQLException;

import javax.annotation.Nullable;

/**
 * Implementation of a routine registered in {@link InMemoryRoutineCatalog}.
 */
@FunctionalInterface
public interface RoutineBody {
    @Nullable
    Object call(RoutineCall call) throws SQLException;
}
