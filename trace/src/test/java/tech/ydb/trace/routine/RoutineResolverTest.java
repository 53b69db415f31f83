package tech.ydb.trace.routine;

import java.sql.SQLException;
import java.util.Arrays;
import java.util.Collections;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import tech.ydb.trace.exception.TraceErrorKind;
import tech.ydb.trace.exception.YdbRoutineNotFoundException;
import tech.ydb.trace.helper.ExceptionAssert;
import tech.ydb.trace.query.QualifiedName;

public class RoutineResolverTest {
    private static final RoutineDescriptor ONE = new RoutineDescriptor(1, QualifiedName.of("public", "f"),
            Arrays.asList("Int32"));
    private static final RoutineDescriptor TWO = new RoutineDescriptor(2, QualifiedName.of("public", "f"),
            Arrays.asList("Text"));

    @Test
    public void resolveTest() throws SQLException {
        RoutineResolver resolver = new RoutineResolver((name, count) -> {
            Assertions.assertEquals(QualifiedName.of("f"), name);
            Assertions.assertEquals(1, count);
            return Collections.singletonList(ONE);
        });

        Assertions.assertSame(ONE, resolver.resolve(QualifiedName.of("f"), 1));
    }

    @Test
    public void notFoundTest() {
        RoutineResolver resolver = new RoutineResolver((name, count) -> Collections.emptyList());

        ExceptionAssert.traceException(YdbRoutineNotFoundException.class, TraceErrorKind.RESOLUTION,
                "Routine s.missing with 2 argument(s) does not exist",
                () -> resolver.resolve(QualifiedName.of("s", "missing"), 2));
    }

    @Test
    public void overloadedByTypeTest() {
        RoutineResolver resolver = new RoutineResolver((name, count) -> Arrays.asList(ONE, TWO));

        ExceptionAssert.traceExceptionContains(YdbRoutineNotFoundException.class, TraceErrorKind.RESOLUTION,
                "Routine f with 1 argument(s) is not unique, candidates: [public.f(Int32)#1, public.f(Text)#2]",
                () -> resolver.resolve(QualifiedName.of("f"), 1));
    }

    @Test
    public void catalogErrorTest() {
        SQLException failure = new SQLException("catalog is unavailable");
        RoutineResolver resolver = new RoutineResolver((name, count) -> {
            throw failure;
        });

        SQLException ex = Assertions.assertThrows(SQLException.class, () -> resolver.resolve(QualifiedName.of("f"), 0));
        Assertions.assertSame(failure, ex);
    }
}
