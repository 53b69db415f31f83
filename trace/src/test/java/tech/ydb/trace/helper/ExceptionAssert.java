package tech.ydb.trace.helper;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.function.Executable;

import tech.ydb.trace.exception.TraceErrorKind;
import tech.ydb.trace.exception.YdbTraceException;

public class ExceptionAssert {
    private ExceptionAssert() { }

    public static <T extends YdbTraceException> T traceException(Class<T> clazz, TraceErrorKind kind,
            String message, Executable exec) {
        T ex = Assertions.assertThrows(clazz, exec, "Invalid call must throw " + clazz.getSimpleName());
        Assertions.assertEquals(kind, ex.getKind());
        Assertions.assertEquals(kind.getSqlState(), ex.getSQLState());
        Assertions.assertEquals(message, ex.getMessage());
        return ex;
    }

    public static <T extends YdbTraceException> T traceExceptionContains(Class<T> clazz, TraceErrorKind kind,
            String message, Executable exec) {
        T ex = Assertions.assertThrows(clazz, exec, "Invalid call must throw " + clazz.getSimpleName());
        Assertions.assertEquals(kind, ex.getKind());
        Assertions.assertTrue(ex.getMessage().contains(message),
                clazz.getSimpleName() + " '" + ex.getMessage() + "' doesn't contain message '" + message + "'");
        return ex;
    }
}
