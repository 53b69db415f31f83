package tech.ydb.trace.exception;

public class YdbRoutineInvocationException extends YdbTraceException {
    private static final long serialVersionUID = 8813694221560094733L;

    public YdbRoutineInvocationException(String message, Throwable cause) {
        super(TraceErrorKind.INVOCATION, message, cause);
    }
}
