package tech.ydb.trace.exception;

public class YdbArityException extends YdbTraceException {
    private static final long serialVersionUID = -5320917262140874818L;

    public YdbArityException(String message) {
        super(TraceErrorKind.ARITY, message);
    }
}
