package tech.ydb.trace.exception;

public class YdbNullResultException extends YdbTraceException {
    private static final long serialVersionUID = -7485136626003420517L;

    public YdbNullResultException(String message) {
        super(TraceErrorKind.NULL_RESULT, message);
    }
}
