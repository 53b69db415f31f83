package tech.ydb.trace.exception;

public class YdbRoutineNotFoundException extends YdbTraceException {
    private static final long serialVersionUID = -1739005274430164982L;

    public YdbRoutineNotFoundException(String message) {
        super(TraceErrorKind.RESOLUTION, message);
    }
}
