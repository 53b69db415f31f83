package tech.ydb.trace.exception;

public class YdbCallSyntaxException extends YdbTraceException {
    private static final long serialVersionUID = 4781263001238791290L;

    public YdbCallSyntaxException(String message) {
        super(TraceErrorKind.PARSE, message);
    }
}
