package tech.ydb.trace.exception;

public class YdbArgumentTypeException extends YdbTraceException {
    private static final long serialVersionUID = 2207346150019826375L;

    private final String typeName;

    public YdbArgumentTypeException(String message, String typeName) {
        super(TraceErrorKind.ARGUMENT_TYPE, message);
        this.typeName = typeName;
    }

    public String getTypeName() {
        return typeName;
    }
}
