package tech.ydb.trace.exception;

public class YdbLiteralConversionException extends YdbTraceException {
    private static final long serialVersionUID = 6649260531093771054L;

    private final String typeName;
    private final String literal;

    public YdbLiteralConversionException(String message, String typeName, String literal, Throwable cause) {
        super(TraceErrorKind.LITERAL_CONVERSION, message, cause);
        this.typeName = typeName;
        this.literal = literal;
    }

    public String getTypeName() {
        return typeName;
    }

    public String getLiteral() {
        return literal;
    }
}
