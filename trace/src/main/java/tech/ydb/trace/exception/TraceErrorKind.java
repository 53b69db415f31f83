package tech.ydb.trace.exception;

/**
 * Stage of a traced call that produced an error. Every kind maps to a fixed SQLState.
 */
public enum TraceErrorKind {
    PARSE("42601"),
    RESOLUTION("42883"),
    ARGUMENT_TYPE("42804"),
    LITERAL_CONVERSION("22P02"),
    ARITY("42P13"),
    INVOCATION("39000"),
    NULL_RESULT("22004");

    private final String sqlState;

    TraceErrorKind(String sqlState) {
        this.sqlState = sqlState;
    }

    public String getSqlState() {
        return sqlState;
    }
}
