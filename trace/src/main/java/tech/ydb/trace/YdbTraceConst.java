package tech.ydb.trace;

public final class YdbTraceConst {

    // Call syntax
    public static final char CALL_ARGS_OPEN = '(';
    public static final char CALL_ARGS_CLOSE = ')';
    public static final char CALL_ARGS_SEPARATOR = ',';
    public static final char NAME_SEPARATOR = '.';
    public static final char QUOTED_NAME = '"';

    public static final String DEFAULT_SCHEMA = "public";
    public static final String UNKNOWN_ROUTINE_LABEL = "Unknown";

    // Report layout
    public static final String REPORT_HEADER = "Routine execution trace report";
    public static final String REPORT_HEADER_LINE = "==============================";
    public static final String REPORT_RECORD = "Record #%d:";
    public static final String REPORT_RECORD_LINE = "----------------";
    public static final String REPORT_ROUTINE = "Routine: ";
    public static final String REPORT_STATEMENT = "Statement: ";
    public static final String REPORT_EXECUTED_AT = "Executed at: ";
    public static final String REPORT_NO_RECORDS = "No execution records found";
    public static final String REPORT_TOTAL = "Total records: %d";
    public static final String DEFAULT_TIMESTAMP_PATTERN = "yyyy-MM-dd HH:mm:ss.SSSSSSx";

    // Messages
    public static final String CALL_IS_NULL = "Routine call cannot be NULL";
    public static final String INVALID_CALL_SYNTAX = "Invalid routine call syntax: ";
    public static final String MISSING_OPEN_PARENTHESIS = INVALID_CALL_SYNTAX + "missing opening parenthesis";
    public static final String MISSING_CLOSE_PARENTHESIS = INVALID_CALL_SYNTAX + "missing closing parenthesis";
    public static final String INVALID_ROUTINE_NAME = INVALID_CALL_SYNTAX + "invalid routine name [%s]";

    public static final String ROUTINE_NOT_FOUND = "Routine %s with %d argument(s) does not exist";
    public static final String ROUTINE_NOT_UNIQUE = "Routine %s with %d argument(s) is not unique, candidates: %s";

    public static final String NO_INPUT_FUNCTION = "No input function available for type %s";
    public static final String INVALID_LITERAL = "Invalid input syntax for type %s: %s";
    public static final String ROUTINE_HAS_NO_ARGUMENT = "Routine %s does not have %d arguments";
    public static final String WRONG_ARGUMENTS_COUNT = "Wrong number of arguments: got %d, expected %d";

    public static final String ROUTINE_EXECUTION_FAILED = "Routine %s execution failed: %s";
    public static final String ROUTINE_RETURNED_NULL = "Routine %s returned no value";

    private YdbTraceConst() {
        //
    }
}
