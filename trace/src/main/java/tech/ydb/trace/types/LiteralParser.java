package tech.ydb.trace.types;

/**
 * Input function of a type: builds a typed value from its textual literal.
 */
@FunctionalInterface
public interface LiteralParser {
    /**
     * Parses the literal.
     *
     * @param literal raw literal text as written in the routine call
     * @return typed value, never {@code null}
     * @throws IllegalArgumentException if the literal is not valid for the type, parsers may also throw other
     * runtime exceptions like {@link java.time.format.DateTimeParseException}
     */
    Object parse(String literal);
}
