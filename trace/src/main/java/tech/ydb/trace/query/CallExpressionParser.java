package tech.ydb.trace.query;

import java.util.ArrayList;
import java.util.List;

import tech.ydb.trace.YdbTraceConst;
import tech.ydb.trace.exception.YdbCallSyntaxException;


/**
 * Splits a routine call like {@code schema.name(1, 'text')} into the qualified name and the raw argument literals.
 * <p>
 * Arguments are separated by every comma between the first opening and the last closing parenthesis; quotes and
 * nested parentheses are not taken into account, so a comma inside a quoted literal splits it. Each literal loses
 * its leading whitespace only, empty fragments between consecutive commas are dropped.
 */
public class CallExpressionParser {
    private CallExpressionParser() { }

    public static CallExpression parse(String call) throws YdbCallSyntaxException {
        if (call == null) {
            throw new YdbCallSyntaxException(YdbTraceConst.CALL_IS_NULL);
        }

        int argsStart = call.indexOf(YdbTraceConst.CALL_ARGS_OPEN);
        if (argsStart < 0) {
            throw new YdbCallSyntaxException(YdbTraceConst.MISSING_OPEN_PARENTHESIS);
        }

        int argsEnd = call.lastIndexOf(YdbTraceConst.CALL_ARGS_CLOSE);
        if (argsEnd < argsStart) {
            throw new YdbCallSyntaxException(YdbTraceConst.MISSING_CLOSE_PARENTHESIS);
        }

        QualifiedName name = QualifiedName.parse(call.substring(0, argsStart));
        List<String> arguments = splitArguments(call.toCharArray(), argsStart + 1, argsEnd);
        return new CallExpression(name, arguments);
    }

    static List<String> splitArguments(char[] chars, int from, int to) {
        List<String> tokens = new ArrayList<>();

        int tokenStart = from;
        for (int i = from; i <= to; i++) {
            if (i < to && chars[i] != YdbTraceConst.CALL_ARGS_SEPARATOR) {
                continue;
            }

            // empty fragments like in f(1,,2) are skipped
            if (i > tokenStart) {
                int start = tokenStart;
                while (start < i && Character.isWhitespace(chars[start])) {
                    start++;
                }
                tokens.add(new String(chars, start, i - start));
            }
            tokenStart = i + 1;
        }

        return tokens;
    }
}
