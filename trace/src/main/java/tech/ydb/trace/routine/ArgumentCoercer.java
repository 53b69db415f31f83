package tech.ydb.trace.routine;

import java.util.ArrayList;
import java.util.List;

import tech.ydb.trace.YdbTraceConst;
import tech.ydb.trace.exception.YdbArgumentTypeException;
import tech.ydb.trace.exception.YdbArityException;
import tech.ydb.trace.exception.YdbLiteralConversionException;
import tech.ydb.trace.exception.YdbTraceException;
import tech.ydb.trace.types.LiteralParser;
import tech.ydb.trace.types.TypeCatalog;

/**
 * Converts raw literals of a call into typed values using the input functions of the declared parameter types.
 */
public class ArgumentCoercer {
    private final TypeCatalog types;

    public ArgumentCoercer(TypeCatalog types) {
        this.types = types;
    }

    public Object coerce(RoutineDescriptor routine, int index, String literal) throws YdbTraceException {
        if (index >= routine.getParametersCount()) {
            throw new YdbArityException(String.format(YdbTraceConst.ROUTINE_HAS_NO_ARGUMENT,
                    routine.getName(), index + 1));
        }

        String typeName = routine.getParameterTypes().get(index);
        LiteralParser parser = types.findParser(typeName);
        if (parser == null) {
            throw new YdbArgumentTypeException(String.format(YdbTraceConst.NO_INPUT_FUNCTION, typeName), typeName);
        }

        try {
            Object value = parser.parse(literal);
            if (value == null) {
                throw new IllegalArgumentException("input function returned no value");
            }
            return value;
        } catch (RuntimeException ex) {
            String msg = String.format(YdbTraceConst.INVALID_LITERAL, typeName, literal);
            throw new YdbLiteralConversionException(msg, typeName, literal, ex);
        }
    }

    public List<Object> coerceAll(RoutineDescriptor routine, List<String> literals) throws YdbTraceException {
        checkArity(literals.size(), routine.getParametersCount());

        List<Object> values = new ArrayList<>(literals.size());
        for (int idx = 0; idx < literals.size(); idx++) {
            values.add(coerce(routine, idx, literals.get(idx)));
        }
        return values;
    }

    public static void checkArity(int got, int expected) throws YdbArityException {
        if (got != expected) {
            throw new YdbArityException(String.format(YdbTraceConst.WRONG_ARGUMENTS_COUNT, got, expected));
        }
    }
}
