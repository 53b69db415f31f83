package tech.ydb.trace.query;

import java.util.List;
import java.util.Objects;

import com.google.common.collect.ImmutableList;

/**
 * Parsed form of {@code name(literal, literal, ...)}: the routine name and its raw literal tokens in call order.
 */
public final class CallExpression {
    private final QualifiedName name;
    private final List<String> arguments;

    public CallExpression(QualifiedName name, List<String> arguments) {
        this.name = Objects.requireNonNull(name);
        this.arguments = ImmutableList.copyOf(arguments);
    }

    public QualifiedName getName() {
        return name;
    }

    public List<String> getArguments() {
        return arguments;
    }

    public int getArgumentsCount() {
        return arguments.size();
    }

    @Override
    public String toString() {
        return name + arguments.toString();
    }
}
