package tech.ydb.trace.routine;

import java.util.List;
import java.util.Objects;

import com.google.common.collect.ImmutableList;

import tech.ydb.trace.query.QualifiedName;

public final class RoutineDescriptor {
    private final long id;
    private final QualifiedName name;
    private final List<String> parameterTypes;

    public RoutineDescriptor(long id, QualifiedName name, List<String> parameterTypes) {
        this.id = id;
        this.name = Objects.requireNonNull(name);
        this.parameterTypes = ImmutableList.copyOf(parameterTypes);
    }

    public long getId() {
        return id;
    }

    public QualifiedName getName() {
        return name;
    }

    public List<String> getParameterTypes() {
        return parameterTypes;
    }

    public int getParametersCount() {
        return parameterTypes.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RoutineDescriptor)) {
            return false;
        }
        RoutineDescriptor that = (RoutineDescriptor) o;
        return id == that.id && name.equals(that.name) && parameterTypes.equals(that.parameterTypes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, parameterTypes);
    }

    @Override
    public String toString() {
        return name + "(" + String.join(", ", parameterTypes) + ")#" + id;
    }
}
