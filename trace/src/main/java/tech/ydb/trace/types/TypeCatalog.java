package tech.ydb.trace.types;

import javax.annotation.Nullable;

public interface TypeCatalog {
    /**
     * Looks up the input function of a type.
     *
     * @param typeName declared parameter type
     * @return literal parser of the type or {@code null} if the type has no input function
     */
    @Nullable
    LiteralParser findParser(String typeName);
}
