package tech.ydb.trace.query;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

import javax.annotation.Nullable;

import tech.ydb.trace.YdbTraceConst;
import tech.ydb.trace.exception.YdbCallSyntaxException;

/**
 * Routine name optionally prefixed by a schema. Unquoted parts are folded to lower case, double-quoted parts are
 * kept as written.
 */
public final class QualifiedName {
    @Nullable
    private final String schema;
    private final String name;

    private QualifiedName(@Nullable String schema, String name) {
        this.schema = schema;
        this.name = Objects.requireNonNull(name);
    }

    public static QualifiedName of(String name) {
        return new QualifiedName(null, name);
    }

    public static QualifiedName of(@Nullable String schema, String name) {
        return new QualifiedName(schema, name);
    }

    @Nullable
    public String getSchema() {
        return schema;
    }

    public String getName() {
        return name;
    }

    public boolean hasSchema() {
        return schema != null;
    }

    public QualifiedName withSchema(String newSchema) {
        return new QualifiedName(newSchema, name);
    }

    public static QualifiedName parse(String text) throws YdbCallSyntaxException {
        List<String> parts = new ArrayList<>(2);
        char[] chars = text.toCharArray();

        int i = skipWhitespaces(chars, 0);
        while (true) {
            if (i >= chars.length) {
                throw invalidName(text);
            }

            StringBuilder part = new StringBuilder();
            if (chars[i] == YdbTraceConst.QUOTED_NAME) {
                i = parseQuotedPart(chars, i, part, text);
            } else {
                i = parsePlainPart(chars, i, part);
            }

            if (part.length() == 0) {
                throw invalidName(text);
            }
            parts.add(part.toString());

            i = skipWhitespaces(chars, i);
            if (i >= chars.length) {
                break;
            }
            if (chars[i] != YdbTraceConst.NAME_SEPARATOR) {
                throw invalidName(text);
            }
            i = skipWhitespaces(chars, i + 1);
        }

        switch (parts.size()) {
            case 1:
                return new QualifiedName(null, parts.get(0));
            case 2:
                return new QualifiedName(parts.get(0), parts.get(1));
            default:
                throw invalidName(text);
        }
    }

    private static int parsePlainPart(char[] chars, int offset, StringBuilder part) {
        int i = offset;
        while (i < chars.length) {
            char ch = chars[i];
            if (ch == YdbTraceConst.NAME_SEPARATOR || ch == YdbTraceConst.QUOTED_NAME
                    || Character.isWhitespace(ch)) {
                break;
            }
            part.append(ch);
            i++;
        }
        String folded = part.toString().toLowerCase(Locale.ROOT);
        part.setLength(0);
        part.append(folded);
        return i;
    }

    private static int parseQuotedPart(char[] chars, int offset, StringBuilder part, String text)
            throws YdbCallSyntaxException {
        int i = offset + 1;
        while (i < chars.length) {
            char ch = chars[i];
            if (ch == YdbTraceConst.QUOTED_NAME) {
                // "" inside quotes is an escaped quote
                if (i + 1 < chars.length && chars[i + 1] == YdbTraceConst.QUOTED_NAME) {
                    part.append(ch);
                    i += 2;
                    continue;
                }
                return i + 1;
            }
            part.append(ch);
            i++;
        }
        throw invalidName(text);
    }

    private static int skipWhitespaces(char[] chars, int offset) {
        int i = offset;
        while (i < chars.length && Character.isWhitespace(chars[i])) {
            i++;
        }
        return i;
    }

    private static YdbCallSyntaxException invalidName(String text) {
        return new YdbCallSyntaxException(String.format(YdbTraceConst.INVALID_ROUTINE_NAME, text));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof QualifiedName)) {
            return false;
        }
        QualifiedName that = (QualifiedName) o;
        return Objects.equals(schema, that.schema) && name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(schema, name);
    }

    @Override
    public String toString() {
        return schema == null ? name : schema + YdbTraceConst.NAME_SEPARATOR + name;
    }
}
