package tech.ydb.trace.host;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSet;

import tech.ydb.trace.types.LiteralParser;
import tech.ydb.trace.types.TypeCatalog;

/**
 * Input functions of primitive types. Type names are case insensitive.
 */
public class BuiltinTypeCatalog implements TypeCatalog {
    private static final ImmutableSet<String> TRUE_LITERALS = ImmutableSet.of("true", "t", "yes", "y", "on", "1");
    private static final ImmutableSet<String> FALSE_LITERALS = ImmutableSet.of("false", "f", "no", "n", "off", "0");

    private static final Pattern UUID_PATTERN = Pattern.compile(
            "[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}");

    private static final BigInteger UINT64_MAX = BigInteger.ONE.shiftLeft(64).subtract(BigInteger.ONE);

    private final Map<String, LiteralParser> parsers = new ConcurrentHashMap<>();

    public BuiltinTypeCatalog() {
        register("Bool", BuiltinTypeCatalog::parseBool);

        register("Int8", v -> Byte.valueOf(v.trim()));
        register("Int16", v -> Short.valueOf(v.trim()));
        register("Int32", v -> Integer.valueOf(v.trim()));
        register("Int64", v -> Long.valueOf(v.trim()));

        register("Uint8", v -> (int) parseUnsigned(v, 0xFFL));
        register("Uint16", v -> (int) parseUnsigned(v, 0xFFFFL));
        register("Uint32", v -> parseUnsigned(v, 0xFFFFFFFFL));
        register("Uint64", BuiltinTypeCatalog::parseUint64);

        register("Float", v -> Float.valueOf(v.trim()));
        register("Double", v -> Double.valueOf(v.trim()));
        register("Decimal", v -> new BigDecimal(v.trim()));

        register("Text", v -> v);
        register("Bytes", v -> v.getBytes(StandardCharsets.UTF_8));
        register("Uuid", BuiltinTypeCatalog::parseUuid);

        register("Date", v -> LocalDate.parse(v.trim()));
        register("Datetime", v -> LocalDateTime.parse(v.trim()));
        register("Timestamp", v -> Instant.parse(v.trim()));
        register("Interval", v -> Duration.parse(v.trim()));
    }

    /**
     * Adds a new type or replaces the input function of a known one.
     *
     * @param typeName name of type
     * @param parser input function
     * @return this catalog
     */
    public BuiltinTypeCatalog register(String typeName, LiteralParser parser) {
        Preconditions.checkNotNull(parser, "parser");
        parsers.put(key(typeName), parser);
        return this;
    }

    @Nullable
    @Override
    public LiteralParser findParser(String typeName) {
        return parsers.get(key(typeName));
    }

    private static String key(String typeName) {
        Preconditions.checkNotNull(typeName, "typeName");
        return typeName.trim().toLowerCase(Locale.ROOT);
    }

    private static Boolean parseBool(String literal) {
        String value = literal.trim().toLowerCase(Locale.ROOT);
        if (TRUE_LITERALS.contains(value)) {
            return Boolean.TRUE;
        }
        if (FALSE_LITERALS.contains(value)) {
            return Boolean.FALSE;
        }
        throw new IllegalArgumentException("not a boolean [" + literal + "]");
    }

    private static long parseUnsigned(String literal, long max) {
        long value = Long.parseLong(literal.trim());
        if (value < 0 || value > max) {
            throw new IllegalArgumentException("value " + value + " is out of range [0, " + max + "]");
        }
        return value;
    }

    private static BigInteger parseUint64(String literal) {
        BigInteger value = new BigInteger(literal.trim());
        if (value.signum() < 0 || value.compareTo(UINT64_MAX) > 0) {
            throw new IllegalArgumentException("value " + value + " is out of range [0, " + UINT64_MAX + "]");
        }
        return value;
    }

    private static UUID parseUuid(String literal) {
        String value = literal.trim();
        if (!UUID_PATTERN.matcher(value).matches()) {
            throw new IllegalArgumentException("not a UUID [" + literal + "]");
        }
        return UUID.fromString(value);
    }
}
