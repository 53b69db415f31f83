package tech.ydb.trace.settings;

import java.sql.DriverPropertyInfo;
import java.sql.SQLException;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Objects;
import java.util.Properties;

import javax.annotation.Nullable;

/**
 * Option of the trace tool. The value is given either as text, converted on read, or as an object of the option
 * type.
 *
 * @param <T> type of the option value
 */
final class YdbTraceProperty<T> {
    @FunctionalInterface
    private interface Converter<T> {
        T convert(String text);
    }

    private final String name;
    private final String description;
    @Nullable
    private final String defaultText;
    private final Class<T> type;
    private final Converter<T> converter;

    private YdbTraceProperty(String name, String description, @Nullable String defaultText, Class<T> type,
            Converter<T> converter) {
        this.name = Objects.requireNonNull(name);
        this.description = Objects.requireNonNull(description);
        this.defaultText = defaultText;
        this.type = type;
        this.converter = converter;
    }

    String getName() {
        return name;
    }

    /**
     * @param props source options
     * @return value of the option, its default if the option is absent, or {@code null} if there is no default
     * @throws SQLException if the option cannot be converted to the option type
     */
    @Nullable
    T read(Properties props) throws SQLException {
        Object raw = props.get(name);
        if (raw == null) {
            return defaultText == null ? null : converter.convert(defaultText);
        }
        if (raw instanceof String) {
            try {
                return converter.convert((String) raw);
            } catch (RuntimeException e) {
                throw new SQLException("Unable to convert property " + name + ": " + e.getMessage(), e);
            }
        }
        if (!type.isInstance(raw)) {
            throw new SQLException("Invalid object property " + name + ", must be " + type + ", got "
                    + raw.getClass());
        }
        return type.cast(raw);
    }

    DriverPropertyInfo toInfo(Properties props) throws SQLException {
        read(props);
        Object raw = props.get(name);
        String text = raw != null ? raw.toString() : defaultText;

        DriverPropertyInfo info = new DriverPropertyInfo(name, text != null ? text : "");
        info.description = description;
        info.required = false;
        return info;
    }

    static YdbTraceProperty<String> text(String name, String description, String defaultText) {
        return new YdbTraceProperty<>(name, description, defaultText, String.class, v -> v);
    }

    static YdbTraceProperty<Boolean> flag(String name, String description, boolean defaultValue) {
        return new YdbTraceProperty<>(name, description, String.valueOf(defaultValue), Boolean.class,
                v -> Boolean.valueOf(v.trim()));
    }

    static YdbTraceProperty<ZoneId> zone(String name, String description) {
        return new YdbTraceProperty<>(name, description, null, ZoneId.class, v -> {
            try {
                return ZoneId.of(v.trim());
            } catch (DateTimeException e) {
                throw new IllegalArgumentException("Unable to parse value [" + v + "] as ZoneId: " + e.getMessage(),
                        e);
            }
        });
    }

    static YdbTraceProperty<DateTimeFormatter> formatter(String name, String description, String defaultPattern) {
        return new YdbTraceProperty<>(name, description, defaultPattern, DateTimeFormatter.class, v -> {
            try {
                return DateTimeFormatter.ofPattern(v);
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Unable to parse value [" + v
                        + "] as DateTimeFormatter pattern: " + e.getMessage(), e);
            }
        });
    }
}
