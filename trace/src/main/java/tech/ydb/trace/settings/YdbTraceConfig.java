package tech.ydb.trace.settings;

import java.sql.DriverPropertyInfo;
import java.sql.SQLException;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Objects;
import java.util.Properties;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;

import tech.ydb.trace.YdbTraceConst;


/**
 * Options of the trace tool, read from plain {@link Properties}.
 */
public class YdbTraceConfig {
    private static final Splitter SCHEMA_SPLITTER = Splitter.on(',').trimResults().omitEmptyStrings();

    static final YdbTraceProperty<String> UNKNOWN_ROUTINE_LABEL = YdbTraceProperty.text(
            "unknownRoutineLabel",
            "Routine name written to records captured while no routine is under trace",
            YdbTraceConst.UNKNOWN_ROUTINE_LABEL
    );
    static final YdbTraceProperty<DateTimeFormatter> REPORT_TIMESTAMP_PATTERN = YdbTraceProperty.formatter(
            "reportTimestampPattern",
            "DateTimeFormatter pattern used to print record timestamps in reports",
            YdbTraceConst.DEFAULT_TIMESTAMP_PATTERN
    );
    static final YdbTraceProperty<ZoneId> REPORT_ZONE_ID = YdbTraceProperty.zone(
            "reportZoneId",
            "Time zone used to print record timestamps in reports, system default if not set"
    );
    static final YdbTraceProperty<String> SEARCH_PATH = YdbTraceProperty.text(
            "searchPath",
            "Comma separated list of schemas used to resolve routine names without schema",
            YdbTraceConst.DEFAULT_SCHEMA
    );
    static final YdbTraceProperty<Boolean> LOG_REPORTS = YdbTraceProperty.flag(
            "logReports", "Log every rendered trace report with INFO level", false
    );

    private final Properties properties;

    private final String unknownRoutineLabel;
    private final DateTimeFormatter timestampFormatter;
    private final ZoneId zoneId;
    private final List<String> searchPath;
    private final boolean logReports;

    private YdbTraceConfig(Properties props) throws SQLException {
        this.properties = props;
        this.unknownRoutineLabel = UNKNOWN_ROUTINE_LABEL.read(props);

        ZoneId zone = REPORT_ZONE_ID.read(props);
        this.zoneId = zone != null ? zone : ZoneId.systemDefault();
        this.timestampFormatter = REPORT_TIMESTAMP_PATTERN.read(props).withZone(zoneId);

        this.searchPath = ImmutableList.copyOf(SCHEMA_SPLITTER.split(SEARCH_PATH.read(props)));
        if (searchPath.isEmpty()) {
            throw new SQLException("Property " + SEARCH_PATH.getName() + " must contain at least one schema");
        }
        this.logReports = LOG_REPORTS.read(props);
    }

    public String getUnknownRoutineLabel() {
        return unknownRoutineLabel;
    }

    public DateTimeFormatter getTimestampFormatter() {
        return timestampFormatter;
    }

    public ZoneId getZoneId() {
        return zoneId;
    }

    public List<String> getSearchPath() {
        return searchPath;
    }

    public boolean isLogReports() {
        return logReports;
    }

    public DriverPropertyInfo[] toPropertyInfo() throws SQLException {
        return new DriverPropertyInfo[] {
            UNKNOWN_ROUTINE_LABEL.toInfo(properties),
            REPORT_TIMESTAMP_PATTERN.toInfo(properties),
            REPORT_ZONE_ID.toInfo(properties),
            SEARCH_PATH.toInfo(properties),
            LOG_REPORTS.toInfo(properties),
        };
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof YdbTraceConfig)) {
            return false;
        }
        YdbTraceConfig that = (YdbTraceConfig) o;
        return Objects.equals(properties, that.properties);
    }

    @Override
    public int hashCode() {
        return Objects.hash(properties);
    }

    @Override
    public String toString() {
        return properties.toString();
    }

    public static YdbTraceConfig defaults() throws SQLException {
        return from(null);
    }

    public static YdbTraceConfig from(Properties origin) throws SQLException {
        Properties properties = new Properties();
        if (origin != null) {
            properties.putAll(origin);
        }
        return new YdbTraceConfig(properties);
    }
}
