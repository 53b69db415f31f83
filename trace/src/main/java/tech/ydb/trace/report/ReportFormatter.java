package tech.ydb.trace.report;

import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Objects;

import tech.ydb.trace.YdbTraceConst;
import tech.ydb.trace.context.TraceEntry;

/**
 * Renders captured records to the text of a trace report. Records are printed in the given order.
 */
public class ReportFormatter {
    private static final char NEW_LINE = '\n';

    private final DateTimeFormatter timestampFormatter;

    /**
     * @param timestampFormatter formatter of record timestamps, must have a zone
     */
    public ReportFormatter(DateTimeFormatter timestampFormatter) {
        this.timestampFormatter = Objects.requireNonNull(timestampFormatter);
    }

    public String format(List<TraceEntry> entries) {
        StringBuilder sb = new StringBuilder();
        sb.append(YdbTraceConst.REPORT_HEADER).append(NEW_LINE);
        sb.append(YdbTraceConst.REPORT_HEADER_LINE).append(NEW_LINE).append(NEW_LINE);

        int index = 0;
        for (TraceEntry entry: entries) {
            index++;
            sb.append(String.format(YdbTraceConst.REPORT_RECORD, index)).append(NEW_LINE);
            sb.append(YdbTraceConst.REPORT_RECORD_LINE).append(NEW_LINE);
            sb.append(YdbTraceConst.REPORT_ROUTINE).append(entry.getRoutineName()).append(NEW_LINE);
            sb.append(YdbTraceConst.REPORT_STATEMENT).append(entry.getStatementText()).append(NEW_LINE);
            sb.append(YdbTraceConst.REPORT_EXECUTED_AT)
                    .append(timestampFormatter.format(entry.getTimestamp()))
                    .append(NEW_LINE);
            sb.append(NEW_LINE);
        }

        if (index == 0) {
            sb.append(YdbTraceConst.REPORT_NO_RECORDS).append(NEW_LINE);
        } else {
            sb.append(String.format(YdbTraceConst.REPORT_TOTAL, index)).append(NEW_LINE);
        }

        return sb.toString();
    }
}
