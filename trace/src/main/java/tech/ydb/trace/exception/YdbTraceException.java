package tech.ydb.trace.exception;

import java.sql.SQLException;

public class YdbTraceException extends SQLException {
    private static final long serialVersionUID = -3102557961428011043L;

    private final TraceErrorKind kind;

    protected YdbTraceException(TraceErrorKind kind, String message) {
        super(message, kind.getSqlState());
        this.kind = kind;
    }

    protected YdbTraceException(TraceErrorKind kind, String message, Throwable cause) {
        super(message, kind.getSqlState(), cause);
        this.kind = kind;
    }

    public TraceErrorKind getKind() {
        return kind;
    }
}
