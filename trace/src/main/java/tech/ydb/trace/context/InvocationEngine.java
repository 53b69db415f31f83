package tech.ydb.trace.context;

import java.sql.SQLException;
import java.time.Clock;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

import tech.ydb.trace.YdbTraceConst;
import tech.ydb.trace.exception.YdbNullResultException;
import tech.ydb.trace.exception.YdbRoutineInvocationException;
import tech.ydb.trace.exception.YdbTraceException;
import tech.ydb.trace.pipeline.ExecutionPipeline;
import tech.ydb.trace.query.CallExpression;
import tech.ydb.trace.query.CallExpressionParser;
import tech.ydb.trace.report.ReportFormatter;
import tech.ydb.trace.routine.ArgumentCoercer;
import tech.ydb.trace.routine.RoutineDescriptor;
import tech.ydb.trace.routine.RoutineInvoker;
import tech.ydb.trace.routine.RoutineResolver;
import tech.ydb.trace.settings.YdbTraceConfig;

/**
 * Runs one routine call under trace: parse, resolve, coerce arguments, invoke and render the report.
 * <p>
 * Records and error messages name the routine by its resolved qualified name, e.g. {@code public.f} for a call of
 * {@code f(...)}.
 * <p>
 * Hooks are installed before parsing and put back on every exit path, before the record log and the active routine
 * name are released. Calls sharing a pipeline are serialized; a routine may call the engine again from the same
 * thread, the inner call chains to the outer hooks.
 */
public class InvocationEngine {
    private static final Logger LOGGER = Logger.getLogger(InvocationEngine.class.getName());

    private final ExecutionPipeline pipeline;
    private final RoutineResolver resolver;
    private final ArgumentCoercer coercer;
    private final RoutineInvoker invoker;
    private final ReportFormatter formatter;
    private final Clock clock;
    private final String unknownRoutineLabel;
    private final Level reportLevel;

    public InvocationEngine(ExecutionPipeline pipeline, RoutineResolver resolver, ArgumentCoercer coercer,
            RoutineInvoker invoker, YdbTraceConfig config, Clock clock) {
        this.pipeline = pipeline;
        this.resolver = resolver;
        this.coercer = coercer;
        this.invoker = invoker;
        this.formatter = new ReportFormatter(config.getTimestampFormatter());
        this.clock = clock;
        this.unknownRoutineLabel = config.getUnknownRoutineLabel();
        this.reportLevel = config.isLogReports() ? Level.INFO : Level.FINEST;
    }

    public String invoke(String call) throws SQLException {
        synchronized (pipeline) {
            return invokeLocked(call);
        }
    }

    private String invokeLocked(String call) throws SQLException {
        TraceLog log = new TraceLog();
        ActiveRoutineContext active = new ActiveRoutineContext();

        LOGGER.log(Level.FINE, "Tracing call [{0}]", call);
        try (TraceCollector collector = TraceCollector.install(pipeline, log, active, clock, unknownRoutineLabel)) {
            CallExpression expression = CallExpressionParser.parse(call);
            RoutineDescriptor routine = resolver.resolve(expression.getName(), expression.getArgumentsCount());

            active.set(routine.getName().toString());

            List<Object> arguments = coercer.coerceAll(routine, expression.getArguments());
            ArgumentCoercer.checkArity(arguments.size(), routine.getParametersCount());

            Object result = invokeRoutine(routine, arguments);
            if (result == null) {
                throw new YdbNullResultException(String.format(YdbTraceConst.ROUTINE_RETURNED_NULL,
                        routine.getName()));
            }

            String report = formatter.format(log.entries());
            LOGGER.log(Level.FINE, "Trace of {0} finished with {1} record(s)", new Object[] {
                routine.getName(), log.size()
            });
            LOGGER.log(reportLevel, "Trace report of [{0}]\n{1}", new Object[] {call, report});
            return report;
        } catch (YdbTraceException ex) {
            LOGGER.log(Level.FINE, "Trace of [{0}] failed with {1}: {2}", new Object[] {
                call, ex.getKind(), ex.getMessage()
            });
            throw ex;
        } finally {
            log.drain();
            active.clear();
        }
    }

    private Object invokeRoutine(RoutineDescriptor routine, List<Object> arguments) throws YdbTraceException {
        try {
            return invoker.invoke(routine, arguments);
        } catch (SQLException | RuntimeException ex) {
            throw invocationFailed(routine, ex);
        } catch (StackOverflowError | AssertionError ex) {
            throw invocationFailed(routine, ex);
        }
    }

    private static YdbRoutineInvocationException invocationFailed(RoutineDescriptor routine, Throwable cause) {
        String reason = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getName();
        String msg = String.format(YdbTraceConst.ROUTINE_EXECUTION_FAILED, routine.getName(), reason);
        return new YdbRoutineInvocationException(msg, cause);
    }
}
