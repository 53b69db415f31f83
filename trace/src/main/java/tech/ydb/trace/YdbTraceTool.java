package tech.ydb.trace;

import java.sql.DriverPropertyInfo;
import java.sql.SQLException;
import java.time.Clock;
import java.util.Properties;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.google.common.annotations.VisibleForTesting;

import tech.ydb.trace.context.InvocationEngine;
import tech.ydb.trace.host.InMemoryRoutineCatalog;
import tech.ydb.trace.host.StandardExecutionPipeline;
import tech.ydb.trace.host.StatementExecutor;
import tech.ydb.trace.host.TraceHost;
import tech.ydb.trace.routine.ArgumentCoercer;
import tech.ydb.trace.routine.RoutineResolver;
import tech.ydb.trace.settings.YdbTraceConfig;


/**
 * Routine trace tool. {@link #trace(String)} invokes a routine given as {@code name(literal, ...)} and returns the
 * report of all statements started while the routine was running.
 * <pre>{@code
 * InMemoryRoutineCatalog catalog = YdbTraceTool.inMemoryCatalog(executor, config);
 * catalog.register("public.add_user", Arrays.asList("Text"), call -> {
 *     call.execute("INSERT INTO users VALUES ('" + call.getArgument(0, String.class) + "')");
 *     return 1;
 * });
 * String report = new YdbTraceTool(TraceHost.inMemory(catalog), config).trace("add_user(bob)");
 * }</pre>
 */
public class YdbTraceTool {
    private static final Logger LOGGER = Logger.getLogger(YdbTraceTool.class.getName());

    private final YdbTraceConfig config;
    private final InvocationEngine engine;

    public YdbTraceTool(TraceHost host, YdbTraceConfig config) {
        this(host, config, Clock.systemUTC());
    }

    @VisibleForTesting
    YdbTraceTool(TraceHost host, YdbTraceConfig config, Clock clock) {
        this.config = config;
        this.engine = new InvocationEngine(
                host.getPipeline(),
                new RoutineResolver(host.getRoutines()),
                new ArgumentCoercer(host.getTypes()),
                host.getInvoker(),
                config,
                clock
        );
        LOGGER.log(Level.FINE, "Trace tool created with properties {0}", config);
    }

    public static YdbTraceTool create(TraceHost host, Properties properties) throws SQLException {
        return new YdbTraceTool(host, YdbTraceConfig.from(properties));
    }

    /**
     * Creates a routine registry whose statements are passed to the given executor, names without schema are
     * resolved by the configured search path.
     *
     * @param executor executor of statements run by routines
     * @param config tool configuration
     * @return new empty registry
     */
    public static InMemoryRoutineCatalog inMemoryCatalog(StatementExecutor executor, YdbTraceConfig config) {
        return new InMemoryRoutineCatalog(new StandardExecutionPipeline(executor), config.getSearchPath());
    }

    /**
     * Invokes the routine and reports the statements it started, most recent first.
     *
     * @param call routine call in form {@code name(literal, literal, ...)}
     * @return text of the trace report
     * @throws SQLException {@link tech.ydb.trace.exception.YdbTraceException} describing the failed stage
     */
    public String trace(String call) throws SQLException {
        return engine.invoke(call);
    }

    public YdbTraceConfig getConfig() {
        return config;
    }

    public DriverPropertyInfo[] getPropertyInfo() throws SQLException {
        return config.toPropertyInfo();
    }
}
