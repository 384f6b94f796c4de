package io.taskhooks.cli.command;

import io.taskhooks.cli.config.CliConfig;
import io.taskhooks.cli.git.GitWorkItemStore;
import io.taskhooks.core.audit.AuditLogReader;
import io.taskhooks.core.audit.JsonlAuditLog;
import io.taskhooks.core.event.EventFactory;
import io.taskhooks.core.exec.ExecutorSettings;
import io.taskhooks.core.exec.SandboxedExecutor;
import io.taskhooks.core.hook.HookRegistry;
import io.taskhooks.core.hook.HooksConfigParser;
import io.taskhooks.core.metrics.MetricsAggregator;
import io.taskhooks.core.metrics.MetricsService;
import io.taskhooks.core.metrics.MetricsStore;
import io.taskhooks.core.spi.WorkItemStore;
import java.io.PrintStream;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.function.Function;

/**
 * Configuration, output streams and component factories shared by all commands.
 *
 * <p>
 * Components are created per call; commands run once per process.
 */
public final class CommandContext {

    private final CliConfig config;
    private final PrintStream out;
    private final PrintStream err;
    private final Clock clock;
    private final Function<String, String> environment;
    private final Function<CliConfig, WorkItemStore> storeFactory;

    public CommandContext(
            CliConfig config,
            PrintStream out,
            PrintStream err,
            Clock clock,
            Function<String, String> environment,
            Function<CliConfig, WorkItemStore> storeFactory) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.out = Objects.requireNonNull(out, "out must not be null");
        this.err = Objects.requireNonNull(err, "err must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.environment = Objects.requireNonNull(environment, "environment must not be null");
        this.storeFactory = Objects.requireNonNull(storeFactory, "storeFactory must not be null");
    }

    /** Context using the system clock and environment and a git-backed store. */
    public static CommandContext system(CliConfig config, PrintStream out, PrintStream err) {
        return new CommandContext(
                config,
                out,
                err,
                Clock.systemUTC(),
                System::getenv,
                c -> new GitWorkItemStore(c.projectRootPath(), c.tasksDir()));
    }

    public CliConfig config() {
        return config;
    }

    public PrintStream out() {
        return out;
    }

    public PrintStream err() {
        return err;
    }

    public Clock clock() {
        return clock;
    }

    public Path projectRoot() {
        return config.projectRootPath();
    }

    public Path hooksFile() {
        return config.resolve(config.hooksConfig());
    }

    public HooksConfigParser parser() {
        return new HooksConfigParser();
    }

    /**
     * Loads the hooks configuration. A missing file is an empty registry.
     *
     * @throws io.taskhooks.core.error.ConfigurationException if the file is invalid
     */
    public HookRegistry loadRegistry() {
        return parser().load(hooksFile());
    }

    public ExecutorSettings executorSettings() {
        return ExecutorSettings.builder(projectRoot())
                .hooksDirectory(Path.of(config.scriptsDir()))
                .passthroughEnv(config.passthroughEnv())
                .maxOutputBytes(config.maxOutputBytes())
                .terminationGrace(Duration.ofMillis(config.terminationGraceMs()))
                .parentEnv(environment)
                .build();
    }

    public SandboxedExecutor executor() {
        return new SandboxedExecutor(executorSettings());
    }

    public JsonlAuditLog auditLog() {
        return new JsonlAuditLog(
                config.resolve(config.auditFile()), config.auditMaxBytes(), config.auditMaxGenerations());
    }

    public AuditLogReader auditReader() {
        return new AuditLogReader(config.resolve(config.auditFile()), config.auditMaxGenerations());
    }

    public MetricsService metricsService() {
        return new MetricsService(
                auditReader(),
                new MetricsAggregator(Duration.ofMinutes(config.metricsPeriodMinutes())),
                new MetricsStore(config.resolve(config.metricsDir()), clock),
                clock);
    }

    public EventFactory eventFactory() {
        return new EventFactory(projectRoot().toString(), clock);
    }

    public WorkItemStore workItemStore() {
        return storeFactory.apply(config);
    }
}
