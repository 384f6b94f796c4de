package io.taskhooks.cli;

import io.taskhooks.cli.command.AuditCommand;
import io.taskhooks.cli.command.Command;
import io.taskhooks.cli.command.CommandContext;
import io.taskhooks.cli.command.EmitCommand;
import io.taskhooks.cli.command.ExitCodes;
import io.taskhooks.cli.command.HealthCommand;
import io.taskhooks.cli.command.InitCommand;
import io.taskhooks.cli.command.ListCommand;
import io.taskhooks.cli.command.MetricsCommand;
import io.taskhooks.cli.command.RunCommand;
import io.taskhooks.cli.command.TestCommand;
import io.taskhooks.cli.command.UsageException;
import io.taskhooks.cli.command.ValidateCommand;
import io.taskhooks.cli.config.CliConfig;
import io.taskhooks.cli.config.CliConfigException;
import io.taskhooks.cli.config.CliConfigLoader;
import io.taskhooks.cli.console.LogbackConfigurator;
import io.taskhooks.core.error.ConfigurationException;
import io.taskhooks.core.error.HookException;
import io.taskhooks.core.error.WorkItemStoreException;
import io.taskhooks.core.model.ToolInfo;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command-line front end: resolves {@code --config}, loads {@link CliConfig}, configures logging
 * and dispatches to a {@link Command}. Returns the process exit code instead of exiting, so it
 * can be driven from tests.
 */
public final class TaskHooksCli {

    private static final Logger LOG = LoggerFactory.getLogger(TaskHooksCli.class);

    private final Map<String, Command> commands = new LinkedHashMap<>();
    private final PrintStream out;
    private final PrintStream err;
    private final Function<String, String> environment;
    private final Function<CliConfig, CommandContext> contextFactory;
    private final boolean configureLogging;

    public TaskHooksCli(PrintStream out, PrintStream err) {
        this(out, err, System::getenv, config -> CommandContext.system(config, out, err), true);
    }

    TaskHooksCli(
            PrintStream out,
            PrintStream err,
            Function<String, String> environment,
            Function<CliConfig, CommandContext> contextFactory,
            boolean configureLogging) {
        this.out = Objects.requireNonNull(out, "out must not be null");
        this.err = Objects.requireNonNull(err, "err must not be null");
        this.environment = Objects.requireNonNull(environment, "environment must not be null");
        this.contextFactory = Objects.requireNonNull(contextFactory, "contextFactory must not be null");
        this.configureLogging = configureLogging;
        for (Command command : List.of(
                new RunCommand(),
                new EmitCommand(),
                new ValidateCommand(),
                new ListCommand(),
                new TestCommand(),
                new AuditCommand(),
                new MetricsCommand(),
                new HealthCommand(),
                new InitCommand())) {
            commands.put(command.name(), command);
        }
    }

    public int run(String[] args) {
        Path configPath;
        try {
            configPath = CliConfigLoader.resolveConfigPath(args);
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            return ExitCodes.FAILURE;
        }
        boolean explicitConfig = CliConfigLoader.hasExplicitConfig(args);
        List<String> remaining = withoutConfigOption(args);

        if (remaining.isEmpty()) {
            printUsage(err);
            return ExitCodes.FAILURE;
        }
        String name = remaining.get(0);
        if ("help".equals(name) || "--help".equals(name) || "-h".equals(name)) {
            printUsage(out);
            return ExitCodes.OK;
        }
        if ("--version".equals(name)) {
            out.println(ToolInfo.NAME + " " + ToolInfo.version());
            return ExitCodes.OK;
        }
        Command command = commands.get(name);
        if (command == null) {
            err.println("Unknown command: " + name);
            printUsage(err);
            return ExitCodes.FAILURE;
        }

        CliConfig config;
        try {
            config = CliConfigLoader.load(configPath, explicitConfig, environment);
        } catch (CliConfigException e) {
            err.println("Configuration error: " + e.getMessage());
            return ExitCodes.CONFIGURATION_ERROR;
        }
        if (configureLogging) {
            LogbackConfigurator.configure(config.loggingFormat(), config.loggingLevel());
        }

        CommandContext context = contextFactory.apply(config);
        try {
            return command.execute(remaining.subList(1, remaining.size()), context);
        } catch (UsageException e) {
            err.println(e.getMessage());
            err.println("usage: " + ToolInfo.NAME + " " + command.synopsis());
            return ExitCodes.FAILURE;
        } catch (ConfigurationException e) {
            err.println("Configuration error: " + e.getMessage());
            return ExitCodes.CONFIGURATION_ERROR;
        } catch (WorkItemStoreException e) {
            err.println("Cannot read work items at " + e.source() + ": " + e.getMessage());
            return ExitCodes.FAILURE;
        } catch (HookException e) {
            LOG.error("{} failed: {}", name, e.getMessage(), e);
            err.println(name + " failed: " + e.getMessage());
            return ExitCodes.FAILURE;
        }
    }

    private void printUsage(PrintStream stream) {
        stream.println("usage: " + ToolInfo.NAME + " [--config <file>] <command> [options]");
        stream.println();
        for (Command command : commands.values()) {
            stream.println("  " + command.synopsis());
        }
    }

    static List<String> withoutConfigOption(String[] args) {
        List<String> remaining = new ArrayList<>(Arrays.asList(args));
        int index = remaining.indexOf("--config");
        if (index >= 0) {
            remaining.remove(index);
            if (index < remaining.size()) {
                remaining.remove(index);
            }
        }
        return remaining;
    }
}
