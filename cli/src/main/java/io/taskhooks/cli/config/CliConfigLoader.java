package io.taskhooks.cli.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.DoubleConsumer;
import java.util.function.Function;
import java.util.function.IntConsumer;
import java.util.function.LongConsumer;

/**
 * Loads {@link CliConfig} from {@code taskhooks.yaml} with an environment variable overlay.
 *
 * <p>
 * The file is optional when it is the default one; a path given with {@code --config} must
 * exist. Missing keys receive the defaults from {@link CliConfig.Builder}.
 *
 * <pre>
 * project:
 *   root: .
 *   tasks-dir: backlog/tasks
 *   tracked-prefix: task
 *   terminal-status: Done
 * hooks:
 *   config: .taskhooks/hooks/hooks.yaml
 *   scripts-dir: .taskhooks/hooks
 *   passthrough-env: [PATH, HOME, USER, LANG, LC_ALL]
 *   termination-grace-ms: 5000
 *   max-output-bytes: 1048576
 * audit:
 *   file: .taskhooks/audit/audit.log
 *   max-bytes: 10485760
 *   max-generations: 5
 * metrics:
 *   dir: .taskhooks/metrics
 *   period-minutes: 60
 * health:
 *   min-success-rate: 0.95
 *   near-timeout-ratio: 0.8
 * logging:
 *   format: text
 *   level: WARN
 * </pre>
 *
 * <p>
 * Every key can be overridden by a {@code TASKHOOKS_*} environment variable, which takes
 * precedence over the file. A variable counts as set only if it is defined and non-blank after
 * trimming.
 */
public final class CliConfigLoader {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    static final String DEFAULT_CONFIG_FILE = "taskhooks.yaml";
    static final String ENV_PREFIX = "TASKHOOKS_";

    private CliConfigLoader() {
        // utility class
    }

    /**
     * Loads configuration from the given file using {@link System#getenv} for overrides.
     *
     * @param configPath path to the YAML file
     * @param required   when true a missing file is an error, otherwise defaults apply
     */
    public static CliConfig load(Path configPath, boolean required) {
        return load(configPath, required, System::getenv);
    }

    /**
     * Loads configuration with an explicit environment lookup.
     *
     * @throws CliConfigException if a required file is missing or the YAML is invalid
     */
    public static CliConfig load(Path configPath, boolean required, Function<String, String> envLookup) {
        CliConfig.Builder builder = CliConfig.builder();
        if (Files.exists(configPath)) {
            try (InputStream in = Files.newInputStream(configPath)) {
                JsonNode root = YAML_MAPPER.readTree(in);
                if (root != null && root.isObject()) {
                    mapYaml(root, builder);
                } else if (root != null && !root.isMissingNode() && !root.isNull()) {
                    throw new CliConfigException("Configuration root must be a mapping: " + configPath);
                }
            } catch (CliConfigException e) {
                throw e;
            } catch (IOException e) {
                throw new CliConfigException("Failed to parse YAML configuration: " + configPath, e);
            } catch (RuntimeException e) {
                throw new CliConfigException("Failed to load configuration from: " + configPath, e);
            }
        } else if (required) {
            throw new CliConfigException(
                    "Configuration file not found: " + configPath + ". Use --config <path> to specify a config file.");
        }
        try {
            applyEnvOverrides(builder, envLookup);
        } catch (NumberFormatException e) {
            throw new CliConfigException("Invalid numeric value in " + ENV_PREFIX + "* environment variable", e);
        }
        return builder.build();
    }

    /**
     * Resolves the config file path from CLI arguments.
     *
     * @return the {@code --config} value, or the default file name
     */
    public static Path resolveConfigPath(String[] args) {
        for (int i = 0; i < args.length; i++) {
            if ("--config".equals(args[i])) {
                if (i + 1 >= args.length) {
                    throw new IllegalArgumentException("--config requires a file path argument");
                }
                return Path.of(args[i + 1]);
            }
        }
        return Path.of(DEFAULT_CONFIG_FILE);
    }

    /** True if {@code --config} was given explicitly. */
    public static boolean hasExplicitConfig(String[] args) {
        return Arrays.asList(args).contains("--config");
    }

    private static void mapYaml(JsonNode root, CliConfig.Builder builder) {
        JsonNode project = root.path("project");
        if (project.has("root")) builder.projectRoot(project.get("root").asText());
        if (project.has("tasks-dir")) builder.tasksDir(project.get("tasks-dir").asText());
        if (project.has("tracked-prefix")) builder.trackedPrefix(project.get("tracked-prefix").asText());
        if (project.has("terminal-status")) builder.terminalStatus(project.get("terminal-status").asText());

        JsonNode hooks = root.path("hooks");
        if (hooks.has("config")) builder.hooksConfig(hooks.get("config").asText());
        if (hooks.has("scripts-dir")) builder.scriptsDir(hooks.get("scripts-dir").asText());
        if (hooks.has("passthrough-env")) builder.passthroughEnv(stringList(hooks.get("passthrough-env")));
        if (hooks.has("termination-grace-ms"))
            builder.terminationGraceMs(requireNumber(hooks, "termination-grace-ms").asLong());
        if (hooks.has("max-output-bytes"))
            builder.maxOutputBytes(requireNumber(hooks, "max-output-bytes").asInt());

        JsonNode audit = root.path("audit");
        if (audit.has("file")) builder.auditFile(audit.get("file").asText());
        if (audit.has("max-bytes")) builder.auditMaxBytes(requireNumber(audit, "max-bytes").asLong());
        if (audit.has("max-generations"))
            builder.auditMaxGenerations(requireNumber(audit, "max-generations").asInt());

        JsonNode metrics = root.path("metrics");
        if (metrics.has("dir")) builder.metricsDir(metrics.get("dir").asText());
        if (metrics.has("period-minutes"))
            builder.metricsPeriodMinutes(requireNumber(metrics, "period-minutes").asInt());

        JsonNode health = root.path("health");
        if (health.has("min-success-rate"))
            builder.minSuccessRate(requireNumber(health, "min-success-rate").asDouble());
        if (health.has("near-timeout-ratio"))
            builder.nearTimeoutRatio(requireNumber(health, "near-timeout-ratio").asDouble());

        JsonNode logging = root.path("logging");
        if (logging.has("format")) builder.loggingFormat(logging.get("format").asText());
        if (logging.has("level")) builder.loggingLevel(logging.get("level").asText());
    }

    private static void applyEnvOverrides(CliConfig.Builder builder, Function<String, String> envLookup) {
        envString(envLookup, "PROJECT_ROOT", builder::projectRoot);
        envString(envLookup, "TASKS_DIR", builder::tasksDir);
        envString(envLookup, "TRACKED_PREFIX", builder::trackedPrefix);
        envString(envLookup, "TERMINAL_STATUS", builder::terminalStatus);
        envString(envLookup, "HOOKS_CONFIG", builder::hooksConfig);
        envString(envLookup, "SCRIPTS_DIR", builder::scriptsDir);
        envString(envLookup, "PASSTHROUGH_ENV", value -> builder.passthroughEnv(commaList(value)));
        envString(envLookup, "AUDIT_FILE", builder::auditFile);
        envString(envLookup, "METRICS_DIR", builder::metricsDir);
        envString(envLookup, "LOG_FORMAT", builder::loggingFormat);
        envString(envLookup, "LOG_LEVEL", builder::loggingLevel);

        envLong(envLookup, "TERMINATION_GRACE_MS", builder::terminationGraceMs);
        envInt(envLookup, "MAX_OUTPUT_BYTES", builder::maxOutputBytes);
        envLong(envLookup, "AUDIT_MAX_BYTES", builder::auditMaxBytes);
        envInt(envLookup, "AUDIT_MAX_GENERATIONS", builder::auditMaxGenerations);
        envInt(envLookup, "METRICS_PERIOD_MINUTES", builder::metricsPeriodMinutes);

        envDouble(envLookup, "MIN_SUCCESS_RATE", builder::minSuccessRate);
        envDouble(envLookup, "NEAR_TIMEOUT_RATIO", builder::nearTimeoutRatio);
    }

    // --- Env var helpers ---

    /** Returns {@code true} if the env var is defined and non-blank after trimming. */
    private static boolean isSet(Function<String, String> envLookup, String name) {
        String value = envLookup.apply(ENV_PREFIX + name);
        return value != null && !value.trim().isEmpty();
    }

    private static String value(Function<String, String> envLookup, String name) {
        return envLookup.apply(ENV_PREFIX + name).trim();
    }

    private static void envString(Function<String, String> envLookup, String name, Consumer<String> setter) {
        if (isSet(envLookup, name)) {
            setter.accept(value(envLookup, name));
        }
    }

    private static void envInt(Function<String, String> envLookup, String name, IntConsumer setter) {
        if (isSet(envLookup, name)) {
            setter.accept(Integer.parseInt(value(envLookup, name)));
        }
    }

    private static void envLong(Function<String, String> envLookup, String name, LongConsumer setter) {
        if (isSet(envLookup, name)) {
            setter.accept(Long.parseLong(value(envLookup, name)));
        }
    }

    private static void envDouble(Function<String, String> envLookup, String name, DoubleConsumer setter) {
        if (isSet(envLookup, name)) {
            setter.accept(Double.parseDouble(value(envLookup, name)));
        }
    }

    // --- YAML helpers ---

    private static JsonNode requireNumber(JsonNode section, String field) {
        JsonNode node = section.get(field);
        if (!node.isNumber()) {
            throw new CliConfigException("Configuration key '" + field + "' must be a number, got: " + node);
        }
        return node;
    }

    private static List<String> stringList(JsonNode node) {
        if (node.isArray()) {
            List<String> values = new ArrayList<>();
            node.forEach(item -> values.add(item.asText()));
            return values;
        }
        return commaList(node.asText());
    }

    private static List<String> commaList(String value) {
        List<String> values = new ArrayList<>();
        for (String part : value.split(",")) {
            if (!part.isBlank()) {
                values.add(part.trim());
            }
        }
        return values;
    }
}
