package io.taskhooks.core.hook;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import io.taskhooks.core.error.ConfigurationException;
import io.taskhooks.core.model.ContextFilter;
import io.taskhooks.core.model.EventMatcher;
import io.taskhooks.core.model.EventPattern;
import io.taskhooks.core.model.FailMode;
import io.taskhooks.core.model.HookAction;
import io.taskhooks.core.model.HookDefinition;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses {@code hooks.yaml} into a {@link HookRegistry}.
 *
 * <p>
 * The document is first validated against the bundled JSON Schema
 * ({@code schema/hooks-config.schema.json}), then checked for rules the schema cannot express:
 * unique hook names, exactly one action per hook and well-formed event patterns. All problems are
 * collected and reported together in one {@link ConfigurationException}.
 *
 * <pre>
 * version: "1.0"
 * defaults:
 *   timeout: 30
 *   fail_mode: continue
 * hooks:
 *   - name: notify-done
 *     events:
 *       - type: task.completed
 *         filter:
 *           labels_any: [backend]
 *     script: notify.sh
 *     fail_mode: stop
 * </pre>
 *
 * <p>
 * Thread-safe: the mapper and compiled schema are immutable after construction.
 */
public final class HooksConfigParser {

    private static final Logger LOG = LoggerFactory.getLogger(HooksConfigParser.class);

    static final String SCHEMA_RESOURCE = "/schema/hooks-config.schema.json";

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final JsonSchemaFactory SCHEMA_FACTORY =
            JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012);
    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final JsonSchema schema;

    public HooksConfigParser() {
        this.schema = loadSchema();
    }

    /**
     * Loads the configuration file, treating a missing file as "no hooks configured".
     *
     * @throws ConfigurationException if the file exists but is invalid
     */
    public HookRegistry load(Path file) {
        if (!Files.exists(file)) {
            LOG.info("No hooks configuration at {}, no hooks will run", file);
            return HookRegistry.builder().source(file.toString()).build();
        }
        return parse(file);
    }

    /**
     * Parses an existing configuration file.
     *
     * @throws ConfigurationException if the file cannot be read or is invalid
     */
    public HookRegistry parse(Path file) {
        String source = file.toString();
        String content;
        try {
            content = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read hooks configuration: " + e.getMessage(), e, source);
        }
        return parse(content, source);
    }

    /**
     * Parses configuration text.
     *
     * @param yaml   the document
     * @param source label used in error messages (usually the file path)
     * @throws ConfigurationException if the document is malformed or invalid
     */
    public HookRegistry parse(String yaml, String source) {
        JsonNode root;
        try {
            root = YAML_MAPPER.readTree(yaml);
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("Malformed YAML in hooks configuration: " + e.getOriginalMessage(), e, source);
        }
        if (root == null || root.isMissingNode() || root.isNull()) {
            LOG.info("Hooks configuration {} is empty, no hooks will run", source);
            return HookRegistry.builder().source(source).build();
        }
        if (!root.isObject()) {
            throw new ConfigurationException("Hooks configuration must be a YAML mapping", source);
        }

        List<String> errors = new ArrayList<>();
        Set<ValidationMessage> violations = schema.validate(root);
        for (ValidationMessage violation : violations) {
            errors.add(violation.getMessage());
        }
        if (!errors.isEmpty()) {
            errors.sort(String::compareTo);
            throw new ConfigurationException("Invalid hooks configuration " + source, errors, source);
        }

        HookDefaults defaults = parseDefaults(root.get("defaults"));
        HookRegistry.Builder builder = HookRegistry.builder()
                .version(root.has("version") ? root.get("version").asText() : "1.0")
                .defaults(defaults)
                .source(source);

        JsonNode hooksNode = root.get("hooks");
        Set<String> names = new HashSet<>();
        List<HookDefinition> hooks = new ArrayList<>();
        if (hooksNode != null && hooksNode.isArray()) {
            for (int i = 0; i < hooksNode.size(); i++) {
                JsonNode hookNode = hooksNode.get(i);
                String name = hookNode.get("name").asText();
                if (!names.add(name)) {
                    errors.add(String.format("hooks[%d]: duplicate hook name '%s'", i, name));
                    continue;
                }
                HookDefinition hook = parseHook(hookNode, defaults, i, errors);
                if (hook != null) {
                    hooks.add(hook);
                }
            }
        }
        if (!errors.isEmpty()) {
            throw new ConfigurationException("Invalid hooks configuration " + source, errors, source);
        }
        hooks.forEach(builder::hook);
        HookRegistry registry = builder.build();
        LOG.info("Loaded {} hook(s) from {}", registry.size(), source);
        return registry;
    }

    // --- Private helpers ---

    private HookDefaults parseDefaults(JsonNode node) {
        HookDefaults standard = HookDefaults.standard();
        if (node == null || !node.isObject()) {
            return standard;
        }
        return new HookDefaults(
                node.has("timeout") ? Duration.ofSeconds(node.get("timeout").asLong()) : standard.timeout(),
                optionalString(node, "working_directory", standard.workingDirectory()),
                optionalString(node, "shell", standard.shell()),
                node.has("fail_mode") ? FailMode.fromConfig(node.get("fail_mode").asText()) : standard.failMode(),
                node.has("enabled") ? node.get("enabled").asBoolean() : standard.enabled());
    }

    private HookDefinition parseHook(JsonNode node, HookDefaults defaults, int index, List<String> errors) {
        String name = node.get("name").asText();
        String prefix = String.format("hooks[%d] '%s'", index, name);

        boolean hasScript = node.has("script");
        boolean hasCommand = node.has("command");
        if (hasScript == hasCommand) {
            errors.add(prefix + ": exactly one of 'script' or 'command' is required");
            return null;
        }

        HookAction action;
        if (hasScript) {
            action = new HookAction.ScriptAction(node.get("script").asText());
        } else {
            JsonNode command = node.get("command");
            if (command.isArray()) {
                List<String> argv = new ArrayList<>();
                command.forEach(arg -> argv.add(arg.asText()));
                action = HookAction.CommandAction.argv(argv);
            } else {
                action = HookAction.CommandAction.shell(command.asText());
            }
        }

        List<EventMatcher> matchers = new ArrayList<>();
        JsonNode events = node.get("events");
        for (int j = 0; j < events.size(); j++) {
            JsonNode entry = events.get(j);
            String expression = entry.isTextual() ? entry.asText() : entry.get("type").asText();
            try {
                matchers.add(new EventMatcher(EventPattern.parse(expression), filter(entry.get("filter"))));
            } catch (IllegalArgumentException e) {
                errors.add(String.format("%s: events[%d]: %s", prefix, j, e.getMessage()));
            }
        }
        if (matchers.size() != events.size()) {
            return null;
        }

        Map<String, String> env = new LinkedHashMap<>();
        JsonNode envNode = node.get("env");
        if (envNode != null && envNode.isObject()) {
            envNode.fields().forEachRemaining(e -> env.put(e.getKey(), e.getValue().asText()));
        }

        return new HookDefinition(
                name,
                optionalString(node, "description", null),
                matchers,
                filter(node.get("filter")),
                action,
                node.has("timeout") ? Duration.ofSeconds(node.get("timeout").asLong()) : defaults.timeout(),
                optionalString(node, "working_directory", defaults.workingDirectory()),
                optionalString(node, "shell", defaults.shell()),
                env,
                node.has("fail_mode") ? FailMode.fromConfig(node.get("fail_mode").asText()) : defaults.failMode(),
                node.has("enabled") ? node.get("enabled").asBoolean() : defaults.enabled());
    }

    private static ContextFilter filter(JsonNode node) {
        if (node == null || node.isNull() || node.isEmpty()) {
            return ContextFilter.empty();
        }
        return new ContextFilter(YAML_MAPPER.convertValue(node, MAP_TYPE));
    }

    private static String optionalString(JsonNode node, String field, String fallback) {
        JsonNode child = node.get(field);
        return (child != null && child.isTextual()) ? child.asText() : fallback;
    }

    private static JsonSchema loadSchema() {
        try (InputStream in = HooksConfigParser.class.getResourceAsStream(SCHEMA_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Bundled schema not found on classpath: " + SCHEMA_RESOURCE);
            }
            return SCHEMA_FACTORY.getSchema(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read bundled schema " + SCHEMA_RESOURCE, e);
        }
    }
}
