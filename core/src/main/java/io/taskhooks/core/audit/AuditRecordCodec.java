package io.taskhooks.core.audit;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.taskhooks.core.model.ExecutionStatus;
import io.taskhooks.core.model.FailMode;
import io.taskhooks.core.model.HookExecutionRecord;
import io.taskhooks.core.model.HookExecutionRecord.EventRef;
import io.taskhooks.core.model.HookExecutionRecord.Execution;
import io.taskhooks.core.model.HookExecutionRecord.HookRef;
import io.taskhooks.core.model.HookExecutionRecord.Output;
import io.taskhooks.core.model.HookExecutionRecord.Security;
import io.taskhooks.core.model.HookExecutionRecord.Tool;
import io.taskhooks.core.model.SecurityOutcome;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * JSON form of {@link HookExecutionRecord} as stored in the audit log. Field order is fixed, so
 * the compact serialization of a node is stable and can be hashed.
 */
public final class AuditRecordCodec {

    private final ObjectMapper mapper;

    public AuditRecordCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public ObjectNode toNode(HookExecutionRecord record) {
        ObjectNode node = mapper.createObjectNode();
        node.put("schema_version", HookExecutionRecord.SCHEMA_VERSION);
        node.put("record_type", record.recordType());
        node.put("timestamp", record.timestamp().toString());

        HookRef hook = record.hook();
        ObjectNode hookNode = node.putObject("hook");
        hookNode.put("name", hook.name());
        hookNode.put("action_type", hook.actionType());
        hookNode.put("action", hook.action());
        hookNode.put("script_sha256", hook.scriptSha256());
        hookNode.put("fail_mode", hook.failMode().configValue());

        ObjectNode eventNode = node.putObject("event");
        eventNode.put("id", record.event().id());
        eventNode.put("type", record.event().type());

        Execution execution = record.execution();
        ObjectNode executionNode = node.putObject("execution");
        executionNode.put("status", execution.status().wireName());
        executionNode.put("exit_code", execution.exitCode());
        executionNode.put("duration_ms", execution.durationMs());
        executionNode.put("started_at", execution.startedAt().toString());
        executionNode.put("completed_at", execution.completedAt().toString());
        executionNode.put("timeout_ms", execution.timeoutMs());
        executionNode.put("working_directory", execution.workingDirectory());
        executionNode.put("executed", execution.executed());

        Output output = record.output();
        ObjectNode outputNode = node.putObject("output");
        outputNode.put("stdout_lines", output.stdoutLines());
        outputNode.put("stderr_lines", output.stderrLines());
        outputNode.put("stdout_truncated", output.stdoutTruncated());
        outputNode.put("stderr_truncated", output.stderrTruncated());

        Security security = record.security();
        ObjectNode securityNode = node.putObject("security");
        securityNode.put("outcome", security.outcome().name().toLowerCase(Locale.ROOT));
        securityNode.put("detail", security.detail());
        ArrayNode warnings = securityNode.putArray("warnings");
        security.warnings().forEach(warnings::add);

        ObjectNode toolNode = node.putObject("tool");
        toolNode.put("name", record.tool().name());
        toolNode.put("version", record.tool().version());

        node.put("error", record.error());
        return node;
    }

    /**
     * @throws IllegalArgumentException if a required field is missing or has the wrong type
     */
    public HookExecutionRecord fromNode(JsonNode node) {
        JsonNode hook = object(node, "hook");
        JsonNode event = object(node, "event");
        JsonNode execution = object(node, "execution");
        JsonNode output = node.path("output");
        JsonNode security = object(node, "security");
        JsonNode tool = node.path("tool");

        List<String> warnings = new ArrayList<>();
        security.path("warnings").forEach(w -> warnings.add(w.asText()));

        try {
            return new HookExecutionRecord(
                    text(node, "record_type"),
                    Instant.parse(text(node, "timestamp")),
                    new HookRef(
                            text(hook, "name"),
                            optionalText(hook, "action_type"),
                            optionalText(hook, "action"),
                            optionalText(hook, "script_sha256"),
                            FailMode.fromConfig(text(hook, "fail_mode"))),
                    new EventRef(text(event, "id"), text(event, "type")),
                    new Execution(
                            ExecutionStatus.fromWireName(text(execution, "status")),
                            execution.hasNonNull("exit_code") ? execution.get("exit_code").asInt() : null,
                            execution.path("duration_ms").asLong(),
                            Instant.parse(text(execution, "started_at")),
                            Instant.parse(text(execution, "completed_at")),
                            execution.path("timeout_ms").asLong(),
                            optionalText(execution, "working_directory"),
                            execution.path("executed").asBoolean(true)),
                    new Output(
                            output.path("stdout_lines").asInt(),
                            output.path("stderr_lines").asInt(),
                            output.path("stdout_truncated").asBoolean(),
                            output.path("stderr_truncated").asBoolean()),
                    new Security(
                            SecurityOutcome.valueOf(text(security, "outcome").toUpperCase(Locale.ROOT)),
                            optionalText(security, "detail"),
                            warnings),
                    new Tool(optionalText(tool, "name"), optionalText(tool, "version")),
                    optionalText(node, "error"));
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid timestamp in audit record: " + e.getParsedString(), e);
        }
    }

    private static JsonNode object(JsonNode node, String field) {
        JsonNode child = node.get(field);
        if (child == null || !child.isObject()) {
            throw new IllegalArgumentException("Audit record is missing object '" + field + "'");
        }
        return child;
    }

    private static String text(JsonNode node, String field) {
        JsonNode child = node.get(field);
        if (child == null || child.isNull()) {
            throw new IllegalArgumentException("Audit record is missing field '" + field + "'");
        }
        return child.asText();
    }

    private static String optionalText(JsonNode node, String field) {
        JsonNode child = node.get(field);
        return child == null || child.isNull() ? null : child.asText();
    }
}
