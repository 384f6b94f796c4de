package io.taskhooks.cli.command;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.taskhooks.core.audit.AuditLogReader;
import io.taskhooks.core.audit.AuditQuery;
import io.taskhooks.core.audit.AuditRecordCodec;
import io.taskhooks.core.audit.ChainVerification;
import io.taskhooks.core.model.ExecutionStatus;
import io.taskhooks.core.model.HookExecutionRecord;
import java.io.UncheckedIOException;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Set;

/** {@code audit}: queries the audit log, or verifies its hash chain with {@code --verify}. */
public final class AuditCommand implements Command {

    static final int DEFAULT_TAIL = 20;

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Override
    public String name() {
        return "audit";
    }

    @Override
    public String synopsis() {
        return "audit [--tail N] [--hook <name>] [--event-type <type>] [--status <status>] [--since <iso>] [--json] [--verify]";
    }

    @Override
    public int execute(List<String> args, CommandContext context) {
        CommandArgs parsed = CommandArgs.parse(
                args,
                Set.of("--tail", "--hook", "--event-type", "--status", "--since"),
                Set.of("--json", "--verify"));
        AuditLogReader reader = context.auditReader();
        if (parsed.flag("--verify")) {
            return verify(reader, context);
        }

        int tail = parsed.intOption("--tail", DEFAULT_TAIL);
        if (tail < 0) {
            throw new UsageException("--tail must be >= 0");
        }
        AuditQuery query = new AuditQuery(
                parsed.option("--hook", null),
                parsed.option("--event-type", null),
                status(parsed.option("--status", null)),
                since(parsed.option("--since", null)),
                tail);
        List<HookExecutionRecord> records = reader.query(query);

        if (parsed.flag("--json")) {
            AuditRecordCodec codec = new AuditRecordCodec(MAPPER);
            for (HookExecutionRecord record : records) {
                try {
                    context.out().println(MAPPER.writeValueAsString(codec.toNode(record)));
                } catch (JsonProcessingException e) {
                    throw new UncheckedIOException("Failed to serialize audit record", e);
                }
            }
            return ExitCodes.OK;
        }
        if (records.isEmpty()) {
            context.out().println("No audit records");
            return ExitCodes.OK;
        }
        for (HookExecutionRecord record : records) {
            context.out().printf(
                    "%s  %-24s %-22s %-8s %6d ms  exit=%s%s%n",
                    record.timestamp(),
                    record.hook().name(),
                    record.event().type(),
                    record.status().wireName(),
                    record.execution().durationMs(),
                    record.execution().exitCode() != null ? record.execution().exitCode() : "-",
                    record.isSecurityViolation() ? "  [security violation]" : "");
        }
        return ExitCodes.OK;
    }

    private static int verify(AuditLogReader reader, CommandContext context) {
        ChainVerification verification = reader.verify();
        if (verification.intact()) {
            context.out().printf("Audit chain intact: %d entries checked%n", verification.entriesChecked());
            return ExitCodes.OK;
        }
        verification.problems().forEach(p -> context.out().println("  " + p));
        context.out().printf(
                "Audit chain BROKEN: %d problem(s) in %d entries%n",
                verification.problems().size(),
                verification.entriesChecked());
        return ExitCodes.FAILURE;
    }

    private static ExecutionStatus status(String value) {
        if (value == null) {
            return null;
        }
        try {
            return ExecutionStatus.fromWireName(value);
        } catch (IllegalArgumentException e) {
            throw new UsageException("--status must be one of success, failed, timeout, error; got: " + value);
        }
    }

    private static Instant since(String value) {
        if (value == null) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            throw new UsageException("--since expects an ISO-8601 instant, e.g. 2024-01-01T00:00:00Z; got: " + value);
        }
    }
}
