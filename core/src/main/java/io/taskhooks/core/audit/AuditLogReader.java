package io.taskhooks.core.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.taskhooks.core.model.HookExecutionRecord;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads an audit log written by {@link JsonlAuditLog}, including its rotated generations, in
 * chronological order (oldest generation first, current file last).
 */
public final class AuditLogReader {

    private static final Logger LOG = LoggerFactory.getLogger(AuditLogReader.class);

    private final Path file;
    private final int maxGenerations;
    private final ObjectMapper mapper = new ObjectMapper();
    private final AuditRecordCodec codec = new AuditRecordCodec(mapper);

    public AuditLogReader(Path file) {
        this(file, JsonlAuditLog.DEFAULT_MAX_GENERATIONS);
    }

    public AuditLogReader(Path file, int maxGenerations) {
        this.file = Objects.requireNonNull(file, "file must not be null");
        this.maxGenerations = maxGenerations;
    }

    /** All decodable entries; malformed lines are skipped with a warning. */
    public List<AuditEntry> entries() {
        List<AuditEntry> entries = new ArrayList<>();
        for (Path path : files()) {
            List<String> lines = readLines(path);
            for (int i = 0; i < lines.size(); i++) {
                String line = lines.get(i);
                if (line.isBlank()) {
                    continue;
                }
                try {
                    JsonNode node = mapper.readTree(line);
                    entries.add(new AuditEntry(
                            codec.fromNode(node),
                            node.path(JsonlAuditLog.PREV_HASH).asText(null),
                            node.path(JsonlAuditLog.ENTRY_HASH).asText(null),
                            path.getFileName().toString(),
                            i + 1));
                } catch (JsonProcessingException | IllegalArgumentException e) {
                    LOG.warn("Skipping malformed audit line {}:{}: {}", path.getFileName(), i + 1, e.getMessage());
                }
            }
        }
        return entries;
    }

    public List<HookExecutionRecord> records() {
        return query(AuditQuery.all());
    }

    /** Matching records in chronological order, trimmed to the last {@code tail} when set. */
    public List<HookExecutionRecord> query(AuditQuery query) {
        List<HookExecutionRecord> matches = new ArrayList<>();
        for (AuditEntry entry : entries()) {
            if (query.matches(entry.record())) {
                matches.add(entry.record());
            }
        }
        if (query.tail() > 0 && matches.size() > query.tail()) {
            return List.copyOf(matches.subList(matches.size() - query.tail(), matches.size()));
        }
        return matches;
    }

    /**
     * Recomputes every entry hash and checks each {@code prev_hash} link. The first entry of the
     * oldest retained file anchors the chain, since its predecessor may have been rotated away.
     */
    public ChainVerification verify() {
        List<String> problems = new ArrayList<>();
        int checked = 0;
        String expectedPrev = null;
        for (Path path : files()) {
            List<String> lines = readLines(path);
            for (int i = 0; i < lines.size(); i++) {
                String line = lines.get(i);
                if (line.isBlank()) {
                    continue;
                }
                checked++;
                String location = path.getFileName() + ":" + (i + 1);
                JsonNode node;
                try {
                    node = mapper.readTree(line);
                } catch (JsonProcessingException e) {
                    problems.add(location + ": malformed JSON");
                    expectedPrev = null;
                    continue;
                }
                String prev = node.path(JsonlAuditLog.PREV_HASH).asText(null);
                String stored = node.path(JsonlAuditLog.ENTRY_HASH).asText(null);
                if (stored == null || prev == null) {
                    problems.add(location + ": missing hash fields");
                    expectedPrev = null;
                    continue;
                }
                if (expectedPrev != null && !expectedPrev.equals(prev)) {
                    problems.add(location + ": prev_hash does not match the preceding entry");
                }
                try {
                    String actual = JsonlAuditLog.hash(mapper, node);
                    if (!actual.equals(stored)) {
                        problems.add(location + ": entry_hash mismatch (record modified)");
                    }
                } catch (JsonProcessingException e) {
                    problems.add(location + ": cannot re-serialize entry");
                }
                expectedPrev = stored;
            }
        }
        if (problems.isEmpty()) {
            LOG.debug("Audit chain intact ({} entries)", checked);
        } else {
            LOG.warn("Audit chain verification found {} problem(s)", problems.size());
        }
        return new ChainVerification(checked, problems);
    }

    private List<Path> files() {
        List<Path> files = new ArrayList<>();
        for (int n = maxGenerations; n >= 1; n--) {
            Path generation = JsonlAuditLog.generation(file, n);
            if (Files.exists(generation)) {
                files.add(generation);
            }
        }
        if (Files.exists(file)) {
            files.add(file);
        }
        return files;
    }

    private static List<String> readLines(Path path) {
        try {
            return Files.readAllLines(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read audit log " + path, e);
        }
    }
}
