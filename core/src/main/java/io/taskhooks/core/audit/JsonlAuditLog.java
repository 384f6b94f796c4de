package io.taskhooks.core.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.taskhooks.core.error.AuditWriteException;
import io.taskhooks.core.model.HookExecutionRecord;
import io.taskhooks.core.util.Hashes;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Append-only JSON Lines audit log with a SHA-256 hash chain and size-based rotation.
 *
 * <p>
 * Each line is one record plus {@code prev_hash} (the previous line's {@code entry_hash}, or
 * {@link #GENESIS_HASH} for the first record ever written) and {@code entry_hash} (SHA-256 of the
 * compact JSON of the line without {@code entry_hash}). The chain continues across rotated files.
 *
 * <p>
 * When the current file would exceed {@code maxBytes}, it is renamed to {@code <name>.1}, older
 * generations shift up by one and anything beyond {@code maxGenerations} is deleted.
 *
 * <p>
 * Appends are synchronized; a single process must own the log at a time.
 */
public final class JsonlAuditLog implements AuditSink {

    private static final Logger LOG = LoggerFactory.getLogger(JsonlAuditLog.class);

    public static final String GENESIS_HASH = "0".repeat(64);
    public static final long DEFAULT_MAX_BYTES = 10L * 1024 * 1024;
    public static final int DEFAULT_MAX_GENERATIONS = 5;

    static final String PREV_HASH = "prev_hash";
    static final String ENTRY_HASH = "entry_hash";

    private final Path file;
    private final long maxBytes;
    private final int maxGenerations;
    private final ObjectMapper mapper;
    private final AuditRecordCodec codec;
    private String lastHash;

    public JsonlAuditLog(Path file) {
        this(file, DEFAULT_MAX_BYTES, DEFAULT_MAX_GENERATIONS);
    }

    public JsonlAuditLog(Path file, long maxBytes, int maxGenerations) {
        this.file = Objects.requireNonNull(file, "file must not be null");
        if (maxBytes <= 0) {
            throw new IllegalArgumentException("maxBytes must be positive, got: " + maxBytes);
        }
        if (maxGenerations < 1) {
            throw new IllegalArgumentException("maxGenerations must be >= 1, got: " + maxGenerations);
        }
        this.maxBytes = maxBytes;
        this.maxGenerations = maxGenerations;
        this.mapper = new ObjectMapper();
        this.codec = new AuditRecordCodec(mapper);
    }

    public Path file() {
        return file;
    }

    @Override
    public synchronized void append(HookExecutionRecord record) {
        Objects.requireNonNull(record, "record must not be null");
        try {
            if (lastHash == null) {
                lastHash = recoverLastHash();
            }
            ObjectNode node = codec.toNode(record);
            node.put(PREV_HASH, lastHash);
            String entryHash = hash(mapper, node);
            node.put(ENTRY_HASH, entryHash);
            byte[] line = (mapper.writeValueAsString(node) + "\n").getBytes(StandardCharsets.UTF_8);

            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            if (Files.exists(file) && Files.size(file) > 0 && Files.size(file) + line.length > maxBytes) {
                rotate();
            }
            Files.write(file, line, StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.DSYNC);
            lastHash = entryHash;
        } catch (IOException e) {
            throw new AuditWriteException(
                    "Failed to append audit record to " + file + ": " + e.getMessage(),
                    e,
                    record.hook().name(),
                    file.toString());
        }
    }

    /** Hash of a line node, ignoring any {@code entry_hash} it already carries. */
    static String hash(ObjectMapper mapper, JsonNode line) throws JsonProcessingException {
        ObjectNode copy = line.deepCopy();
        copy.remove(ENTRY_HASH);
        return Hashes.sha256Hex(mapper.writeValueAsString(copy));
    }

    /** Path of rotated generation {@code n} (1 is the most recent). */
    static Path generation(Path file, int n) {
        return file.resolveSibling(file.getFileName() + "." + n);
    }

    private void rotate() throws IOException {
        Files.deleteIfExists(generation(file, maxGenerations));
        for (int n = maxGenerations - 1; n >= 1; n--) {
            Path source = generation(file, n);
            if (Files.exists(source)) {
                Files.move(source, generation(file, n + 1), StandardCopyOption.REPLACE_EXISTING);
            }
        }
        Files.move(file, generation(file, 1), StandardCopyOption.REPLACE_EXISTING);
        LOG.info("Rotated audit log {} (keeping {} generation(s))", file, maxGenerations);
    }

    private String recoverLastHash() throws IOException {
        for (Path candidate : List.of(file, generation(file, 1))) {
            String hash = lastEntryHash(candidate);
            if (hash != null) {
                return hash;
            }
        }
        return GENESIS_HASH;
    }

    private String lastEntryHash(Path candidate) throws IOException {
        if (!Files.exists(candidate)) {
            return null;
        }
        List<String> lines = Files.readAllLines(candidate, StandardCharsets.UTF_8);
        for (int i = lines.size() - 1; i >= 0; i--) {
            String line = lines.get(i);
            if (line.isBlank()) {
                continue;
            }
            try {
                JsonNode node = mapper.readTree(line);
                if (node.hasNonNull(ENTRY_HASH)) {
                    return node.get(ENTRY_HASH).asText();
                }
            } catch (JsonProcessingException e) {
                LOG.warn("Ignoring malformed audit line {} in {}: {}", i + 1, candidate, e.getOriginalMessage());
            }
        }
        return null;
    }
}
