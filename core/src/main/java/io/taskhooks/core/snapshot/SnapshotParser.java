package io.taskhooks.core.snapshot;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.taskhooks.core.model.AcceptanceItem;
import io.taskhooks.core.model.Snapshot;
import io.taskhooks.core.model.VersionedDocument;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses work-item documents into {@link Snapshot}s.
 *
 * <p>
 * A work item is a Markdown file whose YAML front matter (between two {@code ---} lines) carries
 * at least {@code status}; the identifier comes from the front matter {@code id} field or, failing
 * that, from the file name up to the first {@code " - "} (e.g. {@code task-12 - Fix login.md}).
 * Acceptance criteria are checkbox list items ({@code - [ ]} / {@code - [x]}), taken from the
 * {@code ## Acceptance Criteria} section when the document has one.
 *
 * <p>
 * Files that are not tracked work items are {@linkplain ParseOutcome.Skipped skipped} (DEBUG),
 * never errors. Tracked items with unreadable content are {@linkplain ParseOutcome.Failed failed}
 * for that document only (WARN).
 *
 * <p>
 * Thread-safe: holds only immutable state.
 */
public final class SnapshotParser {

    private static final Logger LOG = LoggerFactory.getLogger(SnapshotParser.class);

    /** Default tracked identifier prefix. */
    public static final String DEFAULT_PREFIX = "task";

    private static final String FENCE = "---";
    private static final Pattern CHECKBOX = Pattern.compile("^\\s*[-*]\\s+\\[([ xX])]\\s+(?:#(\\d+)\\s+)?(.*?)\\s*$");
    private static final Pattern AC_HEADING = Pattern.compile("^#{1,6}\\s+acceptance criteria\\s*$", Pattern.CASE_INSENSITIVE);
    private static final Pattern HEADING = Pattern.compile("^#{1,6}\\s+.*$");

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
    private final String trackedPrefix;

    public SnapshotParser() {
        this(DEFAULT_PREFIX);
    }

    public SnapshotParser(String trackedPrefix) {
        this.trackedPrefix = Objects.requireNonNull(trackedPrefix, "trackedPrefix must not be null");
    }

    /** Parses every document and collects the tracked items into a {@link SnapshotSet}. */
    public SnapshotSet parseAll(List<VersionedDocument> documents) {
        List<ParseOutcome> outcomes = new ArrayList<>(documents.size());
        for (VersionedDocument document : documents) {
            outcomes.add(parse(document));
        }
        return SnapshotSet.of(outcomes);
    }

    public ParseOutcome parse(VersionedDocument document) {
        return parse(document.path(), document.content());
    }

    /**
     * Parses one document.
     *
     * @param path    store-relative path
     * @param content document text
     * @return the outcome; never null and never thrown
     */
    public ParseOutcome parse(String path, String content) {
        Objects.requireNonNull(path, "path must not be null");
        String fileName = fileName(path);
        if (!fileName.toLowerCase(Locale.ROOT).endsWith(".md")) {
            return skip(path, "not a markdown document");
        }

        String[] lines = (content != null ? content : "").split("\\R", -1);
        int closingFence = findClosingFence(lines);
        JsonNode frontMatter = null;
        String frontMatterError = null;
        if (closingFence < 0) {
            frontMatterError = "no front matter block";
        } else {
            try {
                frontMatter = yamlMapper.readTree(String.join("\n", Arrays.copyOfRange(lines, 1, closingFence)));
                if (frontMatter != null && !frontMatter.isObject() && !frontMatter.isMissingNode()) {
                    frontMatterError = "front matter is not a mapping";
                    frontMatter = null;
                }
            } catch (JsonProcessingException e) {
                frontMatterError = "unparseable front matter: " + e.getOriginalMessage();
            }
        }

        String id = text(frontMatter, "id");
        if (id == null) {
            id = idFromFileName(fileName);
        }
        if (!TaskIdGrammar.isTracked(id, trackedPrefix)) {
            return skip(path, "identifier '" + id + "' is not a tracked " + trackedPrefix + " id");
        }
        if (frontMatterError != null) {
            return fail(path, id + ": " + frontMatterError);
        }
        String status = text(frontMatter, "status");
        if (status == null || status.isBlank()) {
            return fail(path, id + ": missing required field 'status'");
        }

        Snapshot snapshot = new Snapshot(
                id,
                path,
                text(frontMatter, "title"),
                status.trim(),
                text(frontMatter, "priority"),
                labels(frontMatter.get("labels")),
                acceptanceItems(lines, closingFence + 1));
        return new ParseOutcome.Parsed(snapshot);
    }

    private static ParseOutcome skip(String path, String reason) {
        LOG.debug("Skipping '{}': {}", path, reason);
        return new ParseOutcome.Skipped(path, reason);
    }

    private static ParseOutcome fail(String path, String reason) {
        LOG.warn("Cannot parse work item '{}': {}", path, reason);
        return new ParseOutcome.Failed(path, reason);
    }

    private static int findClosingFence(String[] lines) {
        if (lines.length == 0 || !lines[0].strip().equals(FENCE)) {
            return -1;
        }
        for (int i = 1; i < lines.length; i++) {
            if (lines[i].strip().equals(FENCE)) {
                return i;
            }
        }
        return -1;
    }

    static String idFromFileName(String fileName) {
        String stem = fileName.substring(0, fileName.length() - ".md".length());
        int separator = stem.indexOf(" - ");
        return (separator >= 0 ? stem.substring(0, separator) : stem).trim();
    }

    private static String fileName(String path) {
        int slash = Math.max(path.lastIndexOf('/'), path.lastIndexOf('\\'));
        return slash >= 0 ? path.substring(slash + 1) : path;
    }

    private static String text(JsonNode node, String field) {
        if (node == null || !node.has(field) || node.get(field).isNull()) {
            return null;
        }
        JsonNode value = node.get(field);
        return value.isValueNode() ? value.asText() : null;
    }

    private static Set<String> labels(JsonNode node) {
        Set<String> labels = new LinkedHashSet<>();
        if (node == null || node.isNull()) {
            return labels;
        }
        if (node.isArray()) {
            for (JsonNode label : node) {
                if (label.isValueNode() && !label.asText().isBlank()) {
                    labels.add(label.asText().trim());
                }
            }
        } else if (node.isValueNode()) {
            for (String label : node.asText().split(",")) {
                if (!label.isBlank()) {
                    labels.add(label.trim());
                }
            }
        }
        return labels;
    }

    private static List<AcceptanceItem> acceptanceItems(String[] lines, int bodyStart) {
        int from = bodyStart;
        int to = lines.length;
        for (int i = bodyStart; i < lines.length; i++) {
            if (AC_HEADING.matcher(lines[i].strip()).matches()) {
                from = i + 1;
                to = lines.length;
                for (int j = from; j < lines.length; j++) {
                    if (HEADING.matcher(lines[j].strip()).matches()) {
                        to = j;
                        break;
                    }
                }
                break;
            }
        }

        List<AcceptanceItem> items = new ArrayList<>();
        for (int i = from; i < to; i++) {
            Matcher m = CHECKBOX.matcher(lines[i]);
            if (m.matches()) {
                int index = index(m.group(2), items.size() + 1);
                boolean checked = !m.group(1).isBlank();
                items.add(new AcceptanceItem(Math.max(index, 1), m.group(3), checked));
            }
        }
        return items;
    }

    // An explicit #N marker wins; one that does not fit an int falls back to the position.
    private static int index(String marker, int position) {
        if (marker == null) {
            return position;
        }
        try {
            return Integer.parseInt(marker);
        } catch (NumberFormatException e) {
            LOG.debug("Ignoring out-of-range acceptance criterion index #{}", marker);
            return position;
        }
    }
}
