package io.taskhooks.cli.git;

import io.taskhooks.core.error.WorkItemStoreException;
import io.taskhooks.core.model.Revision;
import io.taskhooks.core.model.VersionedDocument;
import io.taskhooks.core.spi.WorkItemStore;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link WorkItemStore} backed by the {@code git} executable.
 *
 * <p>
 * Every call is a plain argv invocation; no shell is involved. A marker that does not resolve
 * to a commit (e.g. {@code HEAD~1} on the first commit) yields {@link Revision#empty()}, whose
 * document list is empty.
 */
public final class GitWorkItemStore implements WorkItemStore {

    private static final Logger LOG = LoggerFactory.getLogger(GitWorkItemStore.class);
    private static final long GIT_TIMEOUT_SECONDS = 30;

    private final Path repositoryRoot;
    private final String tasksDirectory;
    private final String gitExecutable;

    public GitWorkItemStore(Path repositoryRoot, String tasksDirectory) {
        this(repositoryRoot, tasksDirectory, "git");
    }

    GitWorkItemStore(Path repositoryRoot, String tasksDirectory, String gitExecutable) {
        this.repositoryRoot = Objects.requireNonNull(repositoryRoot, "repositoryRoot must not be null");
        this.tasksDirectory = Objects.requireNonNull(tasksDirectory, "tasksDirectory must not be null");
        this.gitExecutable = Objects.requireNonNull(gitExecutable, "gitExecutable must not be null");
    }

    @Override
    public Revision resolve(String marker) {
        Objects.requireNonNull(marker, "marker must not be null");
        GitResult rev = git(List.of("rev-parse", "--verify", "--quiet", marker + "^{commit}"), marker);
        if (rev.exitCode() != 0) {
            LOG.debug("Revision {} does not resolve; treating as empty", marker);
            return Revision.empty();
        }
        String sha = rev.stdout().trim();
        GitResult time = git(List.of("show", "-s", "--format=%ct", sha), sha);
        if (time.exitCode() != 0) {
            throw new WorkItemStoreException("git show failed: " + time.stderr().trim(), sha);
        }
        Instant committedAt;
        try {
            committedAt = Instant.ofEpochSecond(Long.parseLong(time.stdout().trim()));
        } catch (NumberFormatException e) {
            throw new WorkItemStoreException("Unexpected commit time '" + time.stdout().trim() + "'", e, sha);
        }
        return new Revision(sha, committedAt);
    }

    @Override
    public List<VersionedDocument> list(Revision revision) {
        if (revision.isEmpty()) {
            return List.of();
        }
        // -z: paths are NUL-terminated and never quoted, whatever characters they contain
        GitResult tree =
                git(List.of("ls-tree", "-r", "-z", "--name-only", revision.id(), "--", tasksDirectory), revision.id());
        if (tree.exitCode() != 0) {
            throw new WorkItemStoreException("git ls-tree failed: " + tree.stderr().trim(), revision.id());
        }
        List<VersionedDocument> documents = new ArrayList<>();
        for (String path : tree.stdout().split("\0")) {
            if (path.isBlank() || !path.endsWith(".md")) {
                continue;
            }
            GitResult blob = git(List.of("show", revision.id() + ":" + path), revision.id());
            if (blob.exitCode() != 0) {
                throw new WorkItemStoreException(
                        String.format("git show %s:%s failed: %s", revision.id(), path, blob.stderr().trim()),
                        revision.id());
            }
            documents.add(new VersionedDocument(path, blob.stdout()));
        }
        LOG.debug("Read {} document(s) under {} at {}", documents.size(), tasksDirectory, revision.id());
        return documents;
    }

    private GitResult git(List<String> arguments, String revision) {
        List<String> command = new ArrayList<>(arguments.size() + 1);
        command.add(gitExecutable);
        command.addAll(arguments);
        Process process;
        try {
            process = new ProcessBuilder(command).directory(repositoryRoot.toFile()).start();
        } catch (IOException e) {
            throw new WorkItemStoreException("Failed to start git: " + e.getMessage(), e, revision);
        }
        ByteArrayOutputStream stderr = new ByteArrayOutputStream();
        Thread drainer = new Thread(() -> drain(process.getErrorStream(), stderr), "git-stderr");
        drainer.setDaemon(true);
        drainer.start();
        try {
            process.getOutputStream().close();
            byte[] stdout = process.getInputStream().readAllBytes();
            if (!process.waitFor(GIT_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                process.destroyForcibly();
                throw new WorkItemStoreException("git " + arguments.get(0) + " timed out", revision);
            }
            drainer.join(TimeUnit.SECONDS.toMillis(2));
            String errText;
            synchronized (stderr) {
                errText = stderr.toString(StandardCharsets.UTF_8);
            }
            return new GitResult(process.exitValue(), new String(stdout, StandardCharsets.UTF_8), errText);
        } catch (IOException e) {
            process.destroyForcibly();
            throw new WorkItemStoreException("Failed to read git output: " + e.getMessage(), e, revision);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            throw new WorkItemStoreException("Interrupted while waiting for git", e, revision);
        }
    }

    private static void drain(InputStream in, ByteArrayOutputStream sink) {
        byte[] buffer = new byte[4096];
        try (in) {
            int read;
            while ((read = in.read(buffer)) != -1) {
                synchronized (sink) {
                    sink.write(buffer, 0, read);
                }
            }
        } catch (IOException e) {
            LOG.debug("git stderr stream closed: {}", e.getMessage());
        }
    }

    private record GitResult(int exitCode, String stdout, String stderr) {}
}
