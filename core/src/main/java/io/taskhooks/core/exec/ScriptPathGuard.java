package io.taskhooks.core.exec;

import io.taskhooks.core.error.SecurityViolationException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;

/**
 * Resolves script references inside the hooks directory and rejects anything that could escape
 * it: absolute paths, {@code ..} segments, and paths (including symlink targets) that resolve
 * outside the base.
 */
public final class ScriptPathGuard {

    private final Path baseDirectory;

    public ScriptPathGuard(Path baseDirectory) {
        this.baseDirectory = baseDirectory.toAbsolutePath().normalize();
    }

    public Path baseDirectory() {
        return baseDirectory;
    }

    /**
     * @return the absolute, normalized script path (which may not exist)
     * @throws SecurityViolationException if the reference escapes the hooks directory
     */
    public Path resolve(String hookName, String scriptRef) {
        if (scriptRef == null || scriptRef.isBlank()) {
            throw new SecurityViolationException("Script path is empty", hookName, scriptRef);
        }
        Path relative;
        try {
            relative = Path.of(scriptRef);
        } catch (InvalidPathException e) {
            throw new SecurityViolationException("Invalid script path '" + scriptRef + "'", hookName, scriptRef);
        }
        if (relative.isAbsolute() || scriptRef.startsWith("/") || scriptRef.startsWith("\\")) {
            throw new SecurityViolationException(
                    "Absolute script path '" + scriptRef + "' is not allowed", hookName, scriptRef);
        }
        for (Path segment : relative) {
            if (segment.toString().equals("..")) {
                throw new SecurityViolationException(
                        "Path traversal in script path '" + scriptRef + "'", hookName, scriptRef);
            }
        }
        Path resolved = baseDirectory.resolve(relative).normalize();
        if (!resolved.startsWith(baseDirectory)) {
            throw new SecurityViolationException(
                    "Script path '" + scriptRef + "' resolves outside " + baseDirectory, hookName, scriptRef);
        }
        if (Files.exists(resolved)) {
            try {
                Path real = resolved.toRealPath();
                Path realBase = baseDirectory.toRealPath();
                if (!real.startsWith(realBase)) {
                    throw new SecurityViolationException(
                            "Script path '" + scriptRef + "' links outside " + baseDirectory, hookName, scriptRef);
                }
            } catch (IOException e) {
                throw new SecurityViolationException(
                        "Cannot resolve script path '" + scriptRef + "': " + e.getMessage(), hookName, scriptRef);
            }
        }
        return resolved;
    }
}
