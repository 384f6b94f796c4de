package io.taskhooks.core.exec;

import io.taskhooks.core.error.SecurityViolationException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;

/** Resolves a hook's working directory and requires it to be the project root or below it. */
public final class WorkingDirectoryGuard {

    private final Path projectRoot;

    public WorkingDirectoryGuard(Path projectRoot) {
        this.projectRoot = projectRoot.toAbsolutePath().normalize();
    }

    /**
     * @param workingDirectory relative (to the project root) or absolute directory, null for the
     *                         root itself
     * @throws SecurityViolationException if the directory lies outside the project
     */
    public Path resolve(String hookName, String workingDirectory) {
        if (workingDirectory == null || workingDirectory.isBlank()) {
            return projectRoot;
        }
        Path resolved;
        try {
            resolved = projectRoot.resolve(workingDirectory).normalize();
        } catch (InvalidPathException e) {
            throw new SecurityViolationException(
                    "Invalid working directory '" + workingDirectory + "'", hookName, workingDirectory);
        }
        if (!resolved.startsWith(projectRoot)) {
            throw new SecurityViolationException(
                    "Working directory '" + workingDirectory + "' is outside the project root " + projectRoot,
                    hookName,
                    workingDirectory);
        }
        if (Files.exists(resolved)) {
            try {
                if (!resolved.toRealPath().startsWith(projectRoot.toRealPath())) {
                    throw new SecurityViolationException(
                            "Working directory '" + workingDirectory + "' links outside the project root",
                            hookName,
                            workingDirectory);
                }
            } catch (IOException e) {
                throw new SecurityViolationException(
                        "Cannot resolve working directory '" + workingDirectory + "': " + e.getMessage(),
                        hookName,
                        workingDirectory);
            }
        }
        return resolved;
    }
}
