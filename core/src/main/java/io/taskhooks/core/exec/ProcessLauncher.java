package io.taskhooks.core.exec;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Starts child processes for hook actions.
 *
 * <p>
 * Always receives an argument vector; implementations must not join it into a shell string. The
 * environment map is the complete child environment, nothing is inherited.
 */
public interface ProcessLauncher {

    /**
     * Starts a process.
     *
     * @param argv             program and arguments, at least one element
     * @param workingDirectory directory the process starts in
     * @param environment      the full environment of the child
     * @return the running process
     * @throws IOException if the process cannot be started
     */
    Process start(List<String> argv, Path workingDirectory, Map<String, String> environment) throws IOException;
}
