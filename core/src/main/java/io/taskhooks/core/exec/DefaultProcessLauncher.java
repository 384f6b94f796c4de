package io.taskhooks.core.exec;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/** {@link ProcessLauncher} backed by {@link ProcessBuilder}, with a cleared environment. */
public final class DefaultProcessLauncher implements ProcessLauncher {

    @Override
    public Process start(List<String> argv, Path workingDirectory, Map<String, String> environment)
            throws IOException {
        ProcessBuilder builder = new ProcessBuilder(argv).directory(workingDirectory.toFile());
        Map<String, String> env = builder.environment();
        env.clear();
        env.putAll(environment);
        return builder.start();
    }
}
