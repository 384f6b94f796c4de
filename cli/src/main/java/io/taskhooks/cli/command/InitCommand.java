package io.taskhooks.cli.command;

import io.taskhooks.cli.scaffold.HookScaffolder;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

/** {@code init}: writes a starter hooks configuration and example scripts. */
public final class InitCommand implements Command {

    @Override
    public String name() {
        return "init";
    }

    @Override
    public String synopsis() {
        return "init [--disabled]";
    }

    @Override
    public int execute(List<String> args, CommandContext context) {
        CommandArgs parsed = CommandArgs.parse(args, Set.of(), Set.of("--disabled"));
        HookScaffolder scaffolder =
                new HookScaffolder(context.hooksFile(), context.executorSettings().hooksDirectory());
        List<Path> created;
        try {
            created = scaffolder.scaffold(!parsed.flag("--disabled"));
        } catch (UncheckedIOException e) {
            context.err().println("init failed: " + e.getMessage());
            return ExitCodes.FAILURE;
        }
        if (created.isEmpty()) {
            context.out().println("Nothing to do: " + context.hooksFile() + " and the example scripts already exist");
            return ExitCodes.OK;
        }
        created.forEach(path -> context.out().println("  created " + display(context.projectRoot(), path)));
        context.out().printf("Created %d file(s). Run 'validate' to check the configuration.%n", created.size());
        return ExitCodes.OK;
    }

    private static Path display(Path root, Path path) {
        return path.startsWith(root) ? root.relativize(path) : path;
    }
}
