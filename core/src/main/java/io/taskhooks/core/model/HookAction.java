package io.taskhooks.core.model;

import java.util.List;
import java.util.Objects;

/**
 * What a hook runs when it fires. Exactly one action per hook.
 *
 * <p>
 * Scripts are resolved against the hooks directory by the executor. Commands are either an
 * argument vector (no shell involved) or a single string that the executor runs as
 * {@code [shell, "-c", command]}; the string only ever comes from configuration.
 */
public sealed interface HookAction {

    /** {@code script} or {@code command}, as recorded in the audit log. */
    String type();

    /** Human-readable description for listings and audit records. */
    String describe();

    /** A script path relative to the hooks directory. */
    record ScriptAction(String path) implements HookAction {
        public ScriptAction {
            Objects.requireNonNull(path, "path must not be null");
        }

        @Override
        public String type() {
            return "script";
        }

        @Override
        public String describe() {
            return path;
        }
    }

    /**
     * An inline command. Exactly one of {@code argv} (non-empty) or {@code shellCommand} is set.
     */
    record CommandAction(List<String> argv, String shellCommand) implements HookAction {
        public CommandAction {
            argv = argv != null ? List.copyOf(argv) : List.of();
            if (argv.isEmpty() == (shellCommand == null)) {
                throw new IllegalArgumentException("Command action needs exactly one of argv or a shell command");
            }
        }

        public static CommandAction argv(List<String> argv) {
            return new CommandAction(argv, null);
        }

        public static CommandAction shell(String command) {
            return new CommandAction(List.of(), command);
        }

        public boolean usesShell() {
            return shellCommand != null;
        }

        @Override
        public String type() {
            return "command";
        }

        @Override
        public String describe() {
            return usesShell() ? shellCommand : String.join(" ", argv);
        }
    }
}
