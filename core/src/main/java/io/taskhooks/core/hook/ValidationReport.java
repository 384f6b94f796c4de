package io.taskhooks.core.hook;

import java.util.List;

/**
 * Result of {@link HookConfigValidator#validate}.
 *
 * @param source    the validated file
 * @param hookCount hooks defined (0 when the file could not be parsed)
 * @param errors    problems that would disable or reject hooks
 * @param warnings  findings that do not block execution
 */
public record ValidationReport(String source, int hookCount, List<String> errors, List<String> warnings) {

    public ValidationReport {
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
    }

    public boolean valid() {
        return errors.isEmpty();
    }
}
