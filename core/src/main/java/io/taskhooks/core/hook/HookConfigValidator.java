package io.taskhooks.core.hook;

import io.taskhooks.core.error.ConfigurationException;
import io.taskhooks.core.error.SecurityViolationException;
import io.taskhooks.core.exec.EnvironmentGuard;
import io.taskhooks.core.exec.ScriptContentScanner;
import io.taskhooks.core.exec.ScriptPathGuard;
import io.taskhooks.core.exec.WorkingDirectoryGuard;
import io.taskhooks.core.model.HookAction;
import io.taskhooks.core.model.HookDefinition;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dry-run validation of a hooks configuration: schema and structure, then every check the
 * executor would apply before spawning (script location and existence, working directory,
 * environment), without running anything.
 */
public final class HookConfigValidator {

    private static final Logger LOG = LoggerFactory.getLogger(HookConfigValidator.class);

    /** Timeouts above this are legal but flagged. */
    static final Duration LONG_TIMEOUT = Duration.ofSeconds(300);

    private final HooksConfigParser parser;
    private final ScriptPathGuard scriptGuard;
    private final WorkingDirectoryGuard workingDirectoryGuard;

    public HookConfigValidator(HooksConfigParser parser, Path projectRoot, Path hooksDirectory) {
        this.parser = parser;
        this.scriptGuard = new ScriptPathGuard(hooksDirectory);
        this.workingDirectoryGuard = new WorkingDirectoryGuard(projectRoot);
    }

    public ValidationReport validate(Path configFile) {
        String source = configFile.toString();
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        if (!Files.exists(configFile)) {
            warnings.add("No hooks configuration at " + source + "; no hooks will run");
            return new ValidationReport(source, 0, errors, warnings);
        }

        HookRegistry registry;
        try {
            registry = parser.parse(configFile);
        } catch (ConfigurationException e) {
            if (e.errors().isEmpty()) {
                errors.add(e.getMessage());
            } else {
                errors.addAll(e.errors());
            }
            return new ValidationReport(source, 0, errors, warnings);
        }

        for (HookDefinition hook : registry.hooks()) {
            checkHook(hook, errors, warnings);
        }
        LOG.debug("Validated {}: {} error(s), {} warning(s)", source, errors.size(), warnings.size());
        return new ValidationReport(source, registry.size(), errors, warnings);
    }

    private void checkHook(HookDefinition hook, List<String> errors, List<String> warnings) {
        String name = hook.name();
        try {
            workingDirectoryGuard.resolve(name, hook.workingDirectory());
        } catch (SecurityViolationException e) {
            errors.add(name + ": " + e.getMessage());
        }
        try {
            EnvironmentGuard.check(name, hook.env());
        } catch (SecurityViolationException e) {
            errors.add(name + ": " + e.getMessage());
        }
        if (hook.action() instanceof HookAction.ScriptAction script) {
            checkScript(name, script.path(), errors, warnings);
        }
        if (hook.timeout().compareTo(LONG_TIMEOUT) > 0) {
            warnings.add(String.format(
                    "%s: timeout %ds exceeds %ds; consider a shorter limit",
                    name, hook.timeout().toSeconds(), LONG_TIMEOUT.toSeconds()));
        }
        if (!hook.enabled()) {
            warnings.add(name + ": disabled");
        }
    }

    private void checkScript(String name, String scriptRef, List<String> errors, List<String> warnings) {
        Path script;
        try {
            script = scriptGuard.resolve(name, scriptRef);
        } catch (SecurityViolationException e) {
            errors.add(name + ": " + e.getMessage());
            return;
        }
        if (!Files.isRegularFile(script)) {
            errors.add(name + ": script not found: " + script);
            return;
        }
        try {
            for (String finding : ScriptContentScanner.scan(Files.readString(script, StandardCharsets.UTF_8))) {
                warnings.add(name + ": script contains a dangerous pattern: " + finding);
            }
        } catch (IOException e) {
            errors.add(name + ": cannot read script " + script + ": " + e.getMessage());
        }
    }
}
