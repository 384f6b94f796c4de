package io.taskhooks.core.error;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.util.List;
import org.junit.jupiter.api.Test;

class ExceptionHierarchyTest {

    // --- Hierarchy structure ---

    @Test
    void hookExceptionIsAbstractAndRoot() {
        assertThat(HookException.class).isAbstract();
        assertThat(HookException.class.getSuperclass()).isEqualTo(RuntimeException.class);
    }

    @Test
    void hookLoadExceptionIsAbstract() {
        assertThat(HookLoadException.class).isAbstract();
        assertThat(HookLoadException.class.getSuperclass()).isEqualTo(HookException.class);
    }

    // --- Load-time exceptions ---

    @Test
    void configurationExceptionListsItsErrors() {
        var ex = new ConfigurationException(
                "Invalid hooks configuration", List.of("hooks[0]: bad name", "hooks[1]: no action"), "hooks.yaml");

        assertThat(ex).isInstanceOf(HookLoadException.class);
        assertThat(ex.phase()).isEqualTo(HookException.Phase.LOAD);
        assertThat(ex.source()).isEqualTo("hooks.yaml");
        assertThat(ex.hookName()).isNull();
        assertThat(ex.errors()).hasSize(2);
        assertThat(ex.getMessage())
                .isEqualTo("Invalid hooks configuration:\n  - hooks[0]: bad name\n  - hooks[1]: no action");
    }

    @Test
    void configurationExceptionWithoutErrorsKeepsMessage() {
        var cause = new IOException("denied");
        var ex = new ConfigurationException("Cannot read hooks.yaml", cause, "hooks.yaml");

        assertThat(ex.getMessage()).isEqualTo("Cannot read hooks.yaml");
        assertThat(ex.getCause()).isSameAs(cause);
        assertThat(ex.errors()).isEmpty();
    }

    @Test
    void workItemStoreExceptionCarriesRevision() {
        var ex = new WorkItemStoreException("git failed", "HEAD~1");

        assertThat(ex).isInstanceOf(HookLoadException.class);
        assertThat(ex.source()).isEqualTo("HEAD~1");
        assertThat(ex.detail()).isEqualTo("git failed");
    }

    // --- Execution-time exceptions ---

    @Test
    void securityViolationIsExecutionPhase() {
        var ex = new SecurityViolationException("Path traversal", "deploy", "../x.sh");

        assertThat(ex).isNotInstanceOf(HookLoadException.class);
        assertThat(ex.phase()).isEqualTo(HookException.Phase.EXECUTION);
        assertThat(ex.hookName()).isEqualTo("deploy");
        assertThat(ex.offendingValue()).isEqualTo("../x.sh");
    }

    @Test
    void auditWriteExceptionCarriesLocation() {
        var cause = new IOException("disk full");
        var ex = new AuditWriteException("append failed", cause, "notify", "/tmp/audit.log");

        assertThat(ex.phase()).isEqualTo(HookException.Phase.EXECUTION);
        assertThat(ex.location()).isEqualTo("/tmp/audit.log");
        assertThat(ex.getCause()).isSameAs(cause);
    }
}
