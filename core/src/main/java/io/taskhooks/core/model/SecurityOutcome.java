package io.taskhooks.core.model;

/** Result of the pre-spawn security checks. */
public enum SecurityOutcome {
    PASSED,
    REJECTED
}
