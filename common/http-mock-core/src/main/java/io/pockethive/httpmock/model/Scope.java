package io.pockethive.httpmock.model;

/**
 * Lifetime policy of a mounted rule.
 */
public enum Scope {
    /** Lives until the server stops. */
    GLOBAL,
    /** Lives until its {@code ScopeGuard} is released. */
    SCOPED
}
