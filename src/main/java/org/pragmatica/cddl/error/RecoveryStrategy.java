package org.pragmatica.cddl.error;

/**
 * What the parser does after a non-fatal error.
 */
public enum RecoveryStrategy {
    /**
     * Fail immediately on first error.
     */
    NONE,

    /**
     * Skip to the next rule definition and keep parsing, collecting every error.
     */
    BASIC
}
