package org.demangler.api;

/**
 * Defines the reasons why an input could not be decoded.
 * These never escape the public API as exceptions; they are reported through
 * {@link org.demangler.diagnostics.DiagnosticsEngine} and the result is a failure node.
 */
public enum DemangleErrorCode {
    /** The input is malformed or truncated, e.g. a length-prefixed literal runs past the end. */
    STRUCTURAL,
    /** A discriminator character is plausible at this position but not part of the grammar. */
    UNKNOWN_DISCRIMINATOR,
    /** A substitution or archetype reference points outside the table, or to a node of the wrong kind. */
    INVALID_BACK_REFERENCE,
    /** The input nests deeper than the configured recursion limit. */
    RECURSION_LIMIT_EXCEEDED
}
