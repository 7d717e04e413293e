package org.demangler.diagnostics;

import org.demangler.api.DemangleErrorCode;

/**
 * Represents the error that stopped the decoding of a symbol.
 *
 * @param code The reason decoding failed.
 * @param message The diagnostic message.
 * @param input The symbol that was being decoded.
 * @param offset The character offset in the input at which decoding diverged.
 */
public record Diagnostic(
        DemangleErrorCode code,
        String message,
        String input,
        int offset
) {
    @Override
    public String toString() {
        return String.format("%s %s@%d: %s", code, input, offset, message);
    }
}
