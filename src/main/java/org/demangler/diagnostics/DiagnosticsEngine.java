package org.demangler.diagnostics;

import org.demangler.api.DemangleErrorCode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * An engine for collecting diagnostic messages that occur while decoding symbols.
 * <p>
 * This decouples error reporting from the decoder: the public API never throws for
 * bad input, so a caller that wants to know why an input failed passes an engine in.
 * An engine is not thread-safe; use one per thread.
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Reports an error.
     *
     * @param code    The reason decoding failed.
     * @param message The error message.
     * @param input   The symbol being decoded.
     * @param offset  The offset at which decoding diverged.
     */
    public void reportError(DemangleErrorCode code, String message, String input, int offset) {
        diagnostics.add(new Diagnostic(code, message, input, offset));
    }

    /**
     * Checks if errors have been reported.
     *
     * @return {@code true} if at least one error exists, otherwise {@code false}.
     */
    public boolean hasErrors() {
        return !diagnostics.isEmpty();
    }

    /**
     * Returns an unmodifiable list of all collected diagnostics.
     *
     * @return An unmodifiable list of diagnostics.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * Removes all collected diagnostics so the engine can be reused.
     */
    public void clear() {
        diagnostics.clear();
    }

    /**
     * Returns all collected diagnostics as a single, formatted string.
     *
     * @return A formatted string summary of all diagnostics.
     */
    public String summary() {
        return diagnostics.stream()
                .map(Diagnostic::toString)
                .collect(Collectors.joining("\n"));
    }
}
