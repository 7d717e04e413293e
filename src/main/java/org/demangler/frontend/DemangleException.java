package org.demangler.frontend;

import org.demangler.api.DemangleErrorCode;

/**
 * Signals that the input does not follow the grammar. Thrown by the cursor and the parser
 * and caught only by the {@link org.demangler.api.Demangler}, which turns it into a
 * failure node. It never crosses the public API.
 */
public class DemangleException extends RuntimeException {

    private final DemangleErrorCode code;
    private final int offset;

    /**
     * Constructs a new demangle exception.
     * @param code The reason decoding failed.
     * @param message The detail message.
     * @param offset The cursor offset at which decoding diverged.
     */
    public DemangleException(DemangleErrorCode code, String message, int offset) {
        super(message, null, false, false);
        this.code = code;
        this.offset = offset;
    }

    public DemangleErrorCode getCode() {
        return code;
    }

    public int getOffset() {
        return offset;
    }
}
