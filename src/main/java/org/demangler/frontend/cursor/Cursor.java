package org.demangler.frontend.cursor;

import org.demangler.api.DemangleErrorCode;
import org.demangler.frontend.DemangleException;
import org.demangler.tree.Node;
import org.demangler.tree.NodeKind;

import java.util.Map;
import java.util.Optional;

/**
 * Walks an encoded symbol from left to right and decodes its low-level tokens:
 * discriminator characters, decimal numerals, indices and length-prefixed literals.
 * <p>
 * Reading past the end of the input never fails with an index error; it raises a
 * {@link DemangleException} with {@link DemangleErrorCode#STRUCTURAL} instead.
 */
public class Cursor {

    private final String input;
    private int position = 0;

    /**
     * Creates a new Cursor positioned at the start of the input.
     * @param input The encoded symbol.
     */
    public Cursor(String input) {
        this.input = input;
    }

    public String input() {
        return input;
    }

    public int position() {
        return position;
    }

    public int remaining() {
        return input.length() - position;
    }

    public boolean isAtEnd() {
        return position >= input.length();
    }

    /**
     * Returns the next character without consuming it.
     * @return The next character, or {@code '\0'} at the end of the input.
     */
    public char peek() {
        return peek(0);
    }

    /**
     * Returns a character ahead of the current position without consuming anything.
     * @param offset The distance from the current position.
     * @return The character, or {@code '\0'} if it lies beyond the end of the input.
     */
    public char peek(int offset) {
        int index = position + offset;
        return index < input.length() ? input.charAt(index) : '\0';
    }

    /**
     * Consumes the next character.
     * @return The consumed character.
     * @throws DemangleException if the input is exhausted.
     */
    public char next() {
        if (isAtEnd()) {
            throw error(DemangleErrorCode.STRUCTURAL, "Unexpected end of input");
        }
        return input.charAt(position++);
    }

    /**
     * Consumes the next character if it matches.
     * @param expected The character to match.
     * @return {@code true} if the character was consumed.
     */
    public boolean nextIf(char expected) {
        if (!isAtEnd() && input.charAt(position) == expected) {
            position++;
            return true;
        }
        return false;
    }

    /**
     * Consumes a fixed prefix if the remaining input starts with it.
     * @param expected The prefix to match.
     * @return {@code true} if the prefix was consumed.
     */
    public boolean nextIf(String expected) {
        if (input.startsWith(expected, position)) {
            position += expected.length();
            return true;
        }
        return false;
    }

    /**
     * Consumes a fixed number of characters.
     * @param count The number of characters to consume.
     * @return The consumed characters.
     * @throws DemangleException if fewer characters remain.
     */
    public String next(int count) {
        if (count > remaining()) {
            throw error(DemangleErrorCode.STRUCTURAL, "Expected " + count + " more characters but only " + remaining() + " remain");
        }
        String chunk = input.substring(position, position + count);
        position += count;
        return chunk;
    }

    /**
     * Consumes a required character.
     * @param expected The character that must come next.
     * @throws DemangleException if another character or the end of input follows.
     */
    public void expect(char expected) {
        if (!nextIf(expected)) {
            if (isAtEnd()) {
                throw error(DemangleErrorCode.STRUCTURAL, "Expected '" + expected + "' but reached end of input");
            }
            throw error(DemangleErrorCode.STRUCTURAL, "Expected '" + expected + "' but found '" + peek() + "'");
        }
    }

    /**
     * Decodes a bare decimal numeral.
     * @return The value of the numeral.
     * @throws DemangleException if no digit follows or the value does not fit into an {@code int}.
     */
    public int readNatural() {
        if (!isDigit(peek())) {
            throw error(DemangleErrorCode.STRUCTURAL, "Expected a number");
        }
        long value = 0;
        while (isDigit(peek())) {
            value = value * 10 + (next() - '0');
            if (value > Integer.MAX_VALUE) {
                throw error(DemangleErrorCode.STRUCTURAL, "Number is too large");
            }
        }
        return (int) value;
    }

    /**
     * Decodes a bare decimal numeral into a standalone {@link NodeKind#NUMBER} leaf.
     * @return The new number node.
     */
    public Node readNumber() {
        return Node.create(NodeKind.NUMBER, Integer.toString(readNatural()));
    }

    /**
     * Decodes an index: {@code '_'} stands for 0 and {@code <n>'_'} for n + 1.
     * @return The decoded index.
     */
    public int readIndex() {
        if (nextIf('_')) {
            return 0;
        }
        int value = readNatural();
        expect('_');
        if (value == Integer.MAX_VALUE) {
            throw error(DemangleErrorCode.STRUCTURAL, "Index is too large");
        }
        return value + 1;
    }

    /**
     * Decodes a length-prefixed literal: a decimal count followed by exactly that many bytes
     * of UTF-8 encoded text.
     * @return The literal characters.
     * @throws DemangleException if the count is zero, exceeds the remaining input or ends
     *         inside a multi-byte character.
     */
    public String readLengthPrefixed() {
        int start = position;
        int length = readNatural();
        if (length == 0) {
            throw new DemangleException(DemangleErrorCode.STRUCTURAL, "Literal of length zero", start);
        }
        int end = position;
        int bytes = 0;
        while (bytes < length) {
            if (end >= input.length()) {
                throw new DemangleException(DemangleErrorCode.STRUCTURAL,
                        "Literal of length " + length + " exceeds the remaining " + bytes + " bytes", start);
            }
            int codePoint = input.codePointAt(end);
            bytes += utf8Length(codePoint);
            end += Character.charCount(codePoint);
        }
        if (bytes != length) {
            throw new DemangleException(DemangleErrorCode.STRUCTURAL,
                    "Literal of length " + length + " ends inside a multi-byte character", start);
        }
        String literal = input.substring(position, end);
        position = end;
        return literal;
    }

    private static int utf8Length(int codePoint) {
        if (codePoint < 0x80) {
            return 1;
        }
        if (codePoint < 0x800) {
            return 2;
        }
        if (codePoint < 0x10000) {
            return 3;
        }
        return 4;
    }

    /**
     * Looks up the next one or two characters in a discriminator table, preferring the
     * two-character match. On a match the discriminator is consumed.
     * @param table A closed mapping from discriminators to node kinds.
     * @return The matched kind, or empty if neither prefix is in the table. Nothing is consumed then.
     */
    public Optional<NodeKind> nextDiscriminator(Map<String, NodeKind> table) {
        if (remaining() >= 2) {
            NodeKind kind = table.get(input.substring(position, position + 2));
            if (kind != null) {
                position += 2;
                return Optional.of(kind);
            }
        }
        if (remaining() >= 1) {
            NodeKind kind = table.get(input.substring(position, position + 1));
            if (kind != null) {
                position += 1;
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }

    /**
     * Creates an exception located at the current position.
     * @param code The error code.
     * @param message The detail message.
     * @return The exception, ready to be thrown.
     */
    public DemangleException error(DemangleErrorCode code, String message) {
        return new DemangleException(code, message, position);
    }

    public static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }
}
