package org.demangler.frontend.parser;

import org.demangler.tree.Node;
import org.demangler.tree.NodeKind;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Standard library entities with a reserved one-letter substitution after {@code 'S'}.
 * They are spelled out on use and never occupy a slot in the {@link SubstitutionTable}.
 */
public enum KnownSubstitution {
    SWIFT_MODULE('s', null, "Swift"),
    OBJC_MODULE('o', null, "__ObjC"),
    C_MODULE('C', null, "C"),
    ARRAY('a', NodeKind.STRUCTURE, "Array"),
    BOOL('b', NodeKind.STRUCTURE, "Bool"),
    UNICODE_SCALAR('c', NodeKind.STRUCTURE, "UnicodeScalar"),
    DOUBLE('d', NodeKind.STRUCTURE, "Double"),
    FLOAT('f', NodeKind.STRUCTURE, "Float"),
    INT('i', NodeKind.STRUCTURE, "Int"),
    UINT('u', NodeKind.STRUCTURE, "UInt"),
    STRING('S', NodeKind.STRUCTURE, "String"),
    OPTIONAL('q', NodeKind.ENUM, "Optional"),
    IMPLICITLY_UNWRAPPED_OPTIONAL('Q', NodeKind.ENUM, "ImplicitlyUnwrappedOptional");

    /** The module that hosts every known nominal type. */
    public static final String STANDARD_LIBRARY = "Swift";

    private static final Map<Character, KnownSubstitution> BY_CODE = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(KnownSubstitution::code, Function.identity()));

    private final char code;
    private final NodeKind kind;
    private final String name;

    KnownSubstitution(char code, NodeKind kind, String name) {
        this.code = code;
        this.kind = kind;
        this.name = name;
    }

    public char code() {
        return code;
    }

    /**
     * Finds the known substitution for a code character.
     * @param code The character following {@code 'S'}.
     * @return The known substitution, or empty if the character is not reserved.
     */
    public static Optional<KnownSubstitution> forCode(char code) {
        return Optional.ofNullable(BY_CODE.get(code));
    }

    /**
     * Builds a fresh subtree for this entity: a module leaf, or a nominal node whose
     * context is the standard library module.
     * @return The new, unlinked subtree.
     */
    public Node toNode() {
        if (kind == null) {
            return Node.create(NodeKind.MODULE, name);
        }
        Node nominal = Node.create(kind);
        nominal.addChildren(Node.create(NodeKind.MODULE, STANDARD_LIBRARY), Node.create(NodeKind.IDENTIFIER, name));
        return nominal;
    }
}
