package org.demangler.frontend.parser;

import org.demangler.api.DemangleErrorCode;
import org.demangler.frontend.DemangleException;
import org.demangler.frontend.cursor.Cursor;
import org.demangler.tree.Node;
import org.demangler.tree.NodeKind;
import org.demangler.tree.TreeWalker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;

import static org.demangler.tree.NodeKind.*;

/**
 * The recursive-descent decoder. It consumes an encoded symbol through a {@link Cursor}
 * and builds a tree of {@link Node}s, one method per production family.
 * <p>
 * A parser decodes exactly one symbol and is not reusable. On the first mismatch it throws
 * a {@link DemangleException}; the partially built subtrees are simply dropped.
 */
public class Parser {

    private static final Logger LOG = LoggerFactory.getLogger(Parser.class);

    /** Upper bound on the nodes produced by resolving substitutions in one decode. */
    static final int MAX_EXPANDED_NODES = 1 << 16;

    private static final String MARKER = "_T";
    private static final String BUILTIN_PREFIX = "Builtin.";

    private static final Map<String, NodeKind> METADATA_RECORDS = Map.of(
            "MP", GENERIC_TYPE_METADATA_PATTERN,
            "Mm", METACLASS,
            "Mn", NOMINAL_TYPE_DESCRIPTOR,
            "M", TYPE_METADATA);

    private static final Map<String, NodeKind> WITNESS_RECORDS = Map.of(
            "WV", VALUE_WITNESS_TABLE,
            "Wo", WITNESS_TABLE_OFFSET,
            "Wv", FIELD_OFFSET,
            "WP", PROTOCOL_WITNESS_TABLE,
            "Wz", LAZY_PROTOCOL_WITNESS_TABLE_ACCESSOR,
            "WZ", LAZY_PROTOCOL_WITNESS_TABLE_TEMPLATE,
            "WD", DEPENDENT_PROTOCOL_WITNESS_TABLE_GENERATOR,
            "Wd", DEPENDENT_PROTOCOL_WITNESS_TABLE_TEMPLATE);

    private static final Map<String, NodeKind> NOMINAL_TYPES = Map.of(
            "C", CLASS,
            "V", STRUCTURE,
            "O", ENUM);

    private static final Map<String, NodeKind> ENTITY_NAMES = Map.of(
            "C", ALLOCATOR,
            "c", CONSTRUCTOR,
            "D", DEALLOCATOR,
            "d", DESTRUCTOR,
            "g", GETTER,
            "s", SETTER,
            "a", ADDRESSOR);

    private static final Map<String, NodeKind> OPERATOR_FIXITIES = Map.of(
            "p", PREFIX_OPERATOR,
            "i", INFIX_OPERATOR,
            "P", POSTFIX_OPERATOR);

    private static final Map<Character, Character> OPERATOR_CHARACTERS = Map.ofEntries(
            Map.entry('a', '&'), Map.entry('c', '@'), Map.entry('d', '/'), Map.entry('e', '='),
            Map.entry('g', '>'), Map.entry('l', '<'), Map.entry('m', '*'), Map.entry('n', '!'),
            Map.entry('o', '|'), Map.entry('p', '+'), Map.entry('r', '%'), Map.entry('s', '-'),
            Map.entry('t', '~'), Map.entry('x', '^'), Map.entry('z', '.'));

    private final Cursor cursor;
    private final int maxDepth;
    private final SubstitutionTable substitutions = new SubstitutionTable();
    private final GenericScopes generics = new GenericScopes();
    private int depth = 0;
    private long expandedNodes = 0;

    /**
     * Constructs a new Parser.
     * @param input The encoded symbol.
     * @param maxDepth The maximum nesting of types and contexts before decoding is abandoned.
     */
    public Parser(String input, int maxDepth) {
        this.cursor = new Cursor(input);
        this.maxDepth = maxDepth;
    }

    /**
     * Decodes the whole input. The optional {@code _T} marker is skipped.
     * @return The root of the decoded tree.
     * @throws DemangleException if the input does not follow the grammar.
     */
    public Node parse() {
        cursor.nextIf(MARKER);
        Node global = parseGlobal();
        if (!cursor.isAtEnd()) {
            throw cursor.error(DemangleErrorCode.STRUCTURAL, "Unexpected trailing characters");
        }
        return global;
    }

    /**
     * Returns the substitutions registered so far, in completion order.
     * @return The substitution table of this decode.
     */
    public SubstitutionTable getSubstitutions() {
        return substitutions;
    }

    private Node parseGlobal() {
        enter();
        try {
            return switch (cursor.peek()) {
                case 'T' -> parseThunk();
                case 't' -> {
                    cursor.next();
                    yield typed(parseType());
                }
                case 'M' -> parseMetadataRecord();
                case 'w' -> parseValueWitness();
                case 'W' -> parseWitnessRecord();
                case 'F', 'v' -> parseEntity();
                default -> throw unexpected("symbol");
            };
        } finally {
            leave();
        }
    }

    private Node parseThunk() {
        cursor.next();
        int start = cursor.position();
        char kind = cursor.next();
        return switch (kind) {
            case 'o' -> node(OBJC_ATTRIBUTE, parseGlobal());
            case 'b' -> node(BRIDGE_TO_BLOCK_FUNCTION, typed(parseType()));
            case 'W' -> {
                Node conformance = parseConformance();
                yield node(PROTOCOL_WITNESS, conformance, parseEntity());
            }
            default -> throw new DemangleException(DemangleErrorCode.UNKNOWN_DISCRIMINATOR,
                    "Unknown thunk discriminator '" + kind + "'", start);
        };
    }

    private Node parseMetadataRecord() {
        NodeKind kind = cursor.nextDiscriminator(METADATA_RECORDS).orElseThrow(() -> unexpected("metadata record"));
        if (kind == TYPE_METADATA || kind == GENERIC_TYPE_METADATA_PATTERN) {
            Node directness = parseDirectness();
            return node(kind, directness, typed(parseType()));
        }
        return node(kind, typed(parseType()));
    }

    private Node parseValueWitness() {
        cursor.next();
        int start = cursor.position();
        String code = cursor.next(2);
        ValueWitnessKind witness = ValueWitnessKind.forCode(code).orElseThrow(() -> new DemangleException(
                DemangleErrorCode.UNKNOWN_DISCRIMINATOR, "Unknown value witness '" + code + "'", start));
        Node node = Node.create(VALUE_WITNESS_KIND, witness.displayName());
        node.addChild(typed(parseType()));
        return node;
    }

    private Node parseWitnessRecord() {
        NodeKind kind = cursor.nextDiscriminator(WITNESS_RECORDS).orElseThrow(() -> unexpected("witness record"));
        return switch (kind) {
            case VALUE_WITNESS_TABLE -> node(kind, typed(parseType()));
            case WITNESS_TABLE_OFFSET -> node(kind, parseEntity());
            case FIELD_OFFSET -> {
                Node directness = parseDirectness();
                yield node(kind, directness, parseEntity());
            }
            default -> node(kind, parseConformance());
        };
    }

    private Node parseDirectness() {
        if (cursor.nextIf('d')) {
            return Node.create(DIRECTNESS, "direct");
        }
        if (cursor.nextIf('i')) {
            return Node.create(DIRECTNESS, "indirect");
        }
        throw unexpected("directness");
    }

    // region Entities and contexts

    private Node parseEntity() {
        if (!cursor.nextIf('F') && !cursor.nextIf('v')) {
            throw unexpected("entity");
        }
        Node context = parseContext();
        return parseEntityName(context);
    }

    private Node parseEntityName(Node context) {
        Optional<NodeKind> special = cursor.nextDiscriminator(ENTITY_NAMES);
        if (special.isEmpty()) {
            Node name = parseDeclName();
            return node(DECLARATION, context, name, typed(parseType()));
        }
        NodeKind kind = special.get();
        return switch (kind) {
            case ALLOCATOR, CONSTRUCTOR -> node(kind, context, typed(parseType()));
            case DEALLOCATOR, DESTRUCTOR -> node(kind, context);
            default -> {
                Node name = parseDeclName();
                yield node(kind, context, name, typed(parseType()));
            }
        };
    }

    private Node parseDeclName() {
        if (cursor.nextIf('L')) {
            Node index = Node.create(NUMBER, Integer.toString(cursor.readIndex()));
            return node(LOCAL_ENTITY, index, parseIdentifier());
        }
        if (cursor.nextIf('o')) {
            return parseOperator();
        }
        return parseIdentifier();
    }

    private Node parseIdentifier() {
        if (!Cursor.isDigit(cursor.peek())) {
            throw unexpected("identifier");
        }
        return Node.create(IDENTIFIER, cursor.readLengthPrefixed());
    }

    private Node parseOperator() {
        NodeKind fixity = cursor.nextDiscriminator(OPERATOR_FIXITIES).orElseThrow(() -> unexpected("operator fixity"));
        String encoded = cursor.readLengthPrefixed();
        int start = cursor.position() - encoded.length();
        StringBuilder spelling = new StringBuilder(encoded.length());
        for (int i = 0; i < encoded.length(); i++) {
            Character decoded = OPERATOR_CHARACTERS.get(encoded.charAt(i));
            if (decoded == null) {
                throw new DemangleException(DemangleErrorCode.UNKNOWN_DISCRIMINATOR,
                        "Unknown operator character '" + encoded.charAt(i) + "'", start + i);
            }
            spelling.append(decoded.charValue());
        }
        return Node.create(fixity, spelling.toString());
    }

    private Node parseContext() {
        enter();
        try {
            char c = cursor.peek();
            if (c == 'S') {
                int start = cursor.position();
                Node substitution = parseSubstitution();
                NodeKind kind = substitution.getKind();
                if (kind != MODULE && !kind.isBindableNominal()) {
                    throw new DemangleException(DemangleErrorCode.INVALID_BACK_REFERENCE,
                            "Substitution of kind " + kind + " cannot be used as a context", start);
                }
                return substitution;
            }
            if (Cursor.isDigit(c)) {
                Node module = Node.create(MODULE, cursor.readLengthPrefixed());
                register(module);
                return module;
            }
            if (c == 'F') {
                cursor.next();
                Node outer = parseContext();
                return node(DECL_CONTEXT, parseEntityName(outer));
            }
            if (NOMINAL_TYPES.containsKey(String.valueOf(c))) {
                return parseNominalType();
            }
            throw unexpected("context");
        } finally {
            leave();
        }
    }

    private Node parseNominalType() {
        NodeKind kind = cursor.nextDiscriminator(NOMINAL_TYPES).orElseThrow(() -> unexpected("nominal type"));
        Node context = parseContext();
        Node nominal = node(kind, context, parseDeclName());
        register(nominal);
        return nominal;
    }

    private Node parseProtocol() {
        Node context;
        if (cursor.peek() == 'S') {
            int start = cursor.position();
            Node substitution = parseSubstitution();
            NodeKind kind = substitution.getKind();
            if (kind == PROTOCOL) {
                return substitution;
            }
            if (kind != MODULE && !kind.isBindableNominal()) {
                throw new DemangleException(DemangleErrorCode.INVALID_BACK_REFERENCE,
                        "Substitution of kind " + kind + " is neither a protocol nor a context", start);
            }
            context = substitution;
        } else {
            context = parseContext();
        }
        Node protocol = node(PROTOCOL, context, parseDeclName());
        register(protocol);
        return protocol;
    }

    private Node parseSubstitution() {
        int start = cursor.position();
        cursor.expect('S');
        Optional<KnownSubstitution> known = KnownSubstitution.forCode(cursor.peek());
        if (known.isPresent()) {
            cursor.next();
            return known.get().toNode();
        }
        if (cursor.peek() != '_' && !Cursor.isDigit(cursor.peek())) {
            throw unexpected("substitution");
        }
        int index = cursor.readIndex();
        if (!substitutions.contains(index)) {
            throw new DemangleException(DemangleErrorCode.INVALID_BACK_REFERENCE,
                    "Substitution " + index + " is out of range, " + substitutions.size() + " registered", start);
        }
        Node resolved = substitutions.resolve(index);
        expandedNodes += TreeWalker.countNodes(resolved);
        if (expandedNodes > MAX_EXPANDED_NODES) {
            throw new DemangleException(DemangleErrorCode.RECURSION_LIMIT_EXCEEDED,
                    "Substitutions expand to more than " + MAX_EXPANDED_NODES + " nodes", start);
        }
        return resolved;
    }

    private void register(Node node) {
        int index = substitutions.register(node);
        if (LOG.isTraceEnabled()) {
            LOG.trace("Registered substitution #{} for {} at offset {}", index, node.getKind(), cursor.position());
        }
    }

    // endregion

    // region Types

    private Node parseType() {
        enter();
        try {
            if (cursor.isAtEnd()) {
                throw cursor.error(DemangleErrorCode.STRUCTURAL, "Unexpected end of input, expected a type");
            }
            return switch (cursor.peek()) {
                case 'B' -> parseBuiltinType();
                case 'A' -> parseArrayType();
                case 'a' -> parseTypeAlias();
                case 'b' -> parseFunctionShape(OBJC_BLOCK);
                case 'F' -> parseFunctionShape(FUNCTION_TYPE);
                case 'f' -> parseFunctionShape(UNCURRIED_FUNCTION_TYPE);
                case 'G' -> parseBoundGeneric();
                case 'M' -> parseModifier(META_TYPE);
                case 'R' -> parseModifier(IN_OUT);
                case 'P' -> parseProtocolList();
                case 'Q' -> parseArchetypeRef();
                case 'T' -> parseTuple(NON_VARIADIC_TUPLE);
                case 't' -> parseTuple(VARIADIC_TUPLE);
                case 'U' -> parseGenericType();
                case 'X' -> parseReferenceOwnership();
                case 'E' -> parseErrorType();
                case 'S' -> parseTypeSubstitution();
                case 'C', 'V', 'O' -> parseNominalType();
                default -> throw unexpected("type");
            };
        } finally {
            leave();
        }
    }

    private Node parseBuiltinType() {
        cursor.next();
        int start = cursor.position();
        char kind = cursor.next();
        String name = switch (kind) {
            case 'f' -> "Float" + sizedSuffix();
            case 'i' -> "Int" + sizedSuffix();
            case 'O' -> "ObjCPointer";
            case 'o' -> "ObjectPointer";
            case 'p' -> "RawPointer";
            case 'u' -> "OpaquePointer";
            case 'v' -> {
                int count = cursor.readNatural();
                int elementStart = cursor.position();
                Node element = parseType();
                if (element.getKind() != BUILTIN_TYPE_NAME) {
                    throw new DemangleException(DemangleErrorCode.STRUCTURAL,
                            "Vector elements must be builtin types, found " + element.getKind(), elementStart);
                }
                yield "Vec" + count + "x" + element.getText().substring(BUILTIN_PREFIX.length());
            }
            default -> throw new DemangleException(DemangleErrorCode.UNKNOWN_DISCRIMINATOR,
                    "Unknown builtin type '" + kind + "'", start);
        };
        return Node.create(BUILTIN_TYPE_NAME, BUILTIN_PREFIX + name);
    }

    private int sizedSuffix() {
        int bits = cursor.readNatural();
        cursor.expect('_');
        return bits;
    }

    private Node parseArrayType() {
        cursor.next();
        Node size = cursor.readNumber();
        return node(ARRAY_TYPE, size, typed(parseType()));
    }

    private Node parseTypeAlias() {
        cursor.next();
        Node context = parseContext();
        return node(PATH, context, parseDeclName());
    }

    private Node parseFunctionShape(NodeKind kind) {
        cursor.next();
        Node arguments = node(ARGUMENT_TUPLE, typed(parseType()));
        Node result = node(RETURN_TYPE, typed(parseType()));
        return node(kind, arguments, result);
    }

    private Node parseModifier(NodeKind kind) {
        cursor.next();
        return node(kind, typed(parseType()));
    }

    private Node parseReferenceOwnership() {
        cursor.next();
        int start = cursor.position();
        char kind = cursor.next();
        return switch (kind) {
            case 'o' -> node(UNOWNED, typed(parseType()));
            case 'w' -> node(WEAK, typed(parseType()));
            default -> throw new DemangleException(DemangleErrorCode.UNKNOWN_DISCRIMINATOR,
                    "Unknown reference ownership '" + kind + "'", start);
        };
    }

    private Node parseErrorType() {
        if (!cursor.nextIf("ERR")) {
            throw unexpected("type");
        }
        return Node.create(ERROR_TYPE);
    }

    private Node parseTypeSubstitution() {
        int start = cursor.position();
        Node substitution = parseSubstitution();
        if (!substitution.getKind().isNominal()) {
            throw new DemangleException(DemangleErrorCode.INVALID_BACK_REFERENCE,
                    "Substitution of kind " + substitution.getKind() + " is not a type", start);
        }
        return substitution;
    }

    private Node parseBoundGeneric() {
        cursor.next();
        int start = cursor.position();
        Node base = parseType();
        NodeKind kind = switch (base.getKind()) {
            case CLASS -> BOUND_GENERIC_CLASS;
            case STRUCTURE -> BOUND_GENERIC_STRUCTURE;
            case ENUM -> BOUND_GENERIC_ENUM;
            default -> throw new DemangleException(DemangleErrorCode.STRUCTURAL,
                    "Only classes, structures and enums take generic arguments, found " + base.getKind(), start);
        };
        Node arguments = Node.create(TYPE_LIST);
        do {
            arguments.addChild(typed(parseType()));
        } while (!cursor.nextIf('_'));
        return node(kind, typed(base), arguments);
    }

    private Node parseProtocolList() {
        cursor.next();
        Node protocols = Node.create(TYPE_LIST);
        while (!cursor.nextIf('_')) {
            protocols.addChild(typed(parseProtocol()));
        }
        return node(PROTOCOL_LIST, protocols);
    }

    private Node parseTuple(NodeKind kind) {
        cursor.next();
        int start = cursor.position();
        Node tuple = Node.create(kind);
        while (!cursor.nextIf('_')) {
            Node element = Node.create(TUPLE_ELEMENT);
            if (Cursor.isDigit(cursor.peek())) {
                element.addChild(Node.create(TUPLE_ELEMENT_NAME, cursor.readLengthPrefixed()));
            }
            element.addChild(node(TUPLE_ELEMENT_TYPE, parseType()));
            tuple.addChild(element);
        }
        if (kind == VARIADIC_TUPLE && !tuple.hasChildren()) {
            throw new DemangleException(DemangleErrorCode.STRUCTURAL, "A variadic tuple needs at least one element", start);
        }
        return tuple;
    }

    // endregion

    // region Generics

    private Node parseGenericType() {
        cursor.next();
        generics.enterScope();
        Node archetypes = parseArchetypeList();
        Node type = typed(parseType());
        generics.leaveScope();
        return node(GENERIC_TYPE, archetypes, type);
    }

    private Node parseArchetypeList() {
        long last = cursor.readIndex();
        Node list = Node.create(ARCHETYPE_LIST);
        for (long i = 0; i <= last; i++) {
            Node archetype = Node.create(ARCHETYPE_REF, generics.declareArchetype());
            Node protocols = Node.create(TYPE_LIST);
            while (!cursor.nextIf('_')) {
                protocols.addChild(typed(parseProtocol()));
            }
            if (protocols.hasChildren()) {
                list.addChild(node(ARCHETYPE_AND_PROTOCOL, archetype, node(PROTOCOL_LIST, protocols)));
            } else {
                list.addChild(archetype);
            }
        }
        return list;
    }

    private Node parseArchetypeRef() {
        int start = cursor.position();
        cursor.next();
        if (cursor.nextIf('d')) {
            int scope = cursor.readIndex();
            int index = cursor.readIndex();
            return archetype(scope + 1L, index, start);
        }
        if (cursor.nextIf('P')) {
            return node(SELF_TYPE_REF, typed(parseProtocol()));
        }
        if (cursor.nextIf('q')) {
            Node index = Node.create(NUMBER, Integer.toString(cursor.readIndex()));
            return node(QUALIFIED_ARCHETYPE, index, parseContext());
        }
        if (cursor.nextIf('a')) {
            Node base = typed(parseType());
            return node(ASSOCIATED_TYPE_REF, base, parseIdentifier());
        }
        return archetype(0, cursor.readIndex(), start);
    }

    private Node archetype(long scope, int index, int start) {
        if (scope > Integer.MAX_VALUE) {
            throw new DemangleException(DemangleErrorCode.INVALID_BACK_REFERENCE, "Archetype scope is out of range", start);
        }
        return generics.resolve((int) scope, index)
                .map(name -> Node.create(ARCHETYPE_REF, name))
                .orElseThrow(() -> new DemangleException(DemangleErrorCode.INVALID_BACK_REFERENCE,
                        "Archetype " + index + " at depth " + scope + " is not in scope, "
                                + generics.depth() + " generic scopes open", start));
    }

    private Node parseConformance() {
        Node conformance = Node.create(PROTOCOL_CONFORMANCE);
        boolean generic = cursor.nextIf('U');
        if (generic) {
            generics.enterScope();
            conformance.addChild(parseArchetypeList());
        }
        conformance.addChild(typed(parseType()));
        if (generic) {
            generics.leaveScope();
        }
        conformance.addChild(typed(parseProtocol()));
        int start = cursor.position();
        Node module = parseContext();
        if (module.getKind() != MODULE) {
            throw new DemangleException(DemangleErrorCode.STRUCTURAL,
                    "A conformance must name its module, found " + module.getKind(), start);
        }
        conformance.addChild(module);
        return conformance;
    }

    // endregion

    // region Helpers

    private void enter() {
        if (++depth > maxDepth) {
            throw cursor.error(DemangleErrorCode.RECURSION_LIMIT_EXCEEDED, "Nesting exceeds " + maxDepth + " levels");
        }
    }

    private void leave() {
        depth--;
    }

    private DemangleException unexpected(String production) {
        if (cursor.isAtEnd()) {
            return cursor.error(DemangleErrorCode.STRUCTURAL, "Unexpected end of input, expected " + production);
        }
        return cursor.error(DemangleErrorCode.UNKNOWN_DISCRIMINATOR,
                "Unknown " + production + " discriminator '" + cursor.peek() + "'");
    }

    private static Node typed(Node type) {
        return node(TYPE, type);
    }

    private static Node node(NodeKind kind, Node... children) {
        Node node = Node.create(kind);
        for (Node child : children) {
            node.addChild(child);
        }
        return node;
    }

    // endregion
}
