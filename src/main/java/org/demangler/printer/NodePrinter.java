package org.demangler.printer;

import org.demangler.api.DemangleOptions;
import org.demangler.frontend.parser.KnownSubstitution;
import org.demangler.tree.Node;
import org.demangler.tree.NodeKind;

import java.util.StringJoiner;

/**
 * Renders a decoded tree to human-readable text.
 * <p>
 * Printing is pure: the tree is only read, and the same tree and options always give the
 * same text. Missing children render as the empty string, so any tree can be printed,
 * including hand-built ones that the decoder would never produce.
 */
public class NodePrinter {

    private final DemangleOptions options;

    /**
     * Creates a printer for one set of options.
     * @param options The rendering options.
     */
    public NodePrinter(DemangleOptions options) {
        this.options = options;
    }

    /**
     * Renders a tree.
     * @param node The root of the tree to render.
     * @return The rendered text.
     */
    public String print(Node node) {
        if (node == null) {
            return "";
        }
        return switch (node.getKind()) {
            case FAILURE, MODULE, IDENTIFIER, NUMBER, BUILTIN_TYPE_NAME, TUPLE_ELEMENT_NAME,
                    ARCHETYPE_REF, DIRECTNESS -> node.getText();
            case UNKNOWN -> node.hasText() ? node.getText() : "<unknown>";
            case CLASS, STRUCTURE, ENUM, PROTOCOL, PATH -> qualified(node);
            case PREFIX_OPERATOR -> node.getText() + " prefix";
            case INFIX_OPERATOR -> node.getText() + " infix";
            case POSTFIX_OPERATOR -> node.getText() + " postfix";
            case LOCAL_ENTITY -> "(" + part(node, 1) + " #" + localOrdinal(child(node, 0)) + ")";
            case TYPE, TUPLE_ELEMENT_TYPE, DECL_CONTEXT, ARGUMENT_TUPLE, RETURN_TYPE -> part(node, 0);
            case TYPE_LIST, ARCHETYPE_LIST -> joined(node);

            case DECLARATION -> qualified(node) + signature(child(node, 2));
            case GETTER -> qualified(node) + ".getter : " + part(node, 2);
            case SETTER -> qualified(node) + ".setter : " + part(node, 2);
            case ADDRESSOR -> qualified(node) + ".addressor : " + part(node, 2);
            case CONSTRUCTOR -> part(node, 0) + ".init" + signature(child(node, 1));
            case ALLOCATOR -> part(node, 0) + ".__allocating_init" + signature(child(node, 1));
            case DESTRUCTOR -> part(node, 0) + ".deinit";
            case DEALLOCATOR -> part(node, 0) + ".__deallocating_deinit";

            case FUNCTION_TYPE -> arguments(node) + " -> " + part(node, 1);
            case UNCURRIED_FUNCTION_TYPE -> uncurried(node);
            case OBJC_BLOCK -> "@objc_block " + arguments(node) + " -> " + part(node, 1);
            case NON_VARIADIC_TUPLE, VARIADIC_TUPLE -> tuple(node);
            case TUPLE_ELEMENT -> tupleElement(node);

            case BOUND_GENERIC_CLASS, BOUND_GENERIC_STRUCTURE, BOUND_GENERIC_ENUM -> boundGeneric(node);
            case GENERIC_TYPE -> genericType(node);
            case ARCHETYPE_AND_PROTOCOL -> part(node, 0) + " : " + part(node, 1);
            case PROTOCOL_LIST -> protocolList(node);
            case SELF_TYPE_REF -> part(node, 0) + ".Self";
            case ASSOCIATED_TYPE_REF -> part(node, 0) + "." + part(node, 1);
            case QUALIFIED_ARCHETYPE -> "(archetype " + part(node, 0) + " of " + part(node, 1) + ")";

            case META_TYPE -> part(node, 0) + ".Type";
            case IN_OUT -> "inout " + part(node, 0);
            case WEAK -> "weak " + part(node, 0);
            case UNOWNED -> "unowned " + part(node, 0);
            case ARRAY_TYPE -> part(node, 1) + "[" + part(node, 0) + "]";
            case ERROR_TYPE -> "<ERROR TYPE>";

            case TYPE_METADATA -> part(node, 0) + " type metadata for " + part(node, 1);
            case GENERIC_TYPE_METADATA_PATTERN -> part(node, 0) + " generic type metadata pattern for " + part(node, 1);
            case METACLASS -> "metaclass for " + part(node, 0);
            case NOMINAL_TYPE_DESCRIPTOR -> "nominal type descriptor for " + part(node, 0);
            case FIELD_OFFSET -> part(node, 0) + " field offset for " + fieldOffsetEntity(child(node, 1));
            case WITNESS_TABLE_OFFSET -> "witness table offset for " + part(node, 0);
            case VALUE_WITNESS_TABLE -> "value witness table for " + part(node, 0);
            case VALUE_WITNESS_KIND -> node.getText() + " value witness for " + part(node, 0);
            case PROTOCOL_WITNESS_TABLE -> "protocol witness table for " + part(node, 0);
            case LAZY_PROTOCOL_WITNESS_TABLE_ACCESSOR -> "lazy protocol witness table accessor for " + part(node, 0);
            case LAZY_PROTOCOL_WITNESS_TABLE_TEMPLATE -> "lazy protocol witness table template for " + part(node, 0);
            case DEPENDENT_PROTOCOL_WITNESS_TABLE_GENERATOR -> "dependent protocol witness table generator for " + part(node, 0);
            case DEPENDENT_PROTOCOL_WITNESS_TABLE_TEMPLATE -> "dependent protocol witness table template for " + part(node, 0);
            case PROTOCOL_CONFORMANCE -> conformance(node);
            case PROTOCOL_WITNESS -> "protocol witness for " + part(node, 1) + " in conformance " + part(node, 0);

            case OBJC_ATTRIBUTE -> "@objc " + part(node, 0);
            case BRIDGE_TO_BLOCK_FUNCTION -> "bridge-to-block function for " + part(node, 0);
        };
    }

    private String qualified(Node node) {
        return part(node, 0) + "." + part(node, 1);
    }

    /**
     * Function-like types follow the name directly, anything else after a colon.
     */
    private String signature(Node type) {
        if (type == null) {
            return "";
        }
        String text = print(type);
        return isFunctionLike(type) ? text : " : " + text;
    }

    private String fieldOffsetEntity(Node entity) {
        if (entity != null && entity.getKind() == NodeKind.DECLARATION && !options.displayTypeOfIVarFieldOffset()) {
            return qualified(entity);
        }
        return print(entity);
    }

    private String arguments(Node function) {
        Node arguments = child(function, 0);
        String text = print(arguments);
        return isTuple(arguments) ? text : "(" + text + ")";
    }

    private String uncurried(Node node) {
        Node result = child(node, 1);
        String rest = print(result);
        if (isFunctionLike(result)) {
            return arguments(node) + rest;
        }
        return arguments(node) + " -> " + rest;
    }

    private String tuple(Node node) {
        StringJoiner joiner = new StringJoiner(", ", "(", ")");
        for (Node element : node) {
            joiner.add(print(element));
        }
        String text = joiner.toString();
        if (node.getKind() == NodeKind.VARIADIC_TUPLE && node.hasChildren()) {
            return text.substring(0, text.length() - 1) + "...)";
        }
        return text;
    }

    private String tupleElement(Node element) {
        if (element.getNumChildren() == 2) {
            return part(element, 0) + " : " + part(element, 1);
        }
        return part(element, 0);
    }

    private String protocolList(Node node) {
        Node protocols = child(node, 0);
        int count = protocols == null ? 0 : protocols.getNumChildren();
        if (count == 0) {
            return "protocol<>";
        }
        if (count == 1) {
            return print(protocols);
        }
        return "protocol<" + print(protocols) + ">";
    }

    private String boundGeneric(Node node) {
        Node arguments = child(node, 1);
        if (options.synthesizeSugarOnTypes() && arguments != null) {
            String sugared = sugar(unwrap(child(node, 0)), arguments);
            if (sugared != null) {
                return sugared;
            }
        }
        return part(node, 0) + "<" + print(arguments) + ">";
    }

    /**
     * Spells standard library collections and optionals with their shorthand.
     * @return The sugared text, or {@code null} if the base has no shorthand.
     */
    private String sugar(Node base, Node arguments) {
        if (base == null || !isStandardLibrary(base)) {
            return null;
        }
        String name = base.getChild(1).getText();
        int count = arguments.getNumChildren();
        if (count == 1) {
            Node argument = arguments.getChild(0);
            if (base.getKind() == NodeKind.STRUCTURE && name.equals("Array")) {
                return "[" + print(argument) + "]";
            }
            if (base.getKind() == NodeKind.ENUM && name.equals("Optional")) {
                return optionalOperand(argument) + "?";
            }
            if (base.getKind() == NodeKind.ENUM && name.equals("ImplicitlyUnwrappedOptional")) {
                return optionalOperand(argument) + "!";
            }
        }
        if (count == 2 && base.getKind() == NodeKind.STRUCTURE && name.equals("Dictionary")) {
            return "[" + print(arguments.getChild(0)) + " : " + print(arguments.getChild(1)) + "]";
        }
        return null;
    }

    private String optionalOperand(Node argument) {
        String text = print(argument);
        return isFunctionLike(argument) ? "(" + text + ")" : text;
    }

    /**
     * A parameter list runs into a function signature and is set apart from any other type.
     */
    private String genericType(Node node) {
        Node type = child(node, 1);
        String separator = isFunctionLike(type) ? "" : " ";
        return "<" + part(node, 0) + ">" + separator + print(type);
    }

    private String conformance(Node node) {
        if (node.getNumChildren() == 4) {
            return "<" + part(node, 0) + "> " + part(node, 1) + " : " + part(node, 2) + " in " + part(node, 3);
        }
        return part(node, 0) + " : " + part(node, 1) + " in " + part(node, 2);
    }

    private static boolean isStandardLibrary(Node nominal) {
        if (!nominal.getKind().isBindableNominal() || nominal.getNumChildren() != 2) {
            return false;
        }
        Node module = nominal.getChild(0);
        return module.getKind() == NodeKind.MODULE
                && module.getText().equals(KnownSubstitution.STANDARD_LIBRARY)
                && nominal.getChild(1).getKind() == NodeKind.IDENTIFIER;
    }

    private static boolean isFunctionLike(Node type) {
        Node inner = unwrap(type);
        if (inner == null) {
            return false;
        }
        return switch (inner.getKind()) {
            case FUNCTION_TYPE, UNCURRIED_FUNCTION_TYPE -> true;
            case GENERIC_TYPE -> isFunctionLike(child(inner, 1));
            default -> false;
        };
    }

    private static boolean isTuple(Node type) {
        Node inner = unwrap(type);
        return inner != null
                && (inner.getKind() == NodeKind.NON_VARIADIC_TUPLE || inner.getKind() == NodeKind.VARIADIC_TUPLE);
    }

    /**
     * Strips the wrappers that only mark a type position.
     */
    private static Node unwrap(Node node) {
        Node current = node;
        while (current != null && isWrapper(current.getKind())) {
            current = child(current, 0);
        }
        return current;
    }

    private static boolean isWrapper(NodeKind kind) {
        return kind == NodeKind.TYPE || kind == NodeKind.ARGUMENT_TUPLE || kind == NodeKind.RETURN_TYPE
                || kind == NodeKind.TUPLE_ELEMENT_TYPE;
    }

    private static String localOrdinal(Node number) {
        if (number == null) {
            return "";
        }
        try {
            return Long.toString(Long.parseLong(number.getText()) + 1);
        } catch (NumberFormatException e) {
            return number.getText();
        }
    }

    private String joined(Node node) {
        StringJoiner joiner = new StringJoiner(", ");
        for (Node child : node) {
            joiner.add(print(child));
        }
        return joiner.toString();
    }

    private String part(Node node, int index) {
        return print(child(node, index));
    }

    private static Node child(Node node, int index) {
        return index < node.getNumChildren() ? node.getChild(index) : null;
    }
}
