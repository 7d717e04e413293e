package org.demangler.tree;

/**
 * Defines the closed set of node kinds that can appear in a demangled tree.
 * Each kind corresponds to one grammar production of the encoding.
 */
public enum NodeKind {
    /** The whole result of a decode that could not be parsed. Carries the original input as text. */
    FAILURE,

    // Structural containers.
    /** A qualified path to a type alias: context followed by a name. */
    PATH,
    /** Wraps a type operand wherever a type appears as a child. */
    TYPE,
    /** An ordered list of {@link #TYPE} nodes, e.g. generic arguments. */
    TYPE_LIST,
    /** A function used as the context of a nested declaration. */
    DECL_CONTEXT,
    /** A named declaration: context, name and type. */
    DECLARATION,
    /** A declaration name that is local to a function, with its discriminator. */
    LOCAL_ENTITY,
    /** A tuple type. */
    NON_VARIADIC_TUPLE,
    /** A tuple type whose last element is variadic. */
    VARIADIC_TUPLE,
    /** One element of a tuple. */
    TUPLE_ELEMENT,
    /** The label of a tuple element. */
    TUPLE_ELEMENT_NAME,
    /** The type of a tuple element. */
    TUPLE_ELEMENT_TYPE,

    // Nominal declarations.
    MODULE,
    CLASS,
    STRUCTURE,
    ENUM,
    PROTOCOL,
    PROTOCOL_LIST,
    BOUND_GENERIC_CLASS,
    BOUND_GENERIC_STRUCTURE,
    BOUND_GENERIC_ENUM,

    // Function shapes.
    FUNCTION_TYPE,
    UNCURRIED_FUNCTION_TYPE,
    ARGUMENT_TUPLE,
    RETURN_TYPE,
    CONSTRUCTOR,
    DESTRUCTOR,
    ALLOCATOR,
    DEALLOCATOR,
    ADDRESSOR,
    GETTER,
    SETTER,

    // Type modifiers.
    IN_OUT,
    WEAK,
    UNOWNED,
    META_TYPE,
    ARRAY_TYPE,
    ERROR_TYPE,

    // Generics.
    GENERIC_TYPE,
    ARCHETYPE_LIST,
    ARCHETYPE_AND_PROTOCOL,
    ARCHETYPE_REF,
    QUALIFIED_ARCHETYPE,
    ASSOCIATED_TYPE_REF,
    SELF_TYPE_REF,

    // Runtime metadata records.
    TYPE_METADATA,
    GENERIC_TYPE_METADATA_PATTERN,
    METACLASS,
    NOMINAL_TYPE_DESCRIPTOR,
    FIELD_OFFSET,
    WITNESS_TABLE_OFFSET,
    VALUE_WITNESS_TABLE,
    VALUE_WITNESS_KIND,
    PROTOCOL_WITNESS_TABLE,
    PROTOCOL_WITNESS,
    PROTOCOL_CONFORMANCE,
    LAZY_PROTOCOL_WITNESS_TABLE_ACCESSOR,
    LAZY_PROTOCOL_WITNESS_TABLE_TEMPLATE,
    DEPENDENT_PROTOCOL_WITNESS_TABLE_GENERATOR,
    DEPENDENT_PROTOCOL_WITNESS_TABLE_TEMPLATE,

    // Foreign interop.
    OBJC_ATTRIBUTE,
    OBJC_BLOCK,
    BRIDGE_TO_BLOCK_FUNCTION,

    // Leaves.
    IDENTIFIER,
    NUMBER,
    /** "direct" or "indirect". */
    DIRECTNESS,
    PREFIX_OPERATOR,
    INFIX_OPERATOR,
    POSTFIX_OPERATOR,
    BUILTIN_TYPE_NAME,
    /** A leaf whose meaning is not known; rendered as its text. */
    UNKNOWN;

    /**
     * Checks whether this kind is a class, structure or enum declaration.
     * @return {@code true} for the three nominal kinds that can be bound to generic arguments.
     */
    public boolean isBindableNominal() {
        return this == CLASS || this == STRUCTURE || this == ENUM;
    }

    /**
     * Checks whether this kind names a nominal type, including protocols.
     * @return {@code true} for class, structure, enum and protocol.
     */
    public boolean isNominal() {
        return isBindableNominal() || this == PROTOCOL;
    }
}
