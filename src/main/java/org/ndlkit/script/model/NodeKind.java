package org.ndlkit.script.model;

/**
 * The closed set of NDL node kinds.
 */
public enum NodeKind {
    /** A numeric or string literal. Terminal for reference resolution. */
    CONSTANT,
    /** A call of a built-in function. */
    FUNCTION,
    /** A named reference to another symbol. */
    VARIABLE,
    /** A formal parameter of a macro; bound per call. */
    PARAMETER,
    /** A macro definition, stored in the global scope. */
    MACRO,
    /** A call of a macro. */
    MACRO_CALL,
    /** A {@code [a:b:c]} list. */
    ARRAY,
    /** A dotted reference into the body of a macro call. */
    DOT_PARAMETER,
    /** A {@code name=value} parameter. */
    OPTIONAL_PARAMETER,
    /** A forward reference that a later definition is expected to replace. */
    UNDETERMINED
}
