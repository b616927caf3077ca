package org.ndlkit.script.api;

/**
 * Defines unique, testable error codes for all errors raised while parsing, evaluating or editing
 * scripts. This decouples the test logic from the wording of the messages.
 */
public enum ScriptErrorCode {
    // region Syntax Errors
    /** A statement is neither an assignment, a call nor a macro definition. */
    INVALID_STATEMENT,
    /** An opening brace, bracket or parenthesis was not closed. */
    UNBALANCED_BRACES,
    /** An unexpected token was found. */
    UNEXPECTED_TOKEN,
    /** The lexer rejected a character or literal. */
    LEXICAL_ERROR,
    /** A command argument could not be converted to the expected type. */
    INVALID_VALUE,
    // endregion

    // region Symbol Errors
    /** A symbol was defined twice in the same scope. */
    SYMBOL_REDEFINED,
    /** A symbol could not be resolved. */
    UNDEFINED_SYMBOL,
    /** A called name is neither a function nor a macro. */
    NOT_CALLABLE,
    /** A variable name is reserved because it is also the name of a function. */
    RESERVED_NAME,
    /** A dotted name traverses something that is not a macro call. */
    INVALID_DOT_NAME,
    /** References form a cycle that never reaches a value. */
    CIRCULAR_REFERENCE,
    /** A property name given to SetProperty is unknown. */
    UNKNOWN_PROPERTY,
    /** Macro calls were nested deeper than the configured limit. */
    MACRO_DEPTH_EXCEEDED,
    // endregion

    // region Arity Errors
    /** A call supplied too few or too many parameters. */
    PARAMETER_COUNT_MISMATCH,
    // endregion

    // region Reference Scope Errors
    /** Operands of one command belong to different networks. */
    NETWORK_MISMATCH,
    // endregion

    // region State Errors
    /** The command name does not match any known command. */
    UNKNOWN_COMMAND,
    /** A model name is not registered. */
    MODEL_NOT_FOUND,
    /** No default model exists. */
    NO_DEFAULT_MODEL,
    /** A node name or pattern matched nothing. */
    NODE_NOT_FOUND,
    /** A named section does not exist in a script file. */
    SECTION_NOT_FOUND,
    /** A symbol that must denote exactly one node matched several. */
    AMBIGUOUS_NODE_PATTERN,
    /** An input index is outside the inputs of a node. */
    INPUT_INDEX_OUT_OF_RANGE,
    /** A saved model could not be read. */
    MODEL_LOAD_FAILED,
    /** An I/O error occurred while reading or writing a file. */
    IO_ERROR,
    /** A network node name is already taken. */
    NODE_ALREADY_EXISTS,
    /** A network failed validation: unconnected inputs, foreign inputs or cycles. */
    NETWORK_VALIDATION_FAILED
    // endregion
}
