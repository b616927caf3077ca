package org.ndlkit.script.frontend.lexer;

/**
 * Defines the different types of tokens that the {@link Lexer} can recognize.
 */
public enum TokenType {
    // Single-character tokens.
    /** The '(' character, opening a parameter list. */
    LEFT_PAREN,
    /** The ')' character, closing a parameter list. */
    RIGHT_PAREN,
    /** The '[' character, opening a section, a macro body or an array. */
    LEFT_BRACKET,
    /** The ']' character. */
    RIGHT_BRACKET,
    /** The '{' character, opening a macro body. */
    LEFT_BRACE,
    /** The '}' character. */
    RIGHT_BRACE,
    /** The ',' character, separating parameters. */
    COMMA,
    /** The ':' character, separating array elements. */
    COLON,
    /** The '=' character. */
    EQUALS,
    /** The configurable statement separator, ';' by default. */
    SEPARATOR,

    // Literals.
    /** An identifier; may contain dots (scoped names) and '*' (wildcards). */
    IDENTIFIER,
    /** A numeric literal. */
    NUMBER,
    /** A quoted string literal. */
    STRING,

    // Miscellaneous.
    /** A newline character. */
    NEWLINE,
    /** Represents the end of the script text. */
    END_OF_FILE
}
