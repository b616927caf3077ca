package org.ndlkit.script.frontend.lexer;

import org.ndlkit.script.diagnostics.DiagnosticsEngine;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts script text into a sequence of tokens. Errors are reported to the
 * {@link DiagnosticsEngine}; scanning continues so that all lexical problems surface at once.
 */
public class Lexer {

    /** The default statement separator. */
    public static final char DEFAULT_SEPARATOR = ';';

    private final String source;
    private final DiagnosticsEngine diagnostics;
    private final String sourceName;
    private final char separator;
    private final List<Token> tokens = new ArrayList<>();
    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int column = 1;
    private int startColumn = 1;

    /**
     * Creates a new Lexer using the default separator.
     * @param source The script text.
     * @param diagnostics The engine for reporting errors.
     */
    public Lexer(String source, DiagnosticsEngine diagnostics) {
        this(source, diagnostics, "<memory>", DEFAULT_SEPARATOR);
    }

    /**
     * Creates a new Lexer.
     * @param source The script text.
     * @param diagnostics The engine for reporting errors.
     * @param sourceName The logical name of the script, for error reporting.
     * @param separator The statement separator character.
     */
    public Lexer(String source, DiagnosticsEngine diagnostics, String sourceName, char separator) {
        this.source = source;
        this.diagnostics = diagnostics;
        this.sourceName = sourceName;
        this.separator = separator;
    }

    /**
     * Tokenizes the entire script text.
     * @return The recognized tokens, always terminated by {@link TokenType#END_OF_FILE}.
     */
    public List<Token> scanTokens() {
        while (!isAtEnd()) {
            start = current;
            startColumn = column;
            scanToken();
        }
        tokens.add(new Token(TokenType.END_OF_FILE, "", "", line, column, sourceName));
        return tokens;
    }

    private void scanToken() {
        char c = advance();
        if (c == separator) {
            addToken(TokenType.SEPARATOR);
            return;
        }
        switch (c) {
            case '(': addToken(TokenType.LEFT_PAREN); break;
            case ')': addToken(TokenType.RIGHT_PAREN); break;
            case '[': addToken(TokenType.LEFT_BRACKET); break;
            case ']': addToken(TokenType.RIGHT_BRACKET); break;
            case '{': addToken(TokenType.LEFT_BRACE); break;
            case '}': addToken(TokenType.RIGHT_BRACE); break;
            case ',': addToken(TokenType.COMMA); break;
            case ':': addToken(TokenType.COLON); break;
            case '=': addToken(TokenType.EQUALS); break;
            case '"', '\'': string(c); break;
            case '#':
                // A comment goes until the end of the line.
                while (peek() != '\n' && !isAtEnd()) advance();
                break;
            case ' ', '\r', '\t':
                break;
            case '\n':
                addToken(TokenType.NEWLINE);
                line++;
                column = 1;
                break;
            case '+', '-', '.':
                if (isDigit(peek()) || (c != '.' && peek() == '.' && isDigit(peekNext()))) {
                    number();
                } else if (c == '.' && isAlpha(peek())) {
                    identifier();
                } else {
                    diagnostics.reportError("Unexpected character: " + c, sourceName, line, startColumn);
                }
                break;
            default:
                if (isDigit(c)) {
                    number();
                } else if (isAlpha(c)) {
                    identifier();
                } else {
                    diagnostics.reportError("Unexpected character: " + c, sourceName, line, startColumn);
                }
                break;
        }
    }

    private void identifier() {
        while (isAlphaNumeric(peek())) advance();
        addToken(TokenType.IDENTIFIER);
    }

    private void number() {
        while (isDigit(peek()) || peek() == '.') advance();
        if ((peek() == 'e' || peek() == 'E')
                && (isDigit(peekNext()) || ((peekNext() == '+' || peekNext() == '-') && isDigit(peekAt(2))))) {
            advance();
            if (peek() == '+' || peek() == '-') advance();
            while (isDigit(peek())) advance();
        }
        String text = source.substring(start, current);
        try {
            Double.parseDouble(text);
        } catch (NumberFormatException e) {
            diagnostics.reportError("Invalid number format: " + text, sourceName, line, startColumn);
            return;
        }
        addToken(TokenType.NUMBER);
    }

    private void string(char quote) {
        while (peek() != quote && !isAtEnd()) {
            if (peek() == '\n') {
                line++;
                column = 0;
            }
            advance();
        }

        if (isAtEnd()) {
            diagnostics.reportError("Unterminated string.", sourceName, line, startColumn);
            return;
        }

        // The closing quote
        advance();

        String value = source.substring(start + 1, current - 1);
        addToken(TokenType.STRING, value);
    }

    private void addToken(TokenType type) {
        String text = source.substring(start, current);
        addToken(type, text);
    }

    private void addToken(TokenType type, String value) {
        String text = source.substring(start, current);
        tokens.add(new Token(type, text, value, line, startColumn, sourceName));
    }

    private char advance() {
        column++;
        return source.charAt(current++);
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char peek() {
        return peekAt(0);
    }

    private char peekNext() {
        return peekAt(1);
    }

    private char peekAt(int offset) {
        if (current + offset >= source.length()) return '\0';
        return source.charAt(current + offset);
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') ||
                (c >= 'A' && c <= 'Z') ||
                c == '_' || c == '$' || c == '*';
    }

    private boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c) || c == '.';
    }
}
