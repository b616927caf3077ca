package org.ndlkit.mel;

import org.ndlkit.script.api.ScriptErrorCode;
import org.ndlkit.script.api.ScriptSyntaxException;
import org.ndlkit.script.diagnostics.DiagnosticsEngine;
import org.ndlkit.script.frontend.lexer.Lexer;
import org.ndlkit.script.frontend.lexer.Token;
import org.ndlkit.script.frontend.lexer.TokenType;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Splits MEL text into statements. {@code Name(args)} is a command; {@code name = ...} is an
 * inline NDL statement whose tokens are handed to the NDL parser unchanged.
 */
public class CommandParser {

    private final char separator;
    private List<Token> tokens;
    private int current;

    public CommandParser(char separator) {
        this.separator = separator;
    }

    /**
     * @param text The MEL text.
     * @param sourceName The logical name of the text.
     * @return The statements in order.
     * @throws ScriptSyntaxException on malformed statements or lexical errors.
     */
    public List<MelStatement> parse(String text, String sourceName) {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        tokens = new Lexer(text, diagnostics, sourceName, separator).scanTokens();
        diagnostics.throwIfErrors();
        current = 0;

        List<MelStatement> statements = new ArrayList<>();
        while (true) {
            while (check(TokenType.SEPARATOR) || check(TokenType.NEWLINE)) {
                advance();
            }
            if (isAtEnd()) {
                return statements;
            }
            Token head = peek();
            if (head.type() != TokenType.IDENTIFIER) {
                throw error(ScriptErrorCode.INVALID_STATEMENT, head, "Expected a command or assignment");
            }
            if (checkNext(TokenType.EQUALS)) {
                statements.add(MelStatement.ndl(head, readNdlStatement()));
                continue;
            }
            if (checkNext(TokenType.LEFT_PAREN)) {
                advance();
                statements.add(MelStatement.command(head, readArguments(head.text())));
                if (!(check(TokenType.SEPARATOR) || check(TokenType.NEWLINE) || isAtEnd())) {
                    throw error(ScriptErrorCode.UNEXPECTED_TOKEN, peek(), "Unexpected token after " + head.text() + "(...)");
                }
                continue;
            }
            throw error(ScriptErrorCode.INVALID_STATEMENT, head,
                    "'" + head.text() + "' is neither a command call nor an assignment");
        }
    }

    private List<Token> readNdlStatement() {
        List<Token> statement = new ArrayList<>();
        int depth = 0;
        while (!isAtEnd()) {
            Token token = peek();
            if (depth == 0 && (token.type() == TokenType.SEPARATOR || token.type() == TokenType.NEWLINE)) {
                break;
            }
            switch (token.type()) {
                case LEFT_PAREN, LEFT_BRACKET, LEFT_BRACE -> depth++;
                case RIGHT_PAREN, RIGHT_BRACKET, RIGHT_BRACE -> depth--;
                default -> { }
            }
            statement.add(advance());
        }
        Token end = peek();
        statement.add(new Token(TokenType.END_OF_FILE, "", "", end.line(), end.column(), end.sourceName()));
        return statement;
    }

    private MelArguments readArguments(String command) {
        advance(); // (
        List<String> positional = new ArrayList<>();
        Map<String, String> named = new LinkedHashMap<>();
        skipNewlines();
        if (!check(TokenType.RIGHT_PAREN)) {
            do {
                skipNewlines();
                if (check(TokenType.IDENTIFIER) && checkNext(TokenType.EQUALS)) {
                    String name = advance().text();
                    advance(); // =
                    named.put(name, readValue());
                } else {
                    positional.add(readValue());
                }
                skipNewlines();
            } while (match(TokenType.COMMA));
        }
        if (!match(TokenType.RIGHT_PAREN)) {
            ScriptErrorCode code = isAtEnd() ? ScriptErrorCode.UNBALANCED_BRACES : ScriptErrorCode.UNEXPECTED_TOKEN;
            throw error(code, peek(), "Expected ')' to close the arguments of " + command);
        }
        return new MelArguments(command, positional, named);
    }

    private String readValue() {
        Token token = peek();
        if (token.type() == TokenType.IDENTIFIER || token.type() == TokenType.NUMBER || token.type() == TokenType.STRING) {
            advance();
            return token.value();
        }
        throw error(isAtEnd() ? ScriptErrorCode.UNBALANCED_BRACES : ScriptErrorCode.UNEXPECTED_TOKEN, token,
                "Expected a command argument");
    }

    private ScriptSyntaxException error(ScriptErrorCode code, Token token, String message) {
        String found = token.type() == TokenType.END_OF_FILE ? "end of script" : "'" + token.text() + "'";
        return new ScriptSyntaxException(code, token.text(), message + " (found " + found + " at " + token.position() + ")");
    }

    private void skipNewlines() {
        while (check(TokenType.NEWLINE)) {
            advance();
        }
    }

    private boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    private boolean check(TokenType type) {
        return peek().type() == type;
    }

    private boolean checkNext(TokenType type) {
        return current + 1 < tokens.size() && tokens.get(current + 1).type() == type;
    }

    private Token advance() {
        Token token = peek();
        if (!isAtEnd()) current++;
        return token;
    }

    private boolean isAtEnd() {
        return peek().type() == TokenType.END_OF_FILE;
    }

    private Token peek() {
        return tokens.get(current);
    }
}
