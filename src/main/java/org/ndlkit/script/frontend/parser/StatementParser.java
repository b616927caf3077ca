package org.ndlkit.script.frontend.parser;

import org.ndlkit.script.api.ScriptErrorCode;
import org.ndlkit.script.api.ScriptSymbolException;
import org.ndlkit.script.api.ScriptSyntaxException;
import org.ndlkit.script.eval.ArgumentBinder;
import org.ndlkit.script.frontend.lexer.Token;
import org.ndlkit.script.frontend.lexer.TokenType;
import org.ndlkit.script.model.GlobalScope;
import org.ndlkit.script.model.NdlNode;
import org.ndlkit.script.model.NdlScript;
import org.ndlkit.script.model.NodeKind;

import java.util.ArrayList;
import java.util.List;

/**
 * Recursive descent over one token stream. Nested calls are hoisted: they are appended to the
 * statement list before the statement that uses them, so statement order is evaluation order.
 */
class StatementParser {

    private final List<Token> tokens;
    private final GlobalScope global;
    private int current = 0;

    StatementParser(List<Token> tokens, GlobalScope global) {
        this.tokens = tokens;
        this.global = global;
    }

    /**
     * Parses statements into the script until the end of the token stream.
     * @param script The target script.
     */
    void parseAll(NdlScript script) {
        parseStatements(script, null);
    }

    private void parseStatements(NdlScript script, TokenType terminator) {
        while (true) {
            skipSeparators();
            if (terminator != null && check(terminator)) {
                return;
            }
            if (isAtEnd()) {
                if (terminator != null) {
                    throw syntaxError(ScriptErrorCode.UNBALANCED_BRACES, peek(),
                            "Missing '" + closingText(terminator) + "'");
                }
                return;
            }
            if (match(TokenType.LEFT_BRACKET)) {
                // grouping brackets are transparent
                parseStatements(script, TokenType.RIGHT_BRACKET);
                advance();
                continue;
            }
            parseStatement(script);
            endOfStatement(terminator);
        }
    }

    private void parseStatement(NdlScript script) {
        Token first = peek();
        if (first.type() != TokenType.IDENTIFIER) {
            throw syntaxError(ScriptErrorCode.INVALID_STATEMENT, first, "Expected a statement but found '" + first.text() + "'");
        }
        advance();
        if (check(TokenType.LEFT_PAREN)) {
            if (!script.isNoDefinitions() && isDefinitionAhead()) {
                parseMacroDefinition(first);
            } else {
                script.addStatement(parseCall(script, first, null));
            }
            return;
        }
        if (match(TokenType.EQUALS)) {
            parseAssignment(script, first);
            return;
        }
        throw syntaxError(ScriptErrorCode.INVALID_STATEMENT, first,
                "Statement '" + first.text() + "' does not contain an '=' sign");
    }

    private void endOfStatement(TokenType terminator) {
        if (match(TokenType.SEPARATOR) || match(TokenType.NEWLINE) || isAtEnd()) {
            return;
        }
        if (terminator != null && check(terminator)) {
            return;
        }
        Token unexpected = peek();
        throw syntaxError(ScriptErrorCode.UNEXPECTED_TOKEN, unexpected, "Unexpected '" + unexpected.text() + "' after statement");
    }

    private void parseMacroDefinition(Token nameToken) {
        String name = nameToken.text();
        if (name.indexOf('.') >= 0) {
            throw new ScriptSymbolException(ScriptErrorCode.INVALID_DOT_NAME, name, "Macro names cannot contain '.': " + name);
        }
        advance(); // (
        List<String> formals = new ArrayList<>();
        skipNewlines();
        if (!check(TokenType.RIGHT_PAREN)) {
            do {
                skipNewlines();
                Token formal = expect(TokenType.IDENTIFIER, ScriptErrorCode.UNEXPECTED_TOKEN, "Expected a parameter name");
                formals.add(formal.text());
                skipNewlines();
            } while (match(TokenType.COMMA));
        }
        expect(TokenType.RIGHT_PAREN, ScriptErrorCode.UNBALANCED_BRACES, "Expected ')' after macro parameters");
        boolean assigned = match(TokenType.EQUALS);

        NdlScript body = new NdlScript(global, name);
        for (String formal : formals) {
            body.symbols().add(formal, body.createNode(formal, formal, NodeKind.PARAMETER));
        }
        // registered before the body is parsed so that the body may call the macro itself
        global.defineMacro(name, formals, body);

        if (match(TokenType.LEFT_BRACKET)) {
            parseStatements(body, TokenType.RIGHT_BRACKET);
            advance();
        } else if (match(TokenType.LEFT_BRACE)) {
            parseStatements(body, TokenType.RIGHT_BRACE);
            advance();
        } else if (assigned && check(TokenType.IDENTIFIER)) {
            body.setNoDefinitions(true);
            parseStatement(body);
        } else {
            throw syntaxError(ScriptErrorCode.INVALID_STATEMENT, peek(), "Macro '" + name + "' has no body");
        }
    }

    private void parseAssignment(NdlScript script, Token keyToken) {
        String key = keyToken.text();
        if (global.functions().findExact(key).isPresent()) {
            throw new ScriptSymbolException(ScriptErrorCode.RESERVED_NAME, key,
                    "'" + key + "' is the name of a built-in function and cannot be assigned at " + keyToken.position());
        }
        if (key.indexOf('.') >= 0) {
            throw new ScriptSymbolException(ScriptErrorCode.INVALID_DOT_NAME, key,
                    "Cannot define the dotted name '" + key + "' at " + keyToken.position());
        }

        Token valueToken = peek();
        switch (valueToken.type()) {
            case IDENTIFIER -> {
                advance();
                if (check(TokenType.LEFT_PAREN)) {
                    NdlNode call = parseCall(script, valueToken, key);
                    script.symbols().add(key, call);
                    script.addStatement(call);
                } else {
                    defineReference(script, key, valueToken.text());
                }
            }
            case NUMBER, STRING -> {
                advance();
                NdlNode constant = script.createNode(key, valueToken.value(), NodeKind.CONSTANT);
                script.symbols().add(key, constant);
                script.addStatement(constant);
            }
            case LEFT_BRACKET -> {
                NdlNode array = parseArray(script, key);
                script.symbols().add(key, array);
                script.addStatement(array);
            }
            default -> throw syntaxError(ScriptErrorCode.UNEXPECTED_TOKEN, valueToken,
                    "Expected a value after '" + key + " ='");
        }
    }

    private void defineReference(NdlScript script, String key, String target) {
        if (target.indexOf('.') >= 0) {
            script.symbols().add(key, script.createNode(key, target, NodeKind.DOT_PARAMETER));
            return;
        }
        NdlNode existing = script.findSymbol(target, true);
        if (existing != null && existing.kind() != NodeKind.MACRO) {
            // an alias: the existing node keeps its name
            script.symbols().add(key, existing);
            return;
        }
        script.symbols().add(key, script.createNode(key, target, NodeKind.VARIABLE));
    }

    private NdlNode parseCall(NdlScript script, Token head, String nodeName) {
        String name = head.text();
        if (script.findSymbol(name, false) != null) {
            throw new ScriptSymbolException(ScriptErrorCode.NOT_CALLABLE, name,
                    "'" + name + "' is not a function or macro at " + head.position());
        }
        NdlNode call = script.checkName(name, nodeName);
        if (call == null) {
            throw new ScriptSymbolException(ScriptErrorCode.UNDEFINED_SYMBOL, name,
                    "Undefined function or macro '" + name + "' at " + head.position());
        }
        if (call.kind() != NodeKind.FUNCTION && call.kind() != NodeKind.MACRO_CALL) {
            throw new ScriptSymbolException(ScriptErrorCode.NOT_CALLABLE, name,
                    "'" + name + "' is not a function or macro at " + head.position());
        }
        expect(TokenType.LEFT_PAREN, ScriptErrorCode.INVALID_STATEMENT, "Expected '(' after " + name);
        skipNewlines();
        if (!check(TokenType.RIGHT_PAREN)) {
            do {
                skipNewlines();
                call.addParameter(parseParameter(script));
                skipNewlines();
            } while (match(TokenType.COMMA));
        }
        expect(TokenType.RIGHT_PAREN, ScriptErrorCode.UNBALANCED_BRACES, "Expected ')' to close the call of " + name);

        if (call.kind() == NodeKind.FUNCTION) {
            ArgumentBinder.checkFunctionArity(call);
        } else {
            ArgumentBinder.bind(call.value(), call.formalParameters(), call.parameters());
        }
        return call;
    }

    private NdlNode parseParameter(NdlScript script) {
        if (check(TokenType.IDENTIFIER) && checkNext(TokenType.EQUALS)) {
            Token nameToken = advance();
            advance(); // =
            Token valueToken = peek();
            NdlNode value = parseOptionalValue(script);
            String text = valueToken.type() == TokenType.IDENTIFIER || valueToken.type() == TokenType.NUMBER
                    || valueToken.type() == TokenType.STRING ? valueToken.value() : value.value();
            NdlNode optional = script.createNode(nameToken.text(), text, NodeKind.OPTIONAL_PARAMETER);
            optional.setOptionalValue(value);
            return optional;
        }
        return parseValue(script);
    }

    private NdlNode parseOptionalValue(NdlScript script) {
        if (check(TokenType.IDENTIFIER) && !checkNext(TokenType.LEFT_PAREN)) {
            String text = advance().text();
            if (text.indexOf('.') >= 0) {
                return script.createNode(null, text, NodeKind.DOT_PARAMETER);
            }
            NdlNode existing = script.findSymbol(text, true);
            // plain words such as init=uniform stay unregistered references
            return existing != null ? existing : script.createNode(null, text, NodeKind.VARIABLE);
        }
        return parseValue(script);
    }

    private NdlNode parseValue(NdlScript script) {
        Token token = peek();
        switch (token.type()) {
            case IDENTIFIER -> {
                advance();
                if (check(TokenType.LEFT_PAREN)) {
                    NdlNode nested = parseCall(script, token, null);
                    script.addStatement(nested);
                    return nested;
                }
                return reference(script, token.text());
            }
            case NUMBER, STRING -> {
                advance();
                return script.createNode(null, token.value(), NodeKind.CONSTANT);
            }
            case LEFT_BRACKET -> {
                return parseArray(script, null);
            }
            case END_OF_FILE -> throw syntaxError(ScriptErrorCode.UNBALANCED_BRACES, token, "Unexpected end of script");
            default -> throw syntaxError(ScriptErrorCode.UNEXPECTED_TOKEN, token, "Unexpected '" + token.text() + "'");
        }
    }

    private NdlNode reference(NdlScript script, String name) {
        if (name.indexOf('.') >= 0) {
            return script.createNode(name, name, NodeKind.DOT_PARAMETER);
        }
        NdlNode existing = script.findSymbol(name, true);
        if (existing != null) {
            return existing;
        }
        NdlNode placeholder = script.createNode(name, name, NodeKind.UNDETERMINED);
        script.symbols().add(name, placeholder);
        return placeholder;
    }

    private NdlNode parseArray(NdlScript script, String name) {
        expect(TokenType.LEFT_BRACKET, ScriptErrorCode.UNEXPECTED_TOKEN, "Expected '['");
        List<NdlNode> elements = new ArrayList<>();
        if (!check(TokenType.RIGHT_BRACKET)) {
            do {
                elements.add(parseValue(script));
            } while (match(TokenType.COLON) || match(TokenType.COMMA));
        }
        expect(TokenType.RIGHT_BRACKET, ScriptErrorCode.UNBALANCED_BRACES, "Expected ']' to close the array");

        List<String> texts = new ArrayList<>();
        for (NdlNode element : elements) {
            texts.add(element.kind() == NodeKind.CONSTANT ? element.value() : element.name());
        }
        NdlNode array = script.createNode(name, String.join(":", texts), NodeKind.ARRAY);
        elements.forEach(array::addParameter);
        return array;
    }

    private boolean isDefinitionAhead() {
        int depth = 0;
        for (int i = current; i < tokens.size(); i++) {
            TokenType type = tokens.get(i).type();
            if (type == TokenType.LEFT_PAREN) {
                depth++;
            } else if (type == TokenType.RIGHT_PAREN) {
                depth--;
                if (depth == 0) {
                    TokenType after = i + 1 < tokens.size() ? tokens.get(i + 1).type() : TokenType.END_OF_FILE;
                    return after == TokenType.EQUALS || after == TokenType.LEFT_BRACKET || after == TokenType.LEFT_BRACE;
                }
            } else if (type == TokenType.END_OF_FILE) {
                return false;
            }
        }
        return false;
    }

    private void skipSeparators() {
        while (check(TokenType.SEPARATOR) || check(TokenType.NEWLINE)) {
            advance();
        }
    }

    private void skipNewlines() {
        while (check(TokenType.NEWLINE)) {
            advance();
        }
    }

    private Token expect(TokenType type, ScriptErrorCode code, String message) {
        if (check(type)) {
            return advance();
        }
        Token found = peek();
        ScriptErrorCode effective = found.type() == TokenType.END_OF_FILE ? ScriptErrorCode.UNBALANCED_BRACES : code;
        throw syntaxError(effective, found, message);
    }

    private ScriptSyntaxException syntaxError(ScriptErrorCode code, Token token, String message) {
        String found = token.type() == TokenType.END_OF_FILE ? "end of script" : "'" + token.text() + "'";
        return new ScriptSyntaxException(code, token.text(), message + " (found " + found + " at " + token.position() + ")");
    }

    private static String closingText(TokenType type) {
        return type == TokenType.RIGHT_BRACE ? "}" : "]";
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
        if (current + 1 >= tokens.size()) return false;
        return tokens.get(current + 1).type() == type;
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
