package org.ndlkit.script.frontend.parser;

import org.ndlkit.script.api.ScriptErrorCode;
import org.ndlkit.script.api.ScriptStateException;
import org.ndlkit.script.api.ScriptSyntaxException;
import org.ndlkit.script.frontend.lexer.Token;
import org.ndlkit.script.frontend.lexer.TokenType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Splits the tokens of a script file into named sections ({@code name = [ ... ]}) and reads the
 * {@code load} and {@code run} keys that select which sections make up the script.
 */
public class SectionReader {

    public static final String LOAD_KEY = "load";
    public static final String RUN_KEY = "run";

    private final Map<String, List<Token>> sections = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
    private final List<String> load = new ArrayList<>();
    private final List<String> run = new ArrayList<>();
    private boolean hasSelection = false;

    /**
     * Scans the top level of a token stream.
     * @param tokens The tokens of the whole file, terminated by END_OF_FILE.
     */
    public SectionReader(List<Token> tokens) {
        int depth = 0;
        int i = 0;
        while (i < tokens.size()) {
            Token token = tokens.get(i);
            if (depth == 0 && token.type() == TokenType.IDENTIFIER && typeAt(tokens, i + 1) == TokenType.EQUALS) {
                if (typeAt(tokens, i + 2) == TokenType.LEFT_BRACKET) {
                    int close = findClosingBracket(tokens, i + 2);
                    if (close >= 0) {
                        List<Token> body = new ArrayList<>(tokens.subList(i + 3, close));
                        body.add(endOfSection(tokens.get(close)));
                        sections.put(token.text(), body);
                        i = close + 1;
                        continue;
                    }
                } else if (LOAD_KEY.equalsIgnoreCase(token.text()) || RUN_KEY.equalsIgnoreCase(token.text())) {
                    List<String> target = LOAD_KEY.equalsIgnoreCase(token.text()) ? load : run;
                    hasSelection = true;
                    i = readNameList(tokens, i + 2, target);
                    continue;
                }
            }
            switch (token.type()) {
                case LEFT_PAREN, LEFT_BRACKET, LEFT_BRACE -> depth++;
                case RIGHT_PAREN, RIGHT_BRACKET, RIGHT_BRACE -> depth--;
                default -> { }
            }
            i++;
        }
    }

    /**
     * @return {@code true} if the file has a {@code load} or {@code run} key.
     */
    public boolean hasSelection() {
        return hasSelection;
    }

    /**
     * @return The sections to parse: the {@code load} list followed by the {@code run} list.
     */
    public List<String> selectedSections() {
        List<String> selected = new ArrayList<>(load);
        selected.addAll(run);
        return selected;
    }

    /**
     * Returns the tokens of a section, terminated by END_OF_FILE.
     * @param name The section name (case-insensitive).
     * @return The section tokens.
     * @throws ScriptStateException if the section does not exist.
     */
    public List<Token> section(String name) {
        List<Token> body = sections.get(name);
        if (body == null) {
            throw new ScriptStateException(ScriptErrorCode.SECTION_NOT_FOUND, name,
                    "Section '" + name + "' not found");
        }
        return Collections.unmodifiableList(body);
    }

    public boolean hasSection(String name) {
        return sections.containsKey(name);
    }

    private int readNameList(List<Token> tokens, int start, List<String> target) {
        int i = start;
        while (i < tokens.size()) {
            Token token = tokens.get(i);
            if (token.type() == TokenType.IDENTIFIER || token.type() == TokenType.STRING) {
                target.add(token.value());
            } else if (token.type() != TokenType.COLON && token.type() != TokenType.COMMA) {
                break;
            }
            i++;
        }
        return i;
    }

    private static int findClosingBracket(List<Token> tokens, int open) {
        int depth = 0;
        for (int i = open; i < tokens.size(); i++) {
            TokenType type = tokens.get(i).type();
            if (type == TokenType.LEFT_BRACKET) {
                depth++;
            } else if (type == TokenType.RIGHT_BRACKET) {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        Token opening = tokens.get(open);
        throw new ScriptSyntaxException(ScriptErrorCode.UNBALANCED_BRACES, opening.text(),
                "Unclosed '[' at " + opening.position());
    }

    private static TokenType typeAt(List<Token> tokens, int index) {
        return index < tokens.size() ? tokens.get(index).type() : TokenType.END_OF_FILE;
    }

    private static Token endOfSection(Token closing) {
        return new Token(TokenType.END_OF_FILE, "", "", closing.line(), closing.column(), closing.sourceName());
    }
}
