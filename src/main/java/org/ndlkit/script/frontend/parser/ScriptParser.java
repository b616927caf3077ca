package org.ndlkit.script.frontend.parser;

import org.ndlkit.script.diagnostics.DiagnosticsEngine;
import org.ndlkit.script.frontend.lexer.Lexer;
import org.ndlkit.script.frontend.lexer.Token;
import org.ndlkit.script.model.GlobalScope;
import org.ndlkit.script.model.NdlScript;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Parses NDL text into {@link NdlScript}s. Macro definitions go to the {@link GlobalScope};
 * everything else lands in the target script.
 */
public class ScriptParser {

    private static final Logger log = LoggerFactory.getLogger(ScriptParser.class);

    private final GlobalScope global;

    /**
     * Creates a parser bound to a global scope.
     * @param global The scope that receives macro definitions and supplies the function table.
     */
    public ScriptParser(GlobalScope global) {
        this.global = global;
    }

    /**
     * Parses script text into a new script, honouring {@code load}/{@code run} section selection.
     * @param text The script text.
     * @param sourceName The logical name of the text, for error messages.
     * @return The parsed script.
     */
    public NdlScript parse(String text, String sourceName) {
        NdlScript script = new NdlScript(global);
        parseInto(script, text, sourceName);
        return script;
    }

    /**
     * Parses script text into an existing script. When the text has a {@code load} or {@code run}
     * key only the selected sections are parsed, {@code load} sections first.
     *
     * @param script The target script.
     * @param text The script text.
     * @param sourceName The logical name of the text.
     */
    public void parseInto(NdlScript script, String text, String sourceName) {
        List<Token> tokens = tokenize(text, sourceName);
        SectionReader sections = new SectionReader(tokens);
        if (sections.hasSelection()) {
            for (String section : sections.selectedSections()) {
                log.debug("Parsing section '{}' of {}", section, sourceName);
                parseTokens(script, sections.section(section));
            }
        } else {
            parseTokens(script, tokens);
        }
    }

    /**
     * Parses a single named section of a script file into an existing script.
     * @param script The target script.
     * @param text The script file text.
     * @param sourceName The logical name of the text.
     * @param section The section to parse.
     * @throws org.ndlkit.script.api.ScriptStateException if the section does not exist.
     */
    public void parseSection(NdlScript script, String text, String sourceName, String section) {
        SectionReader sections = new SectionReader(tokenize(text, sourceName));
        parseTokens(script, sections.section(section));
    }

    /**
     * Parses an already tokenized statement stream.
     * @param script The target script.
     * @param tokens The tokens, terminated by END_OF_FILE.
     */
    public void parseTokens(NdlScript script, List<Token> tokens) {
        int before = script.statements().size();
        new StatementParser(tokens, global).parseAll(script);
        log.debug("Parsed {} statement(s) into {}", script.statements().size() - before, script);
    }

    /**
     * Tokenizes script text with the configured separator.
     * @param text The script text.
     * @param sourceName The logical name of the text.
     * @return The tokens.
     * @throws org.ndlkit.script.api.ScriptSyntaxException if the text has lexical errors.
     */
    public List<Token> tokenize(String text, String sourceName) {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        Lexer lexer = new Lexer(text, diagnostics, sourceName, global.settings().statementSeparator());
        List<Token> tokens = lexer.scanTokens();
        diagnostics.throwIfErrors();
        return tokens;
    }

    public GlobalScope global() {
        return global;
    }
}
