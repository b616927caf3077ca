package org.ndlkit.mel;

import org.ndlkit.script.api.ScriptErrorCode;
import org.ndlkit.script.api.ScriptSyntaxException;
import org.ndlkit.script.frontend.lexer.Token;
import org.ndlkit.script.frontend.lexer.TokenType;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains unit tests for the {@link CommandParser}, which splits MEL text into commands and
 * inline NDL statements.
 */
public class CommandParserTest {

    private final CommandParser parser = new CommandParser(';');

    @Test
    @Tag("unit")
    void testCommandsAndInlineNdl() {
        // Act
        List<MelStatement> statements = parser.parse("CreateModel()\nx = Input(2)", "edit.mel");

        // Assert
        assertThat(statements).hasSize(2);
        assertThat(statements.get(0).isCommand()).isTrue();
        assertThat(statements.get(0).arguments().size()).isZero();
        assertThat(statements.get(1).isCommand()).isFalse();
        assertThat(statements.get(1).ndlTokens()).extracting(Token::text)
                .containsExactly("x", "=", "Input", "(", "2", ")", "");
        assertThat(statements.get(1).ndlTokens().get(6).type()).isEqualTo(TokenType.END_OF_FILE);
    }

    /**
     * Verifies positional and named arguments; quoted strings lose their quotes.
     */
    @Test
    @Tag("unit")
    void testPositionalAndNamedArguments() {
        MelStatement statement = parser.parse("SaveModel(m, \"out/model.json\", format=json)", "edit.mel").get(0);

        assertThat(statement.head().text()).isEqualTo("SaveModel");
        assertThat(statement.arguments().positional()).containsExactly("m", "out/model.json");
        assertThat(statement.arguments().named()).containsEntry("format", "json");
    }

    @Test
    @Tag("unit")
    void testSeparatorSplitsStatements() {
        List<MelStatement> statements = parser.parse("CreateModel(); y = Plus(a, b); z = Tanh(y)", "edit.mel");

        assertThat(statements).hasSize(3);
        assertThat(statements.get(1).ndlTokens()).extracting(Token::text).contains("Plus", "a", ",", "b");
        assertThat(statements.get(2).head().text()).isEqualTo("z");
    }

    @Test
    @Tag("unit")
    void testNewlinesInsideArguments() {
        MelStatement statement = parser.parse("Delete(\n  a,\n  l*.W\n)", "edit.mel").get(0);

        assertThat(statement.arguments().positional()).containsExactly("a", "l*.W");
    }

    @Test
    @Tag("unit")
    void testMissingClosingParenthesis() {
        assertThatThrownBy(() -> parser.parse("Delete(a, b", "edit.mel"))
                .isInstanceOf(ScriptSyntaxException.class)
                .satisfies(e -> assertThat(((ScriptSyntaxException) e).getCode()).isEqualTo(ScriptErrorCode.UNBALANCED_BRACES));
    }

    @Test
    @Tag("unit")
    void testTrailingTokenAfterCommand() {
        assertThatThrownBy(() -> parser.parse("Delete(a) b", "edit.mel"))
                .isInstanceOf(ScriptSyntaxException.class)
                .satisfies(e -> assertThat(((ScriptSyntaxException) e).getCode()).isEqualTo(ScriptErrorCode.UNEXPECTED_TOKEN));
    }

    @Test
    @Tag("unit")
    void testStatementWithoutCallOrAssignment() {
        assertThatThrownBy(() -> parser.parse("CreateModel", "edit.mel"))
                .isInstanceOf(ScriptSyntaxException.class)
                .satisfies(e -> assertThat(((ScriptSyntaxException) e).getCode()).isEqualTo(ScriptErrorCode.INVALID_STATEMENT));
        assertThatThrownBy(() -> parser.parse("42", "edit.mel"))
                .isInstanceOf(ScriptSyntaxException.class)
                .satisfies(e -> assertThat(((ScriptSyntaxException) e).getCode()).isEqualTo(ScriptErrorCode.INVALID_STATEMENT));
    }
}
