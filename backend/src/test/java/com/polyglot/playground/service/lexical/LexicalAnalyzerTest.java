package com.polyglot.playground.service.lexical;

import com.polyglot.playground.config.CompilerAnalysisProperties;
import com.polyglot.playground.dto.Diagnostic;
import com.polyglot.playground.dto.Phase;
import com.polyglot.playground.dto.Token;
import com.polyglot.playground.dto.TokenCategory;
import com.polyglot.playground.dto.TokenKind;
import com.polyglot.playground.language.Language;
import com.polyglot.playground.service.PhaseResult;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class LexicalAnalyzerTest {

    private final LexicalAnalyzer analyzer = new LexicalAnalyzer(CompilerAnalysisProperties.defaults());

    @Test
    void classifiesTokensOfASimpleStatement() {
        LexicalResult result = scan("let total = 42;", Language.JAVASCRIPT);

        assertThat(result.diagnostics()).isEmpty();
        assertThat(result.tokens()).extracting(Token::kind).containsExactly(
                TokenKind.KEYWORD,
                TokenKind.IDENTIFIER,
                TokenKind.ASSIGNMENT_OPERATOR,
                TokenKind.INTEGER_NUMBER,
                TokenKind.SEMICOLON);
        assertThat(result.tokens().get(1).column()).isEqualTo(5);
        assertThat(result.tokens().get(3).offset()).isEqualTo(12);
    }

    @Test
    void reportsUnterminatedStringAndStillEmitsIt() {
        LexicalResult result = scan("let s = \"hello;", Language.JAVASCRIPT);

        assertThat(result.diagnostics()).hasSize(1);
        Diagnostic diagnostic = result.diagnostics().get(0);
        assertThat(diagnostic.message()).contains("sin cerrar");
        assertThat(diagnostic.phase()).isEqualTo(Phase.LEXICAL);
        assertThat(diagnostic.column()).isEqualTo(9);
        assertThat(result.tokens()).anyMatch(token -> token.category() == TokenCategory.STRING
                && token.text().equals("\"hello;"));
    }

    @Test
    void stringLeftOpenStopsAtEndOfLine() {
        LexicalResult result = scan("x = 'abc\ny = 1", Language.PYTHON);

        assertThat(result.errorCount()).isEqualTo(1);
        assertThat(result.tokens()).anyMatch(token -> token.text().equals("y") && token.line() == 2);
    }

    @Test
    void reportsMalformedNumber() {
        LexicalResult result = scan("let x = 123abc;", Language.JAVASCRIPT);

        assertThat(result.diagnostics()).extracting(Diagnostic::message)
                .containsExactly("Malformed number '123abc'");
    }

    @Test
    void recognizesNumberShapes() {
        LexicalResult result = scan("a = 0xFF + 3.14 + 0b101 + 7", Language.PYTHON);

        assertThat(result.tokens()).extracting(Token::kind).contains(
                TokenKind.HEX_NUMBER, TokenKind.DECIMAL_NUMBER, TokenKind.BINARY_NUMBER, TokenKind.INTEGER_NUMBER);
    }

    @Test
    void treatsTsqlVariablesAsIdentifiers() {
        LexicalResult result = scan("DECLARE @count INT = 5;", Language.TSQL);

        assertThat(result.diagnostics()).isEmpty();
        assertThat(result.tokens().get(0).kind()).isEqualTo(TokenKind.KEYWORD);
        assertThat(result.tokens().get(1)).satisfies(token -> {
            assertThat(token.text()).isEqualTo("@count");
            assertThat(token.kind()).isEqualTo(TokenKind.IDENTIFIER);
        });
    }

    @Test
    void reportsUnterminatedBlockComment() {
        LexicalResult result = scan("let a = 1; /* never closed", Language.JAVASCRIPT);

        assertThat(result.diagnostics()).extracting(Diagnostic::message)
                .containsExactly("Unterminated block comment");
        assertThat(result.tokens()).last().extracting(Token::kind).isEqualTo(TokenKind.BLOCK_COMMENT);
    }

    @Test
    void keepsPreprocessorDirectiveAsOneToken() {
        LexicalResult result = scan("#include <iostream>\nint main() {}", Language.CPP);

        assertThat(result.tokens().get(0).kind()).isEqualTo(TokenKind.PREPROCESSOR_DIRECTIVE);
        assertThat(result.tokens().get(0).text()).isEqualTo("#include <iostream>");
        assertThat(result.tokens().get(1).line()).isEqualTo(2);
    }

    @Test
    void offsetsNeverDecrease() {
        LexicalResult result = scan("def f(x):\n    # note\n    return x * 2\n\nprint(f(3))\n", Language.PYTHON);

        List<Token> tokens = result.tokens();
        assertThat(tokens).isNotEmpty();
        for (int i = 1; i < tokens.size(); i++) {
            assertThat(tokens.get(i).offset()).isGreaterThan(tokens.get(i - 1).offset());
            assertThat(tokens.get(i).line()).isGreaterThanOrEqualTo(tokens.get(i - 1).line());
        }
    }

    @Test
    void flagsKeyboardNoiseWhenLanguageIsUnknown() {
        LexicalResult result = scan("hello xqzvbnm", Language.UNKNOWN);

        assertThat(result.tokens()).extracting(Token::text).containsExactly("hello");
        assertThat(result.diagnostics()).extracting(Diagnostic::message)
                .containsExactly("Unrecognized character sequence 'xqzvbnm'");
    }

    @Test
    void emptySourceYieldsNothing() {
        LexicalResult result = scan("", Language.CPP);

        assertThat(result.tokens()).isEmpty();
        assertThat(result.diagnostics()).isEmpty();
    }

    private LexicalResult scan(String source, Language language) {
        PhaseResult<LexicalResult> result = analyzer.analyze(source, language);
        assertThat(result.failed()).isFalse();
        return result.value();
    }
}
