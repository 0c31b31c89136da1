package com.polyglot.playground.service;

import com.polyglot.playground.config.CompilerAnalysisProperties;
import com.polyglot.playground.dto.AnalysisReport;
import com.polyglot.playground.dto.AnalysisRequest;
import com.polyglot.playground.dto.Diagnostic;
import com.polyglot.playground.dto.EditorMarker;
import com.polyglot.playground.dto.Phase;
import com.polyglot.playground.dto.SymbolEntry;
import com.polyglot.playground.language.Language;
import com.polyglot.playground.service.lexical.LexicalAnalyzer;
import com.polyglot.playground.service.semantic.SemanticAnalyzer;
import com.polyglot.playground.service.syntax.SyntaxAnalyzer;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CompilerAnalysisServiceTest {

    private final CompilerAnalysisService service = serviceWith(CompilerAnalysisProperties.defaults());

    @Test
    void undeclaredIdentifierBlocksExecution() {
        AnalysisReport report = service.analyze(
                "#include <iostream>\nint main() { int x = total + 1; return x; }", Language.CPP);

        assertThat(report.canExecute()).isFalse();
        assertThat(report.executionResult()).isNull();
        assertThat(report.errorCount(Phase.SEMANTIC)).isEqualTo(1);
        assertThat(report.analysisPhases().semantic().errorsFound()).isEqualTo(1);
        assertThat(report.diagnosticsOf(Phase.SEMANTIC))
                .anyMatch(diagnostic -> diagnostic.isError() && diagnostic.message().contains("'total'"));
        assertThat(report.symbolTable()).anyMatch(entry -> entry.getName().equals("main"));
    }

    @Test
    void cleanProgramGetsAnExecutionTrace() {
        AnalysisReport report = service.analyze("console.log(\"hi\");", Language.JAVASCRIPT);

        assertThat(report.canExecute()).isTrue();
        assertThat(report.errors()).noneMatch(Diagnostic::isError);
        assertThat(report.executionResult().success()).isTrue();
        assertThat(report.executionResult().output()).isEqualTo("hi\n");
        assertThat(report.analysisPhases().lexical().completed()).isTrue();
        assertThat(report.analysisPhases().lexical().tokensFound()).isEqualTo(7);
        assertThat(report.analysisPhases().syntax().completed()).isTrue();
        assertThat(report.analysisPhases().semantic().completed()).isTrue();
    }

    @Test
    void pascalProgramRunsThroughAllPhases() {
        AnalysisReport report = service.analyze("program Hello;\nbegin\n  writeln('Hello');\nend.", Language.PASCAL);

        assertThat(report.canExecute()).isTrue();
        assertThat(report.executionResult().output()).startsWith("Hello\n").contains("Pascal program found");
    }

    @Test
    void manyLexicalErrorsSkipLaterPhases() {
        AnalysisReport report = service.analyze("\"a\n\"b\n\"c\n\"d\n\"e\n", Language.JAVASCRIPT);

        assertThat(report.errorCount(Phase.LEXICAL)).isEqualTo(5);
        assertThat(report.analysisPhases().syntax().completed()).isFalse();
        assertThat(report.analysisPhases().semantic().completed()).isFalse();
        assertThat(report.parseTree()).isEmpty();
        assertThat(report.canExecute()).isFalse();
    }

    @Test
    void syntaxErrorsSkipSemanticAnalysis() {
        AnalysisReport report = service.analyze("(a, b", Language.JAVASCRIPT);

        assertThat(report.errorCount(Phase.SYNTACTIC)).isEqualTo(1);
        assertThat(report.analysisPhases().semantic().completed()).isFalse();
        assertThat(report.symbolTable()).isEmpty();
        assertThat(report.markers()).hasSize(report.errors().size());
    }

    @Test
    void diagnosticsArriveInPhaseOrder() {
        AnalysisReport report = service.analyze("let a = 1abc;\nlet b = (2;", Language.JAVASCRIPT);

        assertThat(report.errors()).extracting(Diagnostic::phase)
                .startsWith(Phase.LEXICAL)
                .contains(Phase.SYNTACTIC);
        assertThat(report.errors()).extracting(Diagnostic::phase).isSorted();
    }

    @Test
    void deeplyNestedInputTerminates() {
        AnalysisReport report = service.analyze("(".repeat(10_000), Language.JAVASCRIPT);

        assertThat(report.canExecute()).isFalse();
        assertThat(report.errorCount(Phase.SYNTACTIC)).isPositive();
        assertThat(report.analysisPhases().semantic().completed()).isFalse();
    }

    @Test
    void rejectsOversizedSource() {
        CompilerAnalysisProperties defaults = CompilerAnalysisProperties.defaults();
        CompilerAnalysisProperties small = new CompilerAnalysisProperties(
                defaults.lexicalErrorContinuationThreshold(),
                defaults.semanticRuleErrorLimit(),
                defaults.cosmeticTokenThreshold(),
                defaults.postParseCriticalLimit(),
                defaults.lexerIterationFactor(),
                defaults.maxNestingDepth(),
                10);

        AnalysisReport report = serviceWith(small).analyze("let value = 1234567890;", Language.JAVASCRIPT);

        assertThat(report.tokens()).isEmpty();
        assertThat(report.errors()).extracting(Diagnostic::message)
                .containsExactly("Source code exceeds maximum length of 10 characters");
        assertThat(report.analysisPhases().lexical().errorsFound()).isEqualTo(1);
    }

    @Test
    void analysisIsRepeatable() {
        String source = "function f(a) {\n  return a * 2;\n}\nconsole.log(f(2));\nconsole.log(missing);";

        AnalysisReport first = service.analyze(source, Language.JAVASCRIPT);
        AnalysisReport second = service.analyze(source, Language.JAVASCRIPT);

        assertThat(second.tokens()).isEqualTo(first.tokens());
        assertThat(second.parseTree()).isEqualTo(first.parseTree());
        assertThat(second.errors()).isEqualTo(first.errors());
        assertThat(first.symbolTable()).extracting(SymbolEntry::getName).contains("f", "a");
        assertThat(second.symbolTable())
                .usingRecursiveFieldByFieldElementComparator()
                .containsExactlyElementsOf(first.symbolTable());
        assertThat(second.markers()).isEqualTo(first.markers());
        assertThat(second.executionResult()).isEqualTo(first.executionResult());
    }

    @Test
    void missingLanguageFallsBackToUnknown() {
        AnalysisReport report = service.analyze("hello world", null);

        assertThat(report.language()).isEqualTo(Language.UNKNOWN);
        assertThat(report.canExecute()).isTrue();
        assertThat(report.executionResult().output()).isEqualTo("Code analyzed; nothing to simulate");
    }

    @Test
    void requestNormalizesLineEndingsAndResolvesLanguage() {
        AnalysisReport report = service.analyze(new AnalysisRequest("let a = 1;\r\nlet b = a;", "js"));

        assertThat(report.language()).isEqualTo(Language.JAVASCRIPT);
        assertThat(report.tokens()).anyMatch(token -> token.text().equals("b") && token.line() == 2);
    }

    @Test
    void emptySourceIsAnalyzedWithoutErrors() {
        AnalysisReport report = service.analyze("", Language.PYTHON);

        assertThat(report.tokens()).isEmpty();
        assertThat(report.errors()).isEmpty();
        assertThat(report.canExecute()).isTrue();
    }

    @Test
    void markerFailureStillReturnsReport() {
        CompilerAnalysisProperties properties = CompilerAnalysisProperties.defaults();
        MarkerMapper failingMapper = new MarkerMapper() {
            @Override
            public List<EditorMarker> toMarkers(List<Diagnostic> diagnostics, String source) {
                throw new IllegalStateException("marker mapping broke");
            }
        };
        CompilerAnalysisService failing = new CompilerAnalysisService(
                properties,
                new LexicalAnalyzer(properties),
                new SyntaxAnalyzer(properties),
                new SemanticAnalyzer(properties),
                new ExecutionTraceSynthesizer(),
                failingMapper);

        AnalysisReport report = failing.analyze("console.log(missing);", Language.JAVASCRIPT);

        assertThat(report.markers()).isEmpty();
        assertThat(report.errors()).isNotEmpty();
        assertThat(report.tokens()).isNotEmpty();
    }

    private static CompilerAnalysisService serviceWith(CompilerAnalysisProperties properties) {
        return new CompilerAnalysisService(
                properties,
                new LexicalAnalyzer(properties),
                new SyntaxAnalyzer(properties),
                new SemanticAnalyzer(properties),
                new ExecutionTraceSynthesizer(),
                new MarkerMapper());
    }
}
