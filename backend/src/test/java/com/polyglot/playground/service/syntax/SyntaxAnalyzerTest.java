package com.polyglot.playground.service.syntax;

import com.polyglot.playground.config.CompilerAnalysisProperties;
import com.polyglot.playground.dto.Diagnostic;
import com.polyglot.playground.dto.ParseNode;
import com.polyglot.playground.dto.Severity;
import com.polyglot.playground.language.Language;
import com.polyglot.playground.service.PhaseResult;
import com.polyglot.playground.service.lexical.LexicalAnalyzer;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SyntaxAnalyzerTest {

    private final CompilerAnalysisProperties properties = CompilerAnalysisProperties.defaults();
    private final LexicalAnalyzer lexicalAnalyzer = new LexicalAnalyzer(properties);
    private final SyntaxAnalyzer analyzer = new SyntaxAnalyzer(properties);

    @Test
    void reportsUnclosedParenthesisAtTheOpener() {
        SyntaxResult result = parse("(a, b", Language.JAVASCRIPT);

        assertThat(errors(result)).singleElement().satisfies(diagnostic -> {
            assertThat(diagnostic.message()).isEqualTo("Unclosed symbol '('");
            assertThat(diagnostic.line()).isEqualTo(1);
            assertThat(diagnostic.column()).isEqualTo(1);
        });
    }

    @Test
    void reportsUnmatchedClosingBrace() {
        SyntaxResult result = parse("function f() {\n  return 1;\n}\n}", Language.JAVASCRIPT);

        assertThat(errors(result)).extracting(Diagnostic::message)
                .containsExactly("Unmatched closing symbol '}'");
    }

    @Test
    void buildsFunctionDeclarationNode() {
        SyntaxResult result = parse("function greet(name) {\n  return name;\n}\n", Language.JAVASCRIPT);

        assertThat(errors(result)).isEmpty();
        assertThat(result.nodes()).isNotEmpty();
        assertThat(result.nodes().get(0).value()).isEqualTo("greet");
    }

    @Test
    void createTableWithoutColumnsIsAnError() {
        SyntaxResult result = parse("CREATE TABLE users;", Language.TSQL);

        assertThat(errors(result)).extracting(Diagnostic::message)
                .anyMatch(message -> message.contains("missing its column definitions"));
    }

    @Test
    void createTableKeepsColumnDefinitions() {
        SyntaxResult result = parse("CREATE TABLE users (id INT PRIMARY KEY, name VARCHAR(50));", Language.TSQL);

        assertThat(errors(result)).isEmpty();
        ParseNode create = result.nodes().get(0);
        assertThat(create.kind()).isEqualTo("CreateTableStatement");
        assertThat(create.value()).isEqualTo("users");
        ParseNode columns = create.children().get(0);
        assertThat(columns.kind()).isEqualTo("ColumnList");
        assertThat(columns.children()).extracting(ParseNode::value).containsExactly("id", "name");
    }

    @Test
    void reportsUnclosedBeginBlockInPascal() {
        SyntaxResult result = parse("program Demo;\nbegin\n  writeln('hi');\n", Language.PASCAL);

        assertThat(errors(result)).extracting(Diagnostic::message)
                .anyMatch(message -> message.contains("never closed"));
    }

    @Test
    void smallProgramsOnlyKeepErrors() {
        SyntaxResult result = parse("int x = 1;", Language.CPP);

        assertThat(result.diagnostics()).allMatch(Diagnostic::isError);
    }

    @Test
    void warnsAboutMissingMainInLargerCppProgram() {
        SyntaxResult result = parse("int helper(int a) {\n  return a + 1;\n}\n", Language.CPP);

        assertThat(result.diagnostics()).extracting(Diagnostic::message)
                .contains("C++ program should define a 'main' function");
    }

    @Test
    void deepNestingTerminates() {
        String source = "x = " + "(".repeat(5_000) + "1" + ")".repeat(5_000) + ";";

        PhaseResult<SyntaxResult> result = analyzer.analyze(
                lexicalAnalyzer.analyze(source, Language.JAVASCRIPT).value().tokens(), Language.JAVASCRIPT);

        assertThat(result.failed()).isFalse();
        assertThat(errors(result.value())).isEmpty();
    }

    @Test
    void deeplyNestedBracesReportUnclosedSymbols() {
        for (Language language : List.of(Language.JAVASCRIPT, Language.CPP)) {
            SyntaxResult result = parse("{".repeat(20_000), language);

            assertThat(result.nodes()).isNotEmpty();
            assertThat(errors(result)).extracting(Diagnostic::message)
                    .contains("Unclosed symbol '{'")
                    .noneMatch(message -> message.startsWith("Syntax analysis failed"));
        }
    }

    @Test
    void deeplyNestedBeginBlocksReportUnclosedBlocks() {
        SyntaxResult result = parse("begin ".repeat(20_000), Language.PLSQL);

        assertThat(result.nodes()).isNotEmpty();
        assertThat(errors(result)).extracting(Diagnostic::message)
                .contains("Block opened by 'begin' is never closed");
    }

    @Test
    void controlStatementsCutOffAtEndOfInputInTransactSql() {
        SyntaxResult ifOnly = parse("IF", Language.TSQL);
        SyntaxResult trailingWhile = parse("SELECT 1 FROM dual;\nWHILE", Language.TSQL);

        assertThat(ifOnly.nodes()).extracting(ParseNode::kind).containsExactly("IfStatement");
        assertThat(errors(ifOnly)).extracting(Diagnostic::message)
                .contains("Expected condition but found end of input");
        assertThat(trailingWhile.nodes()).extracting(ParseNode::kind).endsWith("WhileStatement");
        assertThat(errors(trailingWhile)).extracting(Diagnostic::message)
                .contains("Expected condition but found end of input");
    }

    @Test
    void controlStatementsCutOffAtEndOfInputInPlSql() {
        SyntaxResult trailingIf = parse("BEGIN\n  IF", Language.PLSQL);
        SyntaxResult trailingWhile = parse("BEGIN\n  WHILE", Language.PLSQL);
        SyntaxResult trailingFor = parse("BEGIN\n  FOR i IN", Language.PLSQL);

        assertThat(errors(trailingIf)).extracting(Diagnostic::message)
                .contains("Expected condition but found end of input");
        assertThat(errors(trailingWhile)).extracting(Diagnostic::message)
                .contains("Expected condition but found end of input");
        assertThat(errors(trailingFor)).extracting(Diagnostic::message)
                .contains("Expected expression but found end of input");
        assertThat(List.of(trailingIf, trailingWhile, trailingFor))
                .allSatisfy(result -> assertThat(result.nodes()).extracting(ParseNode::kind).containsExactly("Block"));
    }

    @Test
    void commentsAreIgnored() {
        SyntaxResult result = parse("// just a note\n/* and another */", Language.JAVASCRIPT);

        assertThat(result.nodes()).isEmpty();
        assertThat(result.diagnostics()).isEmpty();
    }

    private SyntaxResult parse(String source, Language language) {
        PhaseResult<SyntaxResult> result = analyzer.analyze(
                lexicalAnalyzer.analyze(source, language).value().tokens(), language);
        assertThat(result.failed()).isFalse();
        return result.value();
    }

    private static List<Diagnostic> errors(SyntaxResult result) {
        return result.diagnostics().stream()
                .filter(diagnostic -> diagnostic.severity() == Severity.ERROR)
                .toList();
    }
}
