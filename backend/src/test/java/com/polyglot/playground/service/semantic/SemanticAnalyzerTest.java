package com.polyglot.playground.service.semantic;

import com.polyglot.playground.config.CompilerAnalysisProperties;
import com.polyglot.playground.dto.Diagnostic;
import com.polyglot.playground.dto.Severity;
import com.polyglot.playground.dto.SymbolEntry;
import com.polyglot.playground.dto.SymbolKind;
import com.polyglot.playground.dto.Token;
import com.polyglot.playground.language.Language;
import com.polyglot.playground.service.PhaseResult;
import com.polyglot.playground.service.lexical.LexicalAnalyzer;
import com.polyglot.playground.service.syntax.SyntaxAnalyzer;
import com.polyglot.playground.service.syntax.SyntaxResult;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SemanticAnalyzerTest {

    private final CompilerAnalysisProperties properties = CompilerAnalysisProperties.defaults();
    private final LexicalAnalyzer lexicalAnalyzer = new LexicalAnalyzer(properties);
    private final SyntaxAnalyzer syntaxAnalyzer = new SyntaxAnalyzer(properties);
    private final SemanticAnalyzer analyzer = new SemanticAnalyzer(properties);

    @Test
    void reportsUndeclaredIdentifierInCpp() {
        SemanticResult result = analyze("#include <iostream>\nint main() { int x = total + 1; return x; }", Language.CPP);

        assertThat(errors(result)).singleElement().satisfies(diagnostic -> {
            assertThat(diagnostic.message()).contains("'total'");
            assertThat(diagnostic.line()).isEqualTo(2);
        });
    }

    @Test
    void reportsTypeIncompatibility() {
        SemanticResult result = analyze("#include <iostream>\nint main() { int x = \"hello\"; return x; }", Language.CPP);

        assertThat(errors(result)).extracting(Diagnostic::message)
                .containsExactly("Type incompatibility: cannot assign 'string' to 'int'");
    }

    @Test
    void acceptsStringLiteralForCharPointer() {
        SemanticResult result = analyze("#include <cstdio>\nint main() { const char* s = \"hi\"; printf(s); return 0; }",
                Language.CPP);

        assertThat(errors(result)).isEmpty();
    }

    @Test
    void requiresMainInCpp() {
        SemanticResult result = analyze("#include <iostream>\nint helper() { return 1; }", Language.CPP);

        assertThat(errors(result)).extracting(Diagnostic::message)
                .containsExactly("C++ program must define a 'main' function");
    }

    @Test
    void undeclaredNameIsOnlyAWarningInJavaScript() {
        SemanticResult result = analyze("console.log(total);", Language.JAVASCRIPT);

        assertThat(errors(result)).isEmpty();
        assertThat(result.diagnostics()).anySatisfy(diagnostic -> {
            assertThat(diagnostic.severity()).isEqualTo(Severity.WARNING);
            assertThat(diagnostic.message()).isEqualTo("Identifier 'total' has not been declared");
        });
    }

    @Test
    void letRedeclarationIsAnError() {
        SemanticResult result = analyze("let count = 1;\nlet count = 2;\nconsole.log(count);", Language.JAVASCRIPT);

        assertThat(errors(result)).extracting(Diagnostic::message)
                .containsExactly("'count' is already declared in scope 'global'");
    }

    @Test
    void varRedeclarationIsAllowed() {
        SemanticResult result = analyze("var count = 1;\nvar count = 2;\nconsole.log(count);", Language.JAVASCRIPT);

        assertThat(errors(result)).isEmpty();
        assertThat(result.diagnostics()).extracting(Diagnostic::message)
                .contains("Prefer 'let' or 'const' over 'var'");
    }

    @Test
    void constReassignmentIsAnError() {
        SemanticResult result = analyze("const limit = 10;\nlimit = 20;", Language.JAVASCRIPT);

        assertThat(errors(result)).extracting(Diagnostic::message)
                .containsExactly("Cannot reassign constant 'limit'");
    }

    @Test
    void collectsJavaScriptSymbols() {
        SemanticResult result = analyze("function add(a, b) {\n  return a + b;\n}\nconst total = add(1, 2);",
                Language.JAVASCRIPT);

        assertThat(result.symbols()).extracting(SymbolEntry::getName).contains("add", "a", "b", "total");
        SymbolEntry add = find(result, "add");
        assertThat(add.getKind()).isEqualTo(SymbolKind.FUNCTION);
        assertThat(add.getParameters()).hasSize(2);
        assertThat(result.symbols()).noneMatch(SymbolEntry::isBuiltin);
    }

    @Test
    void warnsAboutUnusedPythonLocal() {
        SemanticResult result = analyze("def compute():\n    temp = 5\n    return 1\n", Language.PYTHON);

        assertThat(errors(result)).isEmpty();
        assertThat(result.diagnostics()).extracting(Diagnostic::message)
                .contains("Variable 'temp' is declared but never used");
    }

    @Test
    void pascalNamesAreCaseInsensitive() {
        SemanticResult result = analyze("program Demo;\nvar x: integer;\nbegin\n  X := 1;\n  writeln(total);\nend.",
                Language.PASCAL);

        assertThat(errors(result)).extracting(Diagnostic::message)
                .containsExactly("Identifier 'total' has not been declared");
    }

    @Test
    void tsqlVariablesMustBeDeclared() {
        SemanticResult declared = analyze("DECLARE @n INT = 1;\nSELECT @n;", Language.TSQL);
        SemanticResult undeclared = analyze("SELECT @missing;", Language.TSQL);

        assertThat(errors(declared)).isEmpty();
        assertThat(errors(undeclared)).extracting(Diagnostic::message)
                .containsExactly("Identifier '@missing' has not been declared");
    }

    @Test
    void reportsColumnWithoutType() {
        SemanticResult result = analyze("CREATE TABLE users (id INT, name);", Language.TSQL);

        assertThat(errors(result)).extracting(Diagnostic::message)
                .containsExactly("Column 'name' has no data type");
    }

    @Test
    void warnsAboutDuplicateHtmlId() {
        SemanticResult result = analyze("<div id=\"main\"></div>\n<p id=\"main\">Hi</p>", Language.HTML);

        assertThat(result.diagnostics()).anySatisfy(diagnostic -> {
            assertThat(diagnostic.severity()).isEqualTo(Severity.WARNING);
            assertThat(diagnostic.message()).isEqualTo("Duplicate id 'main'");
            assertThat(diagnostic.line()).isEqualTo(2);
        });
    }

    @Test
    void unknownLanguageHasNoSemanticPolicy() {
        SemanticResult result = analyze("hello world", Language.UNKNOWN);

        assertThat(result.diagnostics()).isEmpty();
        assertThat(result.symbols()).isEmpty();
    }

    private SemanticResult analyze(String source, Language language) {
        List<Token> tokens = lexicalAnalyzer.analyze(source, language).value().tokens();
        SyntaxResult syntax = syntaxAnalyzer.analyze(tokens, language).value();
        PhaseResult<SemanticResult> result = analyzer.analyze(tokens, syntax.nodes(), language);
        assertThat(result.failed()).isFalse();
        return result.value();
    }

    private static List<Diagnostic> errors(SemanticResult result) {
        return result.diagnostics().stream().filter(Diagnostic::isError).toList();
    }

    private static SymbolEntry find(SemanticResult result, String name) {
        return result.symbols().stream()
                .filter(entry -> entry.getName().equals(name))
                .findFirst()
                .orElseThrow();
    }
}
