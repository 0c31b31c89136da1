package com.polyglot.playground.service;

import com.polyglot.playground.config.CompilerAnalysisProperties;
import com.polyglot.playground.dto.ExecutionTrace;
import com.polyglot.playground.dto.SymbolEntry;
import com.polyglot.playground.dto.SymbolKind;
import com.polyglot.playground.language.Language;
import com.polyglot.playground.service.lexical.LexicalAnalyzer;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ExecutionTraceSynthesizerTest {

    private final LexicalAnalyzer lexicalAnalyzer = new LexicalAnalyzer(CompilerAnalysisProperties.defaults());
    private final ExecutionTraceSynthesizer synthesizer = new ExecutionTraceSynthesizer();

    @Test
    void echoesConsoleLog() {
        ExecutionTrace trace = simulate("console.log(\"hi\");", Language.JAVASCRIPT);

        assertThat(trace.success()).isTrue();
        assertThat(trace.output()).isEqualTo("hi\n");
        assertThat(trace.executedCommands()).containsExactly("console.log(hi)");
    }

    @Test
    void joinsConcatenatedArguments() {
        ExecutionTrace trace = simulate("console.log(\"a\" + \"b\", 'c');", Language.JAVASCRIPT);

        assertThat(trace.output()).startsWith("ab c");
    }

    @Test
    void echoesPythonPrint() {
        ExecutionTrace trace = simulate("print('Hello, world')", Language.PYTHON);

        assertThat(trace.output()).isEqualTo("Hello, world\n");
    }

    @Test
    void keepsWrittenSpacingOfCodeArguments() {
        assertThat(simulate("print(add(1, 2))", Language.PYTHON).output()).isEqualTo("add(1, 2)\n");
        assertThat(simulate("print(\"sum:\", a  +  b)", Language.PYTHON).output()).isEqualTo("sum: a  +  b\n");
    }

    @Test
    void followsCoutChains() {
        ExecutionTrace trace = simulate("std::cout << \"Hello\" << std::endl;", Language.CPP);

        assertThat(trace.output()).isEqualTo("Hello\n");
    }

    @Test
    void notesCppShape() {
        SymbolEntry main = new SymbolEntry("main", SymbolKind.FUNCTION, "function", "global", 0, 2, 5, 2);

        ExecutionTrace trace = synthesizer.simulate(
                lexicalAnalyzer.analyze("#include <iostream>\nint main() { return 0; }", Language.CPP).value().tokens(),
                List.of(main), Language.CPP);

        assertThat(trace.output()).contains("Function main found").contains("Includes: 1 file(s)");
    }

    @Test
    void describesSqlStatements() {
        ExecutionTrace trace = simulate(
                "CREATE TABLE users (id INT, name VARCHAR(50));\n"
                        + "INSERT INTO users VALUES (1, 'Ana'), (2, 'Luis');\n"
                        + "SELECT name FROM users;",
                Language.TSQL);

        assertThat(trace.output().split("\n")).containsExactly(
                "Table 'users' created",
                "2 row(s) inserted into 'users'",
                "Query executed on table 'users'");
        assertThat(trace.executedCommands()).containsExactly(
                "CREATE TABLE users", "INSERT INTO users", "SELECT FROM users");
    }

    @Test
    void echoesTsqlPrint() {
        ExecutionTrace trace = simulate("PRINT 'It''s done';", Language.TSQL);

        assertThat(trace.output()).isEqualTo("It's done\n");
    }

    @Test
    void echoesPlsqlPutLine() {
        ExecutionTrace trace = simulate("BEGIN\n  DBMS_OUTPUT.PUT_LINE('Hola');\nEND;", Language.PLSQL);

        assertThat(trace.output()).isEqualTo("Hola\n");
    }

    @Test
    void summarizesHtmlDocument() {
        ExecutionTrace trace = simulate(
                "<html><head><title>My Page</title></head><body><p>One</p><p>Two</p></body></html>",
                Language.HTML);

        assertThat(trace.output())
                .contains("HTML structure: <html>, <head>, <body>, <title>")
                .contains("Title: My Page")
                .contains("Paragraphs: 2");
    }

    @Test
    void fallsBackWhenNothingIsPrinted() {
        ExecutionTrace trace = simulate("let x = 1;", Language.JAVASCRIPT);

        assertThat(trace.output()).isEqualTo("JavaScript code analyzed; no console output");
    }

    @Test
    void unquoteHandlesPrefixesAndTripleQuotes() {
        assertThat(ExecutionTraceSynthesizer.unquote("\"plain\"")).isEqualTo("plain");
        assertThat(ExecutionTraceSynthesizer.unquote("f'name'")).isEqualTo("name");
        assertThat(ExecutionTraceSynthesizer.unquote("N'texto'")).isEqualTo("texto");
        assertThat(ExecutionTraceSynthesizer.unquote("\"\"\"doc\"\"\"")).isEqualTo("doc");
        assertThat(ExecutionTraceSynthesizer.unquote("\"open")).isEqualTo("open");
    }

    @Test
    void decodesEscapes() {
        assertThat(ExecutionTraceSynthesizer.decodeEscapes("a\\tb\\n")).isEqualTo("a\tb\n");
        assertThat(ExecutionTraceSynthesizer.decodeEscapes("quote \\\" here")).isEqualTo("quote \" here");
    }

    private ExecutionTrace simulate(String source, Language language) {
        return synthesizer.simulate(lexicalAnalyzer.analyze(source, language).value().tokens(), List.of(), language);
    }
}
