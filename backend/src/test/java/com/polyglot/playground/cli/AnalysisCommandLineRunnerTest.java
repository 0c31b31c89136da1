package com.polyglot.playground.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.polyglot.playground.config.CompilerAnalysisProperties;
import com.polyglot.playground.service.CompilerAnalysisService;
import com.polyglot.playground.service.ExecutionTraceSynthesizer;
import com.polyglot.playground.service.MarkerMapper;
import com.polyglot.playground.service.lexical.LexicalAnalyzer;
import com.polyglot.playground.service.semantic.SemanticAnalyzer;
import com.polyglot.playground.service.syntax.SyntaxAnalyzer;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.DefaultApplicationArguments;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AnalysisCommandLineRunnerTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final ByteArrayOutputStream output = new ByteArrayOutputStream();
    private ValidatorFactory validatorFactory;
    private AnalysisCommandLineRunner runner;

    @BeforeEach
    void setUp() {
        CompilerAnalysisProperties properties = CompilerAnalysisProperties.defaults();
        CompilerAnalysisService service = new CompilerAnalysisService(
                properties,
                new LexicalAnalyzer(properties),
                new SyntaxAnalyzer(properties),
                new SemanticAnalyzer(properties),
                new ExecutionTraceSynthesizer(),
                new MarkerMapper());
        validatorFactory = Validation.buildDefaultValidatorFactory();
        Validator validator = validatorFactory.getValidator();
        runner = new AnalysisCommandLineRunner(service, validator, objectMapper,
                new PrintStream(output, true, StandardCharsets.UTF_8));
    }

    @AfterEach
    void tearDown() {
        validatorFactory.close();
    }

    @Test
    void printsReportForInlineCode() throws Exception {
        runner.run(new DefaultApplicationArguments("--code=console.log(\"hi\");", "--language=js"));

        JsonNode report = objectMapper.readTree(printed());
        assertThat(report.get("language").asText()).isEqualTo("javascript");
        assertThat(report.get("canExecute").asBoolean()).isTrue();
        assertThat(report.get("executionResult").get("output").asText()).isEqualTo("hi\n");
        assertThat(report.get("tokens")).hasSize(7);
    }

    @Test
    void readsSourceFromFile(@TempDir Path directory) throws Exception {
        Path source = directory.resolve("demo.py");
        Files.writeString(source, "print('from file')\n", StandardCharsets.UTF_8);

        runner.run(new DefaultApplicationArguments("--file=" + source, "--language=python", "--pretty"));

        String printed = printed();
        assertThat(printed).contains(System.lineSeparator());
        JsonNode report = objectMapper.readTree(printed);
        assertThat(report.get("language").asText()).isEqualTo("python");
        assertThat(report.get("executionResult").get("output").asText()).isEqualTo("from file\n");
    }

    @Test
    void doesNothingWithoutSource() throws Exception {
        runner.run(new DefaultApplicationArguments("--language=js"));

        assertThat(output.size()).isZero();
    }

    @Test
    void rejectsOversizedCode() {
        String code = "a".repeat(1_048_577);

        assertThatThrownBy(() -> runner.run(new DefaultApplicationArguments("--code=" + code)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageStartingWith("Validation error: code - ");
        assertThat(output.size()).isZero();
    }

    @Test
    void missingFileFails(@TempDir Path directory) {
        Path missing = directory.resolve("absent.js");

        assertThatThrownBy(() -> runner.run(new DefaultApplicationArguments("--file=" + missing)))
                .isInstanceOf(NoSuchFileException.class);
    }

    private String printed() {
        return output.toString(StandardCharsets.UTF_8);
    }
}
