package com.polyglot.playground.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.polyglot.playground.dto.AnalysisReport;
import com.polyglot.playground.dto.AnalysisRequest;
import com.polyglot.playground.service.CompilerAnalysisService;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

@Component
public class AnalysisCommandLineRunner implements ApplicationRunner {

    private static final Logger logger = LoggerFactory.getLogger(AnalysisCommandLineRunner.class);

    static final String FILE_OPTION = "file";
    static final String CODE_OPTION = "code";
    static final String LANGUAGE_OPTION = "language";
    static final String PRETTY_OPTION = "pretty";

    private final CompilerAnalysisService analysisService;
    private final Validator validator;
    private final ObjectMapper objectMapper;
    private final PrintStream out;

    @Autowired
    public AnalysisCommandLineRunner(CompilerAnalysisService analysisService, Validator validator,
                                     ObjectMapper objectMapper) {
        this(analysisService, validator, objectMapper, System.out);
    }

    AnalysisCommandLineRunner(CompilerAnalysisService analysisService, Validator validator,
                              ObjectMapper objectMapper, PrintStream out) {
        this.analysisService = analysisService;
        this.validator = validator;
        this.objectMapper = objectMapper;
        this.out = out;
    }

    @Override
    public void run(ApplicationArguments args) throws IOException {
        if (!args.containsOption(FILE_OPTION) && !args.containsOption(CODE_OPTION)) {
            logger.debug("No --file or --code option given, nothing to analyze");
            return;
        }

        AnalysisRequest request = new AnalysisRequest(readCode(args), single(args, LANGUAGE_OPTION));
        Set<ConstraintViolation<AnalysisRequest>> violations = validator.validate(request);
        if (!violations.isEmpty()) {
            StringBuilder errorMessage = new StringBuilder("Validation error: ");
            violations.forEach(violation -> errorMessage.append(violation.getPropertyPath())
                    .append(" - ")
                    .append(violation.getMessage())
                    .append("; "));
            logger.warn("{}", errorMessage);
            throw new IllegalArgumentException(errorMessage.toString());
        }

        AnalysisReport report = analysisService.analyze(request);
        ObjectWriter writer = args.containsOption(PRETTY_OPTION)
                ? objectMapper.writerWithDefaultPrettyPrinter()
                : objectMapper.writer();
        out.println(writer.writeValueAsString(report));
        logger.info("Analysis completed - Language: {}, canExecute: {}", report.language().tag(), report.canExecute());
    }

    private static String readCode(ApplicationArguments args) throws IOException {
        String file = single(args, FILE_OPTION);
        if (file != null) {
            Path path = Path.of(file);
            logger.info("Reading source from {}", path);
            return Files.readString(path, StandardCharsets.UTF_8);
        }
        return single(args, CODE_OPTION);
    }

    private static String single(ApplicationArguments args, String option) {
        List<String> values = args.getOptionValues(option);
        return values == null || values.isEmpty() ? null : values.get(values.size() - 1);
    }
}
