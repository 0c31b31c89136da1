package com.polyglot.playground.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;

@ConfigurationProperties(prefix = "compiler.analysis")
@Validated
public record CompilerAnalysisProperties(
    @DefaultValue("5")
    @Positive
    int lexicalErrorContinuationThreshold,

    @DefaultValue("3")
    @PositiveOrZero
    int semanticRuleErrorLimit,

    @DefaultValue("10")
    @PositiveOrZero
    int cosmeticTokenThreshold,

    @DefaultValue("1")
    @PositiveOrZero
    int postParseCriticalLimit,

    @DefaultValue("3")
    @Positive
    int lexerIterationFactor,

    @DefaultValue("256")
    @Positive
    int maxNestingDepth,

    @DefaultValue("1048576")
    @Positive
    int maxSourceLength
) {

    public static CompilerAnalysisProperties defaults() {
        return new CompilerAnalysisProperties(5, 3, 10, 1, 3, 256, 1_048_576);
    }
}
