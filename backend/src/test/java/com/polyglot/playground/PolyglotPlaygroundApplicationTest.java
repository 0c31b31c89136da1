package com.polyglot.playground;

import com.polyglot.playground.config.CompilerAnalysisProperties;
import com.polyglot.playground.dto.AnalysisReport;
import com.polyglot.playground.language.Language;
import com.polyglot.playground.service.CompilerAnalysisService;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = "compiler.analysis.semantic-rule-error-limit=7")
class PolyglotPlaygroundApplicationTest {

    @Autowired
    private CompilerAnalysisProperties properties;

    @Autowired
    private CompilerAnalysisService analysisService;

    @Test
    void bindsAnalysisProperties() {
        assertThat(properties.lexicalErrorContinuationThreshold()).isEqualTo(5);
        assertThat(properties.semanticRuleErrorLimit()).isEqualTo(7);
        assertThat(properties.maxSourceLength()).isEqualTo(1_048_576);
    }

    @Test
    void wiresTheAnalysisPipeline() {
        AnalysisReport report = analysisService.analyze("x = 1\nprint(x)\n", Language.PYTHON);

        assertThat(report.canExecute()).isTrue();
        assertThat(report.executionResult().output()).isEqualTo("x\n");
    }
}
