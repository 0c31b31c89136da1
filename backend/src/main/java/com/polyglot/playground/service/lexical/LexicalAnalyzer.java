package com.polyglot.playground.service.lexical;

import com.polyglot.playground.config.CompilerAnalysisProperties;
import com.polyglot.playground.dto.Phase;
import com.polyglot.playground.exception.AnalysisFault;
import com.polyglot.playground.language.Language;
import com.polyglot.playground.service.PhaseResult;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class LexicalAnalyzer {

    private static final Logger logger = LoggerFactory.getLogger(LexicalAnalyzer.class);

    private final CompilerAnalysisProperties properties;

    public LexicalAnalyzer(CompilerAnalysisProperties properties) {
        this.properties = properties;
    }

    public PhaseResult<LexicalResult> analyze(String source, Language language) {
        SourceScanner scanner = new SourceScanner(source, language.profile(), properties.lexerIterationFactor());
        try {
            LexicalResult result = scanner.scan();
            logger.debug("Lexical analysis of {} produced {} tokens and {} diagnostics",
                    language.tag(), result.tokens().size(), result.diagnostics().size());
            return PhaseResult.success(result);
        } catch (RuntimeException e) {
            logger.warn("Lexical analysis of {} failed: {}", language.tag(), e.getMessage());
            return PhaseResult.failure(
                    new AnalysisFault(Phase.LEXICAL, "Lexical analysis failed: " + e.getMessage(), e),
                    scanner.partialResult());
        }
    }
}
