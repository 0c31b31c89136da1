package com.polyglot.playground.service;

import com.polyglot.playground.config.CompilerAnalysisProperties;
import com.polyglot.playground.dto.AnalysisPhases;
import com.polyglot.playground.dto.AnalysisReport;
import com.polyglot.playground.dto.AnalysisRequest;
import com.polyglot.playground.dto.Diagnostic;
import com.polyglot.playground.dto.EditorMarker;
import com.polyglot.playground.dto.ExecutionTrace;
import com.polyglot.playground.dto.ParseNode;
import com.polyglot.playground.dto.Phase;
import com.polyglot.playground.dto.PhaseSummary;
import com.polyglot.playground.dto.SymbolEntry;
import com.polyglot.playground.dto.Token;
import com.polyglot.playground.exception.AnalysisFault;
import com.polyglot.playground.language.Language;
import com.polyglot.playground.service.lexical.LexicalAnalyzer;
import com.polyglot.playground.service.lexical.LexicalResult;
import com.polyglot.playground.service.semantic.SemanticAnalyzer;
import com.polyglot.playground.service.semantic.SemanticResult;
import com.polyglot.playground.service.syntax.SyntaxAnalyzer;
import com.polyglot.playground.service.syntax.SyntaxResult;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

@Service
public class CompilerAnalysisService {

    private static final Logger logger = LoggerFactory.getLogger(CompilerAnalysisService.class);

    private final CompilerAnalysisProperties properties;
    private final LexicalAnalyzer lexicalAnalyzer;
    private final SyntaxAnalyzer syntaxAnalyzer;
    private final SemanticAnalyzer semanticAnalyzer;
    private final ExecutionTraceSynthesizer traceSynthesizer;
    private final MarkerMapper markerMapper;

    public CompilerAnalysisService(CompilerAnalysisProperties properties,
                                   LexicalAnalyzer lexicalAnalyzer,
                                   SyntaxAnalyzer syntaxAnalyzer,
                                   SemanticAnalyzer semanticAnalyzer,
                                   ExecutionTraceSynthesizer traceSynthesizer,
                                   MarkerMapper markerMapper) {
        this.properties = properties;
        this.lexicalAnalyzer = lexicalAnalyzer;
        this.syntaxAnalyzer = syntaxAnalyzer;
        this.semanticAnalyzer = semanticAnalyzer;
        this.traceSynthesizer = traceSynthesizer;
        this.markerMapper = markerMapper;
    }

    public AnalysisReport analyze(AnalysisRequest request) {
        return analyze(request.sanitizedCode(), request.resolvedLanguage());
    }

    public AnalysisReport analyze(String code, Language language) {
        long startTime = System.currentTimeMillis();
        String source = code == null ? "" : code;
        Language target = language == null ? Language.UNKNOWN : language;
        logger.info("Analyzing {} characters of {}", source.length(), target.displayName());

        List<Token> tokens = List.of();
        List<ParseNode> parseTree = List.of();
        List<SymbolEntry> symbols = List.of();
        List<Diagnostic> diagnostics = new ArrayList<>();
        PhaseSummary lexicalSummary = PhaseSummary.notRun();
        PhaseSummary syntaxSummary = PhaseSummary.notRun();
        PhaseSummary semanticSummary = PhaseSummary.notRun();
        ExecutionTrace trace = null;
        boolean canExecute = false;

        try {
            if (source.length() > properties.maxSourceLength()) {
                logger.warn("Rejecting {} characters of source, limit is {}", source.length(), properties.maxSourceLength());
                diagnostics.add(Diagnostic.error(Phase.LEXICAL,
                        "Source code exceeds maximum length of " + properties.maxSourceLength() + " characters", 1, 1, 0));
                lexicalSummary = PhaseSummary.lexical(false, 0, 1);
            } else {
                PhaseResult<LexicalResult> lexical = lexicalAnalyzer.analyze(source, target);
                tokens = lexical.value().tokens();
                List<Diagnostic> lexicalDiagnostics = withFault(lexical.value().diagnostics(), lexical);
                diagnostics.addAll(lexicalDiagnostics);
                int lexicalErrors = errors(lexicalDiagnostics);
                lexicalSummary = PhaseSummary.lexical(!lexical.failed(), tokens.size(), lexicalErrors);

                int syntaxErrors = 0;
                int semanticErrors = 0;
                if (lexicalErrors < properties.lexicalErrorContinuationThreshold()) {
                    PhaseResult<SyntaxResult> syntax = syntaxAnalyzer.analyze(tokens, target);
                    parseTree = syntax.value().nodes();
                    List<Diagnostic> syntaxDiagnostics = withFault(syntax.value().diagnostics(), syntax);
                    diagnostics.addAll(syntaxDiagnostics);
                    syntaxErrors = errors(syntaxDiagnostics);
                    syntaxSummary = PhaseSummary.syntax(!syntax.failed(), parseTree.size(), syntaxErrors);

                    if (syntaxErrors == 0) {
                        PhaseResult<SemanticResult> semantic = semanticAnalyzer.analyze(tokens, parseTree, target);
                        symbols = semantic.value().symbols();
                        List<Diagnostic> semanticDiagnostics = withFault(semantic.value().diagnostics(), semantic);
                        diagnostics.addAll(semanticDiagnostics);
                        semanticErrors = errors(semanticDiagnostics);
                        semanticSummary = PhaseSummary.semantic(!semantic.failed(), symbols.size(), semanticErrors);
                    } else {
                        logger.warn("Skipping semantic analysis of {}: {} syntax errors", target.tag(), syntaxErrors);
                    }
                } else {
                    logger.warn("Skipping syntax analysis of {}: {} lexical errors", target.tag(), lexicalErrors);
                }

                canExecute = lexicalErrors == 0 && syntaxErrors == 0 && semanticErrors == 0;
                if (canExecute) {
                    trace = traceSynthesizer.simulate(tokens, symbols, target);
                }
            }
        } catch (RuntimeException | StackOverflowError e) {
            logger.error("Critical compiler error while analyzing {}", target.tag(), e);
            diagnostics.add(Diagnostic.error(Phase.SEMANTIC, "critical compiler error: " + e, 1, 1, 0));
            canExecute = false;
            trace = null;
        }

        List<EditorMarker> markers;
        try {
            markers = markerMapper.toMarkers(diagnostics, source);
        } catch (RuntimeException e) {
            logger.warn("Could not map {} diagnostics of {} to editor markers: {}",
                    diagnostics.size(), target.tag(), e.toString());
            markers = List.of();
        }

        long processingTime = System.currentTimeMillis() - startTime;
        logger.info("Analysis of {} finished in {} ms: {} tokens, {} diagnostics, canExecute={}",
                target.tag(), processingTime, tokens.size(), diagnostics.size(), canExecute);

        return new AnalysisReport(
                target,
                tokens,
                parseTree,
                symbols,
                List.copyOf(diagnostics),
                canExecute,
                new AnalysisPhases(lexicalSummary, syntaxSummary, semanticSummary),
                trace,
                markers,
                processingTime
        );
    }

    private static List<Diagnostic> withFault(List<Diagnostic> diagnostics, PhaseResult<?> result) {
        if (!result.failed()) {
            return diagnostics;
        }
        List<Diagnostic> combined = new ArrayList<>(diagnostics);
        result.faultIfAny().map(AnalysisFault::toDiagnostic).ifPresent(combined::add);
        return combined;
    }

    private static int errors(List<Diagnostic> diagnostics) {
        return (int) diagnostics.stream().filter(Diagnostic::isError).count();
    }
}
