package com.polyglot.playground.service.semantic;

import com.polyglot.playground.config.CompilerAnalysisProperties;
import com.polyglot.playground.dto.ParseNode;
import com.polyglot.playground.dto.Phase;
import com.polyglot.playground.dto.SymbolEntry;
import com.polyglot.playground.dto.Token;
import com.polyglot.playground.exception.AnalysisFault;
import com.polyglot.playground.language.Language;
import com.polyglot.playground.service.PhaseResult;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.stream.Collectors;

@Service
public class SemanticAnalyzer {

    private static final Logger logger = LoggerFactory.getLogger(SemanticAnalyzer.class);

    private final CompilerAnalysisProperties properties;

    public SemanticAnalyzer(CompilerAnalysisProperties properties) {
        this.properties = properties;
    }

    public PhaseResult<SemanticResult> analyze(List<Token> tokens, List<ParseNode> tree, Language language) {
        List<Token> significant = tokens.stream()
                .filter(token -> !token.isComment())
                .collect(Collectors.toList());
        SemanticContext context = new SemanticContext(significant, language.profile());
        try {
            context.seedBuiltins();
            SymbolCollector collector = collectorFor(language, context);
            if (collector != null) {
                context.guarded("declarations", collector::collect);
            }
            if (!context.symbols().isEmpty()) {
                new SymbolVerifier(context).verify();
            }
            long errors = context.errorCount();
            if (errors <= properties.semanticRuleErrorLimit()) {
                new LanguageRuleChecks(context, tree).run();
            } else {
                logger.warn("Skipping {} language rules: {} semantic errors already reported", language.tag(), errors);
            }
        } catch (RuntimeException | StackOverflowError e) {
            logger.warn("Semantic analysis of {} failed: {}", language.tag(), e.toString());
            AnalysisFault fault = new AnalysisFault(Phase.SEMANTIC, "Semantic analysis failed: " + e, e);
            return PhaseResult.failure(fault, new SemanticResult(context.sortedDiagnostics(), declared(context)));
        }

        SemanticResult result = new SemanticResult(context.sortedDiagnostics(), declared(context));
        logger.debug("Semantic analysis of {} found {} symbols in {} scopes and {} diagnostics",
                language.tag(), result.symbols().size(), context.scopes().scopes().size(), result.diagnostics().size());
        return PhaseResult.success(result);
    }

    /**
     * The program's own declarations; built-ins stay internal to the run.
     */
    private static List<SymbolEntry> declared(SemanticContext context) {
        return context.symbols().stream()
                .filter(entry -> !entry.isBuiltin())
                .collect(Collectors.toList());
    }

    private static SymbolCollector collectorFor(Language language, SemanticContext context) {
        return switch (language) {
            case JAVASCRIPT -> new JavaScriptSymbolCollector(context);
            case PYTHON -> new PythonSymbolCollector(context);
            case CPP -> new CppSymbolCollector(context);
            case PASCAL -> new PascalSymbolCollector(context);
            case PLSQL -> new PlSqlSymbolCollector(context);
            case TSQL -> new TSqlSymbolCollector(context);
            case HTML, UNKNOWN -> null;
        };
    }
}
