package com.polyglot.playground.service.syntax;

import com.polyglot.playground.config.CompilerAnalysisProperties;
import com.polyglot.playground.dto.Diagnostic;
import com.polyglot.playground.dto.ParseNode;
import com.polyglot.playground.dto.Phase;
import com.polyglot.playground.dto.Token;
import com.polyglot.playground.exception.AnalysisFault;
import com.polyglot.playground.language.Language;
import com.polyglot.playground.language.LanguageProfile;
import com.polyglot.playground.service.PhaseResult;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

@Service
public class SyntaxAnalyzer {

    private static final Logger logger = LoggerFactory.getLogger(SyntaxAnalyzer.class);

    private final CompilerAnalysisProperties properties;

    public SyntaxAnalyzer(CompilerAnalysisProperties properties) {
        this.properties = properties;
    }

    public PhaseResult<SyntaxResult> analyze(List<Token> tokens, Language language) {
        LanguageProfile profile = language.profile();
        List<Token> significant = tokens.stream()
                .filter(token -> !token.isComment())
                .collect(Collectors.toList());
        StatementParser parser = parserFor(language, new TokenCursor(significant, profile));

        List<ParseNode> nodes;
        try {
            nodes = parser.parseProgram();
        } catch (RuntimeException | StackOverflowError e) {
            logger.warn("Syntax analysis of {} failed: {}", language.tag(), e.toString());
            AnalysisFault fault = new AnalysisFault(Phase.SYNTACTIC, "Syntax analysis failed: " + e, e);
            return PhaseResult.failure(fault, new SyntaxResult(List.of(), sorted(parser.diagnostics())));
        }

        List<Diagnostic> diagnostics = new ArrayList<>(parser.diagnostics());
        long critical = diagnostics.stream().filter(Diagnostic::isError).count();
        if (critical <= properties.postParseCriticalLimit()) {
            diagnostics.addAll(new StructuralChecks(significant, profile).run());
        } else {
            logger.debug("Skipping structural checks for {}: {} syntax errors", language.tag(), critical);
        }
        if (significant.size() < properties.cosmeticTokenThreshold()) {
            diagnostics.removeIf(diagnostic -> !diagnostic.isError());
        }

        logger.debug("Syntax analysis of {} produced {} nodes and {} diagnostics",
                language.tag(), nodes.size(), diagnostics.size());
        return PhaseResult.success(new SyntaxResult(nodes, sorted(diagnostics)));
    }

    private StatementParser parserFor(Language language, TokenCursor cursor) {
        LanguageProfile profile = language.profile();
        int depth = properties.maxNestingDepth();
        return switch (language) {
            case JAVASCRIPT -> new JavaScriptParser(cursor, profile, depth);
            case PYTHON -> new PythonParser(cursor, profile, depth);
            case CPP -> new CppParser(cursor, profile, depth);
            case HTML -> new HtmlParser(cursor, profile, depth);
            case PASCAL -> new PascalParser(cursor, profile, depth);
            case PLSQL -> new PlSqlParser(cursor, profile, depth);
            case TSQL -> new TSqlParser(cursor, profile, depth);
            case UNKNOWN -> new GenericParser(cursor, profile, depth);
        };
    }

    private static List<Diagnostic> sorted(List<Diagnostic> diagnostics) {
        List<Diagnostic> copy = new ArrayList<>(diagnostics);
        copy.sort(Comparator.comparingInt(Diagnostic::offset));
        return copy;
    }
}
