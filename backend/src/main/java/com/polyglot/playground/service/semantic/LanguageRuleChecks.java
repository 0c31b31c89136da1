package com.polyglot.playground.service.semantic;

import com.polyglot.playground.dto.Diagnostic;
import com.polyglot.playground.dto.ParseNode;
import com.polyglot.playground.dto.Phase;
import com.polyglot.playground.dto.Severity;
import com.polyglot.playground.dto.SymbolEntry;
import com.polyglot.playground.dto.SymbolKind;
import com.polyglot.playground.dto.Token;
import com.polyglot.playground.dto.TokenKind;
import com.polyglot.playground.language.LanguageProfile;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

final class LanguageRuleChecks {

    private static final Pattern PASCAL_CASE = Pattern.compile("_*[A-Z][A-Za-z0-9]*");
    private static final Pattern SNAKE_CASE = Pattern.compile("_*[a-z][a-z0-9_]*");
    private static final Pattern UPPER_CASE = Pattern.compile("_*[A-Z][A-Z0-9_]*");
    private static final Pattern DUNDER = Pattern.compile("__\\w+__");
    private static final Pattern INCLUDE = Pattern.compile("#\\s*include\\b.*");

    private static final Set<String> SQL_VERBS = Set.of(
            "select", "insert", "update", "delete", "create", "alter", "drop", "merge", "truncate");

    private final SemanticContext context;
    private final List<Token> tokens;
    private final LanguageProfile profile;
    private final List<ParseNode> tree;

    LanguageRuleChecks(SemanticContext context, List<ParseNode> tree) {
        this.context = context;
        this.tokens = context.tokens();
        this.profile = context.profile();
        this.tree = tree;
    }

    void run() {
        switch (profile.language()) {
            case JAVASCRIPT -> {
                context.guarded("var declarations", this::checkVarKeyword);
                context.guarded("equality operators", this::checkLooseEquality);
                context.guarded("class names", this::checkClassNames);
            }
            case PYTHON -> context.guarded("naming conventions", this::checkPythonNames);
            case CPP -> {
                context.guarded("pointer types", this::tagPointerTypes);
                context.guarded("main function", this::checkMainFunction);
                context.guarded("include directives", this::checkIncludes);
            }
            case PASCAL -> context.guarded("block balance", this::checkBlockBalance);
            case PLSQL, TSQL -> {
                context.guarded("statement verbs", this::checkSqlVerb);
                context.guarded("table definitions", () -> tree.forEach(this::checkCreateTable));
            }
            case HTML -> context.guarded("element ids", this::checkDuplicateIds);
            case UNKNOWN -> {
            }
        }
    }

    private void checkVarKeyword() {
        for (Token token : tokens) {
            if (token.isKeyword() && token.hasText("var")) {
                context.report(Severity.INFO, "Prefer 'let' or 'const' over 'var'", token,
                        "'var' is function-scoped and can be redeclared");
            }
        }
    }

    private void checkLooseEquality() {
        for (Token token : tokens) {
            if (token.hasText("==") || token.hasText("!=")) {
                String strict = token.text() + "=";
                context.report(Severity.INFO, "Prefer strict equality '" + strict + "' over '" + token.text() + "'",
                        token, null);
            }
        }
    }

    private void checkClassNames() {
        for (SymbolEntry entry : declared(SymbolKind.CLASS)) {
            if (!PASCAL_CASE.matcher(entry.getName()).matches()) {
                context.report(Severity.INFO, "Class name '" + entry.getName() + "' should use PascalCase",
                        declarationToken(entry), null);
            }
        }
    }

    private void checkPythonNames() {
        for (SymbolEntry entry : context.symbols()) {
            if (entry.isBuiltin() || "module".equals(entry.getDataType())) {
                continue;
            }
            String name = entry.getName();
            if (entry.getKind() == SymbolKind.CLASS) {
                if (!PASCAL_CASE.matcher(name).matches()) {
                    context.report(Severity.INFO, "Class name '" + name + "' should use PascalCase",
                            declarationToken(entry), null);
                }
            } else if (entry.getKind() == SymbolKind.FUNCTION || entry.getKind() == SymbolKind.VARIABLE) {
                if (!SNAKE_CASE.matcher(name).matches() && !UPPER_CASE.matcher(name).matches()
                        && !DUNDER.matcher(name).matches()) {
                    String what = entry.getKind() == SymbolKind.FUNCTION ? "Function" : "Variable";
                    context.report(Severity.INFO, what + " name '" + name + "' should use snake_case",
                            declarationToken(entry), null);
                }
            }
        }
    }

    private void tagPointerTypes() {
        context.symbols().forEach(SymbolEntry::applyTypeSuffix);
    }

    private void checkMainFunction() {
        boolean hasMain = declared(SymbolKind.FUNCTION).stream().anyMatch(entry -> entry.getName().equals("main"));
        if (!hasMain) {
            context.report(Diagnostic.error(Phase.SEMANTIC, "C++ program must define a 'main' function", 1, 1, 0)
                    .withContext("A C++ program starts at int main()"));
        }
    }

    private void checkIncludes() {
        boolean includes = tokens.stream()
                .anyMatch(token -> token.kind() == TokenKind.PREPROCESSOR_DIRECTIVE
                        && INCLUDE.matcher(token.text()).matches());
        if (!includes) {
            context.report(Diagnostic.warning(Phase.SEMANTIC, "No #include directive found", 1, 1, 0));
        }
    }

    private void checkBlockBalance() {
        int opened = 0;
        int closed = 0;
        for (int i = 0; i < tokens.size(); i++) {
            if (profile.opensBlock(tokens, i)) {
                opened++;
            } else if (profile.closesBlock(tokens, i)) {
                closed++;
            }
        }
        if (opened != closed) {
            context.report(Diagnostic.error(Phase.SEMANTIC,
                    "Unbalanced blocks: " + opened + " BEGIN and " + closed + " END", 1, 1, 0));
        }
    }

    private void checkSqlVerb() {
        boolean found = tokens.stream()
                .anyMatch(token -> token.isKeyword() && SQL_VERBS.contains(profile.normalize(token.text())));
        if (!found) {
            context.report(Diagnostic.warning(Phase.SEMANTIC,
                    "No recognized SQL statement (SELECT, INSERT, UPDATE, DELETE, CREATE, ALTER, DROP) found",
                    1, 1, 0));
        }
    }

    private void checkCreateTable(ParseNode node) {
        if (!node.kind().equals("CreateTableStatement")) {
            node.children().forEach(this::checkCreateTable);
            return;
        }
        for (ParseNode part : node.children()) {
            if (!part.kind().equals("ColumnList")) {
                continue;
            }
            if (part.children().isEmpty()) {
                context.report(diagnosticAt(Severity.ERROR,
                        "Table '" + node.value() + "' has no column definitions", part));
            }
            for (ParseNode column : part.children()) {
                if (column.kind().equals("ColumnDefinition") && column.children().isEmpty()) {
                    context.report(diagnosticAt(Severity.ERROR,
                            "Column '" + column.value() + "' has no data type", column));
                }
            }
        }
    }

    private void checkDuplicateIds() {
        Map<String, ParseNode> seen = new HashMap<>();
        tree.forEach(node -> collectIds(node, seen));
    }

    private void collectIds(ParseNode node, Map<String, ParseNode> seen) {
        if (node.kind().equals("Attribute") && "id".equalsIgnoreCase(node.value()) && !node.children().isEmpty()) {
            String id = unquote(node.children().get(0).value());
            ParseNode first = seen.putIfAbsent(id, node);
            if (first != null) {
                context.report(diagnosticAt(Severity.WARNING, "Duplicate id '" + id + "'", node)
                        .withContext("First used at line " + first.line()));
            }
            return;
        }
        node.children().forEach(child -> collectIds(child, seen));
    }

    private Diagnostic diagnosticAt(Severity severity, String message, ParseNode node) {
        return new Diagnostic(Phase.SEMANTIC, message, node.line(), node.column(), offsetOf(node), severity, null);
    }

    private int offsetOf(ParseNode node) {
        for (Token token : tokens) {
            if (token.line() == node.line() && token.column() == node.column()) {
                return token.offset();
            }
        }
        return 0;
    }

    private List<SymbolEntry> declared(SymbolKind kind) {
        return context.symbols().stream()
                .filter(entry -> !entry.isBuiltin() && entry.getKind() == kind)
                .toList();
    }

    private Token declarationToken(SymbolEntry entry) {
        return tokens.get(entry.getDeclarationIndex());
    }

    private static String unquote(String value) {
        if (value == null) {
            return "";
        }
        String trimmed = value.trim();
        if (trimmed.length() >= 2 && (trimmed.startsWith("\"") || trimmed.startsWith("'"))) {
            trimmed = trimmed.substring(1, trimmed.length() - 1);
        }
        return trimmed;
    }
}
