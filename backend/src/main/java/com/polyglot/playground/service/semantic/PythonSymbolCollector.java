package com.polyglot.playground.service.semantic;

import com.polyglot.playground.dto.ParamInfo;
import com.polyglot.playground.dto.SymbolEntry;
import com.polyglot.playground.dto.SymbolKind;
import com.polyglot.playground.dto.Token;
import com.polyglot.playground.dto.TokenCategory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Declarations of Python. Function and class scopes follow indentation: a scope opened by a
 * {@code def} or {@code class} line closes at the first later line indented no deeper.
 */
final class PythonSymbolCollector extends SymbolCollector {

    private final Deque<Block> blocks = new ArrayDeque<>();
    private int bracketDepth;
    private boolean importing;

    private record Block(int indent) {
    }

    PythonSymbolCollector(SemanticContext context) {
        super(context);
    }

    @Override
    void collect() {
        for (int i = 0; i < tokens.size(); i++) {
            boolean lineStart = startsLine(i) && bracketDepth == 0;
            if (lineStart) {
                closeBlocks(tokens.get(i).column());
                importing = false;
            }
            context.recordScope(i);
            trackBrackets(i);
            if (context.isSite(i)) {
                continue;
            }
            boolean statementStart = lineStart || isAny(i - 1, ";")
                    || (is(i - 1, ":") && bracketDepth == 0 && !startsLine(i) && endsCompoundHeader(i - 1));
            visit(i, statementStart);
        }
    }

    private void trackBrackets(int index) {
        Token token = tokens.get(index);
        if (token.category() != TokenCategory.DELIMITER) {
            return;
        }
        if (isAny(index, "(", "[", "{")) {
            bracketDepth++;
        } else if (isAny(index, ")", "]", "}") && bracketDepth > 0) {
            bracketDepth--;
        }
    }

    private void closeBlocks(int column) {
        while (!blocks.isEmpty() && column <= blocks.peek().indent()) {
            blocks.pop();
            scopes.close();
        }
    }

    private void visit(int index, boolean statementStart) {
        Token token = tokens.get(index);
        if (token.isKeyword()) {
            switch (token.text()) {
                case "def" -> declareFunction(index);
                case "class" -> declareClass(index);
                case "for" -> declareLoopTargets(index);
                case "import" -> declareImports(index);
                case "from" -> markModule(index);
                case "as" -> {
                    if (!importing && isIdentifier(index + 1)) {
                        bind(index + 1, null);
                    }
                }
                case "global", "nonlocal" -> markNames(index);
                case "lambda" -> declareLambdaParameters(index);
                default -> {
                }
            }
            return;
        }
        if (token.isIdentifier()) {
            if (is(index + 1, ":=")) {
                bind(index, valueType(index + 2));
            } else if (statementStart) {
                declareAssignmentTargets(index);
            }
        }
    }

    private boolean endsCompoundHeader(int colon) {
        for (int i = colon - 1; i >= 0 && !startsLine(i + 1); i--) {
            if (isKeyword(i) && isAny(i, "if", "elif", "else", "while", "for", "with", "try", "except",
                    "finally", "def", "class")) {
                return true;
            }
        }
        return false;
    }

    private int lineIndent(int index) {
        int i = index;
        while (i > 0 && !startsLine(i)) {
            i--;
        }
        return tokens.get(i).column();
    }

    private void declareFunction(int index) {
        int name = index + 1;
        if (!isIdentifier(name)) {
            return;
        }
        SymbolEntry function = context.declare(name, SymbolKind.FUNCTION, "function", "def");
        function.markInitialized();
        int indent = lineIndent(index);
        scopes.open(tokens.get(name).text());
        blocks.push(new Block(indent));
        if (!is(name + 1, "(")) {
            return;
        }
        int close = matching(name + 1);
        if (close < 0) {
            return;
        }
        int depth = 0;
        for (int i = name + 1; i < close; i++) {
            if (isAny(i, "(", "[", "{")) {
                depth++;
            } else if (isAny(i, ")", "]", "}")) {
                depth--;
            } else if (depth == 1 && isIdentifier(i) && isAny(i - 1, "(", ",", "*", "**")) {
                SymbolEntry parameter = context.declare(i, SymbolKind.PARAMETER, annotation(i), "param");
                parameter.markInitialized();
                function.addParameter(new ParamInfo(parameter.getName(), parameter.getDataType()));
            } else if (depth == 1 && is(i, ":")) {
                i = markAnnotation(i + 1, close);
            }
        }
        if (is(close + 1, "->")) {
            function.setReturnType(at(close + 2) == null ? null : tokens.get(close + 2).text());
            markAnnotation(close + 2, tokens.size());
        }
    }

    private String annotation(int name) {
        return is(name + 1, ":") && at(name + 2) != null ? tokens.get(name + 2).text() : null;
    }

    /**
     * Type annotations name types, not bindings; they are left out of verification. Returns the
     * index of the last annotation token.
     */
    private int markAnnotation(int start, int limit) {
        int depth = 0;
        int i = start;
        for (; i < limit; i++) {
            if (depth == 0 && isAny(i, ",", "=", ":", ")")) {
                return i - 1;
            }
            if (isAny(i, "(", "[")) {
                depth++;
            } else if (isAny(i, ")", "]")) {
                depth--;
            } else if (isIdentifier(i)) {
                context.markSite(i);
            }
        }
        return i - 1;
    }

    private void declareClass(int index) {
        int name = index + 1;
        if (!isIdentifier(name)) {
            return;
        }
        context.declare(name, SymbolKind.CLASS, "class", "class").markInitialized();
        int indent = lineIndent(index);
        scopes.open(tokens.get(name).text());
        blocks.push(new Block(indent));
    }

    private void declareAssignmentTargets(int index) {
        List<Integer> targets = new ArrayList<>();
        int i = index;
        while (true) {
            while (isAny(i, "(", "[")) {
                i++;
            }
            if (!isIdentifier(i) || isAny(i + 1, ".", "[", "(")) {
                return;
            }
            targets.add(i);
            i++;
            while (isAny(i, ")", "]")) {
                i++;
            }
            if (!is(i, ",")) {
                break;
            }
            i++;
        }
        if (targets.size() == 1 && is(i, ":") && !is(i + 1, "=")) {
            // annotated: name: type [= value]
            markAnnotation(i + 1, tokens.size());
            bind(targets.get(0), at(i + 1) == null ? null : tokens.get(i + 1).text());
            return;
        }
        if (!is(i, "=")) {
            return;
        }
        String type = targets.size() == 1 ? singleValueType(i + 1) : null;
        for (int target : targets) {
            bind(target, type);
        }
        // chained: a = b = 0
        int next = i + 1;
        while (isIdentifier(next) && is(next + 1, "=")) {
            bind(next, null);
            next += 2;
        }
    }

    private String singleValueType(int value) {
        if (is(value, "[")) {
            return "list";
        }
        if (is(value, "{")) {
            return "dict";
        }
        Token after = at(value + 1);
        if (after == null || startsLine(value + 1) || is(value + 1, ";")) {
            return valueType(value);
        }
        return null;
    }

    /**
     * Binds a name in the active scope; rebinding an existing local only re-initializes it.
     */
    private void bind(int index, String dataType) {
        SymbolEntry entry = scopes.lookupLocal(scopes.current(), tokens.get(index).text())
                .filter(existing -> !existing.isBuiltin())
                .orElse(null);
        if (entry != null) {
            context.markSite(index);
        } else {
            entry = context.declare(index, SymbolKind.VARIABLE, dataType, "assign");
        }
        entry.markInitialized();
    }

    private void declareLoopTargets(int index) {
        for (int i = index + 1; i < tokens.size() && !is(i, "in"); i++) {
            if (isIdentifier(i) && !is(i - 1, ".")) {
                bind(i, null);
            } else if (!isAny(i, ",", "(", ")", "[", "]")) {
                return;
            }
        }
    }

    private void markModule(int index) {
        importing = true;
        for (int i = index + 1; i < tokens.size() && !is(i, "import") && !startsLine(i); i++) {
            if (isIdentifier(i)) {
                context.markSite(i);
            }
        }
    }

    private void declareImports(int index) {
        importing = true;
        boolean bound = false;
        int first = -1;
        for (int i = index + 1; i < tokens.size() && !startsLine(i) && !is(i, ";"); i++) {
            if (isAny(i, "(", ")")) {
                continue;
            }
            if (is(i, ",")) {
                bindImport(first, bound);
                first = -1;
                bound = false;
            } else if (is(i, "as")) {
                if (isIdentifier(i + 1)) {
                    bindImported(i + 1);
                    i++;
                    bound = true;
                }
            } else if (isIdentifier(i)) {
                if (first < 0 && !is(i - 1, ".")) {
                    first = i;
                } else {
                    context.markSite(i);
                }
            }
        }
        bindImport(first, bound);
    }

    private void bindImport(int first, boolean aliased) {
        if (first < 0) {
            return;
        }
        if (aliased) {
            context.markSite(first);
        } else {
            bindImported(first);
        }
    }

    private void bindImported(int index) {
        SymbolEntry module = scopes.lookupLocal(scopes.current(), tokens.get(index).text())
                .filter(existing -> !existing.isBuiltin())
                .orElse(null);
        if (module != null) {
            context.markSite(index);
            return;
        }
        module = context.declare(index, SymbolKind.VARIABLE, "module", "import");
        module.markInitialized();
        module.markUsed();
    }

    private void markNames(int index) {
        for (int i = index + 1; i < tokens.size() && !startsLine(i); i++) {
            if (isIdentifier(i)) {
                context.markSite(i);
            }
        }
    }

    private void declareLambdaParameters(int index) {
        for (int i = index + 1; i < tokens.size() && !is(i, ":"); i++) {
            if (isIdentifier(i) && isAny(i - 1, "lambda", ",", "*", "**")) {
                context.declare(i, SymbolKind.PARAMETER, null, "param").markInitialized();
            }
        }
    }
}
