package com.polyglot.playground.service.semantic;

import com.polyglot.playground.dto.ParamInfo;
import com.polyglot.playground.dto.SymbolEntry;
import com.polyglot.playground.dto.SymbolKind;
import com.polyglot.playground.dto.Token;
import com.polyglot.playground.dto.TokenCategory;

import java.util.Optional;

final class PlSqlSymbolCollector extends KeywordBlockCollector {

    private boolean declaring;

    PlSqlSymbolCollector(SemanticContext context) {
        super(context);
    }

    @Override
    protected void visit(int index) {
        Token token = tokens.get(index);
        if (token.isKeyword()) {
            switch (word(index)) {
                case "declare" -> {
                    openRoutine("block");
                    declaring = true;
                }
                case "begin" -> declaring = false;
                case "procedure", "function" -> declareRoutine(index);
                case "package" -> openPackage(index);
                case "type", "subtype" -> {
                    if (declaring && isIdentifier(index + 1)) {
                        context.declare(index + 1, SymbolKind.CLASS, "type", "type").markInitialized();
                    }
                }
                case "cursor" -> {
                    if (declaring && isIdentifier(index + 1)) {
                        SymbolEntry cursor = context.declare(index + 1, SymbolKind.VARIABLE, "cursor", "cursor");
                        cursor.markInitialized();
                        markCursorParameters(index + 2);
                    }
                }
                case "for" -> {
                    if (isIdentifier(index + 1) && is(index + 2, "in")) {
                        bindLoopVariable(index + 1);
                    }
                }
                default -> {
                }
            }
            return;
        }
        if (token.isIdentifier() && declaring && isAny(index - 1, ";", "declare", "is", "as")) {
            declareVariable(index);
        }
    }

    private void declareVariable(int index) {
        int end = find(index, tokens.size(), ";");
        int limit = end < 0 ? tokens.size() : end;
        int typeIndex = index + 1;
        boolean constant = false;
        if (is(typeIndex, "constant")) {
            constant = true;
            typeIndex++;
        }
        String type = word(typeIndex);
        for (int i = typeIndex; i < limit; i++) {
            if (is(i, "%") && isAny(i + 1, "type", "rowtype")) {
                type = "any";
            }
        }
        SymbolEntry variable = context.declare(index, SymbolKind.VARIABLE, type, "var");
        variable.setConstant(constant);
        if (type.equals("exception") || find(typeIndex, limit, ":=") >= 0 || find(typeIndex, limit, "default") >= 0) {
            variable.markInitialized();
        }
    }

    private void declareRoutine(int index) {
        int name = index + 1;
        if (!isIdentifier(name)) {
            return;
        }
        if (is(name + 1, ".") && isIdentifier(name + 2)) {
            context.markSite(name);
            name += 2;
        }
        boolean function = is(index, "function");
        SymbolEntry routine = declareCallable(name);
        openRoutine(tokens.get(name).text());
        int after = name + 1;
        if (is(after, "(")) {
            int close = matching(after);
            if (close > 0) {
                declareParameters(after + 1, close, routine);
                after = close + 1;
            }
        }
        if (function && is(after, "return")) {
            routine.setReturnType(word(after + 1));
        } else if (!function) {
            routine.setReturnType("void");
        }
        for (int i = after; i < tokens.size(); i++) {
            if (is(i, ";")) {
                // specification only
                abandonRoutine();
                return;
            }
            if (isAny(i, "is", "as")) {
                declaring = true;
                return;
            }
        }
    }

    /**
     * A package specification and its body declare the same routines once.
     */
    private SymbolEntry declareCallable(int name) {
        Optional<SymbolEntry> existing = scopes.lookupLocal(scopes.current(), tokens.get(name).text())
                .filter(entry -> entry.getKind().isCallable() && !entry.isBuiltin());
        if (existing.isPresent()) {
            context.markSite(name);
            return existing.get();
        }
        SymbolEntry routine = context.declare(name, SymbolKind.FUNCTION, "function", "routine");
        routine.markInitialized();
        return routine;
    }

    private void declareParameters(int start, int close, SymbolEntry routine) {
        boolean collecting = routine.getParameters().isEmpty();
        boolean expectName = true;
        int depth = 0;
        for (int i = start; i < close; i++) {
            if (is(i, "(")) {
                depth++;
            } else if (is(i, ")")) {
                depth--;
            } else if (depth == 0 && is(i, ",")) {
                expectName = true;
            } else if (expectName && isIdentifier(i)) {
                int typeIndex = i + 1;
                while (isAny(typeIndex, "in", "out", "nocopy")) {
                    typeIndex++;
                }
                String type = word(typeIndex);
                SymbolEntry parameter = context.declare(i, SymbolKind.PARAMETER, type, "param");
                parameter.markInitialized();
                if (collecting) {
                    routine.addParameter(new ParamInfo(parameter.getName(), type));
                }
                expectName = false;
            } else if (isIdentifier(i)) {
                context.markSite(i);
            }
        }
    }

    private void openPackage(int index) {
        int name = is(index + 1, "body") ? index + 2 : index + 1;
        if (!isIdentifier(name)) {
            return;
        }
        context.markSite(name);
        openRoutine(tokens.get(name).text());
        declaring = true;
    }

    private void markCursorParameters(int open) {
        if (!is(open, "(")) {
            return;
        }
        int close = matching(open);
        for (int i = open + 1; i < close; i++) {
            if (isIdentifier(i)) {
                context.markSite(i);
            }
        }
    }

    private void bindLoopVariable(int index) {
        Optional<SymbolEntry> existing = scopes.lookupLocal(scopes.current(), tokens.get(index).text());
        if (existing.isPresent()) {
            context.markSite(index);
            existing.get().markInitialized();
            return;
        }
        int start = is(index + 2, "reverse") ? index + 3 : index + 2;
        boolean numeric = is(start + 1, "..")
                || (at(start) != null && at(start).category() == TokenCategory.NUMBER);
        String type = numeric ? "number" : "record";
        SymbolEntry variable = context.declare(index, SymbolKind.VARIABLE, type, "loop");
        variable.markInitialized();
        variable.markUsed();
    }
}
