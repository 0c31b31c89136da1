package com.polyglot.playground.service.semantic;

import com.polyglot.playground.dto.ParamInfo;
import com.polyglot.playground.dto.SymbolEntry;
import com.polyglot.playground.dto.SymbolKind;
import com.polyglot.playground.dto.Token;

/**
 * Declarations of Transact-SQL: {@code DECLARE @var} lists and procedure or function parameters.
 * Local variables live as long as their batch, so each batch between {@code GO} separators gets
 * a scope of its own.
 */
final class TSqlSymbolCollector extends KeywordBlockCollector {

    TSqlSymbolCollector(SemanticContext context) {
        super(context);
    }

    @Override
    void collect() {
        scopes.open("batch");
        super.collect();
    }

    @Override
    protected void visit(int index) {
        Token token = tokens.get(index);
        if (!token.isKeyword()) {
            return;
        }
        switch (word(index)) {
            case "declare" -> declareVariables(index);
            case "procedure", "proc", "function" -> {
                if (isAny(index - 1, "create", "alter")) {
                    declareRoutine(index);
                }
            }
            case "go" -> {
                closeAllRoutines();
                scopes.close();
                scopes.open("batch");
            }
            default -> {
            }
        }
    }

    private void declareVariables(int index) {
        int i = index + 1;
        while (isIdentifier(i)) {
            int name = i;
            int typeIndex = is(name + 1, "as") ? name + 2 : name + 1;
            String type = word(typeIndex);
            boolean initialized = isAny(typeIndex, "cursor", "table");
            boolean more = false;
            int depth = 0;
            for (i = typeIndex; i < tokens.size(); i++) {
                if (is(i, "(")) {
                    depth++;
                } else if (is(i, ")")) {
                    depth--;
                } else if (depth == 0 && is(i, ",")) {
                    more = true;
                    break;
                } else if (depth == 0 && is(i, "=")) {
                    initialized = true;
                } else if (depth == 0 && (is(i, ";") || (i > typeIndex && startsStatement(i)))) {
                    break;
                }
            }
            SymbolEntry variable = context.declare(name, SymbolKind.VARIABLE, type, "declare");
            if (initialized) {
                variable.markInitialized();
            }
            if (!more) {
                return;
            }
            i++;
        }
    }

    private boolean startsStatement(int index) {
        return startsLine(index) && isKeyword(index) && profile.statementKeywords().contains(word(index));
    }

    private void declareRoutine(int index) {
        int name = index + 1;
        if (is(name + 1, ".") && isIdentifier(name + 2)) {
            context.markSite(name);
            name += 2;
        }
        if (!isIdentifier(name)) {
            return;
        }
        boolean function = is(index, "function");
        SymbolEntry routine = context.declare(name, SymbolKind.FUNCTION, "function", "routine");
        routine.markInitialized();
        routine.setReturnType(function ? null : "int");
        openRoutine(tokens.get(name).text());
        int depth = 0;
        for (int i = name + 1; i < tokens.size() && !(depth == 0 && is(i, "as")); i++) {
            if (is(i, "(")) {
                depth++;
            } else if (is(i, ")")) {
                depth--;
            } else if (is(i, "returns")) {
                routine.setReturnType(word(i + 1));
            } else if (isIdentifier(i) && tokens.get(i).text().startsWith("@")
                    && (i == name + 1 || isAny(i - 1, "(", ","))) {
                int typeIndex = is(i + 1, "as") ? i + 2 : i + 1;
                String type = word(typeIndex);
                SymbolEntry parameter = context.declare(i, SymbolKind.PARAMETER, type, "param");
                parameter.markInitialized();
                routine.addParameter(new ParamInfo(parameter.getName(), type));
            }
        }
    }
}
