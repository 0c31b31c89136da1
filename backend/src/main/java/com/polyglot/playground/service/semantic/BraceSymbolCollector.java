package com.polyglot.playground.service.semantic;

import com.polyglot.playground.dto.ParamInfo;
import com.polyglot.playground.dto.SymbolEntry;
import com.polyglot.playground.dto.Token;
import com.polyglot.playground.dto.TokenCategory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;

/**
 * Scope bookkeeping shared by the curly-brace languages. Every brace block opens a scope,
 * except a brace that was reserved for a scope opened earlier at a function name, a loop header
 * or a class head; that brace takes the scope over and closes it.
 */
abstract class BraceSymbolCollector extends SymbolCollector {

    private final Deque<Boolean> braces = new ArrayDeque<>();
    private final Deque<Header> headers = new ArrayDeque<>();
    private final Deque<Integer> expressionScopeEnds = new ArrayDeque<>();
    private final Map<Integer, String> classScopes = new HashMap<>();
    private int adoptingBrace = -1;
    private int plainBrace = -1;
    protected int parenDepth;

    /**
     * A scope opened before a parenthesized header whose closing parenthesis decides whether a
     * body brace follows.
     */
    private record Header(int close, int depth, SymbolEntry owner, boolean parameters) {
    }

    BraceSymbolCollector(SemanticContext context) {
        super(context);
    }

    @Override
    void collect() {
        for (int i = 0; i < tokens.size(); i++) {
            while (!expressionScopeEnds.isEmpty() && expressionScopeEnds.peek() == i) {
                expressionScopeEnds.pop();
                scopes.close();
            }
            context.recordScope(i);
            Token token = tokens.get(i);
            if (token.category() == TokenCategory.DELIMITER) {
                switch (token.text()) {
                    case "{" -> openBrace(i);
                    case "}" -> closeBrace();
                    case "(" -> parenDepth++;
                    case ")" -> {
                        parenDepth--;
                        closeHeader(i);
                    }
                    default -> {
                    }
                }
            }
            visit(i);
        }
    }

    /**
     * Language-specific declaration recognition for the token at {@code index}, called after the
     * token's scope has been recorded.
     */
    protected abstract void visit(int index);

    /**
     * Index of the body brace following a header closed at {@code closeIndex}, or -1 for a
     * header without body such as a prototype.
     */
    protected int bodyBrace(int closeIndex) {
        return is(closeIndex + 1, "{") ? closeIndex + 1 : -1;
    }

    protected boolean openHeader(int parenIndex, String name, SymbolEntry owner, boolean parameters) {
        return openHeader(parenIndex, name, owner, parameters, scopes.current());
    }

    /**
     * Opens the scope of a function, loop or handler before its parenthesized header is read, so
     * parameters land in it.
     */
    protected boolean openHeader(int parenIndex, String name, SymbolEntry owner, boolean parameters, int parent) {
        int close = matching(parenIndex);
        if (close < 0) {
            return false;
        }
        scopes.openChild(name, parent);
        // a prototype already listed the parameters
        SymbolEntry collecting = owner != null && owner.getParameters().isEmpty() ? owner : null;
        headers.push(new Header(close, parenDepth + 1, collecting, parameters));
        return true;
    }

    /**
     * Gives a {@code for} loop its own scope so that a variable declared in the header stays
     * local. An unbraced body keeps the scope until the end of its single statement.
     */
    protected void openLoopHeader(int index) {
        if (!is(index + 1, "(")) {
            return;
        }
        int close = matching(index + 1);
        if (close < 0) {
            return;
        }
        if (bodyBrace(close) >= 0) {
            openHeader(index + 1, "for", null, false);
        } else {
            openExpressionScope("for", statementEnd(close + 1));
        }
    }

    private int statementEnd(int start) {
        int depth = 0;
        for (int i = start; i < tokens.size(); i++) {
            if (isAny(i, "(", "[", "{")) {
                depth++;
            } else if (isAny(i, ")", "]", "}")) {
                depth--;
                if (depth < 0) {
                    return i;
                }
                if (depth == 0 && is(i, "}") && !is(i + 1, "else")) {
                    return i + 1;
                }
            } else if (depth == 0 && is(i, ";") && !is(i + 1, "else")) {
                return i + 1;
            }
        }
        return tokens.size();
    }

    protected boolean inHeaderParameters(int index) {
        Header header = headers.peek();
        return header != null && header.parameters() && index < header.close();
    }

    protected boolean atHeaderDepth() {
        Header header = headers.peek();
        return header != null && parenDepth == header.depth();
    }

    protected void addParameter(SymbolEntry parameter) {
        Header header = headers.peek();
        if (header != null && header.owner() != null) {
            header.owner().addParameter(new ParamInfo(parameter.getName(), parameter.getDataType()));
        }
    }

    /**
     * Reserves the brace at {@code braceIndex} for the active scope: it opens nothing and its
     * matching brace closes that scope.
     */
    protected void adopt(int braceIndex) {
        adoptingBrace = braceIndex;
    }

    /**
     * The brace at {@code braceIndex} delimits a list, not a block, and opens no scope.
     */
    protected void plainBrace(int braceIndex) {
        plainBrace = braceIndex;
    }

    protected int openClassScope(String name) {
        int scope = scopes.open(name);
        classScopes.put(scope, name);
        return scope;
    }

    protected boolean inClassScope() {
        return classScopes.containsKey(scopes.current());
    }

    protected String currentClassName() {
        return classScopes.get(scopes.current());
    }

    protected int classScopeOf(String name) {
        for (Map.Entry<Integer, String> entry : classScopes.entrySet()) {
            if (profile.normalize(entry.getValue()).equals(profile.normalize(name))) {
                return entry.getKey();
            }
        }
        return -1;
    }

    /**
     * Opens a scope for an expression-bodied function that closes when the token at
     * {@code endIndex} is reached.
     */
    protected int openExpressionScope(String name, int endIndex) {
        int scope = scopes.open(name);
        expressionScopeEnds.push(endIndex);
        return scope;
    }

    private void openBrace(int index) {
        if (index == adoptingBrace) {
            braces.push(true);
            adoptingBrace = -1;
        } else if (index == plainBrace) {
            braces.push(false);
            plainBrace = -1;
        } else {
            scopes.open("block");
            braces.push(true);
        }
    }

    private void closeBrace() {
        if (!braces.isEmpty() && braces.pop()) {
            scopes.close();
        }
    }

    private void closeHeader(int index) {
        Header header = headers.peek();
        if (header == null || header.close() != index) {
            return;
        }
        headers.pop();
        int brace = bodyBrace(index);
        if (brace >= 0) {
            adopt(brace);
        } else {
            scopes.close();
        }
    }
}
