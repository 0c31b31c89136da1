package com.polyglot.playground.service.semantic;

import com.polyglot.playground.dto.SymbolEntry;
import com.polyglot.playground.dto.SymbolKind;
import com.polyglot.playground.dto.Token;
import com.polyglot.playground.dto.TokenCategory;

final class JavaScriptSymbolCollector extends BraceSymbolCollector {

    private DeclarationList pending;

    /**
     * A {@code var/let/const} statement whose comma-separated names are still being read.
     */
    private record DeclarationList(String keyword, int parenDepth) {
    }

    JavaScriptSymbolCollector(SemanticContext context) {
        super(context);
    }

    @Override
    protected void visit(int index) {
        Token token = tokens.get(index);
        endDeclarationList(index);
        if (token.isKeyword()) {
            switch (token.text()) {
                case "var", "let", "const" -> {
                    pending = new DeclarationList(token.text(), parenDepth);
                    declareTarget(index + 1, token.text());
                }
                case "function" -> declareFunction(index);
                case "class" -> declareClass(index);
                case "for" -> openLoopHeader(index);
                case "catch" -> {
                    if (is(index + 1, "(")) {
                        openHeader(index + 1, "catch", null, true);
                    }
                }
                case "import" -> declareImports(index);
                default -> {
                }
            }
            return;
        }
        if (token.hasText(",") && pending != null && parenDepth == pending.parenDepth()) {
            declareTarget(index + 1, pending.keyword());
        } else if (token.hasText("=>")) {
            declareArrowParameters(index);
        } else if (token.isIdentifier() && !context.isSite(index)) {
            visitIdentifier(index);
        }
    }

    private void visitIdentifier(int index) {
        if (inHeaderParameters(index) && isAny(index - 1, "(", ",", "...", "{", "[", ":")) {
            if (is(index + 1, ":")) {
                context.markSite(index);
                return;
            }
            SymbolEntry parameter = context.declare(index, SymbolKind.PARAMETER, null, "param");
            parameter.markInitialized();
            if (atHeaderDepth()) {
                addParameter(parameter);
            }
        } else if (isMethodDefinition(index)) {
            SymbolEntry method = context.declare(index, SymbolKind.METHOD, "function", "function");
            method.markInitialized();
            openHeader(index + 1, tokens.get(index).text(), method, true);
        } else if (is(index + 1, ":") && (index == 0 || isAny(index - 1, "{", ",", ";", "}"))) {
            // object key or statement label
            context.markSite(index);
        } else if (isAny(index, "get", "set") && isIdentifier(index + 1) && is(index + 2, "(")) {
            context.markSite(index);
        }
    }

    private void endDeclarationList(int index) {
        if (pending == null) {
            return;
        }
        if (parenDepth < pending.parenDepth()
                || (is(index, ";") && parenDepth == pending.parenDepth())
                || (startsLine(index) && !is(index, ",") && !is(index - 1, ",")
                && parenDepth == pending.parenDepth() && tokens.get(index - 1).category() != TokenCategory.OPERATOR)) {
            pending = null;
        }
    }

    private void declareTarget(int index, String keyword) {
        if (isIdentifier(index)) {
            SymbolEntry entry = context.declare(index, SymbolKind.VARIABLE, initializerType(index), keyword);
            entry.setConstant(keyword.equals("const"));
            if (isAny(index + 1, "=", "of", "in")) {
                entry.markInitialized();
            }
        } else if (isAny(index, "{", "[")) {
            int close = matching(index);
            for (int i = index + 1; i < close; i++) {
                if (isIdentifier(i) && !is(i - 1, "=") && !is(i - 1, ".")) {
                    if (is(i + 1, ":")) {
                        context.markSite(i);
                    } else {
                        SymbolEntry entry = context.declare(i, SymbolKind.VARIABLE, null, keyword);
                        entry.setConstant(keyword.equals("const"));
                        entry.markInitialized();
                    }
                }
            }
        }
    }

    private String initializerType(int nameIndex) {
        if (!is(nameIndex + 1, "=")) {
            return null;
        }
        int value = nameIndex + 2;
        if (is(value, "[")) {
            return "array";
        }
        if (is(value, "{")) {
            return "object";
        }
        if (is(value, "async")) {
            value++;
        }
        if (is(value, "function") || startsArrowFunction(value)) {
            return "function";
        }
        if (is(value, "new") && isIdentifier(value + 1)) {
            return tokens.get(value + 1).text();
        }
        Token after = at(value + 1);
        if (after == null || isAny(value + 1, ";", ",", ")") || startsLine(value + 1)) {
            return valueType(value);
        }
        return null;
    }

    private boolean startsArrowFunction(int index) {
        if (isIdentifier(index)) {
            return is(index + 1, "=>");
        }
        int close = is(index, "(") ? matching(index) : -1;
        return close > 0 && is(close + 1, "=>");
    }

    private void declareFunction(int index) {
        int name = is(index + 1, "*") ? index + 2 : index + 1;
        SymbolEntry function = null;
        String scopeName = "anonymous";
        int paren = name;
        if (isIdentifier(name)) {
            function = context.declare(name, SymbolKind.FUNCTION, "function", "function");
            function.markInitialized();
            scopeName = tokens.get(name).text();
            paren = name + 1;
        }
        if (is(paren, "(")) {
            openHeader(paren, scopeName, function, true);
        }
    }

    private void declareClass(int index) {
        if (!isIdentifier(index + 1)) {
            return;
        }
        SymbolEntry type = context.declare(index + 1, SymbolKind.CLASS, "class", "class");
        type.markInitialized();
        for (int i = index + 2; i < tokens.size() && !is(i, ";"); i++) {
            if (is(i, "{")) {
                openClassScope(tokens.get(index + 1).text());
                adopt(i);
                return;
            }
        }
    }

    private boolean isMethodDefinition(int index) {
        if (!is(index + 1, "(")) {
            return false;
        }
        int close = matching(index + 1);
        if (close < 0 || !is(close + 1, "{")) {
            return false;
        }
        return index == 0 || isAny(index - 1, "{", "}", ";", ",", "static", "async", "get", "set", "*")
                || startsLine(index);
    }

    private void declareArrowParameters(int arrow) {
        int first;
        int last;
        if (isIdentifier(arrow - 1)) {
            first = arrow - 1;
            last = arrow - 1;
        } else if (is(arrow - 1, ")")) {
            first = openingParen(arrow - 1);
            last = arrow - 2;
            if (first < 0) {
                return;
            }
        } else {
            return;
        }
        if (is(arrow + 1, "{")) {
            scopes.open("arrow");
            adopt(arrow + 1);
        } else {
            openExpressionScope("arrow", expressionEnd(arrow + 1));
        }
        for (int i = first; i <= last; i++) {
            if (isIdentifier(i) && !is(i - 1, "=") && !is(i + 1, ":")) {
                context.declare(i, SymbolKind.PARAMETER, null, "param").markInitialized();
            }
        }
    }

    private int openingParen(int close) {
        int depth = 0;
        for (int i = close; i >= 0; i--) {
            if (is(i, ")")) {
                depth++;
            } else if (is(i, "(")) {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    private int expressionEnd(int start) {
        int depth = 0;
        for (int i = start; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            if (token.category() == TokenCategory.DELIMITER) {
                if (isAny(i, "(", "[", "{")) {
                    depth++;
                } else if (isAny(i, ")", "]", "}")) {
                    if (depth == 0) {
                        return i;
                    }
                    depth--;
                } else if (depth == 0 && isAny(i, ",", ";")) {
                    return i;
                }
            }
            if (i > start && depth == 0 && startsLine(i)
                    && tokens.get(i - 1).category() != TokenCategory.OPERATOR) {
                return i;
            }
        }
        return tokens.size();
    }

    private void declareImports(int index) {
        for (int i = index + 1; i < tokens.size() && !is(i, ";"); i++) {
            Token token = tokens.get(i);
            if (token.category() == TokenCategory.STRING) {
                return;
            }
            if (!token.isIdentifier()) {
                continue;
            }
            if (token.hasText("from") && at(i + 1) != null && at(i + 1).category() == TokenCategory.STRING) {
                context.markSite(i);
                return;
            }
            if (token.hasText("as") || is(i + 1, "as")) {
                context.markSite(i);
            } else {
                SymbolEntry binding = context.declare(i, SymbolKind.VARIABLE, "module", "import");
                binding.markInitialized();
                binding.markUsed();
            }
        }
    }
}
