package com.polyglot.playground.service.semantic;

import com.polyglot.playground.dto.ParamInfo;
import com.polyglot.playground.dto.SymbolEntry;
import com.polyglot.playground.dto.SymbolKind;
import com.polyglot.playground.dto.Token;
import com.polyglot.playground.dto.TokenCategory;

import java.util.ArrayList;
import java.util.List;

final class PascalSymbolCollector extends KeywordBlockCollector {

    private enum Section {
        NONE, VAR, CONST, TYPE, NAMES
    }

    private Section section = Section.NONE;

    PascalSymbolCollector(SemanticContext context) {
        super(context);
    }

    @Override
    protected void visit(int index) {
        Token token = tokens.get(index);
        if (token.isKeyword()) {
            switch (word(index)) {
                case "program", "unit" -> {
                    if (isIdentifier(index + 1)) {
                        context.markSite(index + 1);
                    }
                }
                case "uses", "label" -> section = Section.NAMES;
                case "var" -> section = Section.VAR;
                case "const" -> section = Section.CONST;
                case "type" -> section = Section.TYPE;
                case "begin" -> section = Section.NONE;
                case "procedure", "function" -> {
                    section = Section.NONE;
                    declareRoutine(index);
                }
                case "record" -> markRecordFields(index);
                default -> {
                }
            }
            return;
        }
        if (!token.isIdentifier() || section == Section.NONE) {
            return;
        }
        if (section == Section.NAMES) {
            context.markSite(index);
            return;
        }
        if (!isAny(index - 1, ";", "var", "const", "type")) {
            return;
        }
        switch (section) {
            case VAR -> declareVariables(index);
            case CONST -> declareConstant(index);
            case TYPE -> declareType(index);
            default -> {
            }
        }
    }

    private void declareVariables(int index) {
        List<Integer> names = new ArrayList<>();
        int i = index;
        while (isIdentifier(i)) {
            names.add(i);
            if (!is(i + 1, ",")) {
                break;
            }
            i += 2;
        }
        if (!is(i + 1, ":")) {
            return;
        }
        int typeStart = i + 2;
        String type = typeName(typeStart);
        int end = statementEnd(typeStart);
        boolean initialized = find(typeStart, end, "=") >= 0;
        for (int name : names) {
            SymbolEntry variable = context.declare(name, SymbolKind.VARIABLE, type, "var");
            if (initialized) {
                variable.markInitialized();
            }
        }
    }

    private void declareConstant(int index) {
        String type = null;
        int value;
        if (is(index + 1, ":")) {
            type = typeName(index + 2);
            value = find(index + 2, statementEnd(index + 2), "=") + 1;
        } else if (is(index + 1, "=")) {
            value = index + 2;
        } else {
            return;
        }
        if (type == null && value > 0 && is(value + 1, ";")) {
            type = valueType(value);
        }
        SymbolEntry constant = context.declare(index, SymbolKind.CONSTANT, type, "const");
        constant.setConstant(true);
        constant.markInitialized();
    }

    private void declareType(int index) {
        if (!is(index + 1, "=")) {
            return;
        }
        context.declare(index, SymbolKind.CLASS, "type", "type").markInitialized();
        if (is(index + 2, "(")) {
            int close = matching(index + 2);
            for (int i = index + 3; i < close; i++) {
                if (isIdentifier(i)) {
                    SymbolEntry value = context.declare(i, SymbolKind.CONSTANT, tokens.get(index).text(), "const");
                    value.setConstant(true);
                    value.markInitialized();
                }
            }
        }
    }

    private void declareRoutine(int index) {
        int name = index + 1;
        if (!isIdentifier(name)) {
            return;
        }
        boolean function = is(index, "function");
        int header = name + 1;
        if (is(header, ".") && isIdentifier(header + 1)) {
            // TClass.Method: the class part is a type reference
            name = header + 1;
            header = name + 1;
        }
        SymbolEntry routine = context.declare(name, SymbolKind.FUNCTION, "function", "routine");
        routine.markInitialized();
        routine.setReturnType(function ? null : "void");
        openRoutine(tokens.get(name).text());
        int after = header;
        if (is(header, "(")) {
            int close = matching(header);
            if (close > 0) {
                declareParameters(header + 1, close, routine);
                after = close + 1;
            }
        }
        if (function && is(after, ":")) {
            routine.setReturnType(typeName(after + 1));
        }
        int end = statementEnd(after);
        if (isAny(end + 1, "forward", "external")) {
            abandonRoutine();
        }
    }

    private void declareParameters(int start, int close, SymbolEntry routine) {
        List<Integer> names = new ArrayList<>();
        for (int i = start; i < close; i++) {
            if (isKeyword(i) || (isIdentifier(i) && is(i - 1, ":"))) {
                // modifiers and type names
                context.markSite(i);
            } else if (is(i, ":")) {
                String type = typeName(i + 1);
                for (int name : names) {
                    SymbolEntry parameter = context.declare(name, SymbolKind.PARAMETER, type, "param");
                    parameter.markInitialized();
                    routine.addParameter(new ParamInfo(parameter.getName(), type));
                }
                names.clear();
                while (i + 1 < close && !is(i + 1, ";")) {
                    i++;
                }
            } else if (isIdentifier(i)) {
                names.add(i);
            }
        }
    }

    private void markRecordFields(int index) {
        int depth = 0;
        for (int i = index; i < tokens.size(); i++) {
            if (profile.opensBlock(tokens, i)) {
                depth++;
            } else if (profile.closesBlock(tokens, i)) {
                depth--;
                if (depth == 0) {
                    return;
                }
            } else if (isIdentifier(i) && isAny(i + 1, ":", ",") && isAny(i - 1, "record", ";", ",")) {
                context.markSite(i);
            }
        }
    }

    private String typeName(int index) {
        Token token = at(index);
        if (token == null) {
            return null;
        }
        if (is(index, "^")) {
            return "pointer";
        }
        if (is(index, "(")) {
            return "enum";
        }
        if (token.category() == TokenCategory.NUMBER) {
            return "integer";
        }
        if (is(index, "packed")) {
            return typeName(index + 1);
        }
        return profile.normalize(token.text());
    }

    private int statementEnd(int start) {
        int depth = 0;
        for (int i = start; i < tokens.size(); i++) {
            if (isAny(i, "(", "[")) {
                depth++;
            } else if (isAny(i, ")", "]")) {
                depth--;
            } else if (depth <= 0 && is(i, ";")) {
                return i;
            }
        }
        return tokens.size();
    }
}
