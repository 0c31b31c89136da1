package com.polyglot.playground.service.semantic;

import com.polyglot.playground.dto.SymbolEntry;
import com.polyglot.playground.dto.SymbolKind;
import com.polyglot.playground.dto.Token;
import com.polyglot.playground.dto.TokenKind;

import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Declarations of C++. A declaration is a type-shaped run (qualifiers, a built-in or known type,
 * template arguments, pointer and reference markers) followed by a name at the start of a
 * statement or parameter.
 */
final class CppSymbolCollector extends BraceSymbolCollector {

    private static final Set<String> PRIMITIVES = Set.of(
            "int", "float", "double", "char", "bool", "void", "long", "short", "unsigned", "signed",
            "auto", "string", "wchar_t");

    private static final Set<String> QUALIFIERS = Set.of(
            "const", "constexpr", "static", "inline", "virtual", "extern", "mutable", "volatile",
            "register", "explicit", "friend", "typename", "struct", "class", "union");

    private static final Pattern DEFINE = Pattern.compile("#\\s*define\\s+([A-Za-z_]\\w*)");

    private static final Set<String> MEMBER_PREFIXES = Set.of("explicit", "virtual", "inline", "constexpr");

    private DeclarationList pending;
    private int templateClose = -1;

    private record TypeSpan(int end, String text, String suffix, boolean constant, boolean primitive,
                            int chainStart, int chainEnd) {

        String fullText() {
            return text + suffix;
        }
    }

    private record DeclarationList(TypeSpan type, int parenDepth) {
    }

    CppSymbolCollector(SemanticContext context) {
        super(context);
    }

    @Override
    protected void visit(int index) {
        Token token = tokens.get(index);
        if (token.kind() == TokenKind.PREPROCESSOR_DIRECTIVE) {
            declareMacro(index);
            return;
        }
        if (context.isSite(index)) {
            return;
        }
        if (is(index, ";")) {
            if (pending != null && parenDepth <= pending.parenDepth()) {
                pending = null;
            }
            return;
        }
        if (is(index, ",")) {
            continueDeclarationList(index);
            return;
        }
        if (token.isKeyword()) {
            switch (word(index)) {
                case "class", "struct", "union" -> {
                    if (declareClass(index)) {
                        return;
                    }
                }
                case "enum" -> {
                    declareEnum(index);
                    return;
                }
                case "namespace" -> {
                    openNamespace(index);
                    return;
                }
                case "typedef" -> {
                    declareTypedef(index);
                    return;
                }
                case "using" -> {
                    declareAlias(index);
                    return;
                }
                case "template" -> {
                    declareTemplateParameters(index);
                    return;
                }
                case "for" -> {
                    openLoopHeader(index);
                    return;
                }
                case "catch" -> {
                    if (is(index + 1, "(")) {
                        openHeader(index + 1, "catch", null, true);
                    }
                    return;
                }
                default -> {
                }
            }
        }
        if (is(index, "~") && isIdentifier(index + 1) && isConstructorName(index + 1)) {
            context.markSite(index + 1);
            openHeader(index + 2, "~" + tokens.get(index + 1).text(), null, true);
            return;
        }
        if (isIdentifier(index) && isConstructorName(index)
                && (atDeclarationStart(index) || (at(index - 1) != null && MEMBER_PREFIXES.contains(word(index - 1))))) {
            declareConstructor(index);
            return;
        }
        if (atDeclarationStart(index)) {
            tryDeclaration(index);
        }
    }

    @Override
    protected int bodyBrace(int close) {
        int i = close + 1;
        while (isAny(i, "const", "noexcept", "override", "final", "volatile", "&", "&&")) {
            i++;
        }
        if (is(i, "->")) {
            while (at(i) != null && !isAny(i, "{", ";", "=")) {
                i++;
            }
        }
        if (is(i, ":")) {
            // constructor initializer list
            for (int k = i + 1; k < tokens.size() && !is(k, ";"); k++) {
                if (is(k, "{") && isAny(k - 1, ")", "}")) {
                    return k;
                }
                if (isAny(k, "(", "{")) {
                    k = matching(k);
                    if (k < 0) {
                        return -1;
                    }
                }
            }
            return -1;
        }
        return is(i, "{") ? i : -1;
    }

    private boolean atDeclarationStart(int index) {
        if (index == 0 || index - 1 == templateClose) {
            return true;
        }
        Token previous = tokens.get(index - 1);
        return previous.kind() == TokenKind.PREPROCESSOR_DIRECTIVE
                || isAny(index - 1, ";", "{", "}", "(", ",", ":")
                || isAny(index - 1, "else", "do");
    }

    private void tryDeclaration(int index) {
        TypeSpan type = parseType(index);
        if (type == null) {
            return;
        }
        int name = type.end();
        if (is(name, "(") && type.chainEnd() > type.chainStart() && isConstructorChain(type)) {
            defineOutOfClass(type.chainStart(), type.chainEnd(), name, null);
            return;
        }
        if (!isIdentifier(name) || context.isSite(name)) {
            return;
        }
        if (is(name + 1, "::") && isIdentifier(name + 2) && is(name + 3, "(")) {
            defineOutOfClass(name, name + 2, name + 3, type);
            return;
        }
        if (is(name + 1, "(")) {
            declareFunctionOrObject(name, type);
            return;
        }
        if (!isAny(name + 1, "=", ";", ",", "[", "{", ":", ")")) {
            return;
        }
        declareVariable(name, type);
        if (!inHeaderParameters(name)) {
            pending = new DeclarationList(type, parenDepth);
        }
    }

    private TypeSpan parseType(int index) {
        int i = index;
        boolean leadingConst = false;
        while (isKeyword(i) && QUALIFIERS.contains(word(i))) {
            leadingConst |= word(i).equals("const") || word(i).equals("constexpr");
            i++;
        }
        StringBuilder text = new StringBuilder();
        boolean primitive = false;
        int chainStart = -1;
        int chainEnd = -1;
        if (isKeyword(i) && PRIMITIVES.contains(word(i))) {
            while (isKeyword(i) && PRIMITIVES.contains(word(i))) {
                if (text.length() > 0) {
                    text.append(' ');
                }
                text.append(word(i));
                i++;
            }
            primitive = !text.toString().equals("string");
        } else if (isIdentifier(i) && (is(i + 1, "::") || namesType(i))) {
            chainStart = i;
            text.append(tokens.get(i).text());
            i++;
            while (is(i, "::") && (isIdentifier(i + 1) || (is(i + 1, "~") && isIdentifier(i + 2)))) {
                text.append("::");
                if (is(i + 1, "~")) {
                    text.append('~');
                    i++;
                }
                text.append(tokens.get(i + 1).text());
                i += 2;
            }
            chainEnd = i - 1;
        } else {
            return null;
        }
        if (is(i, "<")) {
            int close = closingAngle(i);
            if (close < 0) {
                return null;
            }
            for (int k = i; k <= close; k++) {
                text.append(tokens.get(k).text());
            }
            i = close + 1;
            while (is(i, "::") && isIdentifier(i + 1)) {
                text.append("::").append(tokens.get(i + 1).text());
                i += 2;
            }
        }
        StringBuilder suffix = new StringBuilder();
        boolean trailingConst = false;
        while (isAny(i, "*", "&", "&&", "const")) {
            if (is(i, "const")) {
                trailingConst = true;
            } else {
                suffix.append(tokens.get(i).text());
                trailingConst = false;
            }
            i++;
        }
        boolean constant = suffix.length() == 0 ? leadingConst || trailingConst : trailingConst;
        return new TypeSpan(i, text.toString(), suffix.toString(), constant, primitive, chainStart, chainEnd);
    }

    private boolean namesType(int index) {
        return scopes.resolve(scopes.current(), tokens.get(index).text())
                .map(entry -> entry.getKind() == SymbolKind.CLASS)
                .orElse(false);
    }

    private int closingAngle(int open) {
        int depth = 0;
        for (int i = open; i < tokens.size() && i < open + 64; i++) {
            if (is(i, "<")) {
                depth++;
            } else if (is(i, ">")) {
                depth--;
            } else if (is(i, ">>")) {
                depth -= 2;
            } else if (isAny(i, ";", "{", "}")) {
                return -1;
            }
            if (depth <= 0) {
                return i;
            }
        }
        return -1;
    }

    private boolean isConstructorChain(TypeSpan type) {
        String owner = tokens.get(type.chainStart()).text();
        return tokens.get(type.chainEnd()).hasText(owner) && scopes.current() == ScopeTree.GLOBAL;
    }

    private boolean isConstructorName(int index) {
        return inClassScope() && tokens.get(index).hasText(currentClassName()) && is(index + 1, "(");
    }

    private void declareConstructor(int index) {
        SymbolEntry constructor = declareCallable(index, SymbolKind.METHOD);
        openHeader(index + 1, tokens.get(index).text(), constructor, true);
    }

    /**
     * {@code Owner::name(...)} outside its class. The body scope hangs under the class scope so
     * members resolve without qualification.
     */
    private void defineOutOfClass(int ownerIndex, int nameIndex, int paren, TypeSpan returnType) {
        String owner = tokens.get(ownerIndex).text();
        String name = tokens.get(nameIndex).text();
        int classScope = classScopeOf(owner);
        SymbolEntry method = null;
        if (classScope >= 0) {
            method = scopes.lookupLocal(classScope, name)
                    .filter(entry -> entry.getKind().isCallable())
                    .orElse(null);
            if (method == null && !is(nameIndex - 1, "~")) {
                method = context.declareIn(classScope, nameIndex, SymbolKind.METHOD, "function", null);
                method.markInitialized();
            }
        }
        context.markSite(nameIndex);
        if (method != null && returnType != null) {
            method.setReturnType(returnType.fullText());
        }
        openHeader(paren, owner + "::" + name, method, true, classScope >= 0 ? classScope : scopes.current());
    }

    private void declareFunctionOrObject(int name, TypeSpan type) {
        boolean functionLevel = scopes.current() == ScopeTree.GLOBAL || inClassScope();
        if (!functionLevel) {
            // Type object(arguments);
            declareVariable(name, type).markInitialized();
            return;
        }
        SymbolEntry function = declareCallable(name, inClassScope() ? SymbolKind.METHOD : SymbolKind.FUNCTION);
        function.setReturnType(type.fullText());
        openHeader(name + 1, tokens.get(name).text(), function, true);
    }

    /**
     * A prototype and its definition, or overloads, share one entry.
     */
    private SymbolEntry declareCallable(int name, SymbolKind kind) {
        Optional<SymbolEntry> existing = scopes.lookupLocal(scopes.current(), tokens.get(name).text())
                .filter(entry -> entry.getKind().isCallable() && !entry.isBuiltin());
        if (existing.isPresent()) {
            context.markSite(name);
            return existing.get();
        }
        SymbolEntry function = context.declare(name, kind, "function", null);
        function.markInitialized();
        return function;
    }

    private SymbolEntry declareVariable(int name, TypeSpan type) {
        boolean parameter = inHeaderParameters(name) && atHeaderDepth();
        int after = name + 1;
        String dataType = type.text();
        while (is(after, "[")) {
            int close = matching(after);
            if (close < 0) {
                break;
            }
            after = close + 1;
            dataType = type.text() + "[]";
        }
        if (dataType.equals("auto") && is(after, "=")) {
            Token next = at(after + 2);
            String inferred = valueType(after + 1);
            if (inferred != null && (next == null || isAny(after + 2, ";", ",", ")"))) {
                dataType = inferred;
            }
        }
        SymbolKind kind = parameter ? SymbolKind.PARAMETER : SymbolKind.VARIABLE;
        SymbolEntry entry = context.declare(name, kind, dataType, inClassScope() ? "field" : null);
        entry.setTypeSuffix(type.suffix());
        entry.setConstant(type.constant());
        boolean defaultConstructed = !type.primitive() && type.suffix().isEmpty();
        if (parameter || defaultConstructed || isAny(after, "=", "{", "(", ":")
                || (is(after, ")") && !inHeaderParameters(name))) {
            entry.markInitialized();
        }
        if (parameter) {
            addParameter(entry);
        }
        return entry;
    }

    private void continueDeclarationList(int comma) {
        if (pending == null || parenDepth != pending.parenDepth() || inHeaderParameters(comma)) {
            return;
        }
        int i = comma + 1;
        StringBuilder suffix = new StringBuilder();
        while (isAny(i, "*", "&")) {
            suffix.append(tokens.get(i).text());
            i++;
        }
        if (isIdentifier(i) && !context.isSite(i) && isAny(i + 1, "=", ";", ",", "[", "{", "(")) {
            TypeSpan base = pending.type();
            declareVariable(i, new TypeSpan(i, base.text(), suffix.toString(),
                    base.constant() && suffix.length() == 0, base.primitive(), -1, -1));
        }
    }

    private boolean declareClass(int index) {
        int name = index + 1;
        if (!isIdentifier(name)) {
            return false;
        }
        int next = is(name + 1, "final") ? name + 2 : name + 1;
        if (isAny(next, "{", ":")) {
            declareType(name);
            for (int i = next; i < tokens.size() && !is(i, ";"); i++) {
                if (is(i, "{")) {
                    openClassScope(tokens.get(name).text());
                    adopt(i);
                    break;
                }
            }
            return true;
        }
        if (isAny(next, ";", ">", ",", "=")) {
            declareType(name);
            return true;
        }
        return false;
    }

    private void declareType(int name) {
        Optional<SymbolEntry> existing = scopes.lookupLocal(scopes.current(), tokens.get(name).text())
                .filter(entry -> entry.getKind() == SymbolKind.CLASS && !entry.isBuiltin());
        if (existing.isPresent()) {
            context.markSite(name);
            return;
        }
        context.declare(name, SymbolKind.CLASS, "class", null).markInitialized();
    }

    private void declareEnum(int index) {
        int i = index + 1;
        if (isAny(i, "class", "struct")) {
            i++;
        }
        if (isIdentifier(i)) {
            declareType(i);
            i++;
        }
        while (at(i) != null && !isAny(i, "{", ";")) {
            i++;
        }
        if (!is(i, "{")) {
            return;
        }
        plainBrace(i);
        int close = matching(i);
        for (int k = i + 1; k < close; k++) {
            if (isIdentifier(k) && isAny(k - 1, "{", ",")) {
                SymbolEntry enumerator = context.declare(k, SymbolKind.CONSTANT, "int", null);
                enumerator.setConstant(true);
                enumerator.markInitialized();
            }
        }
    }

    /**
     * Namespace members are declared in the enclosing scope.
     */
    private void openNamespace(int index) {
        int i = index + 1;
        if (isIdentifier(i)) {
            context.markSite(i);
            i++;
        }
        if (is(i, "{")) {
            plainBrace(i);
        }
    }

    private void declareTypedef(int index) {
        int i = index + 1;
        while (at(i) != null && !is(i, ";")) {
            if (isAny(i, "{", "(")) {
                int close = matching(i);
                if (close < 0) {
                    return;
                }
                if (is(i, "{")) {
                    plainBrace(i);
                }
                i = close;
            }
            i++;
        }
        if (isIdentifier(i - 1)) {
            declareType(i - 1);
        }
    }

    private void declareAlias(int index) {
        if (is(index + 1, "namespace")) {
            if (isIdentifier(index + 2)) {
                context.markSite(index + 2);
            }
        } else if (isIdentifier(index + 1) && is(index + 2, "=")) {
            declareType(index + 1);
        }
    }

    private void declareTemplateParameters(int index) {
        if (!is(index + 1, "<")) {
            return;
        }
        int close = closingAngle(index + 1);
        if (close < 0) {
            return;
        }
        templateClose = close;
        for (int k = index + 2; k < close; k++) {
            if (isIdentifier(k) && is(k - 1, "typename")) {
                declareType(k);
            }
        }
    }

    private void declareMacro(int index) {
        Matcher define = DEFINE.matcher(tokens.get(index).text());
        if (define.lookingAt()) {
            SymbolEntry macro = context.declareIn(ScopeTree.GLOBAL, index, define.group(1),
                    SymbolKind.CONSTANT, "macro", "define");
            macro.setConstant(true);
            macro.markInitialized();
            macro.markUsed();
        }
    }
}
