package com.polyglot.playground.service.semantic;

import com.polyglot.playground.dto.Severity;
import com.polyglot.playground.dto.SymbolEntry;
import com.polyglot.playground.dto.SymbolKind;
import com.polyglot.playground.dto.Token;
import com.polyglot.playground.dto.TokenCategory;
import com.polyglot.playground.language.Language;
import com.polyglot.playground.language.LanguageProfile;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Second semantic pass. Resolves every identifier use through the scope chain recorded for it,
 * flags undeclared and out-of-order uses, checks {@code name = value} assignments against the
 * declared type and finally reports unused and uninitialized variables.
 */
final class SymbolVerifier {

    private static final Set<String> MEMBER_ACCESS = Set.of(".", "->", "::", "?.");

    private static final Set<String> VALUE_TERMINATORS = Set.of(";", ",", ")", "]", "}");

    private final SemanticContext context;
    private final List<Token> tokens;
    private final LanguageProfile profile;
    private final ScopeTree scopes;
    private final Set<String> reported = new HashSet<>();

    private record Resolution(SymbolEntry entry, SymbolEntry late) {
    }

    SymbolVerifier(SemanticContext context) {
        this.context = context;
        this.tokens = context.tokens();
        this.profile = context.profile();
        this.scopes = context.scopes();
    }

    void verify() {
        context.guarded("identifier usage", this::verifyUses);
        context.guarded("assignments", this::verifyAssignments);
        context.guarded("input targets", this::markInputTargets);
        if (!profile.lazyBinding()) {
            context.guarded("variable usage", this::verifyVariables);
        }
    }

    private void verifyUses() {
        for (int i = 0; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            if (!token.isIdentifier() || context.isSite(i) || isMemberAccess(i)) {
                continue;
            }
            Resolution resolution = resolve(i);
            if (resolution.entry() != null) {
                resolution.entry().markUsed();
                continue;
            }
            if (followedBy(i, profile.assignmentOperator()) || !profile.tracksIdentifier(token)) {
                continue;
            }
            Optional<Severity> severity = profile.undeclaredSeverity();
            if (severity.isEmpty() || !reported.add(profile.normalize(token.text()))) {
                continue;
            }
            if (resolution.late() != null) {
                context.report(severity.get(), "'" + token.text() + "' is used before its declaration", token,
                        "Declared at line " + resolution.late().getLine());
            } else if (followedBy(i, "(")) {
                context.report(severity.get(), "Function '" + token.text() + "' has not been declared", token, null);
            } else {
                context.report(severity.get(), "Identifier '" + token.text() + "' has not been declared", token, null);
            }
        }
    }

    /**
     * Looks the name up from the scope it was read in. Where declaration order matters, a value
     * holder declared after the use does not count; the search moves on to the enclosing scopes
     * and remembers the late declaration for the report.
     */
    private Resolution resolve(int index) {
        String name = tokens.get(index).text();
        SymbolEntry late = null;
        for (Scope scope : scopes.chain(context.scopeAt(index))) {
            Optional<SymbolEntry> found = scopes.lookupLocal(scope.index(), name);
            if (found.isEmpty()) {
                continue;
            }
            SymbolEntry entry = found.get();
            if (declaredLater(entry, index)) {
                late = late == null ? entry : late;
                continue;
            }
            return new Resolution(entry, null);
        }
        return new Resolution(null, late);
    }

    private boolean declaredLater(SymbolEntry entry, int useIndex) {
        return profile.checksDeclarationOrder()
                && !entry.isBuiltin()
                && entry.getKind().holdsValue()
                && !"field".equals(entry.getDeclarationKeyword())
                && entry.getDeclarationIndex() > useIndex;
    }

    private void verifyAssignments() {
        String operator = profile.assignmentOperator();
        for (int i = 0; i + 1 < tokens.size(); i++) {
            if (!tokens.get(i).isIdentifier() || !followedBy(i, operator) || isMemberAccess(i)) {
                continue;
            }
            SymbolEntry target = resolve(i).entry();
            if (target == null) {
                continue;
            }
            boolean site = context.isSite(i);
            if (!site && target.isConstant() && target.getKind().holdsValue()) {
                context.report(Severity.ERROR, "Cannot reassign constant '" + target.getName() + "'",
                        tokens.get(i), "Declared at line " + target.getLine());
            }
            if (assignsValue(i)) {
                checkType(target, i + 2);
            }
            target.markInitialized();
        }
        markElementTargets(operator);
    }

    /**
     * T-SQL uses {@code =} for comparison too; there only {@code SET} and declarations assign.
     */
    private boolean assignsValue(int index) {
        if (profile.language() != Language.TSQL) {
            return true;
        }
        return context.isSite(index) || (index > 0 && tokens.get(index - 1).hasTextIgnoreCase("set"));
    }

    private void checkType(SymbolEntry target, int valueIndex) {
        if (valueIndex >= tokens.size() || !endsValue(valueIndex + 1)) {
            return;
        }
        String targetType = target.getKind().isCallable() ? target.getReturnType() : target.getDataType();
        String sourceType = typeOf(valueIndex);
        // pointers and arrays take literals their element type would not
        if (targetType == null || sourceType == null
                || !target.getTypeSuffix().isEmpty() || targetType.endsWith("[]")) {
            return;
        }
        if (!profile.typeConversions().isAssignable(targetType, sourceType)) {
            context.report(Severity.ERROR,
                    "Type incompatibility: cannot assign '" + sourceType + "' to '" + targetType + "'",
                    tokens.get(valueIndex), "Variable '" + target.getName() + "'");
        }
    }

    private boolean endsValue(int index) {
        if (index >= tokens.size()) {
            return true;
        }
        Token next = tokens.get(index);
        if (next.line() > tokens.get(index - 1).line()) {
            return true;
        }
        return next.category() == TokenCategory.DELIMITER && VALUE_TERMINATORS.contains(next.text());
    }

    private String typeOf(int valueIndex) {
        Token value = tokens.get(valueIndex);
        String literal = profile.literalType(value);
        if (literal != null) {
            return literal;
        }
        if (!value.isIdentifier()) {
            return null;
        }
        SymbolEntry source = resolve(valueIndex).entry();
        if (source == null) {
            return null;
        }
        return source.getKind().isCallable() ? null : source.getDataType();
    }

    /**
     * {@code a[i] = v} and {@code a.x = v} write into an existing object, which counts as
     * initializing the name in front.
     */
    private void markElementTargets(String operator) {
        for (int i = 0; i < tokens.size(); i++) {
            if (!tokens.get(i).isIdentifier() || isMemberAccess(i)) {
                continue;
            }
            int next = i + 1;
            if (followedBy(i, "[")) {
                next = closing(i + 1);
            } else if (next < tokens.size() && MEMBER_ACCESS.contains(tokens.get(next).text())) {
                next = i + 3;
            } else {
                continue;
            }
            if (next > 0 && followedBy(next - 1, operator)) {
                SymbolEntry entry = resolve(i).entry();
                if (entry != null) {
                    entry.markInitialized();
                }
            }
        }
    }

    private int closing(int openIndex) {
        int depth = 0;
        for (int i = openIndex; i < tokens.size(); i++) {
            String text = tokens.get(i).text();
            if (text.equals("[")) {
                depth++;
            } else if (text.equals("]") && --depth == 0) {
                return i + 1;
            }
        }
        return -1;
    }

    /**
     * Names written by input routines, stream extraction and {@code INTO} clauses.
     */
    private void markInputTargets() {
        Set<String> inputs = profile.inputFunctions();
        for (int i = 0; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            String word = profile.normalize(token.text());
            if (inputs.contains(word) && followedBy(i, "(")) {
                markArguments(i + 1);
            } else if (profile.language() == Language.CPP && token.hasText("cin")) {
                for (int j = i + 1; j + 1 < tokens.size() && tokens.get(j).hasText(">>"); j += 2) {
                    initialize(j + 1);
                }
            } else if (profile.language().isSql() && token.isKeyword() && word.equals("into")
                    && !followedByIdentifierThen(i, "(")) {
                for (int j = i + 1; j < tokens.size() && tokens.get(j).isIdentifier(); j += 2) {
                    initialize(j);
                    if (!followedBy(j, ",")) {
                        break;
                    }
                }
            }
        }
    }

    private boolean followedByIdentifierThen(int index, String text) {
        return index + 2 < tokens.size() && tokens.get(index + 1).isIdentifier() && followedBy(index + 1, text);
    }

    private void markArguments(int openIndex) {
        int depth = 0;
        for (int i = openIndex; i < tokens.size(); i++) {
            String text = tokens.get(i).text();
            if (text.equals("(")) {
                depth++;
            } else if (text.equals(")") && --depth == 0) {
                return;
            } else if (tokens.get(i).isIdentifier()) {
                initialize(i);
            }
        }
    }

    private void initialize(int index) {
        if (index < tokens.size() && tokens.get(index).isIdentifier()) {
            SymbolEntry entry = resolve(index).entry();
            if (entry != null) {
                entry.markInitialized();
            }
        }
    }

    private void verifyVariables() {
        for (SymbolEntry entry : context.symbols()) {
            if (entry.isBuiltin() || entry.getKind() != SymbolKind.VARIABLE
                    || "field".equals(entry.getDeclarationKeyword())) {
                continue;
            }
            Token at = tokens.get(entry.getDeclarationIndex());
            if (!entry.isUsed()) {
                if (entry.getScopeIndex() != ScopeTree.GLOBAL && !entry.getName().startsWith("_")) {
                    context.report(Severity.WARNING,
                            "Variable '" + entry.getName() + "' is declared but never used", at, null);
                }
            } else if (!entry.isInitialized()) {
                context.report(Severity.WARNING,
                        "Variable '" + entry.getName() + "' is used before being initialized", at, null);
            }
        }
    }

    private boolean isMemberAccess(int index) {
        if (index == 0) {
            return false;
        }
        Token previous = tokens.get(index - 1);
        return previous.category() != TokenCategory.STRING && MEMBER_ACCESS.contains(previous.text());
    }

    private boolean followedBy(int index, String text) {
        if (index + 1 >= tokens.size()) {
            return false;
        }
        Token next = tokens.get(index + 1);
        if (next.category() == TokenCategory.STRING) {
            return false;
        }
        return profile.caseSensitive() ? next.hasText(text) : next.hasTextIgnoreCase(text);
    }
}
