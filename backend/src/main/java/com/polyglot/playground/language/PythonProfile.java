package com.polyglot.playground.language;

import com.polyglot.playground.dto.Severity;
import com.polyglot.playground.dto.Token;

import java.util.List;
import java.util.Optional;
import java.util.Set;

final class PythonProfile implements LanguageProfile {

    private static final Set<String> KEYWORDS = Vocabulary.words(
            "False", "None", "True", "and", "as", "assert", "async", "await", "break", "class",
            "continue", "def", "del", "elif", "else", "except", "finally", "for", "from", "global",
            "if", "import", "in", "is", "lambda", "nonlocal", "not", "or", "pass", "raise",
            "return", "try", "while", "with", "yield");

    private static final List<String> OPERATORS = Vocabulary.longestFirst(
            Vocabulary.C_FAMILY_OPERATORS,
            List.of("**", "//", "**=", "//=", "->", ":=", "@", "@="));

    private static final List<BuiltinSymbol> BUILTINS = List.of(
            BuiltinSymbol.function("print", "None"),
            BuiltinSymbol.function("input", "str"),
            BuiltinSymbol.function("len", "int"),
            BuiltinSymbol.function("range", "range"),
            BuiltinSymbol.function("str", "str"),
            BuiltinSymbol.function("int", "int"),
            BuiltinSymbol.function("float", "float"),
            BuiltinSymbol.function("bool", "bool"),
            BuiltinSymbol.function("list", "list"),
            BuiltinSymbol.function("dict", "dict"),
            BuiltinSymbol.function("set", "set"),
            BuiltinSymbol.function("tuple", "tuple"),
            BuiltinSymbol.function("type", "type"),
            BuiltinSymbol.function("isinstance", "bool"),
            BuiltinSymbol.function("open", "file"),
            BuiltinSymbol.function("sum", "number"),
            BuiltinSymbol.function("min", "any"),
            BuiltinSymbol.function("max", "any"),
            BuiltinSymbol.function("abs", "number"),
            BuiltinSymbol.function("round", "number"),
            BuiltinSymbol.function("sorted", "list"),
            BuiltinSymbol.function("reversed", "iterator"),
            BuiltinSymbol.function("enumerate", "iterator"),
            BuiltinSymbol.function("zip", "iterator"),
            BuiltinSymbol.function("map", "iterator"),
            BuiltinSymbol.function("filter", "iterator"),
            BuiltinSymbol.function("any", "bool"),
            BuiltinSymbol.function("all", "bool"),
            BuiltinSymbol.function("super", "object"),
            BuiltinSymbol.function("repr", "str"),
            BuiltinSymbol.function("format", "str"),
            BuiltinSymbol.function("chr", "str"),
            BuiltinSymbol.function("ord", "int"),
            BuiltinSymbol.function("getattr", "any"),
            BuiltinSymbol.function("setattr", "None"),
            BuiltinSymbol.function("hasattr", "bool"),
            BuiltinSymbol.function("iter", "iterator"),
            BuiltinSymbol.function("next", "any"),
            BuiltinSymbol.type("object"),
            BuiltinSymbol.type("Exception"),
            BuiltinSymbol.type("ValueError"),
            BuiltinSymbol.type("TypeError"),
            BuiltinSymbol.type("KeyError"),
            BuiltinSymbol.type("IndexError"),
            BuiltinSymbol.type("ZeroDivisionError"),
            BuiltinSymbol.type("RuntimeError"),
            BuiltinSymbol.constant("__name__", "str"),
            BuiltinSymbol.constant("__file__", "str"));

    private static final Set<String> STATEMENT_KEYWORDS = Vocabulary.words(
            "def", "class", "if", "elif", "else", "for", "while", "try", "except", "finally",
            "with", "return", "import", "from", "pass", "break", "continue", "raise");

    @Override
    public Language language() {
        return Language.PYTHON;
    }

    @Override
    public Set<String> keywords() {
        return KEYWORDS;
    }

    @Override
    public List<String> operators() {
        return OPERATORS;
    }

    @Override
    public List<CommentStyle> commentStyles() {
        return List.of(CommentStyle.HASH);
    }

    @Override
    public List<BuiltinSymbol> builtinSymbols() {
        return BUILTINS;
    }

    @Override
    public TypeConversions typeConversions() {
        return TypeConversions.DYNAMIC;
    }

    @Override
    public Set<String> stringPrefixes() {
        return Set.of("r", "b", "f", "u", "rb", "br", "fr", "rf");
    }

    @Override
    public boolean tripleQuotedStrings() {
        return true;
    }

    @Override
    public Set<String> statementKeywords() {
        return STATEMENT_KEYWORDS;
    }

    @Override
    public BlockStyle blockStyle() {
        return BlockStyle.INDENTATION;
    }

    @Override
    public Optional<Severity> undeclaredSeverity() {
        return Optional.of(Severity.WARNING);
    }

    @Override
    public RedeclarationPolicy redeclarationPolicy() {
        return RedeclarationPolicy.NEVER_REPORT;
    }

    @Override
    public String literalType(Token token) {
        return switch (token.kind()) {
            case INTEGER_NUMBER, HEX_NUMBER, BINARY_NUMBER, OCTAL_NUMBER -> "int";
            case DECIMAL_NUMBER -> "float";
            case DOUBLE_QUOTED_STRING, SINGLE_QUOTED_STRING -> "str";
            case KEYWORD -> token.hasText("True") || token.hasText("False") ? "bool"
                    : token.hasText("None") ? "NoneType" : null;
            default -> null;
        };
    }
}
