package com.polyglot.playground.language;

import com.polyglot.playground.dto.Severity;
import com.polyglot.playground.dto.Token;

import java.util.List;
import java.util.Optional;
import java.util.Set;

final class CppProfile implements LanguageProfile {

    static final Set<String> PRIMITIVE_TYPES = Vocabulary.words(
            "int", "float", "double", "char", "bool", "void", "long", "short", "unsigned", "signed",
            "auto", "string", "wchar_t");

    private static final Set<String> KEYWORDS = Vocabulary.words(
            "auto", "bool", "break", "case", "catch", "char", "class", "const", "constexpr", "continue",
            "default", "delete", "do", "double", "else", "enum", "explicit", "extern", "false", "float",
            "for", "friend", "goto", "if", "inline", "int", "long", "mutable", "namespace", "new",
            "nullptr", "operator", "private", "protected", "public", "register", "return", "short",
            "signed", "sizeof", "static", "struct", "switch", "template", "this", "throw", "true", "try",
            "typedef", "typename", "union", "unsigned", "using", "virtual", "void", "volatile", "while",
            "string", "wchar_t", "override", "noexcept");

    private static final List<String> OPERATORS = Vocabulary.longestFirst(
            Vocabulary.C_FAMILY_OPERATORS,
            List.of("->", "::", "->*"));

    private static final List<BuiltinSymbol> BUILTINS = List.of(
            BuiltinSymbol.object("std", "namespace"),
            BuiltinSymbol.object("cout", "ostream").inScope("std"),
            BuiltinSymbol.object("cin", "istream").inScope("std"),
            BuiltinSymbol.object("cerr", "ostream").inScope("std"),
            BuiltinSymbol.object("endl", "manipulator").inScope("std"),
            BuiltinSymbol.constant("NULL", "pointer"),
            BuiltinSymbol.constant("EOF", "int"),
            BuiltinSymbol.function("printf", "int"),
            BuiltinSymbol.function("scanf", "int"),
            BuiltinSymbol.function("puts", "int"),
            BuiltinSymbol.function("getline", "istream").inScope("std"),
            BuiltinSymbol.function("malloc", "pointer"),
            BuiltinSymbol.function("free", "void"),
            BuiltinSymbol.function("strlen", "size_t"),
            BuiltinSymbol.function("strcpy", "pointer"),
            BuiltinSymbol.function("strcmp", "int"),
            BuiltinSymbol.function("sqrt", "double"),
            BuiltinSymbol.function("pow", "double"),
            BuiltinSymbol.function("abs", "int"),
            BuiltinSymbol.function("exit", "void"),
            BuiltinSymbol.function("rand", "int"),
            BuiltinSymbol.function("srand", "void"),
            BuiltinSymbol.function("time", "long"),
            BuiltinSymbol.function("to_string", "string").inScope("std"),
            BuiltinSymbol.function("stoi", "int").inScope("std"),
            BuiltinSymbol.function("max", "auto").inScope("std"),
            BuiltinSymbol.function("min", "auto").inScope("std"),
            BuiltinSymbol.function("swap", "void").inScope("std"),
            BuiltinSymbol.function("sort", "void").inScope("std"),
            BuiltinSymbol.function("make_pair", "pair").inScope("std"),
            BuiltinSymbol.type("size_t"),
            BuiltinSymbol.type("vector").inScope("std"),
            BuiltinSymbol.type("map").inScope("std"),
            BuiltinSymbol.type("set").inScope("std"),
            BuiltinSymbol.type("pair").inScope("std"),
            BuiltinSymbol.type("unordered_map").inScope("std"),
            BuiltinSymbol.type("exception").inScope("std"));

    private static final Set<String> STATEMENT_KEYWORDS = Vocabulary.words(
            "if", "for", "while", "do", "return", "switch", "break", "continue", "class", "struct",
            "namespace", "using", "template", "typedef", "enum", "try", "throw",
            "int", "void", "char", "float", "double", "bool", "long", "short", "unsigned", "auto",
            "const", "static", "string");

    private static final TypeConversions CONVERSIONS = TypeConversions.builder()
            .family("int", "long", "short", "unsigned", "signed", "float", "double", "char", "bool",
                    "size_t", "wchar_t")
            .allow("string", "string")
            .build();

    @Override
    public Language language() {
        return Language.CPP;
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
        return List.of(CommentStyle.DOUBLE_SLASH, CommentStyle.SLASH_STAR);
    }

    @Override
    public List<BuiltinSymbol> builtinSymbols() {
        return BUILTINS;
    }

    @Override
    public TypeConversions typeConversions() {
        return CONVERSIONS;
    }

    @Override
    public boolean charLiterals() {
        return true;
    }

    @Override
    public boolean preprocessorDirectives() {
        return true;
    }

    @Override
    public String numberSuffixes() {
        return "uUlLfF";
    }

    @Override
    public Set<String> statementKeywords() {
        return STATEMENT_KEYWORDS;
    }

    @Override
    public BlockStyle blockStyle() {
        return BlockStyle.BRACES;
    }

    @Override
    public Optional<Severity> undeclaredSeverity() {
        return Optional.of(Severity.ERROR);
    }

    @Override
    public boolean checksDeclarationOrder() {
        return true;
    }

    @Override
    public Set<String> inputFunctions() {
        return Set.of("scanf", "getline");
    }

    @Override
    public String literalType(Token token) {
        return switch (token.kind()) {
            case INTEGER_NUMBER, HEX_NUMBER, BINARY_NUMBER, OCTAL_NUMBER -> "int";
            case DECIMAL_NUMBER -> token.text().endsWith("f") || token.text().endsWith("F") ? "float" : "double";
            case CHAR_LITERAL -> "char";
            case DOUBLE_QUOTED_STRING -> "string";
            case KEYWORD -> isBooleanLiteral(token) ? "bool" : token.hasText("nullptr") ? "null" : null;
            default -> null;
        };
    }
}
