package com.polyglot.playground.language;

import com.polyglot.playground.dto.Severity;
import com.polyglot.playground.dto.Token;

import java.util.List;
import java.util.Optional;
import java.util.Set;

final class PascalProfile implements LanguageProfile {

    private static final Set<String> KEYWORDS = Vocabulary.words(
            "and", "array", "begin", "case", "const", "div", "do", "downto", "else", "end", "file",
            "for", "forward", "function", "goto", "if", "in", "label", "mod", "nil", "not", "of", "or",
            "packed", "procedure", "program", "record", "repeat", "set", "then", "to", "type", "until",
            "uses", "var", "while", "with", "unit", "interface", "implementation",
            "integer", "real", "boolean", "char", "string", "true", "false");

    private static final List<String> OPERATORS = Vocabulary.longestFirst(
            List.of(":=", "<>", "<=", ">=", "..", "+=", "-=", "+", "-", "*", "/", "=", "<", ">", "^", "@"));

    private static final List<BuiltinSymbol> BUILTINS = List.of(
            BuiltinSymbol.function("writeln", "void"),
            BuiltinSymbol.function("write", "void"),
            BuiltinSymbol.function("readln", "void"),
            BuiltinSymbol.function("read", "void"),
            BuiltinSymbol.function("length", "integer"),
            BuiltinSymbol.function("copy", "string"),
            BuiltinSymbol.function("pos", "integer"),
            BuiltinSymbol.function("concat", "string"),
            BuiltinSymbol.function("inc", "void"),
            BuiltinSymbol.function("dec", "void"),
            BuiltinSymbol.function("ord", "integer"),
            BuiltinSymbol.function("chr", "char"),
            BuiltinSymbol.function("abs", "integer"),
            BuiltinSymbol.function("sqr", "integer"),
            BuiltinSymbol.function("sqrt", "real"),
            BuiltinSymbol.function("round", "integer"),
            BuiltinSymbol.function("trunc", "integer"),
            BuiltinSymbol.function("random", "integer"),
            BuiltinSymbol.function("randomize", "void"),
            BuiltinSymbol.function("halt", "void"),
            BuiltinSymbol.function("exit", "void"),
            BuiltinSymbol.function("break", "void"),
            BuiltinSymbol.function("continue", "void"),
            BuiltinSymbol.function("succ", "integer"),
            BuiltinSymbol.function("pred", "integer"),
            BuiltinSymbol.function("odd", "boolean"),
            BuiltinSymbol.function("upcase", "char"),
            BuiltinSymbol.function("inttostr", "string"),
            BuiltinSymbol.function("strtoint", "integer"),
            BuiltinSymbol.function("sin", "real"),
            BuiltinSymbol.function("cos", "real"),
            BuiltinSymbol.function("new", "void"),
            BuiltinSymbol.function("dispose", "void"),
            BuiltinSymbol.function("eof", "boolean"),
            BuiltinSymbol.constant("maxint", "integer"),
            BuiltinSymbol.object("input", "text"),
            BuiltinSymbol.object("output", "text"),
            BuiltinSymbol.object("result", "any"),
            BuiltinSymbol.type("longint"),
            BuiltinSymbol.type("byte"),
            BuiltinSymbol.type("word"),
            BuiltinSymbol.type("double"),
            BuiltinSymbol.type("text"));

    private static final Set<String> STATEMENT_KEYWORDS = Vocabulary.words(
            "program", "var", "const", "type", "procedure", "function", "begin", "if", "while",
            "for", "repeat", "case", "with", "uses");

    private static final String[] INTEGER_TYPES = {
            "integer", "longint", "shortint", "smallint", "byte", "word", "cardinal", "int64"};

    private static final TypeConversions CONVERSIONS = TypeConversions.builder()
            .family(INTEGER_TYPES)
            .family("real", "double", "single", "extended", "currency")
            .allowInto(new String[]{"real", "double", "single", "extended", "currency"}, INTEGER_TYPES)
            .allow("string", "char", "string")
            .allow("char", "char")
            .allow("boolean", "boolean")
            .build();

    @Override
    public Language language() {
        return Language.PASCAL;
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
        return List.of(CommentStyle.PAREN_STAR, CommentStyle.BRACE, CommentStyle.DOUBLE_SLASH);
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
    public boolean caseSensitive() {
        return false;
    }

    @Override
    public Set<Character> stringQuotes() {
        return Set.of('\'');
    }

    @Override
    public boolean backslashEscapes() {
        return false;
    }

    @Override
    public boolean doubledQuoteEscapes() {
        return true;
    }

    @Override
    public Set<String> statementKeywords() {
        return STATEMENT_KEYWORDS;
    }

    @Override
    public Set<String> blockOpeners() {
        return Set.of("begin", "case", "record");
    }

    @Override
    public BlockStyle blockStyle() {
        return BlockStyle.KEYWORDS;
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
    public String assignmentOperator() {
        return ":=";
    }

    @Override
    public Set<String> inputFunctions() {
        return Set.of("read", "readln");
    }

    @Override
    public String literalType(Token token) {
        return switch (token.kind()) {
            case INTEGER_NUMBER, HEX_NUMBER -> "integer";
            case DECIMAL_NUMBER -> "real";
            case SINGLE_QUOTED_STRING -> token.text().length() == 3 ? "char" : "string";
            case KEYWORD -> isBooleanLiteral(token) ? "boolean" : null;
            default -> null;
        };
    }
}
