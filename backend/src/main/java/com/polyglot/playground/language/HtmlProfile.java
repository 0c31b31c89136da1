package com.polyglot.playground.language;

import java.util.List;
import java.util.Set;

final class HtmlProfile implements LanguageProfile {

    private static final Set<String> VOID_ELEMENTS = Vocabulary.words(
            "area", "base", "br", "col", "embed", "hr", "img", "input", "link", "meta", "source",
            "track", "wbr");

    private static final Set<String> KEYWORDS = Vocabulary.words(
            "html", "head", "body", "title", "meta", "link", "script", "style", "div", "span", "p", "a",
            "img", "ul", "ol", "li", "table", "tr", "td", "th", "thead", "tbody", "tfoot", "form",
            "input", "button", "label", "select", "option", "textarea", "h1", "h2", "h3", "h4", "h5",
            "h6", "header", "footer", "nav", "section", "article", "aside", "main", "br", "hr",
            "strong", "em", "b", "i", "u", "pre", "code", "iframe", "video", "audio", "source",
            "canvas", "svg", "doctype", "blockquote", "figure", "figcaption", "small", "sup", "sub");

    private static final List<String> OPERATORS = Vocabulary.longestFirst(
            List.of("</", "/>", "<", ">", "=", "/", "!", "&", "-", "+", "*", "%", "?", "|", "^", "~"));

    @Override
    public Language language() {
        return Language.HTML;
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
        return List.of(CommentStyle.MARKUP);
    }

    @Override
    public List<BuiltinSymbol> builtinSymbols() {
        return List.of();
    }

    @Override
    public TypeConversions typeConversions() {
        return TypeConversions.DYNAMIC;
    }

    @Override
    public boolean caseSensitive() {
        return false;
    }

    @Override
    public boolean backslashEscapes() {
        return false;
    }

    @Override
    public Set<String> voidElements() {
        return VOID_ELEMENTS;
    }
}
