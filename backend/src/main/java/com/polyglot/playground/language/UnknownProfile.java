package com.polyglot.playground.language;

import java.util.List;
import java.util.Set;

/**
 * Fallback for unrecognized tags: generic lexing, stricter word recognition, no semantic policy.
 */
final class UnknownProfile implements LanguageProfile {

    private static final List<CommentStyle> COMMENTS = List.of(
            CommentStyle.DOUBLE_SLASH, CommentStyle.SLASH_STAR, CommentStyle.HASH);

    @Override
    public Language language() {
        return Language.UNKNOWN;
    }

    @Override
    public Set<String> keywords() {
        return Set.of();
    }

    @Override
    public List<String> operators() {
        return Vocabulary.longestFirst(Vocabulary.C_FAMILY_OPERATORS);
    }

    @Override
    public List<CommentStyle> commentStyles() {
        return COMMENTS;
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
    public boolean strictWordRecognition() {
        return true;
    }
}
