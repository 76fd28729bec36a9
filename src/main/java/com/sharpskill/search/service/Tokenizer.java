package com.sharpskill.search.service;

import java.util.List;
import java.util.Set;

/**
 * Turns free text into comparable terms. Implementations must be pure and
 * deterministic: the same input always yields the same sequence. Any fuzzy
 * normalization (aliases, stemming) belongs here and nowhere else.
 */
public interface Tokenizer {

    /**
     * Normalized terms with tokens below the minimum length removed, except
     * those listed in {@code retainedShortTerms}. Duplicates are kept: term frequency
     * counts on both the document and the query side.
     *
     * @throws com.sharpskill.search.exception.TokenizationException if the text cannot be tokenized
     */
    List<String> tokenize(String text, Set<String> retainedShortTerms);

    default List<String> tokenize(String text) {
        return tokenize(text, Set.of());
    }

    /**
     * Every normalized token, without length filtering. Phrase detection
     * runs on this form for both trigger terms and queries.
     */
    List<String> normalize(String text);

    /** True when a normalized token would be dropped by the length filter. */
    boolean isShort(String term);
}
