package com.sharpskill.search.model;

import java.util.List;

/**
 * A user request after tokenization.
 *
 * @param rawText      text as received
 * @param terms        tokens used for term matching (short tokens filtered)
 * @param phraseTokens every normalized token, used for trigger phrase detection
 */
public record Query(
    String rawText,
    List<String> terms,
    List<String> phraseTokens
) {
    public Query {
        terms = List.copyOf(terms);
        phraseTokens = List.copyOf(phraseTokens);
    }

    /** True when {@code phrase} occurs as a contiguous run starting at {@code start}. */
    public boolean containsPhraseAt(List<String> phrase, int start) {
        if (start < 0 || start + phrase.size() > phraseTokens.size()) {
            return false;
        }
        for (int i = 0; i < phrase.size(); i++) {
            if (!phrase.get(i).equals(phraseTokens.get(start + i))) {
                return false;
            }
        }
        return true;
    }
}
