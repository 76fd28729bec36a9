package com.sharpskill.search.model;

import java.util.List;

/**
 * A trigger term that normalizes to two or more tokens, kept whole so the
 * matcher can award the phrase bonus.
 */
public record TriggerPhrase(
    String documentId,
    String text,
    List<String> tokens
) {
    public TriggerPhrase {
        tokens = List.copyOf(tokens);
        if (tokens.size() < 2) {
            throw new IllegalArgumentException("A trigger phrase needs at least two tokens: " + text);
        }
    }
}
