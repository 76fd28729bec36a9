package com.sharpskill.search.model;

import java.util.List;

public record MatchResult(
    String documentId,
    String name,
    String category,
    double score,
    List<String> matchedTerms
) {
    public MatchResult {
        if (score < 0) {
            throw new IllegalArgumentException("Invalid match score: " + score);
        }
        matchedTerms = List.copyOf(matchedTerms);
    }
}
