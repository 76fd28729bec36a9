package com.sharpskill.search.controller;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.sharpskill.search.model.MatchResult;

import java.util.List;

public record SkillSearchResultItem(
    @JsonProperty("skill_id") String skillId,
    String name,
    String category,
    double score,
    @JsonProperty("matched_terms") List<String> matchedTerms
) {
    public static SkillSearchResultItem from(MatchResult match) {
        return new SkillSearchResultItem(
            match.documentId(),
            match.name(),
            match.category(),
            match.score(),
            match.matchedTerms()
        );
    }
}
