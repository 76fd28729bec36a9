package com.sharpskill.search.controller;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.sharpskill.search.model.SkillDocument;

import java.util.Set;

public record SkillSummaryResponse(
    String id,
    String name,
    String description,
    String category,
    Set<String> tags,
    @JsonProperty("trigger_terms") Set<String> triggerTerms
) {
    public static SkillSummaryResponse from(SkillDocument doc) {
        return new SkillSummaryResponse(
            doc.id(),
            doc.name(),
            doc.description(),
            doc.category(),
            doc.tags(),
            doc.triggerTerms()
        );
    }
}
