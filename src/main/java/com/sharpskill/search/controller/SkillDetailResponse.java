package com.sharpskill.search.controller;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.sharpskill.search.model.SkillDocument;

import java.util.Set;

public record SkillDetailResponse(
    String id,
    String name,
    String description,
    String category,
    Set<String> tags,
    @JsonProperty("trigger_terms") Set<String> triggerTerms,
    @JsonProperty("compatibility_note") String compatibilityNote,
    String body,
    long generation
) {
    public static SkillDetailResponse from(SkillDocument doc, long generation) {
        return new SkillDetailResponse(
            doc.id(),
            doc.name(),
            doc.description(),
            doc.category(),
            doc.tags(),
            doc.triggerTerms(),
            doc.compatibilityNote(),
            doc.body(),
            generation
        );
    }
}
