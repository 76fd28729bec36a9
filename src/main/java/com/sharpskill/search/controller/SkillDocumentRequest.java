package com.sharpskill.search.controller;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.sharpskill.search.model.SkillDocument;

import java.util.List;

/**
 * Name and description are checked by the corpus validator so that every
 * problem in a batch is reported together.
 */
public record SkillDocumentRequest(
    String name,
    String description,
    @JsonProperty("trigger_terms") List<String> triggerTerms,
    List<String> tags,
    String category,
    @JsonProperty("compatibility_note") String compatibilityNote,
    String body
) {
    public SkillDocument toDocument() {
        return SkillDocument.of(name, description, triggerTerms, tags, category, compatibilityNote, body);
    }
}
