package com.sharpskill.search.repository;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.sharpskill.search.model.SkillDocument;

import java.util.List;

/**
 * One entry of the JSON corpus file.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SkillRecord(
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
