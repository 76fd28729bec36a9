package com.sharpskill.search.controller;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.sharpskill.search.model.IndexWarning;

public record SkippedSkillItem(
    @JsonProperty("skill_id") String skillId,
    String reason
) {
    public static SkippedSkillItem from(IndexWarning warning) {
        return new SkippedSkillItem(warning.documentId(), warning.message());
    }
}
