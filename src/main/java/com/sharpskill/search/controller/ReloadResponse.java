package com.sharpskill.search.controller;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.sharpskill.search.model.IndexSnapshot;

import java.util.List;

public record ReloadResponse(
    long generation,
    @JsonProperty("document_count") int documentCount,
    @JsonProperty("term_count") int termCount,
    @JsonProperty("posting_count") int postingCount,
    List<SkippedSkillItem> skipped
) {
    public static ReloadResponse from(IndexSnapshot snapshot) {
        return new ReloadResponse(
            snapshot.generation(),
            snapshot.documents().size(),
            snapshot.index().termCount(),
            snapshot.index().postingCount(),
            snapshot.index().warnings().stream().map(SkippedSkillItem::from).toList()
        );
    }
}
