package com.sharpskill.search.controller;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.sharpskill.search.model.IndexSnapshot;

import java.time.Instant;

public record GenerationResponse(
    long generation,
    @JsonProperty("document_count") int documentCount,
    @JsonProperty("built_at") Instant builtAt
) {
    public static GenerationResponse from(IndexSnapshot snapshot) {
        return new GenerationResponse(
            snapshot.generation(),
            snapshot.documents().size(),
            snapshot.isBuilt() ? snapshot.builtAt() : null
        );
    }
}
