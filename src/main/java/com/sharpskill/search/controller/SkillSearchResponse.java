package com.sharpskill.search.controller;

import com.sharpskill.search.model.RankedList;

import java.util.List;

public record SkillSearchResponse(
    long generation,
    List<SkillSearchResultItem> results
) {
    public static SkillSearchResponse from(RankedList ranked) {
        return new SkillSearchResponse(
            ranked.generation(),
            ranked.results().stream().map(SkillSearchResultItem::from).toList()
        );
    }
}
