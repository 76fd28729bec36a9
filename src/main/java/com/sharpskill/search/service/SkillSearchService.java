package com.sharpskill.search.service;

import com.sharpskill.search.model.RankedList;

import java.util.Optional;

public interface SkillSearchService {

    /**
     * Ranks the skills of the current snapshot against a user request.
     *
     * @throws com.sharpskill.search.exception.EmptyQueryException   for blank text
     * @throws com.sharpskill.search.exception.InvalidQueryException for over-long text or bad limits
     */
    RankedList search(String text, Optional<Integer> topK, Optional<Double> minScore, Optional<String> category);

    default RankedList search(String text) {
        return search(text, Optional.empty(), Optional.empty(), Optional.empty());
    }
}
