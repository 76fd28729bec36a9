package com.sharpskill.search.service;

import com.sharpskill.search.model.MatchResult;
import com.sharpskill.search.model.RankedList;

import java.util.Collection;
import java.util.Optional;

public interface SkillSelector {

    /**
     * Thresholds, orders and truncates matcher output.
     *
     * @param topK     maximum number of results; empty returns every qualifying match
     * @param minScore lowest accepted score; a score must also be positive to qualify
     * @throws com.sharpskill.search.exception.InvalidQueryException for {@code topK < 1} or a negative {@code minScore}
     */
    RankedList select(long generation, Collection<MatchResult> candidates, Optional<Integer> topK, Optional<Double> minScore);
}
