package com.sharpskill.search.service;

import com.sharpskill.search.config.SearchProperties;
import com.sharpskill.search.exception.InvalidQueryException;
import com.sharpskill.search.model.MatchResult;
import com.sharpskill.search.model.RankedList;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.Optional;

@Service
@RequiredArgsConstructor
public class SkillSelectorImpl implements SkillSelector {

    private final SearchProperties searchProperties;

    @Override
    public RankedList select(long generation, Collection<MatchResult> candidates, Optional<Integer> topK, Optional<Double> minScore) {
        Optional<Integer> limit = topK.or(() -> Optional.ofNullable(searchProperties.defaultLimit()));
        double threshold = minScore.orElse(searchProperties.defaultMinScore());

        if (limit.isPresent() && limit.get() < 1) {
            throw new InvalidQueryException("top_k must be at least 1");
        }
        if (threshold < 0 || Double.isNaN(threshold)) {
            throw new InvalidQueryException("min_score must not be negative");
        }

        return new RankedList(generation, candidates.stream()
            .filter(match -> match.score() > 0 && match.score() >= threshold)
            .sorted(RankedList.RANKING)
            .limit(limit.orElse(Integer.MAX_VALUE))
            .toList());
    }
}
