package com.sharpskill.search.service;

import com.sharpskill.search.config.SearchProperties;
import com.sharpskill.search.exception.EmptyQueryException;
import com.sharpskill.search.exception.InvalidQueryException;
import com.sharpskill.search.exception.TokenizationException;
import com.sharpskill.search.model.IndexSnapshot;
import com.sharpskill.search.model.MatchResult;
import com.sharpskill.search.model.Query;
import com.sharpskill.search.model.RankedList;
import com.sharpskill.search.model.SkillIndex;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class SkillSearchServiceImpl implements SkillSearchService {

    private final SkillRegistry registry;
    private final Tokenizer tokenizer;
    private final SkillMatcher matcher;
    private final SkillSelector selector;
    private final SearchProperties searchProperties;

    @Override
    public RankedList search(String text, Optional<Integer> topK, Optional<Double> minScore, Optional<String> category) {
        validateQuery(text);

        IndexSnapshot snapshot = registry.current();
        SkillIndex index = snapshot.index();

        Query query;
        try {
            query = new Query(
                text,
                tokenizer.tokenize(text, index.retainedShortTerms()),
                tokenizer.normalize(text)
            );
        } catch (TokenizationException e) {
            throw new InvalidQueryException("Query cannot be tokenized: " + e.getMessage(), e);
        }
        log.debug("Searching generation {} for terms {}", snapshot.generation(), query.terms());

        Collection<MatchResult> candidates = matcher.score(index, query).values();
        if (category.isPresent() && !category.get().isBlank()) {
            String wanted = category.get().trim();
            candidates = candidates.stream()
                .filter(match -> match.category().equalsIgnoreCase(wanted))
                .toList();
        }

        return selector.select(snapshot.generation(), candidates, topK, minScore);
    }

    private void validateQuery(String text) {
        if (text == null || text.isBlank()) {
            throw new EmptyQueryException();
        }
        if (text.length() > searchProperties.maxQueryLength()) {
            throw new InvalidQueryException("Query too long");
        }
    }
}
