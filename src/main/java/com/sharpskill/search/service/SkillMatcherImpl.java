package com.sharpskill.search.service;

import com.sharpskill.search.config.ScoringProperties;
import com.sharpskill.search.model.MatchResult;
import com.sharpskill.search.model.PostingEntry;
import com.sharpskill.search.model.Query;
import com.sharpskill.search.model.SkillDocument;
import com.sharpskill.search.model.SkillIndex;
import com.sharpskill.search.model.TriggerPhrase;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Field-weighted term overlap plus a fixed bonus per matched trigger phrase.
 * Every occurrence of a query term counts; a trigger phrase counts once per
 * document. Stateless; safe to call concurrently against the same index.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SkillMatcherImpl implements SkillMatcher {

    private final ScoringProperties scoring;

    @Override
    public Map<String, MatchResult> score(SkillIndex index, Query query) {
        Map<String, Double> scores = new HashMap<>();
        Map<String, Set<String>> matched = new HashMap<>();

        // Repeated query terms add their postings again.
        for (String term : query.terms()) {
            for (PostingEntry posting : index.postingsFor(term)) {
                scores.merge(posting.documentId(), posting.weight(), Double::sum);
                matched.computeIfAbsent(posting.documentId(), id -> new TreeSet<>()).add(term);
            }
        }

        Set<TriggerPhrase> awarded = new HashSet<>();
        List<String> tokens = query.phraseTokens();
        for (int i = 0; i < tokens.size(); i++) {
            for (TriggerPhrase phrase : index.phrasesStartingWith(tokens.get(i))) {
                if (!awarded.contains(phrase) && query.containsPhraseAt(phrase.tokens(), i)) {
                    awarded.add(phrase);
                    scores.merge(phrase.documentId(), scoring.phraseBonus(), Double::sum);
                    matched.computeIfAbsent(phrase.documentId(), id -> new TreeSet<>()).add(phrase.text());
                }
            }
        }

        Map<String, MatchResult> results = new LinkedHashMap<>();
        scores.forEach((documentId, score) -> {
            SkillDocument doc = index.documents().findById(documentId)
                .orElseThrow(() -> new IllegalStateException("Index references unknown skill " + documentId));
            results.put(documentId, new MatchResult(
                documentId,
                doc.name(),
                doc.category(),
                score,
                List.copyOf(matched.get(documentId))
            ));
        });

        log.debug("Query '{}' matched {} skills", query.rawText(), results.size());
        return results;
    }
}
