package com.sharpskill.search.service;

import com.sharpskill.search.config.ScoringProperties;
import com.sharpskill.search.exception.TokenizationException;
import com.sharpskill.search.model.DocumentStore;
import com.sharpskill.search.model.IndexField;
import com.sharpskill.search.model.IndexWarning;
import com.sharpskill.search.model.PostingEntry;
import com.sharpskill.search.model.SkillDocument;
import com.sharpskill.search.model.SkillIndex;
import com.sharpskill.search.model.TriggerPhrase;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

@Slf4j
@Service
@RequiredArgsConstructor
public class SkillIndexerImpl implements SkillIndexer {

    private final Tokenizer tokenizer;
    private final ScoringProperties scoring;

    private record DocumentTerms(
        String documentId,
        Map<IndexField, Map<String, Integer>> frequencies,
        List<TriggerPhrase> phrases
    ) {}

    @Override
    public SkillIndex build(List<SkillDocument> documents) {
        DocumentStore store = DocumentStore.of(documents);
        if (store.isEmpty()) {
            log.debug("Building empty skill index");
            return new SkillIndex(Map.of(), Map.of(), Set.of(), store, List.of());
        }

        List<IndexWarning> warnings = new ArrayList<>();
        Set<String> skipped = new HashSet<>();

        // Short trigger tokens must be known before any field is filtered.
        Set<String> retainedShortTerms = new HashSet<>();
        for (SkillDocument doc : store.all()) {
            try {
                for (String trigger : doc.triggerTerms()) {
                    tokenizer.normalize(trigger).stream()
                        .filter(tokenizer::isShort)
                        .forEach(retainedShortTerms::add);
                }
            } catch (TokenizationException e) {
                skip(doc, e, warnings, skipped);
            }
        }

        List<DocumentTerms> indexed = new ArrayList<>();
        for (SkillDocument doc : store.all()) {
            if (skipped.contains(doc.id())) {
                continue;
            }
            try {
                indexed.add(analyze(doc, retainedShortTerms));
            } catch (TokenizationException e) {
                skip(doc, e, warnings, skipped);
            }
        }

        Map<String, List<PostingEntry>> postings = new TreeMap<>();
        Map<String, List<TriggerPhrase>> phrases = new TreeMap<>();
        Set<String> indexedIds = new LinkedHashSet<>();

        for (DocumentTerms terms : indexed) {
            indexedIds.add(terms.documentId());
            terms.frequencies().forEach((field, counts) -> {
                double base = scoring.weightFor(field);
                counts.forEach((term, tf) -> postings
                    .computeIfAbsent(term, t -> new ArrayList<>())
                    .add(new PostingEntry(term, terms.documentId(), field, base * tf)));
            });
            for (TriggerPhrase phrase : terms.phrases()) {
                phrases.computeIfAbsent(phrase.tokens().get(0), t -> new ArrayList<>()).add(phrase);
            }
        }

        SkillIndex index = new SkillIndex(
            postings,
            phrases,
            retainedShortTerms,
            store.retainOnly(indexedIds),
            warnings
        );

        log.info("Built skill index: {} documents, {} terms, {} postings, {} skipped",
            index.documents().size(), index.termCount(), index.postingCount(), warnings.size());
        return index;
    }

    private DocumentTerms analyze(SkillDocument doc, Set<String> retainedShortTerms) {
        Map<IndexField, Map<String, Integer>> frequencies = new EnumMap<>(IndexField.class);

        count(frequencies, IndexField.NAME, List.of(doc.name()), retainedShortTerms);
        count(frequencies, IndexField.TRIGGER_TERM, doc.triggerTerms(), retainedShortTerms);
        count(frequencies, IndexField.TAG, doc.tags(), retainedShortTerms);
        count(frequencies, IndexField.DESCRIPTION, List.of(doc.description()), retainedShortTerms);

        Map<List<String>, TriggerPhrase> phrases = new LinkedHashMap<>();
        for (String trigger : doc.triggerTerms()) {
            List<String> tokens = tokenizer.normalize(trigger);
            if (tokens.size() >= 2) {
                phrases.putIfAbsent(tokens, new TriggerPhrase(doc.id(), trigger.toLowerCase(Locale.ROOT), tokens));
            }
        }

        return new DocumentTerms(doc.id(), frequencies, List.copyOf(phrases.values()));
    }

    private void count(
        Map<IndexField, Map<String, Integer>> frequencies,
        IndexField field,
        Collection<String> values,
        Set<String> retainedShortTerms
    ) {
        for (String value : values) {
            for (String term : tokenizer.tokenize(value, retainedShortTerms)) {
                frequencies.computeIfAbsent(field, f -> new HashMap<>()).merge(term, 1, Integer::sum);
            }
        }
    }

    private static void skip(SkillDocument doc, TokenizationException e, List<IndexWarning> warnings, Set<String> skipped) {
        if (skipped.add(doc.id())) {
            log.warn("Skipping skill '{}' from index: {}", doc.id(), e.getMessage());
            warnings.add(new IndexWarning(doc.id(), e.getMessage()));
        }
    }
}
