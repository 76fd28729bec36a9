package com.sharpskill.search.model;

import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Inverted index over one validated document set. Immutable: a rebuild
 * always produces a new instance.
 *
 * @param postings           term to postings for that term
 * @param phrases            first phrase token to the trigger phrases starting with it
 * @param retainedShortTerms tokens below the minimum length kept because a trigger term contains them
 * @param documents          the documents this index was built from (skipped ones excluded)
 * @param warnings           documents skipped during the build
 */
public record SkillIndex(
    Map<String, List<PostingEntry>> postings,
    Map<String, List<TriggerPhrase>> phrases,
    Set<String> retainedShortTerms,
    DocumentStore documents,
    List<IndexWarning> warnings
) {

    private static final SkillIndex EMPTY =
        new SkillIndex(Map.of(), Map.of(), Set.of(), DocumentStore.empty(), List.of());

    public SkillIndex {
        postings = Collections.unmodifiableMap(postings.entrySet().stream()
            .collect(Collectors.toMap(Map.Entry::getKey, e -> List.copyOf(e.getValue()))));
        phrases = Collections.unmodifiableMap(phrases.entrySet().stream()
            .collect(Collectors.toMap(Map.Entry::getKey, e -> List.copyOf(e.getValue()))));
        retainedShortTerms = Set.copyOf(retainedShortTerms);
        warnings = List.copyOf(warnings);
    }

    public static SkillIndex empty() {
        return EMPTY;
    }

    public List<PostingEntry> postingsFor(String term) {
        return postings.getOrDefault(term, List.of());
    }

    public List<TriggerPhrase> phrasesStartingWith(String token) {
        return phrases.getOrDefault(token, List.of());
    }

    public int termCount() {
        return postings.size();
    }

    public int postingCount() {
        return postings.values().stream().mapToInt(List::size).sum();
    }

    /**
     * Index content with entry ordering removed, for equality checks between builds.
     */
    public Map<String, Set<PostingEntry>> postingSets() {
        Map<String, Set<PostingEntry>> sets = new HashMap<>();
        postings.forEach((term, entries) -> sets.put(term, new HashSet<>(entries)));
        return sets;
    }
}
