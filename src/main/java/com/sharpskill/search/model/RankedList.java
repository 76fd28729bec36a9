package com.sharpskill.search.model;

import java.util.Comparator;
import java.util.List;

/**
 * Final search output, ordered by {@link #RANKING} and stamped with the
 * generation of the snapshot it was computed against.
 */
public record RankedList(
    long generation,
    List<MatchResult> results
) {

    public static final Comparator<MatchResult> RANKING = Comparator
        .comparingDouble(MatchResult::score).reversed()
        .thenComparing(MatchResult::name)
        .thenComparing(MatchResult::documentId);

    public RankedList {
        results = List.copyOf(results);
    }

    public static RankedList empty(long generation) {
        return new RankedList(generation, List.of());
    }

    public boolean isEmpty() {
        return results.isEmpty();
    }

    public int size() {
        return results.size();
    }
}
