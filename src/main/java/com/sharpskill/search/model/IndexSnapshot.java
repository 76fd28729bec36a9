package com.sharpskill.search.model;

import java.time.Instant;

/**
 * One published build of the index. Readers hold on to a snapshot for the
 * whole request; a reload never changes a snapshot already handed out.
 */
public record IndexSnapshot(
    long generation,
    SkillIndex index,
    Instant builtAt
) {

    private static final IndexSnapshot EMPTY = new IndexSnapshot(0, SkillIndex.empty(), Instant.EPOCH);

    public static IndexSnapshot empty() {
        return EMPTY;
    }

    public DocumentStore documents() {
        return index.documents();
    }

    public boolean isBuilt() {
        return generation > 0;
    }
}
