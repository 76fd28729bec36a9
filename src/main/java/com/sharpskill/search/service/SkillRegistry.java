package com.sharpskill.search.service;

import com.sharpskill.search.model.IndexSnapshot;
import com.sharpskill.search.model.SkillDocument;

import java.util.List;

/**
 * Owns the published document set and its index. The only component that
 * mutates state; everything else reads an {@link IndexSnapshot}.
 */
public interface SkillRegistry {

    /**
     * The current snapshot. Never blocks, never returns {@code null}; before
     * the first load this is the empty generation-0 snapshot.
     */
    IndexSnapshot current();

    /**
     * Builds a new index off to the side and publishes it atomically.
     * On failure the previous snapshot stays in effect.
     *
     * @throws com.sharpskill.search.exception.CorpusValidationException if the batch is rejected
     */
    IndexSnapshot load(List<SkillDocument> documents);

    default long currentGeneration() {
        return current().generation();
    }
}
