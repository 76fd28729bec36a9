package com.sharpskill.search.service;

import com.sharpskill.search.model.SkillDocument;
import com.sharpskill.search.model.SkillIndex;

import java.util.List;

public interface SkillIndexer {

    /**
     * Builds a fresh index from a whole batch.
     *
     * @throws com.sharpskill.search.exception.CorpusValidationException if the batch is invalid;
     *         no partial index is ever returned
     */
    SkillIndex build(List<SkillDocument> documents);
}
