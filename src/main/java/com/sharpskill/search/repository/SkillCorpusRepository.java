package com.sharpskill.search.repository;

import com.sharpskill.search.model.SkillDocument;

import java.util.List;

/**
 * Source of the skill corpus loaded at startup and on refresh.
 */
public interface SkillCorpusRepository {

    List<SkillDocument> loadAll();

    /** Digest of the current corpus content; changes whenever the content does. */
    String fingerprint();

    String location();
}
