package com.sharpskill.search.service;

import com.sharpskill.search.model.IndexSnapshot;
import com.sharpskill.search.model.SkillDocument;

import java.util.List;
import java.util.Optional;

public interface SkillAdminService {

    /**
     * Replaces the whole corpus. Subject to the reload rate limit.
     *
     * @throws com.sharpskill.search.exception.ReloadThrottledException  when called too often
     * @throws com.sharpskill.search.exception.CorpusValidationException when the batch is rejected
     */
    IndexSnapshot reload(List<SkillDocument> documents);

    /** Reloads from the configured corpus repository. Not rate limited. */
    IndexSnapshot refreshFromCorpus();

    /**
     * Schedules an asynchronous {@link #refreshFromCorpus()}. Subject to the
     * reload rate limit.
     */
    void requestRefresh(String reason);

    /** Fingerprint of the corpus content last loaded through {@link #refreshFromCorpus()}. */
    Optional<String> loadedCorpusFingerprint();

    /**
     * Fingerprint of corpus content that {@link #refreshFromCorpus()} read but
     * the indexer rejected; cleared by the next successful refresh. Read
     * failures are not recorded.
     */
    Optional<String> rejectedCorpusFingerprint();

    IndexSnapshot current();
}
