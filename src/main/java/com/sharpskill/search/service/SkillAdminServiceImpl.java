package com.sharpskill.search.service;

import com.sharpskill.search.event.CorpusRefreshRequestedEvent;
import com.sharpskill.search.exception.CorpusValidationException;
import com.sharpskill.search.exception.ReloadThrottledException;
import com.sharpskill.search.infra.RateLimiter;
import com.sharpskill.search.model.IndexSnapshot;
import com.sharpskill.search.model.SkillDocument;
import com.sharpskill.search.repository.SkillCorpusRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

@Slf4j
@Service
public class SkillAdminServiceImpl implements SkillAdminService {

    static final String RELOAD_KEY = "admin-reload";

    private final SkillRegistry registry;
    private final SkillCorpusRepository corpusRepository;
    private final RateLimiter reloadLimiter;
    private final ApplicationEventPublisher eventPublisher;

    // Serializes corpus refreshes so the recorded fingerprints follow generation order.
    private final ReentrantLock refreshLock = new ReentrantLock();

    private volatile String loadedFingerprint;
    private volatile String rejectedFingerprint;

    public SkillAdminServiceImpl(
        SkillRegistry registry,
        SkillCorpusRepository corpusRepository,
        @Qualifier("reloadLimiter") RateLimiter reloadLimiter,
        ApplicationEventPublisher eventPublisher
    ) {
        this.registry = registry;
        this.corpusRepository = corpusRepository;
        this.reloadLimiter = reloadLimiter;
        this.eventPublisher = eventPublisher;
    }

    @Override
    public IndexSnapshot reload(List<SkillDocument> documents) {
        acquireReloadPermit("reload of " + documents.size() + " skills");
        return registry.load(documents);
    }

    @Override
    public IndexSnapshot refreshFromCorpus() {
        refreshLock.lock();
        try {
            String fingerprint = corpusRepository.fingerprint();
            List<SkillDocument> documents = corpusRepository.loadAll();

            IndexSnapshot snapshot;
            try {
                snapshot = registry.load(documents);
            } catch (CorpusValidationException e) {
                rejectedFingerprint = fingerprint;
                throw e;
            }
            loadedFingerprint = fingerprint;
            rejectedFingerprint = null;

            log.info("Loaded corpus {} into generation {}", corpusRepository.location(), snapshot.generation());
            return snapshot;
        } finally {
            refreshLock.unlock();
        }
    }

    @Override
    public void requestRefresh(String reason) {
        acquireReloadPermit("refresh (" + reason + ")");
        eventPublisher.publishEvent(new CorpusRefreshRequestedEvent(reason));
    }

    @Override
    public Optional<String> loadedCorpusFingerprint() {
        return Optional.ofNullable(loadedFingerprint);
    }

    @Override
    public Optional<String> rejectedCorpusFingerprint() {
        return Optional.ofNullable(rejectedFingerprint);
    }

    @Override
    public IndexSnapshot current() {
        return registry.current();
    }

    private void acquireReloadPermit(String action) {
        if (!reloadLimiter.tryAcquire(RELOAD_KEY)) {
            log.warn("Throttled {}", action);
            throw new ReloadThrottledException(RELOAD_KEY);
        }
        log.info("Accepted {}", action);
    }
}
