package com.sharpskill.search.worker;

import com.sharpskill.search.event.CorpusRefreshRequestedEvent;
import com.sharpskill.search.exception.CorpusLoadException;
import com.sharpskill.search.repository.SkillCorpusRepository;
import com.sharpskill.search.service.SkillAdminService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Watches the corpus source and requests a rebuild when its content changes.
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(name = "app.skills.corpus.auto-refresh", havingValue = "true")
public class CorpusRefreshWorker {

    private final SkillCorpusRepository corpusRepository;
    private final SkillAdminService adminService;
    private final ApplicationEventPublisher eventPublisher;

    @Scheduled(
        initialDelayString = "${app.skills.corpus.refresh-interval-ms:60000}",
        fixedDelayString = "${app.skills.corpus.refresh-interval-ms:60000}"
    )
    public void checkForChanges() {
        log.debug("Checking skill corpus {} for changes", corpusRepository.location());

        String fingerprint;
        try {
            fingerprint = corpusRepository.fingerprint();
        } catch (CorpusLoadException e) {
            log.warn("Cannot read skill corpus {}: {}", e.getLocation(), e.getMessage());
            return;
        }

        if (matches(adminService.loadedCorpusFingerprint(), fingerprint)) {
            return;
        }
        // Rejected content stays rejected until it changes; read failures are retried next cycle.
        if (matches(adminService.rejectedCorpusFingerprint(), fingerprint)) {
            log.debug("Skill corpus {} unchanged since it was rejected", corpusRepository.location());
            return;
        }

        log.info("Skill corpus {} changed; requesting rebuild", corpusRepository.location());
        eventPublisher.publishEvent(new CorpusRefreshRequestedEvent("corpus changed"));
    }

    private static boolean matches(Optional<String> known, String fingerprint) {
        return known.isPresent() && known.get().equals(fingerprint);
    }
}
