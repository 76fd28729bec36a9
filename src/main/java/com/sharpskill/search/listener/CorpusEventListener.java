package com.sharpskill.search.listener;

import com.sharpskill.search.event.CorpusRefreshRequestedEvent;
import com.sharpskill.search.model.IndexSnapshot;
import com.sharpskill.search.service.SkillAdminService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

@Component
@Slf4j
@RequiredArgsConstructor
public class CorpusEventListener {

    private final SkillAdminService adminService;

    @Value("${app.skills.corpus.load-on-startup:true}")
    private boolean loadOnStartup;

    @EventListener(ApplicationReadyEvent.class)
    public void loadOnStartup() {
        if (!loadOnStartup) {
            log.info("Startup corpus load disabled; serving an empty skill index");
            return;
        }
        refresh("startup");
    }

    @Async("indexRebuildExecutor")
    @EventListener
    public void handleRefresh(CorpusRefreshRequestedEvent event) {
        refresh(event.reason());
    }

    // A failed load keeps the previous generation serving, so it is reported rather than rethrown.
    private void refresh(String reason) {
        log.info("Refreshing skill corpus ({})", reason);
        try {
            IndexSnapshot snapshot = adminService.refreshFromCorpus();
            log.info("Corpus refresh ({}) published generation {}", reason, snapshot.generation());
        } catch (RuntimeException e) {
            log.error("Corpus refresh ({}) failed; generation {} remains active",
                reason, adminService.current().generation(), e);
        }
    }
}
