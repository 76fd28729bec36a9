package com.sharpskill.search.service;

import com.sharpskill.search.model.IndexSnapshot;
import com.sharpskill.search.model.SkillDocument;
import com.sharpskill.search.model.SkillIndex;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

@Slf4j
@Component
public class SkillRegistryImpl implements SkillRegistry {

    private final SkillIndexer indexer;
    private final Clock clock;

    private final AtomicReference<IndexSnapshot> current = new AtomicReference<>(IndexSnapshot.empty());

    // Serializes writers only; readers go straight to the reference.
    private final ReentrantLock buildLock = new ReentrantLock();

    @Autowired
    public SkillRegistryImpl(SkillIndexer indexer) {
        this(indexer, Clock.systemUTC());
    }

    SkillRegistryImpl(SkillIndexer indexer, Clock clock) {
        this.indexer = indexer;
        this.clock = clock;
    }

    @Override
    public IndexSnapshot current() {
        return current.get();
    }

    @Override
    public IndexSnapshot load(List<SkillDocument> documents) {
        buildLock.lock();
        try {
            IndexSnapshot previous = current.get();
            SkillIndex index = indexer.build(documents == null ? List.of() : documents);
            IndexSnapshot next = new IndexSnapshot(previous.generation() + 1, index, clock.instant());
            current.set(next);

            log.info("Published skill index generation {} ({} documents, replaced generation {})",
                next.generation(), index.documents().size(), previous.generation());
            return next;
        } finally {
            buildLock.unlock();
        }
    }
}
