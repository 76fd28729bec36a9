package com.sharpskill.search.infra;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryRpmRateLimiterTest {

    private static final int RPM_LIMIT = 3;

    private InMemoryRpmRateLimiter limiter;

    @BeforeEach
    void setUp() {
        limiter = new InMemoryRpmRateLimiter(RPM_LIMIT);
    }

    @Test
    void shouldRefuseRequestsOverRpmLimit() {
        String key = "admin-reload";

        for (int i = 0; i < RPM_LIMIT; i++) {
            assertThat(limiter.tryAcquire(key)).isTrue();
        }

        assertThat(limiter.tryAcquire(key)).isFalse();
    }

    @Test
    void shouldIsolateLimitsByKey() {
        for (int i = 0; i < RPM_LIMIT; i++) {
            limiter.tryAcquire("key-a");
        }

        assertThat(limiter.tryAcquire("key-a")).isFalse();
        assertThat(limiter.tryAcquire("key-b")).isTrue();
    }

    @Test
    void shouldNeverGrantMoreThanLimitUnderConcurrentAccess() {
        AtomicInteger granted = new AtomicInteger();
        List<CompletableFuture<Void>> futures = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            futures.add(CompletableFuture.runAsync(() -> {
                if (limiter.tryAcquire("concurrent")) {
                    granted.incrementAndGet();
                }
            }));
        }

        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        assertThat(granted.get()).isEqualTo(RPM_LIMIT);
    }

    @Test
    void shouldRejectNonPositiveLimit() {
        assertThatThrownBy(() -> new InMemoryRpmRateLimiter(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
