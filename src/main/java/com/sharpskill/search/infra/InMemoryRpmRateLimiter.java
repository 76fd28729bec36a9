package com.sharpskill.search.infra;

import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Requests-per-minute limiter, one greedy-refill bucket per key. Never blocks:
 * a request over the limit is refused immediately.
 */
public class InMemoryRpmRateLimiter implements RateLimiter {

    private final ConcurrentHashMap<String, Bucket> buckets = new ConcurrentHashMap<>();

    private final int rpmLimit;

    public InMemoryRpmRateLimiter(int rpmLimit) {
        if (rpmLimit < 1) {
            throw new IllegalArgumentException("rpmLimit must be at least 1: " + rpmLimit);
        }
        this.rpmLimit = rpmLimit;
    }

    private Bucket createBucket() {
        return Bucket.builder()
            .addLimit(Bandwidth.builder()
                .capacity(rpmLimit)
                .refillGreedy(rpmLimit, Duration.ofMinutes(1))
                .build())
            .build();
    }

    @Override
    public boolean tryAcquire(String key) {
        return buckets.computeIfAbsent(key, k -> createBucket()).tryConsume(1);
    }
}
