package com.sharpskill.search.infra;

public interface RateLimiter {

    /** Takes one permit for {@code key} if available, without blocking. */
    boolean tryAcquire(String key);
}
