package com.truetickets.search.infra;

import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;

import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Requests-per-minute limiter keyed by endpoint. Callers block until a permit is available.
 */
public class InMemoryRpmRateLimiter implements RateLimiter {

    private final ConcurrentHashMap<String, Bucket> buckets = new ConcurrentHashMap<>();

    private final int rpmLimit;

    public InMemoryRpmRateLimiter(int rpmLimit) {
        if (rpmLimit < 1) {
            throw new IllegalArgumentException("rpmLimit must be positive");
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
    public void acquire(String key, int permits) {
        Bucket bucket = buckets.computeIfAbsent(key, k -> createBucket());
        try {
            bucket.asBlocking().consume(permits);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted while waiting for a permit on " + key);
        }
    }

    public long availablePermits(String key) {
        return buckets.computeIfAbsent(key, k -> createBucket()).getAvailableTokens();
    }
}
