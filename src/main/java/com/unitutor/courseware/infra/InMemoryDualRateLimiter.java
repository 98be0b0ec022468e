package com.unitutor.courseware.infra;

import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import io.github.bucket4j.Refill;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Requests-per-minute and tokens-per-minute limiter, one pair of buckets per key.
 * Callers block until both buckets grant the permits.
 */
public class InMemoryDualRateLimiter implements RateLimiter {

    private final ConcurrentHashMap<String, Bucket> rpmBuckets = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Bucket> tpmBuckets = new ConcurrentHashMap<>();

    private final int rpmLimit;
    private final int tpmLimit;

    public InMemoryDualRateLimiter(int rpmLimit, int tpmLimit) {
        if (rpmLimit <= 0 || tpmLimit <= 0) {
            throw new IllegalArgumentException("Rate limits must be positive");
        }
        this.rpmLimit = rpmLimit;
        this.tpmLimit = tpmLimit;
    }

    private Bucket createRpmBucket() {
        return Bucket.builder()
            .addLimit(Bandwidth.classic(rpmLimit, Refill.greedy(rpmLimit, Duration.ofMinutes(1))))
            .build();
    }

    private Bucket createTpmBucket() {
        return Bucket.builder()
            .addLimit(Bandwidth.classic(tpmLimit, Refill.greedy(tpmLimit, Duration.ofMinutes(1))))
            .build();
    }

    @Override
    public void acquire(String key, int tokens) {
        Bucket rpmBucket = rpmBuckets.computeIfAbsent(key, k -> createRpmBucket());
        Bucket tpmBucket = tpmBuckets.computeIfAbsent(key, k -> createTpmBucket());

        // a request larger than the whole bucket would never be granted
        int boundedTokens = Math.max(1, Math.min(tokens, tpmLimit));

        try {
            rpmBucket.asBlocking().consume(1);
            tpmBucket.asBlocking().consume(boundedTokens);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for rate limit on " + key, e);
        }
    }

    @Override
    public void release(String key, int permits) {
    }
}
