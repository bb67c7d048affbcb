package com.chapterbus.worker;

import com.chapterbus.contract.FailureKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Token bucket per provider. Buckets refill continuously at requests-per-minute and
 * hold at most {@code burst} tokens. Providers without a configured limit pass freely.
 */
public class TokenBucketRateLimiter implements RateLimiter {

    private static final Logger log = LoggerFactory.getLogger(TokenBucketRateLimiter.class);

    private static final long MAX_SLEEP_NANOS = TimeUnit.MILLISECONDS.toNanos(100);

    private final Map<String, Limit> limits;
    private final ConcurrentHashMap<String, Bucket> buckets = new ConcurrentHashMap<>();

    public TokenBucketRateLimiter(Map<String, Limit> limits) {
        this.limits = Map.copyOf(limits);
    }

    @Override
    public void acquire(String providerId, Instant deadline) throws InterruptedException {
        Limit limit = providerId == null ? null : limits.get(providerId);
        if (limit == null) {
            return;
        }
        Bucket bucket = buckets.computeIfAbsent(providerId, id -> new Bucket(limit, System.nanoTime()));

        while (true) {
            long waitNanos = bucket.tryTake(System.nanoTime());
            if (waitNanos == 0) {
                return;
            }
            long remainingNanos = deadline == null
                ? Long.MAX_VALUE
                : Duration.between(Instant.now(), deadline).toNanos();
            if (waitNanos > remainingNanos) {
                log.debug("Provider {} has no permit within deadline (wait={}ms)",
                    providerId, TimeUnit.NANOSECONDS.toMillis(waitNanos));
                throw new WorkerException(FailureKind.DEADLINE_EXCEEDED,
                    "rate limit for provider " + providerId + " exceeds the call deadline");
            }
            TimeUnit.NANOSECONDS.sleep(Math.min(waitNanos, MAX_SLEEP_NANOS));
        }
    }

    public record Limit(int requestsPerMinute, int burst) {
        public Limit {
            if (requestsPerMinute < 1) {
                throw new IllegalArgumentException("requestsPerMinute must be >= 1");
            }
            if (burst < 1) {
                throw new IllegalArgumentException("burst must be >= 1");
            }
        }

        public static Limit perMinute(int requestsPerMinute) {
            return new Limit(requestsPerMinute, requestsPerMinute);
        }
    }

    private static final class Bucket {
        private final double capacity;
        private final double tokensPerNano;
        private double tokens;
        private long lastRefillNanos;

        private Bucket(Limit limit, long now) {
            this.capacity = limit.burst();
            this.tokensPerNano = limit.requestsPerMinute() / (double) TimeUnit.MINUTES.toNanos(1);
            this.tokens = capacity;
            this.lastRefillNanos = now;
        }

        /** Takes a token and returns 0, or returns the nanos until one is available. */
        private synchronized long tryTake(long now) {
            long elapsed = now - lastRefillNanos;
            if (elapsed > 0) {
                tokens = Math.min(capacity, tokens + elapsed * tokensPerNano);
                lastRefillNanos = now;
            }
            if (tokens >= 1.0) {
                tokens -= 1.0;
                return 0;
            }
            return Math.max(1, (long) Math.ceil((1.0 - tokens) / tokensPerNano));
        }
    }
}
