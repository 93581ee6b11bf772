package io.github.chirino.checkin.security;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.jboss.logging.Logger;

/**
 * Sliding-window write limiter with an escalating temporary ban.
 *
 * <p>Each identifier keeps the timestamps of its admitted writes inside the trailing window. Once
 * {@code maxWrites} writes are recorded, the next write starts a ban of {@code banDuration}; every
 * write is denied until the ban expires, which also clears the window.
 *
 * <p>State lives in this process only. Several service instances each enforce their own limit,
 * so the effective limit behind a load balancer is a multiple of {@code maxWrites}.
 */
public class RateLimiter {

    private static final Logger LOG = Logger.getLogger(RateLimiter.class);

    private final Duration window;
    private final int maxWrites;
    private final Duration banDuration;
    private final Clock clock;
    private final ConcurrentMap<String, Bucket> buckets = new ConcurrentHashMap<>();

    public RateLimiter(Duration window, int maxWrites, Duration banDuration, Clock clock) {
        if (window.isNegative() || window.isZero()) {
            throw new IllegalArgumentException("window must be positive");
        }
        if (maxWrites < 1) {
            throw new IllegalArgumentException("maxWrites must be at least 1");
        }
        this.window = window;
        this.maxWrites = maxWrites;
        this.banDuration = banDuration;
        this.clock = clock;
    }

    public RateLimitDecision admit(String identifier, ActionKind kind) {
        if (kind != ActionKind.WRITE) {
            return RateLimitDecision.allow();
        }
        String key = identifier == null ? "" : identifier;
        Instant now = clock.instant();
        RateLimitDecision[] decision = new RateLimitDecision[1];
        // compute() serializes callers for the same key
        buckets.compute(
                key,
                (k, bucket) -> {
                    Bucket b = bucket != null ? bucket : new Bucket();
                    decision[0] = b.admit(now);
                    return b;
                });
        if (!decision[0].allowed()) {
            LOG.debugf(
                    "Rate limited %s, retry after %ds", key, decision[0].retryAfterSeconds());
        }
        return decision[0];
    }

    /** Returns whether the identifier is currently serving a temporary ban. */
    public boolean isBanned(String identifier) {
        Bucket bucket = buckets.get(identifier);
        if (bucket == null) {
            return false;
        }
        Instant now = clock.instant();
        synchronized (bucket) {
            return bucket.bannedUntil != null && now.isBefore(bucket.bannedUntil);
        }
    }

    /**
     * Drops buckets with no live ban and no writes inside the window.
     *
     * @return the number of buckets removed
     */
    public int sweep() {
        Instant now = clock.instant();
        int before = buckets.size();
        for (String key : buckets.keySet()) {
            buckets.computeIfPresent(key, (k, b) -> b.isIdle(now) ? null : b);
        }
        int removed = Math.max(0, before - buckets.size());
        if (removed > 0) {
            LOG.debugf("Swept %d idle rate-limit buckets", removed);
        }
        return removed;
    }

    int trackedIdentifiers() {
        return buckets.size();
    }

    private final class Bucket {
        private final Deque<Instant> writes = new ArrayDeque<>();
        private Instant bannedUntil;

        synchronized RateLimitDecision admit(Instant now) {
            if (bannedUntil != null) {
                if (now.isBefore(bannedUntil)) {
                    return RateLimitDecision.deny(secondsUntil(now, bannedUntil));
                }
                bannedUntil = null;
                writes.clear();
            }
            prune(now);
            if (writes.size() >= maxWrites) {
                bannedUntil = now.plus(banDuration);
                writes.clear();
                return RateLimitDecision.deny(secondsUntil(now, bannedUntil));
            }
            writes.addLast(now);
            return RateLimitDecision.allow();
        }

        synchronized boolean isIdle(Instant now) {
            if (bannedUntil != null && now.isBefore(bannedUntil)) {
                return false;
            }
            prune(now);
            return writes.isEmpty();
        }

        private void prune(Instant now) {
            Instant cutoff = now.minus(window);
            while (!writes.isEmpty() && !writes.peekFirst().isAfter(cutoff)) {
                writes.removeFirst();
            }
        }
    }

    private static long secondsUntil(Instant now, Instant until) {
        long millis = Duration.between(now, until).toMillis();
        return (millis + 999) / 1000;
    }
}
