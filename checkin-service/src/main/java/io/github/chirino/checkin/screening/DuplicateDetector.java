package io.github.chirino.checkin.screening;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.jboss.logging.Logger;

/**
 * Denies content whose trimmed SHA-256 hash was first seen less than {@code window} ago. A denied
 * repeat does not extend the entry; it expires {@code window} after the first sighting.
 */
public class DuplicateDetector {

    private static final Logger LOG = Logger.getLogger(DuplicateDetector.class);

    private final Duration window;
    private final Clock clock;
    private final ConcurrentMap<String, Instant> firstSeen = new ConcurrentHashMap<>();

    public DuplicateDetector(Duration window, Clock clock) {
        this.window = window;
        this.clock = clock;
    }

    /** Returns {@code true} and records the content when it was not seen inside the window. */
    public boolean admit(String content) {
        Instant now = clock.instant();
        purgeExpired(now);
        String hash = Hashing.sha256Hex(content == null ? "" : content.trim());
        boolean[] admitted = new boolean[1];
        firstSeen.compute(
                hash,
                (k, seen) -> {
                    if (seen != null && !isExpired(seen, now)) {
                        return seen;
                    }
                    admitted[0] = true;
                    return now;
                });
        if (!admitted[0]) {
            LOG.debugf("Duplicate content hash %s", hash.substring(0, 12));
        }
        return admitted[0];
    }

    /**
     * Drops every expired hash.
     *
     * @return the number of entries removed
     */
    public int sweep() {
        return purgeExpired(clock.instant());
    }

    int size() {
        return firstSeen.size();
    }

    private int purgeExpired(Instant now) {
        int before = firstSeen.size();
        firstSeen.entrySet().removeIf(e -> isExpired(e.getValue(), now));
        return Math.max(0, before - firstSeen.size());
    }

    private boolean isExpired(Instant seen, Instant now) {
        return Duration.between(seen, now).compareTo(window) > 0;
    }
}
