package io.github.chirino.checkin.service;

import io.github.chirino.checkin.screening.DuplicateDetector;
import io.github.chirino.checkin.screening.KeywordDenylist;
import io.github.chirino.checkin.security.BlocklistStore;
import io.github.chirino.checkin.security.RateLimiter;
import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

/**
 * Housekeeping for the transient pipeline state. Per-call pruning in the limiter and the
 * duplicate cache stays authoritative; this only bounds memory held for idle callers and picks up
 * edits to the denylist files.
 */
@ApplicationScoped
public class PipelineMaintenanceJob {

    private static final Logger LOG = Logger.getLogger(PipelineMaintenanceJob.class);

    @Inject RateLimiter rateLimiter;

    @Inject DuplicateDetector duplicates;

    @Inject KeywordDenylist keywords;

    @Inject BlocklistStore blocklist;

    @Scheduled(every = "${checkin.sweep-interval:1m}")
    public void sweep() {
        int buckets = rateLimiter.sweep();
        int hashes = duplicates.sweep();
        if (buckets > 0 || hashes > 0) {
            LOG.debugf("Swept %d rate-limit buckets and %d duplicate hashes", buckets, hashes);
        }
    }

    @Scheduled(every = "${checkin.screening.keyword-reload-interval:30s}")
    public void reloadLists() {
        try {
            keywords.reloadIfChanged();
            blocklist.reloadIfChanged();
        } catch (RuntimeException e) {
            LOG.warnf("Failed to reload screening lists: %s", e.getMessage());
        }
    }
}
