package io.github.chirino.checkin.config;

import io.github.chirino.checkin.archive.ArchiveProcessingService;
import io.github.chirino.checkin.archive.ArchiveSafetyValidator;
import io.github.chirino.checkin.archive.ImageRenderer;
import io.github.chirino.checkin.moderation.AutoModerator;
import io.github.chirino.checkin.moderation.ModerationAuditLogger;
import io.github.chirino.checkin.moderation.ModerationService;
import io.github.chirino.checkin.screening.ContentSafetyScanner;
import io.github.chirino.checkin.screening.DuplicateDetector;
import io.github.chirino.checkin.screening.HoneypotDetector;
import io.github.chirino.checkin.screening.KeywordDenylist;
import io.github.chirino.checkin.screening.SubmissionFieldValidator;
import io.github.chirino.checkin.security.BlocklistStore;
import io.github.chirino.checkin.security.IpRangeClassifier;
import io.github.chirino.checkin.security.RateLimiter;
import io.github.chirino.checkin.security.RegionRangeTable;
import io.github.chirino.checkin.service.SubmissionGatekeeper;
import io.github.chirino.checkin.service.SubmissionService;
import io.github.chirino.checkin.storage.MediaStore;
import io.github.chirino.checkin.storage.UploadStorage;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import java.time.Clock;

/**
 * Builds the submission pipeline. The pipeline classes are plain objects with constructor
 * arguments; this is the only place that knows about configuration and CDI.
 */
@ApplicationScoped
public class PipelineProducers {

    @Produces
    @Singleton
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Produces
    @Singleton
    public BlocklistStore blocklistStore(GatekeeperConfig config) {
        return new BlocklistStore(config.getBlocklistFile());
    }

    @Produces
    @Singleton
    public IpRangeClassifier ipRangeClassifier(GatekeeperConfig config) {
        return new IpRangeClassifier(RegionRangeTable.defaultTable(), config.getGeoipDatabase());
    }

    @Produces
    @Singleton
    public RateLimiter rateLimiter(GatekeeperConfig config, Clock clock) {
        return new RateLimiter(
                config.getRateLimitWindow(),
                config.getRateLimitMaxWrites(),
                config.getRateLimitBanDuration(),
                clock);
    }

    @Produces
    @Singleton
    public DuplicateDetector duplicateDetector(GatekeeperConfig config, Clock clock) {
        return new DuplicateDetector(config.getDuplicateWindow(), clock);
    }

    @Produces
    @Singleton
    public HoneypotDetector honeypotDetector(GatekeeperConfig config, Clock clock) {
        return new HoneypotDetector(
                config.getHoneypotMinElapsed(), config.getHoneypotMaxElapsed(), clock);
    }

    @Produces
    @Singleton
    public KeywordDenylist keywordDenylist(GatekeeperConfig config) {
        return new KeywordDenylist(config.getKeywordFile());
    }

    @Produces
    @Singleton
    public SubmissionGatekeeper submissionGatekeeper(
            GatekeeperConfig config,
            BlocklistStore blocklist,
            IpRangeClassifier classifier,
            RateLimiter rateLimiter,
            HoneypotDetector honeypot,
            DuplicateDetector duplicates,
            KeywordDenylist keywords,
            MeterRegistry registry) {
        ContentSafetyScanner scanner =
                new ContentSafetyScanner(
                        keywords, config.getMaxScanLength(), config.getNicknamePhrases());
        return new SubmissionGatekeeper(
                blocklist,
                classifier,
                config.getBlockedRegions(),
                rateLimiter,
                honeypot,
                new SubmissionFieldValidator(),
                duplicates,
                scanner,
                registry);
    }

    @Produces
    @Singleton
    public UploadStorage uploadStorage(StorageConfig config, Clock clock) {
        return new UploadStorage(config.getUploadDir(), clock);
    }

    @Produces
    @Singleton
    public ArchiveProcessingService archiveProcessingService(
            ArchiveConfig config, UploadStorage storage) {
        return new ArchiveProcessingService(
                new ArchiveSafetyValidator(config.getMaxEntries(), config.getMaxDeclaredSize()),
                new ImageRenderer(),
                storage,
                config.getLimits(),
                config.getMaxWorkers(),
                config.getQueueCapacity());
    }

    void closeArchiveProcessing(@Disposes ArchiveProcessingService service) {
        service.shutdown();
    }

    @Produces
    @Singleton
    public ModerationService moderationService(
            SubmissionStoreSelector storeSelector,
            BlocklistStore blocklist,
            IpRangeClassifier classifier,
            Clock clock) {
        return new ModerationService(
                storeSelector.getStore(),
                blocklist,
                classifier,
                new ModerationAuditLogger(),
                clock);
    }

    @Produces
    @Singleton
    public SubmissionService submissionService(
            SubmissionGatekeeper gatekeeper,
            StorageConfig storageConfig,
            UploadStorage storage,
            ArchiveProcessingService archives,
            SubmissionStoreSelector storeSelector,
            Clock clock) {
        return new SubmissionService(
                gatekeeper,
                new AutoModerator(),
                new MediaStore(storage, storageConfig.getMediaMaxSize()),
                archives,
                storeSelector.getStore(),
                clock);
    }
}
