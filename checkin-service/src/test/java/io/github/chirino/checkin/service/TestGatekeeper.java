package io.github.chirino.checkin.service;

import io.github.chirino.checkin.MutableClock;
import io.github.chirino.checkin.screening.ContentSafetyScanner;
import io.github.chirino.checkin.screening.DuplicateDetector;
import io.github.chirino.checkin.screening.HoneypotDetector;
import io.github.chirino.checkin.screening.KeywordDenylist;
import io.github.chirino.checkin.screening.SubmissionFieldValidator;
import io.github.chirino.checkin.security.BlocklistStore;
import io.github.chirino.checkin.security.IpRangeClassifier;
import io.github.chirino.checkin.security.RateLimiter;
import io.github.chirino.checkin.security.RegionRangeTable;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/** A gatekeeper wired with the production defaults and a controllable clock. */
final class TestGatekeeper {

    static final String VISITOR_IP = "198.51.100.10";
    static final String BLOCKED_REGION_IP = "1.0.1.1";

    final MutableClock clock = MutableClock.startingAt("2024-05-01T10:00:00Z");
    final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    final BlocklistStore blocklist;
    final SubmissionGatekeeper gatekeeper;

    TestGatekeeper(Path dir) {
        blocklist = new BlocklistStore(dir.resolve("blacklist.txt"));
        gatekeeper =
                new SubmissionGatekeeper(
                        blocklist,
                        new IpRangeClassifier(RegionRangeTable.defaultTable(), Optional.empty()),
                        Set.of(" cn "),
                        new RateLimiter(
                                Duration.ofSeconds(60), 10, Duration.ofSeconds(300), clock),
                        new HoneypotDetector(Duration.ofSeconds(3), Duration.ofHours(1), clock),
                        new SubmissionFieldValidator(),
                        new DuplicateDetector(Duration.ofSeconds(300), clock),
                        new ContentSafetyScanner(
                                KeywordDenylist.of(List.of("casino")), 10_000, List.of("wumao")),
                        registry);
    }

    double rejections(String code) {
        var counter =
                registry.find(SubmissionGatekeeper.REJECTIONS_METRIC).tag("code", code).counter();
        return counter == null ? 0 : counter.count();
    }

    static SubmissionForm form(String content) {
        return new SubmissionForm(
                content, "小明", null, null, null, null, "", null, null, VISITOR_IP);
    }

    static SubmissionForm form(String content, String ip, String fingerprint) {
        return new SubmissionForm(
                content, "小明", null, null, null, null, "", null, fingerprint, ip);
    }
}
