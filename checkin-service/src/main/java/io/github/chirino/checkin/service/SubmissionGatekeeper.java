package io.github.chirino.checkin.service;

import io.github.chirino.checkin.screening.ContentSafetyScanner;
import io.github.chirino.checkin.screening.DuplicateDetector;
import io.github.chirino.checkin.screening.HoneypotDetector;
import io.github.chirino.checkin.screening.ScanResult;
import io.github.chirino.checkin.screening.SubmissionFieldValidator;
import io.github.chirino.checkin.screening.SubmitterFields;
import io.github.chirino.checkin.security.ActionKind;
import io.github.chirino.checkin.security.BlocklistStore;
import io.github.chirino.checkin.security.IpRangeClassifier;
import io.github.chirino.checkin.security.RateLimitDecision;
import io.github.chirino.checkin.security.RateLimiter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import org.jboss.logging.Logger;

/**
 * Runs every check an inbound submission has to pass before anything is persisted.
 *
 * <p>Order: blocklist, region, rate limit, honeypot, field validation, duplicate content,
 * content scan. Cheap policy checks come first so that abusive callers are turned away before any
 * parsing. Field validation precedes the duplicate check so a malformed submission never enters
 * the duplicate cache.
 *
 * <p>The rate limiter, duplicate cache and blocklist are process-local. Several service instances
 * behind a load balancer each enforce their own limits.
 */
public class SubmissionGatekeeper {

    private static final Logger LOG = Logger.getLogger(SubmissionGatekeeper.class);

    static final String REJECTIONS_METRIC = "checkin.gatekeeper.rejections";

    private final BlocklistStore blocklist;
    private final IpRangeClassifier classifier;
    private final Set<String> blockedRegions;
    private final RateLimiter rateLimiter;
    private final HoneypotDetector honeypot;
    private final SubmissionFieldValidator fieldValidator;
    private final DuplicateDetector duplicates;
    private final ContentSafetyScanner scanner;
    private final MeterRegistry registry;

    public SubmissionGatekeeper(
            BlocklistStore blocklist,
            IpRangeClassifier classifier,
            Set<String> blockedRegions,
            RateLimiter rateLimiter,
            HoneypotDetector honeypot,
            SubmissionFieldValidator fieldValidator,
            DuplicateDetector duplicates,
            ContentSafetyScanner scanner,
            MeterRegistry registry) {
        this.blocklist = blocklist;
        this.classifier = classifier;
        this.blockedRegions =
                blockedRegions.stream()
                        .map(region -> region.trim().toUpperCase(Locale.ROOT))
                        .filter(region -> !region.isEmpty())
                        .collect(Collectors.toUnmodifiableSet());
        this.rateLimiter = rateLimiter;
        this.honeypot = honeypot;
        this.fieldValidator = fieldValidator;
        this.duplicates = duplicates;
        this.scanner = scanner;
        this.registry = registry;
    }

    /**
     * Screens a submission.
     *
     * @throws SubmissionRejectedException with the code of the first failing check
     */
    public GatekeeperVerdict admitWrite(SubmissionForm form) {
        String ip = form.ipAddress();
        String fingerprint = form.fingerprintOrNull();

        checkBlocklist(ip, fingerprint);
        String region = checkRegion(ip);
        checkRate(ip);

        HoneypotDetector.Verdict bot = honeypot.check(form.honeypot(), form.issuedAt());
        if (!bot.allowed()) {
            LOG.infof("Rejected submission from %s: bot check %s", ip, bot);
            throw reject(
                    new SubmissionRejectedException(
                            SubmissionRejectedException.BOT_DETECTED,
                            400,
                            "Submission could not be verified, please reload the page"));
        }

        SubmitterFields fields;
        String validFingerprint;
        try {
            validFingerprint = fieldValidator.validateFingerprint(fingerprint);
            fields =
                    fieldValidator.validate(
                            form.content(),
                            form.nickname(),
                            form.email(),
                            form.qq(),
                            form.url(),
                            form.avatar());
        } catch (SubmissionRejectedException e) {
            LOG.debugf("Rejected submission from %s: %s", ip, e.getMessage());
            throw reject(e);
        }

        if (!duplicates.admit(fields.content())) {
            LOG.infof("Rejected submission from %s: duplicate content", ip);
            throw reject(
                    new SubmissionRejectedException(
                            SubmissionRejectedException.DUPLICATE_CONTENT,
                            400,
                            "This content was submitted recently"));
        }

        ScanResult contentScan = scanner.scan(fields.content());
        if (!contentScan.safe()) {
            throw unsafe(ip, "content", contentScan);
        }
        ScanResult nicknameScan = scanner.scanDisplayName(fields.nickname());
        boolean nicknameFlagged = false;
        if (!nicknameScan.safe()) {
            if (nicknameScan.category() != ScanResult.Category.NICKNAME_PATTERN) {
                throw unsafe(ip, "nickname", nicknameScan);
            }
            nicknameFlagged = true;
        }
        return new GatekeeperVerdict(fields, region, validFingerprint, nicknameFlagged);
    }

    /** Checks a caller that wants to read. Only the blocklist applies. */
    public void admitRead(String ip) {
        checkBlocklist(ip, null);
    }

    /** Checks a caller performing a lightweight write such as a like. */
    public void admitAction(String ip) {
        checkBlocklist(ip, null);
        checkRate(ip);
    }

    private void checkBlocklist(String ip, String fingerprint) {
        if (blocklist.isAnyBlocked(ip, fingerprint)) {
            LOG.infof("Rejected request from %s: blocklisted", ip);
            throw reject(
                    new SubmissionRejectedException(
                            SubmissionRejectedException.BLOCKED, 403, "Access denied"));
        }
    }

    private String checkRegion(String ip) {
        String region = classifier.classify(ip);
        if (blockedRegions.contains(region)) {
            LOG.infof("Rejected request from %s: region %s", ip, region);
            throw reject(
                    new SubmissionRejectedException(
                            SubmissionRejectedException.REGION_BLOCKED,
                            451,
                            "Submissions are not available in your region"));
        }
        return region;
    }

    private void checkRate(String ip) {
        RateLimitDecision decision = rateLimiter.admit(ip, ActionKind.WRITE);
        if (!decision.allowed()) {
            LOG.infof(
                    "Rejected request from %s: rate limited for %ds",
                    ip, decision.retryAfterSeconds());
            throw reject(SubmissionRejectedException.rateLimited(decision.retryAfterSeconds()));
        }
    }

    private SubmissionRejectedException unsafe(String ip, String field, ScanResult result) {
        LOG.infof("Rejected submission from %s: unsafe %s", ip, field);
        LOG.debugf("Unsafe %s category for %s: %s", field, ip, result.category());
        return reject(
                new SubmissionRejectedException(
                        SubmissionRejectedException.UNSAFE_CONTENT, 400, result.reason()));
    }

    private SubmissionRejectedException reject(SubmissionRejectedException e) {
        registry.counter(REJECTIONS_METRIC, "code", e.getCode()).increment();
        return e;
    }
}
