package io.github.chirino.checkin.moderation;

import io.github.chirino.checkin.model.ModerationStatus;
import io.github.chirino.checkin.model.Page;
import io.github.chirino.checkin.model.Submission;
import io.github.chirino.checkin.model.SubmissionFilter;
import io.github.chirino.checkin.model.SubmissionQuery;
import io.github.chirino.checkin.security.BlocklistStore;
import io.github.chirino.checkin.security.IpRangeClassifier;
import io.github.chirino.checkin.service.SubmissionRejectedException;
import io.github.chirino.checkin.store.ResourceNotFoundException;
import io.github.chirino.checkin.store.SubmissionStore;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.LongFunction;
import org.jboss.logging.Logger;

/**
 * The moderation state machine.
 *
 * <pre>
 *   (create) -> approved | pending
 *   pending  -> approved             approve
 *   pending  -> banned               reject, ban
 *   approved -> banned               reject, ban
 * </pre>
 *
 * Banned is terminal and realized as a status flag; nothing is deleted. Ban additionally adds the
 * submitter's fingerprint, or its IP when there is no usable fingerprint, to the blocklist. Every
 * transition is a compare-and-set on the stored status, so two moderators acting at once cannot
 * both win.
 */
public class ModerationService {

    private static final Logger LOG = Logger.getLogger(ModerationService.class);

    public static final String REASON_REJECTED = "rejected";
    public static final String REASON_BANNED = "banned";

    private static final Map<ModerationStatus, Set<ModerationStatus>> ALLOWED =
            Map.of(
                    ModerationStatus.PENDING,
                    Set.of(ModerationStatus.APPROVED, ModerationStatus.BANNED),
                    ModerationStatus.APPROVED,
                    Set.of(ModerationStatus.BANNED),
                    ModerationStatus.BANNED,
                    Set.of());

    private final SubmissionStore store;
    private final BlocklistStore blocklist;
    private final IpRangeClassifier classifier;
    private final ModerationAuditLogger audit;
    private final Clock clock;

    public ModerationService(
            SubmissionStore store,
            BlocklistStore blocklist,
            IpRangeClassifier classifier,
            ModerationAuditLogger audit,
            Clock clock) {
        this.store = store;
        this.blocklist = blocklist;
        this.classifier = classifier;
        this.audit = audit;
        this.clock = clock;
    }

    public static boolean isAllowed(ModerationStatus from, ModerationStatus to) {
        return ALLOWED.getOrDefault(from, Set.of()).contains(to);
    }

    /** Publishes a pending submission. Approving an approved one is a no-op. */
    public Submission approve(long id) {
        Submission current = require(id);
        if (current.status() == ModerationStatus.APPROVED) {
            return current;
        }
        return transition("approve", current, ModerationStatus.APPROVED, null);
    }

    /** Takes a submission down without blocking its submitter. */
    public Submission reject(long id) {
        return transition("reject", require(id), ModerationStatus.BANNED, REASON_REJECTED);
    }

    /**
     * Takes a submission down and blocklists its submitter. The blocklist is written first, so a
     * failed write leaves the submission in its previous state and the ban can be retried.
     */
    public Submission ban(long id) {
        Submission current = require(id);
        if (!isAllowed(current.status(), ModerationStatus.BANNED)) {
            throw new IllegalModerationTransitionException(
                    current.id(), current.status(), ModerationStatus.BANNED);
        }
        blocklistSubmitter(current);
        return transition("ban", current, ModerationStatus.BANNED, REASON_BANNED);
    }

    /**
     * Approves each id independently; unknown ids and illegal transitions are skipped.
     *
     * @throws SubmissionRejectedException {@code validation_error} when {@code ids} is empty
     */
    public BatchResult batchApprove(List<Long> ids) {
        return batch("batch_approve", ids, this::approve);
    }

    public BatchResult batchReject(List<Long> ids) {
        return batch("batch_reject", ids, this::reject);
    }

    public Page<Submission> pending(int page, int limit) {
        return store.list(
                SubmissionQuery.byStatus(Optional.of(ModerationStatus.PENDING), page, limit));
    }

    /** Administrative listing; an empty status lists every submission. */
    public Page<Submission> list(Optional<ModerationStatus> status, int page, int limit) {
        return list(status, page, limit, SubmissionFilter.NONE);
    }

    public Page<Submission> list(
            Optional<ModerationStatus> status, int page, int limit, SubmissionFilter filter) {
        return store.list(SubmissionQuery.byStatus(status, page, limit, filter));
    }

    public ModerationStats stats() {
        Map<ModerationStatus, Long> counts = store.countByStatus();
        long approved = counts.getOrDefault(ModerationStatus.APPROVED, 0L);
        long pending = counts.getOrDefault(ModerationStatus.PENDING, 0L);
        long banned = counts.getOrDefault(ModerationStatus.BANNED, 0L);
        return new ModerationStats(approved + pending + banned, approved, pending, banned);
    }

    private Submission transition(
            String action, Submission current, ModerationStatus target, String reason) {
        // one retry covers a concurrent change between the read and the write
        for (int attempt = 0; attempt < 2; attempt++) {
            if (!isAllowed(current.status(), target)) {
                throw new IllegalModerationTransitionException(
                        current.id(), current.status(), target);
            }
            Instant now = clock.instant();
            Optional<Submission> updated =
                    store.compareAndSetStatus(current.id(), current.status(), target, reason, now);
            if (updated.isPresent()) {
                audit.logTransition(action, current.id(), current.status(), target);
                return updated.get();
            }
            current = require(current.id());
        }
        throw new IllegalModerationTransitionException(current.id(), current.status(), target);
    }

    private void blocklistSubmitter(Submission submission) {
        String fingerprint = submission.fingerprint();
        if (BlocklistStore.isValidIdentifier(fingerprint)) {
            blocklist.append(fingerprint);
            audit.logBlocklisted(submission.id(), "fingerprint");
            return;
        }
        if (fingerprint != null && !fingerprint.isBlank()) {
            LOG.warnf(
                    "Submission %d has an unusable fingerprint, falling back to its IP",
                    submission.id());
        }
        String ip = submission.ipAddress();
        if (ip == null || ip.isBlank() || classifier.isLocal(ip)) {
            LOG.infof("Submission %d has no blockable identifier", submission.id());
            return;
        }
        blocklist.append(ip);
        audit.logBlocklisted(submission.id(), "ip");
    }

    private BatchResult batch(String action, List<Long> ids, LongFunction<Submission> op) {
        if (ids == null || ids.isEmpty()) {
            throw SubmissionRejectedException.validation("No submission ids provided");
        }
        List<Long> distinct = ids.stream().distinct().toList();
        int succeeded = 0;
        for (Long id : distinct) {
            if (id == null) {
                continue;
            }
            try {
                op.apply(id);
                succeeded++;
            } catch (ResourceNotFoundException | IllegalModerationTransitionException e) {
                LOG.debugf("Skipping %d in %s: %s", id, action, e.getMessage());
            }
        }
        audit.logBatch(action, distinct.size(), succeeded);
        return new BatchResult(succeeded, distinct.size());
    }

    private Submission require(long id) {
        return store.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("submission", id));
    }
}
