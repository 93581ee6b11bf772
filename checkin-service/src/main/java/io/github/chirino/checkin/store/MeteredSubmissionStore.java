package io.github.chirino.checkin.store;

import io.github.chirino.checkin.model.LikeResult;
import io.github.chirino.checkin.model.ModerationStatus;
import io.github.chirino.checkin.model.NewSubmission;
import io.github.chirino.checkin.model.Page;
import io.github.chirino.checkin.model.Submission;
import io.github.chirino.checkin.model.SubmissionQuery;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * Decorator that records every store call with a Micrometer timer named {@code
 * checkin.store.operation}, tagged with the operation name.
 */
public class MeteredSubmissionStore implements SubmissionStore {

    private static final String TIMER = "checkin.store.operation";

    private final MeterRegistry registry;
    private final SubmissionStore delegate;

    public MeteredSubmissionStore(MeterRegistry registry, SubmissionStore delegate) {
        this.registry = registry;
        this.delegate = delegate;
    }

    @Override
    public Submission create(NewSubmission submission) {
        return registry.timer(TIMER, "operation", "create")
                .record(() -> delegate.create(submission));
    }

    @Override
    public Optional<Submission> findById(long id) {
        return registry.timer(TIMER, "operation", "findById").record(() -> delegate.findById(id));
    }

    @Override
    public Page<Submission> list(SubmissionQuery query) {
        return registry.timer(TIMER, "operation", "list").record(() -> delegate.list(query));
    }

    @Override
    public Optional<Submission> compareAndSetStatus(
            long id,
            ModerationStatus expected,
            ModerationStatus target,
            String reason,
            Instant at) {
        return registry.timer(TIMER, "operation", "compareAndSetStatus")
                .record(() -> delegate.compareAndSetStatus(id, expected, target, reason, at));
    }

    @Override
    public Map<ModerationStatus, Long> countByStatus() {
        return registry.timer(TIMER, "operation", "countByStatus")
                .record(delegate::countByStatus);
    }

    @Override
    public LikeResult addLike(long submissionId, String ipAddress) {
        return registry.timer(TIMER, "operation", "addLike")
                .record(() -> delegate.addLike(submissionId, ipAddress));
    }
}
