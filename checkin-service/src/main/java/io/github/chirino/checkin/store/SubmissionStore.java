package io.github.chirino.checkin.store;

import io.github.chirino.checkin.model.LikeResult;
import io.github.chirino.checkin.model.ModerationStatus;
import io.github.chirino.checkin.model.NewSubmission;
import io.github.chirino.checkin.model.Page;
import io.github.chirino.checkin.model.Submission;
import io.github.chirino.checkin.model.SubmissionQuery;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/** Persistence for submissions and their likes. */
public interface SubmissionStore {

    Submission create(NewSubmission submission);

    Optional<Submission> findById(long id);

    Page<Submission> list(SubmissionQuery query);

    /**
     * Moves a submission from {@code expected} to {@code target} if and only if it is still in
     * {@code expected}.
     *
     * @return the updated submission, or empty when the id is unknown or the status changed
     */
    Optional<Submission> compareAndSetStatus(
            long id,
            ModerationStatus expected,
            ModerationStatus target,
            String reason,
            Instant at);

    Map<ModerationStatus, Long> countByStatus();

    /**
     * Records one like per (submission, ip).
     *
     * @throws ResourceNotFoundException when the submission does not exist
     */
    LikeResult addLike(long submissionId, String ipAddress);
}
