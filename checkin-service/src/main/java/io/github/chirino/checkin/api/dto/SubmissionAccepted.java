package io.github.chirino.checkin.api.dto;

import io.github.chirino.checkin.model.ModerationStatus;
import io.github.chirino.checkin.model.Submission;

/** Response to a successful submission. {@code pendingReview} tells the client it is not live. */
public record SubmissionAccepted(long id, String status, boolean pendingReview, String message) {

    public static SubmissionAccepted from(Submission submission) {
        boolean pending = submission.status() == ModerationStatus.PENDING;
        return new SubmissionAccepted(
                submission.id(),
                submission.status().value(),
                pending,
                pending ? "Submitted, waiting for review" : "Submitted");
    }
}
