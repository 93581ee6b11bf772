package io.github.chirino.checkin.moderation;

import io.github.chirino.checkin.model.ModerationStatus;

public class IllegalModerationTransitionException extends RuntimeException {

    private final long submissionId;
    private final ModerationStatus from;
    private final ModerationStatus to;

    public IllegalModerationTransitionException(
            long submissionId, ModerationStatus from, ModerationStatus to) {
        super(
                "Submission "
                        + submissionId
                        + " cannot move from "
                        + from.value()
                        + " to "
                        + to.value());
        this.submissionId = submissionId;
        this.from = from;
        this.to = to;
    }

    public long getSubmissionId() {
        return submissionId;
    }

    public ModerationStatus getFrom() {
        return from;
    }

    public ModerationStatus getTo() {
        return to;
    }
}
