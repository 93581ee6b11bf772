package io.github.chirino.checkin.api.dto;

import io.github.chirino.checkin.model.Submission;
import java.util.List;

/** Public representation. Contact fields and submitter addresses are never included. */
public record SubmissionView(
        long id,
        String content,
        List<String> mediaFiles,
        String nickname,
        String avatar,
        int likes,
        String createdAt,
        boolean hasArchive,
        ArchiveView archive) {

    public static SubmissionView from(Submission submission) {
        return new SubmissionView(
                submission.id(),
                submission.content(),
                submission.mediaFiles(),
                submission.nickname(),
                submission.avatar(),
                submission.likes(),
                Timestamps.format(submission.createdAt()),
                submission.hasArchive(),
                ArchiveView.from(submission.archive()));
    }
}
