package io.github.chirino.checkin.api.dto;

import io.github.chirino.checkin.model.Submission;
import java.util.List;

public record AdminSubmissionView(
        long id,
        String content,
        List<String> mediaFiles,
        String ipAddress,
        String region,
        String fingerprint,
        String nickname,
        String email,
        String qq,
        String url,
        String avatar,
        int likes,
        String createdAt,
        String status,
        String moderationReason,
        String moderatedAt,
        ArchiveView archive) {

    public static AdminSubmissionView from(Submission s) {
        return new AdminSubmissionView(
                s.id(),
                s.content(),
                s.mediaFiles(),
                s.ipAddress(),
                s.region(),
                s.fingerprint(),
                s.nickname(),
                s.email(),
                s.qq(),
                s.url(),
                s.avatar(),
                s.likes(),
                Timestamps.format(s.createdAt()),
                s.status().value(),
                s.moderationReason(),
                Timestamps.format(s.moderatedAt()),
                ArchiveView.from(s.archive()));
    }
}
