package io.github.chirino.checkin.model;

import java.time.Instant;
import java.util.List;

/** Everything needed to persist a submission that passed the gatekeeper. */
public record NewSubmission(
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
        Instant createdAt,
        ModerationStatus status,
        String moderationReason,
        ArchiveMetadata archive) {

    public NewSubmission {
        mediaFiles = mediaFiles == null ? List.of() : List.copyOf(mediaFiles);
    }
}
