package io.github.chirino.checkin.model;

import java.time.Instant;
import java.util.List;

/** A persisted check-in. Only {@link ModerationStatus#APPROVED} ones are publicly listed. */
public record Submission(
        Long id,
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
        Instant createdAt,
        ModerationStatus status,
        String moderationReason,
        Instant moderatedAt,
        ArchiveMetadata archive) {

    public Submission {
        mediaFiles = mediaFiles == null ? List.of() : List.copyOf(mediaFiles);
    }

    public boolean hasArchive() {
        return archive != null;
    }

    public Submission withStatus(ModerationStatus newStatus, String reason, Instant at) {
        return new Submission(
                id,
                content,
                mediaFiles,
                ipAddress,
                region,
                fingerprint,
                nickname,
                email,
                qq,
                url,
                avatar,
                likes,
                createdAt,
                newStatus,
                reason,
                at,
                archive);
    }

    public Submission withLikes(int newLikes) {
        return new Submission(
                id,
                content,
                mediaFiles,
                ipAddress,
                region,
                fingerprint,
                nickname,
                email,
                qq,
                url,
                avatar,
                newLikes,
                createdAt,
                status,
                moderationReason,
                moderatedAt,
                archive);
    }
}
