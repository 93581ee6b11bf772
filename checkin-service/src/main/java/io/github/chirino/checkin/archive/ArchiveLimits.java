package io.github.chirino.checkin.archive;

import java.time.Duration;

/** Processing limits for uploaded archives beyond the structural ones of the validator. */
public record ArchiveLimits(
        long maxUploadSize,
        long maxEntrySize,
        int previewCount,
        int thumbnailSize,
        int fullImageSize,
        int maxThumbnails,
        Duration processingTimeout) {

    public static ArchiveLimits defaults() {
        return new ArchiveLimits(
                200L * 1024 * 1024, 50L * 1024 * 1024, 3, 200, 800, 50, Duration.ofSeconds(20));
    }
}
