package io.github.chirino.checkin.archive;

import java.util.List;

/** Result of previewing an archive without persisting it. */
public record ArchivePreview(int imageCount, int totalFiles, List<ArchiveThumbnail> thumbnails) {

    public ArchivePreview {
        thumbnails = List.copyOf(thumbnails);
    }
}
