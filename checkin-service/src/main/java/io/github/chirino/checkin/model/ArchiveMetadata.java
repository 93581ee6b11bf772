package io.github.chirino.checkin.model;

import java.util.List;

/**
 * Facts about an archive attached to a submission. Immutable once attached.
 *
 * @param storageKey upload-relative key of the stored original archive
 */
public record ArchiveMetadata(
        String filename,
        long size,
        int totalFiles,
        int imageCount,
        List<String> previewImages,
        String storageKey) {

    public ArchiveMetadata {
        previewImages = previewImages == null ? List.of() : List.copyOf(previewImages);
    }
}
