package io.github.chirino.checkin.api.dto;

import io.github.chirino.checkin.model.ArchiveMetadata;
import java.util.List;

public record ArchiveView(
        String filename, long size, int totalFiles, int imageCount, List<String> previewImages) {

    public static ArchiveView from(ArchiveMetadata metadata) {
        if (metadata == null) {
            return null;
        }
        return new ArchiveView(
                metadata.filename(),
                metadata.size(),
                metadata.totalFiles(),
                metadata.imageCount(),
                metadata.previewImages());
    }
}
