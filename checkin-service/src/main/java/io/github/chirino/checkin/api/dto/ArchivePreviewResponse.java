package io.github.chirino.checkin.api.dto;

import io.github.chirino.checkin.archive.ArchivePreview;
import java.util.List;

public record ArchivePreviewResponse(int imageCount, int totalFiles, List<Thumbnail> thumbnails) {

    public record Thumbnail(String path, String name, String thumbnail) {}

    public static ArchivePreviewResponse from(ArchivePreview preview) {
        return new ArchivePreviewResponse(
                preview.imageCount(),
                preview.totalFiles(),
                preview.thumbnails().stream()
                        .map(t -> new Thumbnail(t.path(), t.name(), t.dataUri()))
                        .toList());
    }
}
