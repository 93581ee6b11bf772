package io.github.chirino.checkin.archive;

/** Inline JPEG thumbnail of one archive image. */
public record ArchiveThumbnail(String path, String name, String dataUri) {}
