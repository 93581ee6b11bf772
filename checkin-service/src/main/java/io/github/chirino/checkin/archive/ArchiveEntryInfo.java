package io.github.chirino.checkin.archive;

/**
 * One entry as listed by the container. {@code declaredSize} is the uncompressed size the archive
 * claims, or {@code -1} when it does not say.
 */
public record ArchiveEntryInfo(String path, long declaredSize, boolean directory) {}
