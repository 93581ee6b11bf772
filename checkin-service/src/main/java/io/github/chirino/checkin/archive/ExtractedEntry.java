package io.github.chirino.checkin.archive;

/**
 * Decompressed entry data. {@code safeName} is the entry's base file name with every directory
 * component removed; {@code path} is the original in-archive path.
 */
public record ExtractedEntry(String path, String safeName, byte[] data) {}
