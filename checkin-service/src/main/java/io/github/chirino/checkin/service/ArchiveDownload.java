package io.github.chirino.checkin.service;

import java.io.InputStream;

/** The stored original archive of a submission, opened for streaming. Callers close it. */
public record ArchiveDownload(String filename, long size, InputStream content) {}
