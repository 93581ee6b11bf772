package io.github.chirino.checkin.service;

import java.nio.file.Path;

/** An uploaded file already spooled to disk by the HTTP layer. */
public record Attachment(String filename, Path file, long size) {

    public boolean isEmpty() {
        return filename == null || filename.isBlank() || size <= 0;
    }
}
