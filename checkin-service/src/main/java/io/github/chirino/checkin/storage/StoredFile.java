package io.github.chirino.checkin.storage;

/** A file written below the upload root, addressed by its {@code /}-separated relative path. */
public record StoredFile(String relativePath, long size) {

    public static final String URL_PREFIX = "/uploads/";

    public String url() {
        return URL_PREFIX + relativePath;
    }
}
