package io.github.chirino.checkin.model;

/**
 * An image picked from an archive for preview.
 *
 * @param path path of the entry inside the archive
 * @param data raw bytes of the entry, already checked to decode as an image
 * @param rank 1-based position in the preview selection
 */
public record PreviewImage(String path, byte[] data, int rank) {

    public String extension() {
        return FileNames.extension(path);
    }
}
