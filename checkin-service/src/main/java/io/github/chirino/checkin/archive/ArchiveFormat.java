package io.github.chirino.checkin.archive;

import io.github.chirino.checkin.model.FileNames;
import java.util.Optional;

public enum ArchiveFormat {
    ZIP(".zip"),
    SEVEN_Z(".7z");

    private final String extension;

    ArchiveFormat(String extension) {
        this.extension = extension;
    }

    public String extension() {
        return extension;
    }

    public static Optional<ArchiveFormat> fromFilename(String filename) {
        String ext = FileNames.extension(filename);
        for (ArchiveFormat format : values()) {
            if (format.extension.equals(ext)) {
                return Optional.of(format);
            }
        }
        return Optional.empty();
    }

    public static boolean isArchive(String filename) {
        return fromFilename(filename).isPresent();
    }
}
