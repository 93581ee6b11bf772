package io.github.chirino.checkin.storage;

import io.github.chirino.checkin.model.FileNames;
import java.io.InputStream;
import java.util.Set;

/** Stores image and video attachments under {@code yyyy-MM/<uuid><ext>}. */
public class MediaStore {

    public static final Set<String> IMAGE_EXTENSIONS =
            Set.of(".jpg", ".jpeg", ".png", ".gif", ".webp");
    public static final Set<String> VIDEO_EXTENSIONS = Set.of(".mp4", ".webm", ".mov", ".avi");

    public static final String UNSUPPORTED_TYPE = "unsupported_media_type";

    private final UploadStorage storage;
    private final long maxSize;

    public MediaStore(UploadStorage storage, long maxSize) {
        this.storage = storage;
        this.maxSize = maxSize;
    }

    public static boolean isSupported(String filename) {
        String ext = FileNames.extension(filename);
        return IMAGE_EXTENSIONS.contains(ext) || VIDEO_EXTENSIONS.contains(ext);
    }

    public static boolean isVideo(String filename) {
        return VIDEO_EXTENSIONS.contains(FileNames.extension(filename));
    }

    /**
     * Stores one attachment.
     *
     * @throws StorageException {@code unsupported_media_type} (400) for other file types, {@code
     *     file_too_large} (413) past the size limit
     */
    public StoredFile store(String originalFilename, InputStream data) {
        if (!isSupported(originalFilename)) {
            throw new StorageException(UNSUPPORTED_TYPE, 400, "Unsupported file type");
        }
        String relative =
                storage.currentMonth()
                        + "/"
                        + UploadStorage.randomName(FileNames.extension(originalFilename));
        return storage.store(data, maxSize, relative);
    }

    public void delete(StoredFile file) {
        if (file != null) {
            storage.delete(file.relativePath());
        }
    }

    public long maxSize() {
        return maxSize;
    }
}
