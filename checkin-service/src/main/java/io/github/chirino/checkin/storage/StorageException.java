package io.github.chirino.checkin.storage;

import java.util.Map;

/**
 * Raised when uploads, archives or the blocklist cannot be written or read. Carries an error
 * code, HTTP status and optional details so the REST layer can render it without branching on
 * types.
 */
public class StorageException extends RuntimeException {

    /** Upload exceeds the maximum allowed size. Suggested HTTP status: 413. */
    public static final String FILE_TOO_LARGE = "file_too_large";

    /** Generic storage error. Suggested HTTP status: 500. */
    public static final String STORAGE_ERROR = "storage_error";

    private final String code;
    private final int httpStatus;
    private final Map<String, Object> details;

    public StorageException(String code, int httpStatus, String message) {
        this(code, httpStatus, message, Map.of(), null);
    }

    public StorageException(
            String code,
            int httpStatus,
            String message,
            Map<String, Object> details,
            Throwable cause) {
        super(message, cause);
        this.code = code;
        this.httpStatus = httpStatus;
        this.details = details != null ? details : Map.of();
    }

    public static StorageException fileTooLarge(long maxBytes, long actualBytes) {
        return new StorageException(
                FILE_TOO_LARGE,
                413,
                "File too large: " + actualBytes + " bytes exceeds maximum of " + maxBytes,
                Map.of("maxBytes", maxBytes),
                null);
    }

    public static StorageException storageError(String message, Throwable cause) {
        return new StorageException(STORAGE_ERROR, 500, message, Map.of(), cause);
    }

    public String getCode() {
        return code;
    }

    public int getHttpStatus() {
        return httpStatus;
    }

    public Map<String, Object> getDetails() {
        return details;
    }
}
