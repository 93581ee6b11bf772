package io.github.chirino.checkin.archive;

/** An uploaded archive failed screening. The message is safe to return to the submitter. */
public class ArchiveRejectedException extends RuntimeException {

    public static final String UNSUPPORTED_FORMAT = "unsupported_format";
    public static final String TOO_MANY_ENTRIES = "too_many_entries";
    public static final String DANGEROUS_ENTRY = "dangerous_entry";
    public static final String TOO_LARGE = "too_large";
    public static final String CORRUPT = "corrupt";
    public static final String TIMEOUT = "timeout";
    public static final String ENTRY_NOT_FOUND = "entry_not_found";
    public static final String BUSY = "server_busy";

    private final String reason;
    private final int httpStatus;

    public ArchiveRejectedException(String reason, String message) {
        this(reason, TOO_LARGE.equals(reason) ? 413 : 400, message, null);
    }

    public ArchiveRejectedException(
            String reason, int httpStatus, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
        this.httpStatus = httpStatus;
    }

    public static ArchiveRejectedException corrupt(Throwable cause) {
        return new ArchiveRejectedException(
                CORRUPT, 400, "Archive is corrupt or unreadable", cause);
    }

    public String getReason() {
        return reason;
    }

    public int getHttpStatus() {
        return httpStatus;
    }
}
