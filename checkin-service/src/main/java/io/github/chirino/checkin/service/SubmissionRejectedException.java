package io.github.chirino.checkin.service;

import java.util.Map;

/**
 * A submission was refused by the pipeline. Carries a stable error code, the HTTP status the REST
 * layer answers with and a message that is safe to show to the submitter; it never contains the
 * pattern or keyword that triggered the rejection.
 */
public class SubmissionRejectedException extends RuntimeException {

    public static final String VALIDATION_ERROR = "validation_error";
    public static final String DUPLICATE_CONTENT = "duplicate_content";
    public static final String BOT_DETECTED = "bot_detected";
    public static final String UNSAFE_CONTENT = "unsafe_content";
    public static final String BLOCKED = "blocked";
    public static final String RATE_LIMITED = "rate_limited";
    public static final String REGION_BLOCKED = "region_blocked";
    public static final String ARCHIVE_REJECTED = "archive_rejected";

    private final String code;
    private final int httpStatus;
    private final Map<String, Object> details;

    public SubmissionRejectedException(String code, int httpStatus, String message) {
        this(code, httpStatus, message, Map.of(), null);
    }

    public SubmissionRejectedException(
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

    public static SubmissionRejectedException validation(String message) {
        return new SubmissionRejectedException(VALIDATION_ERROR, 400, message);
    }

    public static SubmissionRejectedException rateLimited(long retryAfterSeconds) {
        return new SubmissionRejectedException(
                RATE_LIMITED,
                429,
                "Too many submissions, please try again in " + retryAfterSeconds + " seconds",
                Map.of("retryAfterSeconds", retryAfterSeconds),
                null);
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

    /** Seconds the client should wait, or {@code -1} when not rate limited. */
    public long getRetryAfterSeconds() {
        Object value = details.get("retryAfterSeconds");
        return value instanceof Number n ? n.longValue() : -1;
    }
}
