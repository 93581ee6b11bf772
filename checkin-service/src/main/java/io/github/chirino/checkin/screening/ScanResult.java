package io.github.chirino.checkin.screening;

/**
 * Outcome of a content scan. The category is for logs and metrics; {@link #reason()} is the only
 * text meant for the submitter and never includes what matched.
 */
public record ScanResult(boolean safe, Category category) {

    public enum Category {
        MARKUP,
        QUERY_INJECTION,
        SPAM_KEYWORD,
        NICKNAME_PATTERN
    }

    private static final ScanResult SAFE = new ScanResult(true, null);

    public static ScanResult safeResult() {
        return SAFE;
    }

    public static ScanResult unsafe(Category category) {
        return new ScanResult(false, category);
    }

    public String reason() {
        return safe ? "" : "Submission contains content that is not allowed";
    }
}
