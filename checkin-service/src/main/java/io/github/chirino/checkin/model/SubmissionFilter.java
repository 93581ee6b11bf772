package io.github.chirino.checkin.model;

import java.util.Locale;

/**
 * Search criteria of a listing. Nickname and content terms are case-insensitive substring
 * matches, {@code email} must match exactly. Blank terms are ignored.
 *
 * @param excludedNickname hides submissions posted under this nickname, typically the default one
 * @param minContentLength minimum number of characters of the content; 0 disables the check
 */
public record SubmissionFilter(
        String nickname,
        String email,
        String contentKeyword,
        String excludedNickname,
        int minContentLength) {

    public static final SubmissionFilter NONE = new SubmissionFilter(null, null, null, null, 0);

    /** Escape character used in the {@code like} patterns produced by {@link #likePattern}. */
    public static final char LIKE_ESCAPE = '!';

    public SubmissionFilter {
        nickname = blankToNull(nickname);
        email = blankToNull(email);
        contentKeyword = blankToNull(contentKeyword);
        excludedNickname = blankToNull(excludedNickname);
        minContentLength = Math.max(0, minContentLength);
    }

    public boolean isEmpty() {
        return nickname == null
                && email == null
                && contentKeyword == null
                && excludedNickname == null
                && minContentLength == 0;
    }

    public boolean matches(Submission s) {
        if (nickname != null && !containsIgnoreCase(s.nickname(), nickname)) {
            return false;
        }
        if (email != null && !email.equals(s.email())) {
            return false;
        }
        if (contentKeyword != null && !containsIgnoreCase(s.content(), contentKeyword)) {
            return false;
        }
        if (excludedNickname != null && excludedNickname.equals(s.nickname())) {
            return false;
        }
        String content = s.content() == null ? "" : s.content();
        return content.codePointCount(0, content.length()) >= minContentLength;
    }

    /**
     * A lower-cased {@code like} pattern matching {@code term} anywhere; wildcards in the term
     * match literally.
     */
    public static String likePattern(String term) {
        StringBuilder pattern = new StringBuilder("%");
        for (char c : term.toLowerCase(Locale.ROOT).toCharArray()) {
            if (c == '%' || c == '_' || c == LIKE_ESCAPE) {
                pattern.append(LIKE_ESCAPE);
            }
            pattern.append(c);
        }
        return pattern.append('%').toString();
    }

    private static boolean containsIgnoreCase(String value, String term) {
        return value != null
                && value.toLowerCase(Locale.ROOT).contains(term.toLowerCase(Locale.ROOT));
    }

    private static String blankToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.strip();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
