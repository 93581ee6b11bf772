package io.github.chirino.checkin.screening;

import com.google.re2j.Pattern;
import io.github.chirino.checkin.security.BlocklistStore;
import io.github.chirino.checkin.service.SubmissionRejectedException;

/**
 * Validates and normalizes the free-form fields of a submission. Blank optional fields become
 * {@code null}; a blank nickname or avatar falls back to the defaults.
 */
public class SubmissionFieldValidator {

    public static final String DEFAULT_NICKNAME = "用户0721";
    public static final String DEFAULT_AVATAR = "🥰";

    static final int MAX_CONTENT_LENGTH = 10_000;
    static final int MAX_NICKNAME_LENGTH = 20;
    static final int MAX_EMAIL_LENGTH = 254;
    static final int MAX_URL_LENGTH = 2048;
    static final int MAX_AVATAR_LENGTH = 10;

    private static final Pattern EMAIL =
            Pattern.compile("^[a-zA-Z0-9._%+-]+@[a-zA-Z0-9.-]+\\.[a-zA-Z]{2,}$");
    private static final Pattern URL =
            Pattern.compile(
                    "^https?://[a-zA-Z0-9]([a-zA-Z0-9-]{0,61}[a-zA-Z0-9])?"
                            + "(\\.[a-zA-Z0-9]([a-zA-Z0-9-]{0,61}[a-zA-Z0-9])?)*(/.*)?$");
    private static final String FORBIDDEN_NICKNAME_CHARS = "<>&\"'\\/\n\r\t";

    public SubmitterFields validate(
            String content, String nickname, String email, String qq, String url, String avatar) {
        return new SubmitterFields(
                validateContent(content),
                validateNickname(nickname),
                validateEmail(email),
                validateQq(qq),
                validateUrl(url),
                validateAvatar(avatar));
    }

    String validateContent(String content) {
        String value = content == null ? "" : content.strip();
        if (value.isEmpty()) {
            throw SubmissionRejectedException.validation("Content must not be empty");
        }
        if (value.codePointCount(0, value.length()) > MAX_CONTENT_LENGTH) {
            throw SubmissionRejectedException.validation(
                    "Content must be at most " + MAX_CONTENT_LENGTH + " characters");
        }
        return value;
    }

    String validateNickname(String nickname) {
        String value = blankToNull(nickname);
        if (value == null) {
            return DEFAULT_NICKNAME;
        }
        if (value.codePointCount(0, value.length()) > MAX_NICKNAME_LENGTH) {
            throw SubmissionRejectedException.validation(
                    "Nickname must be at most " + MAX_NICKNAME_LENGTH + " characters");
        }
        for (int i = 0; i < value.length(); i++) {
            if (FORBIDDEN_NICKNAME_CHARS.indexOf(value.charAt(i)) >= 0) {
                throw SubmissionRejectedException.validation(
                        "Nickname contains a forbidden character");
            }
        }
        return value;
    }

    String validateEmail(String email) {
        String value = blankToNull(email);
        if (value == null) {
            return null;
        }
        if (value.length() > MAX_EMAIL_LENGTH) {
            throw SubmissionRejectedException.validation("Email address is too long");
        }
        if (!EMAIL.matcher(value).matches()) {
            throw SubmissionRejectedException.validation("Email address is not valid");
        }
        return value;
    }

    String validateQq(String qq) {
        String value = blankToNull(qq);
        if (value == null) {
            return null;
        }
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c < '0' || c > '9') {
                throw SubmissionRejectedException.validation("QQ number must be digits only");
            }
        }
        if (value.length() < 5 || value.length() > 11) {
            throw SubmissionRejectedException.validation("QQ number must have 5 to 11 digits");
        }
        return value;
    }

    String validateUrl(String url) {
        String value = blankToNull(url);
        if (value == null) {
            return null;
        }
        if (!value.startsWith("http://") && !value.startsWith("https://")) {
            throw SubmissionRejectedException.validation(
                    "URL must start with http:// or https://");
        }
        if (value.length() > MAX_URL_LENGTH) {
            throw SubmissionRejectedException.validation("URL is too long");
        }
        if (!URL.matcher(value).matches()) {
            throw SubmissionRejectedException.validation("URL is not valid");
        }
        return value;
    }

    String validateAvatar(String avatar) {
        if (avatar == null || avatar.isEmpty()) {
            return DEFAULT_AVATAR;
        }
        int codePoints = avatar.codePointCount(0, avatar.length());
        if (codePoints > MAX_AVATAR_LENGTH || !avatar.codePoints().allMatch(this::isEmojiPart)) {
            throw SubmissionRejectedException.validation("Avatar must be a single emoji");
        }
        return avatar;
    }

    /**
     * Validates the optional client fingerprint. It must be storable in the blocklist so that a
     * later ban can always record it.
     */
    public String validateFingerprint(String fingerprint) {
        if (fingerprint == null || fingerprint.isBlank()) {
            return null;
        }
        if (!BlocklistStore.isValidIdentifier(fingerprint)) {
            throw SubmissionRejectedException.validation("Fingerprint is not valid");
        }
        return fingerprint.trim();
    }

    private boolean isEmojiPart(int cp) {
        return (cp >= 0x1F300 && cp <= 0x1FAFF)
                || (cp >= 0x2600 && cp <= 0x27BF)
                || (cp >= 0x24C2 && cp <= 0x25FF)
                || (cp >= 0x1F000 && cp <= 0x1F2FF)
                || (cp >= 0x1F1E6 && cp <= 0x1F1FF)
                || (cp >= 0xE0020 && cp <= 0xE007F)
                // zero width joiner, variation selector-16, combining keycap
                || cp == 0x200D
                || cp == 0xFE0F
                || cp == 0x20E3;
    }

    private static String blankToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.strip();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
