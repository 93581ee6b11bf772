package io.github.chirino.checkin.moderation;

import io.github.chirino.checkin.model.ModerationStatus;
import java.util.List;

/** Initial status of a new submission and why it is held, if it is. */
public record ModerationVerdict(ModerationStatus status, List<String> reasons) {

    public static final String CONTACT_INFO = "contact_info";
    public static final String NO_MEDIA = "no_media";
    public static final String NICKNAME_PATTERN = "nickname_pattern";

    public ModerationVerdict {
        reasons = List.copyOf(reasons);
    }

    /** Reasons joined with commas, or {@code null} when there are none. */
    public String reasonText() {
        return reasons.isEmpty() ? null : String.join(",", reasons);
    }
}
