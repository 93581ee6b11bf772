package io.github.chirino.checkin.moderation;

import io.github.chirino.checkin.model.ModerationStatus;
import io.github.chirino.checkin.screening.SubmitterFields;
import java.util.ArrayList;
import java.util.List;

/**
 * Decides whether a submission that passed the gatekeeper publishes immediately. Contact details,
 * missing media and a bot-like nickname each hold it for human review.
 */
public class AutoModerator {

    public ModerationVerdict decide(
            SubmitterFields fields, boolean hasMedia, boolean nicknameFlagged) {
        List<String> reasons = new ArrayList<>();
        if (fields.hasContactInfo()) {
            reasons.add(ModerationVerdict.CONTACT_INFO);
        }
        if (!hasMedia) {
            reasons.add(ModerationVerdict.NO_MEDIA);
        }
        if (nicknameFlagged) {
            reasons.add(ModerationVerdict.NICKNAME_PATTERN);
        }
        ModerationStatus status =
                reasons.isEmpty() ? ModerationStatus.APPROVED : ModerationStatus.PENDING;
        return new ModerationVerdict(status, reasons);
    }
}
