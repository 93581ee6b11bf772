package io.github.chirino.checkin.moderation;

import io.github.chirino.checkin.model.ModerationStatus;
import org.jboss.logging.Logger;

/** Writes every administrative moderation action to a dedicated audit category. */
public class ModerationAuditLogger {

    public static final String CATEGORY = "io.github.chirino.checkin.moderation.audit";

    private static final Logger AUDIT = Logger.getLogger(CATEGORY);

    public void logTransition(
            String action, long submissionId, ModerationStatus from, ModerationStatus to) {
        AUDIT.infof(
                "MODERATION action=%s target=%d from=%s to=%s",
                action, submissionId, from.value(), to.value());
    }

    public void logBlocklisted(long submissionId, String identifierKind) {
        AUDIT.infof(
                "MODERATION action=blocklist target=%d identifier=%s",
                submissionId, identifierKind);
    }

    public void logBatch(String action, int requested, int succeeded) {
        AUDIT.infof(
                "MODERATION action=%s requested=%d succeeded=%d", action, requested, succeeded);
    }
}
