package io.github.chirino.checkin.model;

import java.util.Locale;

/** Approval lifecycle of a submission. {@link #BANNED} is terminal. */
public enum ModerationStatus {
    PENDING,
    APPROVED,
    BANNED;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isTerminal() {
        return this == BANNED;
    }

    public static ModerationStatus fromValue(String value) {
        if (value == null) {
            return PENDING;
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
