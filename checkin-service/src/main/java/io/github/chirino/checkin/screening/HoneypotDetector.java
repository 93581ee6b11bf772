package io.github.chirino.checkin.screening;

import java.time.Clock;
import java.time.Duration;

/**
 * Flags naive bots: a filled-in decoy field, or a form submitted faster than a human could type
 * or long after the form was issued. The form timestamp is epoch seconds (fractions allowed); a
 * missing or unparsable timestamp skips the timing check.
 */
public class HoneypotDetector {

    public enum Verdict {
        ALLOW,
        HONEYPOT_FILLED,
        TOO_FAST,
        STALE;

        public boolean allowed() {
            return this == ALLOW;
        }
    }

    private final Duration minElapsed;
    private final Duration maxElapsed;
    private final Clock clock;

    public HoneypotDetector(Duration minElapsed, Duration maxElapsed, Clock clock) {
        this.minElapsed = minElapsed;
        this.maxElapsed = maxElapsed;
        this.clock = clock;
    }

    public Verdict check(String honeypotValue, String issuedAt) {
        if (honeypotValue != null && !honeypotValue.strip().isEmpty()) {
            return Verdict.HONEYPOT_FILLED;
        }
        Double issuedSeconds = parseEpochSeconds(issuedAt);
        if (issuedSeconds == null) {
            return Verdict.ALLOW;
        }
        double elapsedMillis = clock.millis() - issuedSeconds * 1000.0;
        if (elapsedMillis < minElapsed.toMillis()) {
            return Verdict.TOO_FAST;
        }
        if (elapsedMillis > maxElapsed.toMillis()) {
            return Verdict.STALE;
        }
        return Verdict.ALLOW;
    }

    private static Double parseEpochSeconds(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            double parsed = Double.parseDouble(value.trim());
            return Double.isFinite(parsed) ? parsed : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
