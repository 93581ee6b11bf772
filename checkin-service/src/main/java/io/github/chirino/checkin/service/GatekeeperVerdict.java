package io.github.chirino.checkin.service;

import io.github.chirino.checkin.screening.SubmitterFields;

/**
 * Outcome of a submission that passed every gatekeeper check.
 *
 * @param fingerprint the validated submitter fingerprint, or {@code null} when none was sent
 * @param nicknameFlagged the display name looks like a known bot template; the submission is
 *     accepted but held for review
 */
public record GatekeeperVerdict(
        SubmitterFields fields, String region, String fingerprint, boolean nicknameFlagged) {}
