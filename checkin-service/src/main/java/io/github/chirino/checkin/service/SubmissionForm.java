package io.github.chirino.checkin.service;

/**
 * The text fields of an inbound submission as the client sent them.
 *
 * @param honeypot the decoy field; real visitors leave it empty
 * @param issuedAt epoch seconds at which the form was rendered, possibly fractional
 * @param ipAddress the caller's address as resolved by the HTTP layer
 */
public record SubmissionForm(
        String content,
        String nickname,
        String email,
        String qq,
        String url,
        String avatar,
        String honeypot,
        String issuedAt,
        String fingerprint,
        String ipAddress) {

    public String fingerprintOrNull() {
        return fingerprint == null || fingerprint.isBlank() ? null : fingerprint.trim();
    }
}
