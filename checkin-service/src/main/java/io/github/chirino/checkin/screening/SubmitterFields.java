package io.github.chirino.checkin.screening;

/** Normalized submitter-supplied fields; optional contact fields are {@code null} when absent. */
public record SubmitterFields(
        String content, String nickname, String email, String qq, String url, String avatar) {

    public boolean hasContactInfo() {
        return email != null || qq != null || url != null;
    }
}
