package io.github.chirino.checkin.security;

public record RateLimitDecision(boolean allowed, long retryAfterSeconds) {

    private static final RateLimitDecision ALLOW = new RateLimitDecision(true, 0);

    public static RateLimitDecision allow() {
        return ALLOW;
    }

    public static RateLimitDecision deny(long retryAfterSeconds) {
        return new RateLimitDecision(false, Math.max(1, retryAfterSeconds));
    }
}
