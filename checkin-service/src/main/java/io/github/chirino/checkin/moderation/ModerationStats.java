package io.github.chirino.checkin.moderation;

public record ModerationStats(long total, long approved, long pending, long banned) {}
