package io.github.chirino.checkin.moderation;

public record BatchResult(int succeeded, int requested) {}
