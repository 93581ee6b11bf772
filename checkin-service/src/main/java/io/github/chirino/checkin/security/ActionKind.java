package io.github.chirino.checkin.security;

/** Classifies a request for rate limiting. Only {@link #WRITE} actions are throttled. */
public enum ActionKind {
    READ,
    WRITE
}
