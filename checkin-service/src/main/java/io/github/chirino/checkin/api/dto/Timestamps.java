package io.github.chirino.checkin.api.dto;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

final class Timestamps {

    private static final DateTimeFormatter ISO_FORMATTER = DateTimeFormatter.ISO_OFFSET_DATE_TIME;

    private Timestamps() {}

    static String format(Instant instant) {
        return instant == null ? null : ISO_FORMATTER.format(instant.atOffset(ZoneOffset.UTC));
    }
}
