package io.github.chirino.checkin.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;

class SubmissionFilterTest {

    @Test
    void like_pattern_escapes_wildcards_and_lowercases() {
        assertEquals("%abc%", SubmissionFilter.likePattern("AbC"));
        assertEquals("%100!%!_off!!%", SubmissionFilter.likePattern("100%_off!"));
    }

    @Test
    void blank_terms_are_dropped() {
        SubmissionFilter filter = new SubmissionFilter("  ", " a@b.cn ", "", null, -1);

        assertNull(filter.nickname());
        assertEquals("a@b.cn", filter.email());
        assertNull(filter.contentKeyword());
        assertEquals(0, filter.minContentLength());
        assertFalse(filter.isEmpty());
        assertTrue(SubmissionFilter.NONE.isEmpty());
        assertTrue(new SubmissionQuery(null, 1, 20, null, false, null).filter().isEmpty());
    }

    @Test
    void content_length_counts_characters_not_chars() {
        SubmissionFilter filter = new SubmissionFilter(null, null, null, null, 3);

        assertTrue(filter.matches(submission("😀😀😀", "nick")));
        assertFalse(filter.matches(submission("ab", "nick")));
    }

    private static Submission submission(String content, String nickname) {
        return new Submission(
                1L, content, List.of(), "198.51.100.1", "XX", null, nickname, null,
                null, null, null, 0, Instant.EPOCH, ModerationStatus.APPROVED, null,
                null, null);
    }
}
