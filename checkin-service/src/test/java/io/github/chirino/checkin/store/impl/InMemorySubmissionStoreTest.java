package io.github.chirino.checkin.store.impl;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.chirino.checkin.model.LikeResult;
import io.github.chirino.checkin.model.ModerationStatus;
import io.github.chirino.checkin.model.NewSubmission;
import io.github.chirino.checkin.model.Page;
import io.github.chirino.checkin.model.Submission;
import io.github.chirino.checkin.model.SubmissionFilter;
import io.github.chirino.checkin.model.SubmissionQuery;
import io.github.chirino.checkin.store.ResourceNotFoundException;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class InMemorySubmissionStoreTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    private final InMemorySubmissionStore store = new InMemorySubmissionStore();

    @Test
    void create_assigns_increasing_ids_and_zero_likes() {
        Submission first = store.create(submission("one", ModerationStatus.APPROVED));
        Submission second = store.create(submission("two", ModerationStatus.PENDING));

        assertEquals(1L, first.id());
        assertEquals(2L, second.id());
        assertEquals(0, first.likes());
        assertNull(first.moderatedAt());
        assertEquals(Optional.of(second), store.findById(2));
        assertTrue(store.findById(3).isEmpty());
    }

    @Test
    void public_listing_only_shows_approved_newest_first() {
        store.create(submission("a", ModerationStatus.APPROVED));
        store.create(submission("b", ModerationStatus.PENDING));
        store.create(submission("c", ModerationStatus.APPROVED));
        store.create(submission("d", ModerationStatus.BANNED));

        Page<Submission> page = store.list(SubmissionQuery.publicListing(1, 20, null, null));

        assertEquals(2, page.total());
        assertEquals(List.of("c", "a"), contents(page));
    }

    @Test
    void listing_paginates_and_sorts_by_likes() {
        for (int i = 0; i < 5; i++) {
            store.create(submission("s" + i, ModerationStatus.APPROVED));
        }
        store.addLike(2, "10.0.0.1");
        store.addLike(2, "10.0.0.2");
        store.addLike(4, "10.0.0.1");

        Page<Submission> byLikes = store.list(SubmissionQuery.publicListing(1, 2, "likes", "desc"));
        assertEquals(List.of("s1", "s3"), contents(byLikes));
        assertEquals(5, byLikes.total());
        assertEquals(3, byLikes.totalPages());

        Page<Submission> last = store.list(SubmissionQuery.publicListing(3, 2, "id", "asc"));
        assertEquals(List.of("s4"), contents(last));

        Page<Submission> beyond = store.list(SubmissionQuery.publicListing(9, 2, "id", "asc"));
        assertTrue(beyond.items().isEmpty());
    }

    @Test
    void listing_applies_search_filters() {
        store.create(submission("Morning run done", "Alice", "a@example.com"));
        store.create(submission("evening RUN", "alicia", null));
        store.create(submission("run", "用户0721", null));
        store.create(submission("swim 100% effort", "bob", "b@example.com"));

        assertEquals(
                List.of("evening RUN", "Morning run done"),
                contents(search(new SubmissionFilter("ALI", null, null, null, 0))));
        assertEquals(
                List.of("swim 100% effort"),
                contents(search(new SubmissionFilter(null, "b@example.com", null, null, 0))));
        assertEquals(
                List.of("run", "evening RUN", "Morning run done"),
                contents(search(new SubmissionFilter(null, null, "run", null, 0))));
        assertEquals(
                List.of("evening RUN", "Morning run done"),
                contents(search(new SubmissionFilter(null, null, "run", "用户0721", 0))));
        assertEquals(
                List.of("swim 100% effort", "Morning run done"),
                contents(search(new SubmissionFilter(null, null, null, null, 12))));
        assertEquals(
                List.of("swim 100% effort"),
                contents(search(new SubmissionFilter(null, null, "%", null, 0))));
        assertEquals(4, search(new SubmissionFilter(" ", "", null, null, -3)).total());
    }

    @Test
    void compare_and_set_only_applies_from_the_expected_status() {
        Submission s = store.create(submission("x", ModerationStatus.PENDING));

        Optional<Submission> approved =
                store.compareAndSetStatus(
                        s.id(), ModerationStatus.PENDING, ModerationStatus.APPROVED, null, NOW);
        Optional<Submission> stale =
                store.compareAndSetStatus(
                        s.id(), ModerationStatus.PENDING, ModerationStatus.BANNED, "banned", NOW);

        assertTrue(approved.isPresent());
        assertEquals(NOW, approved.get().moderatedAt());
        assertTrue(stale.isEmpty());
        assertEquals(ModerationStatus.APPROVED, store.findById(s.id()).get().status());
        assertTrue(
                store.compareAndSetStatus(
                                99, ModerationStatus.PENDING, ModerationStatus.APPROVED, null, NOW)
                        .isEmpty());
    }

    @Test
    void counts_every_status() {
        store.create(submission("a", ModerationStatus.APPROVED));
        store.create(submission("b", ModerationStatus.PENDING));
        store.create(submission("c", ModerationStatus.PENDING));

        Map<ModerationStatus, Long> counts = store.countByStatus();

        assertEquals(1L, counts.get(ModerationStatus.APPROVED));
        assertEquals(2L, counts.get(ModerationStatus.PENDING));
        assertEquals(0L, counts.get(ModerationStatus.BANNED));
    }

    @Test
    void one_like_per_address() {
        Submission s = store.create(submission("x", ModerationStatus.APPROVED));

        LikeResult first = store.addLike(s.id(), "10.0.0.1");
        LikeResult again = store.addLike(s.id(), "10.0.0.1");
        LikeResult other = store.addLike(s.id(), "10.0.0.2");

        assertTrue(first.liked());
        assertEquals(1, first.likes());
        assertFalse(again.liked());
        assertTrue(again.alreadyLiked());
        assertEquals(1, again.likes());
        assertEquals(2, other.likes());
        assertThrows(ResourceNotFoundException.class, () -> store.addLike(42, "10.0.0.1"));
    }

    private Page<Submission> search(SubmissionFilter filter) {
        return store.list(SubmissionQuery.publicListing(1, 20, "id", "desc", filter));
    }

    private static List<String> contents(Page<Submission> page) {
        return page.items().stream().map(Submission::content).toList();
    }

    private static NewSubmission submission(String content, ModerationStatus status) {
        return submission(content, status, "nick", null);
    }

    private static NewSubmission submission(String content, String nickname, String email) {
        return submission(content, ModerationStatus.APPROVED, nickname, email);
    }

    private static NewSubmission submission(
            String content, ModerationStatus status, String nickname, String email) {
        return new NewSubmission(
                content,
                List.of(),
                "203.0.113.7",
                "XX",
                null,
                nickname,
                email,
                null,
                null,
                null,
                NOW,
                status,
                null,
                null);
    }
}
