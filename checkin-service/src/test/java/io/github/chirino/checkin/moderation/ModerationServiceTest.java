package io.github.chirino.checkin.moderation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import io.github.chirino.checkin.MutableClock;
import io.github.chirino.checkin.model.ModerationStatus;
import io.github.chirino.checkin.model.NewSubmission;
import io.github.chirino.checkin.model.Page;
import io.github.chirino.checkin.model.Submission;
import io.github.chirino.checkin.security.BlocklistStore;
import io.github.chirino.checkin.security.IpRangeClassifier;
import io.github.chirino.checkin.security.RegionRangeTable;
import io.github.chirino.checkin.service.SubmissionRejectedException;
import io.github.chirino.checkin.storage.StorageException;
import io.github.chirino.checkin.store.ResourceNotFoundException;
import io.github.chirino.checkin.store.SubmissionStore;
import io.github.chirino.checkin.store.impl.InMemorySubmissionStore;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ModerationServiceTest {

    @TempDir Path dir;

    private MutableClock clock;
    private InMemorySubmissionStore store;
    private BlocklistStore blocklist;
    private IpRangeClassifier classifier;
    private ModerationService service;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-05-01T10:00:00Z");
        store = new InMemorySubmissionStore();
        blocklist = new BlocklistStore(dir.resolve("blacklist.txt"));
        classifier = new IpRangeClassifier(RegionRangeTable.defaultTable(), Optional.empty());
        service =
                new ModerationService(
                        store, blocklist, classifier, new ModerationAuditLogger(), clock);
    }

    @Test
    void approving_moves_a_submission_from_pending_to_the_public_listing() {
        Submission pending = create(ModerationStatus.PENDING, "198.51.100.1", null);
        assertEquals(1, service.pending(1, 20).total());

        clock.advanceSeconds(60);
        Submission approved = service.approve(pending.id());

        assertEquals(ModerationStatus.APPROVED, approved.status());
        assertEquals(clock.instant(), approved.moderatedAt());
        assertEquals(0, service.pending(1, 20).total());
        assertEquals(
                List.of(pending.id()),
                ids(service.list(Optional.of(ModerationStatus.APPROVED), 1, 20)));
    }

    @Test
    void approving_an_approved_submission_changes_nothing() {
        Submission approved = create(ModerationStatus.APPROVED, "198.51.100.1", null);

        Submission again = service.approve(approved.id());

        assertEquals(approved, again);
        assertNull(again.moderatedAt());
    }

    @Test
    void reject_hides_without_blocklisting() {
        Submission s = create(ModerationStatus.APPROVED, "198.51.100.1", "fp-1");

        Submission rejected = service.reject(s.id());

        assertEquals(ModerationStatus.BANNED, rejected.status());
        assertEquals(ModerationService.REASON_REJECTED, rejected.moderationReason());
        assertEquals(0, blocklist.size());
    }

    @Test
    void ban_blocklists_the_fingerprint_when_present() {
        Submission s = create(ModerationStatus.PENDING, "198.51.100.1", "fp-abc");

        Submission banned = service.ban(s.id());

        assertEquals(ModerationStatus.BANNED, banned.status());
        assertEquals(ModerationService.REASON_BANNED, banned.moderationReason());
        assertTrue(blocklist.isBlocked("fp-abc"));
        assertFalse(blocklist.isBlocked("198.51.100.1"));
    }

    @Test
    void ban_falls_back_to_the_ip_and_persists_it() throws Exception {
        Submission s = create(ModerationStatus.APPROVED, "198.51.100.7", "  ");

        service.ban(s.id());

        assertTrue(blocklist.isBlocked("198.51.100.7"));
        assertTrue(
                Files.readAllLines(dir.resolve("blacklist.txt")).contains("198.51.100.7"));
    }

    @Test
    void ban_never_blocklists_local_addresses() {
        Submission s = create(ModerationStatus.PENDING, "127.0.0.1", null);

        Submission banned = service.ban(s.id());

        assertEquals(ModerationStatus.BANNED, banned.status());
        assertEquals(0, blocklist.size());
    }

    @Test
    void unusable_fingerprint_falls_back_to_the_ip() {
        Submission s = create(ModerationStatus.APPROVED, "198.51.100.7", "#evader");

        Submission banned = service.ban(s.id());

        assertEquals(ModerationStatus.BANNED, banned.status());
        assertTrue(blocklist.isBlocked("198.51.100.7"));
        assertFalse(blocklist.isBlocked("#evader"));
        assertEquals(1, blocklist.size());
    }

    @Test
    void failed_blocklist_write_leaves_the_submission_untouched() throws Exception {
        Path unwritable = Files.createDirectories(dir.resolve("locked"));
        BlocklistStore broken = new BlocklistStore(unwritable);
        ModerationService failing =
                new ModerationService(
                        store, broken, classifier, new ModerationAuditLogger(), clock);
        Submission s = create(ModerationStatus.APPROVED, "198.51.100.8", null);

        StorageException e = assertThrows(StorageException.class, () -> failing.ban(s.id()));

        assertEquals(StorageException.STORAGE_ERROR, e.getCode());
        assertEquals(ModerationStatus.APPROVED, store.findById(s.id()).get().status());

        Submission banned = service.ban(s.id());

        assertEquals(ModerationStatus.BANNED, banned.status());
        assertTrue(blocklist.isBlocked("198.51.100.8"));
    }

    @Test
    void banned_is_terminal() {
        Submission s = create(ModerationStatus.PENDING, "198.51.100.1", null);
        service.reject(s.id());

        IllegalModerationTransitionException e =
                assertThrows(
                        IllegalModerationTransitionException.class,
                        () -> service.approve(s.id()));
        assertEquals(ModerationStatus.BANNED, e.getFrom());
        assertEquals(ModerationStatus.APPROVED, e.getTo());
        assertThrows(IllegalModerationTransitionException.class, () -> service.ban(s.id()));
        assertEquals(0, blocklist.size());
    }

    @Test
    void unknown_submission_is_not_found() {
        assertThrows(ResourceNotFoundException.class, () -> service.approve(404));
        assertThrows(ResourceNotFoundException.class, () -> service.reject(404));
        assertThrows(ResourceNotFoundException.class, () -> service.ban(404));
    }

    @Test
    void batch_operations_count_only_successful_transitions() {
        Submission a = create(ModerationStatus.PENDING, "198.51.100.1", null);
        Submission b = create(ModerationStatus.PENDING, "198.51.100.2", null);
        Submission c = create(ModerationStatus.BANNED, "198.51.100.3", null);

        BatchResult approved =
                service.batchApprove(Arrays.asList(a.id(), a.id(), b.id(), c.id(), 999L, null));

        assertEquals(2, approved.succeeded());
        assertEquals(5, approved.requested());
        assertEquals(ModerationStatus.APPROVED, store.findById(b.id()).get().status());

        BatchResult rejected = service.batchReject(List.of(a.id(), c.id()));

        assertEquals(1, rejected.succeeded());
        assertEquals(2, rejected.requested());
    }

    @Test
    void batch_without_ids_is_a_validation_error() {
        SubmissionRejectedException e =
                assertThrows(SubmissionRejectedException.class, () -> service.batchReject(null));

        assertEquals(SubmissionRejectedException.VALIDATION_ERROR, e.getCode());
        assertEquals(400, e.getHttpStatus());
        assertThrows(SubmissionRejectedException.class, () -> service.batchApprove(List.of()));
    }

    @Test
    void stats_count_each_status() {
        create(ModerationStatus.PENDING, "198.51.100.1", null);
        create(ModerationStatus.APPROVED, "198.51.100.2", null);
        create(ModerationStatus.APPROVED, "198.51.100.3", null);
        create(ModerationStatus.BANNED, "198.51.100.4", null);

        assertEquals(new ModerationStats(4, 2, 1, 1), service.stats());
    }

    @Test
    void concurrent_change_is_reported_as_a_conflict() {
        SubmissionStore racing = mock(SubmissionStore.class);
        Submission pending = submission(ModerationStatus.PENDING);
        Submission bannedMeanwhile = submission(ModerationStatus.BANNED);
        when(racing.findById(7L))
                .thenReturn(Optional.of(pending))
                .thenReturn(Optional.of(bannedMeanwhile));
        when(racing.compareAndSetStatus(anyLong(), any(), any(), any(), any()))
                .thenReturn(Optional.empty());
        ModerationService contested =
                new ModerationService(
                        racing, blocklist, classifier, new ModerationAuditLogger(), clock);

        IllegalModerationTransitionException e =
                assertThrows(
                        IllegalModerationTransitionException.class, () -> contested.approve(7));

        assertEquals(ModerationStatus.BANNED, e.getFrom());
    }

    @Test
    void lost_race_is_retried_against_the_new_status() {
        SubmissionStore racing = mock(SubmissionStore.class);
        Submission pending = submission(ModerationStatus.PENDING);
        Submission approvedMeanwhile = submission(ModerationStatus.APPROVED);
        Submission banned =
                approvedMeanwhile.withStatus(ModerationStatus.BANNED, "rejected", null);
        when(racing.findById(7L))
                .thenReturn(Optional.of(pending))
                .thenReturn(Optional.of(approvedMeanwhile));
        when(racing.compareAndSetStatus(
                        eq(7L), eq(ModerationStatus.PENDING), any(), any(), any()))
                .thenReturn(Optional.empty());
        when(racing.compareAndSetStatus(
                        eq(7L), eq(ModerationStatus.APPROVED), any(), any(), any()))
                .thenReturn(Optional.of(banned));
        ModerationService contested =
                new ModerationService(
                        racing, blocklist, classifier, new ModerationAuditLogger(), clock);

        assertSame(banned, contested.reject(7));
    }

    @Test
    void transition_table() {
        ModerationStatus pending = ModerationStatus.PENDING;
        ModerationStatus approved = ModerationStatus.APPROVED;
        ModerationStatus banned = ModerationStatus.BANNED;

        assertTrue(ModerationService.isAllowed(pending, approved));
        assertTrue(ModerationService.isAllowed(pending, banned));
        assertTrue(ModerationService.isAllowed(approved, banned));
        assertFalse(ModerationService.isAllowed(approved, pending));
        assertFalse(ModerationService.isAllowed(banned, approved));
        assertFalse(ModerationService.isAllowed(banned, pending));
    }

    private Submission create(ModerationStatus status, String ip, String fingerprint) {
        return store.create(
                new NewSubmission(
                        "hello",
                        List.of(),
                        ip,
                        "XX",
                        fingerprint,
                        "nick",
                        null,
                        null,
                        null,
                        null,
                        clock.instant(),
                        status,
                        null,
                        null));
    }

    private static Submission submission(ModerationStatus status) {
        return new Submission(
                7L, "hello", List.of(), "198.51.100.1", "XX", null, "nick", null, null, null,
                null, 0, Instant.parse("2024-05-01T10:00:00Z"), status, null, null, null);
    }

    private static List<Long> ids(Page<Submission> page) {
        return page.items().stream().map(Submission::id).toList();
    }
}
