package io.github.chirino.checkin.store.impl;

import io.github.chirino.checkin.model.LikeResult;
import io.github.chirino.checkin.model.ModerationStatus;
import io.github.chirino.checkin.model.NewSubmission;
import io.github.chirino.checkin.model.Page;
import io.github.chirino.checkin.model.Submission;
import io.github.chirino.checkin.model.SubmissionQuery;
import io.github.chirino.checkin.store.ResourceNotFoundException;
import io.github.chirino.checkin.store.SubmissionStore;
import jakarta.enterprise.context.ApplicationScoped;
import java.time.Instant;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;

/** Process-local store for single-node development and tests. Nothing survives a restart. */
@ApplicationScoped
public class InMemorySubmissionStore implements SubmissionStore {

    private final AtomicLong ids = new AtomicLong();
    private final ConcurrentMap<Long, Submission> submissions = new ConcurrentHashMap<>();
    private final Set<String> likes = ConcurrentHashMap.newKeySet();

    @Override
    public Submission create(NewSubmission s) {
        long id = ids.incrementAndGet();
        Submission created =
                new Submission(
                        id,
                        s.content(),
                        s.mediaFiles(),
                        s.ipAddress(),
                        s.region(),
                        s.fingerprint(),
                        s.nickname(),
                        s.email(),
                        s.qq(),
                        s.url(),
                        s.avatar(),
                        0,
                        s.createdAt(),
                        s.status(),
                        s.moderationReason(),
                        null,
                        s.archive());
        submissions.put(id, created);
        return created;
    }

    @Override
    public Optional<Submission> findById(long id) {
        return Optional.ofNullable(submissions.get(id));
    }

    @Override
    public Page<Submission> list(SubmissionQuery query) {
        Comparator<Submission> order =
                query.sortBy() == SubmissionQuery.SortField.LIKES
                        ? Comparator.comparingInt(Submission::likes)
                                .thenComparing(Submission::id)
                        : Comparator.comparing(Submission::id);
        if (!query.ascending()) {
            order = order.reversed();
        }
        List<Submission> matching =
                submissions.values().stream()
                        .filter(s -> query.status().map(st -> st == s.status()).orElse(true))
                        .filter(query.filter()::matches)
                        .sorted(order)
                        .toList();
        List<Submission> items =
                matching.stream().skip(query.offset()).limit(query.limit()).toList();
        return new Page<>(items, matching.size(), query.page(), query.limit());
    }

    @Override
    public Optional<Submission> compareAndSetStatus(
            long id,
            ModerationStatus expected,
            ModerationStatus target,
            String reason,
            Instant at) {
        Submission[] updated = new Submission[1];
        submissions.computeIfPresent(
                id,
                (k, current) -> {
                    if (current.status() != expected) {
                        return current;
                    }
                    updated[0] = current.withStatus(target, reason, at);
                    return updated[0];
                });
        return Optional.ofNullable(updated[0]);
    }

    @Override
    public Map<ModerationStatus, Long> countByStatus() {
        Map<ModerationStatus, Long> counts = new EnumMap<>(ModerationStatus.class);
        for (ModerationStatus status : ModerationStatus.values()) {
            counts.put(status, 0L);
        }
        for (Submission s : submissions.values()) {
            counts.merge(s.status(), 1L, Long::sum);
        }
        return counts;
    }

    @Override
    public LikeResult addLike(long submissionId, String ipAddress) {
        if (!submissions.containsKey(submissionId)) {
            throw new ResourceNotFoundException("submission", submissionId);
        }
        if (!likes.add(submissionId + "|" + ipAddress)) {
            return new LikeResult(false, submissions.get(submissionId).likes());
        }
        Submission updated =
                submissions.computeIfPresent(submissionId, (k, s) -> s.withLikes(s.likes() + 1));
        if (updated == null) {
            throw new ResourceNotFoundException("submission", submissionId);
        }
        return new LikeResult(true, updated.likes());
    }
}
