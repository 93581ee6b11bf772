package io.github.chirino.checkin.store.impl;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.chirino.checkin.model.ArchiveMetadata;
import io.github.chirino.checkin.model.LikeResult;
import io.github.chirino.checkin.model.ModerationStatus;
import io.github.chirino.checkin.model.NewSubmission;
import io.github.chirino.checkin.model.Page;
import io.github.chirino.checkin.model.Submission;
import io.github.chirino.checkin.model.SubmissionQuery;
import io.github.chirino.checkin.persistence.entity.SubmissionEntity;
import io.github.chirino.checkin.persistence.repo.LikeRepository;
import io.github.chirino.checkin.persistence.repo.SubmissionRepository;
import io.github.chirino.checkin.store.ResourceNotFoundException;
import io.github.chirino.checkin.store.SubmissionStore;
import io.quarkus.hibernate.orm.panache.PanacheQuery;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@ApplicationScoped
public class PostgresSubmissionStore implements SubmissionStore {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    @Inject SubmissionRepository submissionRepository;

    @Inject LikeRepository likeRepository;

    @Inject ObjectMapper objectMapper;

    @Override
    @Transactional
    public Submission create(NewSubmission s) {
        SubmissionEntity entity = new SubmissionEntity();
        entity.setContent(s.content());
        entity.setMediaFiles(s.mediaFiles());
        entity.setIpAddress(s.ipAddress() != null ? s.ipAddress() : "");
        entity.setRegion(s.region());
        entity.setFingerprint(s.fingerprint());
        entity.setNickname(s.nickname());
        entity.setEmail(s.email());
        entity.setQq(s.qq());
        entity.setUrl(s.url());
        entity.setAvatar(s.avatar());
        entity.setCreatedAt(toOffset(s.createdAt()));
        entity.setStatus(s.status());
        entity.setModerationReason(s.moderationReason());
        entity.setArchiveMetadata(
                s.archive() == null ? null : objectMapper.convertValue(s.archive(), MAP_TYPE));
        submissionRepository.persist(entity);
        return toSubmission(entity);
    }

    @Override
    @Transactional
    public Optional<Submission> findById(long id) {
        return submissionRepository.findByIdOptional(id).map(this::toSubmission);
    }

    @Override
    @Transactional
    public Page<Submission> list(SubmissionQuery query) {
        PanacheQuery<SubmissionEntity> panacheQuery = submissionRepository.query(query);
        long total = panacheQuery.count();
        List<Submission> items =
                panacheQuery
                        .page(io.quarkus.panache.common.Page.of(query.page() - 1, query.limit()))
                        .list()
                        .stream()
                        .map(this::toSubmission)
                        .toList();
        return new Page<>(items, total, query.page(), query.limit());
    }

    @Override
    @Transactional
    public Optional<Submission> compareAndSetStatus(
            long id,
            ModerationStatus expected,
            ModerationStatus target,
            String reason,
            Instant at) {
        int updated =
                submissionRepository.compareAndSetStatus(
                        id, expected, target, reason, toOffset(at));
        if (updated == 0) {
            return Optional.empty();
        }
        // bulk updates bypass the persistence context
        submissionRepository.getEntityManager().clear();
        return submissionRepository.findByIdOptional(id).map(this::toSubmission);
    }

    @Override
    @Transactional
    public Map<ModerationStatus, Long> countByStatus() {
        return submissionRepository.countByStatus();
    }

    @Override
    @Transactional
    public LikeResult addLike(long submissionId, String ipAddress) {
        if (submissionRepository.findByIdOptional(submissionId).isEmpty()) {
            throw new ResourceNotFoundException("submission", submissionId);
        }
        boolean inserted = likeRepository.insertIfAbsent(submissionId, ipAddress);
        if (inserted) {
            submissionRepository.incrementLikes(submissionId);
        }
        submissionRepository.getEntityManager().clear();
        SubmissionEntity entity =
                submissionRepository
                        .findByIdOptional(submissionId)
                        .orElseThrow(
                                () -> new ResourceNotFoundException("submission", submissionId));
        return new LikeResult(inserted, entity.getLikes());
    }

    private Submission toSubmission(SubmissionEntity e) {
        ArchiveMetadata archive =
                e.getArchiveMetadata() == null
                        ? null
                        : objectMapper.convertValue(e.getArchiveMetadata(), ArchiveMetadata.class);
        return new Submission(
                e.getId(),
                e.getContent(),
                e.getMediaFiles(),
                e.getIpAddress(),
                e.getRegion(),
                e.getFingerprint(),
                e.getNickname(),
                e.getEmail(),
                e.getQq(),
                e.getUrl(),
                e.getAvatar(),
                e.getLikes(),
                toInstant(e.getCreatedAt()),
                e.getStatus(),
                e.getModerationReason(),
                toInstant(e.getModeratedAt()),
                archive);
    }

    private static OffsetDateTime toOffset(Instant instant) {
        return instant == null ? null : instant.atOffset(ZoneOffset.UTC);
    }

    private static Instant toInstant(OffsetDateTime time) {
        return time == null ? null : time.toInstant();
    }
}
