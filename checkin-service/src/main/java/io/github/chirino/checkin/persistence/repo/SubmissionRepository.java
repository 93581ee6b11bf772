package io.github.chirino.checkin.persistence.repo;

import static io.github.chirino.checkin.model.SubmissionFilter.LIKE_ESCAPE;

import io.github.chirino.checkin.model.ModerationStatus;
import io.github.chirino.checkin.model.SubmissionFilter;
import io.github.chirino.checkin.model.SubmissionQuery;
import io.github.chirino.checkin.persistence.entity.SubmissionEntity;
import io.quarkus.hibernate.orm.panache.PanacheQuery;
import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import io.quarkus.panache.common.Parameters;
import io.quarkus.panache.common.Sort;
import jakarta.enterprise.context.ApplicationScoped;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@ApplicationScoped
public class SubmissionRepository implements PanacheRepositoryBase<SubmissionEntity, Long> {

    public PanacheQuery<SubmissionEntity> query(SubmissionQuery query) {
        Sort sort =
                query.sortBy() == SubmissionQuery.SortField.LIKES
                        ? Sort.by("likes").and("id")
                        : Sort.by("id");
        sort = query.ascending() ? sort.ascending() : sort.descending();

        List<String> clauses = new ArrayList<>();
        Parameters params = new Parameters();
        if (query.status().isPresent()) {
            clauses.add("status = :status");
            params.and("status", query.status().get());
        }
        SubmissionFilter filter = query.filter();
        if (filter.nickname() != null) {
            clauses.add("lower(nickname) like :nickname escape '" + LIKE_ESCAPE + "'");
            params.and("nickname", SubmissionFilter.likePattern(filter.nickname()));
        }
        if (filter.email() != null) {
            clauses.add("email = :email");
            params.and("email", filter.email());
        }
        if (filter.contentKeyword() != null) {
            clauses.add("lower(content) like :keyword escape '" + LIKE_ESCAPE + "'");
            params.and("keyword", SubmissionFilter.likePattern(filter.contentKeyword()));
        }
        if (filter.excludedNickname() != null) {
            clauses.add("nickname <> :excludedNickname");
            params.and("excludedNickname", filter.excludedNickname());
        }
        if (filter.minContentLength() > 0) {
            clauses.add("length(content) >= :minLength");
            params.and("minLength", filter.minContentLength());
        }
        if (clauses.isEmpty()) {
            return findAll(sort);
        }
        return find(String.join(" and ", clauses), sort, params);
    }

    /** Conditional status update; returns the number of rows changed (0 or 1). */
    public int compareAndSetStatus(
            long id,
            ModerationStatus expected,
            ModerationStatus target,
            String reason,
            OffsetDateTime at) {
        return update(
                "status = ?1, moderationReason = ?2, moderatedAt = ?3 where id = ?4 and status ="
                        + " ?5",
                target,
                reason,
                at,
                id,
                expected);
    }

    public int incrementLikes(long id) {
        return update("likes = likes + 1 where id = ?1", id);
    }

    public Map<ModerationStatus, Long> countByStatus() {
        Map<ModerationStatus, Long> counts = new EnumMap<>(ModerationStatus.class);
        for (ModerationStatus status : ModerationStatus.values()) {
            counts.put(status, 0L);
        }
        List<Object[]> rows =
                getEntityManager()
                        .createQuery(
                                "select s.status, count(s) from SubmissionEntity s group by"
                                        + " s.status",
                                Object[].class)
                        .getResultList();
        for (Object[] row : rows) {
            counts.put((ModerationStatus) row[0], ((Number) row[1]).longValue());
        }
        return counts;
    }
}
