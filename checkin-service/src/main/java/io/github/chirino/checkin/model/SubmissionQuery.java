package io.github.chirino.checkin.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Listing parameters. An empty {@code status} means every status (administrative view only).
 */
public record SubmissionQuery(
        Optional<ModerationStatus> status,
        int page,
        int limit,
        SortField sortBy,
        boolean ascending,
        SubmissionFilter filter) {

    public static final int DEFAULT_LIMIT = 20;
    public static final int MAX_LIMIT = 100;

    public enum SortField {
        ID,
        LIKES;

        public static SortField fromQuery(String value) {
            if (value != null && "likes".equals(value.trim().toLowerCase(Locale.ROOT))) {
                return LIKES;
            }
            return ID;
        }
    }

    public SubmissionQuery {
        status = status == null ? Optional.empty() : status;
        page = Math.max(1, page);
        limit = limit < 1 || limit > MAX_LIMIT ? DEFAULT_LIMIT : limit;
        sortBy = sortBy == null ? SortField.ID : sortBy;
        filter = filter == null ? SubmissionFilter.NONE : filter;
    }

    public static SubmissionQuery publicListing(
            int page, int limit, String sortBy, String order) {
        return publicListing(page, limit, sortBy, order, SubmissionFilter.NONE);
    }

    public static SubmissionQuery publicListing(
            int page, int limit, String sortBy, String order, SubmissionFilter filter) {
        return new SubmissionQuery(
                Optional.of(ModerationStatus.APPROVED),
                page,
                limit,
                SortField.fromQuery(sortBy),
                "asc".equalsIgnoreCase(order),
                filter);
    }

    public static SubmissionQuery byStatus(Optional<ModerationStatus> status, int page, int limit) {
        return byStatus(status, page, limit, SubmissionFilter.NONE);
    }

    public static SubmissionQuery byStatus(
            Optional<ModerationStatus> status, int page, int limit, SubmissionFilter filter) {
        return new SubmissionQuery(status, page, limit, SortField.ID, false, filter);
    }

    public int offset() {
        return (page - 1) * limit;
    }
}
