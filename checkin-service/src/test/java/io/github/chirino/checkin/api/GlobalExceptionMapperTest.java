package io.github.chirino.checkin.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import io.github.chirino.checkin.api.dto.ErrorResponse;
import io.github.chirino.checkin.archive.ArchiveRejectedException;
import io.github.chirino.checkin.model.ModerationStatus;
import io.github.chirino.checkin.moderation.IllegalModerationTransitionException;
import io.github.chirino.checkin.service.SubmissionRejectedException;
import io.github.chirino.checkin.storage.StorageException;
import io.github.chirino.checkin.store.ResourceNotFoundException;
import jakarta.ws.rs.core.Response;
import java.io.IOException;
import java.util.Map;
import org.junit.jupiter.api.Test;

class GlobalExceptionMapperTest {

    private final GlobalExceptionMapper mapper = new GlobalExceptionMapper();

    @Test
    void rate_limit_carries_retry_after() {
        Response response = mapper.handleRejected(SubmissionRejectedException.rateLimited(300));

        assertEquals(429, response.getStatus());
        assertEquals("300", response.getHeaderString("Retry-After"));
        ErrorResponse body = (ErrorResponse) response.getEntity();
        assertEquals(SubmissionRejectedException.RATE_LIMITED, body.getCode());
        assertEquals(300L, body.getDetails().get("retryAfterSeconds"));
    }

    @Test
    void other_rejections_keep_their_status_without_retry_after() {
        Response response =
                mapper.handleRejected(
                        new SubmissionRejectedException(
                                SubmissionRejectedException.REGION_BLOCKED, 451, "Not here"));

        assertEquals(451, response.getStatus());
        assertNull(response.getHeaderString("Retry-After"));
        ErrorResponse body = (ErrorResponse) response.getEntity();
        assertEquals("Not here", body.getError());
        assertNull(body.getDetails());
    }

    @Test
    void archive_rejection_exposes_the_reason() {
        Response response =
                mapper.handleArchiveRejected(
                        new ArchiveRejectedException(
                                ArchiveRejectedException.TOO_LARGE, "Archive upload is too large"));

        assertEquals(413, response.getStatus());
        ErrorResponse body = (ErrorResponse) response.getEntity();
        assertEquals(SubmissionRejectedException.ARCHIVE_REJECTED, body.getCode());
        assertEquals(Map.of("reason", "too_large"), body.getDetails());
    }

    @Test
    void storage_failures_hide_internal_messages() {
        Response failure =
                mapper.handleStorage(
                        StorageException.storageError(
                                "Failed to store /srv/uploads/x", new IOException("disk full")));
        Response tooLarge = mapper.handleStorage(StorageException.fileTooLarge(10, 11));

        assertEquals(500, failure.getStatus());
        assertEquals("Storage error", ((ErrorResponse) failure.getEntity()).getError());
        assertEquals(413, tooLarge.getStatus());
        assertEquals(
                StorageException.FILE_TOO_LARGE, ((ErrorResponse) tooLarge.getEntity()).getCode());
    }

    @Test
    void missing_resources_and_conflicts() {
        Response notFound =
                mapper.handleNotFound(new ResourceNotFoundException("submission", 42L));
        Response conflict =
                mapper.handleIllegalTransition(
                        new IllegalModerationTransitionException(
                                42L, ModerationStatus.BANNED, ModerationStatus.APPROVED));

        assertEquals(404, notFound.getStatus());
        assertEquals("not_found", ((ErrorResponse) notFound.getEntity()).getCode());
        assertEquals(409, conflict.getStatus());
        assertEquals(
                Map.of("from", "banned", "to", "approved"),
                ((ErrorResponse) conflict.getEntity()).getDetails());
    }

    @Test
    void unexpected_exceptions_become_a_generic_500() {
        Response response = mapper.handleException(new NullPointerException("oops"));

        assertEquals(500, response.getStatus());
        ErrorResponse body = (ErrorResponse) response.getEntity();
        assertEquals("internal_error", body.getCode());
        assertEquals("Internal server error", body.getError());
    }

    @Test
    void download_header_has_an_ascii_fallback_and_utf8_name() {
        assertEquals(
                "attachment; filename=\"photos.zip\"; filename*=UTF-8''photos.zip",
                SubmissionsResource.contentDisposition("photos.zip"));
        assertEquals(
                "attachment; filename=\"__ _.7z\"; filename*=UTF-8''%E7%85%A7%E7%89%87%20%22.7z",
                SubmissionsResource.contentDisposition("照片 \".7z"));
        assertEquals(
                "attachment; filename=\"archive\"; filename*=UTF-8''archive",
                SubmissionsResource.contentDisposition(null));
    }
}
