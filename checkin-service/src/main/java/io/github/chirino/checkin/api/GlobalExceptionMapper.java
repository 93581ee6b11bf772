package io.github.chirino.checkin.api;

import io.github.chirino.checkin.api.dto.ErrorResponse;
import io.github.chirino.checkin.archive.ArchiveRejectedException;
import io.github.chirino.checkin.moderation.IllegalModerationTransitionException;
import io.github.chirino.checkin.service.SubmissionRejectedException;
import io.github.chirino.checkin.storage.StorageException;
import io.github.chirino.checkin.store.ResourceNotFoundException;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.util.Map;
import org.jboss.logging.Logger;
import org.jboss.resteasy.reactive.server.ServerExceptionMapper;

/**
 * Renders every failure as an {@link ErrorResponse}. Unexpected exceptions are logged with their
 * stack trace; expected rejections are not, the services already logged them.
 */
public class GlobalExceptionMapper {

    private static final Logger LOG = Logger.getLogger(GlobalExceptionMapper.class);

    @ServerExceptionMapper
    public Response handleRejected(SubmissionRejectedException e) {
        ErrorResponse error =
                new ErrorResponse(e.getMessage(), e.getCode(), details(e.getDetails()));
        Response.ResponseBuilder builder = json(e.getHttpStatus(), error);
        long retryAfter = e.getRetryAfterSeconds();
        if (retryAfter > 0) {
            builder.header("Retry-After", retryAfter);
        }
        return builder.build();
    }

    @ServerExceptionMapper
    public Response handleArchiveRejected(ArchiveRejectedException e) {
        return json(
                        e.getHttpStatus(),
                        new ErrorResponse(
                                e.getMessage(),
                                SubmissionRejectedException.ARCHIVE_REJECTED,
                                Map.of("reason", e.getReason())))
                .build();
    }

    @ServerExceptionMapper
    public Response handleStorage(StorageException e) {
        if (e.getHttpStatus() >= 500) {
            LOG.errorf(e, "Storage failure");
            return json(e.getHttpStatus(), new ErrorResponse("Storage error", e.getCode()))
                    .build();
        }
        return json(
                        e.getHttpStatus(),
                        new ErrorResponse(e.getMessage(), e.getCode(), details(e.getDetails())))
                .build();
    }

    @ServerExceptionMapper
    public Response handleNotFound(ResourceNotFoundException e) {
        return json(
                        404,
                        new ErrorResponse(
                                e.getResource() + " not found",
                                "not_found",
                                Map.of("resource", e.getResource(), "id", e.getId())))
                .build();
    }

    @ServerExceptionMapper
    public Response handleIllegalTransition(IllegalModerationTransitionException e) {
        return json(
                        409,
                        new ErrorResponse(
                                e.getMessage(),
                                "conflict",
                                Map.of(
                                        "from", e.getFrom().value(),
                                        "to", e.getTo().value())))
                .build();
    }

    @ServerExceptionMapper
    public Response handleException(Exception e) {
        if (e instanceof WebApplicationException wae) {
            int status = wae.getResponse().getStatus();
            if (status >= 500) {
                LOG.errorf(e, "Server error %d", status);
            }
            return wae.getResponse();
        }

        LOG.errorf(e, "Unhandled exception");
        return json(500, new ErrorResponse("Internal server error", "internal_error")).build();
    }

    private static Response.ResponseBuilder json(int status, ErrorResponse error) {
        return Response.status(status).type(MediaType.APPLICATION_JSON).entity(error);
    }

    private static Map<String, Object> details(Map<String, Object> details) {
        return details == null || details.isEmpty() ? null : details;
    }
}
