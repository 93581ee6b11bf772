package io.github.chirino.checkin.api;

import io.github.chirino.checkin.api.dto.AdminSubmissionView;
import io.github.chirino.checkin.api.dto.BatchRequest;
import io.github.chirino.checkin.api.dto.ErrorResponse;
import io.github.chirino.checkin.api.dto.PageView;
import io.github.chirino.checkin.model.ModerationStatus;
import io.github.chirino.checkin.model.SubmissionFilter;
import io.github.chirino.checkin.moderation.BatchResult;
import io.github.chirino.checkin.moderation.ModerationService;
import io.github.chirino.checkin.moderation.ModerationStats;
import io.github.chirino.checkin.screening.SubmissionFieldValidator;
import io.github.chirino.checkin.security.RequireAdminKey;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DefaultValue;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.util.List;
import java.util.Optional;

/** Moderation endpoints. Every call needs a configured {@code X-Admin-Key}. */
@Path("/v1/admin")
@RequireAdminKey
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class AdminResource {

    @Inject ModerationService moderation;

    @GET
    @Path("/stats")
    public ModerationStats stats() {
        return moderation.stats();
    }

    @GET
    @Path("/pending")
    public PageView<AdminSubmissionView> pending(
            @QueryParam("page") @DefaultValue("1") int page,
            @QueryParam("limit") @DefaultValue("20") int limit) {
        return PageView.from(moderation.pending(page, limit), AdminSubmissionView::from);
    }

    @GET
    @Path("/submissions")
    public Response submissions(
            @QueryParam("status") @DefaultValue("all") String status,
            @QueryParam("page") @DefaultValue("1") int page,
            @QueryParam("limit") @DefaultValue("20") int limit,
            @QueryParam("nickname") String nickname,
            @QueryParam("email") String email,
            @QueryParam("keyword") String keyword,
            @QueryParam("excludeDefaultNickname") boolean excludeDefaultNickname,
            @QueryParam("minLength") int minLength) {
        Optional<ModerationStatus> statusFilter;
        if ("all".equalsIgnoreCase(status.trim())) {
            statusFilter = Optional.empty();
        } else {
            try {
                statusFilter = Optional.of(ModerationStatus.fromValue(status));
            } catch (IllegalArgumentException e) {
                return Response.status(Response.Status.BAD_REQUEST)
                        .entity(
                                new ErrorResponse(
                                        "status must be one of pending, approved, banned, all",
                                        "validation_error"))
                        .build();
            }
        }
        SubmissionFilter search =
                new SubmissionFilter(
                        nickname,
                        email,
                        keyword,
                        excludeDefaultNickname ? SubmissionFieldValidator.DEFAULT_NICKNAME : null,
                        minLength);
        return Response.ok(
                        PageView.from(
                                moderation.list(statusFilter, page, limit, search),
                                AdminSubmissionView::from))
                .build();
    }

    @POST
    @Path("/approve/{id}")
    public AdminSubmissionView approve(@PathParam("id") long id) {
        return AdminSubmissionView.from(moderation.approve(id));
    }

    @POST
    @Path("/reject/{id}")
    public AdminSubmissionView reject(@PathParam("id") long id) {
        return AdminSubmissionView.from(moderation.reject(id));
    }

    @POST
    @Path("/ban/{id}")
    public AdminSubmissionView ban(@PathParam("id") long id) {
        return AdminSubmissionView.from(moderation.ban(id));
    }

    @POST
    @Path("/batch/approve")
    public BatchResult batchApprove(BatchRequest request) {
        return moderation.batchApprove(ids(request));
    }

    @POST
    @Path("/batch/reject")
    public BatchResult batchReject(BatchRequest request) {
        return moderation.batchReject(ids(request));
    }

    private static List<Long> ids(BatchRequest request) {
        return request == null ? null : request.getIds();
    }
}
