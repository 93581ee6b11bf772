package io.github.chirino.checkin.api;

import io.github.chirino.checkin.api.dto.ArchiveImageResponse;
import io.github.chirino.checkin.api.dto.LikeResponse;
import io.github.chirino.checkin.api.dto.PageView;
import io.github.chirino.checkin.api.dto.SubmissionAccepted;
import io.github.chirino.checkin.api.dto.SubmissionView;
import io.github.chirino.checkin.model.Submission;
import io.github.chirino.checkin.model.SubmissionFilter;
import io.github.chirino.checkin.screening.SubmissionFieldValidator;
import io.github.chirino.checkin.service.ArchiveDownload;
import io.github.chirino.checkin.service.SubmissionForm;
import io.github.chirino.checkin.service.SubmissionService;
import io.vertx.core.http.HttpServerRequest;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DefaultValue;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import org.jboss.resteasy.reactive.server.multipart.MultipartFormDataInput;

@Path("/v1/submissions")
public class SubmissionsResource {

    static final String FILES_FIELD = "files";
    static final String HONEYPOT_FIELD = "honeypot";
    static final String TIMESTAMP_FIELD = "form_timestamp";

    @Inject SubmissionService submissionService;

    @Context HttpServerRequest request;

    @POST
    @Consumes(MediaType.MULTIPART_FORM_DATA)
    @Produces(MediaType.APPLICATION_JSON)
    public Response submit(MultipartFormDataInput input) {
        try (MultipartUploads uploads = new MultipartUploads(input)) {
            SubmissionForm form =
                    new SubmissionForm(
                            uploads.text("content"),
                            uploads.text("nickname"),
                            uploads.text("email"),
                            uploads.text("qq"),
                            uploads.text("url"),
                            uploads.text("avatar"),
                            uploads.text(HONEYPOT_FIELD),
                            uploads.text(TIMESTAMP_FIELD),
                            uploads.text("fingerprint"),
                            ClientAddress.of(request));
            Submission created = submissionService.submit(form, uploads.files(FILES_FIELD));
            return Response.status(Response.Status.CREATED)
                    .entity(SubmissionAccepted.from(created))
                    .build();
        }
    }

    @GET
    @Produces(MediaType.APPLICATION_JSON)
    public PageView<SubmissionView> list(
            @QueryParam("page") @DefaultValue("1") int page,
            @QueryParam("limit") @DefaultValue("20") int limit,
            @QueryParam("sort") String sort,
            @QueryParam("order") String order,
            @QueryParam("nickname") String nickname,
            @QueryParam("keyword") String keyword,
            @QueryParam("excludeDefaultNickname") boolean excludeDefaultNickname,
            @QueryParam("minLength") int minLength) {
        SubmissionFilter filter =
                new SubmissionFilter(
                        nickname,
                        null,
                        keyword,
                        excludeDefaultNickname ? SubmissionFieldValidator.DEFAULT_NICKNAME : null,
                        minLength);
        return PageView.from(
                submissionService.listPublic(page, limit, sort, order, filter),
                SubmissionView::from);
    }

    @POST
    @Path("/{id}/like")
    @Produces(MediaType.APPLICATION_JSON)
    public LikeResponse like(@PathParam("id") long id) {
        return LikeResponse.from(submissionService.like(id, ClientAddress.of(request)));
    }

    @GET
    @Path("/{id}/archive/image")
    @Produces(MediaType.APPLICATION_JSON)
    public ArchiveImageResponse archiveImage(
            @PathParam("id") long id, @QueryParam("path") String path) {
        return new ArchiveImageResponse(path, submissionService.fullImage(id, path));
    }

    @GET
    @Path("/{id}/archive")
    public Response download(@PathParam("id") long id) {
        ArchiveDownload download = submissionService.download(id);
        return Response.ok(download.content(), MediaType.APPLICATION_OCTET_STREAM)
                .header("Content-Length", download.size())
                .header("Content-Disposition", contentDisposition(download.filename()))
                .build();
    }

    static String contentDisposition(String filename) {
        String name = filename == null || filename.isBlank() ? "archive" : filename;
        StringBuilder fallback = new StringBuilder();
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            fallback.append(c >= 0x20 && c < 0x7f && c != '"' && c != '\\' ? c : '_');
        }
        String encoded = URLEncoder.encode(name, StandardCharsets.UTF_8).replace("+", "%20");
        return "attachment; filename=\"" + fallback + "\"; filename*=UTF-8''" + encoded;
    }
}
