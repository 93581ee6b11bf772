package io.github.chirino.checkin.api;

import io.github.chirino.checkin.api.dto.ArchivePreviewResponse;
import io.github.chirino.checkin.service.SubmissionService;
import io.vertx.core.http.HttpServerRequest;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.MediaType;
import org.jboss.resteasy.reactive.server.multipart.MultipartFormDataInput;

@Path("/v1/archives")
public class ArchivesResource {

    @Inject SubmissionService submissionService;

    @Context HttpServerRequest request;

    /** Thumbnails of an uploaded archive; nothing is stored. */
    @POST
    @Path("/preview")
    @Consumes(MediaType.MULTIPART_FORM_DATA)
    @Produces(MediaType.APPLICATION_JSON)
    public ArchivePreviewResponse preview(MultipartFormDataInput input) {
        try (MultipartUploads uploads = new MultipartUploads(input)) {
            return ArchivePreviewResponse.from(
                    submissionService.previewArchive(
                            uploads.file("file"), ClientAddress.of(request)));
        }
    }
}
