package io.github.chirino.checkin.service;

import io.github.chirino.checkin.archive.ArchiveFormat;
import io.github.chirino.checkin.archive.ArchivePreview;
import io.github.chirino.checkin.archive.ArchiveProcessingService;
import io.github.chirino.checkin.archive.ArchiveRejectedException;
import io.github.chirino.checkin.model.ArchiveMetadata;
import io.github.chirino.checkin.model.LikeResult;
import io.github.chirino.checkin.model.ModerationStatus;
import io.github.chirino.checkin.model.NewSubmission;
import io.github.chirino.checkin.model.Page;
import io.github.chirino.checkin.model.Submission;
import io.github.chirino.checkin.model.SubmissionFilter;
import io.github.chirino.checkin.model.SubmissionQuery;
import io.github.chirino.checkin.moderation.AutoModerator;
import io.github.chirino.checkin.moderation.ModerationVerdict;
import io.github.chirino.checkin.screening.SubmitterFields;
import io.github.chirino.checkin.storage.MediaStore;
import io.github.chirino.checkin.storage.StorageException;
import io.github.chirino.checkin.storage.StoredFile;
import io.github.chirino.checkin.store.ResourceNotFoundException;
import io.github.chirino.checkin.store.SubmissionStore;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.jboss.logging.Logger;

/**
 * Accepts submissions end to end: gatekeeper, attachment handling, auto-moderation and
 * persistence. Also serves the public read side (listing, likes, archive images and downloads).
 */
public class SubmissionService {

    private static final Logger LOG = Logger.getLogger(SubmissionService.class);

    private final SubmissionGatekeeper gatekeeper;
    private final AutoModerator autoModerator;
    private final MediaStore mediaStore;
    private final ArchiveProcessingService archives;
    private final SubmissionStore store;
    private final Clock clock;

    public SubmissionService(
            SubmissionGatekeeper gatekeeper,
            AutoModerator autoModerator,
            MediaStore mediaStore,
            ArchiveProcessingService archives,
            SubmissionStore store,
            Clock clock) {
        this.gatekeeper = gatekeeper;
        this.autoModerator = autoModerator;
        this.mediaStore = mediaStore;
        this.archives = archives;
        this.store = store;
        this.clock = clock;
    }

    /**
     * Screens and persists a submission.
     *
     * <p>A submission carries either at most one archive and nothing else, or any number of
     * image and video files. Files written before a later step fails are removed again.
     *
     * @throws SubmissionRejectedException when any check refuses the submission
     * @throws StorageException when the attachments cannot be written
     */
    public Submission submit(SubmissionForm form, List<Attachment> attachments) {
        GatekeeperVerdict verdict = gatekeeper.admitWrite(form);

        List<Attachment> files = new ArrayList<>();
        if (attachments != null) {
            for (Attachment attachment : attachments) {
                if (!attachment.isEmpty()) {
                    files.add(attachment);
                }
            }
        }
        Attachment archive = checkAttachments(files);

        List<StoredFile> storedMedia = new ArrayList<>();
        ArchiveMetadata archiveMetadata = null;
        try {
            if (archive != null) {
                archiveMetadata = processArchive(archive);
            } else {
                for (Attachment file : files) {
                    storedMedia.add(storeMedia(file));
                }
            }

            boolean hasMedia = archiveMetadata != null || !storedMedia.isEmpty();
            SubmitterFields fields = verdict.fields();
            ModerationVerdict moderation =
                    autoModerator.decide(fields, hasMedia, verdict.nicknameFlagged());

            List<String> mediaUrls = new ArrayList<>();
            for (StoredFile stored : storedMedia) {
                mediaUrls.add(stored.url());
            }
            Submission created =
                    store.create(
                            new NewSubmission(
                                    fields.content(),
                                    mediaUrls,
                                    form.ipAddress(),
                                    verdict.region(),
                                    verdict.fingerprint(),
                                    fields.nickname(),
                                    fields.email(),
                                    fields.qq(),
                                    fields.url(),
                                    fields.avatar(),
                                    clock.instant(),
                                    moderation.status(),
                                    moderation.reasonText(),
                                    archiveMetadata));
            LOG.infof(
                    "Accepted submission %d as %s (media=%d, archive=%s)",
                    created.id(),
                    created.status().value(),
                    mediaUrls.size(),
                    archiveMetadata != null);
            return created;
        } catch (RuntimeException e) {
            storedMedia.forEach(mediaStore::delete);
            if (archiveMetadata != null) {
                archives.discard(archiveMetadata.storageKey());
            }
            throw e;
        }
    }

    /** Approved submissions only. */
    public Page<Submission> listPublic(int page, int limit, String sortBy, String order) {
        return listPublic(page, limit, sortBy, order, SubmissionFilter.NONE);
    }

    /**
     * Published submissions matching {@code filter}. Contact details are never shown publicly, so
     * the exact email match is ignored here.
     */
    public Page<Submission> listPublic(
            int page, int limit, String sortBy, String order, SubmissionFilter filter) {
        SubmissionFilter visible =
                filter == null
                        ? SubmissionFilter.NONE
                        : new SubmissionFilter(
                                filter.nickname(),
                                null,
                                filter.contentKeyword(),
                                filter.excludedNickname(),
                                filter.minContentLength());
        return store.list(SubmissionQuery.publicListing(page, limit, sortBy, order, visible));
    }

    public LikeResult like(long id, String ip) {
        gatekeeper.admitAction(ip);
        requirePublished(id);
        return store.addLike(id, ip);
    }

    /** Thumbnails of an archive that is not stored anywhere. */
    public ArchivePreview previewArchive(Attachment upload, String ip) {
        // previews decompress and decode, so they count as writes
        gatekeeper.admitAction(ip);
        if (upload == null || upload.isEmpty()) {
            throw SubmissionRejectedException.validation("No archive was uploaded");
        }
        try {
            return archives.preview(upload.filename(), upload.file());
        } catch (ArchiveRejectedException e) {
            throw archiveRejected(e);
        }
    }

    /**
     * A larger rendering of one image inside a published submission's archive.
     *
     * @return a {@code data:image/jpeg;base64,} URI
     */
    public String fullImage(long id, String entryPath) {
        ArchiveMetadata metadata = requireArchive(id);
        try {
            return archives.fullImage(metadata, entryPath)
                    .orElseThrow(() -> new ResourceNotFoundException("image", entryPath));
        } catch (ArchiveRejectedException e) {
            if (ArchiveRejectedException.ENTRY_NOT_FOUND.equals(e.getReason())) {
                throw new ResourceNotFoundException("image", entryPath);
            }
            throw archiveRejected(e);
        }
    }

    public ArchiveDownload download(long id) {
        ArchiveMetadata metadata = requireArchive(id);
        InputStream content = archives.openStored(metadata);
        return new ArchiveDownload(metadata.filename(), metadata.size(), content);
    }

    private Attachment checkAttachments(List<Attachment> files) {
        List<Attachment> archiveFiles = new ArrayList<>();
        for (Attachment file : files) {
            if (ArchiveFormat.isArchive(file.filename())) {
                archiveFiles.add(file);
            } else if (!MediaStore.isSupported(file.filename())) {
                throw SubmissionRejectedException.validation(
                        "Unsupported file type, only images, videos, .zip and .7z are allowed");
            }
        }
        if (archiveFiles.size() > 1) {
            throw SubmissionRejectedException.validation(
                    "Only one archive can be attached to a submission");
        }
        if (archiveFiles.size() == 1 && files.size() > 1) {
            throw SubmissionRejectedException.validation(
                    "An archive cannot be combined with other attachments");
        }
        return archiveFiles.isEmpty() ? null : archiveFiles.get(0);
    }

    private ArchiveMetadata processArchive(Attachment archive) {
        try {
            return archives.process(archive.filename(), archive.file());
        } catch (ArchiveRejectedException e) {
            throw archiveRejected(e);
        }
    }

    private StoredFile storeMedia(Attachment file) {
        try (InputStream in = Files.newInputStream(file.file())) {
            return mediaStore.store(file.filename(), in);
        } catch (IOException e) {
            throw StorageException.storageError("Failed to read uploaded file", e);
        }
    }

    private Submission requirePublished(long id) {
        return store.findById(id)
                .filter(submission -> submission.status() == ModerationStatus.APPROVED)
                .orElseThrow(() -> new ResourceNotFoundException("submission", id));
    }

    private ArchiveMetadata requireArchive(long id) {
        Submission submission = requirePublished(id);
        if (!submission.hasArchive()) {
            throw new ResourceNotFoundException("archive", id);
        }
        return submission.archive();
    }

    private static SubmissionRejectedException archiveRejected(ArchiveRejectedException e) {
        return new SubmissionRejectedException(
                SubmissionRejectedException.ARCHIVE_REJECTED,
                e.getHttpStatus(),
                e.getMessage(),
                Map.of("reason", e.getReason()),
                e);
    }
}
