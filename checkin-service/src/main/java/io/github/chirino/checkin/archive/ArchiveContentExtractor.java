package io.github.chirino.checkin.archive;

import io.github.chirino.checkin.model.FileNames;
import io.github.chirino.checkin.storage.CountingInputStream;
import io.github.chirino.checkin.storage.StorageException;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.jboss.logging.Logger;

/**
 * Reads entries of a {@link ValidatedArchive}. Every entry is decompressed through a byte counter
 * so a lying size header cannot inflate past {@code maxEntrySize}. Image decode failures are
 * reported as empty results and never abort a batch.
 */
public class ArchiveContentExtractor implements Closeable {

    private static final Logger LOG = Logger.getLogger(ArchiveContentExtractor.class);

    public static final Set<String> IMAGE_EXTENSIONS =
            Set.of(".jpg", ".jpeg", ".png", ".gif", ".webp", ".bmp");

    static final float THUMBNAIL_QUALITY = 0.85f;
    static final float PREVIEW_QUALITY = 0.90f;

    private final ValidatedArchive archive;
    private final long maxEntrySize;
    private final ImageRenderer renderer;
    private ArchiveReader reader;

    public ArchiveContentExtractor(
            ValidatedArchive archive, long maxEntrySize, ImageRenderer renderer) {
        this.archive = archive;
        this.maxEntrySize = maxEntrySize;
        this.renderer = renderer;
    }

    public static boolean isImage(String path) {
        return IMAGE_EXTENSIONS.contains(FileNames.extension(path));
    }

    /** Image entries in archive order, directories excluded. */
    public List<String> listImages() {
        List<String> images = new ArrayList<>();
        for (ArchiveEntryInfo entry : archive.entries()) {
            if (!entry.directory() && !FileNames.isDirectoryName(entry.path())
                    && isImage(entry.path())) {
                images.add(entry.path());
            }
        }
        return images;
    }

    public int totalFiles() {
        return archive.totalFiles();
    }

    /**
     * Decompresses one entry.
     *
     * @throws ArchiveRejectedException {@code entry_not_found} for unknown paths, {@code
     *     too_large} when the entry inflates past the limit, {@code corrupt} on read errors
     */
    public synchronized ExtractedEntry extractEntry(String path) {
        if (!contains(path)) {
            throw new ArchiveRejectedException(
                    ArchiveRejectedException.ENTRY_NOT_FOUND, 404, "No such file in archive", null);
        }
        try (InputStream in = new CountingInputStream(reader().open(path), maxEntrySize)) {
            byte[] data = in.readAllBytes();
            if (Thread.currentThread().isInterrupted()) {
                throw new InterruptedIOException("Extraction interrupted");
            }
            return new ExtractedEntry(path, FileNames.baseName(path), data);
        } catch (StorageException e) {
            throw new ArchiveRejectedException(
                    ArchiveRejectedException.TOO_LARGE,
                    413,
                    "A file in the archive expands beyond the allowed size",
                    e);
        } catch (InterruptedIOException e) {
            Thread.currentThread().interrupt();
            throw new ArchiveRejectedException(
                    ArchiveRejectedException.TIMEOUT, 400, "Archive processing was cancelled", e);
        } catch (IOException | RuntimeException e) {
            throw ArchiveRejectedException.corrupt(e);
        }
    }

    /** Small JPEG data URI of an image entry, or empty when it cannot be decoded. */
    public Optional<String> thumbnail(String path, int maxDim) {
        return render(path, maxDim, THUMBNAIL_QUALITY);
    }

    /** Larger JPEG data URI of an image entry, or empty when it cannot be decoded. */
    public Optional<String> preview(String path, int maxDim) {
        return render(path, maxDim, PREVIEW_QUALITY);
    }

    /** Thumbnails for up to {@code limit} of {@code paths}; undecodable entries are skipped. */
    public List<ArchiveThumbnail> thumbnails(List<String> paths, int maxDim, int limit) {
        List<ArchiveThumbnail> result = new ArrayList<>();
        for (String path : paths.subList(0, Math.min(limit, paths.size()))) {
            if (Thread.currentThread().isInterrupted()) {
                break;
            }
            thumbnail(path, maxDim)
                    .ifPresent(
                            uri ->
                                    result.add(
                                            new ArchiveThumbnail(
                                                    path, FileNames.baseName(path), uri)));
        }
        return result;
    }

    @Override
    public synchronized void close() throws IOException {
        if (reader != null) {
            reader.close();
            reader = null;
        }
    }

    private Optional<String> render(String path, int maxDim, float quality) {
        if (!isImage(path)) {
            return Optional.empty();
        }
        try {
            byte[] data = extractEntry(path).data();
            Optional<String> uri = renderer.renderDataUri(data, maxDim, quality);
            if (uri.isEmpty()) {
                LOG.debugf("Skipping undecodable archive image %s", path);
            }
            return uri;
        } catch (ArchiveRejectedException e) {
            if (ArchiveRejectedException.TIMEOUT.equals(e.getReason())) {
                throw e;
            }
            LOG.debugf("Skipping archive image %s: %s", path, e.getReason());
            return Optional.empty();
        }
    }

    private boolean contains(String path) {
        if (path == null) {
            return false;
        }
        for (ArchiveEntryInfo entry : archive.entries()) {
            if (!entry.directory() && entry.path().equals(path)) {
                return true;
            }
        }
        return false;
    }

    private ArchiveReader reader() throws IOException {
        if (reader == null) {
            reader = archive.openReader();
        }
        return reader;
    }
}
