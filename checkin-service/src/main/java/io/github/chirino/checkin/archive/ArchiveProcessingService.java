package io.github.chirino.checkin.archive;

import io.github.chirino.checkin.model.ArchiveMetadata;
import io.github.chirino.checkin.model.FileNames;
import io.github.chirino.checkin.model.PreviewImage;
import io.github.chirino.checkin.storage.StorageException;
import io.github.chirino.checkin.storage.StoredFile;
import io.github.chirino.checkin.storage.UploadStorage;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import org.jboss.logging.Logger;

/**
 * Validates, extracts and persists uploaded archives.
 *
 * <p>All decompression runs on a bounded worker pool under {@code processingTimeout}. When every
 * worker is busy and the queue is full, new archives are refused with {@code server_busy}. A timed
 * out task is interrupted and stops at its next read. Workers only produce in-memory results;
 * files are written by the calling thread afterwards, so a timed out or failed extraction never
 * leaves anything on disk. If persisting fails halfway, whatever was written is removed before the
 * error propagates.
 */
public class ArchiveProcessingService {

    private static final Logger LOG = Logger.getLogger(ArchiveProcessingService.class);

    public static final int DEFAULT_QUEUE_CAPACITY = 16;

    private final ArchiveSafetyValidator validator;
    private final ImageRenderer renderer;
    private final UploadStorage storage;
    private final ArchiveLimits limits;
    private final ExecutorService workers;

    public ArchiveProcessingService(
            ArchiveSafetyValidator validator,
            ImageRenderer renderer,
            UploadStorage storage,
            ArchiveLimits limits) {
        this(
                validator,
                renderer,
                storage,
                limits,
                Math.max(2, Runtime.getRuntime().availableProcessors()),
                DEFAULT_QUEUE_CAPACITY);
    }

    public ArchiveProcessingService(
            ArchiveSafetyValidator validator,
            ImageRenderer renderer,
            UploadStorage storage,
            ArchiveLimits limits,
            int maxWorkers,
            int queueCapacity) {
        this(validator, renderer, storage, limits, newWorkerPool(maxWorkers, queueCapacity));
    }

    ArchiveProcessingService(
            ArchiveSafetyValidator validator,
            ImageRenderer renderer,
            UploadStorage storage,
            ArchiveLimits limits,
            ExecutorService workers) {
        this.validator = validator;
        this.renderer = renderer;
        this.storage = storage;
        this.limits = limits;
        this.workers = workers;
    }

    static ThreadPoolExecutor newWorkerPool(int maxWorkers, int queueCapacity) {
        if (maxWorkers < 1 || queueCapacity < 1) {
            throw new IllegalArgumentException("Worker pool size and queue must be positive");
        }
        AtomicInteger counter = new AtomicInteger();
        ThreadPoolExecutor pool =
                new ThreadPoolExecutor(
                        maxWorkers,
                        maxWorkers,
                        60,
                        TimeUnit.SECONDS,
                        new ArrayBlockingQueue<>(queueCapacity),
                        runnable -> {
                            Thread thread =
                                    new Thread(
                                            runnable,
                                            "archive-extractor-" + counter.incrementAndGet());
                            thread.setDaemon(true);
                            return thread;
                        },
                        new ThreadPoolExecutor.AbortPolicy());
        pool.allowCoreThreadTimeOut(true);
        return pool;
    }

    /**
     * Screens an uploaded archive, selects and stores its preview images and stores the archive
     * itself.
     *
     * @throws ArchiveRejectedException when the archive fails screening or times out
     * @throws StorageException when the files cannot be written
     */
    public ArchiveMetadata process(String originalFilename, Path uploadedFile) {
        ValidatedArchive archive = screen(originalFilename, uploadedFile);
        List<PreviewImage> previews = runWithTimeout(() -> extractPreviews(archive));

        String key = UUID.randomUUID().toString();
        String month = storage.currentMonth();
        String archivePath = month + "/archives/" + key + archive.format().extension();
        String previewDir = previewDirFor(archivePath);
        List<String> previewUrls = new ArrayList<>();
        try {
            StoredFile stored;
            try (InputStream in = Files.newInputStream(uploadedFile)) {
                stored = storage.store(in, limits.maxUploadSize(), archivePath);
            }
            for (PreviewImage preview : previews) {
                String name = "preview_" + preview.rank() + preview.extension();
                previewUrls.add(storage.write(previewDir + "/" + name, preview.data()).url());
            }
            ArchiveMetadata metadata =
                    new ArchiveMetadata(
                            FileNames.baseName(originalFilename),
                            stored.size(),
                            archive.totalFiles(),
                            countImages(archive),
                            previewUrls,
                            archivePath);
            LOG.infof(
                    "Stored archive %s with %d files, %d images, %d previews",
                    archivePath,
                    metadata.totalFiles(),
                    metadata.imageCount(),
                    previewUrls.size());
            return metadata;
        } catch (IOException e) {
            discard(archivePath);
            throw StorageException.storageError("Failed to store archive", e);
        } catch (RuntimeException e) {
            discard(archivePath);
            throw e;
        }
    }

    /** Thumbnails of an uploaded archive without storing anything. */
    public ArchivePreview preview(String originalFilename, Path uploadedFile) {
        ValidatedArchive archive = screen(originalFilename, uploadedFile);
        return runWithTimeout(
                () -> {
                    try (ArchiveContentExtractor extractor = extractor(archive)) {
                        List<String> images = extractor.listImages();
                        List<ArchiveThumbnail> thumbnails =
                                extractor.thumbnails(
                                        images, limits.thumbnailSize(), limits.maxThumbnails());
                        return new ArchivePreview(
                                images.size(), extractor.totalFiles(), thumbnails);
                    }
                });
    }

    /** A larger rendering of one image inside a stored archive. */
    public Optional<String> fullImage(ArchiveMetadata metadata, String entryPath) {
        if (entryPath == null || !ArchiveContentExtractor.isImage(entryPath)) {
            return Optional.empty();
        }
        ValidatedArchive archive = screenStored(metadata);
        return runWithTimeout(
                () -> {
                    try (ArchiveContentExtractor extractor = extractor(archive)) {
                        if (!extractor.listImages().contains(entryPath)) {
                            return Optional.<String>empty();
                        }
                        return extractor.preview(entryPath, limits.fullImageSize());
                    }
                });
    }

    /** Opens the original archive bytes for download. */
    public InputStream openStored(ArchiveMetadata metadata) {
        return storage.open(metadata.storageKey());
    }

    /** Removes a stored archive and its preview directory. Never throws. */
    public void discard(String archivePath) {
        if (archivePath == null) {
            return;
        }
        storage.delete(previewDirFor(archivePath));
        storage.delete(archivePath);
    }

    public void shutdown() {
        workers.shutdownNow();
    }

    List<PreviewImage> extractPreviews(ValidatedArchive archive) throws IOException {
        try (ArchiveContentExtractor extractor = extractor(archive)) {
            List<String> selected =
                    PreviewSelector.selectPreviews(extractor.listImages(), limits.previewCount());
            List<PreviewImage> previews = new ArrayList<>();
            for (int i = 0; i < selected.size(); i++) {
                if (Thread.currentThread().isInterrupted()) {
                    throw new ArchiveRejectedException(
                            ArchiveRejectedException.TIMEOUT,
                            400,
                            "Archive processing was cancelled",
                            null);
                }
                String path = selected.get(i);
                try {
                    ExtractedEntry entry = extractor.extractEntry(path);
                    if (renderer.isImage(entry.data())) {
                        previews.add(new PreviewImage(path, entry.data(), i + 1));
                    } else {
                        LOG.debugf("Skipping preview %s: not a readable image", path);
                    }
                } catch (ArchiveRejectedException e) {
                    if (ArchiveRejectedException.TIMEOUT.equals(e.getReason())) {
                        throw e;
                    }
                    LOG.debugf("Skipping preview %s: %s", path, e.getReason());
                }
            }
            return previews;
        }
    }

    private ValidatedArchive screen(String originalFilename, Path uploadedFile) {
        ArchiveFormat format = ArchiveFormat.fromFilename(originalFilename).orElse(null);
        long size;
        try {
            size = Files.size(uploadedFile);
        } catch (IOException e) {
            throw ArchiveRejectedException.corrupt(e);
        }
        if (size > limits.maxUploadSize()) {
            throw new ArchiveRejectedException(
                    ArchiveRejectedException.TOO_LARGE, "Archive upload is too large");
        }
        ArchiveValidation validation = validator.validate(uploadedFile, format);
        if (!validation.isOk()) {
            LOG.infof("Rejected archive upload: %s", validation.reason());
        }
        return validation.orElseThrow();
    }

    private ValidatedArchive screenStored(ArchiveMetadata metadata) {
        Path file = storage.resolve(metadata.storageKey());
        ArchiveFormat format = ArchiveFormat.fromFilename(metadata.storageKey()).orElse(null);
        return validator.validate(file, format).orElseThrow();
    }

    private ArchiveContentExtractor extractor(ValidatedArchive archive) {
        return new ArchiveContentExtractor(archive, limits.maxEntrySize(), renderer);
    }

    private <T> T runWithTimeout(Callable<T> task) {
        Future<T> future;
        try {
            future = workers.submit(task);
        } catch (RejectedExecutionException e) {
            LOG.warn("Archive worker pool is saturated, refusing archive");
            throw new ArchiveRejectedException(
                    ArchiveRejectedException.BUSY,
                    503,
                    "Too many archives are being processed, please try again later",
                    e);
        }
        try {
            return future.get(limits.processingTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            LOG.warnf(
                    "Archive processing exceeded %s and was cancelled",
                    limits.processingTimeout());
            throw new ArchiveRejectedException(
                    ArchiveRejectedException.TIMEOUT,
                    400,
                    "Archive took too long to process",
                    e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new ArchiveRejectedException(
                    ArchiveRejectedException.TIMEOUT, 400, "Archive processing interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ArchiveRejectedException rejected) {
                throw rejected;
            }
            if (cause instanceof StorageException storageError) {
                throw storageError;
            }
            throw ArchiveRejectedException.corrupt(cause);
        }
    }

    private static int countImages(ValidatedArchive archive) {
        int count = 0;
        for (ArchiveEntryInfo entry : archive.entries()) {
            if (!entry.directory() && ArchiveContentExtractor.isImage(entry.path())) {
                count++;
            }
        }
        return count;
    }

    static String previewDirFor(String archivePath) {
        int slash = archivePath.indexOf("/archives/");
        String month = slash >= 0 ? archivePath.substring(0, slash) : "";
        String key = FileNames.stem(archivePath);
        return (month.isEmpty() ? "" : month + "/") + "previews/" + key;
    }
}
