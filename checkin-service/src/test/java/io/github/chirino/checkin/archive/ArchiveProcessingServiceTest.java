package io.github.chirino.checkin.archive;

import static io.github.chirino.checkin.archive.ArchiveFixtures.archive;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.chirino.checkin.MutableClock;
import io.github.chirino.checkin.model.ArchiveMetadata;
import io.github.chirino.checkin.storage.StoredFile;
import io.github.chirino.checkin.storage.UploadStorage;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.stream.Stream;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ArchiveProcessingServiceTest {

    @TempDir Path dir;

    private UploadStorage storage;
    private ArchiveProcessingService service;

    @BeforeEach
    void setUp() {
        storage =
                new UploadStorage(
                        dir.resolve("uploads"), MutableClock.startingAt("2024-05-01T10:00:00Z"));
        ArchiveLimits limits =
                new ArchiveLimits(1_000_000, 500_000, 3, 64, 128, 2, Duration.ofSeconds(20));
        service =
                new ArchiveProcessingService(
                        new ArchiveSafetyValidator(50, 5_000_000),
                        new ImageRenderer(),
                        storage,
                        limits);
    }

    @AfterEach
    void tearDown() {
        service.shutdown();
    }

    @Test
    void stores_the_archive_and_its_selected_previews() throws Exception {
        Path upload =
                archive()
                        .image("cover.png", 8, 8)
                        .image("page2.png", 8, 8)
                        .image("page10.png", 8, 8)
                        .image("page1.png", 8, 8)
                        .image("page3.png", 8, 8)
                        .text("credits.txt", "thanks")
                        .writeZip(dir.resolve("upload.tmp"));

        ArchiveMetadata metadata = service.process("C:\\Users\\me\\comic.zip", upload);

        assertEquals("comic.zip", metadata.filename());
        assertEquals(Files.size(upload), metadata.size());
        assertEquals(6, metadata.totalFiles());
        assertEquals(5, metadata.imageCount());
        assertTrue(metadata.storageKey().startsWith("2024-05/archives/"));
        assertTrue(metadata.storageKey().endsWith(".zip"));
        assertTrue(storage.exists(metadata.storageKey()));

        String previewDir =
                StoredFile.URL_PREFIX
                        + ArchiveProcessingService.previewDirFor(metadata.storageKey());
        assertEquals(
                List.of(
                        previewDir + "/preview_1.png",
                        previewDir + "/preview_2.png",
                        previewDir + "/preview_3.png"),
                metadata.previewImages());
        // page1, page2 and page3 in that order
        String first = metadata.previewImages().get(0).substring(StoredFile.URL_PREFIX.length());
        assertArrayEquals(ArchiveFixtures.png(8, 8), storage.readAll(first));
    }

    @Test
    void seven_zip_archives_are_processed_too() throws Exception {
        Path upload =
                archive()
                        .directory("pics")
                        .image("pics/b.png", 6, 6)
                        .image("pics/a.png", 6, 6)
                        .writeSevenZ(dir.resolve("upload.bin"));

        ArchiveMetadata metadata = service.process("pics.7z", upload);

        assertTrue(metadata.storageKey().endsWith(".7z"));
        assertEquals(2, metadata.totalFiles());
        assertEquals(2, metadata.imageCount());
        assertEquals(2, metadata.previewImages().size());
    }

    @Test
    void undecodable_preview_candidates_are_skipped() throws Exception {
        Path upload =
                archive()
                        .text("1.jpg", "garbage")
                        .image("2.png", 4, 4)
                        .writeZip(dir.resolve("upload.tmp"));

        ArchiveMetadata metadata = service.process("mixed.zip", upload);

        assertEquals(2, metadata.imageCount());
        assertEquals(1, metadata.previewImages().size());
        assertTrue(metadata.previewImages().get(0).endsWith("/preview_2.png"));
    }

    @Test
    void rejected_archives_leave_nothing_on_disk() throws Exception {
        Path upload =
                archive()
                        .image("a.png", 4, 4)
                        .text("payload.exe", "MZ")
                        .writeZip(dir.resolve("upload.tmp"));

        ArchiveRejectedException e =
                assertThrows(
                        ArchiveRejectedException.class,
                        () -> service.process("bad.zip", upload));

        assertEquals(ArchiveRejectedException.DANGEROUS_ENTRY, e.getReason());
        assertEquals(0, regularFiles(storage.root()));
    }

    @Test
    void unsupported_extension_is_rejected() throws Exception {
        Path upload = archive().image("a.png", 4, 4).writeZip(dir.resolve("upload.tmp"));

        ArchiveRejectedException e =
                assertThrows(
                        ArchiveRejectedException.class,
                        () -> service.process("images.rar", upload));

        assertEquals(ArchiveRejectedException.UNSUPPORTED_FORMAT, e.getReason());
    }

    @Test
    void oversized_uploads_are_rejected_before_opening() throws Exception {
        Path upload = dir.resolve("huge.zip");
        Files.write(upload, new byte[1_000_001]);

        ArchiveRejectedException e =
                assertThrows(
                        ArchiveRejectedException.class,
                        () -> service.process("huge.zip", upload));

        assertEquals(ArchiveRejectedException.TOO_LARGE, e.getReason());
        assertEquals(413, e.getHttpStatus());
    }

    @Test
    void preview_returns_limited_thumbnails_and_stores_nothing() throws Exception {
        Path upload =
                archive()
                        .image("a.png", 100, 50)
                        .image("b.png", 10, 10)
                        .image("c.png", 10, 10)
                        .text("d.txt", "d")
                        .writeZip(dir.resolve("upload.tmp"));

        ArchivePreview preview = service.preview("set.zip", upload);

        assertEquals(3, preview.imageCount());
        assertEquals(4, preview.totalFiles());
        assertEquals(2, preview.thumbnails().size());
        assertEquals("a.png", preview.thumbnails().get(0).name());
        assertTrue(
                preview.thumbnails().get(0).dataUri().startsWith(ImageRenderer.DATA_URI_PREFIX));
        assertEquals(0, regularFiles(storage.root()));
    }

    @Test
    void full_image_renders_an_entry_of_a_stored_archive() throws Exception {
        Path upload =
                archive()
                        .image("gallery/one.png", 300, 300)
                        .text("gallery/notes.txt", "n")
                        .writeZip(dir.resolve("upload.tmp"));
        ArchiveMetadata metadata = service.process("gallery.zip", upload);

        Optional<String> image = service.fullImage(metadata, "gallery/one.png");

        assertTrue(image.isPresent());
        assertTrue(image.get().startsWith(ImageRenderer.DATA_URI_PREFIX));
        assertTrue(service.fullImage(metadata, "gallery/missing.png").isEmpty());
        assertTrue(service.fullImage(metadata, "gallery/notes.txt").isEmpty());
        assertTrue(service.fullImage(metadata, null).isEmpty());
    }

    @Test
    void stored_archive_can_be_downloaded_and_discarded() throws Exception {
        Path upload = archive().image("x.png", 4, 4).writeZip(dir.resolve("upload.tmp"));
        ArchiveMetadata metadata = service.process("x.zip", upload);

        try (InputStream in = service.openStored(metadata)) {
            assertArrayEquals(Files.readAllBytes(upload), in.readAllBytes());
        }

        service.discard(metadata.storageKey());

        assertEquals(0, regularFiles(storage.root()));
    }

    @Test
    void extraction_past_the_timeout_is_rejected_and_leaves_nothing_on_disk() throws Exception {
        ArchiveLimits tight =
                new ArchiveLimits(50_000_000, 50_000_000, 3, 64, 128, 2, Duration.ofMillis(1));
        ArchiveProcessingService slow =
                new ArchiveProcessingService(
                        new ArchiveSafetyValidator(50, 500_000_000),
                        new ImageRenderer(),
                        storage,
                        tight);
        Path upload =
                archive()
                        .image("1.png", 2000, 2000)
                        .image("2.png", 2000, 2000)
                        .image("3.png", 2000, 2000)
                        .image("4.png", 2000, 2000)
                        .writeZip(dir.resolve("upload.tmp"));
        try {
            ArchiveRejectedException e =
                    assertThrows(
                            ArchiveRejectedException.class,
                            () -> slow.process("slow.zip", upload));

            assertEquals(ArchiveRejectedException.TIMEOUT, e.getReason());
            assertEquals(400, e.getHttpStatus());
            assertEquals(0, regularFiles(storage.root()));
        } finally {
            slow.shutdown();
        }
    }

    @Test
    void saturated_worker_pool_refuses_new_archives() throws Exception {
        ExecutorService saturated = Executors.newSingleThreadExecutor();
        saturated.shutdown();
        ArchiveProcessingService busy =
                new ArchiveProcessingService(
                        new ArchiveSafetyValidator(50, 5_000_000),
                        new ImageRenderer(),
                        storage,
                        ArchiveLimits.defaults(),
                        saturated);
        Path upload = archive().image("a.png", 4, 4).writeZip(dir.resolve("upload.tmp"));

        ArchiveRejectedException e =
                assertThrows(
                        ArchiveRejectedException.class, () -> busy.process("a.zip", upload));

        assertEquals(ArchiveRejectedException.BUSY, e.getReason());
        assertEquals(503, e.getHttpStatus());
        assertEquals(0, regularFiles(storage.root()));
    }

    @Test
    void worker_pool_is_bounded() {
        ThreadPoolExecutor pool = ArchiveProcessingService.newWorkerPool(2, 3);
        try {
            assertEquals(2, pool.getMaximumPoolSize());
            assertEquals(3, pool.getQueue().remainingCapacity());
            assertTrue(pool.allowsCoreThreadTimeOut());
        } finally {
            pool.shutdownNow();
        }
        assertThrows(
                IllegalArgumentException.class,
                () -> ArchiveProcessingService.newWorkerPool(0, 3));
    }

    @Test
    void preview_dir_sits_next_to_the_month_directory() {
        assertEquals(
                "2024-05/previews/abc",
                ArchiveProcessingService.previewDirFor("2024-05/archives/abc.zip"));
        assertEquals("previews/abc", ArchiveProcessingService.previewDirFor("abc.7z"));
    }

    private static long regularFiles(Path root) throws Exception {
        if (!Files.exists(root)) {
            return 0;
        }
        try (Stream<Path> files = Files.walk(root)) {
            return files.filter(Files::isRegularFile).count();
        }
    }
}
