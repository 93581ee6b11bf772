package io.github.chirino.checkin.storage;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.chirino.checkin.MutableClock;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class MediaStoreTest {

    @TempDir Path dir;

    private UploadStorage storage;
    private MediaStore media;

    @BeforeEach
    void setUp() {
        storage = new UploadStorage(dir, MutableClock.startingAt("2024-05-01T10:00:00Z"));
        media = new MediaStore(storage, 1024);
    }

    @Test
    void images_and_videos_are_supported() {
        assertTrue(MediaStore.isSupported("holiday.JPG"));
        assertTrue(MediaStore.isSupported("clip.webm"));
        assertTrue(MediaStore.isVideo("clip.MOV"));
        assertFalse(MediaStore.isVideo("photo.png"));
        assertFalse(MediaStore.isSupported("archive.zip"));
        assertFalse(MediaStore.isSupported("noextension"));
    }

    @Test
    void stores_under_the_month_with_a_random_name() {
        StoredFile stored = media.store("../../My Photo.PNG", input(10));

        assertTrue(stored.relativePath().startsWith("2024-05/"));
        assertTrue(stored.relativePath().endsWith(".png"));
        assertFalse(stored.relativePath().contains("My Photo"));
        assertEquals(10, stored.size());
        assertTrue(storage.exists(stored.relativePath()));
    }

    @Test
    void unsupported_type_is_rejected_before_writing() {
        StorageException e =
                assertThrows(StorageException.class, () -> media.store("run.exe", input(10)));

        assertEquals(MediaStore.UNSUPPORTED_TYPE, e.getCode());
        assertEquals(400, e.getHttpStatus());
    }

    @Test
    void size_limit_is_enforced_on_the_stream() {
        StorageException e =
                assertThrows(StorageException.class, () -> media.store("big.mp4", input(1025)));

        assertEquals(StorageException.FILE_TOO_LARGE, e.getCode());
    }

    @Test
    void delete_removes_the_stored_file() {
        StoredFile stored = media.store("a.gif", input(3));

        media.delete(stored);
        media.delete(null);

        assertFalse(storage.exists(stored.relativePath()));
    }

    @Test
    void counting_stream_fails_once_the_limit_is_passed() throws IOException {
        try (CountingInputStream in = new CountingInputStream(input(5), 5)) {
            assertEquals(5, in.readAllBytes().length);
            assertEquals(5, in.getCount());
        }
        try (CountingInputStream in = new CountingInputStream(input(6), 5)) {
            assertEquals(0, in.read());
            assertThrows(StorageException.class, in::readAllBytes);
        }
    }

    @Test
    void counting_stream_stops_reading_once_the_thread_is_interrupted() throws IOException {
        try (CountingInputStream in = new CountingInputStream(input(10), 100)) {
            Thread.currentThread().interrupt();
            try {
                assertThrows(InterruptedIOException.class, in::read);
                assertThrows(InterruptedIOException.class, in::readAllBytes);
            } finally {
                Thread.interrupted();
            }
            assertEquals(10, in.readAllBytes().length);
        }
    }

    private static InputStream input(int size) {
        return new ByteArrayInputStream(new byte[size]);
    }
}
