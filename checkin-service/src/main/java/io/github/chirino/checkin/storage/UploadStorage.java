package io.github.chirino.checkin.storage;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.UUID;
import org.jboss.logging.Logger;

/**
 * Local file system storage for media, archives and archive previews.
 *
 * <p>Files are first written to a temp file in the target directory and then moved into place, so
 * a reader never observes a half-written file. Every relative path is resolved against the root
 * and rejected if it would escape it.
 */
public class UploadStorage {

    private static final Logger LOG = Logger.getLogger(UploadStorage.class);
    private static final DateTimeFormatter MONTH =
            DateTimeFormatter.ofPattern("yyyy-MM", Locale.ROOT).withZone(ZoneOffset.UTC);

    private final Path root;
    private final Clock clock;

    public UploadStorage(Path root, Clock clock) {
        this.root = root.toAbsolutePath().normalize();
        this.clock = clock;
    }

    public Path root() {
        return root;
    }

    /** {@code yyyy-MM} directory for files uploaded now. */
    public String currentMonth() {
        return MONTH.format(clock.instant());
    }

    /** A fresh random file name carrying {@code extension} (which includes the dot). */
    public static String randomName(String extension) {
        return UUID.randomUUID() + (extension == null ? "" : extension);
    }

    public StoredFile store(InputStream data, long maxSize, String relativePath) {
        Path target = resolve(relativePath);
        Path temp = null;
        try {
            Files.createDirectories(target.getParent());
            temp = Files.createTempFile(target.getParent(), ".upload-", ".tmp");
            CountingInputStream counted = new CountingInputStream(data, maxSize);
            try (OutputStream out = Files.newOutputStream(temp)) {
                counted.transferTo(out);
            }
            moveIntoPlace(temp, target);
            temp = null;
            return new StoredFile(relativePath, counted.getCount());
        } catch (IOException e) {
            throw StorageException.storageError("Failed to store " + relativePath, e);
        } finally {
            deleteQuietly(temp);
        }
    }

    public StoredFile write(String relativePath, byte[] data) {
        Path target = resolve(relativePath);
        Path temp = null;
        try {
            Files.createDirectories(target.getParent());
            temp = Files.createTempFile(target.getParent(), ".upload-", ".tmp");
            Files.write(temp, data);
            moveIntoPlace(temp, target);
            temp = null;
            return new StoredFile(relativePath, data.length);
        } catch (IOException e) {
            throw StorageException.storageError("Failed to write " + relativePath, e);
        } finally {
            deleteQuietly(temp);
        }
    }

    public InputStream open(String relativePath) {
        try {
            return Files.newInputStream(resolve(relativePath));
        } catch (NoSuchFileException e) {
            throw new StorageException(
                    "not_found", 404, "Stored file not found: " + relativePath);
        } catch (IOException e) {
            throw StorageException.storageError("Failed to open " + relativePath, e);
        }
    }

    public byte[] readAll(String relativePath) {
        try (InputStream in = open(relativePath)) {
            return in.readAllBytes();
        } catch (IOException e) {
            throw StorageException.storageError("Failed to read " + relativePath, e);
        }
    }

    public boolean exists(String relativePath) {
        return Files.isRegularFile(resolve(relativePath));
    }

    /** Deletes a file or a whole directory tree. Failures are logged, never thrown. */
    public void delete(String relativePath) {
        if (relativePath == null || relativePath.isBlank()) {
            return;
        }
        Path target;
        try {
            target = resolve(relativePath);
        } catch (StorageException e) {
            LOG.warnf("Refusing to delete %s: %s", relativePath, e.getMessage());
            return;
        }
        try {
            if (Files.isDirectory(target)) {
                Files.walkFileTree(
                        target,
                        new SimpleFileVisitor<>() {
                            @Override
                            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs)
                                    throws IOException {
                                Files.delete(file);
                                return FileVisitResult.CONTINUE;
                            }

                            @Override
                            public FileVisitResult postVisitDirectory(Path dir, IOException exc)
                                    throws IOException {
                                Files.delete(dir);
                                return FileVisitResult.CONTINUE;
                            }
                        });
            } else {
                Files.deleteIfExists(target);
            }
        } catch (IOException e) {
            LOG.warnf("Failed to delete %s: %s", relativePath, e.getMessage());
        }
    }

    /** Absolute path of a stored file; rejects paths escaping the upload root. */
    public Path resolve(String relativePath) {
        if (relativePath == null || relativePath.isBlank()) {
            throw new StorageException("invalid_path", 400, "Empty storage path");
        }
        Path resolved = root.resolve(relativePath).normalize();
        if (!resolved.startsWith(root) || resolved.equals(root)) {
            throw new StorageException("invalid_path", 400, "Invalid storage path");
        }
        return resolved;
    }

    private static void moveIntoPlace(Path temp, Path target) throws IOException {
        try {
            Files.move(
                    temp,
                    target,
                    StandardCopyOption.ATOMIC_MOVE,
                    StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(Path path) {
        if (path == null) {
            return;
        }
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            LOG.debugf("Failed to delete temp file %s: %s", path, e.getMessage());
        }
    }
}
