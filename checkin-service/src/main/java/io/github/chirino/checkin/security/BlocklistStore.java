package io.github.chirino.checkin.security;

import io.github.chirino.checkin.storage.StorageException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.FileTime;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.jboss.logging.Logger;

/**
 * Persistent, append-only set of blocked identifiers (IP addresses or submitter fingerprints).
 *
 * <p>The file is newline-delimited text; blank lines and lines starting with {@code #} are
 * ignored. Readers see an immutable in-memory snapshot, appends are serialized and written with a
 * single {@code APPEND} write so a failure can never truncate existing entries.
 */
public class BlocklistStore {

    private static final Logger LOG = Logger.getLogger(BlocklistStore.class);

    public static final int MAX_IDENTIFIER_LENGTH = 256;

    private final Path file;
    private final Object writeLock = new Object();
    private volatile Set<String> entries = Set.of();
    private volatile FileTime loadedModifiedTime;

    public BlocklistStore(Path file) {
        this.file = file;
        reload();
    }

    public boolean isBlocked(String identifier) {
        if (identifier == null) {
            return false;
        }
        String value = identifier.trim();
        return !value.isEmpty() && entries.contains(value);
    }

    public boolean isAnyBlocked(String... identifiers) {
        for (String identifier : identifiers) {
            if (isBlocked(identifier)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Appends {@code identifier} to the store.
     *
     * @return {@code false} when the identifier was already present
     * @throws StorageException when the file cannot be written
     */
    public boolean append(String identifier) {
        String value = validate(identifier);
        synchronized (writeLock) {
            if (entries.contains(value)) {
                return false;
            }
            byte[] line = (value + "\n").getBytes(StandardCharsets.UTF_8);
            try {
                Path parent = file.toAbsolutePath().getParent();
                if (parent != null) {
                    Files.createDirectories(parent);
                }
                Files.write(
                        file, line, StandardOpenOption.CREATE, StandardOpenOption.APPEND);
            } catch (IOException e) {
                throw StorageException.storageError("Failed to append to blocklist", e);
            }
            Set<String> updated = new HashSet<>(entries);
            updated.add(value);
            entries = Set.copyOf(updated);
            loadedModifiedTime = modifiedTime();
        }
        LOG.infof("Added identifier to blocklist (%d entries)", entries.size());
        return true;
    }

    /** Re-reads the file if it was modified outside this process. */
    public void reloadIfChanged() {
        FileTime current = modifiedTime();
        if (current != null && !current.equals(loadedModifiedTime)) {
            reload();
        }
    }

    public void reload() {
        synchronized (writeLock) {
            Set<String> loaded = new HashSet<>();
            try {
                List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
                for (String line : lines) {
                    String clean = line.trim();
                    if (!clean.isEmpty() && !clean.startsWith("#")) {
                        loaded.add(clean);
                    }
                }
                LOG.infof("Loaded %d blocklist entries from %s", loaded.size(), file);
            } catch (NoSuchFileException e) {
                LOG.debugf("Blocklist file %s does not exist yet", file);
            } catch (IOException e) {
                LOG.errorf(e, "Failed to read blocklist %s, keeping previous entries", file);
                return;
            }
            entries = Set.copyOf(loaded);
            loadedModifiedTime = modifiedTime();
        }
    }

    public int size() {
        return entries.size();
    }

    public Set<String> snapshot() {
        return entries;
    }

    private FileTime modifiedTime() {
        try {
            return Files.getLastModifiedTime(file);
        } catch (IOException e) {
            return null;
        }
    }

    /**
     * Whether {@code identifier} can be stored as one line of the file: not blank, at most {@value
     * #MAX_IDENTIFIER_LENGTH} characters once trimmed, not a comment and free of control
     * characters.
     */
    public static boolean isValidIdentifier(String identifier) {
        if (identifier == null || identifier.isBlank()) {
            return false;
        }
        String value = identifier.trim();
        if (value.length() > MAX_IDENTIFIER_LENGTH || value.startsWith("#")) {
            return false;
        }
        for (int i = 0; i < value.length(); i++) {
            if (Character.isISOControl(value.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    private static String validate(String identifier) {
        if (!isValidIdentifier(identifier)) {
            throw new IllegalArgumentException("Invalid blocklist identifier");
        }
        return identifier.trim();
    }
}
