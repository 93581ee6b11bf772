package io.github.chirino.checkin.screening;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import org.jboss.logging.Logger;

/**
 * Spam keywords loaded from a newline-delimited file ({@code #} comments, blank lines ignored).
 * Matching is case-insensitive substring search. {@link #reloadIfChanged()} picks up edits
 * without a restart.
 */
public class KeywordDenylist {

    private static final Logger LOG = Logger.getLogger(KeywordDenylist.class);

    private final Path file;
    private volatile List<String> keywords = List.of();
    private volatile FileTime loadedModifiedTime;

    public KeywordDenylist(Path file) {
        this.file = file;
        reload();
    }

    /** Builds a fixed list that is never reloaded. */
    public static KeywordDenylist of(List<String> keywords) {
        KeywordDenylist denylist = new KeywordDenylist(null);
        denylist.keywords = normalize(keywords);
        return denylist;
    }

    public boolean matches(String text) {
        if (text == null || text.isEmpty()) {
            return false;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        for (String keyword : keywords) {
            if (lower.contains(keyword)) {
                return true;
            }
        }
        return false;
    }

    public int size() {
        return keywords.size();
    }

    public synchronized void reloadIfChanged() {
        FileTime current = modifiedTime();
        if (current == null ? loadedModifiedTime != null : !current.equals(loadedModifiedTime)) {
            reload();
        }
    }

    public synchronized void reload() {
        if (file == null) {
            return;
        }
        try {
            keywords = normalize(Files.readAllLines(file, StandardCharsets.UTF_8));
            loadedModifiedTime = modifiedTime();
            LOG.infof("Loaded %d spam keywords from %s", keywords.size(), file);
        } catch (NoSuchFileException e) {
            keywords = List.of();
            loadedModifiedTime = null;
            LOG.debugf("Spam keyword file %s does not exist", file);
        } catch (IOException e) {
            LOG.errorf(e, "Failed to read spam keywords from %s, keeping previous list", file);
        }
    }

    private FileTime modifiedTime() {
        if (file == null) {
            return null;
        }
        try {
            return Files.getLastModifiedTime(file);
        } catch (IOException e) {
            return null;
        }
    }

    private static List<String> normalize(List<String> lines) {
        Set<String> result = new LinkedHashSet<>();
        for (String line : lines) {
            String clean = line.trim();
            if (!clean.isEmpty() && !clean.startsWith("#")) {
                result.add(clean.toLowerCase(Locale.ROOT));
            }
        }
        return List.copyOf(new ArrayList<>(result));
    }
}
