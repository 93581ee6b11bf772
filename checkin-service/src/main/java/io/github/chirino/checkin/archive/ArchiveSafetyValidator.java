package io.github.chirino.checkin.archive;

import io.github.chirino.checkin.model.FileNames;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import org.jboss.logging.Logger;

/**
 * Structural screening of an untrusted archive, run before anything is decompressed. Only the
 * container's directory is read: entry count, entry names and the sizes the archive declares.
 */
public class ArchiveSafetyValidator {

    private static final Logger LOG = Logger.getLogger(ArchiveSafetyValidator.class);

    public static final Set<String> DANGEROUS_EXTENSIONS =
            Set.of(
                    // executables and installers
                    ".exe", ".bat", ".cmd", ".com", ".msi", ".scr", ".pif", ".app", ".dmg",
                    ".pkg", ".sh", ".bin", ".run",
                    // scripts
                    ".js", ".vbs", ".vbe", ".jse", ".ws", ".wsf", ".wsc", ".wsh", ".ps1",
                    ".psm1", ".psd1", ".py", ".pyw", ".pyc", ".pyo", ".rb", ".pl", ".php",
                    // macro-enabled office documents
                    ".docm", ".xlsm", ".pptm", ".dotm", ".xltm", ".potm",
                    // libraries, shortcuts, registry files, script-capable markup
                    ".jar", ".class", ".dll", ".sys", ".drv", ".lnk", ".url", ".reg", ".hta",
                    ".html", ".htm", ".svg");

    private final int maxEntries;
    private final long maxDeclaredSize;

    public ArchiveSafetyValidator(int maxEntries, long maxDeclaredSize) {
        this.maxEntries = maxEntries;
        this.maxDeclaredSize = maxDeclaredSize;
    }

    public ArchiveValidation validate(byte[] archiveBytes, ArchiveFormat format) {
        return validate(ArchiveSource.of(archiveBytes), format);
    }

    public ArchiveValidation validate(Path archiveFile, ArchiveFormat format) {
        return validate(ArchiveSource.of(archiveFile), format);
    }

    public ArchiveValidation validate(ArchiveSource source, ArchiveFormat format) {
        if (format == null) {
            return ArchiveValidation.reject(
                    ArchiveRejectedException.UNSUPPORTED_FORMAT,
                    "Unsupported archive format, only .zip and .7z are accepted");
        }
        List<ArchiveEntryInfo> entries;
        try (ArchiveReader reader = ArchiveReader.open(source.openChannel(), format)) {
            entries = reader.entries();
        } catch (Exception e) {
            LOG.debugf("Unreadable %s archive: %s", format, e.toString());
            return ArchiveValidation.reject(ArchiveRejectedException.corrupt(e));
        }

        if (entries.size() > maxEntries) {
            return ArchiveValidation.reject(
                    ArchiveRejectedException.TOO_MANY_ENTRIES,
                    "Archive contains too many files (maximum " + maxEntries + ")");
        }

        long declared = 0;
        for (ArchiveEntryInfo entry : entries) {
            if (entry.directory()) {
                continue;
            }
            if (isDangerous(entry.path())) {
                return ArchiveValidation.reject(
                        ArchiveRejectedException.DANGEROUS_ENTRY,
                        "Archive contains a file type that is not allowed");
            }
            if (entry.declaredSize() < 0) {
                return ArchiveValidation.reject(ArchiveRejectedException.corrupt(null));
            }
            declared += entry.declaredSize();
            if (declared > maxDeclaredSize || declared < 0) {
                return ArchiveValidation.reject(
                        ArchiveRejectedException.TOO_LARGE,
                        "Archive expands beyond the allowed size");
            }
        }
        return ArchiveValidation.ok(new ValidatedArchive(source, format, entries, declared));
    }

    public static boolean isDangerous(String entryName) {
        return DANGEROUS_EXTENSIONS.contains(FileNames.extension(entryName));
    }
}
