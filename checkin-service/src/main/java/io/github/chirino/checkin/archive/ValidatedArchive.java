package io.github.chirino.checkin.archive;

import java.io.IOException;
import java.util.List;

/**
 * An archive that passed {@link ArchiveSafetyValidator}. Only the validator can create one, so
 * holding an instance proves the structural checks ran.
 */
public final class ValidatedArchive {

    private final ArchiveSource source;
    private final ArchiveFormat format;
    private final List<ArchiveEntryInfo> entries;
    private final long declaredSize;

    ValidatedArchive(
            ArchiveSource source,
            ArchiveFormat format,
            List<ArchiveEntryInfo> entries,
            long declaredSize) {
        this.source = source;
        this.format = format;
        this.entries = List.copyOf(entries);
        this.declaredSize = declaredSize;
    }

    public ArchiveFormat format() {
        return format;
    }

    public List<ArchiveEntryInfo> entries() {
        return entries;
    }

    /** Number of non-directory entries. */
    public int totalFiles() {
        return (int) entries.stream().filter(e -> !e.directory()).count();
    }

    public long declaredSize() {
        return declaredSize;
    }

    ArchiveReader openReader() throws IOException {
        return ArchiveReader.open(source.openChannel(), format);
    }
}
