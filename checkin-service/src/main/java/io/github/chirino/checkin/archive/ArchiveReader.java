package io.github.chirino.checkin.archive;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.nio.channels.SeekableByteChannel;
import java.util.List;

/** Random-access view over one archive container. */
public interface ArchiveReader extends Closeable {

    /** Entries in the order the container lists them, directories included. */
    List<ArchiveEntryInfo> entries() throws IOException;

    /** Opens the decompressed data of the named entry. */
    InputStream open(String path) throws IOException;

    static ArchiveReader open(SeekableByteChannel channel, ArchiveFormat format)
            throws IOException {
        return switch (format) {
            case ZIP -> new ZipArchiveReader(channel);
            case SEVEN_Z -> new SevenZipArchiveReader(channel);
        };
    }
}
