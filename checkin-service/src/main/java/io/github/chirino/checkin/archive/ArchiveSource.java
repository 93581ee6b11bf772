package io.github.chirino.checkin.archive;

import java.io.IOException;
import java.nio.channels.SeekableByteChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import org.apache.commons.compress.utils.SeekableInMemoryByteChannel;

/** Where the raw archive bytes live. Each call opens an independent read-only channel. */
@FunctionalInterface
public interface ArchiveSource {

    SeekableByteChannel openChannel() throws IOException;

    static ArchiveSource of(Path file) {
        return () -> Files.newByteChannel(file, StandardOpenOption.READ);
    }

    static ArchiveSource of(byte[] data) {
        return () -> new SeekableInMemoryByteChannel(data);
    }
}
