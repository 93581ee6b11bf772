package io.github.chirino.checkin.archive;

import java.io.IOException;
import java.io.InputStream;
import java.nio.channels.SeekableByteChannel;
import java.util.ArrayList;
import java.util.List;
import org.apache.commons.compress.archivers.sevenz.SevenZArchiveEntry;
import org.apache.commons.compress.archivers.sevenz.SevenZFile;

class SevenZipArchiveReader implements ArchiveReader {

    private final SevenZFile sevenZ;

    SevenZipArchiveReader(SeekableByteChannel channel) throws IOException {
        this.sevenZ = new SevenZFile(channel);
    }

    @Override
    public List<ArchiveEntryInfo> entries() {
        List<ArchiveEntryInfo> result = new ArrayList<>();
        for (SevenZArchiveEntry entry : sevenZ.getEntries()) {
            long size = entry.isDirectory() || !entry.hasStream() ? 0 : entry.getSize();
            result.add(new ArchiveEntryInfo(entry.getName(), size, entry.isDirectory()));
        }
        return result;
    }

    @Override
    public InputStream open(String path) throws IOException {
        for (SevenZArchiveEntry entry : sevenZ.getEntries()) {
            if (path.equals(entry.getName()) && !entry.isDirectory()) {
                return sevenZ.getInputStream(entry);
            }
        }
        throw new IOException("No such entry: " + path);
    }

    @Override
    public void close() throws IOException {
        sevenZ.close();
    }
}
