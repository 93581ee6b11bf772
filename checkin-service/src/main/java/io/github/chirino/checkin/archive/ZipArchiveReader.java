package io.github.chirino.checkin.archive;

import java.io.IOException;
import java.io.InputStream;
import java.nio.channels.SeekableByteChannel;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.apache.commons.compress.archivers.zip.ZipArchiveEntry;
import org.apache.commons.compress.archivers.zip.ZipFile;

class ZipArchiveReader implements ArchiveReader {

    private final ZipFile zip;

    ZipArchiveReader(SeekableByteChannel channel) throws IOException {
        this.zip = new ZipFile(channel);
    }

    @Override
    public List<ArchiveEntryInfo> entries() {
        List<ArchiveEntryInfo> result = new ArrayList<>();
        for (ZipArchiveEntry entry : Collections.list(zip.getEntries())) {
            result.add(
                    new ArchiveEntryInfo(entry.getName(), entry.getSize(), entry.isDirectory()));
        }
        return result;
    }

    @Override
    public InputStream open(String path) throws IOException {
        ZipArchiveEntry entry = zip.getEntry(path);
        if (entry == null || entry.isDirectory()) {
            throw new IOException("No such entry: " + path);
        }
        if (!zip.canReadEntryData(entry)) {
            throw new IOException("Unsupported compression or encryption for entry");
        }
        return zip.getInputStream(entry);
    }

    @Override
    public void close() throws IOException {
        zip.close();
    }
}
