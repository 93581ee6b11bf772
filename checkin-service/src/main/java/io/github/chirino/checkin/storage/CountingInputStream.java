package io.github.chirino.checkin.storage;

import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;

/**
 * Counts bytes read and throws {@link StorageException} ({@code file_too_large}) as soon as the
 * count passes {@code maxSize}. Used for uploads and for every archive entry that is decompressed,
 * so a declared size can never be trusted on its own.
 *
 * <p>Reads also fail with {@link InterruptedIOException} once the reading thread is interrupted, so
 * a cancelled extraction stops at its next read instead of running to completion.
 */
public class CountingInputStream extends FilterInputStream {

    private final long maxSize;
    private long count;

    public CountingInputStream(InputStream in, long maxSize) {
        super(in);
        this.maxSize = maxSize;
    }

    @Override
    public int read() throws IOException {
        checkInterrupted();
        int b = super.read();
        if (b != -1) {
            count++;
            checkLimit();
        }
        return b;
    }

    @Override
    public int read(byte[] b, int off, int len) throws IOException {
        checkInterrupted();
        int n = super.read(b, off, len);
        if (n > 0) {
            count += n;
            checkLimit();
        }
        return n;
    }

    @Override
    public long skip(long n) throws IOException {
        long skipped = super.skip(n);
        if (skipped > 0) {
            count += skipped;
            checkLimit();
        }
        return skipped;
    }

    public long getCount() {
        return count;
    }

    private static void checkInterrupted() throws InterruptedIOException {
        if (Thread.currentThread().isInterrupted()) {
            throw new InterruptedIOException("Read interrupted");
        }
    }

    private void checkLimit() {
        if (count > maxSize) {
            throw StorageException.fileTooLarge(maxSize, count);
        }
    }
}
