package org.qbitspark.fileboxstorage.storage_service.utils;

import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Aborts a transfer between chunks once the reading thread is interrupted or a deadline has
 * passed. Closing it closes the wrapped stream.
 */
public class CancellableInputStream extends FilterInputStream {

    private final Clock clock;
    private final Instant deadline;

    private CancellableInputStream(InputStream in, Clock clock, Instant deadline) {
        super(in);
        this.clock = clock;
        this.deadline = deadline;
    }

    public static InputStream of(InputStream in) {
        if (in instanceof CancellableInputStream) {
            return in;
        }
        return new CancellableInputStream(in, null, null);
    }

    public static InputStream withTimeout(InputStream in, Duration timeout, Clock clock) {
        if (timeout == null) {
            return of(in);
        }
        return new CancellableInputStream(in, clock, clock.instant().plus(timeout));
    }

    @Override
    public int read() throws IOException {
        checkNotCancelled();
        return super.read();
    }

    @Override
    public int read(byte[] b, int off, int len) throws IOException {
        checkNotCancelled();
        return super.read(b, off, len);
    }

    @Override
    public long skip(long n) throws IOException {
        checkNotCancelled();
        return super.skip(n);
    }

    private void checkNotCancelled() throws InterruptedIOException {
        if (Thread.currentThread().isInterrupted()) {
            throw new InterruptedIOException("transfer interrupted");
        }
        if (deadline != null && clock.instant().isAfter(deadline)) {
            throw new InterruptedIOException("transfer deadline exceeded");
        }
    }
}
