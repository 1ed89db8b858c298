package com.phillippitts.mediatoolbox.service.job.progress;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Splits a raw byte stream into progress records.
 *
 * <p>A record ends at the next {@code \r} or {@code \n}, whichever comes first. Tools that redraw
 * a terminal line use bare carriage returns, so line-oriented readers would stall until the
 * process exits. Bytes of an unfinished record are kept across reads.
 *
 * <p>Records are decoded as UTF-8 with replacement of malformed input, stripped, and dropped when
 * blank (a {@code \r\n} pair therefore never yields an empty record). A read error ends the
 * stream the same way end-of-file does: the process is usually gone at that point.
 *
 * <p>A record never holds more than {@link #MAX_RECORD_BYTES}; a longer run without a delimiter is
 * cut there and continues as the next record.
 */
final class RecordReader implements Iterator<String> {

    private static final Logger LOG = LogManager.getLogger(RecordReader.class);

    static final int MAX_RECORD_BYTES = 256 * 1024;

    private final InputStream in;
    private final byte[] chunk;
    private final int maxRecordBytes;
    private final Deque<String> ready = new ArrayDeque<>();
    private byte[] pending = new byte[256];
    private int pendingLength;
    private boolean endOfStream;

    RecordReader(InputStream in, int readBufferBytes) {
        this(in, readBufferBytes, MAX_RECORD_BYTES);
    }

    RecordReader(InputStream in, int readBufferBytes, int maxRecordBytes) {
        if (readBufferBytes <= 0) {
            throw new IllegalArgumentException("readBufferBytes must be positive");
        }
        if (maxRecordBytes <= 0) {
            throw new IllegalArgumentException("maxRecordBytes must be positive");
        }
        this.in = in;
        this.chunk = new byte[readBufferBytes];
        this.maxRecordBytes = maxRecordBytes;
    }

    @Override
    public boolean hasNext() {
        while (ready.isEmpty() && !endOfStream) {
            fill();
        }
        return !ready.isEmpty();
    }

    @Override
    public String next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        return ready.poll();
    }

    private void fill() {
        int n;
        try {
            n = in.read(chunk);
        } catch (IOException e) {
            LOG.debug("Output stream closed while reading: {}", e.toString());
            n = -1;
        }
        if (n < 0) {
            endOfStream = true;
            completeRecord();
            return;
        }
        for (int i = 0; i < n; i++) {
            byte b = chunk[i];
            if (b == '\r' || b == '\n') {
                completeRecord();
            } else {
                appendPending(b);
            }
        }
    }

    private void appendPending(byte b) {
        if (pendingLength == maxRecordBytes) {
            LOG.trace("Record reached {} bytes without a delimiter; cutting it", maxRecordBytes);
            completeRecord();
        }
        if (pendingLength == pending.length) {
            pending = Arrays.copyOf(pending, Math.min(pending.length * 2, maxRecordBytes));
        }
        pending[pendingLength++] = b;
    }

    private void completeRecord() {
        if (pendingLength == 0) {
            return;
        }
        String record = new String(pending, 0, pendingLength, StandardCharsets.UTF_8).strip();
        pendingLength = 0;
        if (!record.isEmpty()) {
            ready.add(record);
        }
    }
}
