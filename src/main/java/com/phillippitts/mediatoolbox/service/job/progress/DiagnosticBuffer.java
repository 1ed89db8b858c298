package com.phillippitts.mediatoolbox.service.job.progress;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Bounded accumulation of diagnostic (stderr) records for failure messages.
 *
 * <p>The first {@code capChars} characters win: once the cap is reached further records are
 * discarded and nothing already captured is evicted. A record that straddles the cap is cut.
 *
 * <p>Thread-safe; one buffer is shared by the stream reader that fills it and the driving task
 * that reads it after process exit.
 */
public final class DiagnosticBuffer {

    private static final Logger LOG = LogManager.getLogger(DiagnosticBuffer.class);

    private final int capChars;
    private final StringBuilder text = new StringBuilder();
    private boolean capReached;

    public DiagnosticBuffer(int capChars) {
        if (capChars <= 0) {
            throw new IllegalArgumentException("capChars must be positive");
        }
        this.capChars = capChars;
    }

    /**
     * Appends one record followed by a newline, unless the cap has been reached.
     */
    public synchronized void append(String record) {
        if (record == null || capReached) {
            return;
        }
        int available = capChars - text.length();
        int needed = record.length() + 1;
        if (needed <= available) {
            text.append(record).append('\n');
            capReached = text.length() >= capChars;
        } else {
            text.append(record, 0, Math.min(record.length(), available));
            capReached = true;
        }
        if (capReached) {
            LOG.debug("Diagnostic buffer reached {} chars; discarding further output", capChars);
        }
    }

    public synchronized String text() {
        return text.toString();
    }

    public synchronized boolean isCapReached() {
        return capReached;
    }

    public int capChars() {
        return capChars;
    }
}
