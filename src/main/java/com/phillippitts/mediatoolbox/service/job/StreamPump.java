package com.phillippitts.mediatoolbox.service.job;

import com.phillippitts.mediatoolbox.domain.ProgressEvent;
import com.phillippitts.mediatoolbox.domain.StreamChannel;
import com.phillippitts.mediatoolbox.service.job.progress.ProgressStreamParser;
import com.phillippitts.mediatoolbox.service.job.progress.RecordObserver;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.Map;
import java.util.UUID;
import java.util.function.BooleanSupplier;
import java.util.stream.Stream;

/**
 * Drains one output stream of a job through the parser until end of stream or cancellation.
 * Events are forwarded only for monitored streams; unmonitored output is still read so the
 * process never blocks on a full pipe.
 */
final class StreamPump implements Runnable {

    private static final Logger LOG = LogManager.getLogger(StreamPump.class);

    private final UUID jobId;
    private final StreamChannel channel;
    private final InputStream in;
    private final boolean monitored;
    private final ProgressStreamParser parser;
    private final Duration knownDuration;
    private final BooleanSupplier cancelled;
    private final RecordObserver observer;
    private final JobListener listener;
    private final Map<String, String> logContext;

    StreamPump(UUID jobId, StreamChannel channel, InputStream in, boolean monitored, ProgressStreamParser parser,
               Duration knownDuration, BooleanSupplier cancelled, RecordObserver observer, JobListener listener) {
        this.jobId = jobId;
        this.channel = channel;
        this.in = in;
        this.monitored = monitored;
        this.parser = parser;
        this.knownDuration = knownDuration;
        this.cancelled = cancelled;
        this.observer = observer;
        this.listener = listener;
        this.logContext = ThreadContext.getImmutableContext();
    }

    /**
     * Starts the pump on a daemon thread named {@code job-<id>-<suffix>}.
     */
    Thread start() {
        Thread t = new Thread(this, "job-" + shortId(jobId) + "-" + channel.suffix());
        t.setDaemon(true);
        t.start();
        return t;
    }

    @Override
    public void run() {
        ThreadContext.putAll(logContext);
        long events = 0;
        try (Stream<ProgressEvent> stream = parser.parse(in, knownDuration, cancelled, observer)) {
            var it = stream.iterator();
            while (it.hasNext()) {
                ProgressEvent event = it.next();
                if (monitored) {
                    listener.onProgress(jobId, event);
                    events++;
                }
            }
        } catch (UncheckedIOException e) {
            LOG.debug("Reading {} of job {} failed: {}", channel, jobId, e.toString());
        } finally {
            closeQuietly();
            LOG.debug("{} reader of job {} finished after {} event(s)", channel, jobId, events);
            ThreadContext.clearAll();
        }
    }

    private void closeQuietly() {
        try {
            in.close();
        } catch (IOException e) {
            LOG.debug("Closing {} of job {} failed: {}", channel, jobId, e.toString());
        }
    }

    private static String shortId(UUID id) {
        return id.toString().substring(0, 8);
    }
}
