package com.phillippitts.mediatoolbox.service.job.progress;

import com.phillippitts.mediatoolbox.config.properties.JobProperties;
import com.phillippitts.mediatoolbox.domain.ProgressEvent;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.InputStream;
import java.time.Clock;
import java.time.Duration;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.function.BooleanSupplier;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Produces a lazy sequence of {@link ProgressEvent}s from a tool's raw output stream.
 *
 * <p>Each call to {@link #parse} starts from a clean state (no cached duration unless one is given), so the parser
 * itself is stateless and shared between jobs. Records are read only as the returned stream is
 * consumed; uninformative records are skipped silently.
 *
 * <p>The cancellation check runs between records. Once it reports {@code true} the sequence
 * ends normally, without error.
 */
@Component
public class ProgressStreamParser {

    private final int readBufferBytes;
    private final Clock clock;

    @Autowired
    public ProgressStreamParser(JobProperties properties) {
        this(properties.readBufferBytes(), Clock.systemUTC());
    }

    public ProgressStreamParser(int readBufferBytes, Clock clock) {
        if (readBufferBytes <= 0) {
            throw new IllegalArgumentException("readBufferBytes must be positive");
        }
        this.readBufferBytes = readBufferBytes;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Parses {@code in} until end of stream or cancellation, taking the total duration from the
     * tool's own output.
     *
     * @param in raw process output; not closed by the parser
     * @param cancelled cancellation check, consulted before each record
     * @param observer receives every record and any destination announcements
     * @return lazy, sequential stream of progress events in record order
     */
    public Stream<ProgressEvent> parse(InputStream in, BooleanSupplier cancelled, RecordObserver observer) {
        return parse(in, null, cancelled, observer);
    }

    /**
     * Parses {@code in} until end of stream or cancellation.
     *
     * @param knownDuration total duration to compute percent against, or null to use the first
     *                      {@code Duration:} line of the output
     */
    public Stream<ProgressEvent> parse(InputStream in, Duration knownDuration, BooleanSupplier cancelled,
                                       RecordObserver observer) {
        Objects.requireNonNull(in, "in");
        Objects.requireNonNull(cancelled, "cancelled");
        RecordObserver obs = observer == null ? RecordObserver.NONE : observer;
        Iterator<ProgressEvent> events = new EventIterator(new RecordReader(in, readBufferBytes),
                new RecordInterpreter(clock, obs, knownDuration), cancelled, obs);
        return StreamSupport.stream(
                Spliterators.spliteratorUnknownSize(events, Spliterator.ORDERED | Spliterator.NONNULL), false);
    }

    /**
     * Parses {@code in} with no cancellation and no observer.
     */
    public Stream<ProgressEvent> parse(InputStream in) {
        return parse(in, () -> false, RecordObserver.NONE);
    }

    private static final class EventIterator implements Iterator<ProgressEvent> {
        private final RecordReader records;
        private final RecordInterpreter interpreter;
        private final BooleanSupplier cancelled;
        private final RecordObserver observer;
        private ProgressEvent next;

        EventIterator(RecordReader records, RecordInterpreter interpreter,
                      BooleanSupplier cancelled, RecordObserver observer) {
            this.records = records;
            this.interpreter = interpreter;
            this.cancelled = cancelled;
            this.observer = observer;
        }

        @Override
        public boolean hasNext() {
            while (next == null && !cancelled.getAsBoolean() && records.hasNext()) {
                String record = records.next();
                observer.onRecord(record);
                Optional<ProgressEvent> event = interpreter.interpret(record);
                if (event.isPresent()) {
                    next = event.get();
                }
            }
            return next != null;
        }

        @Override
        public ProgressEvent next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            ProgressEvent event = next;
            next = null;
            return event;
        }
    }
}
