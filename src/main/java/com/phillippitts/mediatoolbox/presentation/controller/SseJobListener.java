package com.phillippitts.mediatoolbox.presentation.controller;

import com.phillippitts.mediatoolbox.domain.ProgressEvent;
import com.phillippitts.mediatoolbox.domain.TerminalOutcome;
import com.phillippitts.mediatoolbox.domain.ToolKind;
import com.phillippitts.mediatoolbox.presentation.dto.ProgressView;
import com.phillippitts.mediatoolbox.presentation.dto.TerminalView;
import com.phillippitts.mediatoolbox.service.job.JobListener;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.UUID;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Bridges one job to one {@link SseEmitter}.
 *
 * <p>Stream readers only enqueue; a drain task on the event executor writes to the client.
 * When the bounded queue is full, progress events are dropped. The terminal event is held
 * separately, always sent after the queued progress, and completes the emitter. Once the client
 * is gone, everything is discarded.
 */
final class SseJobListener implements JobListener {

    private static final Logger LOG = LogManager.getLogger(SseJobListener.class);

    static final String PROGRESS_EVENT = "progress";

    private final SseEmitter emitter;
    private final ToolKind tool;
    private final Executor executor;
    private final BlockingQueue<ProgressEvent> queue;
    private final AtomicReference<TerminalOutcome> terminal = new AtomicReference<>();
    private final AtomicBoolean draining = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final AtomicLong dropped = new AtomicLong();

    SseJobListener(SseEmitter emitter, ToolKind tool, Executor executor, int queueCapacity) {
        this.emitter = emitter;
        this.tool = tool;
        this.executor = executor;
        this.queue = new ArrayBlockingQueue<>(queueCapacity);
        emitter.onCompletion(() -> closed.set(true));
        emitter.onTimeout(() -> closed.set(true));
        emitter.onError(e -> closed.set(true));
    }

    @Override
    public void onProgress(UUID jobId, ProgressEvent event) {
        if (closed.get()) {
            return;
        }
        if (!queue.offer(event)) {
            long n = dropped.incrementAndGet();
            LOG.trace("Subscriber of job {} is slow; dropped {} progress event(s) so far", jobId, n);
        }
        scheduleDrain();
    }

    @Override
    public void onTerminal(UUID jobId, TerminalOutcome outcome) {
        terminal.compareAndSet(null, outcome);
        scheduleDrain();
    }

    long droppedCount() {
        return dropped.get();
    }

    private void scheduleDrain() {
        if (!draining.compareAndSet(false, true)) {
            return;
        }
        try {
            executor.execute(this::drain);
        } catch (RejectedExecutionException e) {
            draining.set(false);
            LOG.debug("Event executor rejected delivery: {}", e.toString());
        }
    }

    private void drain() {
        while (true) {
            ProgressEvent event;
            while ((event = queue.poll()) != null) {
                send(PROGRESS_EVENT, ProgressView.from(event));
            }
            TerminalOutcome outcome = terminal.get();
            if (outcome != null) {
                sendTerminal(outcome);
                return;
            }
            draining.set(false);
            // Re-check: an enqueue may have lost the race with the flag reset
            if ((queue.isEmpty() && terminal.get() == null) || !draining.compareAndSet(false, true)) {
                return;
            }
        }
    }

    private void sendTerminal(TerminalOutcome outcome) {
        if (closed.get()) {
            return;
        }
        TerminalView view = TerminalView.from(outcome, tool);
        send(view.eventName(), view.payload());
        if (dropped.get() > 0) {
            LOG.debug("Dropped {} progress event(s) for a slow subscriber", dropped.get());
        }
        closed.set(true);
        emitter.complete();
    }

    private void send(String name, Object data) {
        if (closed.get()) {
            return;
        }
        try {
            emitter.send(SseEmitter.event().name(name).data(data));
        } catch (IOException | IllegalStateException e) {
            closed.set(true);
            LOG.debug("Subscriber went away: {}", e.toString());
        }
    }
}
