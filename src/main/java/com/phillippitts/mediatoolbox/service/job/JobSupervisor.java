package com.phillippitts.mediatoolbox.service.job;

import com.phillippitts.mediatoolbox.config.properties.JobProperties;
import com.phillippitts.mediatoolbox.domain.JobRequest;
import com.phillippitts.mediatoolbox.domain.StreamChannel;
import com.phillippitts.mediatoolbox.domain.TerminalOutcome;
import com.phillippitts.mediatoolbox.exception.InvalidJobRequestException;
import com.phillippitts.mediatoolbox.exception.SpawnFailureException;
import com.phillippitts.mediatoolbox.exception.SpawnFailureExceptionBuilder;
import com.phillippitts.mediatoolbox.service.job.event.JobFinishedEvent;
import com.phillippitts.mediatoolbox.service.job.process.LaunchedProcess;
import com.phillippitts.mediatoolbox.service.job.process.ProcessLauncher;
import com.phillippitts.mediatoolbox.service.job.process.Terminator;
import com.phillippitts.mediatoolbox.service.job.progress.DiagnosticBuffer;
import com.phillippitts.mediatoolbox.service.job.progress.ProgressStreamParser;
import com.phillippitts.mediatoolbox.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.OptionalLong;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Runs external tool jobs one at a time and owns the active-job slot.
 *
 * <p><b>Lifecycle of a job:</b>
 * <ol>
 *   <li>{@link #start} registers the slot, spawns the tool and attaches its process id;</li>
 *   <li>one daemon reader per output stream feeds the {@link ProgressStreamParser} and forwards
 *       progress to the listener;</li>
 *   <li>a driving task on the job executor waits for process exit, lets the readers drain,
 *       asks the {@link CompletionResolver} for the outcome, delivers it, then clears the slot.</li>
 * </ol>
 *
 * <p>Cancellation is cooperative (readers stop between records) and forceful (the
 * {@link Terminator} signals the process tree). There is no escalation timeout: a process that
 * ignores the signal keeps its job pending until it exits.
 *
 * <p>Starting a job while another is active does not queue or reject; the new job takes over
 * the slot and the earlier job is no longer cancellable.
 */
@Component
public class JobSupervisor {

    private static final Logger LOG = LogManager.getLogger(JobSupervisor.class);

    private final ActiveJobSlot slot;
    private final ProcessLauncher launcher;
    private final ProgressStreamParser parser;
    private final CompletionResolver completionResolver;
    private final Terminator terminator;
    private final OutputCleaner outputCleaner;
    private final JobProperties properties;
    private final Executor jobExecutor;
    private final ApplicationEventPublisher publisher;

    public JobSupervisor(ActiveJobSlot slot,
                         ProcessLauncher launcher,
                         ProgressStreamParser parser,
                         CompletionResolver completionResolver,
                         Terminator terminator,
                         OutputCleaner outputCleaner,
                         JobProperties properties,
                         @Qualifier("jobExecutor") Executor jobExecutor,
                         ApplicationEventPublisher publisher) {
        this.slot = slot;
        this.launcher = launcher;
        this.parser = parser;
        this.completionResolver = completionResolver;
        this.terminator = terminator;
        this.outputCleaner = outputCleaner;
        this.properties = properties;
        this.jobExecutor = jobExecutor;
        this.publisher = publisher;
    }

    /**
     * Starts a job.
     *
     * @param request validated request
     * @param listener receives progress and the terminal outcome; failures inside it are ignored
     * @return handle whose future completes with the terminal outcome
     * @throws InvalidJobRequestException if {@code request} is null
     * @throws SpawnFailureException if the tool could not be started; the slot is cleared
     */
    public JobHandle start(JobRequest request, JobListener listener) {
        if (request == null) {
            throw new InvalidJobRequestException("request must not be null");
        }
        UUID jobId = UUID.randomUUID();
        JobListener sink = new FireAndForgetListener(listener);
        JobContext ctx = new JobContext(jobId, request,
                new DiagnosticBuffer(properties.diagnosticCapChars()), slot);

        Optional<JobSnapshot> overwritten = slot.register(jobId, request.tool(), request.expectedOutputPath());
        overwritten.ifPresent(prev -> LOG.warn(
                "Job {} started while job {} was still active; tracked state of the earlier job is overwritten",
                jobId, prev.jobId()));

        LaunchedProcess launched;
        try {
            launched = launcher.launch(request);
        } catch (SpawnFailureException e) {
            slot.clear();
            LOG.error("Job {} failed to start: {}", jobId, e.getMessage());
            throw e;
        }

        OptionalLong pid = launched.processId();
        if (pid.isPresent() && slot.attachProcess(pid.getAsLong())) {
            LOG.info("Cancel arrived before process {} of job {} was attached; terminating now",
                    pid.getAsLong(), jobId);
            terminator.terminate(pid.getAsLong());
        }
        LOG.info("Job {} started ({}, pid={})", jobId, request.tool().displayName(),
                pid.isPresent() ? pid.getAsLong() : "n/a");

        List<Thread> readers = List.of(
                startReader(ctx, StreamChannel.STDOUT, launched, sink),
                startReader(ctx, StreamChannel.STDERR, launched, sink));

        CompletableFuture<TerminalOutcome> outcome = new CompletableFuture<>();
        try {
            jobExecutor.execute(() -> drive(ctx, launched, readers, sink, outcome));
        } catch (RejectedExecutionException e) {
            pid.ifPresent(terminator::terminate);
            slot.clear();
            throw SpawnFailureExceptionBuilder.create("Job executor rejected job")
                    .tool(request.tool())
                    .cause(e)
                    .metadata("jobId", jobId)
                    .build();
        }
        return new JobHandle(jobId, request.tool(), outcome);
    }

    /**
     * Cancels the active job, if any. Idempotent: with no active job, or once the job's process has
     * exited and its outcome is being delivered, this does nothing.
     *
     * <p>Sets the cancellation flag, signals the process (the id is handed out once, so a repeated
     * cancel does not signal again) and deletes the recorded output early. The driving task
     * performs the final cleanup once the process has exited.
     */
    public CancelAcknowledgement cancel() {
        Optional<JobSnapshot> cancelled = slot.requestCancel();
        if (cancelled.isEmpty()) {
            LOG.debug("Cancel requested but no job is active");
            return CancelAcknowledgement.idle();
        }
        JobSnapshot job = cancelled.get();
        LOG.info("Cancelling job {} (pid={})", job.jobId(), job.processId() == null ? "n/a" : job.processId());
        boolean terminateSent = job.processId() != null && terminator.terminate(job.processId());
        outputCleaner.deleteIfExists(job.recordedOutputPath());
        return new CancelAcknowledgement(true, job.jobId(), terminateSent);
    }

    public Optional<JobSnapshot> activeJob() {
        return slot.snapshot();
    }

    private Thread startReader(JobContext ctx, StreamChannel channel, LaunchedProcess launched, JobListener sink) {
        var in = channel == StreamChannel.STDOUT ? launched.stdout() : launched.stderr();
        return new StreamPump(ctx.jobId(), channel, in, ctx.request().tool().monitors(channel), parser,
                ctx.request().knownDuration(), slot::isCancelRequested, ctx.observerFor(channel), sink).start();
    }

    private void drive(JobContext ctx, LaunchedProcess launched, List<Thread> readers, JobListener sink,
                       CompletableFuture<TerminalOutcome> result) {
        ThreadContext.put("jobId", ctx.jobId().toString());
        ThreadContext.put("tool", ctx.request().tool().name());
        TerminalOutcome outcome;
        try {
            OptionalInt exitCode = awaitExit(launched.process());
            awaitReaders(readers);
            outcome = completionResolver.resolve(ctx.request(), exitCode, ctx.recordedOutputPath(), ctx.diagnostics());
        } catch (RuntimeException e) {
            LOG.error("Supervising job {} failed", ctx.jobId(), e);
            outcome = new TerminalOutcome.Failed(CompletionResolver.UNKNOWN_EXIT_CODE, e.getMessage());
        }

        Duration took = Duration.ofMillis(TimeUtils.elapsedMillis(ctx.startedNanos()));
        try {
            logOutcome(ctx, outcome, took);
            sink.onTerminal(ctx.jobId(), outcome);
            result.complete(outcome);
        } finally {
            slot.clear();
            publisher.publishEvent(new JobFinishedEvent(ctx.jobId(), ctx.request().tool(), outcome, took, Instant.now()));
            ThreadContext.remove("jobId");
            ThreadContext.remove("tool");
        }
    }

    private static OptionalInt awaitExit(Process process) {
        try {
            return OptionalInt.of(process.waitFor());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while waiting for process exit");
            return OptionalInt.empty();
        }
    }

    private void awaitReaders(List<Thread> readers) {
        long deadline = System.nanoTime() + properties.streamDrainTimeout().toNanos();
        for (Thread reader : readers) {
            long remainingMs = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
            try {
                reader.join(Math.max(1L, remainingMs));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            if (reader.isAlive()) {
                LOG.debug("Reader {} still draining after process exit; continuing without it", reader.getName());
            }
        }
    }

    private static void logOutcome(JobContext ctx, TerminalOutcome outcome, Duration took) {
        String tool = ctx.request().tool().displayName();
        if (outcome instanceof TerminalOutcome.Succeeded s) {
            LOG.info("Job {} succeeded in {} ms ({} output: {})", ctx.jobId(), took.toMillis(), tool, s.outputPath());
        } else if (outcome instanceof TerminalOutcome.Failed f) {
            LOG.warn("Job {} failed after {} ms: {}", ctx.jobId(), took.toMillis(), f.describe(ctx.request().tool()));
        } else {
            LOG.info("Job {} cancelled after {} ms", ctx.jobId(), took.toMillis());
        }
    }
}
