package com.phillippitts.mediatoolbox.service.job;

import com.phillippitts.mediatoolbox.domain.ToolKind;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * The single active-job slot: process id, recorded output path and cancellation flag of the job
 * currently under supervision.
 *
 * <p><b>State Transitions:</b>
 * <pre>
 * IDLE → ACTIVE (via register)
 * ACTIVE → ACTIVE (via register: a second start overwrites the tracked state)
 * ACTIVE → COMPLETING (via beginCompletion, once the process has exited)
 * COMPLETING → IDLE (via clear, unconditionally after the terminal outcome)
 * </pre>
 *
 * <p>A completing slot no longer accepts cancels: the outcome is already decided, and a late cancel
 * must not delete the output of a job that succeeded.
 *
 * <p><b>Thread Safety:</b> every field is read and written under one {@link ReentrantLock}, held
 * only for the field access itself. Callers perform process signalling and file deletion after
 * the lock is released.
 *
 * <p>Writes are not keyed by job id: a job whose state was overwritten by a later start still
 * writes into the shared slot.
 */
@Component
public class ActiveJobSlot {

    private final Lock lock = new ReentrantLock();
    private UUID jobId;
    private ToolKind tool;
    private Long processId;
    private Path recordedOutputPath;
    private boolean cancelRequested;
    private boolean completing;

    /**
     * Marks a job as active before its process is confirmed running, so that a cancel issued
     * right after start can still act. Resets the cancellation flag.
     *
     * @param newJobId id of the job being started
     * @param newTool tool the job runs
     * @param initialOutputPath output path known up front, may be null
     * @return the state that was overwritten, if another job still occupied the slot
     */
    public Optional<JobSnapshot> register(UUID newJobId, ToolKind newTool, Path initialOutputPath) {
        Objects.requireNonNull(newJobId, "newJobId");
        Objects.requireNonNull(newTool, "newTool");
        lock.lock();
        try {
            Optional<JobSnapshot> previous = currentSnapshot();
            jobId = newJobId;
            tool = newTool;
            processId = null;
            recordedOutputPath = initialOutputPath;
            cancelRequested = false;
            completing = false;
            return previous;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Records the process id of the running tool.
     *
     * @return {@code true} if a cancel was requested before the id was known; the caller must
     *         then terminate the process itself
     */
    public boolean attachProcess(long pid) {
        lock.lock();
        try {
            processId = pid;
            return cancelRequested;
        } finally {
            lock.unlock();
        }
    }

    public void recordOutputPath(Path path) {
        lock.lock();
        try {
            recordedOutputPath = path;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Sets the cancellation flag and hands the process id to the caller exactly once, so a second
     * cancel does not signal the process again.
     *
     * @return the slot as it was when cancel arrived, or empty when idle or already completing
     */
    public Optional<JobSnapshot> requestCancel() {
        lock.lock();
        try {
            if (jobId == null || completing) {
                return Optional.empty();
            }
            JobSnapshot atCancel = new JobSnapshot(jobId, tool, processId, recordedOutputPath, true);
            cancelRequested = true;
            processId = null;
            return Optional.of(atCancel);
        } finally {
            lock.unlock();
        }
    }

    public boolean isCancelRequested() {
        lock.lock();
        try {
            return cancelRequested;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Reads and clears the cancellation flag, and closes the slot to further cancels, in one step.
     *
     * @return whether a cancel was pending when the process exited
     */
    public boolean beginCompletion() {
        lock.lock();
        try {
            boolean requested = cancelRequested;
            cancelRequested = false;
            completing = true;
            return requested;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Empties the slot regardless of which job occupies it.
     */
    public void clear() {
        lock.lock();
        try {
            jobId = null;
            tool = null;
            processId = null;
            recordedOutputPath = null;
            completing = false;
        } finally {
            lock.unlock();
        }
    }

    public Optional<JobSnapshot> snapshot() {
        lock.lock();
        try {
            return currentSnapshot();
        } finally {
            lock.unlock();
        }
    }

    private Optional<JobSnapshot> currentSnapshot() {
        if (jobId == null) {
            return Optional.empty();
        }
        return Optional.of(new JobSnapshot(jobId, tool, processId, recordedOutputPath, cancelRequested));
    }
}
