package com.phillippitts.mediatoolbox.service.job;

import com.phillippitts.mediatoolbox.domain.JobRequest;
import com.phillippitts.mediatoolbox.domain.StreamChannel;
import com.phillippitts.mediatoolbox.service.job.progress.DiagnosticBuffer;
import com.phillippitts.mediatoolbox.service.job.progress.RecordObserver;

import java.nio.file.Path;
import java.util.UUID;

/**
 * Per-job state that outlives an overwrite of the shared slot: the request, the job's own view of
 * its output path, and its diagnostic buffer.
 */
final class JobContext {

    private final UUID jobId;
    private final JobRequest request;
    private final DiagnosticBuffer diagnostics;
    private final ActiveJobSlot slot;
    private final long startedNanos;
    private volatile Path recordedOutputPath;

    JobContext(UUID jobId, JobRequest request, DiagnosticBuffer diagnostics, ActiveJobSlot slot) {
        this.jobId = jobId;
        this.request = request;
        this.diagnostics = diagnostics;
        this.slot = slot;
        this.startedNanos = System.nanoTime();
        this.recordedOutputPath = request.expectedOutputPath();
    }

    UUID jobId() {
        return jobId;
    }

    JobRequest request() {
        return request;
    }

    DiagnosticBuffer diagnostics() {
        return diagnostics;
    }

    long startedNanos() {
        return startedNanos;
    }

    Path recordedOutputPath() {
        return recordedOutputPath;
    }

    void recordOutputPath(Path path) {
        recordedOutputPath = path;
        slot.recordOutputPath(path);
    }

    /**
     * Observer for one output stream. Standard error always feeds the diagnostic buffer;
     * destination announcements are only taken from monitored streams.
     */
    RecordObserver observerFor(StreamChannel channel) {
        boolean monitored = request.tool().monitors(channel);
        boolean diagnostic = channel == StreamChannel.STDERR;
        return new RecordObserver() {
            @Override
            public void onRecord(String record) {
                if (diagnostic) {
                    diagnostics.append(record);
                }
            }

            @Override
            public void onDestination(Path destination) {
                if (monitored) {
                    recordOutputPath(destination);
                }
            }
        };
    }
}
