package com.phillippitts.mediatoolbox.service.job;

import com.phillippitts.mediatoolbox.domain.ProgressEvent;
import com.phillippitts.mediatoolbox.domain.TerminalOutcome;

import java.util.UUID;

/**
 * Receives the events of one job.
 *
 * <p>{@link #onProgress} is called from the stream reader threads, possibly from two threads at
 * once when both streams are monitored. {@link #onTerminal} is called exactly once from the
 * driving task, after which no further progress is delivered by the supervisor. Implementations
 * must not block.
 */
public interface JobListener {

    JobListener NONE = new JobListener() {
        @Override
        public void onProgress(UUID jobId, ProgressEvent event) {
        }

        @Override
        public void onTerminal(UUID jobId, TerminalOutcome outcome) {
        }
    };

    void onProgress(UUID jobId, ProgressEvent event);

    void onTerminal(UUID jobId, TerminalOutcome outcome);
}
