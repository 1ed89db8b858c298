package com.phillippitts.mediatoolbox.service.job;

import com.phillippitts.mediatoolbox.domain.ProgressEvent;
import com.phillippitts.mediatoolbox.domain.TerminalOutcome;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.UUID;

/**
 * Wraps a caller's listener so that a failing or vanished consumer never disturbs stream
 * draining or completion. Exceptions are logged at debug and dropped.
 */
final class FireAndForgetListener implements JobListener {

    private static final Logger LOG = LogManager.getLogger(FireAndForgetListener.class);

    private final JobListener delegate;

    FireAndForgetListener(JobListener delegate) {
        this.delegate = delegate == null ? JobListener.NONE : delegate;
    }

    @Override
    public void onProgress(UUID jobId, ProgressEvent event) {
        try {
            delegate.onProgress(jobId, event);
        } catch (RuntimeException e) {
            LOG.debug("Progress sink failed for job {}: {}", jobId, e.toString());
        }
    }

    @Override
    public void onTerminal(UUID jobId, TerminalOutcome outcome) {
        try {
            delegate.onTerminal(jobId, outcome);
        } catch (RuntimeException e) {
            LOG.debug("Terminal sink failed for job {}: {}", jobId, e.toString());
        }
    }
}
