package com.phillippitts.mediatoolbox.service.job.process;

import java.io.InputStream;
import java.util.OptionalLong;

/**
 * Handle to a freshly spawned tool.
 *
 * @param process the running (or already finished) process
 * @param processId OS process id; empty when the platform does not expose it or the process
 *                  exited before it could be captured. Both are normal outcomes.
 * @param executable the executable that was started
 */
public record LaunchedProcess(Process process, OptionalLong processId, String executable) {

    public InputStream stdout() {
        return process.getInputStream();
    }

    public InputStream stderr() {
        return process.getErrorStream();
    }
}
