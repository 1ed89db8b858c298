package com.phillippitts.mediatoolbox.service.job.process;

/**
 * Stops an OS process and, as far as the platform allows, its descendants.
 *
 * <p>Contract: best-effort and asynchronous. A {@code true} result means the signal was sent,
 * not that the process has exited. Descendants started after the call, or that escaped the
 * process tree, may keep running. No escalation or retry is performed.
 */
public interface Terminator {

    /**
     * @param processId OS process id
     * @return {@code true} if a live process with that id was found and signalled
     */
    boolean terminate(long processId);
}
