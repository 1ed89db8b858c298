package com.phillippitts.mediatoolbox.service.job;

import java.util.UUID;

/**
 * Result of a cancel request. Cancel always succeeds; this only reports what it found.
 *
 * @param active whether a job occupied the slot
 * @param jobId the cancelled job, {@code null} when idle
 * @param terminateSent whether a terminate signal reached a live process
 */
public record CancelAcknowledgement(boolean active, UUID jobId, boolean terminateSent) {

    public static CancelAcknowledgement idle() {
        return new CancelAcknowledgement(false, null, false);
    }
}
