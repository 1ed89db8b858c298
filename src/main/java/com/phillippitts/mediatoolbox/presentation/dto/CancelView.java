package com.phillippitts.mediatoolbox.presentation.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.phillippitts.mediatoolbox.service.job.CancelAcknowledgement;

/**
 * Wire shape of {@code POST /api/jobs/cancel}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CancelView(boolean active, String jobId, boolean terminateSent) {

    public static CancelView from(CancelAcknowledgement ack) {
        return new CancelView(ack.active(), ack.jobId() == null ? null : ack.jobId().toString(), ack.terminateSent());
    }
}
