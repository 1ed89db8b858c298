package com.phillippitts.mediatoolbox.presentation.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.phillippitts.mediatoolbox.service.job.JobSnapshot;

/**
 * Wire shape of {@code GET /api/jobs/active}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobStatusView(
        String jobId,
        String tool,
        Long processId,
        String outputPath,
        boolean cancelRequested
) {

    public static JobStatusView from(JobSnapshot snapshot) {
        return new JobStatusView(
                snapshot.jobId().toString(),
                snapshot.tool().name(),
                snapshot.processId(),
                snapshot.recordedOutputPath() == null ? null : snapshot.recordedOutputPath().toString(),
                snapshot.cancelRequested());
    }
}
