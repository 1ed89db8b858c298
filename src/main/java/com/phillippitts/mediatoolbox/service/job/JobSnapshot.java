package com.phillippitts.mediatoolbox.service.job;

import com.phillippitts.mediatoolbox.domain.ToolKind;

import java.nio.file.Path;
import java.util.UUID;

/**
 * Point-in-time copy of the active-job slot.
 *
 * @param jobId id of the job occupying the slot
 * @param tool tool the job runs
 * @param processId OS process id, {@code null} until attached or when unavailable
 * @param recordedOutputPath last output path the job announced, {@code null} if none yet
 * @param cancelRequested whether a cancel is pending
 */
public record JobSnapshot(
        UUID jobId,
        ToolKind tool,
        Long processId,
        Path recordedOutputPath,
        boolean cancelRequested
) {}
