package com.phillippitts.mediatoolbox.service.job.event;

import com.phillippitts.mediatoolbox.domain.TerminalOutcome;
import com.phillippitts.mediatoolbox.domain.ToolKind;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * Published after a job's terminal outcome has been delivered and its slot cleared.
 *
 * @param jobId id of the finished job
 * @param tool tool the job ran
 * @param outcome the terminal outcome
 * @param duration time from start to terminal outcome
 * @param timestamp when the job finished
 */
public record JobFinishedEvent(
        UUID jobId,
        ToolKind tool,
        TerminalOutcome outcome,
        Duration duration,
        Instant timestamp
) {}
