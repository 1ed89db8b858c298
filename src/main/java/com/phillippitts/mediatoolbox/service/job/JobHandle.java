package com.phillippitts.mediatoolbox.service.job;

import com.phillippitts.mediatoolbox.domain.TerminalOutcome;
import com.phillippitts.mediatoolbox.domain.ToolKind;

import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * Returned by {@link JobSupervisor#start}. The future completes exactly once, after the listener
 * has received the terminal outcome. It never completes exceptionally.
 *
 * @param jobId id of the started job
 * @param tool tool the job runs
 * @param outcome terminal outcome of the job
 */
public record JobHandle(UUID jobId, ToolKind tool, CompletableFuture<TerminalOutcome> outcome) {}
