package com.phillippitts.mediatoolbox.domain;

/**
 * One progress observation parsed from a tool's output.
 *
 * <p>Percent never exceeds 99 while the job is running; 100 is only implied by a
 * {@link TerminalOutcome.Succeeded} outcome.
 *
 * @param percent completion estimate in [0, 99]
 * @param elapsedTime {@code HH:MM:SS}, the position reached by the tool or wall-clock time since start
 * @param speedOrRate encode speed ({@code 1.5x}) or transfer rate ({@code 2.10MiB/s}), nullable
 * @param statusText human-readable phase description, nullable
 * @param size total transfer size ({@code 10.00MiB}), nullable
 * @param eta estimated time remaining ({@code 00:12}), nullable
 */
public record ProgressEvent(
        int percent,
        String elapsedTime,
        String speedOrRate,
        String statusText,
        String size,
        String eta
) {

    public static final int MAX_RUNNING_PERCENT = 99;

    public ProgressEvent {
        if (percent < 0 || percent > MAX_RUNNING_PERCENT) {
            throw new IllegalArgumentException("percent must be within [0, 99]: " + percent);
        }
        if (elapsedTime == null) {
            throw new IllegalArgumentException("elapsedTime must not be null");
        }
    }

    public ProgressEvent(int percent, String elapsedTime, String speedOrRate, String statusText) {
        this(percent, elapsedTime, speedOrRate, statusText, null, null);
    }
}
