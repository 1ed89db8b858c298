package com.phillippitts.mediatoolbox.config.properties;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Tuning for job supervision and progress streaming.
 * Binds to properties prefixed with "jobs".
 *
 * @param diagnosticCapChars maximum stderr characters kept for failure messages
 * @param readBufferBytes chunk size used when draining process output
 * @param streamDrainTimeoutMs how long the driving task waits for stream readers after process exit
 * @param eventQueueCapacity per-subscriber progress queue size before events are dropped
 */
@ConfigurationProperties(prefix = "jobs")
@Validated
public record JobProperties(
        @DefaultValue("16384")
        @Positive(message = "Diagnostic cap must be positive")
        int diagnosticCapChars,

        @DefaultValue("4096")
        @Positive(message = "Read buffer size must be positive")
        int readBufferBytes,

        @DefaultValue("500")
        @Positive(message = "Stream drain timeout must be positive")
        long streamDrainTimeoutMs,

        @DefaultValue("256")
        @Positive(message = "Event queue capacity must be positive")
        int eventQueueCapacity
) {

    public static JobProperties defaults() {
        return new JobProperties(16 * 1024, 4096, 500, 256);
    }

    public Duration streamDrainTimeout() {
        return Duration.ofMillis(streamDrainTimeoutMs);
    }
}
