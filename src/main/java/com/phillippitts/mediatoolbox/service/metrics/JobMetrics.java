package com.phillippitts.mediatoolbox.service.metrics;

import com.phillippitts.mediatoolbox.service.job.event.JobFinishedEvent;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Job outcome and duration metrics, fed by {@link JobFinishedEvent}.
 *
 * <ul>
 *   <li>{@code mediatoolbox.jobs.outcome} counter, tagged by tool and outcome</li>
 *   <li>{@code mediatoolbox.jobs.duration} timer, tagged by tool</li>
 * </ul>
 *
 * @see io.micrometer.core.instrument.MeterRegistry
 */
@Component
public class JobMetrics {

    private static final String METRIC_PREFIX = "mediatoolbox.jobs";

    private final MeterRegistry registry;

    public JobMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    @EventListener
    public void onJobFinished(JobFinishedEvent event) {
        String tool = event.tool().name().toLowerCase();
        Counter.builder(METRIC_PREFIX + ".outcome")
                .description("Number of finished jobs by outcome")
                .tag("tool", tool)
                .tag("outcome", event.outcome().label())
                .register(registry)
                .increment();
        Timer.builder(METRIC_PREFIX + ".duration")
                .description("Time from job start to terminal outcome")
                .tag("tool", tool)
                .register(registry)
                .record(event.duration());
    }
}
