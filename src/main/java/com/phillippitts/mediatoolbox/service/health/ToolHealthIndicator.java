package com.phillippitts.mediatoolbox.service.health;

import com.phillippitts.mediatoolbox.domain.ToolKind;
import com.phillippitts.mediatoolbox.service.job.process.ToolLocator;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator for the external tools.
 *
 * <ul>
 *   <li>UP: every tool can be located</li>
 *   <li>DOWN: at least one tool is missing</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health endpoint.
 */
@Component
public class ToolHealthIndicator implements HealthIndicator {

    private final ToolLocator toolLocator;

    public ToolHealthIndicator(ToolLocator toolLocator) {
        this.toolLocator = toolLocator;
    }

    @Override
    public Health health() {
        Health.Builder builder = new Health.Builder();
        boolean allAvailable = true;
        for (ToolKind tool : ToolKind.values()) {
            boolean available = toolLocator.isAvailable(tool);
            allAvailable &= available;
            builder.withDetail(tool.name().toLowerCase(), available ? toolLocator.resolve(tool) : "not found");
        }
        if (allAvailable) {
            builder.up().withDetail("status", "All tools available");
        } else {
            builder.down().withDetail("status", "One or more tools missing");
        }
        return builder.build();
    }
}
