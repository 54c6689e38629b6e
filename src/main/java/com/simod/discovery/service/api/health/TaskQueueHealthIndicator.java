package com.simod.discovery.service.api.health;

import com.simod.discovery.service.config.DispatchConfig;
import com.simod.discovery.service.dispatch.TaskQueue;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator for the discovery task queue.
 *
 * Goes down when the backlog reaches the backpressure threshold.
 */
@Component
@RequiredArgsConstructor
public class TaskQueueHealthIndicator implements HealthIndicator {

    private final TaskQueue queue;
    private final DispatchConfig config;

    @Override
    public Health health() {
        int utilization = queue.getUtilizationPercent();
        int threshold = config.getQueue().getBackpressureThreshold();

        Health.Builder builder = utilization >= threshold
                ? Health.down()
                : Health.up();

        return builder
                .withDetail("transport", config.getTransport())
                .withDetail("durable", queue.isDurable())
                .withDetail("pendingTasks", queue.size())
                .withDetail("capacity", queue.getCapacity())
                .withDetail("utilizationPercent", utilization)
                .withDetail("backpressureThreshold", threshold)
                .build();
    }
}
