package com.simod.discovery.service.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.Getter;
import org.springframework.context.annotation.Configuration;

import java.util.function.Supplier;

/**
 * Metrics configuration for the discovery service.
 *
 * Provides custom metrics for submission, processing, expiry and notification.
 */
@Configuration
@Getter
public class MetricsConfig {

    private final MeterRegistry registry;

    // Counters
    private final Counter jobsSubmitted;
    private final Counter jobsSucceeded;
    private final Counter jobsFailed;
    private final Counter jobsExpired;
    private final Counter jobsRequeued;
    private final Counter dispatchFailures;
    private final Counter notificationsFailed;

    // Timers
    private final Timer engineTimer;
    private final Timer sweepTimer;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;

        this.jobsSubmitted = Counter.builder("discovery.jobs.submitted")
                .description("Number of discovery jobs accepted")
                .register(registry);

        this.jobsSucceeded = Counter.builder("discovery.jobs.succeeded")
                .description("Number of discovery jobs that produced a result")
                .register(registry);

        this.jobsFailed = Counter.builder("discovery.jobs.failed")
                .description("Number of discovery jobs that failed")
                .register(registry);

        this.jobsExpired = Counter.builder("discovery.jobs.expired")
                .description("Number of discovery jobs removed after their retention window")
                .register(registry);

        this.jobsRequeued = Counter.builder("discovery.jobs.requeued")
                .description("Number of discovery jobs requeued after losing their worker")
                .register(registry);

        this.dispatchFailures = Counter.builder("discovery.dispatch.failures")
                .description("Number of tasks the queue did not accept")
                .register(registry);

        this.notificationsFailed = Counter.builder("discovery.notifications.failed")
                .description("Number of completion callbacks that could not be delivered")
                .register(registry);

        this.engineTimer = Timer.builder("discovery.engine.duration")
                .description("Time taken by the discovery engine per job")
                .register(registry);

        this.sweepTimer = Timer.builder("discovery.sweep.duration")
                .description("Time taken by one expiry sweep cycle")
                .register(registry);
    }

    /**
     * Registers a gauge for the number of stored discovery records.
     */
    public void registerStoreGauge(Supplier<Number> sizeSupplier) {
        Gauge.builder("discovery.jobs.stored", sizeSupplier)
                .description("Discovery records currently stored")
                .register(registry);
    }

    /**
     * Registers a gauge for queue depth monitoring.
     *
     * @param name the metric name
     * @param description the metric description
     * @param sizeSupplier supplier for the current size
     */
    public void registerQueueGauge(String name, String description, Supplier<Number> sizeSupplier) {
        Gauge.builder(name, sizeSupplier)
                .description(description)
                .register(registry);
    }
}
