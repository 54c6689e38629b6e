package com.simod.discovery.service.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration properties for the task queue, the worker pool and the
 * reconciliation sweep.
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "discovery.dispatch")
public class DispatchConfig {

    /**
     * Task transport: "memory" (in-process queue) or "rabbit" (AMQP broker).
     */
    @NotBlank
    private String transport = "memory";

    /**
     * Queue configuration.
     */
    @Valid
    private QueueConfig queue = new QueueConfig();

    /**
     * Worker configuration.
     */
    @Valid
    private WorkerConfig worker = new WorkerConfig();

    /**
     * Retry settings for jobs whose worker was lost.
     */
    @Valid
    private RetryConfig retry = new RetryConfig();

    /**
     * Reconciliation sweep settings.
     */
    private ReconciliationConfig reconciliation = new ReconciliationConfig();

    /**
     * AMQP settings, used when the transport is "rabbit".
     */
    private RabbitConfig rabbit = new RabbitConfig();

    @Getter
    @Setter
    public static class QueueConfig {

        /**
         * Maximum in-memory queue capacity.
         */
        @Min(1)
        private int capacity = 1000;

        /**
         * Queue utilization threshold for backpressure alerts (percentage).
         */
        private int backpressureThreshold = 80;

        /**
         * Enqueue timeout in milliseconds.
         */
        private long enqueueTimeoutMs = 5000;
    }

    @Getter
    @Setter
    public static class WorkerConfig {

        /**
         * Number of worker threads, each processing one job at a time.
         */
        @Min(1)
        private int threadCount = 2;

        /**
         * Poll timeout in milliseconds.
         */
        private long pollMs = 500;

        /**
         * Interval between worker liveness signals while a job runs.
         */
        private Duration heartbeatInterval = Duration.ofSeconds(30);

        /**
         * A running job whose last heartbeat is older than this is considered
         * abandoned by its worker.
         */
        private Duration ackTimeout = Duration.ofMinutes(5);

        /**
         * A running job older than this is failed with a timeout error.
         */
        private Duration maxProcessing = Duration.ofHours(12);

        /**
         * Seconds to wait for in-flight jobs on shutdown.
         */
        private int shutdownTimeoutSeconds = 30;
    }

    @Getter
    @Setter
    public static class RetryConfig {

        /**
         * Maximum processing attempts for a job whose worker was lost.
         */
        @Min(1)
        private int maxAttempts = 3;

        /**
         * Base backoff before a lost job is dispatched again; doubles per attempt.
         */
        private Duration backoff = Duration.ofSeconds(30);
    }

    @Getter
    @Setter
    public static class ReconciliationConfig {

        /**
         * Reconciliation sweep interval in milliseconds.
         */
        private long intervalMs = 30000;

        /**
         * A pending job with no accepted dispatch is retried once older than this.
         */
        private Duration pendingGrace = Duration.ofSeconds(60);
    }

    @Getter
    @Setter
    public static class RabbitConfig {

        /**
         * Topic exchange tasks are published to.
         */
        private String exchange = "simod";

        /**
         * Durable queue workers consume from.
         */
        private String queue = "discoveries";

        /**
         * Routing key for pending discovery tasks.
         */
        private String routingKey = "discoveries.status.pending";
    }
}
