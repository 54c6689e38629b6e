package com.simod.discovery.service.dispatch;

import com.simod.discovery.service.config.DispatchConfig;
import com.simod.discovery.service.config.MetricsConfig;
import com.simod.discovery.service.exception.DispatchException;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.BlockingDeque;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingDeque;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-process task queue backed by a bounded BlockingDeque.
 *
 * Delivered tasks are tracked in an in-flight table until acknowledged; a
 * requeued task goes back to the head of the line. Tasks do not survive a
 * restart, reconciliation re-dispatches them.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "discovery.dispatch", name = "transport", havingValue = "memory", matchIfMissing = true)
public class InMemoryTaskQueue implements TaskQueue {

    private final DispatchConfig config;
    private final MetricsConfig metricsConfig;

    private final Map<Long, DiscoveryTask> inFlight = new ConcurrentHashMap<>();
    private final AtomicLong deliveryTags = new AtomicLong();

    private BlockingDeque<DiscoveryTask> queue;
    private int capacity;

    @PostConstruct
    void init() {
        this.capacity = config.getQueue().getCapacity();
        this.queue = new LinkedBlockingDeque<>(capacity);

        metricsConfig.registerQueueGauge(
                "discovery.queue.size",
                "Current discovery task queue size",
                this::size
        );
        metricsConfig.registerQueueGauge(
                "discovery.queue.in_flight",
                "Discovery tasks delivered but not yet acknowledged",
                this::inFlightCount
        );

        log.info("In-memory TaskQueue initialized with capacity: {}", capacity);
    }

    @Override
    public void enqueue(DiscoveryTask task) {
        boolean offered;
        try {
            offered = queue.offer(task, config.getQueue().getEnqueueTimeoutMs(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DispatchException("Interrupted while enqueuing task", task.jobId(), e);
        }
        if (!offered) {
            throw new DispatchException("Task queue full, capacity " + capacity, task.jobId());
        }
        log.debug("Enqueued task for job {} (attempt {})", task.jobId(), task.attempt());
    }

    @Override
    public Optional<TaskDelivery> dequeue(long timeoutMs) {
        try {
            DiscoveryTask task = queue.poll(timeoutMs, TimeUnit.MILLISECONDS);
            if (task == null) {
                return Optional.empty();
            }
            long tag = deliveryTags.incrementAndGet();
            inFlight.put(tag, task);
            log.debug("Dequeued task for job {} (tag {})", task.jobId(), tag);
            return Optional.of(new InMemoryDelivery(tag, task));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("Interrupted while dequeuing task");
            return Optional.empty();
        }
    }

    @Override
    public int size() {
        return queue.size();
    }

    @Override
    public int getCapacity() {
        return capacity;
    }

    @Override
    public boolean isDurable() {
        return false;
    }

    /**
     * Gets the number of delivered tasks not yet acknowledged.
     */
    public int inFlightCount() {
        return inFlight.size();
    }

    private final class InMemoryDelivery implements TaskDelivery {

        private final long tag;
        private final DiscoveryTask task;
        private final AtomicBoolean settled = new AtomicBoolean(false);

        private InMemoryDelivery(long tag, DiscoveryTask task) {
            this.tag = tag;
            this.task = task;
        }

        @Override
        public DiscoveryTask task() {
            return task;
        }

        @Override
        public void ack() {
            if (settled.compareAndSet(false, true)) {
                inFlight.remove(tag);
            }
        }

        @Override
        public void nack(boolean requeue) {
            if (!settled.compareAndSet(false, true)) {
                return;
            }
            inFlight.remove(tag);
            if (requeue && !queue.offerFirst(task)) {
                log.warn("Queue full, dropping requeued task for job {}", task.jobId());
            }
        }
    }
}
