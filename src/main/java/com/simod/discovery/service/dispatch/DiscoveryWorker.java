package com.simod.discovery.service.dispatch;

import com.simod.discovery.service.config.DispatchConfig;
import com.simod.discovery.service.exception.DiscoveryException;
import com.simod.discovery.service.exception.InvalidTransitionException;
import com.simod.discovery.service.exception.JobNotFoundException;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Worker pool that processes tasks from the task queue.
 *
 * Each thread handles one task at a time. A task is acknowledged only after
 * its outcome is recorded; if recording fails the task is returned to the
 * queue.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "discovery.features", name = "worker-enabled", matchIfMissing = true)
public class DiscoveryWorker {

    private final TaskQueue queue;
    private final TaskProcessor processor;
    private final DispatchConfig dispatchConfig;

    private ExecutorService executorService;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicInteger activeWorkers = new AtomicInteger(0);
    private final AtomicInteger busyWorkers = new AtomicInteger(0);

    // ==================== Lifecycle ====================

    @PostConstruct
    void start() {
        int workerCount = dispatchConfig.getWorker().getThreadCount();
        executorService = Executors.newFixedThreadPool(workerCount, this::createWorkerThread);
        running.set(true);
        for (int i = 0; i < workerCount; i++) {
            executorService.submit(this::processLoop);
        }
        log.info("DiscoveryWorker started with {} workers", workerCount);
    }

    @PreDestroy
    void stop() {
        running.set(false);
        executorService.shutdown();
        int timeoutSeconds = dispatchConfig.getWorker().getShutdownTimeoutSeconds();
        try {
            if (!executorService.awaitTermination(timeoutSeconds, TimeUnit.SECONDS)) {
                log.warn("Forcing shutdown of discovery workers, {} still busy", busyWorkers.get());
                executorService.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executorService.shutdownNow();
        }
        log.info("DiscoveryWorker stopped. Final active workers: {}", activeWorkers.get());
    }

    private Thread createWorkerThread(Runnable runnable) {
        var thread = new Thread(runnable);
        thread.setName("discovery-worker-" + thread.getId());
        thread.setDaemon(true);
        return thread;
    }

    // ==================== Processing Loop ====================

    private void processLoop() {
        activeWorkers.incrementAndGet();
        long pollTimeoutMs = dispatchConfig.getWorker().getPollMs();

        try {
            while (running.get() && !Thread.currentThread().isInterrupted()) {
                processNext(pollTimeoutMs);
            }
        } finally {
            activeWorkers.decrementAndGet();
        }
    }

    private void processNext(long pollTimeoutMs) {
        try {
            queue.dequeue(pollTimeoutMs).ifPresent(this::handle);
        } catch (Exception e) {
            log.error("Error in discovery worker loop", e);
        }
    }

    void handle(TaskDelivery delivery) {
        DiscoveryTask task = delivery.task();
        busyWorkers.incrementAndGet();
        try {
            processor.process(task);
            delivery.ack();
        } catch (InvalidTransitionException | JobNotFoundException e) {
            log.warn("Dropping task for job {}: {}", task.jobId(), e.getMessage());
            delivery.ack();
        } catch (DiscoveryException e) {
            log.error("Outcome of job {} not recorded: {} [{}]", task.jobId(), e.getMessage(), e.getErrorCode());
            requeue(delivery);
        } catch (Exception e) {
            log.error("Unexpected error processing job {}", task.jobId(), e);
            requeue(delivery);
        } finally {
            busyWorkers.decrementAndGet();
        }
    }

    private void requeue(TaskDelivery delivery) {
        try {
            delivery.nack(true);
        } catch (DiscoveryException e) {
            log.warn("Could not return task for job {} to the queue: {}", delivery.task().jobId(), e.getMessage());
        }
    }

    // ==================== Monitoring ====================

    /**
     * Returns the current number of worker threads.
     */
    public int getActiveWorkerCount() {
        return activeWorkers.get();
    }

    /**
     * Returns the number of workers currently processing a job.
     */
    public int getBusyWorkerCount() {
        return busyWorkers.get();
    }
}
