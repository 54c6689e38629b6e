package com.simod.discovery.service.dispatch;

import java.util.Optional;

/**
 * Interface for the discovery task queue.
 *
 * Decouples request handling from the long-running engine. Delivery is
 * at least once: a task is only removed once a worker acknowledges it.
 */
public interface TaskQueue {

    /**
     * Hands a task to the queue.
     *
     * @throws com.simod.discovery.service.exception.DispatchException if the queue did not accept it
     */
    void enqueue(DiscoveryTask task);

    /**
     * Waits up to {@code timeoutMs} for the next task.
     *
     * @return the delivery if one was available, empty otherwise
     */
    Optional<TaskDelivery> dequeue(long timeoutMs);

    /**
     * Gets the number of tasks waiting for a worker.
     */
    int size();

    /**
     * Gets the queue capacity.
     */
    int getCapacity();

    /**
     * Whether queued tasks survive a restart of this process.
     */
    boolean isDurable();

    /**
     * Gets the queue utilization as a percentage.
     *
     * @return utilization percentage (0-100)
     */
    default int getUtilizationPercent() {
        int capacity = getCapacity();
        return capacity > 0 ? Math.min(100, (size() * 100) / capacity) : 0;
    }

    /**
     * Checks if the queue is at capacity.
     */
    default boolean isFull() {
        return size() >= getCapacity();
    }
}
