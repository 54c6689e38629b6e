package com.simod.discovery.service.dispatch;

/**
 * A task handed to one worker, pending acknowledgement.
 *
 * Exactly one of {@link #ack()} or {@link #nack(boolean)} must be called.
 * An unacknowledged delivery is redelivered if the worker disappears.
 */
public interface TaskDelivery {

    DiscoveryTask task();

    /**
     * Confirms the task is fully handled and removes it from the queue.
     */
    void ack();

    /**
     * Rejects the task.
     *
     * @param requeue put the task back for another worker
     */
    void nack(boolean requeue);
}
