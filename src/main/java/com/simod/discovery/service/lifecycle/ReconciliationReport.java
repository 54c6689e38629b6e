package com.simod.discovery.service.lifecycle;

/**
 * Result of one reconciliation cycle.
 *
 * @param redispatched PENDING jobs handed to the queue again
 * @param requeued     RUNNING jobs returned to PENDING after losing their worker
 * @param failed       RUNNING jobs failed for timeout or exhausted attempts
 * @param errors       jobs whose reconciliation failed and is left for the next cycle
 */
public record ReconciliationReport(int redispatched, int requeued, int failed, int errors) {

    public boolean isEmpty() {
        return redispatched == 0 && requeued == 0 && failed == 0 && errors == 0;
    }
}
