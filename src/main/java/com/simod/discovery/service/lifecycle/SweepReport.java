package com.simod.discovery.service.lifecycle;

/**
 * Result of one expiry sweep cycle.
 *
 * @param expired        job records removed
 * @param orphansRemoved artifact namespaces removed that had no record
 * @param failures       jobs or namespaces whose cleanup failed and is left for the next cycle
 */
public record SweepReport(int expired, int orphansRemoved, int failures) {

    public static final SweepReport EMPTY = new SweepReport(0, 0, 0);

    public boolean isEmpty() {
        return expired == 0 && orphansRemoved == 0 && failures == 0;
    }
}
