package com.simod.discovery.service.engine;

import java.nio.file.Path;

/**
 * The process-discovery computation, run synchronously by a worker.
 *
 * The engine is a black box: given an event log and an optional
 * configuration it either produces a single result artifact or fails.
 */
public interface DiscoveryEngine {

    /**
     * Runs discovery for one job.
     *
     * @return path of the produced artifact, inside the input's workspace
     * @throws com.simod.discovery.service.exception.EngineException if discovery fails
     */
    Path discover(DiscoveryInput input);
}
