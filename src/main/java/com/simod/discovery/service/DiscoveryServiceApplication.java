package com.simod.discovery.service;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Discovery Service Application - Entry point for the Spring Boot application.
 *
 * Accepts event logs for simulation model discovery and runs them
 * asynchronously. It:
 * - Stores uploaded logs and configurations and records a job per submission
 * - Dispatches jobs through a task queue to a pool of discovery workers
 * - Serves job status and results until the retention window ends
 * - Sweeps expired jobs and recovers lost or stuck ones
 */
@SpringBootApplication
@EnableScheduling
@EnableAsync
@ConfigurationPropertiesScan("com.simod.discovery.service.config")
public class DiscoveryServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(DiscoveryServiceApplication.class, args);
    }
}
