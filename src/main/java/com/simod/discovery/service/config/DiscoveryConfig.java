package com.simod.discovery.service.config;

import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Overall application configuration for the discovery service.
 *
 * Contains the public address used in links and feature toggles.
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "discovery")
public class DiscoveryConfig {

    /**
     * Base URL clients use to reach this service, used to build status and result links.
     */
    @NotBlank
    private String publicUrl = "http://localhost:8080";

    /**
     * Reject unknown top-level sections in uploaded configurations.
     */
    private boolean strictConfiguration = false;

    /**
     * Feature flags for optional capabilities.
     */
    private Features features = new Features();

    @Getter
    @Setter
    public static class Features {

        /**
         * Run the worker pool in this process.
         */
        private boolean workerEnabled = true;

        /**
         * Run the reconciliation sweep for stuck and under-dispatched jobs.
         */
        private boolean reconciliationEnabled = true;

        /**
         * Deliver completion callbacks.
         */
        private boolean callbacksEnabled = true;
    }
}
