package com.simod.discovery.service.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for job retention and expiry sweeping.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "discovery.retention")
public class RetentionConfig {

    /**
     * How long a job and its artifacts are kept after completion (or after
     * submission, while it never completes). Default: 7 days.
     */
    private Duration window = Duration.ofDays(7);

    /**
     * Expiry sweep interval in milliseconds.
     */
    private long sweepIntervalMs = 60000;

    /**
     * Minimum age of an artifact namespace with no job record before the
     * sweep removes it.
     */
    private Duration orphanGrace = Duration.ofHours(1);
}
