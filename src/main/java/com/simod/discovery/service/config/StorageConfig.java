package com.simod.discovery.service.config;

import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for artifact storage and the job repository.
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "discovery.storage")
public class StorageConfig {

    /**
     * Root directory for job artifacts.
     */
    @NotBlank
    private String path = "./tmp/discoveries";

    /**
     * Job repository backend: "mongo" or "memory".
     */
    private String repository = "mongo";

    /**
     * Mongo collection holding job records.
     */
    private String collection = "discoveries";
}
