package com.simod.discovery.service.config;

import jakarta.validation.constraints.NotEmpty;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the external discovery engine process.
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "discovery.engine")
public class EngineConfig {

    /**
     * Command line. The placeholders {log}, {config} and {output} are replaced
     * with the event log, configuration and output directory paths.
     */
    @NotEmpty
    private List<String> command = new ArrayList<>(List.of("bash", "/usr/src/Simod/run.sh", "{config}", "{output}"));

    /**
     * Working directory of the engine process; the job workspace when empty.
     */
    private String workingDirectory;

    /**
     * Maximum wall-clock time of one engine run.
     */
    private Duration timeout = Duration.ofHours(12);

    /**
     * Sub-directory of the output directory holding the discovered model.
     */
    private String resultDirectory = "best_result";

    /**
     * File name of the packaged result artifact.
     */
    private String archiveName = "results.tar.gz";
}
