package com.simod.discovery.service.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.simod.discovery.service.job.Job;
import com.simod.discovery.service.job.JobStatus;
import com.simod.discovery.service.lifecycle.DiscoveryLinks;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * DTO for discovery job responses.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class DiscoveryResponse {

    /**
     * Discovery identifier.
     */
    private String id;

    private JobStatus status;

    private Instant submittedAt;
    private Instant startedAt;
    private Instant completedAt;

    /**
     * When the discovery and its artifacts are removed.
     */
    private Instant expiresAt;

    /**
     * Link to poll for the status.
     */
    private String statusUrl;

    /**
     * Link to download the result, present once the discovery succeeded.
     */
    private String resultUrl;

    /**
     * Failure description, present once the discovery failed.
     */
    private String error;

    private String callbackUrl;

    /**
     * Processing attempts started so far.
     */
    private Integer attempts;

    public static DiscoveryResponse from(Job job, DiscoveryLinks links) {
        return DiscoveryResponse.builder()
                .id(job.getId())
                .status(job.getStatus())
                .submittedAt(job.getSubmittedAt())
                .startedAt(job.getStartedAt())
                .completedAt(job.getCompletedAt())
                .expiresAt(job.getExpiresAt())
                .statusUrl(links.statusUrl(job.getId()))
                .resultUrl(job.getStatus() == JobStatus.SUCCEEDED ? links.resultUrl(job.getId()) : null)
                .error(job.getErrorDetail())
                .callbackUrl(job.getCallbackUrl())
                .attempts(job.getAttempts())
                .build();
    }
}
