package com.simod.discovery.service.lifecycle;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.simod.discovery.service.config.DiscoveryConfig;
import com.simod.discovery.service.config.MetricsConfig;
import com.simod.discovery.service.exception.NotificationException;
import com.simod.discovery.service.exception.StorageException;
import com.simod.discovery.service.job.Job;
import com.simod.discovery.service.job.JobField;
import com.simod.discovery.service.job.JobRepository;
import com.simod.discovery.service.job.JobStatus;
import com.simod.discovery.service.job.JobUpdate;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.net.URI;

/**
 * Delivers completion callbacks.
 *
 * One POST per terminal job, never retried. Failures are logged and counted,
 * the job status is never touched.
 */
@Slf4j
@Component
public class CallbackNotifier {

    private final RestClient restClient;
    private final JobRepository jobRepository;
    private final DiscoveryLinks links;
    private final DiscoveryConfig discoveryConfig;
    private final MetricsConfig metricsConfig;

    public CallbackNotifier(@Qualifier("callbackRestClient") RestClient restClient,
                            JobRepository jobRepository,
                            DiscoveryLinks links,
                            DiscoveryConfig discoveryConfig,
                            MetricsConfig metricsConfig) {
        this.restClient = restClient;
        this.jobRepository = jobRepository;
        this.links = links;
        this.discoveryConfig = discoveryConfig;
        this.metricsConfig = metricsConfig;
    }

    /**
     * Posts the terminal status of a job to its callback URL, if it has one.
     */
    @Async("notificationExecutor")
    public void notifyCompletion(Job job) {
        if (job.getCallbackUrl() == null || !discoveryConfig.getFeatures().isCallbacksEnabled()) {
            return;
        }
        try {
            deliver(job);
            log.info("Callback delivered for job {} to {}", job.getId(), job.getCallbackUrl());
        } catch (NotificationException e) {
            log.warn("{} [{}]", e.getMessage(), e.getErrorCode());
            metricsConfig.getNotificationsFailed().increment();
        } finally {
            markNotified(job);
        }
    }

    void deliver(Job job) {
        try {
            restClient.post()
                    .uri(URI.create(job.getCallbackUrl()))
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(payloadFor(job))
                    .retrieve()
                    .toBodilessEntity();
        } catch (RestClientException | IllegalArgumentException e) {
            throw new NotificationException(
                    "Callback for job " + job.getId() + " to " + job.getCallbackUrl() + " failed: " + e.getMessage(),
                    job.getId(), e);
        }
    }

    CallbackPayload payloadFor(Job job) {
        String resultUrl = job.getStatus() == JobStatus.SUCCEEDED ? links.resultUrl(job.getId()) : null;
        return new CallbackPayload(job.getId(), job.getStatus(), resultUrl);
    }

    private void markNotified(Job job) {
        try {
            jobRepository.updateIfStatus(job.getId(), job.getStatus(), JobUpdate.fields().set(JobField.NOTIFIED, true));
        } catch (StorageException e) {
            log.warn("Could not record callback attempt for job {}: {}", job.getId(), e.getMessage());
        }
    }

    /**
     * Body of a completion callback.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record CallbackPayload(
            @JsonProperty("discovery_id") String discoveryId,
            @JsonProperty("status") JobStatus status,
            @JsonProperty("result_url") String resultUrl) {
    }
}
