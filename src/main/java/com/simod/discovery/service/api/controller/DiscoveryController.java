package com.simod.discovery.service.api.controller;

import com.simod.discovery.service.api.dto.ApiResponse;
import com.simod.discovery.service.api.dto.DeletionResponse;
import com.simod.discovery.service.api.dto.DiscoveryResponse;
import com.simod.discovery.service.exception.ValidationException;
import com.simod.discovery.service.job.Job;
import com.simod.discovery.service.lifecycle.DiscoveryLifecycleManager;
import com.simod.discovery.service.lifecycle.DiscoveryLinks;
import com.simod.discovery.service.lifecycle.ResultArtifact;
import com.simod.discovery.service.lifecycle.SubmissionRequest;
import com.simod.discovery.service.lifecycle.UploadedFile;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.InputStreamResource;
import org.springframework.core.io.Resource;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.MediaTypeFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.net.URI;
import java.util.List;

/**
 * Controller for discovery jobs.
 *
 * Submission returns as soon as the job is recorded; clients poll the status
 * URL or register a callback.
 */
@Slf4j
@RestController
@RequestMapping("/discoveries")
@Tag(name = "Discoveries", description = "Submit event logs for discovery and retrieve the results")
@RequiredArgsConstructor
public class DiscoveryController {

    static final MediaType YAML = MediaType.parseMediaType("application/yaml");

    private final DiscoveryLifecycleManager lifecycleManager;
    private final DiscoveryLinks links;

    // ==================== Submission ====================

    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @Operation(
            summary = "Submit a discovery",
            description = "Uploads an event log (CSV or XES, optionally gzipped) and an optional discovery " +
                    "configuration. The discovery runs asynchronously."
    )
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "202", description = "Discovery accepted"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Missing event log or invalid configuration"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "415", description = "Unsupported event log type"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "503", description = "Storage unavailable")
    })
    public ResponseEntity<ApiResponse<DiscoveryResponse>> submit(
            @Parameter(description = "Event log file") @RequestPart("event_log") MultipartFile eventLog,
            @Parameter(description = "Discovery configuration (YAML)")
            @RequestPart(value = "configuration", required = false) MultipartFile configuration,
            @Parameter(description = "URL notified once the discovery completes")
            @RequestParam(value = "callback_url", required = false) String callbackUrl,
            @Parameter(description = "Not supported, requests carrying it are rejected")
            @RequestParam(value = "email", required = false) String email) {

        if (email != null) {
            throw new ValidationException("Email notifications are not supported");
        }

        log.debug("Received discovery submission: eventLog={} ({} bytes), configuration={}",
                eventLog.getOriginalFilename(), eventLog.getSize(),
                configuration == null ? null : configuration.getOriginalFilename());

        Job job = lifecycleManager.submit(new SubmissionRequest(
                toUploadedFile(eventLog),
                configuration == null ? null : toUploadedFile(configuration),
                callbackUrl));

        return ResponseEntity.accepted()
                .location(URI.create(links.statusUrl(job.getId())))
                .body(ApiResponse.success(DiscoveryResponse.from(job, links)));
    }

    // ==================== Queries ====================

    @GetMapping
    @Operation(summary = "List discoveries", description = "Returns every discovery that has not expired")
    public ResponseEntity<ApiResponse<List<DiscoveryResponse>>> list() {
        var discoveries = lifecycleManager.list().stream()
                .map(job -> DiscoveryResponse.from(job, links))
                .toList();
        return ResponseEntity.ok(ApiResponse.success(discoveries));
    }

    @GetMapping("/{discoveryId}")
    @Operation(summary = "Get discovery status", description = "Returns the status, with a result link once succeeded")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Discovery found"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Unknown or expired discovery")
    })
    public ResponseEntity<ApiResponse<DiscoveryResponse>> get(
            @Parameter(description = "Discovery ID") @PathVariable String discoveryId) {
        return ResponseEntity.ok(ApiResponse.success(DiscoveryResponse.from(lifecycleManager.get(discoveryId), links)));
    }

    @GetMapping("/{discoveryId}/result")
    @Operation(summary = "Download the result", description = "Returns the artifact produced by the discovery engine")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Result artifact"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "No result available"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "409", description = "Discovery still processing")
    })
    public ResponseEntity<Resource> result(
            @Parameter(description = "Discovery ID") @PathVariable String discoveryId) {
        ResultArtifact artifact = lifecycleManager.openResult(discoveryId);
        MediaType contentType = MediaTypeFactory.getMediaType(artifact.fileName())
                .orElse(MediaType.APPLICATION_OCTET_STREAM);

        return ResponseEntity.ok()
                .contentType(contentType)
                .header(HttpHeaders.CONTENT_DISPOSITION, ContentDisposition.attachment()
                        .filename(artifact.fileName())
                        .build()
                        .toString())
                .body(new InputStreamResource(artifact.content()));
    }

    @GetMapping("/{discoveryId}/configuration")
    @Operation(summary = "Download the configuration", description = "Returns the configuration the engine runs with")
    public ResponseEntity<byte[]> configuration(
            @Parameter(description = "Discovery ID") @PathVariable String discoveryId) {
        return ResponseEntity.ok()
                .contentType(YAML)
                .body(lifecycleManager.openConfiguration(discoveryId));
    }

    // ==================== Deletion ====================

    @DeleteMapping("/{discoveryId}")
    @Operation(summary = "Delete a discovery", description = "Removes the discovery and all of its artifacts")
    public ResponseEntity<ApiResponse<DeletionResponse>> delete(
            @Parameter(description = "Discovery ID") @PathVariable String discoveryId) {
        Job removed = lifecycleManager.delete(discoveryId);
        log.info("Discovery {} deleted on request", discoveryId);
        return ResponseEntity.ok(ApiResponse.success(DeletionResponse.single(removed.getId())));
    }

    @DeleteMapping
    @Operation(summary = "Delete all discoveries", description = "Removes every discovery and its artifacts")
    public ResponseEntity<ApiResponse<DeletionResponse>> deleteAll() {
        long deleted = lifecycleManager.deleteAll();
        return ResponseEntity.ok(ApiResponse.success(DeletionResponse.amount(deleted)));
    }

    // ==================== Helper Methods ====================

    private static UploadedFile toUploadedFile(MultipartFile file) {
        try {
            return new UploadedFile(file.getOriginalFilename(), file.getContentType(), file.getBytes());
        } catch (IOException e) {
            throw new ValidationException("Could not read uploaded file " + file.getOriginalFilename(), e);
        }
    }
}
