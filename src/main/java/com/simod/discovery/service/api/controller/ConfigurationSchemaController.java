package com.simod.discovery.service.api.controller;

import com.simod.discovery.service.api.dto.ApiResponse;
import com.simod.discovery.service.schema.DiscoveryConfigurationSchema;
import com.simod.discovery.service.schema.DiscoveryConfigurationValidator;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Publishes the recognised discovery configuration fields.
 */
@RestController
@RequestMapping("/configuration-schema")
@Tag(name = "Configuration Schema", description = "Recognised discovery configuration fields")
@RequiredArgsConstructor
public class ConfigurationSchemaController {

    private final DiscoveryConfigurationValidator configurationValidator;

    @GetMapping("/json")
    @Operation(summary = "Configuration schema as JSON")
    public ResponseEntity<ApiResponse<Map<String, Object>>> json() {
        return ResponseEntity.ok(ApiResponse.success(DiscoveryConfigurationSchema.describe()));
    }

    @GetMapping("/yaml")
    @Operation(summary = "Configuration schema as YAML")
    public ResponseEntity<byte[]> yaml() {
        return ResponseEntity.ok()
                .contentType(DiscoveryController.YAML)
                .body(configurationValidator.write(DiscoveryConfigurationSchema.describe()));
    }
}
