package com.simod.discovery.service.lifecycle;

import com.simod.discovery.service.config.DiscoveryConfig;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * Builds the public links of a discovery.
 */
@Component
@RequiredArgsConstructor
public class DiscoveryLinks {

    private final DiscoveryConfig discoveryConfig;

    public String statusUrl(String jobId) {
        return base().pathSegment("discoveries", jobId).toUriString();
    }

    public String resultUrl(String jobId) {
        return base().pathSegment("discoveries", jobId, "result").toUriString();
    }

    private UriComponentsBuilder base() {
        return UriComponentsBuilder.fromHttpUrl(discoveryConfig.getPublicUrl());
    }
}
