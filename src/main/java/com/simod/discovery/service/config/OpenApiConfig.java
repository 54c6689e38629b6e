package com.simod.discovery.service.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI/Swagger configuration for API documentation.
 */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI discoveryServiceOpenAPI(DiscoveryConfig discoveryConfig) {
        return new OpenAPI()
                .info(new Info()
                        .title("Discovery Service API")
                        .description("Submits event logs for business process simulation model discovery, " +
                                "tracks discovery jobs and serves their results until they expire.")
                        .version("1.0.0")
                        .license(new License()
                                .name("Apache 2.0")
                                .url("https://www.apache.org/licenses/LICENSE-2.0")))
                .servers(List.of(
                        new Server()
                                .url(discoveryConfig.getPublicUrl())
                                .description("Configured public address")
                ));
    }
}
