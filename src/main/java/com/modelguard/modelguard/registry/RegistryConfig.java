package com.modelguard.modelguard.registry;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Binds registry and scoring properties and builds one WebClient per collaborator.
 */
@Configuration
@EnableConfigurationProperties({RegistryProperties.class, ScoringProperties.class})
public class RegistryConfig {

    @Bean
    public WebClient registryWebClient(WebClient.Builder builder, RegistryProperties registryProperties) {
        return builder.clone()
                .baseUrl(registryProperties.getBaseUrl())
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .build();
    }

    @Bean
    public WebClient scoringWebClient(WebClient.Builder builder, ScoringProperties scoringProperties) {
        return builder.clone()
                .baseUrl(scoringProperties.getBaseUrl())
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .build();
    }
}
