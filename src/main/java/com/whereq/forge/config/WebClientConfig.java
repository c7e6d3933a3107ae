package com.whereq.forge.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * WebClient configuration for the generation backend
 */
@Configuration
public class WebClientConfig {

    @Bean
    public WebClient.Builder webClientBuilder() {
        return WebClient.builder()
            .codecs(configurer -> configurer
                .defaultCodecs()
                .maxInMemorySize(16 * 1024 * 1024)); // 16MB, generated articles can be large
    }

    @Bean
    public WebClient generationWebClient(WebClient.Builder webClientBuilder, ForgeProperties properties) {
        return webClientBuilder.clone()
            .baseUrl(properties.getGeneration().getBaseUrl())
            .build();
    }
}
