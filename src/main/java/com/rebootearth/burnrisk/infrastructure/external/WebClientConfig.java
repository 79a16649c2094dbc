package com.rebootearth.burnrisk.infrastructure.external;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * WebClient configuration shared by all upstream clients.
 *
 * Each client clones the builder and sets its own base URL. The in-memory buffer
 * is raised because Overpass and chat completion responses can exceed the 256 KB default.
 */
@Configuration
public class WebClientConfig {

    private static final int MAX_IN_MEMORY_BYTES = 4 * 1024 * 1024;

    @Bean
    public WebClient.Builder webClientBuilder() {
        return WebClient.builder()
            .exchangeStrategies(ExchangeStrategies.builder()
                .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(MAX_IN_MEMORY_BYTES))
                .build());
    }
}
