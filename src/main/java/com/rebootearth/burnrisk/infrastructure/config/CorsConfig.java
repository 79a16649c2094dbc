package com.rebootearth.burnrisk.infrastructure.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.UrlBasedCorsConfigurationSource;
import org.springframework.web.filter.CorsFilter;

import java.util.Arrays;
import java.util.List;

/**
 * CORS configuration for the burn map dashboard.
 */
@Configuration
public class CorsConfig {

    @Bean
    public CorsFilter corsFilter(@Value("${app.cors.allowed-origin-patterns:*}") String allowedOriginPatterns) {
        UrlBasedCorsConfigurationSource source = new UrlBasedCorsConfigurationSource();
        CorsConfiguration config = new CorsConfiguration();

        // Patterns rather than origins so "*" stays valid for local development
        config.setAllowedOriginPatterns(Arrays.asList(allowedOriginPatterns.split(",")));

        config.setAllowedHeaders(List.of("*"));

        // Read-only API apart from cache invalidation
        config.setAllowedMethods(Arrays.asList("GET", "DELETE", "OPTIONS"));

        config.setMaxAge(3600L);

        source.registerCorsConfiguration("/**", config);

        return new CorsFilter(source);
    }
}
