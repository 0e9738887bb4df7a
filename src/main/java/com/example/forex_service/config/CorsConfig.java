package com.example.forex_service.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.UrlBasedCorsConfigurationSource;
import org.springframework.web.filter.CorsFilter;

import java.util.List;

/**
 * Browser access for local front ends: any origin starting with
 * {@code http://localhost}, plus the literal {@code null} origin sent by pages
 * opened from the file system.
 */
@Configuration
public class CorsConfig {

    static final String LOCALHOST_ORIGIN_PREFIX = "http://localhost";
    static final String NULL_ORIGIN = "null";

    @Bean
    public CorsFilter corsFilter() {
        CorsConfiguration config = new LocalOriginCorsConfiguration();
        config.setAllowCredentials(true);
        config.setAllowedHeaders(List.of(HttpHeaders.AUTHORIZATION, HttpHeaders.ACCEPT, HttpHeaders.CONTENT_TYPE));
        config.setAllowedMethods(List.of("GET", "POST", "PUT", "DELETE"));
        config.setMaxAge(3600L);

        UrlBasedCorsConfigurationSource source = new UrlBasedCorsConfigurationSource();
        source.registerCorsConfiguration("/**", config);

        return new CorsFilter(source);
    }

    /**
     * Matches origins by prefix instead of the exact or wildcard lists
     * {@link CorsConfiguration} supports.
     */
    static class LocalOriginCorsConfiguration extends CorsConfiguration {

        @Override
        public String checkOrigin(String origin) {
            if (origin == null) {
                return null;
            }
            if (origin.startsWith(LOCALHOST_ORIGIN_PREFIX) || origin.equals(NULL_ORIGIN)) {
                return origin;
            }
            return null;
        }
    }
}
