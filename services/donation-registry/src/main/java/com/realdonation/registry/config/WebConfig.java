package com.realdonation.registry.config;

import com.realdonation.registry.infrastructure.web.CorrelationIdFilter;
import com.realdonation.security.CallerAddressExtractor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * CORS for local wallet front ends calling the registry API.
 */
@Configuration
public class WebConfig implements WebMvcConfigurer {

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        registry.addMapping("/api/**")
                .allowedOrigins("http://localhost:3000", "http://localhost:5173")
                .allowedMethods("GET", "POST", "PUT", "DELETE", "OPTIONS")
                .allowedHeaders(
                        "Content-Type",
                        CallerAddressExtractor.HEADER,
                        CorrelationIdFilter.CORRELATION_ID_HEADER)
                .exposedHeaders(CorrelationIdFilter.CORRELATION_ID_HEADER)
                .maxAge(3600);
    }
}
