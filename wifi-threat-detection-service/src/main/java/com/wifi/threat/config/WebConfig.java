package com.wifi.threat.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import com.wifi.threat.security.ApiKeyInterceptor;

import lombok.RequiredArgsConstructor;

/**
 * Registers the API key guard on the sensor ingest endpoint. Dashboard reads stay open.
 */
@Configuration
@RequiredArgsConstructor
public class WebConfig implements WebMvcConfigurer {

    public static final String SCAN_PATH = "/api/scan";

    private final ApiKeyInterceptor apiKeyInterceptor;

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(apiKeyInterceptor)
                .addPathPatterns(SCAN_PATH);
    }
}
