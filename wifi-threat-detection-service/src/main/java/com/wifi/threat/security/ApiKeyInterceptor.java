package com.wifi.threat.security;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

import com.wifi.threat.config.ThreatDetectionProperties;
import com.wifi.threat.exception.UnauthorizedException;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;

/**
 * Rejects requests that do not carry the shared API key, before any handler runs.
 *
 * <p>The key is read from {@code x-api-key}, falling back to {@code Authorization} (with or
 * without a {@code Bearer } prefix).
 */
@Component
@Slf4j
public class ApiKeyInterceptor implements HandlerInterceptor {

    public static final String API_KEY_HEADER = "x-api-key";
    public static final String AUTHORIZATION_HEADER = "Authorization";
    private static final String BEARER_PREFIX = "Bearer ";

    private final byte[] expectedKey;

    public ApiKeyInterceptor(ThreatDetectionProperties properties) {
        this.expectedKey = properties.apiKey().getBytes(StandardCharsets.UTF_8);
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        String presented = extractKey(request);
        if (presented == null || !MessageDigest.isEqual(expectedKey, presented.getBytes(StandardCharsets.UTF_8))) {
            log.warn("Rejected {} {} from {}: invalid or missing API key",
                    request.getMethod(), request.getRequestURI(), request.getRemoteAddr());
            throw new UnauthorizedException("Unauthorized: Invalid or missing API key");
        }
        return true;
    }

    private static String extractKey(HttpServletRequest request) {
        String apiKey = request.getHeader(API_KEY_HEADER);
        if (apiKey != null && !apiKey.isEmpty()) {
            return apiKey;
        }
        String authorization = request.getHeader(AUTHORIZATION_HEADER);
        if (authorization == null || authorization.isEmpty()) {
            return null;
        }
        return authorization.startsWith(BEARER_PREFIX) ? authorization.substring(BEARER_PREFIX.length()) : authorization;
    }
}
