package com.wifi.threat.controller;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import io.swagger.v3.oas.annotations.Hidden;

/** Service banner at the root path. */
@RestController
@Hidden
public class ServiceInfoController {

    private static final List<String> ENDPOINTS = List.of(
            "GET /actuator/health - Health check",
            "POST /api/scan - Submit network scan (requires API key)",
            "GET /api/networks - Get all networks",
            "PATCH /api/networks/{bssid}/status - Update network status",
            "GET /api/networks/{bssid}/threat - Assess one network",
            "GET /api/stats - Get statistics",
            "GET /api/threats - Get threat report");

    @GetMapping("/")
    public Map<String, Object> serviceInfo() {
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("message", "WiFi Threat Detection API");
        info.put("status", "running");
        info.put("endpoints", ENDPOINTS);
        return info;
    }
}
