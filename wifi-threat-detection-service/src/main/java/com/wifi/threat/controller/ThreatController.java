package com.wifi.threat.controller;

import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.wifi.threat.dto.ThreatReportResponse;
import com.wifi.threat.service.ThreatQueryService;
import com.wifi.threat.service.ThreatReport;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Tag(name = "Threats", description = "Threat assessment across all observed networks")
public class ThreatController {

    private final ThreatQueryService threatQueryService;

    @Operation(summary = "Threat report",
            description = "Recomputes every assessment from the current store, ranked by harm score")
    @GetMapping(value = "/threats", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ThreatReportResponse> getThreats() {
        ThreatReport report = threatQueryService.generateThreatReport();
        return ResponseEntity.ok(new ThreatReportResponse(true, report.summary(), report.threats()));
    }
}
