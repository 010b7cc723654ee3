package com.wifi.threat.controller;

import java.util.List;

import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.wifi.threat.detection.ThreatAssessment;
import com.wifi.threat.dto.AccessPointRecord;
import com.wifi.threat.dto.NetworkListResponse;
import com.wifi.threat.dto.NetworkQuery;
import com.wifi.threat.dto.NetworkStatsResponse;
import com.wifi.threat.dto.StatusUpdateRequest;
import com.wifi.threat.dto.StatusUpdateResponse;
import com.wifi.threat.service.AccessPointQueryService;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;

/**
 * Dashboard endpoints over stored access point records.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Tag(name = "Networks", description = "Access point listing, status management and statistics")
public class NetworkController {

    private final AccessPointQueryService queryService;

    @Operation(summary = "List networks",
            description = "Filter by persisted status, search SSID/BSSID, sort and limit the stored records")
    @GetMapping(value = "/networks", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<NetworkListResponse> listNetworks(
            @RequestParam(required = false) String status,
            @RequestParam(required = false) String search,
            @RequestParam(defaultValue = "100") int limit,
            @RequestParam(defaultValue = NetworkQuery.DEFAULT_SORT_BY) String sortBy,
            @RequestParam(defaultValue = NetworkQuery.DEFAULT_ORDER) String order) {

        NetworkQuery query = NetworkQuery.builder()
                .status(status)
                .search(search)
                .limit(limit)
                .sortBy(sortBy)
                .order(order)
                .build();
        List<AccessPointRecord> networks = queryService.listAccessPoints(query);
        return ResponseEntity.ok(new NetworkListResponse(true, networks.size(), networks));
    }

    @Operation(summary = "Update network status", description = "Operator sets trusted, unknown or suspicious")
    @PatchMapping(value = "/networks/{bssid}/status", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<StatusUpdateResponse> updateStatus(
            @PathVariable String bssid,
            @RequestBody StatusUpdateRequest request) {
        AccessPointRecord updated = queryService.updateStatus(bssid, request.getStatus());
        return ResponseEntity.ok(new StatusUpdateResponse(true, "Network status updated", updated));
    }

    @Operation(summary = "Assess one network", description = "Fresh threat assessment against all stored records")
    @GetMapping(value = "/networks/{bssid}/threat", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ThreatAssessment> assessNetwork(@PathVariable String bssid) {
        return ResponseEntity.ok(queryService.assessAccessPoint(bssid));
    }

    @Operation(summary = "Network statistics", description = "Counts by status and recently active networks")
    @GetMapping(value = "/stats", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<NetworkStatsResponse> getStats() {
        return ResponseEntity.ok(new NetworkStatsResponse(true, queryService.getStats()));
    }
}
