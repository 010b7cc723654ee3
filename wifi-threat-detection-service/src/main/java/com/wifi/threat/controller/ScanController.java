package com.wifi.threat.controller;

import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.wifi.threat.dto.ScanBatchRequest;
import com.wifi.threat.dto.ScanBatchResponse;
import com.wifi.threat.exception.InvalidPayloadException;
import com.wifi.threat.service.IntakeResult;
import com.wifi.threat.service.ObservationIntakeService;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;

/**
 * Sensor-facing endpoint receiving scan batches. Guarded by the API key interceptor.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Tag(name = "Scan Intake", description = "Submission of access point observations by sensor devices")
public class ScanController {

    static final String INVALID_PAYLOAD_MESSAGE = "Invalid payload: networks array required";

    private final ObservationIntakeService intakeService;

    @Operation(summary = "Submit scan batch",
            description = "Upserts every reported access point, assesses it against all stored records "
                    + "and escalates harmful unknown networks to suspicious.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Batch processed, possibly with per-item errors",
                    content = @Content(schema = @Schema(implementation = ScanBatchResponse.class))),
            @ApiResponse(responseCode = "400", description = "Networks array missing or malformed"),
            @ApiResponse(responseCode = "401", description = "Invalid or missing API key"),
            @ApiResponse(responseCode = "500", description = "Observation store unavailable")
    })
    @PostMapping(value = "/scan", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ScanBatchResponse> submitScan(@RequestBody(required = false) ScanBatchRequest request) {
        if (request == null || request.getNetworks() == null) {
            throw new InvalidPayloadException(INVALID_PAYLOAD_MESSAGE);
        }

        IntakeResult result = intakeService.ingest(request.getDeviceId(), request.getNetworks());

        ScanBatchResponse response = ScanBatchResponse.builder()
                .success(true)
                .message("Processed " + result.processed() + " networks")
                .securitySummary(result.securitySummary())
                .processed(result.processed())
                .created(result.created())
                .updated(result.updated())
                .threats(result.threats())
                .errors(result.errors())
                .build();
        return ResponseEntity.ok(response);
    }
}
