package com.wifi.threat.controller;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.is;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.time.Duration;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import com.fasterxml.jackson.databind.JsonNode;
import com.wifi.threat.config.ThreatDetectionProperties;
import com.wifi.threat.config.WebConfig;
import com.wifi.threat.exception.ObservationStoreException;
import com.wifi.threat.security.ApiKeyInterceptor;
import com.wifi.threat.service.IntakeResult;
import com.wifi.threat.service.ObservationIntakeService;

@ExtendWith(MockitoExtension.class)
@DisplayName("Scan Controller Tests")
class ScanControllerTest {

    private static final String API_KEY = "test-api-key";
    private static final String VALID_BATCH = """
            {
              "deviceId": "ESP8266_042",
              "networks": [
                {"ssid": "HomeNet", "bssid": "F4:F2:6D:01:02:03", "rssi": -55, "channel": 6, "encType": "WPA2"}
              ]
            }
            """;

    @Mock private ObservationIntakeService intakeService;

    @InjectMocks private ScanController controller;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        ThreatDetectionProperties properties =
                new ThreatDetectionProperties(API_KEY, "ESP8266_001", 20, Duration.ofMinutes(10), 3, null);
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalExceptionHandler())
                .addMappedInterceptors(new String[] {WebConfig.SCAN_PATH}, new ApiKeyInterceptor(properties))
                .build();
    }

    @Test
    void should_ReturnBatchOutcome_When_PayloadValid() throws Exception {
        when(intakeService.ingest(eq("ESP8266_042"), anyList()))
                .thenReturn(new IntakeResult(1, 1, 0, List.of(), List.of()));

        mockMvc.perform(post("/api/scan")
                        .header(ApiKeyInterceptor.API_KEY_HEADER, API_KEY)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(VALID_BATCH))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success", is(true)))
                .andExpect(jsonPath("$.message", is("Processed 1 networks")))
                .andExpect(jsonPath("$.created", is(1)))
                .andExpect(jsonPath("$.updated", is(0)))
                .andExpect(jsonPath("$.securitySummary.threatsDetected", is(0)));
    }

    @Test
    void should_AcceptBearerToken_When_ApiKeyHeaderAbsent() throws Exception {
        when(intakeService.ingest(any(), anyList())).thenReturn(new IntakeResult(1, 1, 0, List.of(), List.of()));

        mockMvc.perform(post("/api/scan")
                        .header(ApiKeyInterceptor.AUTHORIZATION_HEADER, "Bearer " + API_KEY)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(VALID_BATCH))
                .andExpect(status().isOk());
    }

    @Test
    void should_Return401_When_ApiKeyMissing() throws Exception {
        mockMvc.perform(post("/api/scan")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(VALID_BATCH))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.message", is("Unauthorized: Invalid or missing API key")));

        verify(intakeService, never()).ingest(any(), anyList());
    }

    @Test
    void should_Return401_When_ApiKeyWrong() throws Exception {
        mockMvc.perform(post("/api/scan")
                        .header(ApiKeyInterceptor.API_KEY_HEADER, "not-the-key")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(VALID_BATCH))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void should_Return400_When_NetworksMissing() throws Exception {
        mockMvc.perform(post("/api/scan")
                        .header(ApiKeyInterceptor.API_KEY_HEADER, API_KEY)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"deviceId\": \"ESP8266_042\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error", is("Invalid payload: networks array required")));
    }

    @Test
    void should_Return400_When_NetworksNotAList() throws Exception {
        mockMvc.perform(post("/api/scan")
                        .header(ApiKeyInterceptor.API_KEY_HEADER, API_KEY)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"networks\": 42}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message", is("Invalid payload: networks array required")));
    }

    @Test
    @SuppressWarnings("unchecked")
    void should_PassEveryEntryToIntake_When_OneEntryDoesNotBind() throws Exception {
        when(intakeService.ingest(any(), anyList())).thenReturn(new IntakeResult(1, 1, 0,
                List.of("Error processing F4:F2:6D:01:02:04: Malformed network report"), List.of()));

        mockMvc.perform(post("/api/scan")
                        .header(ApiKeyInterceptor.API_KEY_HEADER, API_KEY)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"networks": [
                                  {"ssid": "HomeNet", "bssid": "F4:F2:6D:01:02:03", "rssi": -55, "channel": 6},
                                  {"ssid": "CafeNet", "bssid": "F4:F2:6D:01:02:04", "rssi": "strong", "channel": 6},
                                  "oops"
                                ]}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.errors[0]", is("Error processing F4:F2:6D:01:02:04: Malformed network report")));

        ArgumentCaptor<List<JsonNode>> captor = ArgumentCaptor.forClass(List.class);
        verify(intakeService).ingest(isNull(), captor.capture());
        assertThat(captor.getValue()).hasSize(3);
        assertThat(captor.getValue().get(2).isTextual()).isTrue();
    }

    @Test
    void should_Return500_When_StoreUnavailable() throws Exception {
        when(intakeService.ingest(any(), anyList()))
                .thenThrow(new ObservationStoreException("Failed to read access points", new RuntimeException("down")));

        mockMvc.perform(post("/api/scan")
                        .header(ApiKeyInterceptor.API_KEY_HEADER, API_KEY)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(VALID_BATCH))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.status", is(500)));
    }
}
