package com.wifi.threat.service;

import java.util.List;

import com.wifi.threat.detection.ThreatAssessment;
import com.wifi.threat.dto.ThreatSummary;

/**
 * Ranked threat report over the whole store.
 *
 * @param summary counts per risk level and harmful count
 * @param threats assessments with a non-zero score or findings, highest score first
 */
public record ThreatReport(ThreatSummary summary, List<ThreatAssessment> threats) {}
