package com.wifi.threat.detection;

import java.util.List;

import com.wifi.threat.dto.AccessPointRecord;
import com.wifi.threat.dto.SignalSample;

/**
 * Inputs of one assessment: the record under evaluation, the snapshot of every stored record
 * (the target included) and the target's signal history, oldest first.
 */
public record AssessmentContext(
        AccessPointRecord target,
        List<AccessPointRecord> allRecords,
        List<SignalSample> history) {

    public AssessmentContext {
        allRecords = allRecords == null ? List.of() : allRecords;
        history = history == null ? List.of() : history;
    }
}
