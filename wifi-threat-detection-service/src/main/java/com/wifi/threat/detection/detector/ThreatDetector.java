package com.wifi.threat.detection.detector;

import java.util.Optional;

import com.wifi.threat.detection.AssessmentContext;
import com.wifi.threat.detection.ThreatFinding;

/**
 * A single independent threat heuristic.
 *
 * <p>Implementations are pure: they read the context only and hold no mutable state, so one
 * instance may be shared across concurrent assessments.
 */
public interface ThreatDetector {

    /** Points added to the harm score when this detector fires. */
    int points();

    /**
     * Evaluates the heuristic.
     *
     * @param context the record under evaluation and its surroundings
     * @return the finding when the heuristic fires, otherwise empty
     */
    Optional<ThreatFinding> detect(AssessmentContext context);
}
