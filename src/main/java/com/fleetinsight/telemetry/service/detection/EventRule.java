package com.fleetinsight.telemetry.service.detection;

import java.util.List;

/**
 * One independent detection rule evaluated against a (previous, current) sample pair.
 *
 * Implementations must not persist anything; the detector records, dedupes
 * and publishes what they return. A rule that lacks the inputs it needs
 * returns an empty list.
 */
public interface EventRule {

    List<EventCandidate> evaluate(DetectionContext context);

    default String name() {
        return getClass().getSimpleName();
    }
}
