package com.fleetinsight.telemetry.entity;

/**
 * Arrival-hour buckets for visit patterns.
 */
public enum TimeOfDay {
    MORNING,
    AFTERNOON,
    EVENING,
    NIGHT;

    public static TimeOfDay ofHour(int hour) {
        if (hour >= 5 && hour <= 11) {
            return MORNING;
        }
        if (hour >= 12 && hour <= 16) {
            return AFTERNOON;
        }
        if (hour >= 17 && hour <= 21) {
            return EVENING;
        }
        return NIGHT;
    }
}
