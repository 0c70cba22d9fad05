package com.fleetinsight.telemetry.entity;

/**
 * Which segmentation strategy produced a trip.
 *
 *  IGNITION     : ignition on/off boundaries, split on sample gaps
 *  IDLE_TIMEOUT : ignition-on samples only, split after a stop of a few minutes
 */
public enum TripSource {
    IGNITION,
    IDLE_TIMEOUT
}
