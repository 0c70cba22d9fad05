package com.fleetinsight.telemetry.entity;

/**
 * Typed vehicle events produced by the event detector.
 * Stored as VARCHAR (EnumType.STRING).
 */
public enum EventType {

    LOW_BATTERY,
    CRITICAL_BATTERY,
    OVERSPEEDING,
    RAPID_ACCELERATION,
    HARSH_BRAKING,
    IGNITION_ON,
    IGNITION_OFF,
    TRIP_COMPLETED,
    VEHICLE_MOVING,
    IDLE_TOO_LONG,
    OFFLINE,
    ONLINE
}
