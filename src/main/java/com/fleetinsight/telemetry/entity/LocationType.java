package com.fleetinsight.telemetry.entity;

public enum LocationType {
    HOME,
    WORK,
    PARKING,
    FREQUENT,
    UNKNOWN
}
