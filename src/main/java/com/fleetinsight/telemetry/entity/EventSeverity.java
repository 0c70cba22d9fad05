package com.fleetinsight.telemetry.entity;

public enum EventSeverity {
    INFO,
    WARNING,
    ERROR,
    CRITICAL
}
