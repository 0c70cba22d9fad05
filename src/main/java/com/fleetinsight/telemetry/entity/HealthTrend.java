package com.fleetinsight.telemetry.entity;

public enum HealthTrend {
    IMPROVING,
    STABLE,
    DECLINING,
    CRITICAL
}
