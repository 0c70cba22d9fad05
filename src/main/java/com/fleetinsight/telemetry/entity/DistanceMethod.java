package com.fleetinsight.telemetry.entity;

public enum DistanceMethod {
    ODOMETER,
    GREAT_CIRCLE
}
