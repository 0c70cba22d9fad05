package com.fleetinsight.telemetry.exception;

public class ResourceNotFoundException extends TelemetryException {

    public ResourceNotFoundException(String resource, Object id) {
        super(resource + " not found with ID: " + id);
    }
}
