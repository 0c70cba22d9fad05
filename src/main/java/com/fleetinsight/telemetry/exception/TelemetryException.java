package com.fleetinsight.telemetry.exception;

/**
 * Base type for failures raised by the telemetry pipeline.
 */
public class TelemetryException extends RuntimeException {

    public TelemetryException(String message) {
        super(message);
    }

    public TelemetryException(String message, Throwable cause) {
        super(message, cause);
    }
}
