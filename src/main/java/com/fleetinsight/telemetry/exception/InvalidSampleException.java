package com.fleetinsight.telemetry.exception;

/**
 * A position sample that is malformed or out of range.
 * Only the offending sample is rejected; batches carry on.
 */
public class InvalidSampleException extends TelemetryException {

    public InvalidSampleException(String message) {
        super(message);
    }
}
