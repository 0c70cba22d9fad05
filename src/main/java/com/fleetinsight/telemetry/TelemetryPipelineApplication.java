package com.fleetinsight.telemetry;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.retry.annotation.EnableRetry;

/**
 * Vehicle telemetry pipeline: event detection, trip segmentation,
 * location learning and daily health scoring.
 */
@SpringBootApplication
@EnableRetry
public class TelemetryPipelineApplication {

    public static void main(String[] args) {
        SpringApplication.run(TelemetryPipelineApplication.class, args);
    }

}
