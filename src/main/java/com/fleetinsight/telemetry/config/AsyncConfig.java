package com.fleetinsight.telemetry.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Thread pools.
 *
 * telemetryTaskExecutor : background ingestion of single samples.
 *   Core 10 / max 50 / queue 500.
 *
 * healthTaskExecutor : per-vehicle work of the daily health sweep. Sized to
 *   the connection pool so the sweep cannot starve ingestion of connections.
 *
 * Both use CallerRunsPolicy: when the queue is full the submitting thread does
 * the work, so nothing is dropped.
 */
@Configuration
@EnableAsync
public class AsyncConfig {

    @Value("${telemetry.health.batch.pool-size:4}")
    private int healthPoolSize;

    @Bean("telemetryTaskExecutor")
    public Executor telemetryTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(10);
        executor.setMaxPoolSize(50);
        executor.setQueueCapacity(500);
        executor.setThreadNamePrefix("telemetry-async-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.initialize();
        return executor;
    }

    @Bean("healthTaskExecutor")
    public Executor healthTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(healthPoolSize);
        executor.setMaxPoolSize(healthPoolSize);
        executor.setQueueCapacity(1000);
        executor.setThreadNamePrefix("health-batch-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.initialize();
        return executor;
    }
}
