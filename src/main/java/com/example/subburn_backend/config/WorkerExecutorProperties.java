package com.example.subburn_backend.config;

import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Bounds for the pool that runs subtitle pipelines. Uploads beyond
 * {@code executorThreads + executorQueueCapacity} in-flight jobs are rejected.
 */
@Validated
@ConfigurationProperties(prefix = "worker")
public class WorkerExecutorProperties {

    @Min(1)
    private int executorThreads = 2;

    @Min(0)
    private int executorQueueCapacity = 20;

    public int getExecutorThreads() {
        return executorThreads;
    }

    public void setExecutorThreads(int executorThreads) {
        this.executorThreads = executorThreads;
    }

    public int getExecutorQueueCapacity() {
        return executorQueueCapacity;
    }

    public void setExecutorQueueCapacity(int executorQueueCapacity) {
        this.executorQueueCapacity = executorQueueCapacity;
    }
}
