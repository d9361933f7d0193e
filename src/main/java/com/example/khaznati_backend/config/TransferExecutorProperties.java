package com.example.khaznati_backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Sizes the two pools used by the chunk pipeline: one runs whole upload pipelines, the other runs the
 * individual chunk put/get calls.
 */
@ConfigurationProperties(prefix = "transfer")
public class TransferExecutorProperties {

    private int executorThreads = 12;
    private int executorQueueCapacity = 500;
    private int pipelineThreads = 4;
    private int pipelineQueueCapacity = 100;

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

    public int getPipelineThreads() {
        return pipelineThreads;
    }

    public void setPipelineThreads(int pipelineThreads) {
        this.pipelineThreads = pipelineThreads;
    }

    public int getPipelineQueueCapacity() {
        return pipelineQueueCapacity;
    }

    public void setPipelineQueueCapacity(int pipelineQueueCapacity) {
        this.pipelineQueueCapacity = pipelineQueueCapacity;
    }
}
