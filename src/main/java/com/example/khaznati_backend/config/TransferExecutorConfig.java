package com.example.khaznati_backend.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Thread pools for the chunk pipeline. Upload pipelines wait on chunk tasks, so the two never share a pool.
 */
@Configuration
@EnableConfigurationProperties(TransferExecutorProperties.class)
public class TransferExecutorConfig {

    @Bean(name = "transferTaskExecutor")
    public ThreadPoolTaskExecutor transferTaskExecutor(TransferExecutorProperties properties) {
        return pool("chunk-", properties.getExecutorThreads(), properties.getExecutorQueueCapacity());
    }

    @Bean(name = "uploadPipelineExecutor")
    public ThreadPoolTaskExecutor uploadPipelineExecutor(TransferExecutorProperties properties) {
        return pool("upload-", properties.getPipelineThreads(), properties.getPipelineQueueCapacity());
    }

    private ThreadPoolTaskExecutor pool(String prefix, int threads, int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        int size = Math.max(1, threads);
        executor.setCorePoolSize(size);
        executor.setMaxPoolSize(size);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix(prefix);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();
        return executor;
    }
}
