package com.example.media_acquisition.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Thread pools of the pipeline. Secondary acquisitions get their own pool because they are awaited
 * from inside an acquisition thread; sharing one pool could starve it.
 */
@Configuration
public class ExecutorConfig {

    @Bean(name = "acquisitionTaskExecutor")
    public ThreadPoolTaskExecutor acquisitionTaskExecutor(ExecutorProperties properties) {
        return executor(properties.getAcquisitionThreads(), properties.getQueueCapacity(), "acquire-");
    }

    @Bean(name = "secondaryTaskExecutor")
    public ThreadPoolTaskExecutor secondaryTaskExecutor(ExecutorProperties properties) {
        return executor(properties.getSecondaryThreads(), properties.getQueueCapacity(), "secondary-");
    }

    @Bean(name = "backendTaskExecutor")
    public ThreadPoolTaskExecutor backendTaskExecutor(ExecutorProperties properties) {
        return executor(properties.getBackendThreads(), properties.getQueueCapacity(), "backend-");
    }

    private static ThreadPoolTaskExecutor executor(int threads, int queueCapacity, String prefix) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(Math.max(1, threads));
        executor.setMaxPoolSize(Math.max(1, threads));
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix(prefix);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();
        return executor;
    }
}
