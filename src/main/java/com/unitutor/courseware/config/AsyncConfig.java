package com.unitutor.courseware.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class AsyncConfig {

    /**
     * Fixed pool for pipeline runs. Submissions beyond the pool and its queue are rejected
     * with a {@link org.springframework.core.task.TaskRejectedException}, never waited on.
     */
    @Bean(name = "pipelineTaskExecutor")
    public ThreadPoolTaskExecutor pipelineTaskExecutor(
        @Value("${app.pipeline.max-concurrent-runs:4}") int maxConcurrentRuns,
        @Value("${app.pipeline.queued-runs:16}") int queuedRuns
    ) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setThreadNamePrefix("pipeline-");
        executor.setCorePoolSize(maxConcurrentRuns);
        executor.setMaxPoolSize(maxConcurrentRuns);
        executor.setQueueCapacity(queuedRuns);
        executor.initialize();
        return executor;
    }
}
