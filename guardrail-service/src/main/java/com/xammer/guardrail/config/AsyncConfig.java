package com.xammer.guardrail.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

@Configuration
public class AsyncConfig {

    /**
     * Bounded pool for credential deactivations. Each task targets a distinct
     * access key, so there is no ordering between them. A full queue makes the
     * submitting thread run the task itself.
     */
    @Bean(name = "hygieneTaskExecutor")
    public ThreadPoolTaskExecutor hygieneTaskExecutor(GuardrailProperties properties) {
        int poolSize = Math.max(1, properties.getHygiene().getWorkerPoolSize());
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setQueueCapacity(1000);
        executor.setThreadNamePrefix("Hygiene-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.initialize();
        return executor;
    }
}
