package com.mlops.retraining.config;

import java.time.Clock;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
@EnableConfigurationProperties(RetrainingProperties.class)
public class RetrainingConfig {

    @Bean
    public Clock retrainingClock() {
        return Clock.systemUTC();
    }

    @Bean
    public ThreadPoolTaskExecutor retrainingWorkerExecutor(RetrainingProperties properties) {
        int threads = Math.max(1, properties.getJob().getWorkerThreads());
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setQueueCapacity(Math.max(1, properties.getJob().getQueueCapacity()));
        executor.setThreadNamePrefix("retraining-worker-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.setTaskDecorator(new MdcTaskDecorator());
        return executor;
    }
}
