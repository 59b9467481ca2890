package com.example.dutybot.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Thread pools for provider polling and notification delivery.
 * On shutdown both pools get a bounded grace period to finish in-flight work.
 */
@Configuration
public class AsyncConfig {

    @Bean(name = "providerExecutor")
    public ThreadPoolTaskExecutor providerExecutor(DutyConfig dutyConfig, BotProperties properties) {
        int providers = dutyConfig.providers().size();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(providers);
        executor.setMaxPoolSize(providers * 2);
        executor.setQueueCapacity(20);
        executor.setThreadNamePrefix("provider-");
        executor.setDaemon(true);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(properties.getReconciler().getShutdownGraceSeconds());
        executor.initialize();
        return executor;
    }

    @Bean(name = "dispatchExecutor")
    public ThreadPoolTaskExecutor dispatchExecutor(BotProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(4);
        executor.setQueueCapacity(50);
        executor.setThreadNamePrefix("dispatch-");
        executor.setDaemon(true);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(properties.getDispatcher().getShutdownTimeoutSeconds());
        executor.initialize();
        return executor;
    }
}
