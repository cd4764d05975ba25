package com.deepansh.lineage.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Dedicated thread pool for tool calls.
 *
 * The calling query thread blocks on the returned future with a timeout, so the
 * pool only exists to make a hanging store call abandonable. Isolated from the
 * web thread pool so slow stores never starve HTTP request handling.
 */
@Configuration
public class AsyncConfig {

    @Bean(name = "toolTaskExecutor")
    public ThreadPoolTaskExecutor toolTaskExecutor(ToolProperties toolProperties) {
        ToolProperties.Executor cfg = toolProperties.getExecutor();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(cfg.getCorePoolSize());
        executor.setMaxPoolSize(cfg.getMaxPoolSize());
        executor.setQueueCapacity(cfg.getQueueCapacity());
        executor.setThreadNamePrefix("lineage-tool-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }
}
