package io.invoicebot.server.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

@Configuration
public class AsyncConfig {

    @Bean(name = "oracleExecutor")
    public ThreadPoolTaskExecutor oracleExecutor(InvoiceBotProperties properties) {
        InvoiceBotProperties.Executor cfg = properties.getExecutor();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(cfg.getOracleCorePoolSize());
        executor.setMaxPoolSize(cfg.getOracleMaxPoolSize());
        executor.setQueueCapacity(cfg.getOracleQueueCapacity());
        executor.setThreadNamePrefix("decision-oracle-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }

    @Bean(name = "checkpointScheduler")
    public ThreadPoolTaskScheduler checkpointScheduler(InvoiceBotProperties properties) {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(properties.getExecutor().getCheckpointSchedulerPoolSize());
        scheduler.setThreadNamePrefix("auto-checkpoint-");
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds(10);
        scheduler.initialize();
        return scheduler;
    }
}
