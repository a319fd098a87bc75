package lkml.watch.app.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Configuration for concurrent subsystem monitoring.
 * Each subscribed subsystem is processed on its own worker; messages within a subsystem stay sequential.
 */
@Configuration
@EnableAsync
public class AsyncConfig {

    @Bean(name = "feedMonitorExecutor")
    public Executor feedMonitorExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(4);
        executor.setMaxPoolSize(8);
        executor.setQueueCapacity(200); // one task per subscribed subsystem per cycle
        executor.setThreadNamePrefix("feed-monitor-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.initialize();
        return executor;
    }
}
