package com.architecture.memory.riskscope.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Thread pools used by the risk pipeline: tier-1 signal fan-out, reasoning calls
 * (timeouts enforced by the caller) and the default pool for @Async methods.
 */
@Configuration
@EnableAsync
@Slf4j
public class AsyncConfig {

    @Bean(name = "tier1SignalExecutor", destroyMethod = "shutdown")
    public ThreadPoolTaskExecutor tier1SignalExecutor(RiskScopeProperties properties) {
        int poolSize = properties.getTier1().getPoolSize();
        log.info("[Async Config] Initializing tier-1 signal pool with {} threads", poolSize);

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setQueueCapacity(poolSize * 10);
        executor.setThreadNamePrefix("tier1-");
        executor.initialize();
        return executor;
    }

    /**
     * Default pool for @Async methods.
     */
    @Bean(name = "taskExecutor")
    public ThreadPoolTaskExecutor taskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(4);
        executor.setQueueCapacity(1000);
        executor.setThreadNamePrefix("async-");
        executor.initialize();
        return executor;
    }

    @Bean(name = "reasoningExecutor", destroyMethod = "shutdownNow")
    public ExecutorService reasoningExecutor() {
        return Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName("reasoning-" + thread.getId());
            thread.setDaemon(true);
            return thread;
        });
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
