package org.sporkfed.webhookagent.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Dedicated thread pools:
 * - webhookExecutor: takes push processing off the HTTP thread
 * - ruleExecutor: runs the rules of one push concurrently
 */
@Configuration
public class AsyncConfig {

    private static final Logger log = LoggerFactory.getLogger(AsyncConfig.class);

    private final SporkfedProperties properties;

    public AsyncConfig(SporkfedProperties properties) {
        this.properties = properties;
    }

    @Bean(name = "webhookExecutor")
    public Executor webhookExecutor() {
        SporkfedProperties.Executor sizes = properties.getExecutor();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(sizes.getWebhookCoreSize());
        executor.setMaxPoolSize(sizes.getWebhookMaxSize());
        executor.setQueueCapacity(sizes.getWebhookQueueCapacity());
        executor.setThreadNamePrefix("webhook-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(120);
        executor.setRejectedExecutionHandler((r, e) -> {
            log.error("Webhook executor rejected task, queue is full. Pool size: {}, Active: {}, Queue size: {}",
                    e.getPoolSize(), e.getActiveCount(), e.getQueue().size());
            if (!e.isShutdown()) {
                r.run();
            }
        });
        executor.initialize();
        log.info("Webhook executor initialized with core={}, max={}, queueCapacity={}",
                sizes.getWebhookCoreSize(), sizes.getWebhookMaxSize(), sizes.getWebhookQueueCapacity());
        return executor;
    }

    /**
     * Rule tasks block on a join in the webhook thread, so this pool must be separate from
     * webhookExecutor.
     */
    @Bean(name = "ruleExecutor")
    public Executor ruleExecutor() {
        SporkfedProperties.Executor sizes = properties.getExecutor();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(sizes.getRuleCoreSize());
        executor.setMaxPoolSize(sizes.getRuleMaxSize());
        executor.setQueueCapacity(sizes.getRuleQueueCapacity());
        executor.setThreadNamePrefix("rule-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(120);
        executor.setRejectedExecutionHandler((r, e) -> {
            log.warn("Rule executor saturated, running rule on caller thread");
            if (!e.isShutdown()) {
                r.run();
            }
        });
        executor.initialize();
        log.info("Rule executor initialized with core={}, max={}, queueCapacity={}",
                sizes.getRuleCoreSize(), sizes.getRuleMaxSize(), sizes.getRuleQueueCapacity());
        return executor;
    }
}
