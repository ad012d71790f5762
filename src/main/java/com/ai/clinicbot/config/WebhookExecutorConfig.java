package com.ai.clinicbot.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

@Configuration
public class WebhookExecutorConfig {

    /** Runs the message and status events of one webhook delivery side by side. */
    @Bean(name = "webhookExecutor")
    public ThreadPoolTaskExecutor webhookExecutor(@Value("${clinicbot.webhook.pool-size:8}") int poolSize,
                                                  @Value("${clinicbot.webhook.queue-capacity:200}") int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("webhook-");
        // The request thread runs the event itself rather than dropping it
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.initialize();
        return executor;
    }
}
