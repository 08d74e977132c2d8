package com.insurance.payments.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * HTTP client and worker pool used for webhook delivery. The pool is shut down with the
 * application context.
 */
@Configuration
public class WebhookConfig {

    @Bean
    public RestTemplate webhookRestTemplate(RestTemplateBuilder builder,
                                            @Value("${payment.webhook.timeout-ms:5000}") long timeoutMs) {
        return builder
                .connectTimeout(Duration.ofMillis(timeoutMs))
                .readTimeout(Duration.ofMillis(timeoutMs))
                .build();
    }

    /** Bounded queue; submissions beyond it are rejected and logged by the caller. */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService webhookExecutor(@Value("${payment.webhook.pool-size:4}") int poolSize,
                                           @Value("${payment.webhook.queue-capacity:1000}") int queueCapacity) {
        return new ThreadPoolExecutor(poolSize, poolSize, 60L, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(queueCapacity),
                new CustomizableThreadFactory("webhook-"),
                new ThreadPoolExecutor.AbortPolicy());
    }
}
