package com.eyelevel.tableingestor.config;

import com.eyelevel.tableingestor.exception.TransientStoreException;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.RetryListener;
import org.springframework.retry.backoff.ExponentialBackOffPolicy;
import org.springframework.retry.policy.SimpleRetryPolicy;
import org.springframework.retry.support.RetryTemplate;

import java.util.Map;

/**
 * Retry policy for transient store failures: bounded attempts with exponential backoff.
 */
@Configuration
@RequiredArgsConstructor
public class RetryConfig {

    private final IngestionConfig config;

    @Bean("transientStoreRetryTemplate")
    public RetryTemplate transientStoreRetryTemplate(RetryListener transientStoreRetryListener) {
        IngestionConfig.Retry retry = config.getRetry();

        ExponentialBackOffPolicy backOffPolicy = new ExponentialBackOffPolicy();
        backOffPolicy.setInitialInterval(retry.getDelayMs());
        backOffPolicy.setMultiplier(retry.getMultiplier());
        backOffPolicy.setMaxInterval(retry.getMaxDelayMs());

        RetryTemplate template = new RetryTemplate();
        // traverseCauses so a wrapped TransientStoreException still counts
        template.setRetryPolicy(new SimpleRetryPolicy(Math.max(1, retry.getAttempts()),
                Map.of(TransientStoreException.class, true), true));
        template.setBackOffPolicy(backOffPolicy);
        template.registerListener(transientStoreRetryListener);
        return template;
    }
}
