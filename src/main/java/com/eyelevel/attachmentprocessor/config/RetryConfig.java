package com.eyelevel.attachmentprocessor.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.RetryListener;
import org.springframework.retry.backoff.FixedBackOffPolicy;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.backoff.ThreadWaitSleeper;
import org.springframework.retry.policy.SimpleRetryPolicy;
import org.springframework.retry.support.RetryTemplate;

import java.time.Duration;

/**
 * Builds the job-level {@link RetryTemplate}: a fixed number of attempts with a fixed pause between them.
 * The values come from {@code app.processing.retry.*}.
 */
@Configuration
public class RetryConfig {

    @Bean
    public Sleeper retrySleeper() {
        return new ThreadWaitSleeper();
    }

    @Bean("ingestionRetryTemplate")
    public RetryTemplate ingestionRetryTemplate(AttachmentProcessingConfig config, Sleeper retrySleeper,
                                                RetryListener ingestionRetryListener) {
        return buildRetryTemplate(config.getRetry().getAttempts(), config.getRetry().getDelay(), retrySleeper,
                ingestionRetryListener);
    }

    /**
     * @param maxAttempts Total attempts, including the first one.
     * @param delay       Pause between a failed attempt and the next one.
     * @param sleeper     Performs the pause.
     * @param listeners   Notified of every attempt.
     */
    public static RetryTemplate buildRetryTemplate(int maxAttempts, Duration delay, Sleeper sleeper,
                                                   RetryListener... listeners) {
        final FixedBackOffPolicy backOffPolicy = new FixedBackOffPolicy();
        backOffPolicy.setBackOffPeriod(delay.toMillis());
        backOffPolicy.setSleeper(sleeper);

        final RetryTemplate template = new RetryTemplate();
        template.setRetryPolicy(new SimpleRetryPolicy(maxAttempts));
        template.setBackOffPolicy(backOffPolicy);
        template.setListeners(listeners);
        return template;
    }
}
