package com.eyelevel.attachmentprocessor.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.RetryCallback;
import org.springframework.retry.RetryContext;
import org.springframework.retry.RetryListener;
import org.springframework.stereotype.Component;

@Slf4j
@Component("ingestionRetryListener")
public class IngestionRetryListener implements RetryListener {

    /**
     * Called after a failed attempt, before the back-off pause.
     */
    @Override
    public <T, E extends Throwable> void onError(RetryContext context, RetryCallback<T, E> callback, Throwable throwable) {
        log.error("Attempt {} failed: {}", context.getRetryCount(), throwable.getMessage());
    }

    /**
     * Called after the final attempt, successful or not.
     */
    @Override
    public <T, E extends Throwable> void close(RetryContext context, RetryCallback<T, E> callback, Throwable throwable) {
        if (throwable == null) {
            log.info("Processing completed successfully");
        } else {
            log.error("All retry attempts failed after {} attempts", context.getRetryCount());
        }
    }
}
