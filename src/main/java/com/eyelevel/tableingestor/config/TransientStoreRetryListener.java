package com.eyelevel.tableingestor.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.RetryCallback;
import org.springframework.retry.RetryContext;
import org.springframework.retry.RetryListener;
import org.springframework.stereotype.Component;

@Slf4j
@Component("transientStoreRetryListener")
public class TransientStoreRetryListener implements RetryListener {
    @Override
    public <T, E extends Throwable> void onError(RetryContext context, RetryCallback<T, E> callback,
                                                 Throwable throwable) {
        log.warn("Transient store operation failed on attempt {}: {}", context.getRetryCount(),
                throwable.getMessage());
    }
}
