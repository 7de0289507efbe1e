package com.eyelevel.extractionpipeline.service.queue;

import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.RetryCallback;
import org.springframework.retry.RetryContext;
import org.springframework.retry.RetryListener;
import org.springframework.stereotype.Component;

@Component("jobStoreRetryListener")
@Slf4j
public class JobStoreRetryListener implements RetryListener {
    @Override
    public <T, E extends Throwable> void onError(RetryContext context, RetryCallback<T, E> callback,
                                                 Throwable throwable) {
        if (context.getRetryCount() > 0) {
            String jobId = "unknown";
            Object[] args = (Object[]) context.getAttribute("context.args");

            if (args != null && args.length > 0 && args[0] instanceof String) {
                jobId = (String) args[0];
            }

            log.warn("Job store write for job '{}' failed on attempt {}. Retrying...", jobId,
                     context.getRetryCount(), throwable);
        }
    }
}
