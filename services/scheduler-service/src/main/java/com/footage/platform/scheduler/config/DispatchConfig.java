package com.footage.platform.scheduler.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class DispatchConfig {

    public static final String DISPATCH_EXECUTOR = "publishDispatchExecutor";

    /**
     * Fixed pool the queue fans publish calls out on.
     */
    @Bean(name = DISPATCH_EXECUTOR, destroyMethod = "shutdownNow")
    public ExecutorService publishDispatchExecutor(SchedulerProperties properties) {
        return Executors.newFixedThreadPool(
                properties.getQueue().getDispatchConcurrency(),
                new CustomizableThreadFactory("publish-dispatch-"));
    }
}
