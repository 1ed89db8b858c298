package com.phillippitts.mediatoolbox.config;

import com.phillippitts.mediatoolbox.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Configuration for the executors used by job supervision.
 *
 * <p>Pool sizes are configured via {@link ThreadPoolProperties} and can be tuned
 * in application.properties.
 *
 * <p>Both executors copy the Log4j2 ThreadContext (MDC) from the submitting thread to the
 * worker thread so request ids survive the hop into background work.
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Executor for the driving task of each job (spawn, wait, resolve).
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.AbortPolicy}. When the pool and queue are full
     * the start request fails with a spawn failure instead of holding the HTTP thread for the whole
     * job.
     *
     * @return executor for job driving tasks
     */
    @Bean(name = "jobExecutor")
    public Executor jobExecutor() {
        return buildExecutor(threadPoolProperties.getJob(), new ThreadPoolExecutor.AbortPolicy());
    }

    /**
     * Executor that delivers queued progress events to HTTP subscribers, keeping slow
     * clients away from the stream readers. When saturated, the submitting thread delivers.
     *
     * @return executor for event delivery
     */
    @Bean(name = "eventExecutor")
    public Executor eventExecutor() {
        return buildExecutor(threadPoolProperties.getEvent(), new ThreadPoolExecutor.CallerRunsPolicy());
    }

    private static ThreadPoolTaskExecutor buildExecutor(ThreadPoolProperties.PoolProperties props,
                                                        RejectedExecutionHandler rejectionPolicy) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getCorePoolSize());
        executor.setMaxPoolSize(props.getMaxPoolSize());
        executor.setQueueCapacity(props.getQueueCapacity());
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setKeepAliveSeconds(props.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(rejectionPolicy);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.setTaskDecorator(mdcPropagatingDecorator());
        executor.initialize();
        return executor;
    }

    static TaskDecorator mdcPropagatingDecorator() {
        return runnable -> {
            Map<String, String> contextMap = ThreadContext.getImmutableContext();
            return () -> {
                Map<String, String> previous = ThreadContext.getImmutableContext();
                try {
                    if (contextMap != null && !contextMap.isEmpty()) {
                        ThreadContext.putAll(contextMap);
                    }
                    runnable.run();
                } finally {
                    ThreadContext.clearAll();
                    if (previous != null && !previous.isEmpty()) {
                        ThreadContext.putAll(previous);
                    }
                }
            };
        };
    }
}
