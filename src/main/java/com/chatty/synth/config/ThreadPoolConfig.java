package com.chatty.synth.config;

import com.chatty.synth.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Configuration for the thread pool that runs helper-seat backend calls.
 *
 * <p>Pool sizes are configured via {@link ThreadPoolProperties} ({@code threadpool.helper.*}).
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Bounded executor for concurrent helper calls.
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.AbortPolicy}. When the pool and queue are
     * full the submission fails and the dispatcher counts that seat as rejected. Running the call
     * on the request thread instead would escape the dispatch deadline.
     *
     * <p>MDC propagation: the submitting thread's Log4j2 ThreadContext (requestId, userId) is
     * copied to the worker for the duration of the task.
     *
     * @return configured executor for helper dispatch
     */
    @Bean(name = "helperExecutor")
    public Executor helperExecutor() {
        ThreadPoolProperties.HelperPoolProperties helperProps = threadPoolProperties.getHelper();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(helperProps.getCorePoolSize());
        executor.setMaxPoolSize(helperProps.getMaxPoolSize());
        executor.setQueueCapacity(helperProps.getQueueCapacity());
        executor.setThreadNamePrefix(helperProps.getThreadNamePrefix());
        executor.setKeepAliveSeconds(helperProps.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
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
