package com.phillippitts.mathscrap.config;

import com.phillippitts.mathscrap.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Executors for asynchronous pipeline work.
 *
 * <p>Pool sizes come from {@link ThreadPoolProperties} ({@code threadpool.*}). All pools copy the
 * Log4j2 ThreadContext (MDC) from the submitting thread so request and job ids survive the hop.
 *
 * <p>The pipeline and recognition pools reject work when saturated
 * ({@link ThreadPoolExecutor.AbortPolicy}); submitted work never runs on the submitting
 * thread. The analysis pool uses {@link ThreadPoolExecutor.CallerRunsPolicy}.
 */
@Configuration
@EnableAsync
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Runs whole-image processing for asynchronous API requests.
     *
     * @return executor for pipeline jobs
     */
    @Bean(name = "pipelineExecutor")
    public Executor pipelineExecutor() {
        return buildExecutor(threadPoolProperties.getPipeline(), new ThreadPoolExecutor.AbortPolicy());
    }

    /**
     * Runs backend recognition calls so that slow inference never occupies a request thread.
     *
     * @return executor for recognition backends
     */
    @Bean(name = "recognitionExecutor")
    public Executor recognitionExecutor() {
        return buildExecutor(threadPoolProperties.getRecognition(), new ThreadPoolExecutor.AbortPolicy());
    }

    /**
     * Runs symbolic validation and readable rendering concurrently for one image.
     *
     * @return executor for post-recognition analysis
     */
    @Bean(name = "analysisExecutor")
    public Executor analysisExecutor() {
        return buildExecutor(threadPoolProperties.getAnalysis(), new ThreadPoolExecutor.CallerRunsPolicy());
    }

    static ThreadPoolTaskExecutor buildExecutor(ThreadPoolProperties.PoolProperties props,
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
