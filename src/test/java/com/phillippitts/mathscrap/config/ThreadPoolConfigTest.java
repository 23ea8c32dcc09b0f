package com.phillippitts.mathscrap.config;

import com.phillippitts.mathscrap.config.logging.MdcKeys;
import com.phillippitts.mathscrap.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ThreadPoolConfigTest {

    private final ThreadPoolConfig config = new ThreadPoolConfig(new ThreadPoolProperties());

    @AfterEach
    void tearDown() {
        ThreadContext.clearAll();
    }

    @Test
    void shouldCreateExecutorsFromDefaults() {
        ThreadPoolTaskExecutor pipeline = (ThreadPoolTaskExecutor) config.pipelineExecutor();
        ThreadPoolTaskExecutor recognition = (ThreadPoolTaskExecutor) config.recognitionExecutor();
        ThreadPoolTaskExecutor analysis = (ThreadPoolTaskExecutor) config.analysisExecutor();

        assertThat(pipeline.getCorePoolSize()).isEqualTo(2);
        assertThat(pipeline.getMaxPoolSize()).isEqualTo(4);
        assertThat(pipeline.getThreadNamePrefix()).isEqualTo("pipeline-");
        assertThat(recognition.getThreadNamePrefix()).isEqualTo("recognition-");
        assertThat(analysis.getCorePoolSize()).isEqualTo(4);
        assertThat(analysis.getMaxPoolSize()).isEqualTo(8);

        pipeline.shutdown();
        recognition.shutdown();
        analysis.shutdown();
    }

    @Test
    void shouldHandleConcurrentTasks() throws InterruptedException {
        ThreadPoolTaskExecutor executor = (ThreadPoolTaskExecutor) config.analysisExecutor();
        int taskCount = 20;
        CountDownLatch latch = new CountDownLatch(taskCount);
        AtomicInteger completed = new AtomicInteger();

        for (int i = 0; i < taskCount; i++) {
            executor.execute(() -> {
                try {
                    Thread.sleep(5);
                    completed.incrementAndGet();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    latch.countDown();
                }
            });
        }

        assertThat(latch.await(10, TimeUnit.SECONDS)).isTrue();
        assertThat(completed.get()).isEqualTo(taskCount);
        executor.shutdown();
    }

    @Test
    void saturatedPipelinePoolRejectsInsteadOfRunningOnCaller() throws InterruptedException {
        // Arrange
        ThreadPoolProperties props = new ThreadPoolProperties();
        props.getPipeline().setCorePoolSize(1);
        props.getPipeline().setMaxPoolSize(1);
        props.getPipeline().setQueueCapacity(0);
        ThreadPoolTaskExecutor executor = (ThreadPoolTaskExecutor) new ThreadPoolConfig(props).pipelineExecutor();
        CountDownLatch release = new CountDownLatch(1);
        executor.execute(() -> {
            try {
                release.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        AtomicReference<String> ranOn = new AtomicReference<>();

        try {
            // Act & Assert
            assertThatThrownBy(() -> executor.execute(() -> ranOn.set(Thread.currentThread().getName())))
                    .isInstanceOf(RejectedExecutionException.class);
            assertThat(ranOn.get()).isNull();
        } finally {
            release.countDown();
            executor.shutdown();
        }
    }

    @Test
    void saturatedAnalysisPoolRunsOnCaller() {
        // Arrange
        ThreadPoolProperties props = new ThreadPoolProperties();
        props.getAnalysis().setCorePoolSize(1);
        props.getAnalysis().setMaxPoolSize(1);
        props.getAnalysis().setQueueCapacity(0);
        ThreadPoolTaskExecutor executor = (ThreadPoolTaskExecutor) new ThreadPoolConfig(props).analysisExecutor();
        CountDownLatch release = new CountDownLatch(1);
        executor.execute(() -> {
            try {
                release.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        AtomicReference<String> ranOn = new AtomicReference<>();

        try {
            // Act
            executor.execute(() -> ranOn.set(Thread.currentThread().getName()));

            // Assert
            assertThat(ranOn.get()).isEqualTo(Thread.currentThread().getName());
        } finally {
            release.countDown();
            executor.shutdown();
        }
    }

    @Test
    void shouldCarryMdcOntoWorkerThread() throws InterruptedException {
        // Arrange
        Executor executor = config.pipelineExecutor();
        ThreadContext.put(MdcKeys.JOB_ID, "job-42");
        CountDownLatch latch = new CountDownLatch(1);
        AtomicReference<String> seen = new AtomicReference<>();
        AtomicReference<String> threadName = new AtomicReference<>();

        // Act
        executor.execute(() -> {
            seen.set(ThreadContext.get(MdcKeys.JOB_ID));
            threadName.set(Thread.currentThread().getName());
            latch.countDown();
        });

        // Assert
        assertThat(latch.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(seen.get()).isEqualTo("job-42");
        assertThat(threadName.get()).startsWith("pipeline-");
        ((ThreadPoolTaskExecutor) executor).shutdown();
    }

    @Test
    void decoratorRestoresPreviousContext() {
        // Arrange
        ThreadContext.put(MdcKeys.JOB_ID, "submitter");
        Runnable decorated = ThreadPoolConfig.mdcPropagatingDecorator().decorate(
                () -> assertThat(ThreadContext.get(MdcKeys.JOB_ID)).isEqualTo("submitter"));
        ThreadContext.clearAll();
        ThreadContext.put(MdcKeys.REQUEST_ID, "worker-own");

        // Act
        decorated.run();

        // Assert
        assertThat(ThreadContext.get(MdcKeys.JOB_ID)).isNull();
        assertThat(ThreadContext.get(MdcKeys.REQUEST_ID)).isEqualTo("worker-own");
    }
}
