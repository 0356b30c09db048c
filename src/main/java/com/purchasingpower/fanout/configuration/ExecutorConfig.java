package com.purchasingpower.fanout.configuration;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Thread pools for search runs.
 *
 * <ul>
 *   <li>{@code engineExecutor} - one task per engine call and the corpus task</li>
 *   <li>{@code anchorExecutor} - anchor follow-ups, kept apart so engine tasks waiting on them never starve</li>
 *   <li>{@code streamExecutor} - drives SSE runs off the request thread</li>
 *   <li>{@code backendExecutor} - parallel dual writes</li>
 * </ul>
 *
 * Saturated pools run the task on the submitting thread instead of rejecting it.
 */
@Slf4j
@Configuration
public class ExecutorConfig {

    @Bean(name = "engineExecutor", destroyMethod = "shutdown")
    public ThreadPoolTaskExecutor engineExecutor(SearchProperties properties) {
        return pool("engine-", properties.getPools().getEngineThreads(), 200);
    }

    @Bean(name = "anchorExecutor", destroyMethod = "shutdown")
    public ThreadPoolTaskExecutor anchorExecutor(SearchProperties properties) {
        return pool("anchor-", properties.getPools().getAnchorThreads(), 200);
    }

    @Bean(name = "streamExecutor", destroyMethod = "shutdown")
    public ThreadPoolTaskExecutor streamExecutor(SearchProperties properties) {
        return pool("search-stream-", properties.getPools().getStreamThreads(), 50);
    }

    @Bean(name = "backendExecutor", destroyMethod = "shutdown")
    public ThreadPoolTaskExecutor backendExecutor(BackendProperties properties) {
        return pool("backend-write-", properties.getWriterThreads(), 500);
    }

    private static ThreadPoolTaskExecutor pool(String prefix, int size, int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(size);
        executor.setMaxPoolSize(size);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix(prefix);
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        executor.initialize();

        log.info("✅ Executor {} configured: threads={}, queue={}", prefix, size, queueCapacity);
        return executor;
    }
}
