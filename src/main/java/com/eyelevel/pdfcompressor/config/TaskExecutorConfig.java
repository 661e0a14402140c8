package com.eyelevel.pdfcompressor.config;

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Configures the bounded thread pool that runs compression jobs in {@link DispatchMode#ASYNC} mode.
 */
@Configuration
@RequiredArgsConstructor
public class TaskExecutorConfig {

    private final PdfCompressorConfig config;

    /**
     * Creates the compression pool. A full queue rejects new work instead of blocking the request thread,
     * and the rejected job is failed by the caller.
     *
     * @return A configured AsyncTaskExecutor bean.
     */
    @Bean("compressionTaskExecutor")
    public AsyncTaskExecutor compressionTaskExecutor() {
        final PdfCompressorConfig.Dispatch.Executor settings = config.getDispatch().getExecutor();
        final ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(settings.getCorePoolSize());
        executor.setMaxPoolSize(settings.getMaxPoolSize());
        executor.setQueueCapacity(settings.getQueueCapacity());
        executor.setThreadNamePrefix("compress-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();
        return executor;
    }
}
