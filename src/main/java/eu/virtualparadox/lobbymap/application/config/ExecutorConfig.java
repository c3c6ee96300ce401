package eu.virtualparadox.lobbymap.application.config;

import eu.virtualparadox.lobbymap.application.executor.FanOutExecutor;
import eu.virtualparadox.lobbymap.application.executor.IngestionExecutor;
import eu.virtualparadox.lobbymap.application.executor.ModelCallGuard;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ExecutorConfig {

    @Bean
    public IngestionExecutor ingestionExecutor(final ApplicationConfig config) {
        final int workers = Math.max(1, config.getIngestion().getWorkerCount());
        IngestionExecutor executor = new IngestionExecutor();
        executor.setCorePoolSize(workers);
        executor.setMaxPoolSize(workers);
        executor.setQueueCapacity(Integer.MAX_VALUE); // unlimited queue
        executor.setThreadNamePrefix("ingest-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.initialize();
        return executor;
    }

    /**
     * Pool for per-item rerank and judgment tasks. The model-call guard bounds how many of them
     * actually talk to a model at once.
     */
    @Bean
    public FanOutExecutor fanOutExecutor(final ApplicationConfig config) {
        final int threads = Math.max(1, config.getModelCall().getConcurrencyLimit()) * 2;
        FanOutExecutor executor = new FanOutExecutor();
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setQueueCapacity(Integer.MAX_VALUE);
        executor.setThreadNamePrefix("fan-out-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }

    @Bean(destroyMethod = "close")
    public ModelCallGuard modelCallGuard(final ApplicationConfig config) {
        final ApplicationConfig.ModelCall call = config.getModelCall();
        return new ModelCallGuard(call.getTimeoutMs(), call.getMaxAttempts(), call.getInitialBackoffMs(),
                call.getMaxBackoffMs(), call.getConcurrencyLimit());
    }
}
