package net.gridcollate.config;

import java.util.concurrent.ThreadPoolExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Worker pool for CPU-bound feature extraction (decode, resize, hash, pixel statistics).
 * The coordinator renders and writes the ledger on its own thread; workers never write files.
 */
@Configuration
public class ExtractionExecutorConfig {

    private static final Logger log = LoggerFactory.getLogger(ExtractionExecutorConfig.class);
    private static final String THREAD_PREFIX = "FeatureExtract-";
    private static final int SHUTDOWN_TIMEOUT_SECONDS = 30;

    @Bean(name = "featureExtractionExecutor")
    public ThreadPoolTaskExecutor featureExtractionExecutor(CollateProperties properties) {
        int workers = properties.resolveWorkerThreads();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setThreadNamePrefix(THREAD_PREFIX);
        executor.setCorePoolSize(workers);
        executor.setMaxPoolSize(workers);
        executor.setQueueCapacity(properties.getWorkQueueCapacity());
        // A full queue pushes work back onto the coordinator instead of dropping it
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(SHUTDOWN_TIMEOUT_SECONDS);
        log.info("Feature extraction pool: {} worker(s), queue capacity {}.", workers, properties.getWorkQueueCapacity());
        return executor;
    }
}
