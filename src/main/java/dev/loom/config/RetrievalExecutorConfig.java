package dev.loom.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Thread pool for concurrent source searches.
 *
 * <p>Every query string fans out into up to four searches (vector and keyword, over the knowledge
 * base and the email corpus), all submitted here. A full queue rejects with {@link
 * org.springframework.core.task.TaskRejectedException} instead of running the search on the caller
 * thread; the retriever treats a rejected search as a failed source.
 */
@Configuration
public class RetrievalExecutorConfig {

    private static final Logger log = LoggerFactory.getLogger(RetrievalExecutorConfig.class);

    @Bean(name = "retrievalExecutor")
    public ThreadPoolTaskExecutor retrievalExecutor(
            @Value("${loom.retrieval.core-threads:4}") int coreThreads,
            @Value("${loom.retrieval.max-threads:16}") int maxThreads,
            @Value("${loom.retrieval.queue-capacity:200}") int queueCapacity) {
        int core = Math.max(1, coreThreads);
        int max = Math.max(core, maxThreads);
        int queue = Math.max(10, queueCapacity);

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(core);
        executor.setMaxPoolSize(max);
        executor.setQueueCapacity(queue);
        executor.setKeepAliveSeconds(30);
        executor.setAllowCoreThreadTimeOut(true);
        executor.setThreadNamePrefix("retrieval-");
        executor.setDaemon(true);
        executor.initialize();
        log.info("Retrieval pool initialized: core={}, max={}, queue={}", core, max, queue);
        return executor;
    }
}
