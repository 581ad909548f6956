package com.uctp.optimizer.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.uctp.optimizer.advisory.AdvisoryService;
import com.uctp.optimizer.advisory.GeminiAdvisoryService;
import com.uctp.optimizer.advisory.GuardedAdvisoryService;
import com.uctp.optimizer.advisory.NoOpAdvisoryService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
@EnableConfigurationProperties({OptimizerProperties.class, AdvisoryProperties.class})
public class OptimizerConfiguration {
    private static final Logger logger = LoggerFactory.getLogger(OptimizerConfiguration.class);

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService optimizerWorkerPool(OptimizerProperties properties) {
        return Executors.newFixedThreadPool(properties.effectiveWorkerThreads(), daemonThreads("optimizer-worker-"));
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService advisoryExecutor() {
        return Executors.newSingleThreadExecutor(daemonThreads("advisory-"));
    }

    @Bean
    public AdvisoryService advisoryService(AdvisoryProperties properties, ObjectMapper objectMapper,
                                           @Qualifier("advisoryExecutor") ExecutorService advisoryExecutor) {
        AdvisoryService delegate;
        if (properties.isConfigured()) {
            SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
            requestFactory.setConnectTimeout((int) properties.getConnectTimeout().toMillis());
            requestFactory.setReadTimeout((int) properties.getTimeout().toMillis());
            delegate = new GeminiAdvisoryService(RestClient.builder().requestFactory(requestFactory),
                    properties, objectMapper);
            logger.info("Advisory enabled with model {}", properties.getModel());
        } else {
            delegate = new NoOpAdvisoryService();
            logger.info("Advisory disabled, using default strategies");
        }
        return new GuardedAdvisoryService(delegate, advisoryExecutor, properties.getTimeout());
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
