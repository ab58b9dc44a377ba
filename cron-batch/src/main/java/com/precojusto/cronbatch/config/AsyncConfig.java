package com.precojusto.cronbatch.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread pool backing the fan-out variant of the executor.
 */
@Configuration
public class AsyncConfig {

    @Value("${batch.worker.max-parallelism:10}")
    private int maxParallelism;

    @Bean(name = "batchWorkerExecutorService")
    public ExecutorService batchWorkerExecutorService() {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(maxParallelism,
                r -> {
                    Thread thread = new Thread(r);
                    thread.setName("BatchWorker-" + counter.incrementAndGet());
                    thread.setDaemon(false);
                    return thread;
                });
    }
}
