package com.quantbacktest.symphony.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Thread pool hosting the background queue workers.
 */
@Configuration
public class AsyncConfig {

    @Value("${backtest.worker.thread-count:3}")
    private int workerThreadCount;

    @Bean(name = "workerExecutorService")
    public ExecutorService workerExecutorService() {
        return Executors.newFixedThreadPool(Math.max(1, workerThreadCount),
                r -> {
                    Thread thread = new Thread(r);
                    thread.setName("SymphonyWorker-" + thread.getId());
                    thread.setDaemon(false);
                    return thread;
                });
    }
}
