package com.quantbacktest.symphony.infrastructure;

import com.quantbacktest.symphony.repository.BacktestJobRepository;
import com.quantbacktest.symphony.service.BacktestExecutor;
import com.quantbacktest.symphony.service.BacktestMetricsService;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Starts the queue workers with the application and stops them on shutdown.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WorkerManager {

    private final ExecutorService workerExecutorService;
    private final QueueService queueService;
    private final BacktestJobRepository backtestJobRepository;
    private final BacktestExecutor backtestExecutor;
    private final RetryBackoff retryBackoff;
    private final BacktestMetricsService metricsService;

    @Value("${backtest.worker.thread-count:3}")
    private int workerThreadCount;

    @Value("${backtest.worker.enabled:true}")
    private boolean workersEnabled;

    @Value("${backtest.worker.shutdown-timeout-seconds:60}")
    private long shutdownTimeoutSeconds;

    private final List<BacktestWorker> workers = new ArrayList<>();

    @PostConstruct
    public void startWorkers() {
        if (!workersEnabled) {
            log.info("Background workers are disabled");
            return;
        }

        try {
            log.info("Starting {} backtest workers, {} jobs waiting", workerThreadCount, queueService.size());
        } catch (IllegalStateException e) {
            log.warn("Starting {} backtest workers, queue depth unavailable: {}", workerThreadCount, e.getMessage());
        }

        for (int i = 0; i < workerThreadCount; i++) {
            BacktestWorker worker = new BacktestWorker(
                    queueService,
                    backtestJobRepository,
                    backtestExecutor,
                    retryBackoff,
                    "SymphonyWorker-" + (i + 1));

            workers.add(worker);
            workerExecutorService.submit(worker);
        }
    }

    @PreDestroy
    public void stopWorkers() {
        log.info("Stopping {} workers...", workers.size());

        workers.forEach(BacktestWorker::stop);

        workerExecutorService.shutdown();

        try {
            if (!workerExecutorService.awaitTermination(shutdownTimeoutSeconds, TimeUnit.SECONDS)) {
                log.warn("Workers did not stop within {}s, forcing shutdown", shutdownTimeoutSeconds);
                workerExecutorService.shutdownNow();
            } else {
                log.info("All workers stopped gracefully");
            }
        } catch (InterruptedException e) {
            log.error("Interrupted while waiting for workers to stop", e);
            workerExecutorService.shutdownNow();
            Thread.currentThread().interrupt();
        }

        workers.forEach(worker -> log.info("{} handled {} jobs", worker.getWorkerName(), worker.getHandledJobs()));
        log.info(metricsService.getMetricsSummary());
    }

    List<BacktestWorker> getWorkers() {
        return workers;
    }
}
