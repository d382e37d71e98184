package com.quantbacktest.symphony.infrastructure;

import com.quantbacktest.symphony.domain.BacktestJob;
import com.quantbacktest.symphony.repository.BacktestJobRepository;
import com.quantbacktest.symphony.service.BacktestExecutor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Polls the job queue and hands each job to the {@link BacktestExecutor}.
 * Requeued jobs wait out the {@link RetryBackoff} delay for their failure count first.
 * Status checks happen in the executor under a row lock, not here.
 */
@RequiredArgsConstructor
@Slf4j
public class BacktestWorker implements Runnable {

    private static final long POLL_ERROR_PAUSE_MS = 1000;

    private final QueueService queueService;
    private final BacktestJobRepository backtestJobRepository;
    private final BacktestExecutor backtestExecutor;
    private final RetryBackoff retryBackoff;
    private final String workerName;

    private final AtomicInteger handledJobs = new AtomicInteger();
    private volatile boolean running = true;

    @Override
    public void run() {
        log.info("{} started and polling queue", workerName);

        try {
            while (running) {
                try {
                    Long jobId = queueService.pop();
                    if (jobId != null) {
                        process(jobId);
                    }
                } catch (InterruptedException e) {
                    throw e;
                } catch (Exception e) {
                    log.error("{} failed to poll queue: {}", workerName, e.getMessage(), e);
                    retryBackoff.pause(POLL_ERROR_PAUSE_MS);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("{} interrupted", workerName);
        }

        log.info("{} stopped after {} jobs", workerName, handledJobs.get());
    }

    /**
     * Run one job. An interrupt during the backoff puts the job back on the queue.
     */
    void process(Long jobId) throws InterruptedException {
        MDC.put("jobId", String.valueOf(jobId));
        MDC.put("worker", workerName);

        try {
            Optional<BacktestJob> jobOptional = backtestJobRepository.findById(jobId);
            if (jobOptional.isEmpty()) {
                log.warn("Job not found in database");
                return;
            }
            BacktestJob job = jobOptional.get();

            try {
                retryBackoff.await(job.getRetryCount());
            } catch (InterruptedException e) {
                log.warn("Interrupted during backoff, returning job to the queue");
                queueService.push(jobId);
                throw e;
            }

            log.info("Running '{}' ({}) {} to {}, attempt {}",
                    job.getStrategyName(), job.getDialect(), job.getStartDate(), job.getEndDate(),
                    job.getRetryCount() + 1);
            backtestExecutor.executeBacktest(job);
            handledJobs.incrementAndGet();
        } catch (RuntimeException e) {
            log.error("Failed to process job: {}", e.getMessage(), e);
        } finally {
            MDC.remove("jobId");
            MDC.remove("worker");
        }
    }

    public String getWorkerName() {
        return workerName;
    }

    public int getHandledJobs() {
        return handledJobs.get();
    }

    public void stop() {
        log.info("Stopping {}", workerName);
        running = false;
    }
}
