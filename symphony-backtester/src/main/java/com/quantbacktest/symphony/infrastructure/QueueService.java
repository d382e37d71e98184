package com.quantbacktest.symphony.infrastructure;

/**
 * Service interface for job queue operations.
 */
public interface QueueService {

    /**
     * Push a job ID to the queue.
     *
     * @param jobId the job ID to enqueue
     */
    void push(Long jobId);

    /**
     * Pop a job ID from the queue, waiting briefly when it is empty.
     *
     * @return the job ID, or null if nothing usable arrived
     */
    Long pop();

    /**
     * Number of job IDs waiting in the queue.
     */
    long size();
}
