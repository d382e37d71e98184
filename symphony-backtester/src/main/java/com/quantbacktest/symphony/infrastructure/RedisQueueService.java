package com.quantbacktest.symphony.infrastructure;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;

import java.util.concurrent.TimeUnit;

/**
 * FIFO job queue on a Redis list: RPUSH to enqueue, blocking LPOP to dequeue.
 * Entries that are not job IDs are dropped on pop.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RedisQueueService implements QueueService {

    private final RedisTemplate<String, Object> redisTemplate;

    @Value("${backtest.queue.name:symphony-backtest-jobs}")
    private String queueName;

    @Value("${backtest.queue.pop-timeout-seconds:1}")
    private long popTimeoutSeconds;

    @Override
    public void push(Long jobId) {
        if (jobId == null) {
            throw new IllegalArgumentException("Job ID cannot be null");
        }

        try {
            Long depth = redisTemplate.opsForList().rightPush(queueName, jobId);
            log.info("Queued job {} on {} (depth {})", jobId, queueName, depth);
        } catch (DataAccessException e) {
            log.error("Redis error while pushing job {} to {}: {}", jobId, queueName, e.getMessage(), e);
            throw new IllegalStateException("Failed to enqueue job " + jobId, e);
        }
    }

    @Override
    public Long pop() {
        Object value;
        try {
            // atomic, so competing workers never receive the same id
            value = redisTemplate.opsForList().leftPop(queueName, popTimeoutSeconds, TimeUnit.SECONDS);
        } catch (DataAccessException e) {
            log.error("Redis error while popping from {}: {}", queueName, e.getMessage(), e);
            throw new IllegalStateException("Failed to dequeue job", e);
        }

        if (value == null) {
            return null;
        }
        Long jobId = toJobId(value);
        if (jobId == null) {
            log.warn("Discarding malformed entry from {}: {}", queueName, value);
            return null;
        }
        log.debug("Popped job {} from {}", jobId, queueName);
        return jobId;
    }

    @Override
    public long size() {
        try {
            Long size = redisTemplate.opsForList().size(queueName);
            return size == null ? 0 : size;
        } catch (DataAccessException e) {
            throw new IllegalStateException("Failed to read size of " + queueName, e);
        }
    }

    /**
     * The JSON serializer hands small ids back as Integer; ids pushed by hand arrive as strings.
     */
    private static Long toJobId(Object value) {
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        if (value instanceof String) {
            try {
                return Long.parseLong(((String) value).trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }
}
