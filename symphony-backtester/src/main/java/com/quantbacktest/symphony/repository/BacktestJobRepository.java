package com.quantbacktest.symphony.repository;

import com.quantbacktest.symphony.domain.BacktestJob;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Repository interface for BacktestJob entity.
 * Provides data access operations for backtest jobs.
 */
@Repository
public interface BacktestJobRepository extends JpaRepository<BacktestJob, Long> {

    /**
     * Find a job by its idempotency key.
     *
     * @param idempotencyKey the unique idempotency key
     * @return Optional containing the job if found
     */
    Optional<BacktestJob> findByIdempotencyKey(String idempotencyKey);

    /**
     * Find and lock a job by ID for update (pessimistic write lock).
     * Prevents race conditions during status transitions.
     *
     * @param id the job ID
     * @return Optional containing the locked job if found
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT j FROM BacktestJob j WHERE j.id = :id")
    Optional<BacktestJob> findByIdForUpdate(@Param("id") Long id);
}
