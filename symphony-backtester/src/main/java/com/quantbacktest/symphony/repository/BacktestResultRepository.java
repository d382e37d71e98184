package com.quantbacktest.symphony.repository;

import com.quantbacktest.symphony.domain.BacktestResult;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Repository interface for BacktestResult entity.
 * Provides data access operations for backtest results.
 */
@Repository
public interface BacktestResultRepository extends JpaRepository<BacktestResult, Long> {

    /**
     * Find result by job ID.
     *
     * @param jobId the job ID
     * @return Optional containing the result if found
     */
    Optional<BacktestResult> findByJobId(Long jobId);
}
