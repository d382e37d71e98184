package com.quantbacktest.symphony.domain;

import com.quantbacktest.symphony.strategy.parse.ProgramDialect;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.LastModifiedDate;
import org.springframework.data.jpa.domain.support.AuditingEntityListener;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Entity representing a submitted symphony backtest.
 * Holds the program source as submitted, the simulation settings and the job lifecycle state.
 */
@Entity
@Table(name = "backtest_jobs", uniqueConstraints = {
                @UniqueConstraint(name = "uk_idempotency_key", columnNames = "idempotency_key")
}, indexes = {
                @Index(name = "idx_status", columnList = "status"),
                @Index(name = "idx_created_at", columnList = "created_at"),
                @Index(name = "idx_strategy_name", columnList = "strategy_name")
})
@EntityListeners(AuditingEntityListener.class)
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BacktestJob {

        @Id
        @GeneratedValue(strategy = GenerationType.IDENTITY)
        private Long id;

        @Version
        @Column(name = "version")
        private Long version;

        @Column(name = "strategy_name", nullable = false, length = 255)
        private String strategyName;

        @Enumerated(EnumType.STRING)
        @Column(name = "dialect", nullable = false, length = 20)
        private ProgramDialect dialect;

        /** Program document; for the Lisp dialect this is a JSON string holding the source text. */
        @Column(name = "program_json", nullable = false, columnDefinition = "TEXT")
        private String programJson;

        @Column(name = "start_date", nullable = false)
        private LocalDate startDate;

        @Column(name = "end_date", nullable = false)
        private LocalDate endDate;

        @Column(name = "settings_json", columnDefinition = "TEXT")
        private String settingsJson;

        @Column(name = "ground_truth_csv", columnDefinition = "TEXT")
        private String groundTruthCsv;

        @Enumerated(EnumType.STRING)
        @Column(name = "status", nullable = false, length = 20)
        private JobStatus status;

        @Column(name = "idempotency_key", nullable = false, unique = true, length = 255)
        private String idempotencyKey;

        @Column(name = "retry_count", nullable = false)
        @Builder.Default
        private Integer retryCount = 0;

        @Column(name = "failure_reason", columnDefinition = "TEXT")
        private String failureReason;

        @CreatedDate
        @Column(name = "created_at", nullable = false, updatable = false)
        private LocalDateTime createdAt;

        @LastModifiedDate
        @Column(name = "updated_at", nullable = false)
        private LocalDateTime updatedAt;
}
