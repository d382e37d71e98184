package com.quantbacktest.symphony.infrastructure;

import com.quantbacktest.symphony.domain.BacktestJob;
import com.quantbacktest.symphony.domain.JobStatus;
import com.quantbacktest.symphony.repository.BacktestJobRepository;
import com.quantbacktest.symphony.service.BacktestExecutor;
import com.quantbacktest.symphony.strategy.parse.ProgramDialect;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit tests for BacktestWorker lifecycle and job processing.
 */
@ExtendWith(MockitoExtension.class)
class BacktestWorkerTest {

    @Mock
    private QueueService queueService;

    @Mock
    private BacktestJobRepository backtestJobRepository;

    @Mock
    private BacktestExecutor backtestExecutor;

    private final List<Long> sleeps = new ArrayList<>();
    private BacktestWorker worker;

    @BeforeEach
    void setUp() {
        RetryBackoff backoff = new RetryBackoff(new long[] { 1000, 3000, 5000 }, sleeps::add);
        worker = new BacktestWorker(queueService, backtestJobRepository, backtestExecutor, backoff, "TestWorker");
    }

    @Test
    void testProcess_FirstAttempt_RunsWithoutBackoff() throws Exception {
        // Arrange
        BacktestJob job = createJob(1L, JobStatus.QUEUED, 0);
        when(backtestJobRepository.findById(1L)).thenReturn(Optional.of(job));

        // Act
        worker.process(1L);

        // Assert
        verify(backtestExecutor).executeBacktest(job);
        assertTrue(sleeps.isEmpty());
        assertEquals(1, worker.getHandledJobs());
    }

    @Test
    void testProcess_RetriedJob_WaitsForItsFailureCount() throws Exception {
        // Arrange
        when(backtestJobRepository.findById(1L)).thenReturn(Optional.of(createJob(1L, JobStatus.QUEUED, 1)));
        when(backtestJobRepository.findById(2L)).thenReturn(Optional.of(createJob(2L, JobStatus.QUEUED, 2)));

        // Act
        worker.process(1L);
        worker.process(2L);

        // Assert
        assertEquals(List.of(1000L, 3000L), sleeps);
        verify(backtestExecutor, times(2)).executeBacktest(any());
    }

    @Test
    void testProcess_CompletedJob_StillHandedToExecutor() throws Exception {
        // Arrange
        BacktestJob job = createJob(1L, JobStatus.COMPLETED, 0);
        when(backtestJobRepository.findById(1L)).thenReturn(Optional.of(job));

        // Act
        worker.process(1L);

        // Assert
        verify(backtestExecutor).executeBacktest(job);
    }

    @Test
    void testProcess_JobNotFound() throws Exception {
        // Arrange
        when(backtestJobRepository.findById(999L)).thenReturn(Optional.empty());

        // Act
        worker.process(999L);

        // Assert
        verify(backtestExecutor, never()).executeBacktest(any());
        assertEquals(0, worker.getHandledJobs());
    }

    @Test
    void testProcess_ExecutorThrows_WorkerSurvives() throws Exception {
        // Arrange
        BacktestJob job = createJob(1L, JobStatus.QUEUED, 0);
        when(backtestJobRepository.findById(1L)).thenReturn(Optional.of(job));
        doThrow(new IllegalStateException("Database connection lost")).when(backtestExecutor).executeBacktest(any());

        // Act & Assert
        assertDoesNotThrow(() -> worker.process(1L));
        assertEquals(0, worker.getHandledJobs());
    }

    @Test
    void testProcess_InterruptedDuringBackoff_RequeuesJob() {
        // Arrange
        RetryBackoff interrupting = new RetryBackoff(new long[] { 1000 }, millis -> {
            throw new InterruptedException();
        });
        worker = new BacktestWorker(queueService, backtestJobRepository, backtestExecutor, interrupting, "TestWorker");
        when(backtestJobRepository.findById(4L)).thenReturn(Optional.of(createJob(4L, JobStatus.QUEUED, 1)));

        // Act & Assert
        assertThrows(InterruptedException.class, () -> worker.process(4L));
        verify(queueService).push(4L);
        verify(backtestExecutor, never()).executeBacktest(any());
    }

    @Test
    void testRun_ProcessesJobsInSequenceUntilStopped() {
        // Arrange
        BacktestJob job1 = createJob(1L, JobStatus.QUEUED, 0);
        BacktestJob job2 = createJob(2L, JobStatus.QUEUED, 0);
        when(queueService.pop())
                .thenReturn(1L)
                .thenReturn(2L)
                .thenAnswer(invocation -> {
                    worker.stop();
                    return null;
                });
        when(backtestJobRepository.findById(1L)).thenReturn(Optional.of(job1));
        when(backtestJobRepository.findById(2L)).thenReturn(Optional.of(job2));

        // Act
        worker.run();

        // Assert
        verify(backtestExecutor).executeBacktest(job1);
        verify(backtestExecutor).executeBacktest(job2);
        assertEquals(2, worker.getHandledJobs());
    }

    @Test
    void testRun_QueueError_PausesAndKeepsPolling() {
        // Arrange
        when(queueService.pop())
                .thenThrow(new IllegalStateException("Failed to dequeue job"))
                .thenAnswer(invocation -> {
                    worker.stop();
                    return null;
                });

        // Act
        worker.run();

        // Assert
        verify(queueService, times(2)).pop();
        assertEquals(List.of(1000L), sleeps);
    }

    @Test
    void testRun_InterruptedDuringBackoff_StopsAndKeepsInterruptFlag() {
        // Arrange
        RetryBackoff interrupting = new RetryBackoff(new long[] { 1000 }, millis -> {
            throw new InterruptedException();
        });
        worker = new BacktestWorker(queueService, backtestJobRepository, backtestExecutor, interrupting, "TestWorker");
        when(queueService.pop()).thenReturn(6L);
        when(backtestJobRepository.findById(6L)).thenReturn(Optional.of(createJob(6L, JobStatus.QUEUED, 2)));

        // Act
        worker.run();

        // Assert
        assertTrue(Thread.interrupted(), "Interrupt flag should be restored");
        verify(queueService).pop();
        verify(queueService).push(6L);
    }

    @Test
    void testWorkerStop_GracefulShutdown() throws Exception {
        // Arrange
        when(queueService.pop()).thenAnswer(invocation -> {
            Thread.sleep(20);
            return null;
        });

        // Act
        Thread workerThread = new Thread(worker);
        workerThread.start();
        Thread.sleep(100);
        worker.stop();
        workerThread.join(1000);

        // Assert
        assertFalse(workerThread.isAlive());
        verify(queueService, atLeastOnce()).pop();
    }

    private BacktestJob createJob(Long id, JobStatus status, int retryCount) {
        return BacktestJob.builder()
                .id(id)
                .strategyName("Hold SPY")
                .dialect(ProgramDialect.COMPOSER_JSON)
                .programJson("[\"Hold SPY\", \"\", [\"asset\", \"SPY\"]]")
                .startDate(LocalDate.of(2024, 1, 1))
                .endDate(LocalDate.of(2024, 12, 31))
                .settingsJson("{}")
                .status(status)
                .retryCount(retryCount)
                .build();
    }
}
