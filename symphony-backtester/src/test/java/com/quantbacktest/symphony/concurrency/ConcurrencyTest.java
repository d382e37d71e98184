package com.quantbacktest.symphony.concurrency;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.quantbacktest.symphony.controller.dto.BacktestJobResponse;
import com.quantbacktest.symphony.controller.dto.BacktestSubmissionRequest;
import com.quantbacktest.symphony.domain.BacktestEngine;
import com.quantbacktest.symphony.domain.BacktestJob;
import com.quantbacktest.symphony.domain.JobStatus;
import com.quantbacktest.symphony.engine.StaticAnalyzer;
import com.quantbacktest.symphony.engine.StrategyEvaluator;
import com.quantbacktest.symphony.engine.TargetAllocation;
import com.quantbacktest.symphony.infrastructure.QueueService;
import com.quantbacktest.symphony.marketdata.IndicatorCalculator;
import com.quantbacktest.symphony.marketdata.InMemoryMarketDataAccessor;
import com.quantbacktest.symphony.repository.BacktestJobRepository;
import com.quantbacktest.symphony.repository.BacktestResultRepository;
import com.quantbacktest.symphony.service.BacktestMetricsService;
import com.quantbacktest.symphony.service.BacktestServiceImpl;
import com.quantbacktest.symphony.service.MarketDataLoader;
import com.quantbacktest.symphony.service.StrategyService;
import com.quantbacktest.symphony.simulation.SimulationSettings;
import com.quantbacktest.symphony.strategy.IndicatorRef;
import com.quantbacktest.symphony.strategy.Symphony;
import com.quantbacktest.symphony.strategy.parse.LispSymphonyReader;
import com.quantbacktest.symphony.strategy.parse.ProgramDialect;
import com.quantbacktest.symphony.strategy.parse.QuantmageNormalizer;
import com.quantbacktest.symphony.strategy.parse.SymphonyParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Concurrency tests: shared market data and evaluators used from many threads, and
 * simultaneous job submissions.
 */
@ExtendWith(MockitoExtension.class)
class ConcurrencyTest {

    private static final String PROGRAM = "[\"Momentum pick\", \"\", [\"filter\", [\"rsi\", {\":window\": 5}],"
            + " [\"select-top\", 2], [[\"asset\", \"AAA\"], [\"asset\", \"BBB\"], [\"asset\", \"CCC\"]]]]";
    private static final LocalDate START = LocalDate.of(2023, 1, 2);
    private static final int DAYS = 120;

    @Mock
    private BacktestJobRepository backtestJobRepository;

    @Mock
    private BacktestResultRepository backtestResultRepository;

    @Mock
    private QueueService queueService;

    @Mock
    private MarketDataLoader marketDataLoader;

    @Mock
    private BacktestMetricsService metricsService;

    private ObjectMapper objectMapper;
    private StrategyService strategyService;
    private BacktestServiceImpl backtestService;
    private InMemoryMarketDataAccessor marketData;
    private List<LocalDate> days;

    @BeforeEach
    void setUp() {
        objectMapper = new ObjectMapper();
        objectMapper.findAndRegisterModules(); // Register JavaTimeModule for LocalDate support
        strategyService = new StrategyService(
                new SymphonyParser(objectMapper),
                new LispSymphonyReader(),
                new QuantmageNormalizer(),
                new StaticAnalyzer(),
                new StrategyEvaluator(),
                marketDataLoader);
        backtestService = new BacktestServiceImpl(
                backtestJobRepository,
                backtestResultRepository,
                queueService,
                strategyService,
                SimulationSettings.builder().build(),
                metricsService,
                objectMapper);

        days = new ArrayList<>();
        marketData = new InMemoryMarketDataAccessor();
        IndicatorRef rsi = IndicatorRef.rsi(5);
        String[] symbols = { "AAA", "BBB", "CCC" };
        for (int s = 0; s < symbols.length; s++) {
            TreeMap<LocalDate, Double> closes = new TreeMap<>();
            for (int i = 0; i < DAYS; i++) {
                // distinct oscillating paths so the ranking changes over time
                closes.put(START.plusDays(i), 100.0 + 10 * Math.sin(i / (3.0 + s)) + i * 0.05 * s);
            }
            marketData.putCloses(symbols[s], closes);
            marketData.putIndicator(symbols[s], rsi, IndicatorCalculator.compute(rsi, closes));
        }
        for (int i = 10; i < DAYS; i++) {
            days.add(START.plusDays(i));
        }
    }

    @Test
    void testParallelEvaluation_MatchesSequential() throws Exception {
        // Arrange
        Symphony symphony = strategyService.parse(ProgramDialect.COMPOSER_JSON, objectMapper.readTree(PROGRAM));
        StrategyEvaluator evaluator = new StrategyEvaluator();
        Map<LocalDate, TargetAllocation> sequential = new LinkedHashMap<>();
        for (LocalDate date : days) {
            sequential.put(date, evaluator.evaluate(symphony.getRoot(), date, marketData));
        }

        // Act - evaluate every date concurrently against the shared accessor
        ExecutorService executor = Executors.newFixedThreadPool(8);
        Map<LocalDate, Future<TargetAllocation>> futures = new LinkedHashMap<>();
        for (LocalDate date : days) {
            futures.put(date, executor.submit(() -> evaluator.evaluate(symphony.getRoot(), date, marketData)));
        }
        Map<LocalDate, TargetAllocation> parallel = new LinkedHashMap<>();
        for (Map.Entry<LocalDate, Future<TargetAllocation>> entry : futures.entrySet()) {
            parallel.put(entry.getKey(), entry.getValue().get(10, TimeUnit.SECONDS));
        }
        executor.shutdown();

        // Assert
        assertEquals(sequential, parallel, "Evaluation must not depend on thread interleaving");
        assertTrue(parallel.values().stream().allMatch(allocation -> allocation.getWeights().size() == 2));
    }

    @Test
    void testConcurrentBacktests_SharedMarketData_IdenticalReports() throws Exception {
        // Arrange
        Symphony symphony = strategyService.parse(ProgramDialect.COMPOSER_JSON, objectMapper.readTree(PROGRAM));
        BacktestEngine engine = new BacktestEngine();
        BacktestEngine.BacktestConfig config = BacktestEngine.BacktestConfig.builder()
                .symphony(symphony)
                .marketData(marketData)
                .tradingDays(days)
                .settings(SimulationSettings.builder().transactionCostPct(0.001).slippagePct(0.0005).build())
                .build();

        int numThreads = 6;
        ExecutorService executor = Executors.newFixedThreadPool(numThreads);
        CountDownLatch startLatch = new CountDownLatch(1);
        List<Future<BacktestEngine.BacktestReport>> futures = new ArrayList<>();

        // Act
        for (int i = 0; i < numThreads; i++) {
            futures.add(executor.submit(() -> {
                startLatch.await();
                return engine.runBacktest(config);
            }));
        }
        startLatch.countDown();

        List<BacktestEngine.BacktestReport> reports = new ArrayList<>();
        for (Future<BacktestEngine.BacktestReport> future : futures) {
            reports.add(future.get(30, TimeUnit.SECONDS));
        }
        executor.shutdown();

        // Assert
        BacktestEngine.BacktestReport first = reports.get(0);
        for (BacktestEngine.BacktestReport report : reports) {
            assertEquals(first.getSummary(), report.getSummary());
            assertEquals(first.getOrders(), report.getOrders());
        }
    }

    @Test
    void testConcurrentSubmissions_DifferentJobs() throws Exception {
        // Arrange
        int numThreads = 10;
        ExecutorService executor = Executors.newFixedThreadPool(numThreads);
        AtomicLong jobIdCounter = new AtomicLong(1);
        when(backtestJobRepository.findByIdempotencyKey(any())).thenReturn(Optional.empty());
        when(backtestJobRepository.save(any())).thenAnswer(invocation -> {
            BacktestJob job = invocation.getArgument(0);
            if (job.getId() == null) {
                job.setId(jobIdCounter.getAndIncrement());
            }
            return job;
        });

        // Act - Submit different jobs concurrently
        List<Future<BacktestJobResponse>> futures = new ArrayList<>();
        for (int i = 0; i < numThreads; i++) {
            BacktestSubmissionRequest request = createRequest(new BigDecimal(10_000 + i));
            futures.add(executor.submit(() -> backtestService.submitBacktest(request)));
        }

        Set<Long> jobIds = ConcurrentHashMap.newKeySet();
        for (Future<BacktestJobResponse> future : futures) {
            jobIds.add(future.get(10, TimeUnit.SECONDS).getJobId());
        }
        executor.shutdown();

        // Assert
        assertEquals(numThreads, jobIds.size(), "Each submission should get its own job");
        verify(queueService, times(numThreads)).push(any());
        verify(metricsService, times(numThreads)).recordJobSubmitted();
    }

    @Test
    void testConcurrentSubmissions_SameRequest_SameIdempotencyKey() throws Exception {
        // Arrange
        int numThreads = 8;
        ExecutorService executor = Executors.newFixedThreadPool(numThreads);
        Set<String> keys = ConcurrentHashMap.newKeySet();
        BacktestJob existing = BacktestJob.builder()
                .id(1L)
                .status(JobStatus.QUEUED)
                .build();
        when(backtestJobRepository.findByIdempotencyKey(any())).thenAnswer(invocation -> {
            keys.add(invocation.getArgument(0));
            return Optional.of(existing);
        });

        // Act
        List<Future<BacktestJobResponse>> futures = new ArrayList<>();
        for (int i = 0; i < numThreads; i++) {
            BacktestSubmissionRequest request = createRequest(new BigDecimal("10000"));
            futures.add(executor.submit(() -> backtestService.submitBacktest(request)));
        }
        for (Future<BacktestJobResponse> future : futures) {
            BacktestJobResponse response = future.get(10, TimeUnit.SECONDS);
            assertTrue(response.getIsExisting());
            assertEquals(1L, response.getJobId());
        }
        executor.shutdown();

        // Assert
        assertEquals(1, keys.size(), "Identical payloads must hash to one key");
        verify(queueService, never()).push(any());
    }

    private BacktestSubmissionRequest createRequest(BigDecimal initialCapital) throws Exception {
        return BacktestSubmissionRequest.builder()
                .dialect(ProgramDialect.COMPOSER_JSON)
                .program(objectMapper.readTree(PROGRAM))
                .startDate(LocalDate.of(2023, 1, 12))
                .endDate(LocalDate.of(2023, 4, 30))
                .initialCapital(initialCapital)
                .build();
    }
}
