package com.quantbacktest.symphony.controller;

import com.quantbacktest.symphony.controller.dto.AllocationResponse;
import com.quantbacktest.symphony.controller.dto.StrategyAnalysisRequest;
import com.quantbacktest.symphony.controller.dto.StrategyAnalysisResponse;
import com.quantbacktest.symphony.controller.dto.StrategyEvaluationRequest;
import com.quantbacktest.symphony.engine.StrategyRequirements;
import com.quantbacktest.symphony.engine.TargetAllocation;
import com.quantbacktest.symphony.service.StrategyService;
import com.quantbacktest.symphony.strategy.Symphony;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Inspect and evaluate programs without running a backtest.
 */
@RestController
@RequestMapping("/strategies")
@RequiredArgsConstructor
@Slf4j
public class StrategyController {

    private final StrategyService strategyService;

    /**
     * Tickers and indicators the program needs.
     */
    @PostMapping("/analyze")
    public ResponseEntity<StrategyAnalysisResponse> analyze(@Valid @RequestBody StrategyAnalysisRequest request) {
        log.info("POST /strategies/analyze - Dialect: {}", request.getDialect());

        Symphony symphony = strategyService.parse(request.getDialect(), request.getProgram());
        StrategyRequirements requirements = strategyService.analyze(symphony);

        List<StrategyAnalysisResponse.IndicatorRequirement> indicators = requirements.getIndicators().stream()
                .map(ref -> new StrategyAnalysisResponse.IndicatorRequirement(
                        ref.getKind().name(), ref.getWindow(), requirements.symbolsFor(ref)))
                .collect(Collectors.toList());

        return ResponseEntity.ok(StrategyAnalysisResponse.builder()
                .name(symphony.getName())
                .tickers(requirements.getTickers())
                .indicators(indicators)
                .build());
    }

    /**
     * Target allocation of the program on one date, using stored market data.
     */
    @PostMapping("/evaluate")
    public ResponseEntity<AllocationResponse> evaluate(@Valid @RequestBody StrategyEvaluationRequest request) {
        log.info("POST /strategies/evaluate - Dialect: {}, Date: {}", request.getDialect(), request.getDate());

        TargetAllocation allocation =
                strategyService.evaluate(request.getDialect(), request.getProgram(), request.getDate());

        return ResponseEntity.ok(AllocationResponse.builder()
                .date(request.getDate())
                .weights(allocation.getWeights())
                .cash(allocation.isCash())
                .build());
    }
}
