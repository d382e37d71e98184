package com.quantbacktest.symphony.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.quantbacktest.symphony.engine.EvaluationErrorKind;
import com.quantbacktest.symphony.engine.RunDiagnostics;
import com.quantbacktest.symphony.engine.StaticAnalyzer;
import com.quantbacktest.symphony.engine.StrategyEvaluator;
import com.quantbacktest.symphony.engine.StrategyRequirements;
import com.quantbacktest.symphony.engine.TargetAllocation;
import com.quantbacktest.symphony.strategy.Symphony;
import com.quantbacktest.symphony.strategy.parse.LispSymphonyReader;
import com.quantbacktest.symphony.strategy.parse.ProgramDialect;
import com.quantbacktest.symphony.strategy.parse.QuantmageNormalizer;
import com.quantbacktest.symphony.strategy.parse.StrategyParseException;
import com.quantbacktest.symphony.strategy.parse.SymphonyParser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;

/**
 * Entry point for turning submitted programs into strategy trees, and for one-off analysis and
 * evaluation outside a full backtest.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StrategyService {

    private final SymphonyParser symphonyParser;
    private final LispSymphonyReader lispSymphonyReader;
    private final QuantmageNormalizer quantmageNormalizer;
    private final StaticAnalyzer staticAnalyzer;
    private final StrategyEvaluator strategyEvaluator;
    private final MarketDataLoader marketDataLoader;

    /**
     * Parse a program in the given dialect.
     *
     * @throws StrategyParseException if the program is malformed or uses an unknown operator
     */
    public Symphony parse(ProgramDialect dialect, JsonNode program) {
        if (program == null || program.isNull()) {
            throw new StrategyParseException(EvaluationErrorKind.MALFORMED_EXPRESSION, "Program is required");
        }
        Symphony symphony = switch (dialect) {
            case COMPOSER_JSON -> program.isTextual()
                    ? symphonyParser.parse(program.asText())
                    : symphonyParser.parse(program);
            case COMPOSER_LISP -> {
                if (!program.isTextual()) {
                    throw new StrategyParseException(EvaluationErrorKind.MALFORMED_EXPRESSION,
                            "Lisp programs must be submitted as a string");
                }
                yield symphonyParser.parse(lispSymphonyReader.read(program.asText()));
            }
            case QUANTMAGE -> quantmageNormalizer.normalize(program);
        };
        log.debug("Parsed {} program '{}'", dialect, symphony.getName());
        return symphony;
    }

    public StrategyRequirements analyze(ProgramDialect dialect, JsonNode program) {
        return analyze(parse(dialect, program));
    }

    public StrategyRequirements analyze(Symphony symphony) {
        return staticAnalyzer.analyze(symphony);
    }

    /**
     * Target allocation of the program on {@code date} using stored market data.
     */
    public TargetAllocation evaluate(ProgramDialect dialect, JsonNode program, LocalDate date) {
        Symphony symphony = parse(dialect, program);
        StrategyRequirements requirements = staticAnalyzer.analyze(symphony);
        MarketDataLoader.LoadedMarketData data = marketDataLoader.load(requirements, date, date);
        TargetAllocation allocation = strategyEvaluator.evaluate(
                symphony.getRoot(), date, data.getAccessor(), new RunDiagnostics());
        log.info("Evaluated '{}' on {}: {}", symphony.getName(), date, allocation);
        return allocation;
    }
}
