package com.quantbacktest.symphony.engine;

import com.quantbacktest.symphony.strategy.AssetNode;
import com.quantbacktest.symphony.strategy.ComparisonOperator;
import com.quantbacktest.symphony.strategy.Condition;
import com.quantbacktest.symphony.strategy.CurrentPrice;
import com.quantbacktest.symphony.strategy.FilterNode;
import com.quantbacktest.symphony.strategy.GroupNode;
import com.quantbacktest.symphony.strategy.IfNode;
import com.quantbacktest.symphony.strategy.IndicatorRef;
import com.quantbacktest.symphony.strategy.IndicatorValue;
import com.quantbacktest.symphony.strategy.LiteralValue;
import com.quantbacktest.symphony.strategy.SelectionMode;
import com.quantbacktest.symphony.strategy.StrategyNode;
import com.quantbacktest.symphony.strategy.Symphony;
import com.quantbacktest.symphony.strategy.WeightEqualNode;
import com.quantbacktest.symphony.strategy.WeightSpecifiedNode;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.OptionalInt;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for StaticAnalyzer requirement collection.
 */
class StaticAnalyzerTest {

    private final StaticAnalyzer analyzer = new StaticAnalyzer();

    @Test
    void testAnalyze_CollectsTickersFromEveryBranch() {
        // Arrange
        StrategyNode program = new IfNode(
                new Condition(ComparisonOperator.GREATER_THAN,
                        new CurrentPrice("SPY"), IndicatorValue.movingAveragePrice("SPY", 200)),
                new WeightEqualNode(List.of(AssetNode.of("TQQQ"), AssetNode.of("UPRO"))),
                new WeightSpecifiedNode(List.of(
                        new WeightSpecifiedNode.WeightedBranch(0.5, AssetNode.of("BIL")),
                        new WeightSpecifiedNode.WeightedBranch(0.5, AssetNode.of("TLT")))));

        // Act
        StrategyRequirements requirements = analyzer.analyze(program);

        // Assert
        assertEquals(Set.of("SPY", "TQQQ", "UPRO", "BIL", "TLT"), requirements.getTickers());
        assertEquals(Set.of(IndicatorRef.movingAverage(200)), requirements.getIndicators());
        assertEquals(Set.of("SPY"), requirements.symbolsFor(IndicatorRef.movingAverage(200)));
    }

    @Test
    void testAnalyze_GroupLabelSplitOnPlus() {
        // Arrange
        StrategyNode program = new GroupNode("SOXL + TECL+ ", AssetNode.of("BIL"));

        // Act
        StrategyRequirements requirements = analyzer.analyze(program);

        // Assert
        assertEquals(Set.of("SOXL", "TECL", "BIL"), requirements.getTickers());
    }

    @Test
    void testAnalyze_FilterCandidatesNeedIndicator() {
        // Arrange
        StrategyNode program = new FilterNode(IndicatorRef.rsi(10), SelectionMode.BOTTOM, 1, List.of(
                AssetNode.of("SOXL"),
                new GroupNode("tech", new WeightEqualNode(List.of(AssetNode.of("TECL"), AssetNode.of("FNGU"))))));

        // Act
        StrategyRequirements requirements = analyzer.analyze(program);

        // Assert
        assertEquals(Set.of("SOXL", "TECL", "FNGU"), requirements.symbolsFor(IndicatorRef.rsi(10)));
        assertTrue(requirements.getTickers().containsAll(Set.of("SOXL", "TECL", "FNGU", "tech")));
    }

    @Test
    void testAnalyze_DistinctWindowsAreDistinctRequirements() {
        // Arrange
        StrategyNode program = new IfNode(
                new Condition(ComparisonOperator.LESS_THAN, IndicatorValue.rsi("QQQ", 10), IndicatorValue.rsi("QQQ", 20)),
                AssetNode.of("QQQ"),
                new IfNode(
                        new Condition(ComparisonOperator.GREATER_THAN, IndicatorValue.rsi("SPY", 10), new LiteralValue(80)),
                        AssetNode.of("UVXY"),
                        AssetNode.of("SPY")));

        // Act
        StrategyRequirements requirements = analyzer.analyze(program);

        // Assert
        assertEquals(Set.of(IndicatorRef.rsi(10), IndicatorRef.rsi(20)), requirements.getIndicators());
        assertEquals(Set.of("QQQ", "SPY"), requirements.symbolsFor(IndicatorRef.rsi(10)));
        assertEquals(Set.of("QQQ"), requirements.symbolsFor(IndicatorRef.rsi(20)));
        assertEquals(OptionalInt.of(20), requirements.maxWindow());
    }

    @Test
    void testAnalyze_NoIndicators_EmptyMaxWindow() {
        // Act
        StrategyRequirements requirements = analyzer.analyze(new Symphony("Static", "", AssetNode.of("SPY")));

        // Assert
        assertEquals(Set.of("SPY"), requirements.getTickers());
        assertTrue(requirements.getIndicators().isEmpty());
        assertTrue(requirements.maxWindow().isEmpty());
    }

    @Test
    void testAnalyze_Deterministic() {
        // Arrange
        StrategyNode program = new WeightEqualNode(List.of(
                AssetNode.of("B"), AssetNode.of("A"), new GroupNode("C+D", AssetNode.of("A"))));

        // Act
        StrategyRequirements first = analyzer.analyze(program);
        StrategyRequirements second = analyzer.analyze(program);

        // Assert
        assertEquals(first, second);
        assertEquals(List.of("A", "B", "C", "D"), List.copyOf(first.getTickers()));
    }
}
