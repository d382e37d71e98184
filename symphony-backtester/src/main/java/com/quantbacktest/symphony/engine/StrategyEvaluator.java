package com.quantbacktest.symphony.engine;

import com.quantbacktest.symphony.marketdata.MarketDataAccessor;
import com.quantbacktest.symphony.strategy.AssetNode;
import com.quantbacktest.symphony.strategy.Condition;
import com.quantbacktest.symphony.strategy.CurrentPrice;
import com.quantbacktest.symphony.strategy.FilterNode;
import com.quantbacktest.symphony.strategy.GroupNode;
import com.quantbacktest.symphony.strategy.IfNode;
import com.quantbacktest.symphony.strategy.IndicatorValue;
import com.quantbacktest.symphony.strategy.LiteralValue;
import com.quantbacktest.symphony.strategy.SelectionMode;
import com.quantbacktest.symphony.strategy.StrategyNode;
import com.quantbacktest.symphony.strategy.StrategyNodeVisitor;
import com.quantbacktest.symphony.strategy.ValueExpressionVisitor;
import com.quantbacktest.symphony.strategy.WeightEqualNode;
import com.quantbacktest.symphony.strategy.WeightSpecifiedNode;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * Computes the target allocation of a strategy program for a single date.
 *
 * <p>The evaluator is stateless: it reads only the program, the date and the market-data view,
 * so the same instance may evaluate different dates concurrently.
 *
 * <p>Combinators accumulate the contributions of their branches by summing per symbol and then
 * normalizing. A branch that yields no holdings contributes nothing; if every branch is empty
 * the combinator itself yields no holdings.
 */
@Slf4j
public class StrategyEvaluator {

    /**
     * Evaluate without collecting diagnostics.
     */
    public TargetAllocation evaluate(StrategyNode root, LocalDate date, MarketDataAccessor marketData) {
        return evaluate(root, date, marketData, null);
    }

    /**
     * Evaluate the program for {@code date}.
     *
     * @param diagnostics optional sink for dropped filter candidates, may be null
     * @throws EvaluationException if a required value is missing or the expression cannot be evaluated
     */
    public TargetAllocation evaluate(StrategyNode root, LocalDate date, MarketDataAccessor marketData,
                                     RunDiagnostics diagnostics) {
        Map<String, Double> weights = root.accept(new AllocationVisitor(date, marketData, diagnostics));
        return TargetAllocation.normalized(weights);
    }

    private static final class AllocationVisitor implements StrategyNodeVisitor<Map<String, Double>> {

        private final LocalDate date;
        private final MarketDataAccessor marketData;
        private final RunDiagnostics diagnostics;
        private final ValueResolver values;

        private AllocationVisitor(LocalDate date, MarketDataAccessor marketData, RunDiagnostics diagnostics) {
            this.date = date;
            this.marketData = marketData;
            this.diagnostics = diagnostics;
            this.values = new ValueResolver(date, marketData);
        }

        @Override
        public Map<String, Double> visitAsset(AssetNode node) {
            Map<String, Double> single = new LinkedHashMap<>();
            single.put(node.getSymbol(), 1.0);
            return single;
        }

        @Override
        public Map<String, Double> visitGroup(GroupNode node) {
            return node.getBody().accept(this);
        }

        @Override
        public Map<String, Double> visitIf(IfNode node) {
            return holds(node.getCondition())
                    ? node.getThenBranch().accept(this)
                    : node.getElseBranch().accept(this);
        }

        @Override
        public Map<String, Double> visitWeightEqual(WeightEqualNode node) {
            Map<String, Double> combined = new LinkedHashMap<>();
            for (StrategyNode branch : node.getBranches()) {
                branch.accept(this).forEach((symbol, weight) -> combined.merge(symbol, weight, Double::sum));
            }
            return TargetAllocation.normalize(combined);
        }

        @Override
        public Map<String, Double> visitWeightSpecified(WeightSpecifiedNode node) {
            Map<String, Double> combined = new LinkedHashMap<>();
            for (WeightSpecifiedNode.WeightedBranch branch : node.getBranches()) {
                double weight = branch.getWeight();
                for (String symbol : branch.getNode().accept(this).keySet()) {
                    combined.merge(symbol, weight, Double::sum);
                }
            }
            return TargetAllocation.normalize(combined);
        }

        @Override
        public Map<String, Double> visitFilter(FilterNode node) {
            Set<String> candidates = new LinkedHashSet<>();
            for (StrategyNode candidate : node.getCandidates()) {
                candidates.addAll(candidate.accept(this).keySet());
            }

            List<RankedCandidate> ranked = new ArrayList<>();
            for (String symbol : candidates) {
                OptionalDouble value = marketData.indicator(symbol, node.getIndicator(), date);
                if (value.isEmpty() || Double.isNaN(value.getAsDouble())) {
                    log.debug("Dropping filter candidate {} on {}: no {}", symbol, date, node.getIndicator());
                    if (diagnostics != null) {
                        diagnostics.record(date, RunDiagnostics.FILTER_CANDIDATE_DROPPED,
                                symbol + " has no " + node.getIndicator());
                    }
                    continue;
                }
                ranked.add(new RankedCandidate(symbol, value.getAsDouble()));
            }

            Comparator<RankedCandidate> order = Comparator.comparingDouble(RankedCandidate::value);
            if (node.getMode() == SelectionMode.TOP) {
                order = order.reversed();
            }
            // List.sort is stable, so ties keep candidate order
            ranked.sort(order);

            int selected = Math.min(node.getCount(), ranked.size());
            Map<String, Double> result = new LinkedHashMap<>();
            for (int i = 0; i < selected; i++) {
                result.put(ranked.get(i).symbol(), 1.0 / selected);
            }
            return result;
        }

        private boolean holds(Condition condition) {
            double left = condition.getLeft().accept(values);
            double right = condition.getRight().accept(values);
            return condition.getOperator().test(left, right);
        }
    }

    private static final class ValueResolver implements ValueExpressionVisitor<Double> {

        private final LocalDate date;
        private final MarketDataAccessor marketData;

        private ValueResolver(LocalDate date, MarketDataAccessor marketData) {
            this.date = date;
            this.marketData = marketData;
        }

        @Override
        public Double visitLiteral(LiteralValue value) {
            return value.getValue();
        }

        @Override
        public Double visitCurrentPrice(CurrentPrice value) {
            return require(marketData.close(value.getSymbol(), date), value.getSymbol(), "close price");
        }

        @Override
        public Double visitIndicator(IndicatorValue value) {
            return require(marketData.indicator(value.getSymbol(), value.getIndicator(), date),
                    value.getSymbol(), value.getIndicator().toString());
        }

        private double require(OptionalDouble value, String symbol, String what) {
            if (value.isEmpty() || Double.isNaN(value.getAsDouble())) {
                throw EvaluationException.dataUnavailable(symbol, what, date);
            }
            return value.getAsDouble();
        }
    }

    private static final class RankedCandidate {
        private final String symbol;
        private final double value;

        private RankedCandidate(String symbol, double value) {
            this.symbol = symbol;
            this.value = value;
        }

        String symbol() {
            return symbol;
        }

        double value() {
            return value;
        }
    }
}
