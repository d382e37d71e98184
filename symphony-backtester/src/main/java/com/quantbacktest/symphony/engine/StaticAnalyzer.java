package com.quantbacktest.symphony.engine;

import com.quantbacktest.symphony.strategy.AssetNode;
import com.quantbacktest.symphony.strategy.Condition;
import com.quantbacktest.symphony.strategy.CurrentPrice;
import com.quantbacktest.symphony.strategy.FilterNode;
import com.quantbacktest.symphony.strategy.GroupNode;
import com.quantbacktest.symphony.strategy.IfNode;
import com.quantbacktest.symphony.strategy.IndicatorRef;
import com.quantbacktest.symphony.strategy.IndicatorValue;
import com.quantbacktest.symphony.strategy.LiteralValue;
import com.quantbacktest.symphony.strategy.StrategyNode;
import com.quantbacktest.symphony.strategy.StrategyNodeVisitor;
import com.quantbacktest.symphony.strategy.Symphony;
import com.quantbacktest.symphony.strategy.ValueExpressionVisitor;
import com.quantbacktest.symphony.strategy.WeightEqualNode;
import com.quantbacktest.symphony.strategy.WeightSpecifiedNode;

import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Walks a program once, before any evaluation, and collects every ticker and indicator it may touch.
 * Both branches of every conditional are visited; no market data is read.
 */
public class StaticAnalyzer {

    public StrategyRequirements analyze(Symphony symphony) {
        return analyze(symphony.getRoot());
    }

    public StrategyRequirements analyze(StrategyNode root) {
        Collector collector = new Collector();
        root.accept(collector);

        Map<IndicatorRef, Set<String>> indicatorSymbols = new TreeMap<>();
        collector.indicatorSymbols.forEach((indicator, symbols) ->
                indicatorSymbols.put(indicator, Collections.unmodifiableSet(symbols)));

        return new StrategyRequirements(
                Collections.unmodifiableSet(collector.tickers),
                Collections.unmodifiableSet(new TreeSet<>(indicatorSymbols.keySet())),
                Collections.unmodifiableMap(indicatorSymbols));
    }

    private static final class Collector implements StrategyNodeVisitor<Void>, ValueExpressionVisitor<Void> {

        private final Set<String> tickers = new TreeSet<>();
        private final Map<IndicatorRef, Set<String>> indicatorSymbols = new TreeMap<>();

        @Override
        public Void visitAsset(AssetNode node) {
            tickers.add(node.getSymbol());
            return null;
        }

        @Override
        public Void visitGroup(GroupNode node) {
            tickers.addAll(node.labelTickers());
            return node.getBody().accept(this);
        }

        @Override
        public Void visitIf(IfNode node) {
            Condition condition = node.getCondition();
            condition.getLeft().accept(this);
            condition.getRight().accept(this);
            node.getThenBranch().accept(this);
            return node.getElseBranch().accept(this);
        }

        @Override
        public Void visitWeightEqual(WeightEqualNode node) {
            node.getBranches().forEach(branch -> branch.accept(this));
            return null;
        }

        @Override
        public Void visitWeightSpecified(WeightSpecifiedNode node) {
            node.getBranches().forEach(branch -> branch.getNode().accept(this));
            return null;
        }

        @Override
        public Void visitFilter(FilterNode node) {
            AssetCollector candidates = new AssetCollector();
            node.getCandidates().forEach(candidate -> candidate.accept(candidates));
            indicatorSymbols.computeIfAbsent(node.getIndicator(), key -> new TreeSet<>())
                    .addAll(candidates.symbols);
            node.getCandidates().forEach(candidate -> candidate.accept(this));
            return null;
        }

        @Override
        public Void visitLiteral(LiteralValue value) {
            return null;
        }

        @Override
        public Void visitCurrentPrice(CurrentPrice value) {
            tickers.add(value.getSymbol());
            return null;
        }

        @Override
        public Void visitIndicator(IndicatorValue value) {
            tickers.add(value.getSymbol());
            indicatorSymbols.computeIfAbsent(value.getIndicator(), key -> new TreeSet<>())
                    .add(value.getSymbol());
            return null;
        }
    }

    /**
     * Asset symbols statically reachable below a node, used to resolve filter candidates.
     */
    private static final class AssetCollector implements StrategyNodeVisitor<Void> {

        private final Set<String> symbols = new TreeSet<>();

        @Override
        public Void visitAsset(AssetNode node) {
            symbols.add(node.getSymbol());
            return null;
        }

        @Override
        public Void visitGroup(GroupNode node) {
            return node.getBody().accept(this);
        }

        @Override
        public Void visitIf(IfNode node) {
            node.getThenBranch().accept(this);
            return node.getElseBranch().accept(this);
        }

        @Override
        public Void visitWeightEqual(WeightEqualNode node) {
            node.getBranches().forEach(branch -> branch.accept(this));
            return null;
        }

        @Override
        public Void visitWeightSpecified(WeightSpecifiedNode node) {
            node.getBranches().forEach(branch -> branch.getNode().accept(this));
            return null;
        }

        @Override
        public Void visitFilter(FilterNode node) {
            node.getCandidates().forEach(candidate -> candidate.accept(this));
            return null;
        }
    }
}
