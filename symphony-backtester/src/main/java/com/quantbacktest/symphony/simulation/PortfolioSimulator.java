package com.quantbacktest.symphony.simulation;

import com.quantbacktest.symphony.engine.RunDiagnostics;
import com.quantbacktest.symphony.engine.TargetAllocation;
import com.quantbacktest.symphony.marketdata.MarketDataAccessor;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Turns daily target allocations into orders against a single {@link PortfolioState}.
 *
 * <p>Each day is processed as: mark to market, cadence gate, liquidation of symbols that left the
 * target, then resizing of the remaining targets (reductions before increases), then appending the
 * pre-trade valuation. Until the portfolio first holds a position every day rebalances and ignores
 * the minimum trade size, so a run that opens in cash still seeds its first real allocation.
 *
 * <p>Not thread-safe; one simulator owns one portfolio for one run.
 */
@Slf4j
public class PortfolioSimulator {

    /** Share deltas below this are treated as no trade. */
    static final double SHARE_EPSILON = 1e-9;

    /** Cash below {@code -CASH_EPSILON} is an overdraft and aborts the run. */
    static final double CASH_EPSILON = 1e-6;

    private final SimulationSettings settings;
    private final MarketDataAccessor prices;
    private final RunDiagnostics diagnostics;
    private final PortfolioState state;
    private final List<DailyValuation> valuations = new ArrayList<>();
    private final List<ExecutedOrder> orders = new ArrayList<>();

    private int daysSinceRebalance;
    private int rebalanceCount;
    private boolean seeded;

    public PortfolioSimulator(SimulationSettings settings, MarketDataAccessor prices) {
        this(settings, prices, new RunDiagnostics());
    }

    public PortfolioSimulator(SimulationSettings settings, MarketDataAccessor prices, RunDiagnostics diagnostics) {
        settings.validate();
        this.settings = settings;
        this.prices = prices;
        this.diagnostics = diagnostics;
        this.state = new PortfolioState(settings.getInitialCapital());
    }

    /**
     * Simulate one trading day against {@code target}.
     */
    public StepResult step(LocalDate date, TargetAllocation target) {
        double preTradeValue = markToMarket(date);
        daysSinceRebalance++;

        boolean due = !seeded || daysSinceRebalance >= settings.getRebalanceFrequencyDays();
        List<ExecutedOrder> executed = new ArrayList<>();
        if (due) {
            liquidateDropped(date, target, executed);
            rebalance(date, target, preTradeValue, !seeded, executed);
            daysSinceRebalance = 0;
            rebalanceCount++;
            seeded = seeded || !state.getHoldings().isEmpty();
        }

        valuations.add(new DailyValuation(date, preTradeValue));
        orders.addAll(executed);
        if (!executed.isEmpty()) {
            log.debug("{}: executed {} orders, cash {}", date, executed.size(), state.getCash());
        }
        return new StepResult(date, preTradeValue, due, Collections.unmodifiableList(executed));
    }

    /**
     * Advance a day on which no target is available: value is sampled and the cadence counter moves,
     * but nothing trades.
     */
    public StepResult recordSkippedDay(LocalDate date) {
        double preTradeValue = markToMarket(date);
        daysSinceRebalance++;
        valuations.add(new DailyValuation(date, preTradeValue));
        return new StepResult(date, preTradeValue, false, List.of());
    }

    /**
     * Cash plus as-of value of every priced holding.
     */
    public double markToMarket(LocalDate date) {
        double value = state.getCash();
        for (Map.Entry<String, Double> holding : state.getHoldings().entrySet()) {
            OptionalDouble price = prices.close(holding.getKey(), date);
            if (price.isEmpty()) {
                log.warn("No price for held symbol {} on {}; excluded from valuation", holding.getKey(), date);
                diagnostics.record(date, RunDiagnostics.HOLDING_UNPRICED, holding.getKey());
                continue;
            }
            value += holding.getValue() * price.getAsDouble();
        }
        return value;
    }

    private void liquidateDropped(LocalDate date, TargetAllocation target, List<ExecutedOrder> executed) {
        for (String symbol : new ArrayList<>(state.getHoldings().keySet())) {
            if (target.contains(symbol)) {
                continue;
            }
            OptionalDouble price = prices.close(symbol, date);
            if (price.isEmpty()) {
                log.warn("Cannot liquidate {} on {}: no price", symbol, date);
                diagnostics.record(date, RunDiagnostics.HOLDING_UNPRICED, "liquidation of " + symbol + " deferred");
                continue;
            }
            executed.add(sell(date, symbol, state.sharesOf(symbol), price.getAsDouble(), ExecutedOrder.Reason.LIQUIDATION));
        }
    }

    private void rebalance(LocalDate date, TargetAllocation target, double preTradeValue, boolean seeding,
                           List<ExecutedOrder> executed) {
        List<PlannedTrade> reductions = new ArrayList<>();
        List<PlannedTrade> increases = new ArrayList<>();

        for (Map.Entry<String, Double> entry : target.getWeights().entrySet()) {
            String symbol = entry.getKey();
            OptionalDouble quote = prices.close(symbol, date);
            if (quote.isEmpty()) {
                log.warn("No price for target symbol {} on {}; not traded", symbol, date);
                diagnostics.record(date, RunDiagnostics.TARGET_UNPRICED, symbol);
                continue;
            }
            double price = quote.getAsDouble();
            double targetShares = preTradeValue * entry.getValue() / price;
            double delta = targetShares - state.sharesOf(symbol);
            if (Math.abs(delta) < SHARE_EPSILON) {
                continue;
            }
            if (!seeding && Math.abs(delta * price) < settings.getMinTradeSize()) {
                continue;
            }
            PlannedTrade trade = new PlannedTrade(symbol, delta, price);
            if (delta < 0) {
                reductions.add(trade);
            } else {
                increases.add(trade);
            }
        }

        for (PlannedTrade trade : reductions) {
            executed.add(sell(date, trade.symbol, -trade.delta, trade.price, ExecutedOrder.Reason.REBALANCE));
        }
        for (PlannedTrade trade : increases) {
            ExecutedOrder order = buy(date, trade.symbol, trade.delta, trade.price);
            if (order != null) {
                executed.add(order);
            }
        }
    }

    private ExecutedOrder sell(LocalDate date, String symbol, double shares, double price, ExecutedOrder.Reason reason) {
        double held = state.sharesOf(symbol);
        double quantity = Math.min(shares, held);
        double executionPrice = price * (1 - settings.getSlippagePct());
        double proceeds = quantity * executionPrice;
        double fee = proceeds * settings.getTransactionCostPct();

        state.adjustCash(proceeds - fee);
        double remaining = held - quantity;
        state.setShares(symbol, remaining <= SHARE_EPSILON ? 0.0 : remaining);

        log.debug("{} SELL {} {} @ {} fee {} ({})", date, quantity, symbol, executionPrice, fee, reason);
        return ExecutedOrder.builder()
                .date(date)
                .symbol(symbol)
                .side(ExecutedOrder.Side.SELL)
                .shares(quantity)
                .marketPrice(price)
                .executionPrice(executionPrice)
                .fee(fee)
                .reason(reason)
                .build();
    }

    private ExecutedOrder buy(LocalDate date, String symbol, double shares, double price) {
        double executionPrice = price * (1 + settings.getSlippagePct());
        double unitCost = executionPrice * (1 + settings.getTransactionCostPct());
        double affordable = Math.max(state.getCash(), 0.0) / unitCost;
        double quantity = Math.min(shares, affordable);
        if (quantity <= SHARE_EPSILON) {
            log.debug("{} BUY {} skipped: insufficient cash {}", date, symbol, state.getCash());
            return null;
        }

        double cost = quantity * executionPrice;
        double fee = cost * settings.getTransactionCostPct();
        state.adjustCash(-(cost + fee));
        if (state.getCash() < -CASH_EPSILON) {
            throw new IllegalStateException(String.format(
                    "Cash overdrawn to %.6f buying %s on %s", state.getCash(), symbol, date));
        }
        if (state.getCash() < 0) {
            state.setCash(0.0);
        }
        state.setShares(symbol, state.sharesOf(symbol) + quantity);

        log.debug("{} BUY {} {} @ {} fee {}", date, quantity, symbol, executionPrice, fee);
        return ExecutedOrder.builder()
                .date(date)
                .symbol(symbol)
                .side(ExecutedOrder.Side.BUY)
                .shares(quantity)
                .marketPrice(price)
                .executionPrice(executionPrice)
                .fee(fee)
                .reason(ExecutedOrder.Reason.REBALANCE)
                .build();
    }

    public PortfolioState getState() {
        return state;
    }

    public List<DailyValuation> getValuations() {
        return Collections.unmodifiableList(valuations);
    }

    public List<ExecutedOrder> getOrders() {
        return Collections.unmodifiableList(orders);
    }

    public int getRebalanceCount() {
        return rebalanceCount;
    }

    public boolean isSeeded() {
        return seeded;
    }

    private static final class PlannedTrade {
        private final String symbol;
        private final double delta;
        private final double price;

        private PlannedTrade(String symbol, double delta, double price) {
            this.symbol = symbol;
            this.delta = delta;
            this.price = price;
        }
    }
}
