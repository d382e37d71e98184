package com.quantbacktest.symphony.strategy.parse;

import com.fasterxml.jackson.databind.JsonNode;
import com.quantbacktest.symphony.strategy.AssetNode;
import com.quantbacktest.symphony.strategy.ComparisonOperator;
import com.quantbacktest.symphony.strategy.Condition;
import com.quantbacktest.symphony.strategy.CurrentPrice;
import com.quantbacktest.symphony.strategy.FilterNode;
import com.quantbacktest.symphony.strategy.IfNode;
import com.quantbacktest.symphony.strategy.IndicatorKind;
import com.quantbacktest.symphony.strategy.IndicatorRef;
import com.quantbacktest.symphony.strategy.IndicatorValue;
import com.quantbacktest.symphony.strategy.LiteralValue;
import com.quantbacktest.symphony.strategy.SelectionMode;
import com.quantbacktest.symphony.strategy.StrategyNode;
import com.quantbacktest.symphony.strategy.Symphony;
import com.quantbacktest.symphony.strategy.ValueExpression;
import com.quantbacktest.symphony.strategy.WeightEqualNode;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Maps a Quantmage incantation document onto the strategy tree.
 *
 * <p>Supported incantations are {@code Ticker}, {@code Weighted}, {@code IfElse} with a
 * {@code SingleCondition}, and {@code Filtered}. Anything else is rejected rather than guessed.
 */
@Slf4j
public class QuantmageNormalizer {

    private static final int DEFAULT_WINDOW = 10;

    public Symphony normalize(JsonNode document) {
        if (document == null || !document.isObject()) {
            throw StrategyParseException.malformed("Quantmage strategy must be a JSON object");
        }
        JsonNode incantation = document.get("incantation");
        if (incantation == null || !incantation.isObject()) {
            throw StrategyParseException.malformed("Quantmage strategy has no incantation");
        }
        String name = document.path("name").asText("Quantmage Strategy");
        String description = document.path("description").asText("");
        log.debug("Normalizing Quantmage strategy '{}'", name);
        return new Symphony(name, description, convert(incantation));
    }

    StrategyNode convert(JsonNode incantation) {
        String type = incantation.path("incantation_type").asText("");
        return switch (type) {
            case "Ticker" -> ticker(incantation);
            case "Weighted" -> weighted(incantation);
            case "IfElse" -> ifElse(incantation);
            case "Filtered" -> filtered(incantation);
            default -> throw StrategyParseException.unknownOperator("incantation_type " + quoted(type));
        };
    }

    private StrategyNode ticker(JsonNode incantation) {
        String symbol = incantation.path("symbol").asText("");
        if (symbol.isBlank()) {
            throw StrategyParseException.malformed("Ticker incantation without a symbol");
        }
        String name = incantation.hasNonNull("name") ? incantation.get("name").asText() : null;
        return new AssetNode(symbol, name);
    }

    private StrategyNode weighted(JsonNode incantation) {
        List<StrategyNode> children = children(incantation);
        return children.size() == 1 ? children.get(0) : new WeightEqualNode(children);
    }

    private StrategyNode ifElse(JsonNode incantation) {
        JsonNode thenBranch = incantation.get("then_incantation");
        JsonNode elseBranch = incantation.get("else_incantation");
        if (thenBranch == null || elseBranch == null) {
            throw StrategyParseException.malformed("IfElse incantation requires then and else branches");
        }
        return new IfNode(condition(incantation.path("condition")), convert(thenBranch), convert(elseBranch));
    }

    private StrategyNode filtered(JsonNode incantation) {
        IndicatorRef indicator = indicatorRef(incantation.path("sort_indicator"));
        int count = incantation.path("count").asInt(1);
        if (count < 1) {
            throw StrategyParseException.malformed("Filtered count must be positive: " + count);
        }
        SelectionMode mode = incantation.path("bottom").asBoolean(false) ? SelectionMode.BOTTOM : SelectionMode.TOP;
        return new FilterNode(indicator, mode, count, children(incantation));
    }

    private Condition condition(JsonNode condition) {
        String type = condition.path("condition_type").asText("");
        if (!"SingleCondition".equals(type)) {
            throw StrategyParseException.unknownOperator("condition_type " + quoted(type));
        }
        String leftSymbol = condition.path("lh_ticker_symbol").asText("");
        ValueExpression left = indicatorValue(condition.path("lh_indicator"), leftSymbol);

        ValueExpression right;
        JsonNode rightIndicator = condition.path("rh_indicator");
        if (rightIndicator.hasNonNull("type")) {
            String rightSymbol = condition.path("rh_ticker_symbol").asText(leftSymbol);
            right = indicatorValue(rightIndicator, rightSymbol);
        } else {
            right = new LiteralValue(condition.path("rh_value").asDouble(0.0));
        }

        ComparisonOperator operator = condition.path("greater_than").asBoolean(true)
                ? ComparisonOperator.GREATER_THAN
                : ComparisonOperator.LESS_THAN;
        return new Condition(operator, left, right);
    }

    private ValueExpression indicatorValue(JsonNode indicator, String symbol) {
        if (symbol.isBlank()) {
            throw StrategyParseException.malformed("Condition indicator without a ticker symbol");
        }
        if ("CurrentPrice".equals(indicator.path("type").asText())) {
            return new CurrentPrice(symbol);
        }
        return new IndicatorValue(symbol, indicatorRef(indicator));
    }

    private IndicatorRef indicatorRef(JsonNode indicator) {
        String type = indicator.path("type").asText("");
        int window = indicator.path("window").asInt(DEFAULT_WINDOW);
        if (window < 1) {
            throw StrategyParseException.malformed("Indicator window must be positive: " + window);
        }
        IndicatorKind kind = switch (type) {
            case "RelativeStrengthIndex" -> IndicatorKind.RSI;
            case "MovingAverage" -> IndicatorKind.MOVING_AVERAGE;
            default -> throw StrategyParseException.unknownOperator("indicator " + quoted(type));
        };
        return new IndicatorRef(kind, window);
    }

    private List<StrategyNode> children(JsonNode incantation) {
        List<StrategyNode> children = new ArrayList<>();
        for (JsonNode child : incantation.path("incantations")) {
            children.add(convert(child));
        }
        return children;
    }

    private static String quoted(String value) {
        return "'" + value + "'";
    }
}
