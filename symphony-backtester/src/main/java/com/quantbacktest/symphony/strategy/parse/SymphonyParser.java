package com.quantbacktest.symphony.strategy.parse;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.quantbacktest.symphony.engine.EvaluationErrorKind;
import com.quantbacktest.symphony.strategy.AssetNode;
import com.quantbacktest.symphony.strategy.ComparisonOperator;
import com.quantbacktest.symphony.strategy.Condition;
import com.quantbacktest.symphony.strategy.CurrentPrice;
import com.quantbacktest.symphony.strategy.FilterNode;
import com.quantbacktest.symphony.strategy.GroupNode;
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
import com.quantbacktest.symphony.strategy.WeightSpecifiedNode;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Parses the Composer nested-array program format into a {@link Symphony}.
 *
 * <p>Every expression is an array whose first element names the operator, for example
 * {@code ["if", [">", ["current-price", "SPY"], 100], ["asset", "SPY"], ["asset", "BIL"]]}.
 * An array whose first element is itself an array is a block of expressions.
 * All structural checks happen here, so a tree returned by this parser never fails evaluation
 * for structural reasons.
 */
@Slf4j
public class SymphonyParser {

    private static final String DEFSYMPHONY = "defsymphony";

    private final ObjectMapper objectMapper;

    public SymphonyParser() {
        this(new ObjectMapper());
    }

    public SymphonyParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Symphony parse(String json) {
        try {
            return parse(objectMapper.readTree(json));
        } catch (JsonProcessingException e) {
            throw new StrategyParseException(EvaluationErrorKind.MALFORMED_EXPRESSION,
                    "Program is not valid JSON: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Parse a full program document: {@code ["defsymphony", name, (options,) root]} or
     * {@code [name, description, root]}.
     */
    public Symphony parse(JsonNode document) {
        if (document == null || !document.isArray() || document.size() < 3) {
            throw StrategyParseException.malformed("Program must be an array of [name, description, root]");
        }

        String head = document.get(0).asText();
        if (DEFSYMPHONY.equals(head)) {
            if (document.size() > 4) {
                throw StrategyParseException.malformed("defsymphony takes a name, optional options and one root expression");
            }
            String name = text(document.get(1), "symphony name");
            JsonNode root = document.get(document.size() - 1);
            log.debug("Parsing defsymphony '{}'", name);
            return new Symphony(name, "", parseExpression(root));
        }

        if (document.size() != 3) {
            throw StrategyParseException.malformed("Program must have exactly three elements, got " + document.size());
        }
        return new Symphony(text(document.get(0), "symphony name"),
                document.get(1).isNull() ? "" : document.get(1).asText(),
                parseExpression(document.get(2)));
    }

    public StrategyNode parseExpression(JsonNode node) {
        if (node == null || !node.isArray()) {
            throw StrategyParseException.malformed("Expected an expression array but found: " + node);
        }
        if (node.isEmpty()) {
            return new WeightEqualNode(List.of());
        }
        JsonNode head = node.get(0);
        if (head.isArray()) {
            return parseBlock(node);
        }
        if (!head.isTextual()) {
            throw StrategyParseException.malformed("Expression must start with an operator name: " + node);
        }

        String operator = head.asText();
        return switch (operator) {
            case "asset" -> parseAsset(node);
            case "group" -> parseGroup(node);
            case "if" -> parseIf(node);
            case "weight-equal", "wt-cash-equal" -> parseWeightEqual(node);
            case "weight-specified", "wt-cash-specified" -> parseWeightSpecified(node);
            case "filter" -> parseFilter(node);
            default -> {
                if (ComparisonOperator.fromSymbol(operator).isPresent()) {
                    throw StrategyParseException.malformed(
                            "Comparison '" + operator + "' cannot be used as an allocation");
                }
                throw StrategyParseException.unknownOperator(operator);
            }
        };
    }

    /**
     * A block of one expression is that expression; several become an equal-weight split.
     */
    private StrategyNode parseBlock(JsonNode block) {
        List<StrategyNode> children = parseAll(block.elements());
        return children.size() == 1 ? children.get(0) : new WeightEqualNode(children);
    }

    private StrategyNode parseAsset(JsonNode node) {
        requireArity(node, 2, 3);
        JsonNode ticker = node.get(1);
        // keyword form: ["asset", [":ticker", "SPY"], [":name", "..."]]
        if (ticker.isArray() && ticker.size() == 2 && ":ticker".equals(ticker.get(0).asText())) {
            ticker = ticker.get(1);
        }
        String name = null;
        if (node.size() == 3) {
            JsonNode nameNode = node.get(2);
            if (nameNode.isArray() && nameNode.size() == 2) {
                nameNode = nameNode.get(1);
            }
            name = nameNode.asText();
        }
        return new AssetNode(text(ticker, "asset symbol"), name);
    }

    private StrategyNode parseGroup(JsonNode node) {
        requireArity(node, 3, 3);
        return new GroupNode(text(node.get(1), "group label"), parseExpression(node.get(2)));
    }

    private StrategyNode parseIf(JsonNode node) {
        requireArity(node, 4, 4);
        return new IfNode(parseCondition(node.get(1)),
                parseExpression(node.get(2)),
                parseExpression(node.get(3)));
    }

    private StrategyNode parseWeightEqual(JsonNode node) {
        List<JsonNode> args = arguments(node);
        if (args.size() == 1 && isBlock(args.get(0))) {
            return new WeightEqualNode(parseAll(args.get(0).elements()));
        }
        List<StrategyNode> branches = new ArrayList<>();
        for (JsonNode arg : args) {
            branches.add(parseExpression(arg));
        }
        return new WeightEqualNode(branches);
    }

    private StrategyNode parseWeightSpecified(JsonNode node) {
        List<JsonNode> args = arguments(node);
        if (args.size() == 1 && args.get(0).isArray() && !args.get(0).isEmpty() && args.get(0).get(0).isNumber()) {
            args = new ArrayList<>();
            node.get(1).elements().forEachRemaining(args::add);
        }
        if (args.size() % 2 != 0) {
            throw StrategyParseException.malformed("weight-specified requires weight/expression pairs: " + node);
        }
        List<WeightSpecifiedNode.WeightedBranch> branches = new ArrayList<>();
        for (int i = 0; i < args.size(); i += 2) {
            JsonNode weight = args.get(i);
            if (!weight.isNumber() || !Double.isFinite(weight.asDouble()) || weight.asDouble() < 0) {
                throw StrategyParseException.malformed("Weight must be a non-negative number: " + weight);
            }
            branches.add(new WeightSpecifiedNode.WeightedBranch(weight.asDouble(), parseExpression(args.get(i + 1))));
        }
        return new WeightSpecifiedNode(branches);
    }

    private StrategyNode parseFilter(JsonNode node) {
        if (node.size() < 4) {
            throw StrategyParseException.malformed("filter requires an indicator, a selector and candidates: " + node);
        }
        IndicatorRef indicator = parseIndicatorSpec(node.get(1));
        JsonNode selector = node.get(2);
        if (!selector.isArray() || selector.isEmpty() || selector.size() > 2) {
            throw StrategyParseException.malformed("Filter selector must be [select-top|select-bottom, n]: " + selector);
        }
        String selectorName = text(selector.get(0), "filter selector");
        SelectionMode mode = switch (selectorName) {
            case "select-top" -> SelectionMode.TOP;
            case "select-bottom" -> SelectionMode.BOTTOM;
            default -> throw StrategyParseException.unknownOperator(selectorName);
        };
        int count = selector.size() == 2 ? positiveInt(selector.get(1), "filter count") : 1;

        List<StrategyNode> candidates;
        if (node.size() == 4 && isBlock(node.get(3))) {
            candidates = parseAll(node.get(3).elements());
        } else {
            candidates = new ArrayList<>();
            for (int i = 3; i < node.size(); i++) {
                candidates.add(parseExpression(node.get(i)));
            }
        }
        return new FilterNode(indicator, mode, count, candidates);
    }

    private Condition parseCondition(JsonNode node) {
        if (!node.isArray() || node.size() != 3 || !node.get(0).isTextual()) {
            throw StrategyParseException.malformed("Condition must be [operator, lhs, rhs]: " + node);
        }
        String symbol = node.get(0).asText();
        ComparisonOperator operator = ComparisonOperator.fromSymbol(symbol)
                .orElseThrow(() -> StrategyParseException.unknownOperator(symbol));
        return new Condition(operator, parseValue(node.get(1)), parseValue(node.get(2)));
    }

    ValueExpression parseValue(JsonNode node) {
        if (node.isNumber()) {
            return new LiteralValue(node.asDouble());
        }
        if (!node.isArray() || node.isEmpty() || !node.get(0).isTextual()) {
            throw StrategyParseException.malformed("Expected a number or value expression: " + node);
        }
        String operator = node.get(0).asText();
        if ("current-price".equals(operator)) {
            requireArity(node, 2, 2);
            return new CurrentPrice(text(node.get(1), "price symbol"));
        }
        IndicatorKind kind = indicatorKind(operator);
        requireArity(node, 2, 3);
        int window = node.size() == 3 ? windowParam(node.get(2), kind) : kind.getDefaultWindow();
        return new IndicatorValue(text(node.get(1), "indicator symbol"), new IndicatorRef(kind, window));
    }

    /**
     * Indicator of a filter: {@code ["rsi", {":window": 10}]} or {@code ["moving-average-price"]}.
     */
    private IndicatorRef parseIndicatorSpec(JsonNode node) {
        if (!node.isArray() || node.isEmpty() || node.size() > 2) {
            throw StrategyParseException.malformed("Indicator must be [name, params]: " + node);
        }
        IndicatorKind kind = indicatorKind(text(node.get(0), "indicator name"));
        int window = node.size() == 2 ? windowParam(node.get(1), kind) : kind.getDefaultWindow();
        return new IndicatorRef(kind, window);
    }

    private IndicatorKind indicatorKind(String name) {
        return switch (name) {
            case "rsi", "relative-strength-index" -> IndicatorKind.RSI;
            case "moving-average-price" -> IndicatorKind.MOVING_AVERAGE;
            default -> throw StrategyParseException.unknownOperator(name);
        };
    }

    /**
     * Reads the window from {@code {":window": n}}, {@code {"window": n}} or {@code [":window", n]}.
     */
    private int windowParam(JsonNode params, IndicatorKind kind) {
        if (params.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = params.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                if (":window".equals(field.getKey()) || "window".equals(field.getKey())) {
                    return positiveInt(field.getValue(), "indicator window");
                }
            }
            return kind.getDefaultWindow();
        }
        if (params.isArray()) {
            for (int i = 0; i + 1 < params.size(); i += 2) {
                String key = params.get(i).asText();
                if (":window".equals(key) || "window".equals(key)) {
                    return positiveInt(params.get(i + 1), "indicator window");
                }
            }
            return kind.getDefaultWindow();
        }
        if (params.isNumber()) {
            return positiveInt(params, "indicator window");
        }
        throw StrategyParseException.malformed("Unsupported indicator parameters: " + params);
    }

    private List<StrategyNode> parseAll(Iterator<JsonNode> elements) {
        List<StrategyNode> nodes = new ArrayList<>();
        elements.forEachRemaining(element -> nodes.add(parseExpression(element)));
        return nodes;
    }

    private static List<JsonNode> arguments(JsonNode node) {
        List<JsonNode> args = new ArrayList<>();
        for (int i = 1; i < node.size(); i++) {
            args.add(node.get(i));
        }
        return args;
    }

    private static boolean isBlock(JsonNode node) {
        return node.isArray() && (node.isEmpty() || node.get(0).isArray());
    }

    private static void requireArity(JsonNode node, int min, int max) {
        if (node.size() < min || node.size() > max) {
            throw StrategyParseException.malformed(String.format(
                    "'%s' expects between %d and %d elements, got %d", node.get(0).asText(), min, max, node.size()));
        }
    }

    private static String text(JsonNode node, String what) {
        if (node == null || !node.isTextual() || node.asText().isBlank()) {
            throw StrategyParseException.malformed("Expected " + what + " as a non-empty string but found: " + node);
        }
        return node.asText().trim();
    }

    private static int positiveInt(JsonNode node, String what) {
        if (!node.isNumber() || node.asDouble() != Math.rint(node.asDouble()) || node.asDouble() < 1) {
            throw StrategyParseException.malformed(what + " must be a positive integer: " + node);
        }
        return node.asInt();
    }
}
