package com.strata.mcp;

import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;

/**
 * Built-in {@code internal} server. Its {@code decision} action turns the {@code condition}
 * argument of a materialized decision node into an outcome string: booleans and numbers
 * become "true"/"false", other strings are returned stripped so they can match
 * {@code case:} style outcomes.
 */
@Component
public class DecisionToolClient implements ToolClient {

    public static final String SERVER = "internal";
    public static final String DECISION_ACTION = "decision";
    public static final String DECISION_TOOL = SERVER + ":" + DECISION_ACTION;

    @Override
    public String server() {
        return SERVER;
    }

    @Override
    public Object call(String action, Map<String, Object> arguments) {
        if (!DECISION_ACTION.equals(action)) {
            throw new ToolCallException("Unknown internal action: " + action);
        }
        return evaluate(arguments.get("condition"));
    }

    static String evaluate(Object condition) {
        if (condition == null) {
            return "false";
        }
        if (condition instanceof Boolean b) {
            return b.toString();
        }
        if (condition instanceof Number n) {
            return Boolean.toString(n.doubleValue() != 0);
        }
        String text = condition.toString().strip();
        String lower = text.toLowerCase(Locale.ROOT);
        if (lower.equals("true") || lower.equals("false")) {
            return lower;
        }
        return text;
    }
}
