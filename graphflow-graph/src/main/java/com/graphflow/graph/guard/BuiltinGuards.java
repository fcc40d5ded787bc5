package com.graphflow.graph.guard;

import com.graphflow.node.GuardFactory;
import com.graphflow.node.GuardPredicate;
import com.graphflow.registry.ComponentRegistry;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.Map;
import java.util.Objects;
import java.util.function.IntPredicate;

/**
 * Guard types available to every graph once registered with {@link #registerAll(ComponentRegistry)}.
 * Comparison guards take {@code key} and {@code value} params; a missing key or a non-numeric operand
 * makes an ordering guard evaluate to false.
 */
public final class BuiltinGuards {

    public static final String ALWAYS = "always";
    public static final String EQUALS = "equals";
    public static final String NOT_EQUALS = "not_equals";
    public static final String GREATER_THAN = "greater_than";
    public static final String GREATER_OR_EQUAL = "greater_or_equal";
    public static final String LESS_THAN = "less_than";
    public static final String LESS_OR_EQUAL = "less_or_equal";
    public static final String EXISTS = "exists";
    public static final String TRUTHY = "truthy";
    public static final String HAS_ERRORS = "has_errors";
    public static final String HAS_TOOL_CALLS = "has_tool_calls";
    public static final String MAX_ITERATIONS_REACHED = "max_iterations_reached";

    private BuiltinGuards() {
    }

    public static void registerAll(ComponentRegistry<GuardFactory> registry) {
        registry.register(ALWAYS, params -> labeled(v -> true, ALWAYS));
        registry.register(EQUALS, params -> {
            String key = requireKey(EQUALS, params);
            Object expected = params.get("value");
            return labeled(v -> valuesEqual(v.get(key), expected), EQUALS + " " + key);
        });
        registry.register(NOT_EQUALS, params -> {
            String key = requireKey(NOT_EQUALS, params);
            Object expected = params.get("value");
            return labeled(v -> !valuesEqual(v.get(key), expected), NOT_EQUALS + " " + key);
        });
        registry.register(GREATER_THAN, params -> ordering(GREATER_THAN, params, c -> c > 0));
        registry.register(GREATER_OR_EQUAL, params -> ordering(GREATER_OR_EQUAL, params, c -> c >= 0));
        registry.register(LESS_THAN, params -> ordering(LESS_THAN, params, c -> c < 0));
        registry.register(LESS_OR_EQUAL, params -> ordering(LESS_OR_EQUAL, params, c -> c <= 0));
        registry.register(EXISTS, params -> {
            String key = requireKey(EXISTS, params);
            return labeled(v -> v.get(key) != null, EXISTS + " " + key);
        });
        registry.register(TRUTHY, params -> {
            String key = requireKey(TRUTHY, params);
            return labeled(v -> isTruthy(v.get(key)), TRUTHY + " " + key);
        });
        registry.register(HAS_ERRORS, params -> {
            String key = keyOrDefault(params, "errors");
            return labeled(v -> isTruthy(v.get(key)), HAS_ERRORS);
        });
        registry.register(HAS_TOOL_CALLS, params -> {
            String key = keyOrDefault(params, "tool_calls");
            return labeled(v -> isTruthy(v.get(key)), HAS_TOOL_CALLS);
        });
        registry.register(MAX_ITERATIONS_REACHED, BuiltinGuards::maxIterationsReached);
    }

    /**
     * {@code iteration_count >= max_iterations}. The limit comes from param {@code max}, else from the state
     * key {@code max_iterations}; with neither, the guard is false.
     */
    private static GuardPredicate maxIterationsReached(Map<String, Object> params) {
        String countKey = keyOrDefault(params, "iteration_count");
        Object fixedMax = params.get("max");
        if (fixedMax != null && toDecimal(fixedMax) == null) {
            throw new IllegalArgumentException(MAX_ITERATIONS_REACHED + ": 'max' must be numeric");
        }
        return labeled(v -> {
            BigDecimal count = toDecimal(v.get(countKey));
            BigDecimal max = toDecimal(fixedMax != null ? fixedMax : v.get("max_iterations"));
            return count != null && max != null && count.compareTo(max) >= 0;
        }, MAX_ITERATIONS_REACHED);
    }

    private static GuardPredicate ordering(String name, Map<String, Object> params, IntPredicate test) {
        String key = requireKey(name, params);
        BigDecimal bound = toDecimal(params.get("value"));
        if (bound == null) {
            throw new IllegalArgumentException(name + ": 'value' must be numeric");
        }
        return labeled(v -> {
            BigDecimal actual = toDecimal(v.get(key));
            return actual != null && test.test(actual.compareTo(bound));
        }, name + " " + key + " " + bound.toPlainString());
    }

    private static String requireKey(String guard, Map<String, Object> params) {
        Object key = params.get("key");
        if (!(key instanceof String) || ((String) key).isBlank()) {
            throw new IllegalArgumentException(guard + ": 'key' param is required");
        }
        return (String) key;
    }

    private static String keyOrDefault(Map<String, Object> params, String defaultKey) {
        Object key = params.get("key");
        return key instanceof String && !((String) key).isBlank() ? (String) key : defaultKey;
    }

    static boolean valuesEqual(Object actual, Object expected) {
        BigDecimal a = toDecimal(actual);
        BigDecimal b = toDecimal(expected);
        if (a != null && b != null) return a.compareTo(b) == 0;
        return Objects.equals(actual, expected);
    }

    static boolean isTruthy(Object value) {
        if (value == null) return false;
        if (value instanceof Boolean) return (Boolean) value;
        if (value instanceof Number) return toDecimal(value).signum() != 0;
        if (value instanceof CharSequence) return ((CharSequence) value).length() > 0;
        if (value instanceof Collection) return !((Collection<?>) value).isEmpty();
        if (value instanceof Map) return !((Map<?, ?>) value).isEmpty();
        return true;
    }

    static BigDecimal toDecimal(Object value) {
        if (value instanceof BigDecimal) return (BigDecimal) value;
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            return BigDecimal.valueOf(((Number) value).longValue());
        }
        if (value instanceof Number) {
            double d = ((Number) value).doubleValue();
            return Double.isFinite(d) ? new BigDecimal(value.toString()) : null;
        }
        return null;
    }

    private static GuardPredicate labeled(GuardPredicate predicate, String label) {
        return new GuardPredicate() {
            @Override
            public boolean evaluate(Map<String, Object> values) {
                return predicate.evaluate(values);
            }

            @Override
            public String describe() {
                return label;
            }
        };
    }
}
