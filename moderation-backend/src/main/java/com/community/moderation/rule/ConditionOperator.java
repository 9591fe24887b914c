package com.community.moderation.rule;

import java.util.Collection;
import java.util.Locale;

/**
 * 条件运算符。actual 为空时条件视为不满足；类型无法比较时抛出 IllegalArgumentException，由引擎跳过该规则。
 */
public enum ConditionOperator {
    EQUALS("equals"),
    NOT_EQUALS("not_equals"),
    GREATER_THAN("greater_than"),
    GREATER_OR_EQUAL("greater_or_equal"),
    LESS_THAN("less_than"),
    LESS_OR_EQUAL("less_or_equal"),
    CONTAINS("contains"),
    NOT_CONTAINS("not_contains"),
    IN("in"),
    NOT_IN("not_in"),
    IS_TRUE("is_true"),
    IS_FALSE("is_false");

    private static final double EPSILON = 1e-9;

    private final String code;

    ConditionOperator(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    /**
     * @return 对应的运算符；未知编码返回 null
     */
    public static ConditionOperator fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (ConditionOperator operator : values()) {
            if (operator.code.equalsIgnoreCase(code.trim())) {
                return operator;
            }
        }
        return null;
    }

    public boolean test(Object actual, Object threshold) {
        if (actual == null) {
            return false;
        }
        switch (this) {
            case EQUALS:
                return valueEquals(actual, threshold);
            case NOT_EQUALS:
                return !valueEquals(actual, threshold);
            case GREATER_THAN:
                return toNumber(actual) > toNumber(threshold);
            case GREATER_OR_EQUAL:
                return toNumber(actual) >= toNumber(threshold) - EPSILON;
            case LESS_THAN:
                return toNumber(actual) < toNumber(threshold);
            case LESS_OR_EQUAL:
                return toNumber(actual) <= toNumber(threshold) + EPSILON;
            case CONTAINS:
                return contains(actual, threshold);
            case NOT_CONTAINS:
                return !contains(actual, threshold);
            case IN:
                return memberOf(actual, threshold);
            case NOT_IN:
                return !memberOf(actual, threshold);
            case IS_TRUE:
                return toBoolean(actual);
            case IS_FALSE:
                return !toBoolean(actual);
            default:
                throw new IllegalStateException("Unhandled operator " + this);
        }
    }

    private static boolean valueEquals(Object actual, Object expected) {
        if (expected == null) {
            return false;
        }
        if (actual instanceof Number && expected instanceof Number) {
            return Math.abs(((Number) actual).doubleValue() - ((Number) expected).doubleValue()) < EPSILON;
        }
        if (actual instanceof Boolean || expected instanceof Boolean) {
            return toBoolean(actual) == toBoolean(expected);
        }
        return String.valueOf(actual).equalsIgnoreCase(String.valueOf(expected));
    }

    private static boolean contains(Object actual, Object expected) {
        if (actual instanceof Collection) {
            for (Object element : (Collection<?>) actual) {
                if (valueEquals(element, expected)) {
                    return true;
                }
            }
            return false;
        }
        return String.valueOf(actual).toLowerCase(Locale.ROOT)
                .contains(String.valueOf(expected).toLowerCase(Locale.ROOT));
    }

    private static boolean memberOf(Object actual, Object candidates) {
        if (!(candidates instanceof Collection)) {
            throw new IllegalArgumentException("Operator in/not_in requires a list threshold");
        }
        for (Object candidate : (Collection<?>) candidates) {
            if (valueEquals(actual, candidate)) {
                return true;
            }
        }
        return false;
    }

    private static double toNumber(Object value) {
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        if (value instanceof String) {
            try {
                return Double.parseDouble(((String) value).trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Not a number: " + value, e);
            }
        }
        throw new IllegalArgumentException("Not a number: " + value);
    }

    private static boolean toBoolean(Object value) {
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof Number) {
            return ((Number) value).doubleValue() != 0.0;
        }
        return Boolean.parseBoolean(String.valueOf(value));
    }
}
