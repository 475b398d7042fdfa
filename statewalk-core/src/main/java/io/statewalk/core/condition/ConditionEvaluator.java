package io.statewalk.core.condition;

import io.statewalk.core.context.SharedAttributeStore;
import java.math.BigDecimal;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/// Evaluates edge conditions against the shared attribute store.
///
/// A bare reference such as `retries` resolves to an attribute of the node the condition
/// is evaluated for; a qualified reference such as `config.retries` resolves to the
/// attribute `retries` of node `config`. Further parts navigate into map values.
///
/// ### Undecidable conditions
/// A reference to an attribute that is not set never coerces to false. The comparison
/// that needs it becomes undecidable, and so does the whole expression unless a definite
/// side of `&&` or `||` already decides it. Malformed expressions are undecidable too.
///
/// ### Usage
/// {@snippet :
/// ConditionResult result = evaluator.evaluate("ctx.count >= 3 && ready", "worker", store);
/// if (!result.isDecidable()) {
///     // hand the decision to an agent
/// }
/// }
///
/// @implNote Thread-safe. Parsed expressions are cached per source text.
public class ConditionEvaluator {

    private static final Object UNDECIDED = new Object();

    private final Map<String, Object> cache = new ConcurrentHashMap<>();

    /// Evaluates a condition.
    ///
    /// @param condition expression text, not null
    /// @param nodeName node that bare references resolve against, not null
    /// @param store current attribute values, not null
    /// @return tri-state result, never null
    public ConditionResult evaluate(String condition, String nodeName, SharedAttributeStore store) {
        Objects.requireNonNull(condition, "condition must not be null");
        Objects.requireNonNull(nodeName, "nodeName must not be null");
        Objects.requireNonNull(store, "store must not be null");

        Object parsed = parseCached(condition);
        if (parsed instanceof ConditionParseException e) {
            return new ConditionResult(ConditionResult.Outcome.UNDECIDABLE, Set.of(), e.getMessage());
        }

        Set<String> missing = new LinkedHashSet<>();
        Object value = eval((Expression) parsed, nodeName, store, missing);
        if (value == UNDECIDED) {
            return new ConditionResult(ConditionResult.Outcome.UNDECIDABLE, missing, null);
        }
        return new ConditionResult(
                truthy(value) ? ConditionResult.Outcome.TRUE : ConditionResult.Outcome.FALSE,
                missing,
                null);
    }

    /// Returns the qualified attribute paths a condition reads.
    ///
    /// @param condition expression text, not null
    /// @param nodeName node that bare references resolve against, not null
    /// @return qualified paths in order of appearance; empty for malformed expressions
    public Set<String> references(String condition, String nodeName) {
        Object parsed = parseCached(condition);
        Set<String> result = new LinkedHashSet<>();
        if (parsed instanceof Expression expression) {
            collectReferences(expression, nodeName, result);
        }
        return result;
    }

    private Object parseCached(String condition) {
        return cache.computeIfAbsent(
                condition,
                text -> {
                    try {
                        return ConditionParser.parse(text);
                    } catch (ConditionParseException e) {
                        return e;
                    }
                });
    }

    private Object eval(
            Expression expression, String nodeName, SharedAttributeStore store, Set<String> missing) {
        if (expression instanceof Expression.Literal literal) {
            return literal.value();
        }
        if (expression instanceof Expression.Reference reference) {
            return resolve(reference, nodeName, store, missing);
        }
        if (expression instanceof Expression.Not not) {
            Object operand = eval(not.operand(), nodeName, store, missing);
            return operand == UNDECIDED ? UNDECIDED : !truthy(operand);
        }
        Expression.Binary binary = (Expression.Binary) expression;
        Object left = eval(binary.left(), nodeName, store, missing);
        switch (binary.operator()) {
            case AND:
                if (left != UNDECIDED && !truthy(left)) {
                    return false;
                }
                Object andRight = eval(binary.right(), nodeName, store, missing);
                if (andRight != UNDECIDED && !truthy(andRight)) {
                    return false;
                }
                return left == UNDECIDED || andRight == UNDECIDED ? UNDECIDED : true;
            case OR:
                if (left != UNDECIDED && truthy(left)) {
                    return true;
                }
                Object orRight = eval(binary.right(), nodeName, store, missing);
                if (orRight != UNDECIDED && truthy(orRight)) {
                    return true;
                }
                return left == UNDECIDED || orRight == UNDECIDED ? UNDECIDED : false;
            default:
                Object right = eval(binary.right(), nodeName, store, missing);
                if (left == UNDECIDED || right == UNDECIDED) {
                    return UNDECIDED;
                }
                return compare(binary.operator(), left, right);
        }
    }

    private static Object resolve(
            Expression.Reference reference,
            String nodeName,
            SharedAttributeStore store,
            Set<String> missing) {
        List<String> parts = reference.parts();
        String path = qualified(reference, nodeName);
        Optional<Object> value = store.get(path);
        if (value.isEmpty()) {
            missing.add(path);
            return UNDECIDED;
        }
        Object current = value.get();
        for (int i = 2; i < parts.size(); i++) {
            if (!(current instanceof Map<?, ?> map) || !map.containsKey(parts.get(i))) {
                missing.add(reference.text());
                return UNDECIDED;
            }
            current = map.get(parts.get(i));
        }
        return current;
    }

    private static String qualified(Expression.Reference reference, String nodeName) {
        List<String> parts = reference.parts();
        return reference.isBare()
                ? SharedAttributeStore.qualify(nodeName, parts.get(0))
                : SharedAttributeStore.qualify(parts.get(0), parts.get(1));
    }

    private static void collectReferences(Expression expression, String nodeName, Set<String> out) {
        if (expression instanceof Expression.Reference reference) {
            out.add(qualified(reference, nodeName));
        } else if (expression instanceof Expression.Not not) {
            collectReferences(not.operand(), nodeName, out);
        } else if (expression instanceof Expression.Binary binary) {
            collectReferences(binary.left(), nodeName, out);
            collectReferences(binary.right(), nodeName, out);
        }
    }

    private static boolean compare(Expression.Operator operator, Object left, Object right) {
        switch (operator) {
            case EQ:
                return looselyEqual(left, right);
            case NE:
                return !looselyEqual(left, right);
            default:
                break;
        }
        BigDecimal leftNumber = asNumber(left);
        BigDecimal rightNumber = asNumber(right);
        int order;
        if (leftNumber != null && rightNumber != null) {
            order = leftNumber.compareTo(rightNumber);
        } else if (left instanceof String l && right instanceof String r) {
            order = l.compareTo(r);
        } else {
            return false;
        }
        return switch (operator) {
            case LT -> order < 0;
            case LE -> order <= 0;
            case GT -> order > 0;
            case GE -> order >= 0;
            default -> false;
        };
    }

    private static boolean looselyEqual(Object left, Object right) {
        if (left == null || right == null) {
            return left == right;
        }
        BigDecimal leftNumber = asNumber(left);
        BigDecimal rightNumber = asNumber(right);
        if (leftNumber != null && rightNumber != null) {
            return leftNumber.compareTo(rightNumber) == 0;
        }
        if (left instanceof Boolean || right instanceof Boolean) {
            return String.valueOf(left).equalsIgnoreCase(String.valueOf(right));
        }
        return String.valueOf(left).equals(String.valueOf(right));
    }

    private static BigDecimal asNumber(Object value) {
        if (value instanceof BigDecimal decimal) {
            return decimal;
        }
        String text;
        if (value instanceof Number number) {
            text = number.toString();
        } else if (value instanceof String string && !string.isBlank()) {
            text = string.trim();
        } else {
            return null;
        }
        try {
            return new BigDecimal(text);
        } catch (NumberFormatException e) {
            // not numeric (including NaN and infinities)
            return null;
        }
    }

    static boolean truthy(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof String s) {
            return !s.isEmpty() && !"false".equalsIgnoreCase(s);
        }
        BigDecimal number = asNumber(value);
        if (number != null) {
            return number.signum() != 0;
        }
        return true;
    }
}
