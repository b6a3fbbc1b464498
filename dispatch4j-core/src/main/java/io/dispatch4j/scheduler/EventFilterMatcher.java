package io.dispatch4j.scheduler;

import java.util.Collection;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Matches event payloads against a filter. Each filter key must be present in the payload and
 * either equal the expected value or satisfy every operator of an operator map:
 * {@code $eq $ne $gt $lt $in $regex}. Numbers compare by value regardless of their boxed type.
 */
public final class EventFilterMatcher {

    private EventFilterMatcher() {
    }

    public static boolean matches(Map<String, Object> eventData, Map<String, Object> filter) {
        if (filter == null || filter.isEmpty()) {
            return true;
        }
        if (eventData == null) {
            return false;
        }
        for (var entry : filter.entrySet()) {
            if (!eventData.containsKey(entry.getKey())) {
                return false;
            }
            Object actual = eventData.get(entry.getKey());
            Object expected = entry.getValue();
            if (expected instanceof Map<?, ?> ops) {
                if (!matchesOperators(actual, ops)) {
                    return false;
                }
            } else if (!looselyEquals(actual, expected)) {
                return false;
            }
        }
        return true;
    }

    private static boolean matchesOperators(Object actual, Map<?, ?> ops) {
        if (ops.containsKey("$eq") && !looselyEquals(actual, ops.get("$eq"))) {
            return false;
        }
        if (ops.containsKey("$ne") && looselyEquals(actual, ops.get("$ne"))) {
            return false;
        }
        if (ops.containsKey("$gt") && !(compare(actual, ops.get("$gt")) > 0)) {
            return false;
        }
        if (ops.containsKey("$lt") && !(compare(actual, ops.get("$lt")) < 0)) {
            return false;
        }
        if (ops.containsKey("$in")) {
            if (!(ops.get("$in") instanceof Collection<?> options) || options.stream().noneMatch(o -> looselyEquals(actual, o))) {
                return false;
            }
        }
        if (ops.containsKey("$regex")) {
            try {
                // anchored at the start, not the end
                if (!Pattern.compile(String.valueOf(ops.get("$regex"))).matcher(String.valueOf(actual)).lookingAt()) {
                    return false;
                }
            } catch (PatternSyntaxException e) {
                return false;
            }
        }
        return true;
    }

    private static boolean looselyEquals(Object a, Object b) {
        if (a instanceof Number x && b instanceof Number y) {
            return Double.compare(x.doubleValue(), y.doubleValue()) == 0;
        }
        return Objects.equals(a, b);
    }

    // Incomparable values return 0 so they fail both $gt and $lt.
    @SuppressWarnings({"unchecked", "rawtypes"})
    private static int compare(Object actual, Object bound) {
        if (actual instanceof Number x && bound instanceof Number y) {
            double dx = x.doubleValue();
            double dy = y.doubleValue();
            if (Double.isNaN(dx) || Double.isNaN(dy)) {
                return 0;
            }
            return Double.compare(dx, dy);
        }
        if (actual instanceof Comparable c && bound != null && actual.getClass().isInstance(bound)) {
            return Integer.signum(c.compareTo(bound));
        }
        return 0;
    }
}
