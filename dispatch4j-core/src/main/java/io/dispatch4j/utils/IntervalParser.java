package io.dispatch4j.utils;

import java.time.Duration;
import java.util.HashSet;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses interval specs for INTERVAL schedules into {@link Duration}.
 * <p>
 * Supported formats:
 * <ul>
 *   <li>Plain seconds: "300"</li>
 *   <li>Compact units: "30s", "5m", "2h", "1d", "1w"</li>
 *   <li>Human-readable pairs: "5 minutes", "1 day 3 hours"</li>
 * </ul>
 */
public final class IntervalParser {
    private static final Pattern COMPACT = Pattern.compile("^(\\d+)\\s*([smhdw])$");
    private static final Pattern PAIR = Pattern.compile("(\\d+)\\s+([a-z]+)");

    private IntervalParser() {
    }

    /**
     * Parse an interval spec into a strictly positive duration.
     *
     * @throws IllegalArgumentException if the spec is blank, malformed or not positive
     */
    public static Duration parse(String spec) {
        Objects.requireNonNull(spec, "spec must not be null");
        String s = spec.trim().toLowerCase(Locale.ROOT);
        if (s.isEmpty()) {
            throw new IllegalArgumentException("Interval string must not be empty");
        }

        Duration result;
        if (s.matches("^\\d+$")) {
            result = Duration.ofSeconds(parseCount(s, spec));
        } else {
            Matcher compact = COMPACT.matcher(s);
            result = compact.matches()
                    ? unit(compact.group(2), parseCount(compact.group(1), spec))
                    : parsePairs(s, spec);
        }

        if (result.isZero() || result.isNegative()) {
            throw new IllegalArgumentException("Interval must be positive: " + spec);
        }
        return result;
    }

    /**
     * Convenience: parse and return whole seconds.
     */
    public static long parseSeconds(String spec) {
        return parse(spec).toSeconds();
    }

    private static Duration parsePairs(String s, String original) {
        Matcher m = PAIR.matcher(s);
        Set<String> seen = new HashSet<>();
        Duration total = Duration.ZERO;
        int consumed = 0;
        while (m.find()) {
            if (!s.substring(consumed, m.start()).isBlank()) {
                throw new IllegalArgumentException("Invalid interval format. Expected pairs like '3 minutes': " + original);
            }
            String name = m.group(2).endsWith("s") ? m.group(2).substring(0, m.group(2).length() - 1) : m.group(2);
            if (!seen.add(name)) {
                throw new IllegalArgumentException("Duplicate unit: " + name);
            }
            total = total.plus(named(name, parseCount(m.group(1), original), m.group(2)));
            consumed = m.end();
        }
        if (consumed == 0 || !s.substring(consumed).isBlank()) {
            throw new IllegalArgumentException("Invalid interval format. Expected pairs like '3 minutes': " + original);
        }
        return total;
    }

    private static Duration named(String unit, long n, String raw) {
        return switch (unit) {
            case "week" -> Duration.ofDays(7L * n);
            case "day" -> Duration.ofDays(n);
            case "hour" -> Duration.ofHours(n);
            case "minute", "min" -> Duration.ofMinutes(n);
            case "second", "sec" -> Duration.ofSeconds(n);
            default -> throw new IllegalArgumentException("Unsupported interval unit: " + raw);
        };
    }

    private static Duration unit(String u, long n) {
        return switch (u.charAt(0)) {
            case 's' -> Duration.ofSeconds(n);
            case 'm' -> Duration.ofMinutes(n);
            case 'h' -> Duration.ofHours(n);
            case 'd' -> Duration.ofDays(n);
            case 'w' -> Duration.ofDays(7L * n);
            default -> throw new IllegalArgumentException("Unsupported compact unit: " + u);
        };
    }

    private static long parseCount(String digits, String original) {
        try {
            return Long.parseLong(digits);
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Interval value out of range: " + original);
        }
    }
}
