package io.dispatch4j.utils;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Human-readable cron aliases and their 5-field expansions.
 * <p>
 * Lookups are case-insensitive and accept the alias with or without the leading {@code @},
 * so {@code "@daily"}, {@code "daily"} and {@code "DAILY"} all resolve to {@code "0 0 * * *"}.
 */
public final class CronAliases {
    private static final Map<String, String> EXPRESSIONS = new LinkedHashMap<>();
    private static final Map<String, String> DESCRIPTIONS = new LinkedHashMap<>();

    static {
        register("@yearly", "0 0 1 1 *", "Once a year at midnight on January 1st");
        register("@annually", "0 0 1 1 *", "Once a year at midnight on January 1st");
        register("@monthly", "0 0 1 * *", "Once a month at midnight on the 1st");
        register("@weekly", "0 0 * * 0", "Once a week at midnight on Sunday");
        register("@daily", "0 0 * * *", "Once a day at midnight");
        register("@midnight", "0 0 * * *", "Once a day at midnight");
        register("@hourly", "0 * * * *", "Once every hour");
        register("@every_minute", "* * * * *", "Every minute");
        register("@every_5_minutes", "*/5 * * * *", "Every 5 minutes");
        register("@every_10_minutes", "*/10 * * * *", "Every 10 minutes");
        register("@every_15_minutes", "*/15 * * * *", "Every 15 minutes");
        register("@every_30_minutes", "*/30 * * * *", "Every 30 minutes");
        register("@business_hours", "0 9-17 * * 1-5", "Every hour during business hours (9-17) on weekdays");
        register("@weekdays", "0 9 * * 1-5", "At 9 AM on weekdays");
        register("@weekends", "0 9 * * 0,6", "At 9 AM on weekends");
        register("@end_of_month", "0 0 L * *", "At midnight on the last day of the month");
        register("@first_monday", "0 0 * * 1#1", "At midnight on the first Monday of the month");
        register("@last_friday", "0 17 * * 5L", "At 5 PM on the last Friday of the month");
    }

    private CronAliases() {
    }

    private static void register(String alias, String expression, String description) {
        EXPRESSIONS.put(alias, expression);
        DESCRIPTIONS.put(alias, description);
    }

    /**
     * Returns true if {@code spec} names a known alias.
     */
    public static boolean isAlias(String spec) {
        return spec != null && EXPRESSIONS.containsKey(key(spec));
    }

    /**
     * Resolve {@code spec} to a cron expression. Non-alias input is returned trimmed.
     *
     * @throws IllegalArgumentException if {@code spec} starts with {@code @} but is not a known alias
     */
    public static String expand(String spec) {
        if (spec == null) {
            throw new IllegalArgumentException("spec must not be null");
        }
        String s = spec.trim();
        String expanded = EXPRESSIONS.get(key(s));
        if (expanded != null) {
            return expanded;
        }
        if (s.startsWith("@")) {
            throw new IllegalArgumentException("Unknown cron alias: " + s);
        }
        return s;
    }

    public static String describe(String alias) {
        return DESCRIPTIONS.get(key(alias));
    }

    /**
     * Find the alias whose expansion equals {@code expression}, preferring the first registered one.
     */
    public static String aliasFor(String expression) {
        if (expression == null) {
            return null;
        }
        String normalized = expression.trim().replaceAll("\\s+", " ");
        for (var e : EXPRESSIONS.entrySet()) {
            if (e.getValue().equals(normalized)) {
                return e.getKey();
            }
        }
        return null;
    }

    public static Map<String, String> all() {
        return Collections.unmodifiableMap(EXPRESSIONS);
    }

    private static String key(String spec) {
        String s = spec.trim().toLowerCase(Locale.ROOT);
        return s.startsWith("@") ? s : "@" + s;
    }
}
