package io.dispatch4j.utils;

import java.time.LocalDate;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Parsed cron expression with next-fire-time computation.
 * <p>
 * Supported formats:
 * <ul>
 *   <li>5-field cron: {@code minute hour day-of-month month day-of-week}</li>
 *   <li>6-field cron: {@code second minute hour day-of-month month day-of-week}</li>
 *   <li>Aliases from {@link CronAliases}, e.g. {@code "@daily"} or {@code "hourly"}</li>
 * </ul>
 * <p>
 * Each field accepts {@code *}, {@code ?}, single values, ranges {@code a-b}, steps such as {@code 0/15}
 * or {@code 9-17/2}, and comma-separated lists. Months and weekdays accept three-letter names.
 * Day-of-week uses 0-7 where both 0 and 7 mean Sunday. Day-of-month accepts {@code L} (last day);
 * day-of-week accepts {@code nL} (last weekday n of the month) and {@code n#k} (k-th weekday n).
 * When both day-of-month and day-of-week are restricted, a day matches if either does.
 */
public final class CronExpression {

    private static final String[] MONTH_NAMES = {
            "JAN", "FEB", "MAR", "APR", "MAY", "JUN", "JUL", "AUG", "SEP", "OCT", "NOV", "DEC"
    };
    private static final String[] DAY_NAMES = {"SUN", "MON", "TUE", "WED", "THU", "FRI", "SAT"};

    // Bounded search horizon; leap-day expressions need up to 8 years.
    private static final int MAX_YEARS_AHEAD = 8;

    private final String expression;
    private final BitSet seconds;
    private final BitSet minutes;
    private final BitSet hours;
    private final BitSet daysOfMonth;
    private final BitSet months;
    private final BitSet daysOfWeek;
    private final boolean lastDayOfMonth;
    private final BitSet lastWeekdaysOfMonth;
    private final List<int[]> nthWeekdays;
    private final boolean dayOfMonthRestricted;
    private final boolean dayOfWeekRestricted;

    private CronExpression(String expression, String[] fields) {
        this.expression = expression;
        this.seconds = parseField(fields[0], 0, 59, null, "second");
        this.minutes = parseField(fields[1], 0, 59, null, "minute");
        this.hours = parseField(fields[2], 0, 23, null, "hour");
        this.months = parseField(fields[4], 1, 12, MONTH_NAMES, "month");

        String dom = fields[3].toUpperCase(Locale.ROOT);
        this.dayOfMonthRestricted = !isWildcard(dom);
        BitSet domBits = new BitSet(32);
        boolean last = false;
        for (String part : dom.split(",")) {
            if ("L".equals(part)) {
                last = true;
            } else {
                domBits.or(parseField(part, 1, 31, null, "day-of-month"));
            }
        }
        this.daysOfMonth = domBits;
        this.lastDayOfMonth = last;

        String dow = fields[5].toUpperCase(Locale.ROOT);
        this.dayOfWeekRestricted = !isWildcard(dow);
        BitSet dowBits = new BitSet(7);
        BitSet lastWeekdays = new BitSet(7);
        List<int[]> nth = new ArrayList<>();
        for (String part : dow.split(",")) {
            if (part.length() > 1 && part.endsWith("L")) {
                lastWeekdays.set(parseDayOfWeek(part.substring(0, part.length() - 1)));
            } else if (part.contains("#")) {
                String[] pair = part.split("#", -1);
                if (pair.length != 2) {
                    throw new IllegalArgumentException("Invalid day-of-week value: " + part);
                }
                int day = parseDayOfWeek(pair[0]);
                int occurrence = parseNumber(pair[1], "day-of-week occurrence");
                if (occurrence < 1 || occurrence > 5) {
                    throw new IllegalArgumentException("day-of-week occurrence must be 1-5: " + part);
                }
                nth.add(new int[]{day, occurrence});
            } else {
                BitSet raw = parseField(part, 0, 7, DAY_NAMES, "day-of-week");
                for (int i = raw.nextSetBit(0); i >= 0; i = raw.nextSetBit(i + 1)) {
                    dowBits.set(i % 7);
                }
            }
        }
        this.daysOfWeek = dowBits;
        this.lastWeekdaysOfMonth = lastWeekdays;
        this.nthWeekdays = List.copyOf(nth);
    }

    /**
     * Parse a cron expression or alias.
     *
     * @throws IllegalArgumentException if the expression is malformed
     */
    public static CronExpression parse(String spec) {
        String expanded = CronAliases.expand(spec);
        if (expanded.isEmpty()) {
            throw new IllegalArgumentException("cron expression must not be empty");
        }
        String[] parts = expanded.split("\\s+");
        String[] fields;
        if (parts.length == 5) {
            fields = new String[]{"0", parts[0], parts[1], parts[2], parts[3], parts[4]};
        } else if (parts.length == 6) {
            fields = parts;
        } else {
            throw new IllegalArgumentException(
                    "Invalid cron expression: " + spec + ". Expected 5 or 6 fields, got " + parts.length);
        }
        return new CronExpression(expanded, fields);
    }

    public static boolean isValid(String spec) {
        try {
            parse(spec);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    /**
     * Returns the expanded expression (aliases already resolved).
     */
    public String expression() {
        return expression;
    }

    /**
     * Next fire time strictly after {@code after}, in the same zone, or {@code null} if none exists
     * within the search horizon (e.g. {@code 0 0 30 2 *}).
     */
    public ZonedDateTime nextAfter(ZonedDateTime after) {
        Objects.requireNonNull(after, "after must not be null");
        ZonedDateTime t = after.truncatedTo(ChronoUnit.SECONDS).plusSeconds(1);
        ZonedDateTime limit = after.plusYears(MAX_YEARS_AHEAD);

        while (t.isBefore(limit)) {
            if (!months.get(t.getMonthValue())) {
                t = t.withDayOfMonth(1).truncatedTo(ChronoUnit.DAYS).plusMonths(1);
                continue;
            }
            if (!matchesDay(t.toLocalDate())) {
                t = t.truncatedTo(ChronoUnit.DAYS).plusDays(1);
                continue;
            }
            int hour = hours.nextSetBit(t.getHour());
            if (hour < 0) {
                t = t.truncatedTo(ChronoUnit.DAYS).plusDays(1);
                continue;
            }
            if (hour != t.getHour()) {
                t = t.truncatedTo(ChronoUnit.DAYS).withHour(hour);
                continue;
            }
            int minute = minutes.nextSetBit(t.getMinute());
            if (minute < 0) {
                t = t.truncatedTo(ChronoUnit.HOURS).plusHours(1);
                continue;
            }
            if (minute != t.getMinute()) {
                t = t.truncatedTo(ChronoUnit.HOURS).withMinute(minute);
                continue;
            }
            int second = seconds.nextSetBit(t.getSecond());
            if (second < 0) {
                t = t.truncatedTo(ChronoUnit.MINUTES).plusMinutes(1);
                continue;
            }
            return t.withSecond(second);
        }
        return null;
    }

    /**
     * Returns true if {@code date} is a firing day (ignoring the time-of-day fields).
     */
    public boolean matchesDay(LocalDate date) {
        if (!months.get(date.getMonthValue())) {
            return false;
        }
        boolean domMatch = daysOfMonth.get(date.getDayOfMonth())
                || (lastDayOfMonth && date.getDayOfMonth() == date.lengthOfMonth());
        int dow = date.getDayOfWeek().getValue() % 7;
        boolean dowMatch = daysOfWeek.get(dow)
                || (lastWeekdaysOfMonth.get(dow) && date.getDayOfMonth() + 7 > date.lengthOfMonth())
                || matchesNth(dow, date.getDayOfMonth());

        if (dayOfMonthRestricted && dayOfWeekRestricted) {
            return domMatch || dowMatch;
        }
        if (dayOfMonthRestricted) {
            return domMatch;
        }
        if (dayOfWeekRestricted) {
            return dowMatch;
        }
        return true;
    }

    private boolean matchesNth(int dow, int dayOfMonth) {
        for (int[] rule : nthWeekdays) {
            if (rule[0] == dow && (dayOfMonth - 1) / 7 + 1 == rule[1]) {
                return true;
            }
        }
        return false;
    }

    /**
     * Human-readable description, e.g. "At 9:00 on weekdays".
     */
    public String describe() {
        String alias = CronAliases.aliasFor(expression);
        if (alias != null) {
            return CronAliases.describe(alias);
        }
        String[] parts = expression.split("\\s+");
        int offset = parts.length == 6 ? 1 : 0;
        String minute = parts[offset];
        String hour = parts[offset + 1];
        String day = parts[offset + 2];
        String month = parts[offset + 3];
        String dow = parts[offset + 4];

        StringBuilder sb = new StringBuilder();
        if ("*".equals(minute) && "*".equals(hour)) {
            sb.append("Every minute");
        } else if (minute.startsWith("*/")) {
            sb.append("Every ").append(minute.substring(2)).append(" minutes");
        } else if ("*".equals(hour)) {
            sb.append("At minute ").append(minute).append(" every hour");
        } else if (hour.startsWith("*/")) {
            sb.append("Every ").append(hour.substring(2)).append(" hours at minute ").append(minute);
        } else {
            sb.append("At ").append(hour).append(':').append(minute.length() == 1 ? "0" + minute : minute);
        }

        if (!isWildcard(day)) {
            sb.append("L".equalsIgnoreCase(day) ? " on the last day of the month" : " on day " + day);
        }
        if (!isWildcard(month)) {
            sb.append(" in month ").append(month);
        }
        if (!isWildcard(dow)) {
            if ("1-5".equals(dow)) {
                sb.append(" on weekdays");
            } else if ("0,6".equals(dow) || "6,0".equals(dow)) {
                sb.append(" on weekends");
            } else {
                sb.append(" on day-of-week ").append(dow);
            }
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return expression;
    }

    /* ================= field parsing ================= */

    private static boolean isWildcard(String field) {
        return "*".equals(field) || "?".equals(field);
    }

    private static BitSet parseField(String field, int min, int max, String[] names, String label) {
        BitSet bits = new BitSet(max + 1);
        for (String part : field.toUpperCase(Locale.ROOT).split(",")) {
            if (part.isEmpty()) {
                throw new IllegalArgumentException("Empty " + label + " value in: " + field);
            }
            String range = part;
            int step = 1;
            int slash = part.indexOf('/');
            if (slash >= 0) {
                range = part.substring(0, slash);
                step = parseNumber(part.substring(slash + 1), label + " step");
                if (step <= 0) {
                    throw new IllegalArgumentException(label + " step must be positive: " + part);
                }
            }

            int start;
            int end;
            if (isWildcard(range)) {
                start = min;
                end = max;
            } else if (range.indexOf('-') > 0) {
                String[] bounds = range.split("-", -1);
                if (bounds.length != 2) {
                    throw new IllegalArgumentException("Invalid " + label + " range: " + part);
                }
                start = parseValue(bounds[0], names, min, label);
                end = parseValue(bounds[1], names, min, label);
            } else {
                start = parseValue(range, names, min, label);
                end = slash >= 0 ? max : start;
            }

            if (start < min || end > max || start > end) {
                throw new IllegalArgumentException(
                        label + " value out of range [" + min + "-" + max + "]: " + part);
            }
            for (int v = start; v <= end; v += step) {
                bits.set(v);
            }
        }
        return bits;
    }

    private static int parseValue(String token, String[] names, int min, String label) {
        if (names != null) {
            for (int i = 0; i < names.length; i++) {
                if (names[i].equals(token)) {
                    return i + min;
                }
            }
        }
        return parseNumber(token, label);
    }

    private static int parseDayOfWeek(String token) {
        int v = parseValue(token.trim(), DAY_NAMES, 0, "day-of-week");
        if (v < 0 || v > 7) {
            throw new IllegalArgumentException("day-of-week value out of range [0-7]: " + token);
        }
        return v % 7;
    }

    private static int parseNumber(String token, String label) {
        try {
            return Integer.parseInt(token.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid " + label + " value: " + token);
        }
    }
}
