package io.dispatch4j.calendar;

/**
 * Verdict of {@link BusinessCalendar#canExecute}. {@code reason} is null when allowed.
 */
public record CalendarDecision(boolean allowed, String reason) {

    private static final CalendarDecision ALLOWED = new CalendarDecision(true, null);

    public static CalendarDecision allow() {
        return ALLOWED;
    }

    public static CalendarDecision deny(String reason) {
        return new CalendarDecision(false, reason);
    }
}
