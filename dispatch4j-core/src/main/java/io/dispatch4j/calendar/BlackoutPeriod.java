package io.dispatch4j.calendar;

import java.time.ZonedDateTime;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * A window in which scheduled execution is forbidden regardless of working hours.
 * <p>
 * Recurring blackouts repeat every year on the same calendar dates; a range whose start falls
 * after its end once moved into the checked year (e.g. Dec 20 to Jan 5) wraps around New Year.
 * An empty {@code affectedWorkflows} set applies to every workflow.
 */
public record BlackoutPeriod(
        String name,
        ZonedDateTime start,
        ZonedDateTime end,
        String reason,
        boolean recurring,
        Set<String> affectedWorkflows
) {
    public BlackoutPeriod {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(start, "start must not be null");
        Objects.requireNonNull(end, "end must not be null");
        if (!recurring && end.isBefore(start)) {
            throw new IllegalArgumentException("end must not be before start for blackout " + name);
        }
        reason = reason == null ? "" : reason;
        affectedWorkflows = affectedWorkflows == null ? Set.of() : Set.copyOf(affectedWorkflows);
    }

    public static BlackoutPeriod of(String name, ZonedDateTime start, ZonedDateTime end) {
        return new BlackoutPeriod(name, start, end, "", false, Set.of());
    }

    public static Builder builder(String name, ZonedDateTime start, ZonedDateTime end) {
        return new Builder(name, start, end);
    }

    /**
     * Returns true if the blackout covers {@code time} for {@code workflowId}.
     * A null workflow id is treated as matching workflow-scoped blackouts.
     */
    public boolean isActive(ZonedDateTime time, String workflowId) {
        if (!affectedWorkflows.isEmpty() && workflowId != null && !affectedWorkflows.contains(workflowId)) {
            return false;
        }

        if (recurring) {
            int year = time.withZoneSameInstant(start.getZone()).getYear();
            ZonedDateTime s = start.withYear(year);
            ZonedDateTime e = end.withYear(year);
            if (s.isAfter(e)) {
                return !time.isBefore(s) || !time.isAfter(e);
            }
            return !time.isBefore(s) && !time.isAfter(e);
        }

        return !time.isBefore(start) && !time.isAfter(end);
    }

    public boolean overlaps(ZonedDateTime from, ZonedDateTime to) {
        return start.isBefore(to) && end.isAfter(from);
    }

    public static final class Builder {
        private final String name;
        private final ZonedDateTime start;
        private final ZonedDateTime end;
        private String reason = "";
        private boolean recurring;
        private final Set<String> workflows = new LinkedHashSet<>();

        private Builder(String name, ZonedDateTime start, ZonedDateTime end) {
            this.name = name;
            this.start = start;
            this.end = end;
        }

        public Builder reason(String reason) {
            this.reason = reason;
            return this;
        }

        public Builder recurring(boolean recurring) {
            this.recurring = recurring;
            return this;
        }

        public Builder affects(String... workflowIds) {
            for (String id : workflowIds) {
                workflows.add(Objects.requireNonNull(id, "workflowId must not be null"));
            }
            return this;
        }

        public BlackoutPeriod build() {
            return new BlackoutPeriod(name, start, end, reason, recurring, workflows);
        }
    }
}
