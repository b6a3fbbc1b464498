package io.dispatch4j.scheduler;

import io.dispatch4j.ScheduleBuilder;
import io.dispatch4j.core.CatchUpConfig;
import io.dispatch4j.core.ConditionalConfig;
import io.dispatch4j.core.DependencyConfig;
import io.dispatch4j.core.EventTriggerConfig;
import io.dispatch4j.core.Priority;
import io.dispatch4j.core.RateLimitConfig;
import io.dispatch4j.core.Schedule;
import io.dispatch4j.core.ScheduleType;
import io.dispatch4j.core.SlaConfig;
import io.dispatch4j.utils.IntervalParser;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Default {@link ScheduleBuilder} implementation.
 */
public class SimpleScheduleBuilder implements ScheduleBuilder {

    private final String id;
    private final String name;
    private final String workflowId;
    private final Predicate<Schedule> persister;

    private String workflowName;
    private ScheduleType type = ScheduleType.CRON;
    private boolean enabled = true;

    private String timezone = "UTC";
    private String cronExpression;
    private Duration interval;
    private Instant runAt;
    private EventTriggerConfig eventTrigger;

    private String calendarId;
    private boolean respectBusinessHours;
    private RateLimitConfig rateLimit;
    private DependencyConfig dependency;
    private ConditionalConfig conditional;

    private SlaConfig sla;
    private CatchUpConfig catchUp;

    private int priority = Priority.NORMAL.value();
    private int maxInstances = 3;
    private String robotId;
    private Map<String, Object> variables = Map.of();
    private List<String> tags = List.of();
    private Map<String, Object> metadata = Map.of();
    private String createdBy = "";

    /**
     * Builder not bound to a scheduler; {@link #save()} is unsupported.
     */
    public SimpleScheduleBuilder(String id, String name, String workflowId) {
        this(id, name, workflowId, s -> {
            throw new IllegalStateException("builder is not bound to a scheduler");
        });
    }

    public SimpleScheduleBuilder(String id, String name, String workflowId, Predicate<Schedule> persister) {
        this.id = Objects.requireNonNull(id, "schedule id must not be null");
        this.name = Objects.requireNonNull(name, "schedule name must not be null");
        this.workflowId = Objects.requireNonNull(workflowId, "workflowId must not be null");
        this.persister = Objects.requireNonNull(persister, "persister must not be null");
        if (id.isBlank()) throw new IllegalArgumentException("schedule id must not be blank");
    }

    /**
     * Start from an existing definition, e.g. to change one field before {@code updateSchedule}.
     */
    public static SimpleScheduleBuilder from(Schedule s) {
        SimpleScheduleBuilder b = new SimpleScheduleBuilder(s.id(), s.name(), s.workflowId());
        b.workflowName = s.workflowName();
        b.type = s.type();
        b.enabled = s.enabled();
        b.timezone = s.timezone();
        b.cronExpression = s.cronExpression();
        b.interval = s.interval();
        b.runAt = s.runAt();
        b.eventTrigger = s.eventTrigger();
        b.calendarId = s.calendarId();
        b.respectBusinessHours = s.respectBusinessHours();
        b.rateLimit = s.rateLimit();
        b.dependency = s.dependency();
        b.conditional = s.conditional();
        b.sla = s.sla();
        b.catchUp = s.catchUp();
        b.priority = s.priority();
        b.maxInstances = s.maxInstances();
        b.robotId = s.robotId();
        b.variables = s.variables();
        b.tags = s.tags();
        b.metadata = s.metadata();
        b.createdBy = s.createdBy();
        return b;
    }

    @Override
    public ScheduleBuilder workflowName(String workflowName) {
        this.workflowName = workflowName;
        return this;
    }

    @Override
    public ScheduleBuilder cron(String expression) {
        Objects.requireNonNull(expression, "expression must not be null");
        this.type = ScheduleType.CRON;
        this.cronExpression = expression;
        return this;
    }

    @Override
    public ScheduleBuilder every(String interval) {
        return every(IntervalParser.parse(interval));
    }

    @Override
    public ScheduleBuilder every(Duration interval) {
        Objects.requireNonNull(interval, "interval must not be null");
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("interval must be a positive duration");
        }
        this.type = ScheduleType.INTERVAL;
        this.interval = interval;
        return this;
    }

    @Override
    public ScheduleBuilder every(Number seconds) {
        Objects.requireNonNull(seconds, "interval must not be null");
        double asDouble = seconds.doubleValue();
        if (asDouble <= 0) {
            throw new IllegalArgumentException("interval must be a positive number of seconds");
        }
        if (asDouble % 1 != 0) {
            throw new IllegalArgumentException("interval must be an integer number of seconds");
        }
        return every(Duration.ofSeconds(seconds.longValue()));
    }

    @Override
    public ScheduleBuilder at(Instant time) {
        Objects.requireNonNull(time, "time must not be null");
        this.type = ScheduleType.ONE_TIME;
        this.runAt = time;
        return this;
    }

    @Override
    public ScheduleBuilder onEvent(EventTriggerConfig eventTrigger) {
        this.eventTrigger = Objects.requireNonNull(eventTrigger, "eventTrigger must not be null");
        this.type = ScheduleType.EVENT;
        return this;
    }

    @Override
    public ScheduleBuilder afterCompletionOf(DependencyConfig dependency) {
        this.dependency = Objects.requireNonNull(dependency, "dependency must not be null");
        this.type = ScheduleType.DEPENDENCY;
        return this;
    }

    @Override
    public ScheduleBuilder dependency(DependencyConfig dependency) {
        this.dependency = dependency;
        return this;
    }

    @Override
    public ScheduleBuilder timezone(String timezone) {
        Objects.requireNonNull(timezone, "timezone must not be null");
        ZoneId.of(timezone);
        this.timezone = timezone;
        return this;
    }

    @Override
    public ScheduleBuilder businessCalendar(String calendarId) {
        this.calendarId = calendarId;
        this.respectBusinessHours = calendarId != null;
        return this;
    }

    @Override
    public ScheduleBuilder sla(SlaConfig sla) {
        this.sla = sla;
        return this;
    }

    @Override
    public ScheduleBuilder rateLimit(RateLimitConfig rateLimit) {
        this.rateLimit = rateLimit;
        return this;
    }

    @Override
    public ScheduleBuilder conditional(ConditionalConfig conditional) {
        this.conditional = conditional;
        return this;
    }

    @Override
    public ScheduleBuilder catchUp(CatchUpConfig catchUp) {
        this.catchUp = catchUp;
        return this;
    }

    @Override
    public ScheduleBuilder priority(Priority priority) {
        Objects.requireNonNull(priority, "priority must not be null");
        this.priority = priority.value();
        return this;
    }

    @Override
    public ScheduleBuilder priority(int priority) {
        this.priority = priority;
        return this;
    }

    @Override
    public ScheduleBuilder maxInstances(int maxInstances) {
        if (maxInstances <= 0) {
            throw new IllegalArgumentException("maxInstances must be a positive number");
        }
        this.maxInstances = maxInstances;
        return this;
    }

    @Override
    public ScheduleBuilder robotId(String robotId) {
        this.robotId = robotId;
        return this;
    }

    @Override
    public ScheduleBuilder variables(Map<String, Object> variables) {
        this.variables = variables == null ? Map.of() : new LinkedHashMap<>(variables);
        return this;
    }

    @Override
    public ScheduleBuilder tags(List<String> tags) {
        this.tags = tags == null ? List.of() : List.copyOf(tags);
        return this;
    }

    @Override
    public ScheduleBuilder metadata(Map<String, Object> metadata) {
        this.metadata = metadata == null ? Map.of() : new LinkedHashMap<>(metadata);
        return this;
    }

    @Override
    public ScheduleBuilder createdBy(String createdBy) {
        this.createdBy = createdBy;
        return this;
    }

    @Override
    public ScheduleBuilder enabled(boolean enabled) {
        this.enabled = enabled;
        return this;
    }

    @Override
    public Schedule build() {
        return new Schedule(
                id,
                name,
                workflowId,
                workflowName,
                type,
                enabled,
                timezone,
                cronExpression,
                interval,
                runAt,
                eventTrigger,
                calendarId,
                respectBusinessHours,
                rateLimit,
                dependency,
                conditional,
                sla,
                catchUp,
                priority,
                maxInstances,
                robotId,
                variables,
                tags,
                metadata,
                createdBy
        );
    }

    @Override
    public boolean save() {
        return persister.test(build());
    }
}
