package io.dispatch4j.scheduler;

import io.dispatch4j.FleetScheduler;
import io.dispatch4j.ScheduleBuilder;
import io.dispatch4j.ScheduleTrigger;
import io.dispatch4j.TriggerContext;
import io.dispatch4j.calendar.BusinessCalendar;
import io.dispatch4j.calendar.CalendarDecision;
import io.dispatch4j.config.SchedulerProperties;
import io.dispatch4j.core.CatchUpConfig;
import io.dispatch4j.core.ConditionalConfig;
import io.dispatch4j.core.DependencyConfig;
import io.dispatch4j.core.EventTriggerConfig;
import io.dispatch4j.core.EventType;
import io.dispatch4j.core.Schedule;
import io.dispatch4j.core.ScheduleInfo;
import io.dispatch4j.core.ScheduleStatus;
import io.dispatch4j.core.ScheduleStore;
import io.dispatch4j.core.ScheduleType;
import io.dispatch4j.core.SlaBreachHandler;
import io.dispatch4j.core.SlaConfig;
import io.dispatch4j.core.SlaStatus;
import io.dispatch4j.utils.CronExpression;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-process {@link FleetScheduler}.
 *
 * <p>One timer thread arms the next fire time of every active timed schedule; each tick is handed
 * to the worker pool, which runs the gate pipeline:
 * <ol>
 *   <li>status must be ACTIVE</li>
 *   <li>rate limit (skip, or wait for a free slot when the limit queues overflow)</li>
 *   <li>business calendar, when the schedule respects business hours</li>
 *   <li>condition, with optional retries</li>
 *   <li>dependencies, for non-DEPENDENCY schedules that declare them</li>
 * </ol>
 * A run that passes every gate invokes the {@link ScheduleTrigger}. Failures are counted and logged,
 * never rethrown.
 *
 * <p>Typical usage:
 * <pre>{@code
 * scheduler.create("nightly-invoices", "Nightly invoices", "wf-invoices")
 *          .cron("0 2 * * *")
 *          .timezone("Europe/London")
 *          .businessCalendar("uk")
 *          .save();
 * scheduler.start();
 * }</pre>
 *
 * <p>Without {@link #start()}, event and dependency runs execute on the calling thread.
 */
public class DefaultFleetScheduler implements FleetScheduler {
    private static final Logger log = LoggerFactory.getLogger(DefaultFleetScheduler.class);

    private final SchedulerProperties props;
    private final ScheduleTrigger callback;
    private final ScheduleStore store;
    private final Clock clock;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private ScheduledExecutorService timer;
    private ExecutorService workerPool;

    private final ConcurrentSkipListMap<String, Entry> entries = new ConcurrentSkipListMap<>();
    private final ConcurrentHashMap<String, ScheduledFuture<?>> timers = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, InstanceLimit> instanceSem = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, SlidingWindowRateLimiter> rateLimiters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Instant> lastEventAt = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, BusinessCalendar> calendars = new ConcurrentHashMap<>();

    private final ReentrantLock registryLock = new ReentrantLock();
    private final ReentrantLock completionLock = new ReentrantLock();

    private final DependencyTracker dependencyTracker;
    private final SlaMonitor slaMonitor;

    /**
     * Mutable runtime state of one schedule. Callers only ever see {@link ScheduleInfo} snapshots.
     */
    private static final class Entry {
        private Schedule schedule;
        private Trigger trigger;
        private ScheduleStatus status;
        private Instant lastRun;
        private Instant nextRun;
        private long runCount;
        private long successCount;
        private long failureCount;
        private int consecutiveFailures;
        private final Instant createdAt;
        private Instant updatedAt;

        private Entry(ScheduleInfo info, Trigger trigger) {
            this.schedule = info.schedule();
            this.trigger = trigger;
            this.status = info.status();
            this.lastRun = info.lastRun();
            this.nextRun = info.nextRun();
            this.runCount = info.runCount();
            this.successCount = info.successCount();
            this.failureCount = info.failureCount();
            this.consecutiveFailures = info.consecutiveFailures();
            this.createdAt = info.createdAt();
            this.updatedAt = info.updatedAt();
        }

        synchronized ScheduleInfo snapshot() {
            return new ScheduleInfo(schedule, status, lastRun, nextRun, runCount, successCount, failureCount,
                    consecutiveFailures, createdAt, updatedAt);
        }

        synchronized Schedule schedule() {
            return schedule;
        }

        synchronized Trigger trigger() {
            return trigger;
        }

        synchronized ScheduleStatus status() {
            return status;
        }

        synchronized void redefine(Schedule schedule, Trigger trigger, Instant now) {
            this.schedule = schedule;
            this.trigger = trigger;
            this.updatedAt = now;
        }

        synchronized void nextRun(Instant nextRun, Instant now) {
            this.nextRun = nextRun;
            this.updatedAt = now;
        }

        /**
         * @return false when the current status does not allow the transition
         */
        synchronized boolean transition(ScheduleStatus to, Instant now, ScheduleStatus... from) {
            for (ScheduleStatus s : from) {
                if (status == s) {
                    if (to == ScheduleStatus.ACTIVE) {
                        consecutiveFailures = 0;
                    }
                    if (to != ScheduleStatus.ACTIVE) {
                        nextRun = null;
                    }
                    status = to;
                    updatedAt = now;
                    return true;
                }
            }
            return false;
        }

        synchronized ScheduleInfo markStarted(Instant firedAt) {
            lastRun = firedAt;
            runCount++;
            updatedAt = firedAt;
            return snapshot();
        }

        synchronized ScheduleInfo markFinished(boolean success, Instant now) {
            if (success) {
                successCount++;
                consecutiveFailures = 0;
            } else {
                failureCount++;
                consecutiveFailures++;
            }
            SlaConfig sla = schedule.sla();
            if (status == ScheduleStatus.ACTIVE) {
                if (!success && sla != null && consecutiveFailures >= sla.consecutiveFailureLimit()) {
                    status = ScheduleStatus.ERROR;
                    nextRun = null;
                } else if (schedule.type() == ScheduleType.ONE_TIME) {
                    status = ScheduleStatus.COMPLETED;
                    nextRun = null;
                }
            }
            updatedAt = now;
            return snapshot();
        }
    }

    public DefaultFleetScheduler(SchedulerProperties props, ScheduleTrigger callback) {
        this(props, callback, new InMemoryScheduleStore(), Clock.systemUTC());
    }

    public DefaultFleetScheduler(SchedulerProperties props, ScheduleTrigger callback, ScheduleStore store, Clock clock) {
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.callback = Objects.requireNonNull(callback, "callback must not be null");
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        if (props.getMaxConcurrency() <= 0) {
            throw new IllegalArgumentException("dispatch4j.scheduler.maxConcurrency must be a positive number");
        }
        Objects.requireNonNull(props.getMisfireGracePeriod(), "dispatch4j.scheduler.misfireGracePeriod must not be null");
        Objects.requireNonNull(props.getShutdownTimeout(), "dispatch4j.scheduler.shutdownTimeout must not be null");
        this.dependencyTracker = new DependencyTracker(clock);
        this.slaMonitor = new SlaMonitor(clock, props.getSlaMetricsRetention());
    }

    /**
     * Restore stored schedules, arm timers and start executing. Idempotent.
     */
    @Override
    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }

        log.info("Scheduler starting with maxConcurrency={}, misfireGracePeriod={}, shutdownTimeout={}",
                props.getMaxConcurrency(),
                props.getMisfireGracePeriod(),
                props.getShutdownTimeout());

        timer = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r);
            t.setName("dispatch4j.timer");
            t.setDaemon(true);
            return t;
        });
        workerPool = Executors.newFixedThreadPool(props.getMaxConcurrency(), r -> {
            Thread t = new Thread(r);
            t.setName("dispatch4j.worker");
            t.setDaemon(true);
            return t;
        });

        restoreFromStore();

        for (Entry entry : entries.values()) {
            if (entry.status() == ScheduleStatus.ACTIVE && entry.schedule().type().isTimed()) {
                arm(entry);
            }
        }

        List<String> catchUp = new ArrayList<>();
        for (ScheduleInfo missed : checkMissedRuns()) {
            catchUp.add(missed.id());
        }
        if (!catchUp.isEmpty()) {
            workerPool.execute(() -> catchUp.forEach(this::executeCatchUp));
        }
        log.info("Scheduler started successfully. schedules={}", entries.size());
    }

    @Override
    public void stop() {
        stop(true);
    }

    /**
     * Stop firing. Idempotent.
     */
    @Override
    public void stop(boolean wait) {
        if (!started.compareAndSet(true, false)) {
            return;
        }

        log.info("Scheduler stopping... wait={}", wait);

        timers.values().forEach(f -> f.cancel(false));
        timers.clear();
        if (timer != null) {
            timer.shutdownNow();
            timer = null;
        }

        if (workerPool != null) {
            if (wait) {
                workerPool.shutdown();
                try {
                    if (!workerPool.awaitTermination(props.getShutdownTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                        log.warn("In-flight runs did not finish within shutdownTimeout={}", props.getShutdownTimeout());
                        workerPool.shutdownNow();
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    workerPool.shutdownNow();
                }
            } else {
                workerPool.shutdownNow();
            }
            workerPool = null;
        }
        log.info("Scheduler stopped successfully.");
    }

    @Override
    public boolean isRunning() {
        return started.get();
    }

    @Override
    public ScheduleBuilder create(String id, String name, String workflowId) {
        return new SimpleScheduleBuilder(id, name, workflowId, this::addSchedule)
                .maxInstances(props.getDefaultMaxInstances())
                .timezone(props.getDefaultTimezone());
    }

    @Override
    public boolean addSchedule(Schedule schedule) {
        Objects.requireNonNull(schedule, "schedule must not be null");
        Instant now = clock.instant();
        registryLock.lock();
        try {
            Trigger trigger;
            try {
                trigger = triggerFor(schedule, now);
            } catch (IllegalArgumentException | DateTimeException e) {
                log.error("Invalid schedule rejected. id={} type={} msg={}", schedule.id(), schedule.type(), e.getMessage());
                return false;
            }
            if (!acyclicWith(schedule)) {
                return false;
            }

            Entry previous = entries.get(schedule.id());
            if (previous != null) {
                cancelTimer(schedule.id());
                log.info("Replacing schedule. id={}", schedule.id());
            }

            Entry entry = new Entry(ScheduleInfo.fresh(schedule, now), trigger);
            entries.put(schedule.id(), entry);
            applyLimits(schedule);
            persist(entry);

            if (started.get() && entry.status() == ScheduleStatus.ACTIVE && schedule.type().isTimed()) {
                arm(entry);
            }
            log.info("Schedule added. id={} type={} workflow={}", schedule.id(), schedule.type(), schedule.workflowId());
            return true;
        } finally {
            registryLock.unlock();
        }
    }

    @Override
    public boolean removeSchedule(String scheduleId) {
        Objects.requireNonNull(scheduleId, "scheduleId must not be null");
        registryLock.lock();
        try {
            Entry removed = entries.remove(scheduleId);
            if (removed == null) {
                return false;
            }
            cancelTimer(scheduleId);
            instanceSem.remove(scheduleId);
            rateLimiters.remove(scheduleId);
            lastEventAt.remove(scheduleId);
            slaMonitor.forget(scheduleId);
            dependencyTracker.forget(scheduleId);
            try {
                store.delete(scheduleId);
            } catch (RuntimeException e) {
                log.error("Schedule delete failed. id={} msg={}", scheduleId, e.getMessage(), e);
            }
            log.info("Schedule removed. id={}", scheduleId);
            return true;
        } finally {
            registryLock.unlock();
        }
    }

    @Override
    public boolean updateSchedule(Schedule schedule) {
        Objects.requireNonNull(schedule, "schedule must not be null");
        Instant now = clock.instant();
        registryLock.lock();
        try {
            Entry entry = entries.get(schedule.id());
            if (entry == null) {
                log.warn("Cannot update unknown schedule. id={}", schedule.id());
                return false;
            }
            Trigger trigger;
            try {
                trigger = triggerFor(schedule, entry.snapshot().createdAt());
            } catch (IllegalArgumentException | DateTimeException e) {
                log.error("Invalid schedule update rejected. id={} type={} msg={}", schedule.id(), schedule.type(), e.getMessage());
                return false;
            }
            if (!acyclicWith(schedule)) {
                return false;
            }

            cancelTimer(schedule.id());
            entry.redefine(schedule, trigger, now);
            if (!schedule.enabled()) {
                entry.transition(ScheduleStatus.DISABLED, now, ScheduleStatus.ACTIVE, ScheduleStatus.PAUSED,
                        ScheduleStatus.ERROR);
            }
            if (!schedule.type().isTimed()) {
                entry.nextRun(null, now);
            }
            applyLimits(schedule);
            persist(entry);

            if (started.get() && entry.status() == ScheduleStatus.ACTIVE && schedule.type().isTimed()) {
                arm(entry);
            }
            log.info("Schedule updated. id={} type={}", schedule.id(), schedule.type());
            return true;
        } finally {
            registryLock.unlock();
        }
    }

    @Override
    public boolean pauseSchedule(String scheduleId) {
        return changeStatus(scheduleId, ScheduleStatus.PAUSED, ScheduleStatus.ACTIVE);
    }

    /**
     * Reactivate a PAUSED or ERROR schedule. Resuming from ERROR clears the failure streak.
     */
    @Override
    public boolean resumeSchedule(String scheduleId) {
        return changeStatus(scheduleId, ScheduleStatus.ACTIVE, ScheduleStatus.PAUSED, ScheduleStatus.ERROR);
    }

    @Override
    public boolean disableSchedule(String scheduleId) {
        return changeStatus(scheduleId, ScheduleStatus.DISABLED,
                ScheduleStatus.ACTIVE, ScheduleStatus.PAUSED, ScheduleStatus.ERROR);
    }

    private boolean changeStatus(String scheduleId, ScheduleStatus to, ScheduleStatus... from) {
        Objects.requireNonNull(scheduleId, "scheduleId must not be null");
        Entry entry = entries.get(scheduleId);
        if (entry == null) {
            return false;
        }
        ScheduleStatus before = entry.status();
        if (!entry.transition(to, clock.instant(), from)) {
            log.warn("Status change rejected. id={} status={} requested={}", scheduleId, before, to);
            return false;
        }
        if (to == ScheduleStatus.ACTIVE) {
            if (started.get() && entry.schedule().type().isTimed()) {
                arm(entry);
            }
        } else {
            cancelTimer(scheduleId);
        }
        persist(entry);
        log.info("Schedule status changed. id={} from={} to={}", scheduleId, before, to);
        return true;
    }

    @Override
    public Optional<ScheduleInfo> getSchedule(String scheduleId) {
        Entry entry = entries.get(scheduleId);
        return entry == null ? Optional.empty() : Optional.of(entry.snapshot());
    }

    @Override
    public List<ScheduleInfo> getAllSchedules() {
        List<ScheduleInfo> all = new ArrayList<>();
        for (Entry entry : entries.values()) {
            all.add(entry.snapshot());
        }
        return all;
    }

    @Override
    public List<ScheduleInfo> getSchedulesByStatus(ScheduleStatus status) {
        Objects.requireNonNull(status, "status must not be null");
        return getAllSchedules().stream()
                .filter(s -> s.status() == status)
                .toList();
    }

    @Override
    public ExecutionOutcome triggerNow(String scheduleId) {
        Objects.requireNonNull(scheduleId, "scheduleId must not be null");
        return execute(scheduleId, null, Map.of(), false);
    }

    @Override
    public List<String> triggerEvent(EventType eventType, String eventSource, Map<String, Object> eventData) {
        Objects.requireNonNull(eventType, "eventType must not be null");
        Objects.requireNonNull(eventSource, "eventSource must not be null");
        Map<String, Object> data = eventData == null ? Map.of() : eventData;
        Instant now = clock.instant();

        List<String> triggered = new ArrayList<>();
        for (Entry entry : entries.values()) {
            Schedule s = entry.schedule();
            if (s.type() != ScheduleType.EVENT || entry.status() != ScheduleStatus.ACTIVE) {
                continue;
            }
            EventTriggerConfig cfg = s.eventTrigger();
            if (cfg.eventType() != eventType || !cfg.eventSource().equals(eventSource)) {
                continue;
            }
            if (!EventFilterMatcher.matches(data, cfg.eventFilter())) {
                log.debug("Event filtered out. id={} type={} source={}", s.id(), eventType, eventSource);
                continue;
            }
            if (debounced(s.id(), cfg.debounce(), now)) {
                log.debug("Event debounced. id={} debounce={}", s.id(), cfg.debounce());
                continue;
            }
            triggered.add(s.id());
        }

        log.info("Event received. type={} source={} triggered={}", eventType, eventSource, triggered);
        for (String id : triggered) {
            dispatch(() -> execute(id, null, data, false));
        }
        return triggered;
    }

    private boolean debounced(String scheduleId, Duration debounce, Instant now) {
        if (debounce.isZero() || debounce.isNegative()) {
            lastEventAt.put(scheduleId, now);
            return false;
        }
        boolean[] accepted = {false};
        lastEventAt.compute(scheduleId, (k, last) -> {
            if (last != null && Duration.between(last, now).compareTo(debounce) < 0) {
                return last;
            }
            accepted[0] = true;
            return now;
        });
        return !accepted[0];
    }

    /**
     * Record the completion, then fire every active DEPENDENCY schedule whose dependencies are now
     * satisfied by completions since its own last run. Calls are handled one at a time, in order.
     */
    @Override
    public void notifyCompletion(String scheduleId, boolean success, Object result) {
        Objects.requireNonNull(scheduleId, "scheduleId must not be null");
        completionLock.lock();
        try {
            dependencyTracker.recordCompletion(scheduleId, success, result);

            List<String> ready = new ArrayList<>();
            for (Entry entry : entries.values()) {
                ScheduleInfo info = entry.snapshot();
                Schedule s = info.schedule();
                if (s.type() != ScheduleType.DEPENDENCY || info.status() != ScheduleStatus.ACTIVE) {
                    continue;
                }
                DependencyConfig dep = s.dependency();
                if (!dep.dependsOn().contains(scheduleId)) {
                    continue;
                }
                DependencyTracker.DependencyCheck check = dependencyTracker.areDependenciesSatisfied(
                        dep.dependsOn(), dep.waitForAll(), info.lastRun(), dep.triggerOnSuccessOnly());
                if (check.satisfied()) {
                    ready.add(s.id());
                } else {
                    log.debug("Dependent still waiting. id={} pending={}", s.id(), check.unsatisfied());
                }
            }

            for (String id : ready) {
                log.info("Dependencies satisfied, firing. id={} triggeredBy={}", id, scheduleId);
                Map<String, Object> data = Map.of("triggered_by", scheduleId, "success", success);
                dispatch(() -> execute(id, null, data, false));
            }
        } finally {
            completionLock.unlock();
        }
    }

    @Override
    public GraphValidation validateDependencyGraph() {
        return DependencyGraphValidator.validate(dependsOnGraph(null));
    }

    @Override
    public Map<String, List<String>> getDependencyGraph() {
        Map<String, List<String>> graph = new TreeMap<>();
        for (Entry entry : entries.values()) {
            Schedule s = entry.schedule();
            if (s.dependency() == null) {
                continue;
            }
            for (String dep : s.dependency().dependsOn()) {
                graph.computeIfAbsent(dep, k -> new ArrayList<>()).add(s.id());
            }
        }
        Map<String, List<String>> result = new LinkedHashMap<>();
        graph.forEach((k, v) -> result.put(k, List.copyOf(v)));
        return result;
    }

    /**
     * Active timed schedules with catch-up enabled whose last run is older than their catch-up
     * window. A schedule that never ran has nothing to catch up.
     */
    @Override
    public List<ScheduleInfo> checkMissedRuns() {
        Instant now = clock.instant();
        List<ScheduleInfo> missed = new ArrayList<>();
        for (Entry entry : entries.values()) {
            if (!missedFireTimes(entry, now).isEmpty()) {
                missed.add(entry.snapshot());
            }
        }
        return missed;
    }

    /**
     * Replay the missed runs of one schedule, at most {@code maxCatchUpRuns}. Stops as soon as the
     * scheduler stops; does nothing while it is not running.
     */
    @Override
    public int executeCatchUp(String scheduleId) {
        Objects.requireNonNull(scheduleId, "scheduleId must not be null");
        Entry entry = entries.get(scheduleId);
        if (entry == null || !started.get()) {
            return 0;
        }
        List<Instant> missed = missedFireTimes(entry, clock.instant());
        if (missed.isEmpty()) {
            return 0;
        }
        CatchUpConfig cfg = entry.schedule().catchUp();
        log.info("Catching up missed runs. id={} missed={} sequential={}", scheduleId, missed.size(), cfg.runSequentially());

        int executed = 0;
        if (cfg.runSequentially()) {
            for (int i = 0; i < missed.size(); i++) {
                if (!started.get()) {
                    log.info("Catch-up interrupted by shutdown. id={} executed={}", scheduleId, executed);
                    break;
                }
                if (i > 0 && !sleep(props.getCatchUpSpacing())) {
                    break;
                }
                if (execute(scheduleId, missed.get(i), Map.of(), true).executed()) {
                    executed++;
                }
            }
            return executed;
        }

        List<Future<ExecutionOutcome>> futures = new ArrayList<>();
        for (Instant planned : missed) {
            ExecutorService pool = workerPool;
            if (!started.get() || pool == null) {
                break;
            }
            try {
                futures.add(pool.submit(() -> execute(scheduleId, planned, Map.of(), true)));
            } catch (RejectedExecutionException e) {
                log.warn("Catch-up run rejected. id={} msg={}", scheduleId, e.getMessage());
                break;
            }
        }
        for (Future<ExecutionOutcome> f : futures) {
            try {
                if (f.get().executed()) {
                    executed++;
                }
            } catch (ExecutionException e) {
                log.error("Catch-up run failed. id={} msg={}", scheduleId, e.getMessage(), e);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        return executed;
    }

    private List<Instant> missedFireTimes(Entry entry, Instant now) {
        ScheduleInfo info = entry.snapshot();
        Schedule s = info.schedule();
        CatchUpConfig cfg = s.catchUp();
        Trigger trigger = entry.trigger();
        if (cfg == null || !cfg.enabled() || trigger == null || info.status() != ScheduleStatus.ACTIVE
                || info.lastRun() == null) {
            return List.of();
        }
        Instant windowStart = now.minus(Duration.ofHours(cfg.catchUpWindowHours()));
        if (!info.lastRun().isBefore(windowStart)) {
            return List.of();
        }
        // the tick currently within the grace period belongs to the timer
        Instant until = now.minus(props.getMisfireGracePeriod());

        List<Instant> missed = new ArrayList<>();
        Instant next = trigger.nextFireTime(windowStart);
        while (next != null && next.isBefore(until) && missed.size() < cfg.maxCatchUpRuns()) {
            missed.add(next);
            next = trigger.nextFireTime(next);
        }
        return missed;
    }

    @Override
    public SlaReport getSlaReport(String scheduleId, int windowHours) {
        if (windowHours <= 0) {
            throw new IllegalArgumentException("windowHours must be a positive number");
        }
        List<SlaReport.Entry> rows = new ArrayList<>();
        for (Entry entry : entries.values()) {
            ScheduleInfo info = entry.snapshot();
            SlaConfig sla = info.schedule().sla();
            if (sla == null || (scheduleId != null && !scheduleId.equals(info.id()))) {
                continue;
            }
            rows.add(new SlaReport.Entry(
                    info.id(),
                    info.schedule().name(),
                    slaStatus(info, sla, windowHours),
                    slaMonitor.getSuccessRate(info.id(), windowHours),
                    sla.successRateThreshold(),
                    slaMonitor.getAverageDurationMs(info.id(), windowHours),
                    sla.maxDuration() == null ? null : sla.maxDuration().toMillis(),
                    info.consecutiveFailures(),
                    sla.consecutiveFailureLimit(),
                    slaMonitor.getSuccessStreak(info.id()),
                    info.runCount()
            ));
        }
        return new SlaReport(clock.instant(), windowHours, rows);
    }

    private SlaStatus slaStatus(ScheduleInfo info, SlaConfig sla, int windowHours) {
        boolean noData = slaMonitor.getMetrics(info.id(), clock.instant().minus(Duration.ofHours(windowHours)), 1).isEmpty();
        if (noData && info.consecutiveFailures() < sla.consecutiveFailureLimit()) {
            return SlaStatus.UNKNOWN;
        }
        return slaMonitor.evaluate(info.id(), sla, info.consecutiveFailures(), windowHours);
    }

    @Override
    public void addSlaAlertListener(SlaBreachHandler listener) {
        slaMonitor.addAlertListener(listener);
    }

    @Override
    public List<UpcomingRun> getUpcomingRuns(int limit, String workflowId) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be a positive number");
        }
        return getAllSchedules().stream()
                .filter(i -> i.status() == ScheduleStatus.ACTIVE && i.nextRun() != null)
                .filter(i -> workflowId == null || workflowId.equals(i.schedule().workflowId()))
                .sorted(Comparator.comparing(ScheduleInfo::nextRun))
                .limit(limit)
                .map(i -> new UpcomingRun(i.id(), i.schedule().name(), i.schedule().workflowId(),
                        i.schedule().workflowName(), i.nextRun(), i.schedule().type(), i.status()))
                .toList();
    }

    @Override
    public void registerCalendar(String calendarId, BusinessCalendar calendar) {
        Objects.requireNonNull(calendarId, "calendarId must not be null");
        Objects.requireNonNull(calendar, "calendar must not be null");
        calendars.put(calendarId, calendar);
        log.info("Calendar registered. id={} zone={}", calendarId, calendar.zone());
    }

    @Override
    public Optional<BusinessCalendar> getCalendar(String calendarId) {
        return Optional.ofNullable(calendars.get(calendarId));
    }

    // --- pipeline ---

    private ExecutionOutcome execute(String scheduleId, Instant planned, Map<String, Object> eventData, boolean catchUp) {
        Entry entry = entries.get(scheduleId);
        if (entry == null) {
            log.warn("Unknown schedule. id={}", scheduleId);
            return ExecutionOutcome.NOT_FOUND;
        }
        if (entry.status() != ScheduleStatus.ACTIVE) {
            log.debug("Schedule not active. id={} status={}", scheduleId, entry.status());
            return ExecutionOutcome.NOT_ACTIVE;
        }
        Schedule s = entry.schedule();

        Semaphore sem = instanceSem.computeIfAbsent(scheduleId, k -> new InstanceLimit(s.maxInstances()));
        if (!sem.tryAcquire()) {
            log.warn("Max instances reached, skipping run. id={} maxInstances={}", scheduleId, s.maxInstances());
            return ExecutionOutcome.MAX_INSTANCES_REACHED;
        }
        try {
            SlidingWindowRateLimiter limiter = rateLimiters.get(scheduleId);
            if (limiter != null && !limiter.tryAcquire(scheduleId)) {
                if (!s.rateLimit().queueOverflow()) {
                    log.info("Rate limit reached, skipping run. id={} max={} window={}",
                            scheduleId, s.rateLimit().maxExecutions(), s.rateLimit().window());
                    return ExecutionOutcome.RATE_LIMITED;
                }
                Duration wait = limiter.getWaitTime(scheduleId);
                log.info("Rate limit reached, waiting for slot. id={} wait={}", scheduleId, wait);
                if (!sleep(wait)) {
                    return ExecutionOutcome.SCHEDULER_STOPPED;
                }
                if (!limiter.tryAcquire(scheduleId)) {
                    return ExecutionOutcome.RATE_LIMITED;
                }
            }
            ExecutionOutcome skipped = checkGates(entry, s);
            if (skipped != null) {
                if (limiter != null) {
                    limiter.release(scheduleId);
                }
                return skipped;
            }
            return run(entry, planned, eventData, catchUp);
        } finally {
            sem.release();
        }
    }

    // Calendar, condition and dependency gates; null when the run may proceed.
    private ExecutionOutcome checkGates(Entry entry, Schedule s) {
        String scheduleId = s.id();
        if (s.respectBusinessHours() && s.calendarId() != null) {
            BusinessCalendar calendar = calendars.get(s.calendarId());
            if (calendar == null) {
                log.warn("Unknown calendar, business hours not enforced. id={} calendar={}", scheduleId, s.calendarId());
            } else {
                CalendarDecision decision = calendar.canExecute(clock.instant(), s.workflowId());
                if (!decision.allowed()) {
                    log.info("Blocked by business calendar. id={} reason={}", scheduleId, decision.reason());
                    return ExecutionOutcome.BLOCKED_BY_CALENDAR;
                }
            }
        }

        if (s.conditional() != null && !conditionMet(entry, s.conditional())) {
            return ExecutionOutcome.CONDITION_NOT_MET;
        }

        if (s.type() != ScheduleType.DEPENDENCY && s.dependency() != null && !s.dependency().dependsOn().isEmpty()) {
            DependencyConfig dep = s.dependency();
            DependencyTracker.DependencyCheck check = dependencyTracker.areDependenciesSatisfied(
                    dep.dependsOn(), dep.waitForAll(), null, dep.triggerOnSuccessOnly());
            if (!check.satisfied()) {
                log.info("Dependencies pending. id={} pending={}", scheduleId, check.unsatisfied());
                return ExecutionOutcome.DEPENDENCIES_PENDING;
            }
        }

        return null;
    }

    private boolean conditionMet(Entry entry, ConditionalConfig cfg) {
        int attempts = cfg.retryOnConditionFail() ? cfg.maxConditionRetries() + 1 : 1;
        for (int i = 0; i < attempts; i++) {
            if (i > 0 && !sleep(cfg.retryInterval())) {
                return false;
            }
            try {
                if (cfg.condition().test(entry.snapshot())) {
                    return true;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            } catch (Exception e) {
                log.warn("Schedule condition threw. id={} msg={}", entry.schedule().id(), e.getMessage());
            }
        }
        log.info("Schedule condition not met. id={} attempts={}", entry.schedule().id(), attempts);
        return false;
    }

    private ExecutionOutcome run(Entry entry, Instant planned, Map<String, Object> eventData, boolean catchUp) {
        Schedule s = entry.schedule();
        String executionId = slaMonitor.recordStart(s.id(), catchUp ? null : planned);
        Instant firedAt = clock.instant();
        ScheduleInfo snapshot = entry.markStarted(firedAt);
        persist(entry);

        TriggerContext context = new TriggerContext(executionId, snapshot, firedAt, eventData, catchUp);
        boolean success = false;
        Object result = null;
        try {
            result = callback.onTrigger(context);
            success = true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Schedule run interrupted. id={} execution={}", s.id(), executionId);
        } catch (Exception e) {
            log.error("Schedule run failed. id={} execution={} msg={}", s.id(), executionId, e.getMessage(), e);
        }

        ScheduleInfo after = entry.markFinished(success, clock.instant());
        persist(entry);
        slaMonitor.recordCompletion(executionId, success, s.sla());

        if (after.status() == ScheduleStatus.ERROR && snapshot.status() == ScheduleStatus.ACTIVE) {
            cancelTimer(s.id());
            String message = after.consecutiveFailures() + " consecutive failures";
            log.error("Schedule moved to ERROR. id={} consecutiveFailures={}", s.id(), after.consecutiveFailures());
            slaMonitor.alert(s.id(), message, s.sla().onBreach());
        } else if (after.status() == ScheduleStatus.COMPLETED) {
            log.info("One-time schedule completed. id={}", s.id());
        }

        notifyCompletion(s.id(), success, result);
        return success ? ExecutionOutcome.SUCCEEDED : ExecutionOutcome.FAILED;
    }

    // --- timers ---

    private void arm(Entry entry) {
        Instant now = clock.instant();
        Trigger trigger = entry.trigger();
        if (trigger == null) {
            return;
        }
        armAt(entry, firstFireTime(entry, trigger, now), now);
    }

    private void armAt(Entry entry, Instant next, Instant now) {
        String id = entry.schedule().id();
        entry.nextRun(next, now);
        persist(entry);
        ScheduledExecutorService t = timer;
        if (next == null || t == null || !started.get()) {
            return;
        }
        long delayMs = Math.max(0, Duration.between(now, next).toMillis());
        try {
            ScheduledFuture<?> future = t.schedule(() -> onTick(id, next), delayMs, TimeUnit.MILLISECONDS);
            ScheduledFuture<?> old = timers.put(id, future);
            if (old != null) {
                old.cancel(false);
            }
        } catch (RejectedExecutionException e) {
            log.debug("Timer rejected tick during shutdown. id={}", id);
        }
    }

    private Instant firstFireTime(Entry entry, Trigger trigger, Instant now) {
        Schedule s = entry.schedule();
        Instant first = trigger.firstFireTime(now);
        if (first == null || s.type() != ScheduleType.ONE_TIME || !s.respectBusinessHours() || s.calendarId() == null) {
            return first;
        }
        BusinessCalendar calendar = calendars.get(s.calendarId());
        if (calendar == null) {
            return first;
        }
        return calendar.adjustToWorkingTime(first.atZone(calendar.zone()), s.workflowId()).toInstant();
    }

    private void onTick(String scheduleId, Instant planned) {
        try {
            Entry entry = entries.get(scheduleId);
            if (entry == null || !started.get() || entry.status() != ScheduleStatus.ACTIVE) {
                return;
            }
            timers.remove(scheduleId);
            Instant now = clock.instant();
            Trigger trigger = entry.trigger();
            Instant after = now.isAfter(planned) ? now : planned;
            armAt(entry, trigger == null ? null : trigger.nextFireTime(after), now);

            Duration lateness = Duration.between(planned, now);
            if (lateness.compareTo(props.getMisfireGracePeriod()) > 0) {
                log.warn("Misfired tick dropped. id={} planned={} lateness={}", scheduleId, planned, lateness);
                return;
            }
            dispatch(() -> execute(scheduleId, planned, Map.of(), false));
        } catch (RuntimeException e) {
            log.error("Timer tick failed. id={} msg={}", scheduleId, e.getMessage(), e);
        }
    }

    private void cancelTimer(String scheduleId) {
        ScheduledFuture<?> f = timers.remove(scheduleId);
        if (f != null) {
            f.cancel(false);
        }
    }

    // --- helpers ---

    private void dispatch(Runnable task) {
        ExecutorService pool = workerPool;
        if (started.get() && pool != null) {
            try {
                pool.execute(task);
                return;
            } catch (RejectedExecutionException e) {
                log.warn("Worker pool rejected run. msg={}", e.getMessage());
                return;
            }
        }
        task.run();
    }

    /**
     * @return the timed trigger, null for event and dependency schedules
     * @throws IllegalArgumentException for an incomplete or malformed trigger definition
     * @throws DateTimeException        for an unknown time zone
     */
    private static Trigger triggerFor(Schedule s, Instant anchor) {
        ZoneId zone = ZoneId.of(s.timezone());
        return switch (s.type()) {
            case CRON -> {
                if (s.cronExpression() == null) {
                    throw new IllegalArgumentException("cron schedule needs a cron expression");
                }
                yield new CronTrigger(CronExpression.parse(s.cronExpression()), zone);
            }
            case INTERVAL -> {
                if (s.interval() == null) {
                    throw new IllegalArgumentException("interval schedule needs an interval");
                }
                yield new IntervalTrigger(s.interval(), anchor);
            }
            case ONE_TIME -> {
                if (s.runAt() == null) {
                    throw new IllegalArgumentException("one-time schedule needs a run time");
                }
                yield new DateTrigger(s.runAt());
            }
            case EVENT -> {
                if (s.eventTrigger() == null) {
                    throw new IllegalArgumentException("event schedule needs an event trigger");
                }
                yield null;
            }
            case DEPENDENCY -> {
                if (s.dependency() == null || s.dependency().dependsOn().isEmpty()) {
                    throw new IllegalArgumentException("dependency schedule needs at least one dependency");
                }
                yield null;
            }
        };
    }

    private boolean acyclicWith(Schedule schedule) {
        GraphValidation validation = DependencyGraphValidator.validate(dependsOnGraph(schedule));
        if (!validation.valid()) {
            log.error("Schedule rejected, dependency cycle. id={} cycle={}", schedule.id(), validation.cyclePath());
            return false;
        }
        return true;
    }

    /**
     * Schedule id to the ids it depends on, with {@code candidate} replacing any registered
     * definition of the same id.
     */
    private Map<String, List<String>> dependsOnGraph(Schedule candidate) {
        Map<String, List<String>> graph = new LinkedHashMap<>();
        for (Entry entry : entries.values()) {
            Schedule s = entry.schedule();
            if (candidate != null && s.id().equals(candidate.id())) {
                continue;
            }
            if (s.dependency() != null) {
                graph.put(s.id(), s.dependency().dependsOn());
            }
        }
        if (candidate != null && candidate.dependency() != null) {
            graph.put(candidate.id(), candidate.dependency().dependsOn());
        }
        return graph;
    }

    private void applyLimits(Schedule s) {
        // Runs in flight hold permits of the existing semaphore, so it is resized rather than replaced.
        instanceSem.compute(s.id(), (id, current) -> {
            if (current == null) {
                return new InstanceLimit(s.maxInstances());
            }
            current.resize(s.maxInstances());
            return current;
        });
        if (s.rateLimit() != null) {
            rateLimiters.put(s.id(), new SlidingWindowRateLimiter(s.rateLimit().maxExecutions(), s.rateLimit().window(), clock));
        } else {
            rateLimiters.remove(s.id());
        }
    }

    private void restoreFromStore() {
        List<ScheduleInfo> stored;
        try {
            stored = store.findAll();
        } catch (RuntimeException e) {
            log.error("Schedule restore failed. msg={}", e.getMessage(), e);
            return;
        }
        int restored = 0;
        registryLock.lock();
        try {
            for (ScheduleInfo info : stored) {
                if (entries.containsKey(info.id())) {
                    continue;
                }
                Instant anchor = info.createdAt() != null ? info.createdAt() : clock.instant();
                Trigger trigger;
                try {
                    trigger = triggerFor(info.schedule(), anchor);
                } catch (IllegalArgumentException | DateTimeException e) {
                    log.error("Stored schedule skipped. id={} msg={}", info.id(), e.getMessage());
                    continue;
                }
                entries.put(info.id(), new Entry(info, trigger));
                applyLimits(info.schedule());
                restored++;
            }
        } finally {
            registryLock.unlock();
        }
        if (restored > 0) {
            log.info("Restored schedules from store. count={}", restored);
        }
    }

    private void persist(Entry entry) {
        try {
            store.save(entry.snapshot());
        } catch (RuntimeException e) {
            log.error("Schedule persist failed. id={} msg={}", entry.schedule().id(), e.getMessage(), e);
        }
    }

    /**
     * @return false when interrupted
     */
    private static boolean sleep(Duration d) {
        if (d == null || d.isZero() || d.isNegative()) {
            return true;
        }
        try {
            Thread.sleep(d.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /**
     * Per-schedule concurrency permits whose limit can change while runs hold permits.
     */
    static final class InstanceLimit extends Semaphore {
        private int limit;

        InstanceLimit(int limit) {
            super(limit);
            this.limit = limit;
        }

        synchronized void resize(int newLimit) {
            int delta = newLimit - limit;
            if (delta > 0) {
                release(delta);
            } else if (delta < 0) {
                reducePermits(-delta);
            }
            limit = newLimit;
        }
    }
}
