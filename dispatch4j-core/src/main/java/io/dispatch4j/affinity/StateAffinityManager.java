package io.dispatch4j.affinity;

import io.dispatch4j.assignment.AffinitySignal;
import io.dispatch4j.assignment.RobotInfo;
import io.dispatch4j.config.AffinityProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.ToDoubleFunction;

/**
 * Tracks which robots hold recoverable state for which workflows and which robot each workflow
 * session is pinned to, and turns that into robot selections per {@link AffinityLevel}.
 *
 * <p>Registries are keyed by workflow id then robot id and only touched under one lock. Expired
 * state and sessions are hidden from every query as soon as they expire; the background sweep
 * started by {@link #start()} only reclaims the memory.
 *
 * <p>Typical usage:
 * <pre>{@code
 * manager.start();
 * AffinityDecision d = manager.selectRobot("W1", AffinityLevel.SOFT, List.of("r1", "r2"), jobId);
 * ...
 * manager.registerState(d.selectedRobotId(), "W1", "browser_session");
 * }</pre>
 */
public class StateAffinityManager implements AffinitySignal {
    private static final Logger log = LoggerFactory.getLogger(StateAffinityManager.class);

    private final AffinityProperties props;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, Map<String, List<RobotState>>> registry = new LinkedHashMap<>();
    private final Map<String, WorkflowSession> sessions = new HashMap<>();
    private final Map<String, Integer> queueAttempts = new HashMap<>();
    private final Map<String, MigrationHandler> migrationHandlers = new ConcurrentHashMap<>();

    private final AtomicBoolean started = new AtomicBoolean(false);
    private Thread sweeperThread;

    public record CleanupResult(int expiredStates, int expiredSessions) {
    }

    public StateAffinityManager() {
        this(new AffinityProperties(), Clock.systemUTC());
    }

    public StateAffinityManager(AffinityProperties props, Clock clock) {
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        requirePositive(props.getSessionTimeout(), "affinity.sessionTimeout");
        requirePositive(props.getHardAffinityQueueDelay(), "affinity.hardAffinityQueueDelay");
        requirePositive(props.getMaxQueueDelay(), "affinity.maxQueueDelay");
        requirePositive(props.getCleanupInterval(), "affinity.cleanupInterval");
        Objects.requireNonNull(props.getDefaultStateTtl(), "affinity.defaultStateTtl must not be null");
        if (props.getMaxQueueAttempts() <= 0) {
            throw new IllegalArgumentException("affinity.maxQueueAttempts must be a positive number");
        }
        log.info("StateAffinityManager initialized. stateTtl={} sessionTimeout={} maxQueueAttempts={}",
                props.getDefaultStateTtl(), props.getSessionTimeout(), props.getMaxQueueAttempts());
    }

    /**
     * Start the background expiry sweep. Idempotent.
     */
    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        sweeperThread = new Thread(this::sweepLoop);
        sweeperThread.setName("dispatch4j.affinity-sweep");
        sweeperThread.setDaemon(true);
        sweeperThread.start();
        log.info("StateAffinityManager sweep started. interval={}", props.getCleanupInterval());
    }

    /**
     * Stop the background sweep. Idempotent.
     */
    public void stop() {
        if (!started.compareAndSet(true, false)) {
            return;
        }
        if (sweeperThread != null) {
            sweeperThread.interrupt();
            sweeperThread = null;
        }
        log.info("StateAffinityManager stopped.");
    }

    public boolean isRunning() {
        return started.get();
    }

    private void sweepLoop() {
        while (started.get()) {
            try {
                Thread.sleep(props.getCleanupInterval().toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            try {
                cleanupExpired();
            } catch (RuntimeException e) {
                log.error("affinity sweep failed msg={}", e.getMessage(), e);
            }
        }
    }

    // ---------------------------------------------------------------- state

    public RobotState registerState(String robotId, String workflowId, String stateType) {
        return registerState(robotId, workflowId, stateType, null, Map.of(), 0, true);
    }

    /**
     * @param ttl null for the configured default; zero or negative for state that never expires
     */
    public RobotState registerState(String robotId, String workflowId, String stateType, Duration ttl,
                                    Map<String, Object> metadata, long sizeBytes, boolean migratable) {
        Objects.requireNonNull(robotId, "robotId must not be null");
        Objects.requireNonNull(workflowId, "workflowId must not be null");
        Objects.requireNonNull(stateType, "stateType must not be null");
        Duration effective = ttl != null ? ttl : props.getDefaultStateTtl();
        Instant now = clock.instant();
        Instant expiresAt = effective.isZero() || effective.isNegative() ? null : now.plus(effective);
        RobotState state = new RobotState(robotId, workflowId, stateType, now, now, expiresAt, metadata, sizeBytes, migratable);

        lock.lock();
        try {
            registry.computeIfAbsent(workflowId, k -> new LinkedHashMap<>())
                    .computeIfAbsent(robotId, k -> new ArrayList<>())
                    .add(state);
        } finally {
            lock.unlock();
        }
        log.debug("Registered state. type={} workflow={} robot={}", stateType, workflowId, robotId);
        return state;
    }

    /**
     * @param stateType state type to remove, or null for every type
     * @return number of entries removed
     */
    public int unregisterState(String robotId, String workflowId, String stateType) {
        int removed;
        lock.lock();
        try {
            Map<String, List<RobotState>> byRobot = registry.get(workflowId);
            if (byRobot == null || !byRobot.containsKey(robotId)) {
                return 0;
            }
            List<RobotState> states = byRobot.get(robotId);
            if (stateType != null) {
                int before = states.size();
                states.removeIf(s -> s.stateType().equals(stateType));
                removed = before - states.size();
                if (states.isEmpty()) {
                    byRobot.remove(robotId);
                }
            } else {
                removed = states.size();
                byRobot.remove(robotId);
            }
            if (byRobot.isEmpty()) {
                registry.remove(workflowId);
            }
        } finally {
            lock.unlock();
        }
        if (removed > 0) {
            log.debug("Unregistered state. count={} workflow={} robot={}", removed, workflowId, robotId);
        }
        return removed;
    }

    public void touchState(String robotId, String workflowId) {
        Instant now = clock.instant();
        lock.lock();
        try {
            List<RobotState> states = statesOf(workflowId, robotId);
            states.replaceAll(s -> s.touchedAt(now));
        } finally {
            lock.unlock();
        }
    }

    public boolean hasStateFor(String robotId, String workflowId) {
        Instant now = clock.instant();
        lock.lock();
        try {
            for (RobotState s : statesOf(workflowId, robotId)) {
                if (!s.isExpired(now)) {
                    return true;
                }
            }
            return false;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean hasValidState(String workflowId, String robotId) {
        return hasStateFor(robotId, workflowId);
    }

    public List<String> getRobotsWithState(String workflowId) {
        return new ArrayList<>(getAllStateForWorkflow(workflowId).keySet());
    }

    public List<RobotState> getStateForRobot(String robotId, String workflowId) {
        Instant now = clock.instant();
        lock.lock();
        try {
            return live(statesOf(workflowId, robotId), now);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Valid state for a workflow grouped by robot, in registration order.
     */
    public Map<String, List<RobotState>> getAllStateForWorkflow(String workflowId) {
        Instant now = clock.instant();
        Map<String, List<RobotState>> result = new LinkedHashMap<>();
        lock.lock();
        try {
            Map<String, List<RobotState>> byRobot = registry.get(workflowId);
            if (byRobot != null) {
                byRobot.forEach((robotId, states) -> {
                    List<RobotState> valid = live(states, now);
                    if (!valid.isEmpty()) {
                        result.put(robotId, valid);
                    }
                });
            }
        } finally {
            lock.unlock();
        }
        return result;
    }

    private List<RobotState> statesOf(String workflowId, String robotId) {
        Map<String, List<RobotState>> byRobot = registry.get(workflowId);
        if (byRobot == null) {
            return new ArrayList<>();
        }
        return byRobot.getOrDefault(robotId, new ArrayList<>());
    }

    /**
     * Remove one stored item, leaving siblings of the same type in place. A touched item is a new
     * instance, so it is matched by type, creation time and metadata. Caller holds the lock.
     */
    private void removeItem(String robotId, String workflowId, RobotState state) {
        Map<String, List<RobotState>> byRobot = registry.get(workflowId);
        if (byRobot == null || !byRobot.containsKey(robotId)) {
            return;
        }
        List<RobotState> states = byRobot.get(robotId);
        int index = -1;
        for (int i = 0; i < states.size(); i++) {
            if (states.get(i) == state) {
                index = i;
                break;
            }
        }
        if (index < 0) {
            for (int i = 0; i < states.size(); i++) {
                RobotState s = states.get(i);
                if (s.stateType().equals(state.stateType()) && s.createdAt().equals(state.createdAt())
                        && s.metadata().equals(state.metadata())) {
                    index = i;
                    break;
                }
            }
        }
        if (index < 0) {
            return;
        }
        states.remove(index);
        if (states.isEmpty()) {
            byRobot.remove(robotId);
        }
        if (byRobot.isEmpty()) {
            registry.remove(workflowId);
        }
    }

    private static List<RobotState> live(List<RobotState> states, Instant now) {
        List<RobotState> result = new ArrayList<>();
        for (RobotState s : states) {
            if (!s.isExpired(now)) {
                result.add(s);
            }
        }
        return result;
    }

    // ---------------------------------------------------------------- sessions

    /**
     * Pin a workflow to a robot, replacing any previous session of that workflow.
     *
     * @param timeout idle timeout, or null for the configured default
     */
    public WorkflowSession createSession(String sessionId, String workflowId, String robotId, String chainId, Duration timeout) {
        Instant now = clock.instant();
        WorkflowSession session = new WorkflowSession(sessionId, workflowId, robotId, chainId, now, now, 0,
                timeout != null ? timeout : props.getSessionTimeout());
        lock.lock();
        try {
            sessions.put(workflowId, session);
        } finally {
            lock.unlock();
        }
        log.info("Created session. session={} workflow={} robot={}", sessionId, workflowId, robotId);
        return session;
    }

    public Optional<WorkflowSession> getSession(String workflowId) {
        Instant now = clock.instant();
        lock.lock();
        try {
            WorkflowSession session = sessions.get(workflowId);
            if (session != null && session.isExpired(now)) {
                sessions.remove(workflowId);
                log.debug("Session expired. workflow={} session={}", workflowId, session.sessionId());
                return Optional.empty();
            }
            return Optional.ofNullable(session);
        } finally {
            lock.unlock();
        }
    }

    public boolean endSession(String workflowId) {
        WorkflowSession session;
        lock.lock();
        try {
            session = sessions.remove(workflowId);
        } finally {
            lock.unlock();
        }
        if (session == null) {
            return false;
        }
        log.info("Ended session. session={} workflow={} jobs={}", session.sessionId(), workflowId, session.jobCount());
        return true;
    }

    public Optional<String> getSessionRobot(String workflowId) {
        return getSession(workflowId).map(WorkflowSession::robotId);
    }

    public void recordSessionJob(String workflowId) {
        Instant now = clock.instant();
        lock.lock();
        try {
            sessions.computeIfPresent(workflowId, (k, s) -> s.isExpired(now) ? null : s.withJobRecorded(now));
        } finally {
            lock.unlock();
        }
    }

    // ---------------------------------------------------------------- selection

    public AffinityDecision selectRobot(String workflowId, AffinityLevel level, List<String> availableRobots, String jobId) {
        return selectRobot(workflowId, level, availableRobots, jobId, null);
    }

    /**
     * Pick a robot for a workflow under the given affinity level.
     *
     * @param availableRobots robots that can take the job right now, in preference order
     * @param jobId           key for HARD-affinity queue attempts, may be null
     * @param scorer          higher is better; null keeps the input order
     * @throws SessionAffinityException when the session robot is unavailable or HARD queue attempts are exhausted
     */
    public AffinityDecision selectRobot(String workflowId, AffinityLevel level, List<String> availableRobots,
                                        String jobId, ToDoubleFunction<String> scorer) {
        Objects.requireNonNull(workflowId, "workflowId must not be null");
        Objects.requireNonNull(level, "level must not be null");
        Objects.requireNonNull(availableRobots, "availableRobots must not be null");

        if (level == AffinityLevel.SESSION) {
            // A pinned session fails fast even when nothing at all is available.
            lock.lock();
            try {
                return selectSession(workflowId, availableRobots, scorer);
            } finally {
                lock.unlock();
            }
        }

        if (availableRobots.isEmpty()) {
            return new AffinityDecision(null, level, "No available robots", false, List.of(), false,
                    level == AffinityLevel.HARD, props.getHardAffinityQueueDelay(), false, null, null);
        }

        lock.lock();
        try {
            List<String> withState = new ArrayList<>();
            for (String robotId : availableRobots) {
                if (hasStateFor(robotId, workflowId)) {
                    withState.add(robotId);
                }
            }
            return switch (level) {
                case NONE -> {
                    String selected = best(availableRobots, scorer);
                    yield AffinityDecision.selected(selected, level, "No affinity required, selected best available robot",
                            withState.contains(selected), withState, false);
                }
                case SOFT -> selectSoft(workflowId, availableRobots, withState, scorer);
                case HARD -> selectHard(workflowId, availableRobots, withState, jobId, scorer);
                case SESSION -> throw new IllegalStateException("unreachable");
            };
        } finally {
            lock.unlock();
        }
    }

    /**
     * Snapshot-based variant: unavailable robots are dropped and the remaining ones ranked by {@code scorer}.
     */
    public AffinityDecision selectAvailableRobot(String workflowId, AffinityLevel level, List<? extends RobotInfo> robots,
                                                 String jobId, ToDoubleFunction<RobotInfo> scorer) {
        Objects.requireNonNull(robots, "robots must not be null");
        Map<String, RobotInfo> byId = new LinkedHashMap<>();
        for (RobotInfo robot : robots) {
            if (robot.isAvailable()) {
                byId.putIfAbsent(robot.robotId(), robot);
            }
        }
        ToDoubleFunction<String> idScorer = scorer == null ? null : id -> scorer.applyAsDouble(byId.get(id));
        return selectRobot(workflowId, level, new ArrayList<>(byId.keySet()), jobId, idScorer);
    }

    private AffinityDecision selectSoft(String workflowId, List<String> available, List<String> withState,
                                        ToDoubleFunction<String> scorer) {
        if (!withState.isEmpty()) {
            return AffinityDecision.selected(best(withState, scorer), AffinityLevel.SOFT,
                    "Selected robot with existing state", true, withState, false);
        }

        String migrationSource = null;
        for (var entry : getAllStateForWorkflow(workflowId).entrySet()) {
            if (!available.contains(entry.getKey()) && entry.getValue().stream().anyMatch(RobotState::migratable)) {
                migrationSource = entry.getKey();
                break;
            }
        }
        String reason = "No robot with state available, falling back to best available"
                + (migrationSource != null ? " (migration possible)" : "");
        return new AffinityDecision(best(available, scorer), AffinityLevel.SOFT, reason, false, withState, true,
                false, Duration.ZERO, migrationSource != null, migrationSource, null);
    }

    private AffinityDecision selectHard(String workflowId, List<String> available, List<String> withState,
                                        String jobId, ToDoubleFunction<String> scorer) {
        if (!withState.isEmpty()) {
            if (jobId != null) {
                queueAttempts.remove(jobId);
            }
            return AffinityDecision.selected(best(withState, scorer), AffinityLevel.HARD,
                    "Selected robot with required state", true, withState, false);
        }

        List<String> holders = getRobotsWithState(workflowId);
        if (holders.isEmpty()) {
            return AffinityDecision.selected(best(available, scorer), AffinityLevel.HARD,
                    "No state exists yet, allowing any robot for initial execution", false, List.of(), true);
        }

        int attempt = 0;
        if (jobId != null) {
            attempt = queueAttempts.getOrDefault(jobId, 0);
            queueAttempts.put(jobId, attempt + 1);
        }
        if (attempt >= props.getMaxQueueAttempts()) {
            queueAttempts.remove(jobId);
            log.warn("Hard affinity queue attempts exhausted. workflow={} job={} holders={}", workflowId, jobId, holders);
            throw new SessionAffinityException("Max queue attempts (" + props.getMaxQueueAttempts()
                    + ") exceeded, required robots " + holders + " unavailable",
                    workflowId, holders.size() == 1 ? holders.get(0) : null);
        }

        Duration delay = queueDelay(attempt);
        log.debug("Queueing hard affinity job. workflow={} job={} attempt={} delay={}", workflowId, jobId, attempt + 1, delay);
        return AffinityDecision.queued(AffinityLevel.HARD, "Required robots " + holders + " unavailable, requeuing (attempt "
                + (attempt + 1) + "/" + props.getMaxQueueAttempts() + ")", holders, delay);
    }

    private AffinityDecision selectSession(String workflowId, List<String> available, ToDoubleFunction<String> scorer) {
        Optional<WorkflowSession> existing = getSession(workflowId);
        if (existing.isPresent()) {
            WorkflowSession session = existing.get();
            if (!available.contains(session.robotId())) {
                throw new SessionAffinityException("Session robot " + session.robotId() + " is not available. Session has "
                        + session.jobCount() + " previous jobs.", workflowId, session.robotId());
            }
            return new AffinityDecision(session.robotId(), AffinityLevel.SESSION,
                    "Using session robot (session " + session.sessionId() + ", " + session.jobCount() + " previous jobs)",
                    true, List.of(session.robotId()), false, false, Duration.ZERO, false, null, session);
        }

        if (available.isEmpty()) {
            return new AffinityDecision(null, AffinityLevel.SESSION, "No available robots", false, List.of(), false,
                    false, Duration.ZERO, false, null, null);
        }

        List<String> withState = new ArrayList<>();
        for (String robotId : available) {
            if (hasStateFor(robotId, workflowId)) {
                withState.add(robotId);
            }
        }
        String selected = best(withState.isEmpty() ? available : withState, scorer);
        WorkflowSession session = createSession(UUID.randomUUID().toString(), workflowId, selected, null, null);
        return new AffinityDecision(selected, AffinityLevel.SESSION,
                "Starting new session" + (withState.isEmpty() ? "" : " with existing state"),
                withState.contains(selected), withState, false, false, Duration.ZERO, false, null, session);
    }

    // First highest score wins so equal scores keep the input order.
    private static String best(List<String> candidates, ToDoubleFunction<String> scorer) {
        if (candidates.isEmpty()) {
            return null;
        }
        if (scorer == null) {
            return candidates.get(0);
        }
        String best = candidates.get(0);
        double bestScore = scorer.applyAsDouble(best);
        for (String candidate : candidates.subList(1, candidates.size())) {
            double score = scorer.applyAsDouble(candidate);
            if (score > bestScore) {
                best = candidate;
                bestScore = score;
            }
        }
        return best;
    }

    /**
     * Queue delay before retry number {@code attempt + 1}: base, 2x base, 4x base ... capped.
     */
    Duration queueDelay(int attempt) {
        int exp = Math.max(0, Math.min(attempt, 20));
        long ms = Math.min(props.getHardAffinityQueueDelay().toMillis() * (1L << exp), props.getMaxQueueDelay().toMillis());
        return Duration.ofMillis(ms);
    }

    public void clearQueueAttempts(String jobId) {
        lock.lock();
        try {
            queueAttempts.remove(jobId);
        } finally {
            lock.unlock();
        }
    }

    // ---------------------------------------------------------------- migration

    public void registerMigrationHandler(String stateType, MigrationHandler handler) {
        migrationHandlers.put(Objects.requireNonNull(stateType, "stateType must not be null"),
                Objects.requireNonNull(handler, "handler must not be null"));
        log.debug("Registered migration handler. stateType={}", stateType);
    }

    /**
     * Move state from {@code sourceRobot} to {@code targetRobot} item by item. Items that are not
     * migratable, have no handler, or whose handler fails are counted as failed and stay on the source.
     *
     * @param stateTypes restrict to these types, or null for all
     */
    public MigrationResult migrateState(String workflowId, String sourceRobot, String targetRobot, Collection<String> stateTypes) {
        List<RobotState> states = getStateForRobot(sourceRobot, workflowId);
        int succeeded = 0;
        int failed = 0;

        for (RobotState state : states) {
            if (stateTypes != null && !stateTypes.contains(state.stateType())) {
                continue;
            }
            if (!state.migratable()) {
                log.warn("State is not migratable. type={} workflow={}", state.stateType(), workflowId);
                failed++;
                continue;
            }
            MigrationHandler handler = migrationHandlers.get(state.stateType());
            if (handler == null) {
                log.warn("No migration handler. type={}", state.stateType());
                failed++;
                continue;
            }
            try {
                handler.migrate(sourceRobot, targetRobot, state).toCompletableFuture().join();
            } catch (CompletionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                log.error("State migration failed. type={} source={} target={} msg={}",
                        state.stateType(), sourceRobot, targetRobot, cause.getMessage(), cause);
                failed++;
                continue;
            } catch (RuntimeException e) {
                log.error("State migration failed. type={} source={} target={} msg={}",
                        state.stateType(), sourceRobot, targetRobot, e.getMessage(), e);
                failed++;
                continue;
            }

            lock.lock();
            try {
                Instant now = clock.instant();
                Duration remaining = state.expiresAt() == null ? Duration.ZERO : Duration.between(now, state.expiresAt());
                if (state.expiresAt() != null && (remaining.isZero() || remaining.isNegative())) {
                    remaining = props.getDefaultStateTtl();
                }
                registerState(targetRobot, workflowId, state.stateType(), remaining, state.metadata(),
                        state.sizeBytes(), state.migratable());
                removeItem(sourceRobot, workflowId, state);
            } finally {
                lock.unlock();
            }
            succeeded++;
            log.info("Migrated state. type={} source={} target={}", state.stateType(), sourceRobot, targetRobot);
        }
        return new MigrationResult(succeeded, failed);
    }

    // ---------------------------------------------------------------- cleanup & stats

    public CleanupResult cleanupExpired() {
        Instant now = clock.instant();
        int statesRemoved = 0;
        int sessionsRemoved = 0;
        lock.lock();
        try {
            var workflows = registry.values().iterator();
            while (workflows.hasNext()) {
                Map<String, List<RobotState>> byRobot = workflows.next();
                var robots = byRobot.values().iterator();
                while (robots.hasNext()) {
                    List<RobotState> states = robots.next();
                    int before = states.size();
                    states.removeIf(s -> s.isExpired(now));
                    statesRemoved += before - states.size();
                    if (states.isEmpty()) {
                        robots.remove();
                    }
                }
                if (byRobot.isEmpty()) {
                    workflows.remove();
                }
            }

            var it = sessions.values().iterator();
            while (it.hasNext()) {
                if (it.next().isExpired(now)) {
                    it.remove();
                    sessionsRemoved++;
                }
            }

            queueAttempts.values().removeIf(attempts -> attempts >= props.getMaxQueueAttempts());
        } finally {
            lock.unlock();
        }
        if (statesRemoved > 0 || sessionsRemoved > 0) {
            log.debug("Affinity cleanup. expiredStates={} expiredSessions={}", statesRemoved, sessionsRemoved);
        }
        return new CleanupResult(statesRemoved, sessionsRemoved);
    }

    public Map<String, Object> getStatistics() {
        Instant now = clock.instant();
        lock.lock();
        try {
            int entries = 0;
            Map<String, Integer> byType = new LinkedHashMap<>();
            for (Map<String, List<RobotState>> byRobot : registry.values()) {
                for (List<RobotState> states : byRobot.values()) {
                    for (RobotState s : states) {
                        if (!s.isExpired(now)) {
                            entries++;
                            byType.merge(s.stateType(), 1, Integer::sum);
                        }
                    }
                }
            }
            long activeSessions = sessions.values().stream().filter(s -> !s.isExpired(now)).count();

            Map<String, Object> stats = new LinkedHashMap<>();
            stats.put("workflows_with_state", registry.size());
            stats.put("total_state_entries", entries);
            stats.put("active_sessions", activeSessions);
            stats.put("state_by_type", byType);
            stats.put("pending_queue_attempts", queueAttempts.size());
            return stats;
        } finally {
            lock.unlock();
        }
    }

    public Map<String, Object> getWorkflowStateSummary(String workflowId) {
        Map<String, List<RobotState>> states = getAllStateForWorkflow(workflowId);
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("workflow_id", workflowId);
        summary.put("has_state", !states.isEmpty());
        summary.put("robots_with_state", new ArrayList<>(states.keySet()));
        summary.put("state_count", states.values().stream().mapToInt(List::size).sum());
        summary.put("session", getSession(workflowId).orElse(null));
        return summary;
    }

    private static void requirePositive(Duration d, String name) {
        Objects.requireNonNull(d, name + " must not be null");
        if (d.isZero() || d.isNegative()) {
            throw new IllegalArgumentException(name + " must be a positive duration");
        }
    }
}
