package io.dispatch4j.assignment;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.ToDoubleFunction;

/**
 * Picks the robot that should run a job.
 * <p>
 * Robots are first filtered by hard constraints (availability, capabilities, environment, minimum
 * resources). Survivors start from a score of 100 and collect weighted penalties and bonuses for
 * load, job slots, tags, state affinity and network zone. The highest score wins; ties keep the
 * order in which robots were offered.
 * <p>
 * Scoring holds no lock. The only mutable state is the internal {@link StateAffinityTracker}.
 */
public class JobAssignmentEngine {
    private static final Logger log = LoggerFactory.getLogger(JobAssignmentEngine.class);

    public static final double BASE_SCORE = 100.0;
    public static final int MAX_ALTERNATIVES = 4;

    private final ScoringWeights weights;
    private final String networkZone;
    private final StateAffinityTracker tracker;
    private final AffinitySignal externalSignal;

    public JobAssignmentEngine() {
        this(ScoringWeights.defaults(), Duration.ofHours(1), RobotInfo.DEFAULT_ZONE, AffinitySignal.NONE, Clock.systemUTC());
    }

    public JobAssignmentEngine(ScoringWeights weights, Duration stateTtl, String networkZone,
                               AffinitySignal externalSignal, Clock clock) {
        this.weights = Objects.requireNonNull(weights, "weights must not be null");
        this.networkZone = Objects.requireNonNull(networkZone, "networkZone must not be null");
        this.externalSignal = Objects.requireNonNull(externalSignal, "externalSignal must not be null");
        this.tracker = new StateAffinityTracker(stateTtl, Objects.requireNonNull(clock, "clock must not be null"));

        log.info("JobAssignmentEngine initialized. cpuWeight={} memoryWeight={} tagWeight={} affinityWeight={} zone={}",
                weights.cpuLoadWeight(), weights.memoryLoadWeight(), weights.tagMatchWeight(),
                weights.stateAffinityWeight(), networkZone);
    }

    public ScoringWeights getWeights() {
        return weights;
    }

    public AssignmentResult assignJob(JobRequirements requirements, List<? extends RobotInfo> robots) {
        return assignJob(requirements, robots, null);
    }

    /**
     * @param orchestratorZone zone used for the proximity bonus, or null for the engine's own zone
     * @throws NoCapableRobotException if no robot passes the hard filter
     */
    public AssignmentResult assignJob(JobRequirements requirements, List<? extends RobotInfo> robots, String orchestratorZone) {
        AssignmentOutcome outcome = tryAssign(requirements, robots, orchestratorZone);
        if (outcome instanceof AssignmentOutcome.Assigned assigned) {
            return assigned.result();
        }
        AssignmentOutcome.Rejected rejected = (AssignmentOutcome.Rejected) outcome;
        log.warn("No capable robot found. job={} requiredCapabilities={} environment={} candidates={}",
                rejected.jobName(), rejected.requiredCapabilities(), rejected.environment(), rejected.candidates());
        throw rejected.toException();
    }

    /**
     * Same decision as {@link #assignJob(JobRequirements, List, String)} returned as a value.
     */
    public AssignmentOutcome tryAssign(JobRequirements requirements, List<? extends RobotInfo> robots, String orchestratorZone) {
        Objects.requireNonNull(requirements, "requirements must not be null");
        Objects.requireNonNull(robots, "robots must not be null");
        long startNanos = System.nanoTime();
        String zone = orchestratorZone != null ? orchestratorZone : networkZone;

        List<RobotInfo> capable = filterByHardConstraints(requirements, robots);
        if (capable.isEmpty()) {
            return new AssignmentOutcome.Rejected(requirements.workflowName(), requirements.requiredCapabilityNames(),
                    requirements.environment(), robots.size());
        }

        List<Scored> scored = new ArrayList<>(capable.size());
        for (RobotInfo robot : capable) {
            Map<String, Double> breakdown = breakdown(requirements, robot, zone, true);
            scored.add(new Scored(robot, sum(breakdown), breakdown));
        }
        // List.sort is stable, equal scores keep input order
        scored.sort(Comparator.comparingDouble(Scored::score).reversed());

        Scored best = scored.get(0);
        List<ScoredRobot> alternatives = new ArrayList<>();
        for (Scored s : scored.subList(1, Math.min(scored.size(), MAX_ALTERNATIVES + 1))) {
            alternatives.add(new ScoredRobot(s.robot().robotId(), s.robot().name(), s.score()));
        }
        Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);

        log.info("Assigned job. job={} robot={} score={} alternatives={}",
                requirements.workflowName(), best.robot().name(), String.format("%.1f", best.score()), scored.size() - 1);

        return new AssignmentOutcome.Assigned(new AssignmentResult(best.robot().robotId(), best.robot().name(),
                best.score(), best.breakdown(), alternatives, elapsed));
    }

    /**
     * Soft score without the state-affinity factor, for callers that apply affinity themselves.
     */
    public ToDoubleFunction<RobotInfo> scorer(JobRequirements requirements, String orchestratorZone) {
        Objects.requireNonNull(requirements, "requirements must not be null");
        String zone = orchestratorZone != null ? orchestratorZone : networkZone;
        return robot -> sum(breakdown(requirements, robot, zone, false));
    }

    List<RobotInfo> filterByHardConstraints(JobRequirements requirements, List<? extends RobotInfo> robots) {
        List<RobotInfo> capable = new ArrayList<>();
        for (RobotInfo robot : robots) {
            if (!robot.isAvailable()) {
                log.debug("Robot filtered: not available. robot={} status={} jobs={}/{}",
                        robot.name(), robot.status(), robot.currentJobs(), robot.maxConcurrentJobs());
                continue;
            }
            if (!matchesCapabilities(requirements, robot)) {
                log.debug("Robot filtered: missing required capabilities. robot={}", robot.name());
                continue;
            }
            String required = requirements.environment();
            if (!RobotInfo.DEFAULT_ENVIRONMENT.equals(required)
                    && !required.equals(robot.environment())
                    && !RobotInfo.DEFAULT_ENVIRONMENT.equals(robot.environment())) {
                log.debug("Robot filtered: environment mismatch. robot={} required={} has={}",
                        robot.name(), required, robot.environment());
                continue;
            }
            if (!meetsResourceRequirements(requirements, robot)) {
                log.debug("Robot filtered: insufficient resources. robot={}", robot.name());
                continue;
            }
            capable.add(robot);
        }
        return capable;
    }

    private static boolean matchesCapabilities(JobRequirements requirements, RobotInfo robot) {
        for (RobotCapability required : requirements.requiredCapabilities()) {
            if (!robot.hasCapability(required)) {
                return false;
            }
        }
        return true;
    }

    private static boolean meetsResourceRequirements(JobRequirements requirements, RobotInfo robot) {
        if (requirements.minMemoryGb() > 0 && robot.resource("memory_total_gb") < requirements.minMemoryGb()) {
            return false;
        }
        return requirements.minCpuCores() <= 0 || robot.resource("cpu_count") >= requirements.minCpuCores();
    }

    private Map<String, Double> breakdown(JobRequirements requirements, RobotInfo robot, String zone, boolean withState) {
        Map<String, Double> b = new LinkedHashMap<>();
        b.put("base", BASE_SCORE);
        b.put("cpu_load", -loadPenalty(robot.cpuPercent(), weights.cpuMediumThreshold(), weights.cpuHighThreshold())
                * weights.cpuLoadWeight());
        b.put("memory_load", -loadPenalty(robot.memoryPercent(), weights.memoryMediumThreshold(), weights.memoryHighThreshold())
                * weights.memoryLoadWeight());
        b.put("job_count", -jobCountPenalty(robot) * weights.jobCountWeight());
        b.put("tag_match", tagBonus(requirements, robot) * weights.tagMatchWeight());
        if (withState && requirements.requiresState()) {
            double bonus = hasState(requirements.workflowId(), robot.robotId()) ? weights.stateAffinityBonus() : 0.0;
            b.put("state_affinity", bonus * weights.stateAffinityWeight());
        }
        double proximity = zone.equals(robot.networkZone()) ? weights.sameZoneBonus() : 0.0;
        b.put("network_proximity", proximity * weights.networkProximityWeight());
        return b;
    }

    private static double sum(Map<String, Double> breakdown) {
        double total = 0.0;
        for (double v : breakdown.values()) {
            total += v;
        }
        return total;
    }

    private double loadPenalty(double percent, double medium, double high) {
        if (percent > high) {
            return weights.highLoadPenalty();
        }
        if (percent > medium) {
            return weights.mediumLoadPenalty();
        }
        return 0.0;
    }

    private double jobCountPenalty(RobotInfo robot) {
        if (robot.maxConcurrentJobs() == 0) {
            return weights.highLoadPenalty();
        }
        double utilization = (double) robot.currentJobs() / robot.maxConcurrentJobs();
        if (utilization > 0.8) {
            return weights.highLoadPenalty();
        }
        if (utilization > 0.5) {
            return weights.mediumLoadPenalty();
        }
        return utilization * 10;
    }

    private double tagBonus(JobRequirements requirements, RobotInfo robot) {
        Set<String> robotTags = robot.tags() == null ? Set.of() : new HashSet<>(robot.tags());
        Set<String> required = new HashSet<>(requirements.requiredTags());
        required.retainAll(robotTags);
        Set<String> preferred = new HashSet<>(requirements.preferredTags());
        preferred.retainAll(robotTags);
        return required.size() * weights.tagMatchBonus() + preferred.size() * weights.tagMatchBonus() * 0.5;
    }

    private boolean hasState(String workflowId, String robotId) {
        return tracker.hasValidState(workflowId, robotId) || externalSignal.hasValidState(workflowId, robotId);
    }

    /**
     * Successful runs leave state behind on the robot; failed runs are not recorded.
     */
    public void recordJobCompletion(String workflowId, String robotId, boolean success) {
        if (success) {
            tracker.recordState(workflowId, robotId);
            log.debug("Recorded state affinity. workflow={} robot={}", workflowId, robotId);
        }
    }

    public void clearStateAffinity(String workflowId, String robotId) {
        tracker.clearState(workflowId, robotId);
    }

    public int cleanupExpiredState() {
        int removed = tracker.cleanupExpired();
        if (removed > 0) {
            log.debug("Removed expired state affinity records. count={}", removed);
        }
        return removed;
    }

    public List<String> getRobotsWithState(String workflowId) {
        return tracker.getRobotsWithState(workflowId);
    }

    public Map<String, Object> getStatistics() {
        Map<String, Object> stats = new LinkedHashMap<>();
        Map<String, Double> w = new LinkedHashMap<>();
        w.put("cpu_load", weights.cpuLoadWeight());
        w.put("memory_load", weights.memoryLoadWeight());
        w.put("tag_match", weights.tagMatchWeight());
        w.put("state_affinity", weights.stateAffinityWeight());
        w.put("network_proximity", weights.networkProximityWeight());
        w.put("job_count", weights.jobCountWeight());
        stats.put("weights", w);
        Map<String, Double> t = new LinkedHashMap<>();
        t.put("cpu_high", weights.cpuHighThreshold());
        t.put("cpu_medium", weights.cpuMediumThreshold());
        t.put("memory_high", weights.memoryHighThreshold());
        t.put("memory_medium", weights.memoryMediumThreshold());
        stats.put("thresholds", t);
        stats.put("network_zone", networkZone);
        return stats;
    }

    private record Scored(RobotInfo robot, double score, Map<String, Double> breakdown) {
    }
}
