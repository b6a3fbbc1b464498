package io.dispatch4j.assignment;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Lightweight record of which robots recently completed which workflows successfully.
 * Entries older than the TTL no longer count, whether or not {@link #cleanupExpired()} ran.
 */
public class StateAffinityTracker implements AffinitySignal {
    private final Duration ttl;
    private final Clock clock;
    private final Map<String, Map<String, Instant>> recordedAt = new ConcurrentHashMap<>();

    public StateAffinityTracker(Duration ttl, Clock clock) {
        this.ttl = Objects.requireNonNull(ttl, "ttl must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        if (ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must be a positive duration");
        }
    }

    public void recordState(String workflowId, String robotId) {
        recordedAt.computeIfAbsent(workflowId, k -> new ConcurrentHashMap<>()).put(robotId, clock.instant());
    }

    @Override
    public boolean hasValidState(String workflowId, String robotId) {
        Map<String, Instant> robots = recordedAt.get(workflowId);
        if (robots == null) {
            return false;
        }
        Instant at = robots.get(robotId);
        return at != null && !isExpired(at, clock.instant());
    }

    public List<String> getRobotsWithState(String workflowId) {
        Map<String, Instant> robots = recordedAt.get(workflowId);
        List<String> result = new ArrayList<>();
        if (robots == null) {
            return result;
        }
        Instant now = clock.instant();
        robots.forEach((robotId, at) -> {
            if (!isExpired(at, now)) {
                result.add(robotId);
            }
        });
        return result;
    }

    /**
     * Forget state for one robot, or for every robot when {@code robotId} is null.
     */
    public void clearState(String workflowId, String robotId) {
        if (robotId == null) {
            recordedAt.remove(workflowId);
            return;
        }
        Map<String, Instant> robots = recordedAt.get(workflowId);
        if (robots != null) {
            robots.remove(robotId);
        }
    }

    public int cleanupExpired() {
        Instant now = clock.instant();
        int removed = 0;
        for (var workflow : recordedAt.entrySet()) {
            var it = workflow.getValue().entrySet().iterator();
            while (it.hasNext()) {
                if (isExpired(it.next().getValue(), now)) {
                    it.remove();
                    removed++;
                }
            }
        }
        recordedAt.values().removeIf(Map::isEmpty);
        return removed;
    }

    private boolean isExpired(Instant recorded, Instant now) {
        return now.isAfter(recorded.plus(ttl));
    }
}
