package io.dispatch4j.assignment;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one assignment decision.
 *
 * @param scoreBreakdown weighted contribution per factor, starting with {@code base}; the values sum to {@code score}
 * @param alternatives   up to four runner-ups, best first
 * @param decisionTime   time spent filtering and scoring
 */
public record AssignmentResult(
        String robotId,
        String robotName,
        double score,
        Map<String, Double> scoreBreakdown,
        List<ScoredRobot> alternatives,
        Duration decisionTime
) {
    public AssignmentResult {
        scoreBreakdown = Collections.unmodifiableMap(new LinkedHashMap<>(scoreBreakdown));
        alternatives = List.copyOf(alternatives);
    }
}
