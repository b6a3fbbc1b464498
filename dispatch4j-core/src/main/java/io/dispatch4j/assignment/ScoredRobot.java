package io.dispatch4j.assignment;

public record ScoredRobot(String robotId, String robotName, double score) {
}
