package io.dispatch4j.core;

import java.time.Duration;
import java.util.List;

/**
 * @param waitForAll           all of {@code dependsOn} must have completed, otherwise any one is enough
 * @param triggerOnSuccessOnly failed completions do not count
 */
public record DependencyConfig(List<String> dependsOn, boolean waitForAll, Duration timeout, boolean triggerOnSuccessOnly) {
    public DependencyConfig {
        dependsOn = dependsOn == null ? List.of() : List.copyOf(dependsOn);
        timeout = timeout == null ? Duration.ofHours(1) : timeout;
    }

    public static DependencyConfig on(String... scheduleIds) {
        return new DependencyConfig(List.of(scheduleIds), true, Duration.ofHours(1), true);
    }
}
