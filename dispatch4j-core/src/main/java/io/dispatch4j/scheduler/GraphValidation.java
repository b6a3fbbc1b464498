package io.dispatch4j.scheduler;

import java.util.List;

/**
 * @param cyclePath schedule ids along the cycle, first id repeated at the end; empty when valid
 */
public record GraphValidation(boolean valid, List<String> cyclePath) {
    public GraphValidation {
        cyclePath = List.copyOf(cyclePath);
    }

    public static GraphValidation ok() {
        return new GraphValidation(true, List.of());
    }

    public static GraphValidation cycle(List<String> path) {
        return new GraphValidation(false, path);
    }
}
