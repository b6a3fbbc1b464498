package io.dispatch4j.scheduler;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Depth-first cycle detection over schedule dependencies.
 */
public final class DependencyGraphValidator {

    private DependencyGraphValidator() {
    }

    /**
     * @param graph schedule id to the ids it depends on; iteration order decides which cycle is reported
     */
    public static GraphValidation validate(Map<String, List<String>> graph) {
        Set<String> visited = new HashSet<>();
        Set<String> onStack = new HashSet<>();
        for (String node : graph.keySet()) {
            if (!visited.contains(node)) {
                List<String> cycle = visit(node, graph, visited, onStack, new ArrayList<>());
                if (cycle != null) {
                    return GraphValidation.cycle(cycle);
                }
            }
        }
        return GraphValidation.ok();
    }

    private static List<String> visit(String node, Map<String, List<String>> graph, Set<String> visited,
                                      Set<String> onStack, List<String> path) {
        visited.add(node);
        onStack.add(node);
        path.add(node);
        for (String next : graph.getOrDefault(node, List.of())) {
            if (!visited.contains(next)) {
                List<String> cycle = visit(next, graph, visited, onStack, path);
                if (cycle != null) {
                    return cycle;
                }
            } else if (onStack.contains(next)) {
                List<String> cycle = new ArrayList<>(path.subList(path.indexOf(next), path.size()));
                cycle.add(next);
                return cycle;
            }
        }
        path.remove(path.size() - 1);
        onStack.remove(node);
        return null;
    }
}
