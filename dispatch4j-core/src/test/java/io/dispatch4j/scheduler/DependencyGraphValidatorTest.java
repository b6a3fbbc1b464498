package io.dispatch4j.scheduler;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DependencyGraphValidatorTest {

    @Test
    void acyclicGraphShouldBeValid() {
        Map<String, List<String>> graph = new LinkedHashMap<>();
        graph.put("report", List.of("transform"));
        graph.put("transform", List.of("extract-a", "extract-b"));
        graph.put("extract-a", List.of());

        GraphValidation result = DependencyGraphValidator.validate(graph);

        assertTrue(result.valid());
        assertTrue(result.cyclePath().isEmpty());
    }

    @Test
    void cycleShouldBeReportedWithClosingNode() {
        Map<String, List<String>> graph = new LinkedHashMap<>();
        graph.put("a", List.of("b"));
        graph.put("b", List.of("c"));
        graph.put("c", List.of("a"));

        GraphValidation result = DependencyGraphValidator.validate(graph);

        assertFalse(result.valid());
        assertEquals(List.of("a", "b", "c", "a"), result.cyclePath());
    }

    @Test
    void selfDependencyShouldBeACycle() {
        GraphValidation result = DependencyGraphValidator.validate(Map.of("a", List.of("a")));

        assertEquals(List.of("a", "a"), result.cyclePath());
    }
}
