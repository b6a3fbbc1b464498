package io.dispatch4j.scheduler;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EventFilterMatcherTest {

    private static final Map<String, Object> EVENT = Map.of(
            "path", "/inbox/invoice-42.pdf",
            "size", 2048,
            "customer", "acme"
    );

    @Test
    void emptyFilterShouldMatchAnything() {
        assertTrue(EventFilterMatcher.matches(EVENT, Map.of()));
        assertTrue(EventFilterMatcher.matches(null, null));
    }

    @Test
    void plainValuesShouldCompareLoosely() {
        assertTrue(EventFilterMatcher.matches(EVENT, Map.of("customer", "acme", "size", 2048L)));
        assertFalse(EventFilterMatcher.matches(EVENT, Map.of("customer", "globex")));
        assertFalse(EventFilterMatcher.matches(EVENT, Map.of("region", "eu")));
    }

    @Test
    void operatorsShouldAllHold() {
        assertTrue(EventFilterMatcher.matches(EVENT, Map.of("size", Map.of("$gt", 1024, "$lt", 4096.5))));
        assertFalse(EventFilterMatcher.matches(EVENT, Map.of("size", Map.of("$gt", 4096))));
        assertTrue(EventFilterMatcher.matches(EVENT, Map.of("customer", Map.of("$in", List.of("acme", "initech")))));
        assertFalse(EventFilterMatcher.matches(EVENT, Map.of("customer", Map.of("$ne", "acme"))));
        assertTrue(EventFilterMatcher.matches(EVENT, Map.of("customer", Map.of("$eq", "acme"))));
    }

    @Test
    void regexShouldAnchorAtStartOnly() {
        assertTrue(EventFilterMatcher.matches(EVENT, Map.of("path", Map.of("$regex", "/inbox/"))));
        assertFalse(EventFilterMatcher.matches(EVENT, Map.of("path", Map.of("$regex", "invoice"))));
        assertFalse(EventFilterMatcher.matches(EVENT, Map.of("path", Map.of("$regex", "[unclosed"))));
    }

    @Test
    void incomparableBoundsShouldFail() {
        assertFalse(EventFilterMatcher.matches(EVENT, Map.of("customer", Map.of("$gt", 5))));
        assertFalse(EventFilterMatcher.matches(EVENT, Map.of("customer", Map.of("$lt", 5))));
    }
}
