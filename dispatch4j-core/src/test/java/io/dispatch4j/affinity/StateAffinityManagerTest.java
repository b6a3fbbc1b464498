package io.dispatch4j.affinity;

import io.dispatch4j.MutableClock;
import io.dispatch4j.config.AffinityProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StateAffinityManagerTest {

    private static final Instant T0 = Instant.parse("2026-03-02T10:00:00Z");

    private MutableClock clock;
    private StateAffinityManager manager;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        manager = new StateAffinityManager(new AffinityProperties(), clock);
    }

    @Test
    void softAffinityShouldPreferRobotWithState() {
        manager.registerState("r2", "W1", "browser_session");

        for (int i = 0; i < 3; i++) {
            AffinityDecision d = manager.selectRobot("W1", AffinityLevel.SOFT, List.of("r1", "r2", "r3"), "job-" + i);
            assertEquals("r2", d.selectedRobotId());
            assertTrue(d.hasState());
            assertFalse(d.fallbackUsed());
        }
    }

    @Test
    void softAffinityShouldFallBackAndFlagMigration() {
        manager.registerState("r9", "W1", "browser_session");

        AffinityDecision d = manager.selectRobot("W1", AffinityLevel.SOFT, List.of("r1", "r2"), "job-1",
                id -> id.equals("r2") ? 10 : 1);

        assertEquals("r2", d.selectedRobotId());
        assertTrue(d.fallbackUsed());
        assertTrue(d.migrationRequired());
        assertEquals("r9", d.migrationSourceRobot());
    }

    @Test
    void noneShouldIgnoreStateAndUseScorer() {
        manager.registerState("r1", "W1", "cache");

        AffinityDecision d = manager.selectRobot("W1", AffinityLevel.NONE, List.of("r1", "r2"), null,
                id -> id.equals("r2") ? 5 : 0);

        assertEquals("r2", d.selectedRobotId());
        assertEquals(List.of("r1"), d.stateRobots());
    }

    @Test
    void emptyAvailabilityShouldNotSelect() {
        AffinityDecision soft = manager.selectRobot("W1", AffinityLevel.SOFT, List.of(), null);
        assertNull(soft.selectedRobotId());
        assertFalse(soft.shouldQueue());

        AffinityDecision hard = manager.selectRobot("W1", AffinityLevel.HARD, List.of(), null);
        assertTrue(hard.shouldQueue());
        assertEquals(Duration.ofSeconds(30), hard.queueDelay());
    }

    @Test
    void hardAffinityShouldAllowAnyRobotOnFirstRun() {
        AffinityDecision d = manager.selectRobot("W1", AffinityLevel.HARD, List.of("r1", "r2"), "job-1");

        assertEquals("r1", d.selectedRobotId());
        assertTrue(d.fallbackUsed());
        assertFalse(d.shouldQueue());
    }

    @Test
    void hardAffinityShouldQueueWithBackoffThenGiveUp() {
        manager.registerState("r1", "W1", "browser_session");

        Duration[] expected = {
                Duration.ofSeconds(30), Duration.ofSeconds(60), Duration.ofSeconds(120), Duration.ofSeconds(240),
                Duration.ofSeconds(480), Duration.ofMinutes(15), Duration.ofMinutes(15), Duration.ofMinutes(15),
                Duration.ofMinutes(15), Duration.ofMinutes(15)
        };
        for (Duration delay : expected) {
            AffinityDecision d = manager.selectRobot("W1", AffinityLevel.HARD, List.of("r2"), "job-1");
            assertTrue(d.shouldQueue());
            assertNull(d.selectedRobotId());
            assertEquals(delay, d.queueDelay());
        }

        SessionAffinityException e = assertThrows(SessionAffinityException.class,
                () -> manager.selectRobot("W1", AffinityLevel.HARD, List.of("r2"), "job-1"));
        assertEquals("r1", e.getRequiredRobotId());
        assertEquals("W1", e.getWorkflowId());
    }

    @Test
    void hardAffinityShouldResetAttemptsOnceHolderReturns() {
        manager.registerState("r1", "W1", "browser_session");
        manager.selectRobot("W1", AffinityLevel.HARD, List.of("r2"), "job-1");
        manager.selectRobot("W1", AffinityLevel.HARD, List.of("r2"), "job-1");

        assertEquals("r1", manager.selectRobot("W1", AffinityLevel.HARD, List.of("r1", "r2"), "job-1").selectedRobotId());
        assertEquals(Duration.ofSeconds(30),
                manager.selectRobot("W1", AffinityLevel.HARD, List.of("r2"), "job-1").queueDelay());
    }

    @Test
    void sessionShouldPinWorkflowToOneRobot() {
        AffinityDecision first = manager.selectRobot("W1", AffinityLevel.SESSION, List.of("r1", "r2"), null);
        assertEquals("r1", first.selectedRobotId());
        assertNotNull(first.session());
        manager.recordSessionJob("W1");

        AffinityDecision second = manager.selectRobot("W1", AffinityLevel.SESSION, List.of("r2", "r1"), null);
        assertEquals("r1", second.selectedRobotId());
        assertEquals(1, second.session().jobCount());
    }

    @Test
    void sessionRobotUnavailableShouldFailEvenWithNoRobots() {
        manager.createSession("s-1", "W1", "r1", null, null);

        SessionAffinityException e = assertThrows(SessionAffinityException.class,
                () -> manager.selectRobot("W1", AffinityLevel.SESSION, List.of(), null));
        assertEquals("r1", e.getRequiredRobotId());
        assertThrows(SessionAffinityException.class,
                () -> manager.selectRobot("W1", AffinityLevel.SESSION, List.of("r2"), null));
    }

    @Test
    void idleSessionShouldExpire() {
        manager.createSession("s-1", "W1", "r1", null, Duration.ofMinutes(10));

        clock.advance(Duration.ofMinutes(11));

        assertTrue(manager.getSession("W1").isEmpty());
        assertEquals("r2", manager.selectRobot("W1", AffinityLevel.SESSION, List.of("r2"), null).selectedRobotId());
    }

    @Test
    void expiredStateShouldBeInvisibleBeforeSweep() {
        manager.registerState("r1", "W1", "cache", Duration.ofMinutes(10), Map.of(), 0, true);
        manager.registerState("r1", "W1", "pinned", Duration.ZERO, Map.of(), 0, true);

        clock.advance(Duration.ofMinutes(11));

        assertEquals(1, manager.getStateForRobot("r1", "W1").size());
        assertEquals("pinned", manager.getStateForRobot("r1", "W1").get(0).stateType());
        assertEquals(1, manager.cleanupExpired().expiredStates());
        assertTrue(manager.hasStateFor("r1", "W1"));
    }

    @Test
    void unregisterShouldRemoveByType() {
        manager.registerState("r1", "W1", "cache");
        manager.registerState("r1", "W1", "files");

        assertEquals(1, manager.unregisterState("r1", "W1", "cache"));
        assertEquals(1, manager.unregisterState("r1", "W1", null));
        assertFalse(manager.hasStateFor("r1", "W1"));
        assertEquals(0, manager.unregisterState("r1", "W1", null));
    }

    @Test
    void migrationShouldMoveItemsIndependently() {
        manager.registerState("r1", "W1", "browser_session");
        manager.registerState("r1", "W1", "files");
        manager.registerState("r1", "W1", "cache", null, Map.of(), 0, false);
        manager.registerMigrationHandler("browser_session", MigrationHandler.blocking((s, t, state) -> {
        }));
        manager.registerMigrationHandler("files",
                (s, t, state) -> CompletableFuture.failedFuture(new IllegalStateException("disk full")));

        clock.advance(Duration.ofMinutes(20));
        MigrationResult result = manager.migrateState("W1", "r1", "r2", null);

        assertEquals(1, result.succeeded());
        assertEquals(2, result.failed());
        assertFalse(result.isComplete());
        List<RobotState> moved = manager.getStateForRobot("r2", "W1");
        assertEquals(1, moved.size());
        assertEquals(T0.plus(Duration.ofHours(1)), moved.get(0).expiresAt());
        assertEquals(2, manager.getStateForRobot("r1", "W1").size());
    }

    @Test
    void failedMigrationShouldKeepSiblingOfSameType() {
        manager.registerState("r1", "W1", "browser_session", null, Map.of("profile", "a"), 0, true);
        manager.registerState("r1", "W1", "browser_session", null, Map.of("profile", "b"), 0, true);
        manager.registerMigrationHandler("browser_session", MigrationHandler.blocking((s, t, state) -> {
            if ("b".equals(state.metadata().get("profile"))) {
                throw new IllegalStateException("profile locked");
            }
        }));

        MigrationResult result = manager.migrateState("W1", "r1", "r2", null);

        assertEquals(1, result.succeeded());
        assertEquals(1, result.failed());
        List<RobotState> left = manager.getStateForRobot("r1", "W1");
        assertEquals(1, left.size());
        assertEquals("b", left.get(0).metadata().get("profile"));
        List<RobotState> moved = manager.getStateForRobot("r2", "W1");
        assertEquals(1, moved.size());
        assertEquals("a", moved.get(0).metadata().get("profile"));
    }

    @Test
    void startAndStopShouldBeIdempotent() {
        manager.start();
        manager.start();
        assertTrue(manager.isRunning());
        manager.stop();
        manager.stop();
        assertFalse(manager.isRunning());
    }

    @Test
    void invalidPropertiesShouldBeRejected() {
        AffinityProperties props = new AffinityProperties();
        props.setMaxQueueAttempts(0);

        assertThrows(IllegalArgumentException.class, () -> new StateAffinityManager(props, clock));
    }
}
