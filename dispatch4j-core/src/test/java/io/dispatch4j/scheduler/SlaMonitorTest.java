package io.dispatch4j.scheduler;

import io.dispatch4j.MutableClock;
import io.dispatch4j.core.SlaConfig;
import io.dispatch4j.core.SlaStatus;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SlaMonitorTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2026-03-02T10:00:00Z"));
    private final SlaMonitor monitor = new SlaMonitor(clock, 10);

    private void run(String scheduleId, boolean success, Duration took) {
        String id = monitor.recordStart(scheduleId, null);
        clock.advance(took);
        monitor.recordCompletion(id, success, null);
    }

    @Test
    void slowRunShouldAlertListenersAndScheduleHandler() {
        List<String> alerts = new ArrayList<>();
        monitor.addAlertListener((id, status, msg) -> alerts.add("listener:" + status + ":" + msg));
        SlaConfig sla = SlaConfig.defaults()
                .withMaxDuration(Duration.ofSeconds(30))
                .withOnBreach((id, status, msg) -> alerts.add("handler:" + id));

        Instant planned = clock.instant();
        clock.advance(Duration.ofMinutes(6));
        String exec = monitor.recordStart("s1", planned);
        clock.advance(Duration.ofMinutes(1));
        monitor.recordCompletion(exec, true, sla);

        assertEquals(2, alerts.size());
        assertEquals("listener:BREACHED:Duration 60000ms exceeded limit 30000ms; Start delay 360000ms exceeded limit 300000ms",
                alerts.get(0));
        assertEquals("handler:s1", alerts.get(1));
    }

    @Test
    void failingListenerShouldNotStopOthers() {
        List<String> alerts = new ArrayList<>();
        monitor.addAlertListener((id, status, msg) -> {
            throw new IllegalStateException("pager down");
        });
        monitor.addAlertListener((id, status, msg) -> alerts.add(id));

        String exec = monitor.recordStart("s1", null);
        clock.advance(Duration.ofSeconds(5));
        monitor.recordCompletion(exec, true, SlaConfig.defaults().withMaxDuration(Duration.ofSeconds(1)));

        assertEquals(List.of("s1"), alerts);
    }

    @Test
    void statusShouldFollowSuccessRate() {
        SlaConfig sla = SlaConfig.defaults().withSuccessRateThreshold(85.0);
        for (int i = 0; i < 9; i++) {
            run("s1", true, Duration.ofSeconds(2));
        }
        run("s1", false, Duration.ofSeconds(2));
        assertEquals(90.0, monitor.getSuccessRate("s1", 24), 1e-9);
        assertEquals(SlaStatus.OK, monitor.evaluate("s1", sla, 1, 24));

        run("s1", false, Duration.ofSeconds(2));
        // 9 of 11 is within five points of the threshold
        assertEquals(SlaStatus.AT_RISK, monitor.evaluate("s1", sla, 2, 24));
        assertEquals(SlaStatus.BREACHED, monitor.evaluate("s1", sla, 3, 24));
        assertEquals(SlaStatus.UNKNOWN, monitor.evaluate("s1", null, 0, 24));
    }

    @Test
    void averagesAndStreaksShouldUseWindow() {
        run("s1", false, Duration.ofSeconds(10));
        run("s1", true, Duration.ofSeconds(2));
        run("s1", true, Duration.ofSeconds(4));

        assertEquals(2, monitor.getSuccessStreak("s1"));
        assertEquals(5333, monitor.getAverageDurationMs("s1", 1));

        clock.advance(Duration.ofHours(2));
        assertEquals(100.0, monitor.getSuccessRate("s1", 1), 1e-9);
        assertEquals(0, monitor.getAverageDurationMs("s1", 1));
    }

    @Test
    void retentionShouldTrimToNewestHalf() {
        for (int i = 0; i < 11; i++) {
            run("s1", true, Duration.ofSeconds(1));
        }

        List<SlaMonitor.ExecutionMetrics> kept = monitor.getMetrics("s1", null, 100);
        assertEquals(5, kept.size());
        assertTrue(kept.get(0).startedAt().isAfter(kept.get(4).startedAt()));
    }
}
