package io.dispatch4j.scheduler;

import io.dispatch4j.core.DependencyConfig;
import io.dispatch4j.core.EventTriggerConfig;
import io.dispatch4j.core.EventType;
import io.dispatch4j.core.Priority;
import io.dispatch4j.core.Schedule;
import io.dispatch4j.core.ScheduleType;
import org.junit.jupiter.api.Test;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SimpleScheduleBuilderTest {

    @Test
    void defaultsShouldDescribeActiveCronSchedule() {
        Schedule s = new SimpleScheduleBuilder("s1", "Invoices", "wf-invoices").cron("0 9 * * 1-5").build();

        assertEquals(ScheduleType.CRON, s.type());
        assertTrue(s.enabled());
        assertEquals("UTC", s.timezone());
        assertEquals(Priority.NORMAL.value(), s.priority());
        assertEquals(3, s.maxInstances());
        assertFalse(s.respectBusinessHours());
        assertEquals("", s.workflowName());
    }

    @Test
    void lastTriggerCallShouldWin() {
        Schedule s = new SimpleScheduleBuilder("s1", "Sync", "wf-sync")
                .cron("daily")
                .every("15 minutes")
                .build();

        assertEquals(ScheduleType.INTERVAL, s.type());
        assertEquals(Duration.ofMinutes(15), s.interval());
    }

    @Test
    void everyShouldAcceptSecondsAndDurations() {
        assertEquals(Duration.ofSeconds(90), new SimpleScheduleBuilder("s1", "n", "wf").every(90).build().interval());
        assertEquals(Duration.ofHours(2), new SimpleScheduleBuilder("s1", "n", "wf").every(Duration.ofHours(2)).build().interval());

        SimpleScheduleBuilder b = new SimpleScheduleBuilder("s1", "n", "wf");
        assertThrows(IllegalArgumentException.class, () -> b.every(0));
        assertThrows(IllegalArgumentException.class, () -> b.every(1.5));
        assertThrows(IllegalArgumentException.class, () -> b.every(Duration.ofSeconds(-1)));
        assertThrows(IllegalArgumentException.class, () -> b.every("soon"));
    }

    @Test
    void typeSelectorsShouldSetTheirConfig() {
        Instant at = Instant.parse("2026-05-01T08:00:00Z");
        assertEquals(ScheduleType.ONE_TIME, new SimpleScheduleBuilder("s1", "n", "wf").at(at).build().type());

        Schedule event = new SimpleScheduleBuilder("s2", "n", "wf")
                .onEvent(EventTriggerConfig.of(EventType.FILE_ARRIVAL, "sftp"))
                .build();
        assertEquals(ScheduleType.EVENT, event.type());

        Schedule dep = new SimpleScheduleBuilder("s3", "n", "wf")
                .afterCompletionOf(DependencyConfig.on("s1", "s2"))
                .build();
        assertEquals(ScheduleType.DEPENDENCY, dep.type());
        assertEquals(List.of("s1", "s2"), dep.dependency().dependsOn());

        Schedule gated = new SimpleScheduleBuilder("s4", "n", "wf")
                .cron("hourly")
                .dependency(DependencyConfig.on("s1"))
                .build();
        assertEquals(ScheduleType.CRON, gated.type());
    }

    @Test
    void businessCalendarShouldToggleBusinessHours() {
        SimpleScheduleBuilder b = new SimpleScheduleBuilder("s1", "n", "wf");

        assertTrue(b.businessCalendar("us").build().respectBusinessHours());
        Schedule cleared = b.businessCalendar(null).build();
        assertFalse(cleared.respectBusinessHours());
        assertNull(cleared.calendarId());
    }

    @Test
    void invalidValuesShouldBeRejected() {
        SimpleScheduleBuilder b = new SimpleScheduleBuilder("s1", "n", "wf");

        assertThrows(DateTimeException.class, () -> b.timezone("Mars/Olympus"));
        assertThrows(IllegalArgumentException.class, () -> b.maxInstances(0));
        assertThrows(IllegalArgumentException.class, () -> new SimpleScheduleBuilder(" ", "n", "wf"));
        assertThrows(NullPointerException.class, () -> new SimpleScheduleBuilder("s1", null, "wf"));
    }

    @Test
    void saveShouldHandDefinitionToPersister() {
        List<Schedule> saved = new ArrayList<>();
        boolean result = new SimpleScheduleBuilder("s1", "n", "wf", saved::add)
                .every("1h")
                .variables(Map.of("region", "eu"))
                .save();

        assertTrue(result);
        assertEquals(1, saved.size());
        assertEquals("eu", saved.get(0).variables().get("region"));
        assertThrows(IllegalStateException.class, () -> new SimpleScheduleBuilder("s2", "n", "wf").save());
    }

    @Test
    void fromShouldCopyEveryField() {
        Schedule original = new SimpleScheduleBuilder("s1", "Invoices", "wf")
                .workflowName("Invoice run")
                .cron("0 2 * * *")
                .timezone("Europe/London")
                .businessCalendar("uk")
                .priority(Priority.HIGH)
                .maxInstances(1)
                .robotId("robot-7")
                .tags(List.of("finance"))
                .createdBy("ops")
                .build();

        assertEquals(original, SimpleScheduleBuilder.from(original).build());
        assertFalse(SimpleScheduleBuilder.from(original).enabled(false).build().enabled());
    }
}
