package io.dispatch4j.internal.mongo;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mongodb.client.MongoClients;
import io.dispatch4j.config.SchedulerProperties;
import io.dispatch4j.core.CatchUpConfig;
import io.dispatch4j.core.DependencyConfig;
import io.dispatch4j.core.EventTriggerConfig;
import io.dispatch4j.core.EventType;
import io.dispatch4j.core.PersistResult;
import io.dispatch4j.core.RateLimitConfig;
import io.dispatch4j.core.Schedule;
import io.dispatch4j.core.ScheduleInfo;
import io.dispatch4j.core.ScheduleStatus;
import io.dispatch4j.core.ScheduleType;
import io.dispatch4j.core.SlaConfig;
import io.dispatch4j.scheduler.DefaultFleetScheduler;
import io.dispatch4j.scheduler.SimpleScheduleBuilder;
import org.bson.Document;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Testcontainers(disabledWithoutDocker = true)
class MongoScheduleStoreIntegrationTest {

    @Container
    static final MongoDBContainer MONGO = new MongoDBContainer("mongo:7.0");

    private static final Instant CREATED = Instant.parse("2026-03-02T10:00:00Z");

    private MongoTemplate mongoTemplate;
    private MongoScheduleStore store;

    @BeforeEach
    void setUp() {
        mongoTemplate = new MongoTemplate(MongoClients.create(MONGO.getReplicaSetUrl()), "dispatch4j_test");
        mongoTemplate.dropCollection(ScheduleDocument.class);
        store = new MongoScheduleStore(mongoTemplate, new ObjectMapper());
    }

    @AfterEach
    void tearDown() {
        mongoTemplate.dropCollection(ScheduleDocument.class);
    }

    @Test
    void saveShouldUpsertByScheduleId() {
        ScheduleInfo info = ScheduleInfo.fresh(cron("nightly-invoices"), CREATED);

        PersistResult first = store.save(info);
        PersistResult second = store.save(info);

        assertTrue(first.created());
        assertTrue(second.updated());
        assertEquals(1, mongoTemplate.getCollection("dispatch_schedules").countDocuments());
    }

    @Test
    void findByIdShouldRestoreDefinitionAndCounters() {
        Schedule schedule = new SimpleScheduleBuilder("claims-intake", "Claims intake", "wf-claims")
                .workflowName("Claims")
                .every(Duration.ofMinutes(15))
                .businessCalendar("us-ops")
                .rateLimit(new RateLimitConfig(4, Duration.ofHours(1), true))
                .dependency(new DependencyConfig(List.of("claims-extract", "claims-ocr"), false, Duration.ofMinutes(30), true))
                .sla(SlaConfig.defaults().withMaxDuration(Duration.ofMinutes(10)).withConsecutiveFailureLimit(2))
                .catchUp(new CatchUpConfig(true, 3, 12, false))
                .maxInstances(2)
                .robotId("robot-7")
                .variables(Map.of("queue", "claims", "batch", 25))
                .tags(List.of("finance", "ocr"))
                .createdBy("ops")
                .build();
        Instant lastRun = CREATED.plusSeconds(900);
        store.save(new ScheduleInfo(schedule, ScheduleStatus.ACTIVE, lastRun, lastRun.plusSeconds(900), 7, 5, 2, 1,
                CREATED, lastRun));

        ScheduleInfo loaded = store.findById("claims-intake").orElseThrow();

        Schedule s = loaded.schedule();
        assertEquals(ScheduleType.INTERVAL, s.type());
        assertEquals("Claims", s.workflowName());
        assertEquals(Duration.ofMinutes(15), s.interval());
        assertEquals("us-ops", s.calendarId());
        assertTrue(s.respectBusinessHours());
        assertEquals(schedule.rateLimit(), s.rateLimit());
        assertEquals(schedule.dependency(), s.dependency());
        assertEquals(schedule.sla(), s.sla());
        assertEquals(schedule.catchUp(), s.catchUp());
        assertEquals(2, s.maxInstances());
        assertEquals("robot-7", s.robotId());
        assertEquals(Map.of("queue", "claims", "batch", 25), s.variables());
        assertEquals(List.of("finance", "ocr"), s.tags());

        assertEquals(ScheduleStatus.ACTIVE, loaded.status());
        assertEquals(lastRun, loaded.lastRun());
        assertEquals(lastRun.plusSeconds(900), loaded.nextRun());
        assertEquals(7, loaded.runCount());
        assertEquals(5, loaded.successCount());
        assertEquals(2, loaded.failureCount());
        assertEquals(1, loaded.consecutiveFailures());
        assertEquals(CREATED, loaded.createdAt());
    }

    @Test
    void eventTriggerShouldSurviveRoundTrip() {
        Schedule schedule = new SimpleScheduleBuilder("pdf-drop", "PDF drop", "wf-docs")
                .onEvent(new EventTriggerConfig(EventType.FILE_ARRIVAL, "sftp", Map.of("ext", "pdf"), Duration.ofMinutes(5)))
                .build();
        store.save(ScheduleInfo.fresh(schedule, CREATED));

        EventTriggerConfig loaded = store.findById("pdf-drop").orElseThrow().schedule().eventTrigger();

        assertEquals(schedule.eventTrigger(), loaded);
    }

    @Test
    void clearedFieldsShouldBeRemovedFromDocument() {
        Schedule withSla = new SimpleScheduleBuilder("s1", "n", "wf").cron("0 6 * * *")
                .sla(SlaConfig.defaults().withOnBreach((id, status, msg) -> {
                }))
                .build();
        store.save(new ScheduleInfo(withSla, ScheduleStatus.ACTIVE, CREATED, CREATED.plusSeconds(60), 1, 1, 0, 0,
                CREATED, CREATED));
        Schedule withoutSla = SimpleScheduleBuilder.from(withSla).sla(null).build();
        store.save(new ScheduleInfo(withoutSla, ScheduleStatus.PAUSED, CREATED, null, 1, 1, 0, 0, CREATED, CREATED));

        Document raw = mongoTemplate.getCollection("dispatch_schedules").find().first();
        assertNotNull(raw);
        assertFalse(raw.containsKey("sla"));
        assertTrue(raw.containsKey("nextRun"));
        assertNull(raw.get("nextRun"));

        ScheduleInfo loaded = store.findById("s1").orElseThrow();
        assertNull(loaded.schedule().sla());
        assertNull(loaded.nextRun());
        assertEquals(ScheduleStatus.PAUSED, loaded.status());
    }

    @Test
    void breachHandlerShouldNotBePersisted() {
        Schedule schedule = new SimpleScheduleBuilder("s1", "n", "wf").cron("0 6 * * *")
                .sla(SlaConfig.defaults().withOnBreach((id, status, msg) -> {
                }))
                .build();
        store.save(ScheduleInfo.fresh(schedule, CREATED));

        SlaConfig loaded = store.findById("s1").orElseThrow().schedule().sla();

        assertNull(loaded.onBreach());
        assertEquals(Duration.ofMinutes(5), loaded.maxStartDelay());
        assertNull(loaded.maxDuration());
    }

    @Test
    void findAllAndDeleteShouldWorkTogether() {
        store.save(ScheduleInfo.fresh(cron("a"), CREATED));
        store.save(ScheduleInfo.fresh(cron("b"), CREATED));

        assertEquals(2, store.findAll().size());
        assertTrue(store.delete("a"));
        assertFalse(store.delete("a"));
        assertEquals(List.of("b"), store.findAll().stream().map(ScheduleInfo::id).toList());
        assertTrue(store.findById("a").isEmpty());
    }

    @Test
    void schedulerShouldRestoreSchedulesAfterRestart() {
        Clock clock = Clock.fixed(CREATED, ZoneOffset.UTC);
        SchedulerProperties props = new SchedulerProperties();
        DefaultFleetScheduler first = new DefaultFleetScheduler(props, ctx -> null, store, clock);
        assertTrue(first.create("hourly-sync", "Hourly sync", "wf-sync").every("1h").save());
        first.triggerNow("hourly-sync");

        DefaultFleetScheduler second = new DefaultFleetScheduler(props, ctx -> null, store, clock);
        second.start();
        try {
            ScheduleInfo restored = second.getSchedule("hourly-sync").orElseThrow();
            assertEquals(1, restored.runCount());
            assertEquals(Duration.ofHours(1), restored.schedule().interval());
            assertEquals(CREATED.plus(Duration.ofHours(1)), restored.nextRun());
        } finally {
            second.stop();
        }
    }

    private static Schedule cron(String id) {
        return new SimpleScheduleBuilder(id, id, "wf-" + id).cron("0 2 * * *").build();
    }
}
