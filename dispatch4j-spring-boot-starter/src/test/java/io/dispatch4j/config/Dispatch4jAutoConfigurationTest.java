package io.dispatch4j.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.dispatch4j.FleetScheduler;
import io.dispatch4j.ScheduleTrigger;
import io.dispatch4j.TriggerContext;
import io.dispatch4j.affinity.StateAffinityManager;
import io.dispatch4j.assignment.JobAssignmentEngine;
import io.dispatch4j.core.ScheduleStore;
import io.dispatch4j.internal.mongo.MongoScheduleStore;
import io.dispatch4j.internal.mongo.ScheduleDocument;
import io.dispatch4j.scheduler.ExecutionOutcome;
import io.dispatch4j.scheduler.InMemoryScheduleStore;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.IndexDefinition;
import org.springframework.data.mongodb.core.index.IndexOperations;

import java.time.Duration;
import java.time.ZoneId;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class Dispatch4jAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(Dispatch4jConfig.class))
            .withPropertyValues(
                    "dispatch4j.enabled=true",
                    "dispatch4j.scheduler.max-concurrency=4",
                    "dispatch4j.scheduler.misfire-grace-period=2m",
                    "dispatch4j.affinity.default-state-ttl=2h",
                    "dispatch4j.calendars.ops.preset=UK",
                    "dispatch4j.calendars.ops.timezone=Europe/London"
            );

    @Test
    void shouldAutoConfigureDispatchBeansWithMongoStore() {
        contextRunner
                .withBean(MongoTemplate.class, () -> mock(MongoTemplate.class))
                .withBean(ObjectMapper.class, ObjectMapper::new)
                .run(context -> {
                    assertThat(context).hasSingleBean(FleetScheduler.class);
                    assertThat(context).hasSingleBean(JobAssignmentEngine.class);
                    assertThat(context).hasSingleBean(StateAffinityManager.class);
                    assertThat(context).hasSingleBean(Dispatch4jLifecycle.class);
                    assertThat(context).hasSingleBean(Dispatch4jProperties.class);
                    assertThat(context).hasSingleBean(ScheduleStore.class);
                    assertThat(context.getBean(ScheduleStore.class)).isInstanceOf(MongoScheduleStore.class);
                    assertThat(context).hasSingleBean(ScheduleMongoIndexConfig.class);
                });
    }

    @Test
    void shouldFallBackToInMemoryStoreWithoutMongo() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(ScheduleStore.class);
            assertThat(context.getBean(ScheduleStore.class)).isInstanceOf(InMemoryScheduleStore.class);
            assertThat(context).doesNotHaveBean(ScheduleMongoIndexConfig.class);
        });
    }

    @Test
    void shouldBindPropertiesAndRegisterCalendars() {
        contextRunner.run(context -> {
            Dispatch4jProperties props = context.getBean(Dispatch4jProperties.class);
            assertThat(props.getScheduler().getMaxConcurrency()).isEqualTo(4);
            assertThat(props.getScheduler().getMisfireGracePeriod()).isEqualTo(Duration.ofMinutes(2));
            assertThat(props.getAffinity().getDefaultStateTtl()).isEqualTo(Duration.ofHours(2));

            FleetScheduler scheduler = context.getBean(FleetScheduler.class);
            assertThat(scheduler.getCalendar("ops")).isPresent();
            assertThat(scheduler.getCalendar("ops").get().zone()).isEqualTo(ZoneId.of("Europe/London"));
        });
    }

    @Test
    void lifecycleShouldStartScheduler() {
        contextRunner.run(context -> {
            assertThat(context.getBean(Dispatch4jLifecycle.class).isRunning()).isTrue();
            assertThat(context.getBean(FleetScheduler.class).isRunning()).isTrue();
        });
    }

    @Test
    void shouldRunRegisteredTrigger() {
        List<String> fired = new CopyOnWriteArrayList<>();
        contextRunner
                .withBean(ScheduleTrigger.class, () -> (TriggerContext ctx) -> {
                    fired.add(ctx.schedule().id());
                    return null;
                })
                .run(context -> {
                    FleetScheduler scheduler = context.getBean(FleetScheduler.class);
                    assertThat(scheduler.create("nightly", "Nightly", "wf-nightly").cron("0 2 * * *").save()).isTrue();

                    assertThat(scheduler.triggerNow("nightly")).isEqualTo(ExecutionOutcome.SUCCEEDED);
                    assertThat(fired).containsExactly("nightly");
                });
    }

    @Test
    void shouldCreateIndexesWhenRequested() {
        IndexOperations indexOps = mock(IndexOperations.class);
        MongoTemplate mongoTemplate = mock(MongoTemplate.class);
        when(mongoTemplate.indexOps(ScheduleDocument.class)).thenReturn(indexOps);

        contextRunner
                .withBean(MongoTemplate.class, () -> mongoTemplate)
                .withPropertyValues("dispatch4j.ensure-indexes-on-startup=true")
                .run(context -> {
                    assertThat(context).hasNotFailed();
                    verify(indexOps, times(3)).ensureIndex(any(IndexDefinition.class));
                });
    }

    @Test
    void shouldBackOffWhenDisabled() {
        contextRunner
                .withPropertyValues("dispatch4j.enabled=false")
                .run(context -> {
                    assertThat(context).doesNotHaveBean(FleetScheduler.class);
                    assertThat(context).doesNotHaveBean(Dispatch4jLifecycle.class);
                });
    }
}
