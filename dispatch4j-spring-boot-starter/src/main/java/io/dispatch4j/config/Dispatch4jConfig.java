package io.dispatch4j.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.dispatch4j.FleetScheduler;
import io.dispatch4j.ScheduleTrigger;
import io.dispatch4j.affinity.StateAffinityManager;
import io.dispatch4j.assignment.JobAssignmentEngine;
import io.dispatch4j.calendar.BusinessCalendar;
import io.dispatch4j.core.ScheduleStore;
import io.dispatch4j.internal.mongo.MongoScheduleStore;
import io.dispatch4j.scheduler.DefaultFleetScheduler;
import io.dispatch4j.scheduler.InMemoryScheduleStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.core.MongoTemplate;

import java.time.Clock;
import java.time.ZoneId;
import java.util.List;
import java.util.Map;

/**
 * Spring Boot auto-configuration entrypoint for dispatch4j components.
 *
 * <p>Schedules are persisted to MongoDB when a {@link MongoTemplate} bean exists, in memory otherwise.
 */
@AutoConfiguration(afterName = "org.springframework.boot.autoconfigure.data.mongo.MongoDataAutoConfiguration")
@ConditionalOnClass(FleetScheduler.class)
@EnableConfigurationProperties(Dispatch4jProperties.class)
@ConditionalOnProperty(prefix = "dispatch4j", name = "enabled", havingValue = "true", matchIfMissing = true)
public class Dispatch4jConfig {
    private static final Logger log = LoggerFactory.getLogger(Dispatch4jConfig.class);

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(MongoTemplate.class)
    @ConditionalOnBean(MongoTemplate.class)
    static class MongoStoreConfig {

        @Bean
        @ConditionalOnMissingBean(ScheduleStore.class)
        public MongoScheduleStore mongoScheduleStore(MongoTemplate mongoTemplate, ObjectProvider<ObjectMapper> objectMapper) {
            return new MongoScheduleStore(mongoTemplate, objectMapper.getIfAvailable(ObjectMapper::new));
        }

        @Bean
        @ConditionalOnMissingBean
        public ScheduleMongoIndexConfig scheduleMongoIndexConfig(MongoTemplate mongoTemplate) {
            return new ScheduleMongoIndexConfig(mongoTemplate);
        }

        @Bean
        @ConditionalOnProperty(prefix = "dispatch4j", name = "ensure-indexes-on-startup", havingValue = "true")
        public SmartInitializingSingleton dispatch4jIndexesInitializer(ScheduleMongoIndexConfig indexConfig) {
            return indexConfig::ensureIndexes;
        }
    }

    @Bean
    @ConditionalOnMissingBean
    public ScheduleStore scheduleStore() {
        return new InMemoryScheduleStore();
    }

    @Bean
    @ConditionalOnMissingBean
    public Clock dispatch4jClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public StateAffinityManager stateAffinityManager(Dispatch4jProperties props, Clock clock) {
        return new StateAffinityManager(props.getAffinity(), clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public JobAssignmentEngine jobAssignmentEngine(Dispatch4jProperties props, StateAffinityManager affinityManager, Clock clock) {
        AssignmentProperties a = props.getAssignment();
        return new JobAssignmentEngine(a.toWeights(), a.getStateTtl(), a.getNetworkZone(), affinityManager, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public FleetScheduler fleetScheduler(Dispatch4jProperties props,
                                         ObjectProvider<ScheduleTrigger> triggerProvider,
                                         ScheduleStore store,
                                         Clock clock) {
        ScheduleTrigger trigger = triggerProvider.getIfAvailable(() -> context -> {
            log.warn("No ScheduleTrigger bean registered, run ignored. schedule={} execution={}",
                    context.schedule().id(), context.executionId());
            return null;
        });
        DefaultFleetScheduler scheduler = new DefaultFleetScheduler(props.getScheduler(), trigger, store, clock);
        for (Map.Entry<String, Dispatch4jProperties.Calendar> e : props.getCalendars().entrySet()) {
            scheduler.registerCalendar(e.getKey(), calendar(e.getValue()));
        }
        return scheduler;
    }

    @Bean
    @ConditionalOnMissingBean
    public Dispatch4jLifecycle dispatch4jLifecycle(FleetScheduler scheduler, StateAffinityManager affinityManager) {
        return new Dispatch4jLifecycle(scheduler, affinityManager);
    }

    static BusinessCalendar calendar(Dispatch4jProperties.Calendar c) {
        ZoneId zone = ZoneId.of(c.getTimezone());
        return switch (c.getPreset()) {
            case US -> BusinessCalendar.us(zone, c.isIncludeHolidays());
            case UK -> BusinessCalendar.uk(zone, c.isIncludeHolidays());
            case ALWAYS_OPEN -> BusinessCalendar.alwaysOpen(zone, List.of());
        };
    }
}
