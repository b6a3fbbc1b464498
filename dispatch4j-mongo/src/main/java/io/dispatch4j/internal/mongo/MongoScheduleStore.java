package io.dispatch4j.internal.mongo;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.mongodb.client.result.DeleteResult;
import com.mongodb.client.result.UpdateResult;
import io.dispatch4j.core.CatchUpConfig;
import io.dispatch4j.core.DependencyConfig;
import io.dispatch4j.core.EventTriggerConfig;
import io.dispatch4j.core.PersistResult;
import io.dispatch4j.core.RateLimitConfig;
import io.dispatch4j.core.Schedule;
import io.dispatch4j.core.ScheduleInfo;
import io.dispatch4j.core.ScheduleStore;
import io.dispatch4j.core.SlaConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * MongoDB persistence of schedules.
 *
 * <p>One document per schedule id, written with an upsert on every change. Nested configs are
 * converted with Jackson; durations are stored as ISO-8601 strings. SLA breach handlers and
 * conditional predicates are code, not data, and are dropped on write.
 */
public class MongoScheduleStore implements ScheduleStore {
    private static final Logger log = LoggerFactory.getLogger(MongoScheduleStore.class);
    private static final TypeReference<Map<String, Object>> MAP = new TypeReference<>() {
    };

    private final MongoTemplate mongoTemplate;
    private final ObjectMapper objectMapper;

    public MongoScheduleStore(MongoTemplate mongoTemplate, ObjectMapper objectMapper) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null")
                .copy()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    /**
     * Upsert by schedule id.
     *
     * <p>Returns CREATED when the document did not exist, UPDATED otherwise.
     */
    @Override
    public PersistResult save(ScheduleInfo info) {
        Objects.requireNonNull(info, "schedule must not be null");
        Query query = new Query(Criteria.where("_id").is(info.id()));
        UpdateResult result = mongoTemplate.upsert(query, buildUpdate(info), ScheduleDocument.class);
        return result.getUpsertedId() != null ? PersistResult.createdResult() : PersistResult.updatedResult();
    }

    @Override
    public Optional<ScheduleInfo> findById(String scheduleId) {
        Objects.requireNonNull(scheduleId, "scheduleId must not be null");
        ScheduleDocument doc = mongoTemplate.findById(scheduleId, ScheduleDocument.class);
        return doc == null ? Optional.empty() : Optional.of(toInfo(doc));
    }

    /**
     * Unreadable documents are logged and skipped.
     */
    @Override
    public List<ScheduleInfo> findAll() {
        List<ScheduleInfo> result = new ArrayList<>();
        for (ScheduleDocument doc : mongoTemplate.findAll(ScheduleDocument.class)) {
            try {
                result.add(toInfo(doc));
            } catch (RuntimeException e) {
                log.error("Skipping unreadable schedule document. id={} msg={}", doc.getId(), e.getMessage());
            }
        }
        return result;
    }

    @Override
    public boolean delete(String scheduleId) {
        Objects.requireNonNull(scheduleId, "scheduleId must not be null");
        DeleteResult result = mongoTemplate.remove(new Query(Criteria.where("_id").is(scheduleId)), ScheduleDocument.class);
        return result.getDeletedCount() > 0;
    }

    private Update buildUpdate(ScheduleInfo info) {
        Schedule s = info.schedule();
        Update u = new Update();
        u.set("name", s.name());
        u.set("workflowId", s.workflowId());
        u.set("workflowName", s.workflowName());
        u.set("type", s.type());
        u.set("enabled", s.enabled());
        u.set("timezone", s.timezone());
        setOrUnset(u, "cronExpression", s.cronExpression());
        setOrUnset(u, "intervalMillis", s.interval() == null ? null : s.interval().toMillis());
        setOrUnset(u, "runAt", s.runAt());
        setOrUnset(u, "eventTrigger", toMap(s.eventTrigger()));
        setOrUnset(u, "calendarId", s.calendarId());
        u.set("respectBusinessHours", s.respectBusinessHours());
        setOrUnset(u, "rateLimit", toMap(s.rateLimit()));
        setOrUnset(u, "dependency", toMap(s.dependency()));
        setOrUnset(u, "sla", slaToMap(s.sla()));
        setOrUnset(u, "catchUp", toMap(s.catchUp()));
        u.set("priority", s.priority());
        u.set("maxInstances", s.maxInstances());
        setOrUnset(u, "robotId", s.robotId());
        u.set("variables", s.variables());
        u.set("tags", s.tags());
        u.set("metadata", s.metadata());
        setOrUnset(u, "createdBy", s.createdBy());

        u.set("status", info.status());
        setOrUnset(u, "lastRun", info.lastRun());
        u.set("nextRun", info.nextRun());
        u.set("runCount", info.runCount());
        u.set("successCount", info.successCount());
        u.set("failureCount", info.failureCount());
        u.set("consecutiveFailures", info.consecutiveFailures());
        u.set("createdAt", info.createdAt());
        u.set("updatedAt", info.updatedAt());
        return u;
    }

    private static void setOrUnset(Update u, String key, Object value) {
        if (value != null) {
            u.set(key, value);
        } else {
            u.unset(key);
        }
    }

    private Map<String, Object> toMap(Object value) {
        return value == null ? null : objectMapper.convertValue(value, MAP);
    }

    private static Map<String, Object> slaToMap(SlaConfig sla) {
        if (sla == null) {
            return null;
        }
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("maxDuration", sla.maxDuration() == null ? null : sla.maxDuration().toString());
        m.put("maxStartDelay", sla.maxStartDelay() == null ? null : sla.maxStartDelay().toString());
        m.put("successRateThreshold", sla.successRateThreshold());
        m.put("consecutiveFailureLimit", sla.consecutiveFailureLimit());
        return m;
    }

    /**
     * Reverse of {@link #buildUpdate(ScheduleInfo)}.
     *
     * @throws IllegalArgumentException when a nested config cannot be converted back
     */
    ScheduleInfo toInfo(ScheduleDocument doc) {
        Schedule schedule = new Schedule(
                doc.getId(),
                doc.getName(),
                doc.getWorkflowId(),
                doc.getWorkflowName(),
                doc.getType(),
                doc.isEnabled(),
                doc.getTimezone(),
                doc.getCronExpression(),
                doc.getIntervalMillis() == null ? null : Duration.ofMillis(doc.getIntervalMillis()),
                doc.getRunAt(),
                fromMap(doc.getEventTrigger(), EventTriggerConfig.class),
                doc.getCalendarId(),
                doc.isRespectBusinessHours(),
                fromMap(doc.getRateLimit(), RateLimitConfig.class),
                fromMap(doc.getDependency(), DependencyConfig.class),
                null,
                slaFromMap(doc.getSla()),
                fromMap(doc.getCatchUp(), CatchUpConfig.class),
                doc.getPriority(),
                doc.getMaxInstances(),
                doc.getRobotId(),
                doc.getVariables(),
                doc.getTags(),
                doc.getMetadata(),
                doc.getCreatedBy()
        );
        return new ScheduleInfo(schedule, doc.getStatus(), doc.getLastRun(), doc.getNextRun(), doc.getRunCount(),
                doc.getSuccessCount(), doc.getFailureCount(), doc.getConsecutiveFailures(), doc.getCreatedAt(),
                doc.getUpdatedAt());
    }

    private <T> T fromMap(Map<String, Object> map, Class<T> type) {
        return map == null ? null : objectMapper.convertValue(map, type);
    }

    private static SlaConfig slaFromMap(Map<String, Object> m) {
        if (m == null) {
            return null;
        }
        return new SlaConfig(
                duration(m.get("maxDuration")),
                duration(m.get("maxStartDelay")),
                ((Number) m.getOrDefault("successRateThreshold", 95.0)).doubleValue(),
                ((Number) m.getOrDefault("consecutiveFailureLimit", 3)).intValue(),
                null
        );
    }

    private static Duration duration(Object value) {
        return value == null ? null : Duration.parse(value.toString());
    }
}
