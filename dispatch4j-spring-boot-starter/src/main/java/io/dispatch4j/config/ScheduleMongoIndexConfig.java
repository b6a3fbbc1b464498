package io.dispatch4j.config;

import io.dispatch4j.internal.mongo.ScheduleDocument;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;

import java.util.Objects;

/**
 * MongoDB index definitions for the schedule store.
 *
 * <p><b>Important:</b> indexes are <b>NOT</b> created at startup unless
 * {@code dispatch4j.ensure-indexes-on-startup=true}. In production they are usually managed by
 * migrations or ops scripts.
 *
 * <h3>Indexes (collection: {@code dispatch_schedules})</h3>
 * <ul>
 *   <li><b>idx_status_next_run</b>: { status: 1, nextRun: 1 }
 *       <br/>Upcoming-run listings and restore of active schedules.</li>
 *   <li><b>idx_workflow</b>: { workflowId: 1 }
 *       <br/>Per-workflow schedule lookup.</li>
 *   <li><b>idx_event_subscription</b>: { type: 1, eventTrigger.eventType: 1, eventTrigger.eventSource: 1 }
 *       <br/>Finding the EVENT schedules subscribed to a source.</li>
 * </ul>
 *
 * <h3>Example mongosh script</h3>
 * <pre>
 * db.dispatch_schedules.createIndex({ status: 1, nextRun: 1 }, { name: "idx_status_next_run" });
 * db.dispatch_schedules.createIndex({ workflowId: 1 }, { name: "idx_workflow" });
 * db.dispatch_schedules.createIndex(
 *   { type: 1, "eventTrigger.eventType": 1, "eventTrigger.eventSource": 1 },
 *   { name: "idx_event_subscription" }
 * );
 * </pre>
 */
public class ScheduleMongoIndexConfig {

    public static final String IDX_STATUS_NEXT_RUN = "idx_status_next_run";
    public static final String IDX_WORKFLOW = "idx_workflow";
    public static final String IDX_EVENT_SUBSCRIPTION = "idx_event_subscription";

    private final MongoTemplate mongoTemplate;

    public ScheduleMongoIndexConfig(MongoTemplate mongoTemplate) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
    }

    public void ensureIndexes() {
        mongoTemplate.indexOps(ScheduleDocument.class).ensureIndex(statusNextRunIndex());
        mongoTemplate.indexOps(ScheduleDocument.class).ensureIndex(workflowIndex());
        mongoTemplate.indexOps(ScheduleDocument.class).ensureIndex(eventSubscriptionIndex());
    }

    public static Index statusNextRunIndex() {
        return new Index()
                .on("status", Sort.Direction.ASC)
                .on("nextRun", Sort.Direction.ASC)
                .named(IDX_STATUS_NEXT_RUN);
    }

    public static Index workflowIndex() {
        return new Index()
                .on("workflowId", Sort.Direction.ASC)
                .named(IDX_WORKFLOW);
    }

    public static Index eventSubscriptionIndex() {
        return new Index()
                .on("type", Sort.Direction.ASC)
                .on("eventTrigger.eventType", Sort.Direction.ASC)
                .on("eventTrigger.eventSource", Sort.Direction.ASC)
                .named(IDX_EVENT_SUBSCRIPTION);
    }
}
