package io.webtimer4j.config;

import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;

/**
 * MongoDB index definitions for the request history collection.
 *
 * <p>Indexes are not created automatically unless {@code webtimer.history.ensure-indexes-on-startup=true};
 * production deployments usually manage them with migrations.
 *
 * <h3>Indexes (collection: {@code request_history})</h3>
 * <ul>
 *   <li><b>idx_schedule_timestamp</b>: { scheduleId: 1, timestamp: -1 } for per-schedule listing and stats</li>
 *   <li><b>idx_timestamp</b>: { timestamp: -1 } for global listing and retention purges</li>
 *   <li><b>idx_success</b>: { success: 1 } for the success filter</li>
 * </ul>
 *
 * <pre>
 * db.request_history.createIndex({ scheduleId: 1, timestamp: -1 }, { name: "idx_schedule_timestamp" });
 * db.request_history.createIndex({ timestamp: -1 }, { name: "idx_timestamp" });
 * db.request_history.createIndex({ success: 1 }, { name: "idx_success" });
 * </pre>
 */
public class WebTimerMongoIndexConfig {

    public static final String IDX_SCHEDULE_TIMESTAMP = "idx_schedule_timestamp";
    public static final String IDX_TIMESTAMP = "idx_timestamp";
    public static final String IDX_SUCCESS = "idx_success";

    private final MongoTemplate mongoTemplate;
    private final String collection;

    public WebTimerMongoIndexConfig(MongoTemplate mongoTemplate, String collection) {
        this.mongoTemplate = mongoTemplate;
        this.collection = collection;
    }

    public void ensureIndexes() {
        mongoTemplate.indexOps(collection).ensureIndex(scheduleTimestampIndex());
        mongoTemplate.indexOps(collection).ensureIndex(timestampIndex());
        mongoTemplate.indexOps(collection).ensureIndex(successIndex());
    }

    public static Index scheduleTimestampIndex() {
        return new Index()
                .on("scheduleId", Sort.Direction.ASC)
                .on("timestamp", Sort.Direction.DESC)
                .named(IDX_SCHEDULE_TIMESTAMP);
    }

    public static Index timestampIndex() {
        return new Index()
                .on("timestamp", Sort.Direction.DESC)
                .named(IDX_TIMESTAMP);
    }

    public static Index successIndex() {
        return new Index()
                .on("success", Sort.Direction.ASC)
                .named(IDX_SUCCESS);
    }
}
