package io.webtimer4j.internal.mongo;

import io.webtimer4j.core.PersistenceException;
import io.webtimer4j.history.HistoryQuery;
import io.webtimer4j.history.HistoryRecord;
import io.webtimer4j.history.HistoryStore;
import io.webtimer4j.history.HistorySummary;
import io.webtimer4j.history.ScheduleStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * MongoDB persistence layer for request history.
 *
 * <p>Sequences are allocated in-process from the highest stored {@code _id}, so one engine instance is
 * expected to write a given collection. Each append is a single-document insert.
 */
public class MongoHistoryStore implements HistoryStore {
    private static final Logger log = LoggerFactory.getLogger(MongoHistoryStore.class);

    private final MongoTemplate mongoTemplate;
    private final String collection;
    private final AtomicLong sequence = new AtomicLong();

    public MongoHistoryStore(MongoTemplate mongoTemplate, String collection) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
        this.collection = (collection == null || collection.isBlank()) ? "request_history" : collection;
    }

    @Override
    public void initialize() {
        try {
            Query q = new Query().with(Sort.by(Sort.Direction.DESC, "_id")).limit(1);
            q.fields().include("_id");
            RequestHistoryDocument last = mongoTemplate.findOne(q, RequestHistoryDocument.class, collection);
            long max = (last == null || last.getSequence() == null) ? 0L : last.getSequence();
            sequence.accumulateAndGet(max, Math::max);
            log.info("history store ready collection={} lastSequence={}", collection, max);
        } catch (DataAccessException e) {
            throw new PersistenceException("unable to initialize history collection " + collection + ": " + e.getMessage(), e);
        }
    }

    @Override
    public HistoryRecord append(HistoryRecord record) {
        Objects.requireNonNull(record, "record must not be null");
        HistoryRecord stored = record.withSequence(sequence.incrementAndGet());
        try {
            mongoTemplate.insert(RequestHistoryDocument.from(stored), collection);
            return stored;
        } catch (DataAccessException e) {
            throw new PersistenceException("history insert failed id=" + record.scheduleId() + ": " + e.getMessage(), e);
        }
    }

    @Override
    public List<HistoryRecord> find(HistoryQuery query) {
        Objects.requireNonNull(query, "query must not be null");
        Sort.Direction dir = query.oldestFirst() ? Sort.Direction.ASC : Sort.Direction.DESC;
        Query q = new Query(criteria(query))
                .with(Sort.by(dir, "timestamp").and(Sort.by(dir, "_id")))
                .limit(query.limit());
        return load(q);
    }

    @Override
    public ScheduleStats stats(String scheduleId) {
        Objects.requireNonNull(scheduleId, "scheduleId must not be null");
        Query q = new Query(Criteria.where("scheduleId").is(scheduleId));
        q.fields().exclude("responseBody");
        return ScheduleStats.compute(scheduleId, load(q));
    }

    @Override
    public HistorySummary summary(Instant now) {
        Query q = new Query();
        q.fields().exclude("responseBody");
        return HistorySummary.compute(load(q), now);
    }

    @Override
    public long purgeOlderThan(Instant cutoff) {
        Objects.requireNonNull(cutoff, "cutoff must not be null");
        try {
            return mongoTemplate.remove(new Query(Criteria.where("timestamp").lt(cutoff)),
                    RequestHistoryDocument.class, collection).getDeletedCount();
        } catch (DataAccessException e) {
            throw new PersistenceException("history purge failed: " + e.getMessage(), e);
        }
    }

    private Criteria criteria(HistoryQuery query) {
        Criteria c = new Criteria();
        if (query.scheduleId() != null) {
            c = c.and("scheduleId").is(query.scheduleId());
        }
        if (query.success() != null) {
            c = c.and("success").is(query.success());
        }
        if (query.from() != null || query.to() != null) {
            Criteria ts = c.and("timestamp");
            if (query.from() != null) {
                ts = ts.gte(query.from());
            }
            if (query.to() != null) {
                ts = ts.lte(query.to());
            }
            c = ts;
        }
        return c;
    }

    private List<HistoryRecord> load(Query q) {
        try {
            List<RequestHistoryDocument> docs = mongoTemplate.find(q, RequestHistoryDocument.class, collection);
            List<HistoryRecord> out = new ArrayList<>(docs.size());
            for (RequestHistoryDocument doc : docs) {
                out.add(doc.toRecord());
            }
            return out;
        } catch (DataAccessException e) {
            throw new PersistenceException("history query failed: " + e.getMessage(), e);
        }
    }
}
