package io.herald4j.internal.mongo;

import io.herald4j.JobStore;
import io.herald4j.JobStoreUnavailableException;
import io.herald4j.core.InlineButton;
import io.herald4j.core.JobQuery;
import io.herald4j.core.JobRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * MongoDB persistence layer for scheduled messages.
 *
 * <p>{@code (destination, schedule_name)} has no unique index: the scheduler
 * keeps that pair unique by deleting the old record before inserting the new one.
 *
 * <p>Resource failures (server unreachable, timeouts) surface as {@link JobStoreUnavailableException};
 * other data access errors propagate unchanged.
 */
public class MongoJobStore implements JobStore {
    private static final Logger log = LoggerFactory.getLogger(MongoJobStore.class);

    private final MongoTemplate mongoTemplate;

    public MongoJobStore(MongoTemplate mongoTemplate) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
    }

    @Override
    public String insert(JobRecord record) {
        Objects.requireNonNull(record, "record must not be null");
        ScheduledMessageDocument doc = toDocument(record);
        return execute("insert", () -> mongoTemplate.insert(doc).getId());
    }

    @Override
    public Optional<JobRecord> findById(String id) {
        Objects.requireNonNull(id, "id must not be null");
        return execute("findById", () -> Optional.ofNullable(
                mongoTemplate.findById(id, ScheduledMessageDocument.class)
        ).map(MongoJobStore::toRecord));
    }

    @Override
    public Optional<JobRecord> findOne(JobQuery query) {
        Query q = new Query(buildCriteria(query));
        return execute("findOne", () -> Optional.ofNullable(
                mongoTemplate.findOne(q, ScheduledMessageDocument.class)
        ).map(MongoJobStore::toRecord));
    }

    @Override
    public List<JobRecord> findMany(JobQuery query) {
        Query q = new Query(buildCriteria(query));
        // insertion order; ObjectIds grow with creation time
        q.with(Sort.by(Sort.Order.asc("_id")));

        List<ScheduledMessageDocument> docs = execute("findMany", () -> mongoTemplate.find(q, ScheduledMessageDocument.class));
        List<JobRecord> records = new ArrayList<>(docs.size());
        for (ScheduledMessageDocument d : docs) {
            if (d != null) {
                records.add(toRecord(d));
            }
        }
        return records;
    }

    @Override
    public long markCompleted(String id) {
        Objects.requireNonNull(id, "id must not be null");
        Query q = new Query(Criteria.where("_id").is(id));
        Update u = new Update().set("completed", true);
        return execute("markCompleted", () -> mongoTemplate.updateFirst(q, u, ScheduledMessageDocument.class).getModifiedCount());
    }

    /**
     * Atomically removes the first record matching the query.
     */
    @Override
    public long deleteOne(JobQuery query) {
        Query q = new Query(buildCriteria(query));
        ScheduledMessageDocument removed = execute("deleteOne", () -> mongoTemplate.findAndRemove(q, ScheduledMessageDocument.class));
        return removed == null ? 0 : 1;
    }

    private <T> T execute(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessResourceFailureException | TransientDataAccessException e) {
            log.error("MongoDB operation failed: {} msg={}", operation, e.getMessage());
            throw new JobStoreUnavailableException("Job store unavailable during " + operation, e);
        }
    }

    static Criteria buildCriteria(JobQuery query) {
        Objects.requireNonNull(query, "query must not be null");
        List<Criteria> parts = new ArrayList<>(4);

        if (query.id() != null) {
            parts.add(Criteria.where("_id").is(query.id()));
        }
        if (query.destination() != null) {
            parts.add(Criteria.where("destination").is(query.destination()));
        }
        if (query.scheduleName() != null) {
            parts.add(Criteria.where("schedule_name").is(query.scheduleName()));
        }
        if (query.completed() != null) {
            parts.add(Criteria.where("completed").is(query.completed()));
        }

        if (parts.isEmpty()) {
            throw new IllegalArgumentException("JobQuery must include at least one condition");
        }
        if (parts.size() == 1) {
            return parts.get(0);
        }
        return new Criteria().andOperator(parts.toArray(new Criteria[0]));
    }

    static ScheduledMessageDocument toDocument(JobRecord record) {
        ScheduledMessageDocument doc = new ScheduledMessageDocument();
        doc.setId(record.id());
        doc.setDestination(record.destination());
        doc.setScheduleName(record.scheduleName());
        doc.setBody(record.body());
        doc.setMediaType(record.mediaType());
        doc.setMediaRef(record.mediaRef());
        doc.setMediaAccessToken(record.mediaAccessToken());

        List<ScheduledMessageDocument.Button> buttons = new ArrayList<>(record.buttons().size());
        for (InlineButton b : record.buttons()) {
            buttons.add(new ScheduledMessageDocument.Button(b.text(), b.url()));
        }
        doc.setButtons(buttons);

        doc.setIntervalSeconds(record.intervalSeconds());
        doc.setFireAt(record.fireAt());
        doc.setCompleted(record.completed());
        return doc;
    }

    /**
     * Reverse of {@link #toDocument(JobRecord)}. Malformed buttons are dropped.
     */
    static JobRecord toRecord(ScheduledMessageDocument doc) {
        List<InlineButton> buttons = new ArrayList<>();
        if (doc.getButtons() != null) {
            for (ScheduledMessageDocument.Button b : doc.getButtons()) {
                if (b == null || isBlank(b.getText()) || isBlank(b.getUrl())) {
                    log.warn("Dropping malformed button of job={}", doc.getId());
                    continue;
                }
                buttons.add(new InlineButton(b.getText(), b.getUrl()));
            }
        }

        return new JobRecord(
                doc.getId(),
                doc.getDestination(),
                doc.getScheduleName(),
                doc.getBody(),
                doc.getMediaType(),
                doc.getMediaRef(),
                doc.getMediaAccessToken(),
                buttons,
                doc.getIntervalSeconds(),
                doc.getFireAt(),
                doc.isCompleted()
        );
    }

    private static boolean isBlank(String s) {
        return s == null || s.trim().isEmpty();
    }
}
