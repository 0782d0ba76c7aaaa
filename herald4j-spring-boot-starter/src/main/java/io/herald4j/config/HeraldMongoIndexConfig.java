package io.herald4j.config;

import io.herald4j.internal.mongo.ScheduledMessageDocument;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;
import org.springframework.data.mongodb.core.index.IndexOperations;

/**
 * MongoDB index definitions for scheduled messages.
 *
 * <p>Indexes are <b>not</b> created automatically unless {@code herald.ensure-indexes-on-startup=true};
 * in production they are usually managed by migrations or ops scripts.
 *
 * <h3>Indexes (collection: {@code scheduled_messages})</h3>
 * <ul>
 *   <li><b>idx_destination_name</b>: { destination: 1, schedule_name: 1 }
 *       <br/>Name lookup on create. Not unique: the scheduler replaces by delete-then-insert.</li>
 *   <li><b>idx_completed_destination</b>: { completed: 1, destination: 1 }
 *       <br/>Recovery scan and per-chat listing of pending records.</li>
 * </ul>
 *
 * <h3>Example mongosh script</h3>
 * <pre>
 * db.scheduled_messages.createIndex({ destination: 1, schedule_name: 1 }, { name: "idx_destination_name" });
 * db.scheduled_messages.createIndex({ completed: 1, destination: 1 }, { name: "idx_completed_destination" });
 * </pre>
 */
public class HeraldMongoIndexConfig {

    public static final String IDX_DESTINATION_NAME = "idx_destination_name";
    public static final String IDX_COMPLETED_DESTINATION = "idx_completed_destination";

    private final MongoTemplate mongoTemplate;

    public HeraldMongoIndexConfig(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    public void ensureIndexes() {
        IndexOperations ops = mongoTemplate.indexOps(ScheduledMessageDocument.class);
        ops.ensureIndex(destinationNameIndex());
        ops.ensureIndex(completedDestinationIndex());
    }

    public static Index destinationNameIndex() {
        return new Index()
                .on("destination", Sort.Direction.ASC)
                .on("schedule_name", Sort.Direction.ASC)
                .named(IDX_DESTINATION_NAME);
    }

    public static Index completedDestinationIndex() {
        return new Index()
                .on("completed", Sort.Direction.ASC)
                .on("destination", Sort.Direction.ASC)
                .named(IDX_COMPLETED_DESTINATION);
    }
}
