package io.herald4j.internal.mongo;

import io.herald4j.JobStoreUnavailableException;
import io.herald4j.core.JobQuery;
import io.herald4j.core.JobRecord;
import org.assertj.core.api.InstanceOfAssertFactories;
import org.bson.Document;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MongoJobStoreTest {

    @Mock
    private MongoTemplate mongoTemplate;

    @InjectMocks
    private MongoJobStore jobStore;

    @Test
    void unreachableServerShouldSurfaceAsUnavailable() {
        when(mongoTemplate.find(any(Query.class), eq(ScheduledMessageDocument.class)))
                .thenThrow(new DataAccessResourceFailureException("timed out"));

        assertThatThrownBy(() -> jobStore.findMany(JobQuery.pending()))
                .isInstanceOf(JobStoreUnavailableException.class)
                .hasCauseInstanceOf(DataAccessResourceFailureException.class);
    }

    @Test
    void otherDataErrorsShouldPropagateUnchanged() {
        when(mongoTemplate.insert(any(ScheduledMessageDocument.class)))
                .thenThrow(new DuplicateKeyException("dup"));

        assertThatThrownBy(() -> jobStore.insert(new JobRecord(null, "-100", "n", "b", null, null, null,
                List.of(), 60L, null, false)))
                .isInstanceOf(DuplicateKeyException.class);
    }

    @Test
    void criteriaShouldCombineGivenFieldsWithAnd() {
        Document single = MongoJobStore.buildCriteria(JobQuery.byId("abc")).getCriteriaObject();
        assertThat(single).isEqualTo(new Document("_id", "abc"));

        Document combined = MongoJobStore.buildCriteria(JobQuery.named("-100", "Daily")).getCriteriaObject();
        assertThat(combined).containsOnlyKeys("$and");
        assertThat(combined.get("$and")).asInstanceOf(InstanceOfAssertFactories.LIST).containsExactly(
                new Document("destination", "-100"),
                new Document("schedule_name", "Daily"));
    }

    @Test
    void malformedButtonsShouldBeDroppedOnRead() {
        ScheduledMessageDocument doc = new ScheduledMessageDocument();
        doc.setId("1");
        doc.setDestination("-100");
        doc.setButtons(Arrays.asList(
                new ScheduledMessageDocument.Button("Ok", "https://ok"),
                new ScheduledMessageDocument.Button("", "https://blank"),
                null));

        JobRecord record = MongoJobStore.toRecord(doc);

        assertThat(record.buttons()).hasSize(1);
        assertThat(record.buttons().get(0).text()).isEqualTo("Ok");
    }
}
