package io.agentcron.internal.mongo;

import io.agentcron.core.ExecutionCompletion;
import io.agentcron.core.ExecutionPage;
import io.agentcron.core.ExecutionQuery;
import io.agentcron.core.ExecutionRecord;
import io.agentcron.core.ExecutionStats;
import io.agentcron.core.ExecutionStatus;
import io.agentcron.store.ExecutionRepository;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.aggregation.Aggregation;
import org.springframework.data.mongodb.core.aggregation.AggregationResults;
import org.springframework.data.mongodb.core.aggregation.ComparisonOperators;
import org.springframework.data.mongodb.core.aggregation.ConditionalOperators;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * MongoDB persistence layer for run history.
 *
 * <p>Completion is a conditional update on {@code {_id, status: RUNNING}}, so a record
 * reaches a terminal state at most once even if two writers race.
 */
public class MongoExecutionStore implements ExecutionRepository {
    private static final Logger log = LoggerFactory.getLogger(MongoExecutionStore.class);

    static final String SEQUENCE = "task_executions";

    private static final Sort NEWEST_FIRST = Sort.by(Sort.Direction.DESC, "startTime")
            .and(Sort.by(Sort.Direction.DESC, "_id"));

    private final MongoTemplate mongoTemplate;
    private final MongoSequenceGenerator sequences;

    public MongoExecutionStore(MongoTemplate mongoTemplate, MongoSequenceGenerator sequences) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
        this.sequences = Objects.requireNonNull(sequences, "sequences must not be null");
    }

    @Override
    public long createExecution(ExecutionRecord record) {
        Objects.requireNonNull(record, "record must not be null");
        if (record.status() != ExecutionStatus.RUNNING) {
            throw new IllegalArgumentException("new execution records must be RUNNING, got " + record.status());
        }

        Instant now = Instant.now().truncatedTo(ChronoUnit.MILLIS);
        TaskExecutionDocument doc = new TaskExecutionDocument();
        doc.setId(sequences.next(SEQUENCE));
        doc.setJobId(record.jobId());
        doc.setJobName(record.jobName());
        doc.setJobPrompt(record.jobPrompt());
        doc.setStatus(ExecutionStatus.RUNNING);
        doc.setStartTime(record.startTime());
        doc.setCreatedAt(now);
        doc.setUpdatedAt(now);

        mongoTemplate.insert(doc);
        return doc.getId();
    }

    @Override
    public boolean completeExecution(long executionId, ExecutionCompletion completion) {
        Objects.requireNonNull(completion, "completion must not be null");

        Query q = new Query(Criteria.where("_id").is(executionId)
                .and("status").is(ExecutionStatus.RUNNING));

        Update u = new Update()
                .set("status", completion.status())
                .set("endTime", completion.endTime())
                .set("durationSeconds", completion.durationSeconds())
                .set("updatedAt", Instant.now().truncatedTo(ChronoUnit.MILLIS));
        setIfPresent(u, "resultSummary", completion.resultSummary());
        setIfPresent(u, "resultDetail", completion.resultDetail());
        setIfPresent(u, "errorMessage", completion.errorMessage());
        setIfPresent(u, "errorDetail", completion.errorDetail());

        long modified = mongoTemplate.updateFirst(q, u, TaskExecutionDocument.class).getModifiedCount();
        if (modified == 0) {
            log.debug("agentcron execution id={} was not RUNNING, completion ignored", executionId);
        }
        return modified == 1;
    }

    @Override
    public Optional<ExecutionRecord> findById(long executionId) {
        return Optional.ofNullable(mongoTemplate.findById(executionId, TaskExecutionDocument.class))
                .map(MongoExecutionStore::toRecord);
    }

    @Override
    public ExecutionPage find(ExecutionQuery query) {
        Objects.requireNonNull(query, "query must not be null");

        Criteria c = new Criteria();
        if (query.jobId() != null) {
            c = c.and("jobId").is(query.jobId());
        }
        if (query.status() != null) {
            c = c.and("status").is(query.status());
        }

        long total = mongoTemplate.count(new Query(c), TaskExecutionDocument.class);
        if (total == 0 || query.offset() >= total) {
            return new ExecutionPage(List.of(), total, query.offset(), query.size());
        }

        Query page = new Query(c)
                .with(NEWEST_FIRST)
                .skip(query.offset())
                .limit(query.size());
        List<ExecutionRecord> items = mongoTemplate.find(page, TaskExecutionDocument.class).stream()
                .map(MongoExecutionStore::toRecord)
                .toList();
        return new ExecutionPage(items, total, query.offset(), query.size());
    }

    @Override
    public Optional<ExecutionRecord> findLatestByJobId(long jobId) {
        Query q = new Query(Criteria.where("jobId").is(jobId)).with(NEWEST_FIRST).limit(1);
        return Optional.ofNullable(mongoTemplate.findOne(q, TaskExecutionDocument.class))
                .map(MongoExecutionStore::toRecord);
    }

    /**
     * One {@code $group} by status; the average itself is computed in {@link ExecutionStats#aggregate}.
     */
    @Override
    public ExecutionStats statsForJob(long jobId) {
        Aggregation aggregation = Aggregation.newAggregation(
                Aggregation.match(Criteria.where("jobId").is(jobId)),
                Aggregation.group("status")
                        .count().as("count")
                        .sum("durationSeconds").as("durationSum")
                        .sum(ConditionalOperators
                                .when(ComparisonOperators.valueOf("durationSeconds").greaterThanEqualToValue(0))
                                .then(1)
                                .otherwise(0)).as("durationCount")
        );

        AggregationResults<Document> results =
                mongoTemplate.aggregate(aggregation, TaskExecutionDocument.COLLECTION, Document.class);

        List<ExecutionStats.StatusBucket> buckets = new ArrayList<>();
        for (Document row : results.getMappedResults()) {
            Object status = row.get("_id");
            if (status == null) {
                continue;
            }
            buckets.add(new ExecutionStats.StatusBucket(
                    ExecutionStatus.valueOf(status.toString()),
                    asLong(row.get("count")),
                    asLong(row.get("durationSum")),
                    asLong(row.get("durationCount"))
            ));
        }

        return ExecutionStats.aggregate(jobId, buckets, findLatestByJobId(jobId).orElse(null));
    }

    static ExecutionRecord toRecord(TaskExecutionDocument doc) {
        return new ExecutionRecord(
                doc.getId(),
                doc.getJobId(),
                doc.getJobName(),
                doc.getJobPrompt(),
                doc.getStatus(),
                doc.getStartTime(),
                doc.getEndTime(),
                doc.getDurationSeconds(),
                doc.getResultSummary(),
                doc.getResultDetail(),
                doc.getErrorMessage(),
                doc.getErrorDetail(),
                doc.getCreatedAt(),
                doc.getUpdatedAt()
        );
    }

    private static void setIfPresent(Update u, String field, String value) {
        if (value != null) {
            u.set(field, value);
        }
    }

    private static long asLong(Object value) {
        return value instanceof Number n ? n.longValue() : 0L;
    }
}
