package io.agentcron.internal.mongo;

import io.agentcron.core.JobDefinition;
import io.agentcron.core.JobPatch;
import io.agentcron.store.JobRepository;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * MongoDB persistence layer for job definitions.
 *
 * <p>Ids come from {@link MongoSequenceGenerator} so jobs keep the small numeric ids the
 * execution tracker and the REST surface work with.
 */
public class MongoJobStore implements JobRepository {

    static final String SEQUENCE = "agent_tasks";

    private final MongoTemplate mongoTemplate;
    private final MongoSequenceGenerator sequences;

    public MongoJobStore(MongoTemplate mongoTemplate, MongoSequenceGenerator sequences) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
        this.sequences = Objects.requireNonNull(sequences, "sequences must not be null");
    }

    @Override
    public List<JobDefinition> listEnabledJobs() {
        Query q = new Query(Criteria.where("enabled").is(true))
                .with(Sort.by(Sort.Direction.ASC, "_id"));
        return mongoTemplate.find(q, AgentTaskDocument.class).stream()
                .map(MongoJobStore::toDefinition)
                .toList();
    }

    @Override
    public Optional<JobDefinition> findById(long id) {
        return Optional.ofNullable(mongoTemplate.findById(id, AgentTaskDocument.class))
                .map(MongoJobStore::toDefinition);
    }

    @Override
    public List<JobDefinition> findAll() {
        Query q = new Query().with(Sort.by(Sort.Direction.DESC, "_id"));
        return mongoTemplate.find(q, AgentTaskDocument.class).stream()
                .map(MongoJobStore::toDefinition)
                .toList();
    }

    @Override
    public long count() {
        return mongoTemplate.count(new Query(), AgentTaskDocument.class);
    }

    @Override
    public JobDefinition create(JobDefinition draft) {
        Objects.requireNonNull(draft, "draft must not be null");
        if (draft.name() == null || draft.name().isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }

        Instant now = now();
        AgentTaskDocument doc = new AgentTaskDocument();
        doc.setId(sequences.next(SEQUENCE));
        doc.setName(draft.name());
        doc.setInfo(draft.info());
        doc.setTimeSpec(draft.timeSpec());
        doc.setPrompt(draft.prompt());
        doc.setEnabled(draft.enabled());
        doc.setCreatedAt(now);
        doc.setUpdatedAt(now);

        return toDefinition(mongoTemplate.insert(doc));
    }

    /**
     * Only the non-null fields of the patch are written.
     *
     * @throws IllegalArgumentException when the patch carries no field at all
     */
    @Override
    public Optional<JobDefinition> update(long id, JobPatch patch) {
        Objects.requireNonNull(patch, "patch must not be null");
        if (patch.isEmpty()) {
            throw new IllegalArgumentException("patch must change at least one field");
        }

        Update u = new Update();
        if (patch.name() != null) {
            u.set("name", patch.name());
        }
        if (patch.info() != null) {
            u.set("info", patch.info());
        }
        if (patch.timeSpec() != null) {
            u.set("timeSpec", patch.timeSpec());
        }
        if (patch.prompt() != null) {
            u.set("prompt", patch.prompt());
        }
        if (patch.enabled() != null) {
            u.set("enabled", patch.enabled());
        }
        u.set("updatedAt", now());

        AgentTaskDocument updated = mongoTemplate.findAndModify(
                new Query(Criteria.where("_id").is(id)),
                u,
                FindAndModifyOptions.options().returnNew(true),
                AgentTaskDocument.class
        );
        return Optional.ofNullable(updated).map(MongoJobStore::toDefinition);
    }

    @Override
    public boolean deleteById(long id) {
        return mongoTemplate.remove(new Query(Criteria.where("_id").is(id)), AgentTaskDocument.class)
                .getDeletedCount() > 0;
    }

    static JobDefinition toDefinition(AgentTaskDocument doc) {
        return new JobDefinition(
                doc.getId(),
                doc.getName(),
                doc.getInfo(),
                doc.getTimeSpec(),
                doc.getPrompt(),
                doc.isEnabled(),
                doc.getCreatedAt(),
                doc.getUpdatedAt()
        );
    }

    // Mongo keeps millisecond precision; returned values must equal what a later read yields.
    private static Instant now() {
        return Instant.now().truncatedTo(ChronoUnit.MILLIS);
    }
}
