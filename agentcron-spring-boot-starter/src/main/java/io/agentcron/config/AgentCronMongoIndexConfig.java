package io.agentcron.config;

import io.agentcron.internal.mongo.AgentTaskDocument;
import io.agentcron.internal.mongo.TaskExecutionDocument;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;

import java.util.Objects;

/**
 * MongoDB index definitions for the scheduler collections.
 *
 * <p>Indexes are <b>not</b> created automatically unless
 * {@code agentcron.mongo.ensure-indexes-on-startup=true}; in production they usually come from
 * migration scripts.
 *
 * <h3>Collection {@code task_executions}</h3>
 * <ul>
 *   <li><b>idx_job_start</b>: { jobId: 1, startTime: -1 }
 *       <br/>Per-job history listing, latest execution and stats.</li>
 *   <li><b>idx_status</b>: { status: 1 }
 *       <br/>History filtered by status.</li>
 *   <li><b>idx_start_time</b>: { startTime: -1 }
 *       <br/>Unfiltered history listing.</li>
 * </ul>
 *
 * <h3>Collection {@code agent_tasks}</h3>
 * <ul>
 *   <li><b>idx_enabled</b>: { enabled: 1 }
 *       <br/>The scan query.</li>
 * </ul>
 *
 * <h3>Example mongosh script</h3>
 * <pre>
 * db.task_executions.createIndex({ jobId: 1, startTime: -1 }, { name: "idx_job_start" });
 * db.task_executions.createIndex({ status: 1 }, { name: "idx_status" });
 * db.task_executions.createIndex({ startTime: -1 }, { name: "idx_start_time" });
 * db.agent_tasks.createIndex({ enabled: 1 }, { name: "idx_enabled" });
 * </pre>
 */
public class AgentCronMongoIndexConfig {

    public static final String IDX_JOB_START = "idx_job_start";
    public static final String IDX_STATUS = "idx_status";
    public static final String IDX_START_TIME = "idx_start_time";
    public static final String IDX_ENABLED = "idx_enabled";

    private final MongoTemplate mongoTemplate;

    public AgentCronMongoIndexConfig(MongoTemplate mongoTemplate) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
    }

    public void ensureIndexes() {
        mongoTemplate.indexOps(TaskExecutionDocument.class).ensureIndex(jobStartIndex());
        mongoTemplate.indexOps(TaskExecutionDocument.class).ensureIndex(statusIndex());
        mongoTemplate.indexOps(TaskExecutionDocument.class).ensureIndex(startTimeIndex());
        mongoTemplate.indexOps(AgentTaskDocument.class).ensureIndex(enabledIndex());
    }

    public static Index jobStartIndex() {
        return new Index()
                .on("jobId", Sort.Direction.ASC)
                .on("startTime", Sort.Direction.DESC)
                .named(IDX_JOB_START);
    }

    public static Index statusIndex() {
        return new Index().on("status", Sort.Direction.ASC).named(IDX_STATUS);
    }

    public static Index startTimeIndex() {
        return new Index().on("startTime", Sort.Direction.DESC).named(IDX_START_TIME);
    }

    public static Index enabledIndex() {
        return new Index().on("enabled", Sort.Direction.ASC).named(IDX_ENABLED);
    }
}
