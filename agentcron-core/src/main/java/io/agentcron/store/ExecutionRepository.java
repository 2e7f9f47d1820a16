package io.agentcron.store;

import io.agentcron.core.ExecutionCompletion;
import io.agentcron.core.ExecutionPage;
import io.agentcron.core.ExecutionQuery;
import io.agentcron.core.ExecutionRecord;
import io.agentcron.core.ExecutionStats;

import java.util.Optional;

/**
 * Durable run history. Implementations must tolerate concurrent writers touching different
 * records.
 */
public interface ExecutionRepository {

    /**
     * Insert a RUNNING record.
     *
     * @return the assigned execution id
     */
    long createExecution(ExecutionRecord record);

    /**
     * Write the terminal fields of a record. Applies only while the record is still RUNNING,
     * so a record reaches a terminal state at most once.
     *
     * @return true when the record was updated
     */
    boolean completeExecution(long executionId, ExecutionCompletion completion);

    Optional<ExecutionRecord> findById(long executionId);

    ExecutionPage find(ExecutionQuery query);

    Optional<ExecutionRecord> findLatestByJobId(long jobId);

    ExecutionStats statsForJob(long jobId);
}
