package io.agentcron.store;

import io.agentcron.core.JobDefinition;
import io.agentcron.core.JobPatch;

import java.util.List;
import java.util.Optional;

/**
 * Persistence of job definitions.
 */
public interface JobRepository {

    /**
     * Enabled jobs ordered by id ascending. This is the only call the scheduler loop makes.
     */
    List<JobDefinition> listEnabledJobs();

    Optional<JobDefinition> findById(long id);

    /**
     * All jobs, newest (highest id) first.
     */
    List<JobDefinition> findAll();

    long count();

    /**
     * Insert a new job. The store assigns the id and both timestamps.
     */
    JobDefinition create(JobDefinition draft);

    /**
     * Apply a partial update and refresh {@code updatedAt}.
     *
     * @return the updated job, or empty when no job has this id
     */
    Optional<JobDefinition> update(long id, JobPatch patch);

    boolean deleteById(long id);
}
