package io.agentcron.core;

/**
 * ExecutionQuery describes which execution records to list.
 *
 * <p>This is an API-layer object. The store layer translates it into an actual database
 * query. Results are ordered by start time, newest first.
 */
public final class ExecutionQuery {

    public static final int DEFAULT_SIZE = 20;
    public static final int MAX_SIZE = 100;

    private final Long jobId;
    private final ExecutionStatus status;
    private final int offset;
    private final int size;

    private ExecutionQuery(Long jobId, ExecutionStatus status, int offset, int size) {
        this.jobId = jobId;
        this.status = status;
        this.offset = offset;
        this.size = size;
    }

    /**
     * Job id filter, or null for all jobs.
     */
    public Long jobId() {
        return jobId;
    }

    /**
     * Status filter, or null for any status.
     */
    public ExecutionStatus status() {
        return status;
    }

    public int offset() {
        return offset;
    }

    public int size() {
        return size;
    }

    public static ExecutionQuery all() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Long jobId;
        private ExecutionStatus status;
        private int offset = 0;
        private int size = DEFAULT_SIZE;

        public Builder jobId(Long jobId) {
            this.jobId = jobId;
            return this;
        }

        public Builder status(ExecutionStatus status) {
            this.status = status;
            return this;
        }

        public Builder offset(int offset) {
            this.offset = offset;
            return this;
        }

        public Builder size(int size) {
            this.size = size;
            return this;
        }

        public ExecutionQuery build() {
            if (offset < 0) {
                throw new IllegalArgumentException("offset must not be negative");
            }
            if (size <= 0 || size > MAX_SIZE) {
                throw new IllegalArgumentException("size must be between 1 and " + MAX_SIZE);
            }
            return new ExecutionQuery(jobId, status, offset, size);
        }
    }
}
