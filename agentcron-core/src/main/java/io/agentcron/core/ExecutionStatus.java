package io.agentcron.core;

public enum ExecutionStatus {

    RUNNING(0) {
        @Override
        public boolean isTerminal() {
            return false;
        }
    },
    SUCCEEDED(1) {
        @Override
        public boolean isTerminal() {
            return true;
        }
    },
    FAILED(2) {
        @Override
        public boolean isTerminal() {
            return true;
        }
    };

    private final int code;

    ExecutionStatus(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public abstract boolean isTerminal();

    public static ExecutionStatus fromCode(int code) {
        for (ExecutionStatus status : values()) {
            if (status.code == code) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown execution status code: " + code);
    }
}
