package io.agentcron.core;

/**
 * Raised by research engine clients when the engine cannot produce a report.
 */
public class ResearchEngineException extends RuntimeException {

    public ResearchEngineException(String message) {
        super(message);
    }

    public ResearchEngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
