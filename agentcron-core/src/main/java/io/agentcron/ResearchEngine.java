package io.agentcron;

import io.agentcron.core.ResearchRequest;

/**
 * Turns a prompt into a report. Implementations may block for a long time.
 */
public interface ResearchEngine {

    String research(ResearchRequest request) throws Exception;
}
