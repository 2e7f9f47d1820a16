package io.agentcron.core;

import java.io.PrintWriter;
import java.io.StringWriter;

/**
 * Result of invoking the research engine for one run.
 */
public sealed interface ExecutionOutcome permits ExecutionOutcome.Succeeded, ExecutionOutcome.Failed {

    record Succeeded(String report) implements ExecutionOutcome {
        public Succeeded {
            report = report == null ? "" : report;
        }
    }

    record Failed(String message, String detail) implements ExecutionOutcome {
    }

    static ExecutionOutcome succeeded(String report) {
        return new Succeeded(report);
    }

    static ExecutionOutcome failed(Throwable error) {
        String message = error.getMessage();
        if (message == null || message.isBlank()) {
            message = error.getClass().getName();
        }
        StringWriter trace = new StringWriter();
        error.printStackTrace(new PrintWriter(trace));
        return new Failed(message, trace.toString());
    }
}
