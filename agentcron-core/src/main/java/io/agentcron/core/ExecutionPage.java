package io.agentcron.core;

import java.util.List;

public record ExecutionPage(
        List<ExecutionRecord> items,
        long total,
        int offset,
        int size
) {

    public ExecutionPage {
        items = List.copyOf(items);
    }

    public static ExecutionPage empty(ExecutionQuery query) {
        return new ExecutionPage(List.of(), 0, query.offset(), query.size());
    }
}
