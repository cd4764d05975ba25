package com.deepansh.lineage.observability;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Mutable per-run collection of timing data.
 * Created at the start of each query, populated throughout, then logged.
 */
@Data
public class RunContext {

    private final long startTimeMs = System.currentTimeMillis();
    private final List<ToolCallRecord> toolCallRecords = new ArrayList<>();

    private int decisionCalls;
    private int failedDecisionCalls;
    private long decisionLatencyMs;

    public void recordToolCall(String toolName, long latencyMs, boolean success) {
        toolCallRecords.add(new ToolCallRecord(toolName, latencyMs, success));
    }

    public void recordDecisionCall(long latencyMs, boolean failed) {
        decisionCalls++;
        decisionLatencyMs += latencyMs;
        if (failed) failedDecisionCalls++;
    }

    public long toolLatencyMs() {
        return toolCallRecords.stream().mapToLong(ToolCallRecord::latencyMs).sum();
    }

    public long elapsedMs() {
        return System.currentTimeMillis() - startTimeMs;
    }

    public record ToolCallRecord(String toolName, long latencyMs, boolean success) {}
}
