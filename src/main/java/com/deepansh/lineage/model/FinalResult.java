package com.deepansh.lineage.model;

import com.deepansh.lineage.core.AgentPhase;
import com.deepansh.lineage.core.AgentState;
import com.deepansh.lineage.tool.ToolResult;
import lombok.Builder;
import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * What a completed query returns to its caller. {@code phase} is always DONE.
 */
@Data
@Builder
public class FinalResult {

    private String query;
    private String finalAnswer;
    private double confidence;
    private List<String> toolsInvoked;
    private Map<String, ToolResult> toolResults;
    private AgentPhase phase;
    private String plan;
    private int stepCount;
    private List<Map<String, Object>> evidence;
    private Map<String, Object> dependencyContext;
    private List<String> errors;
    private long latencyMs;

    public static FinalResult from(AgentState state, long latencyMs) {
        return FinalResult.builder()
                .query(state.getQuery())
                .finalAnswer(state.getFinalAnswer())
                .confidence(state.getConfidence())
                .toolsInvoked(List.copyOf(state.getToolsInvoked()))
                .toolResults(state.getToolResults())
                .phase(state.getPhase())
                .plan(state.getPlan())
                .stepCount(state.getStepCount())
                .evidence(state.getEvidence())
                .dependencyContext(state.getDependencyContext())
                .errors(List.copyOf(state.getErrors()))
                .latencyMs(latencyMs)
                .build();
    }
}
