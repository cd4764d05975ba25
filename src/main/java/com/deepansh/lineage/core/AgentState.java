package com.deepansh.lineage.core;

import com.deepansh.lineage.tool.ToolResult;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * All mutable state of one lineage query, threaded through every phase.
 *
 * Owned by a single loop invocation and never shared between queries. The
 * mutators keep the invariants: the step counter only grows, phases only follow
 * legal edges, confidence is always derived from {@link #getToolResults()}, and
 * nothing changes once the phase is {@link AgentPhase#DONE}.
 */
public class AgentState {

    /** Confidence reported when synthesis runs without any tool result */
    static final double NO_EVIDENCE_CONFIDENCE = 0.5;

    @Getter private final String query;
    @Getter private final int maxSteps;
    @Getter private final int maxTools;

    @Getter private AgentPhase phase = AgentPhase.PLAN;
    @Getter private String plan;
    @Getter private String pendingTool;
    @Getter private double confidence = 0.0;
    @Getter private int stepCount = 0;
    @Getter private String finalAnswer;

    // one entry per distinct tool name; a repeat call overwrites
    private final Map<String, ToolResult> toolResults = new LinkedHashMap<>();
    // every call in order, repeats included
    private final List<String> toolsInvoked = new ArrayList<>();
    private List<Map<String, Object>> evidence = new ArrayList<>();
    private Map<String, Object> dependencyContext = new LinkedHashMap<>();
    private final List<String> errors = new ArrayList<>();

    AgentState(String query, int maxSteps, int maxTools) {
        this.query = query;
        this.maxSteps = maxSteps;
        this.maxTools = maxTools;
    }

    // ─── Transitions ─────────────────────────────────────────────────────────

    /** Counts the step of the phase that just ran. */
    void incrementStep() {
        checkMutable();
        stepCount++;
    }

    /** Moves along a legal edge without counting a step. */
    void transitionTo(AgentPhase next) {
        checkMutable();
        if (!phase.canTransitionTo(next)) {
            throw new IllegalStateException("Illegal transition " + phase + " -> " + next);
        }
        phase = next;
    }

    /** Counts the current phase's step and moves on. */
    void advanceTo(AgentPhase next) {
        incrementStep();
        transitionTo(next);
    }

    // ─── Phase outputs ───────────────────────────────────────────────────────

    void recordPlan(String plan) {
        checkMutable();
        this.plan = plan;
    }

    void selectTool(String toolName) {
        checkMutable();
        this.pendingTool = toolName;
    }

    /** Returns the tool chosen by Investigate and clears it. */
    String takePendingTool() {
        checkMutable();
        String tool = pendingTool;
        pendingTool = null;
        return tool;
    }

    /**
     * Stores a tool outcome, appends to the call history and recomputes
     * confidence. Successful search and dependency results also refresh the
     * evidence and dependency views used for synthesis.
     */
    void recordToolCall(String toolName, ToolResult result) {
        checkMutable();
        toolResults.put(toolName, result);
        toolsInvoked.add(toolName);
        confidence = successRatio();

        if (result.isSuccess()) {
            String lower = toolName.toLowerCase(Locale.ROOT);
            if (lower.contains("search")) {
                evidence = new ArrayList<>(result.getList("items"));
            } else if (lower.contains("dependencies")) {
                dependencyContext = new LinkedHashMap<>(result.asMap());
            }
        }
    }

    void recordError(String error) {
        checkMutable();
        errors.add(error);
    }

    /**
     * Stores the answer, fixes the final confidence and enters DONE.
     */
    void complete(String answer) {
        checkMutable();
        finalAnswer = answer;
        confidence = toolResults.isEmpty() ? NO_EVIDENCE_CONFIDENCE : successRatio();
        advanceTo(AgentPhase.DONE);
    }

    // ─── Views ───────────────────────────────────────────────────────────────

    public Map<String, ToolResult> getToolResults() {
        return Collections.unmodifiableMap(toolResults);
    }

    public List<String> getToolsInvoked() {
        return Collections.unmodifiableList(toolsInvoked);
    }

    public List<Map<String, Object>> getEvidence() {
        return Collections.unmodifiableList(evidence);
    }

    public Map<String, Object> getDependencyContext() {
        return Collections.unmodifiableMap(dependencyContext);
    }

    public List<String> getErrors() {
        return Collections.unmodifiableList(errors);
    }

    public int distinctToolCount() {
        return toolResults.size();
    }

    public long successfulToolCount() {
        return toolResults.values().stream().filter(ToolResult::isSuccess).count();
    }

    public boolean isDone() {
        return phase.isTerminal();
    }

    private double successRatio() {
        return toolResults.isEmpty() ? 0.0 : (double) successfulToolCount() / toolResults.size();
    }

    private void checkMutable() {
        if (phase.isTerminal()) {
            throw new IllegalStateException("Agent state is DONE and can no longer change");
        }
    }
}
