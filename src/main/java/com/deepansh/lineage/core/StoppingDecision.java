package com.deepansh.lineage.core;

/**
 * Outcome of the Act phase's stopping check, with the rule that produced it.
 */
public record StoppingDecision(AgentPhase next, Rule rule) {

    public enum Rule {
        STEP_BUDGET_EXHAUSTED,
        TOOL_BUDGET_EXHAUSTED,
        NO_EVIDENCE_YET,
        CONFIDENT,
        TOOL_CAP_REACHED,
        KEEP_INVESTIGATING
    }

    public boolean stops() {
        return next == AgentPhase.SYNTHESIZE;
    }
}
