package com.deepansh.lineage.core;

import java.util.EnumSet;
import java.util.Set;

/**
 * Position of a query in the orchestration state machine.
 * <pre>
 * PLAN → INVESTIGATE → ACT → INVESTIGATE (loop)
 *                          → SYNTHESIZE → DONE
 * </pre>
 */
public enum AgentPhase {

    /** Ask the decision maker for an investigation plan */
    PLAN,

    /** Ask the decision maker which tool to call next */
    INVESTIGATE,

    /** Run the selected tool, then apply the stopping rules */
    ACT,

    /** Produce the final answer from accumulated evidence */
    SYNTHESIZE,

    /** Terminal */
    DONE;

    public boolean isTerminal() {
        return this == DONE;
    }

    public Set<AgentPhase> successors() {
        return switch (this) {
            case PLAN -> EnumSet.of(INVESTIGATE);
            case INVESTIGATE -> EnumSet.of(ACT);
            case ACT -> EnumSet.of(INVESTIGATE, SYNTHESIZE);
            case SYNTHESIZE -> EnumSet.of(DONE);
            case DONE -> EnumSet.noneOf(AgentPhase.class);
        };
    }

    public boolean canTransitionTo(AgentPhase next) {
        return successors().contains(next);
    }
}
