package com.deepansh.lineage.core;

/**
 * Decides where the loop goes after an Act phase: back to INVESTIGATE or on to
 * SYNTHESIZE. Must be a pure function of the state.
 */
public interface StoppingPolicy {

    StoppingDecision decide(AgentState state);

    default AgentPhase nextPhase(AgentState state) {
        return decide(state).next();
    }
}
