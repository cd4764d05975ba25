package com.deepansh.lineage.core;

import com.deepansh.lineage.core.StoppingDecision.Rule;
import com.deepansh.lineage.tool.ToolResult;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class PriorityStoppingPolicyTest {

    private final PriorityStoppingPolicy policy = new PriorityStoppingPolicy();

    /** Puts a fresh state into ACT with {@code steps} counted. */
    private AgentState actState(int maxSteps, int maxTools, int steps) {
        AgentState state = AgentStateFactory.createInitialState("what feeds revenue_dashboard?", maxSteps, maxTools);
        state.transitionTo(AgentPhase.INVESTIGATE);
        state.transitionTo(AgentPhase.ACT);
        for (int i = 0; i < steps; i++) state.incrementStep();
        return state;
    }

    private static ToolResult ok() {
        return ToolResult.success(Map.of("count", 1));
    }

    private static ToolResult failed() {
        return ToolResult.failure("boom");
    }

    @Test
    void decide_stepBudgetSpent_synthesizesEvenWithoutTools() {
        AgentState state = actState(2, 3, 3);

        StoppingDecision decision = policy.decide(state);

        assertThat(decision.next()).isEqualTo(AgentPhase.SYNTHESIZE);
        assertThat(decision.rule()).isEqualTo(Rule.STEP_BUDGET_EXHAUSTED);
        assertThat(decision.stops()).isTrue();
    }

    @Test
    void decide_stepBudgetOutranksEverything() {
        AgentState state = actState(3, 3, 3);
        state.recordToolCall("search_vector_db", ok());
        state.recordToolCall("get_table_dependencies", ok());
        state.recordToolCall("trace_data_flow", ok());

        assertThat(policy.decide(state).rule()).isEqualTo(Rule.STEP_BUDGET_EXHAUSTED);
    }

    @Test
    void decide_toolBudgetReached_synthesizesRegardlessOfConfidence() {
        AgentState state = actState(8, 1, 3);
        state.recordToolCall("search_vector_db", failed());

        StoppingDecision decision = policy.decide(state);

        assertThat(state.getConfidence()).isZero();
        assertThat(decision.next()).isEqualTo(AgentPhase.SYNTHESIZE);
        assertThat(decision.rule()).isEqualTo(Rule.TOOL_BUDGET_EXHAUSTED);
    }

    @Test
    void decide_noToolResults_keepsInvestigating() {
        AgentState state = actState(8, 3, 3);

        StoppingDecision decision = policy.decide(state);

        assertThat(decision.next()).isEqualTo(AgentPhase.INVESTIGATE);
        assertThat(decision.rule()).isEqualTo(Rule.NO_EVIDENCE_YET);
        assertThat(decision.stops()).isFalse();
    }

    @Test
    void decide_highConfidence_synthesizes() {
        AgentState state = actState(8, 3, 3);
        state.recordToolCall("search_vector_db", ok());

        StoppingDecision decision = policy.decide(state);

        assertThat(decision.next()).isEqualTo(AgentPhase.SYNTHESIZE);
        assertThat(decision.rule()).isEqualTo(Rule.CONFIDENT);
    }

    @Test
    void decide_confidenceExactlyAtThreshold_isNotConfident() {
        AgentState state = actState(32, 11, 3);
        for (int i = 0; i < 10; i++) {
            state.recordToolCall("tool_" + i, i < 7 ? ok() : failed());
        }

        StoppingDecision decision = policy.decide(state);

        assertThat(state.getConfidence()).isEqualTo(0.7);
        assertThat(decision.rule()).isEqualTo(Rule.TOOL_CAP_REACHED);
    }

    @Test
    void decide_twoDistinctToolsWithMediocreConfidence_hitsToolCap() {
        AgentState state = actState(8, 3, 5);
        state.recordToolCall("search_vector_db", failed());
        state.recordToolCall("get_table_dependencies", failed());

        StoppingDecision decision = policy.decide(state);

        assertThat(decision.next()).isEqualTo(AgentPhase.SYNTHESIZE);
        assertThat(decision.rule()).isEqualTo(Rule.TOOL_CAP_REACHED);
    }

    @Test
    void decide_oneFailedTool_keepsInvestigating() {
        AgentState state = actState(8, 3, 3);
        state.recordToolCall("search_vector_db", failed());

        StoppingDecision decision = policy.decide(state);

        assertThat(decision.next()).isEqualTo(AgentPhase.INVESTIGATE);
        assertThat(decision.rule()).isEqualTo(Rule.KEEP_INVESTIGATING);
    }

    @Test
    void decide_repeatedCallsToSameTool_countOnce() {
        AgentState state = actState(8, 2, 5);
        state.recordToolCall("search_vector_db", failed());
        state.recordToolCall("search_vector_db", failed());

        assertThat(state.getToolsInvoked()).hasSize(2);
        assertThat(policy.decide(state).rule()).isEqualTo(Rule.KEEP_INVESTIGATING);
    }

    @Test
    void nextPhase_matchesDecision() {
        AgentState state = actState(8, 3, 3);
        state.recordToolCall("search_vector_db", ok());

        assertThat(policy.nextPhase(state)).isEqualTo(AgentPhase.SYNTHESIZE);
    }
}
