package com.deepansh.lineage.core;

import com.deepansh.lineage.core.StoppingDecision.Rule;
import org.springframework.stereotype.Component;

/**
 * Priority-ordered stopping rules; the first match decides.
 *
 * <ol>
 *   <li>step budget spent → SYNTHESIZE</li>
 *   <li>tool budget spent → SYNTHESIZE</li>
 *   <li>no tool result yet → INVESTIGATE</li>
 *   <li>confidence above {@value #CONFIDENCE_THRESHOLD} → SYNTHESIZE</li>
 *   <li>{@value #TOOL_CAP} or more distinct tools → SYNTHESIZE</li>
 *   <li>otherwise → INVESTIGATE</li>
 * </ol>
 *
 * The order is part of the contract. Rules 1 and 2 must stay first: they are
 * the only ones that do not depend on tool outcomes.
 */
@Component
public class PriorityStoppingPolicy implements StoppingPolicy {

    public static final double CONFIDENCE_THRESHOLD = 0.7;
    public static final int TOOL_CAP = 2;

    @Override
    public StoppingDecision decide(AgentState state) {
        int toolCount = state.distinctToolCount();

        if (state.getStepCount() >= state.getMaxSteps()) {
            return new StoppingDecision(AgentPhase.SYNTHESIZE, Rule.STEP_BUDGET_EXHAUSTED);
        }
        if (toolCount >= state.getMaxTools()) {
            return new StoppingDecision(AgentPhase.SYNTHESIZE, Rule.TOOL_BUDGET_EXHAUSTED);
        }
        if (toolCount == 0) {
            return new StoppingDecision(AgentPhase.INVESTIGATE, Rule.NO_EVIDENCE_YET);
        }
        if (state.getConfidence() > CONFIDENCE_THRESHOLD) {
            return new StoppingDecision(AgentPhase.SYNTHESIZE, Rule.CONFIDENT);
        }
        if (toolCount >= TOOL_CAP) {
            return new StoppingDecision(AgentPhase.SYNTHESIZE, Rule.TOOL_CAP_REACHED);
        }
        return new StoppingDecision(AgentPhase.INVESTIGATE, Rule.KEEP_INVESTIGATING);
    }
}
