package com.deepansh.lineage.core;

import com.deepansh.lineage.config.AgentProperties;
import com.deepansh.lineage.exception.IterationLimitExceededException;
import com.deepansh.lineage.exception.QueryCancelledException;
import com.deepansh.lineage.llm.DecisionMaker;
import com.deepansh.lineage.model.FinalResult;
import com.deepansh.lineage.observability.RunContext;
import com.deepansh.lineage.tool.ToolDispatcher;
import com.deepansh.lineage.tool.ToolNames;
import com.deepansh.lineage.tool.ToolResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * Bounded plan / investigate / act / synthesize loop over the tool registry.
 *
 * Per-query flow:
 * 1. PLAN: ask for a short investigation plan
 * 2. INVESTIGATE: ask for one tool name, resolve it fuzzily
 * 3. ACT: run the tool, fold the result into the state, consult the stopping policy
 * 4. Repeat 2-3 until the policy says SYNTHESIZE
 * 5. SYNTHESIZE: ask for the final answer over every tool result
 *
 * Decision-maker failures never escape a phase; they become empty text and an
 * entry in {@code errors}. The only fatal outcomes are the transition safety
 * net and caller cancellation.
 */
@Service
@Slf4j
public class LineageAgentLoop {

    private final DecisionMaker decisionMaker;
    private final ToolDispatcher toolDispatcher;
    private final ToolSelector toolSelector;
    private final ToolInputBuilder toolInputBuilder;
    private final LineagePrompts prompts;
    private final StoppingPolicy stoppingPolicy;
    private final AgentProperties agentProperties;

    public LineageAgentLoop(DecisionMaker decisionMaker,
                            ToolDispatcher toolDispatcher,
                            ToolSelector toolSelector,
                            ToolInputBuilder toolInputBuilder,
                            LineagePrompts prompts,
                            StoppingPolicy stoppingPolicy,
                            AgentProperties agentProperties) {
        this.decisionMaker = decisionMaker;
        this.toolDispatcher = toolDispatcher;
        this.toolSelector = toolSelector;
        this.toolInputBuilder = toolInputBuilder;
        this.prompts = prompts;
        this.stoppingPolicy = stoppingPolicy;
        this.agentProperties = agentProperties;
    }

    public FinalResult run(String query, int maxSteps, int maxTools) {
        return run(query, maxSteps, maxTools, CancellationSignal.none());
    }

    public FinalResult run(String query, int maxSteps, int maxTools, CancellationSignal cancellation) {
        int maxTransitions = agentProperties.getMaxTransitions();
        // the first Act lands on step 3, so budgets below 2 still need four transitions
        if (Math.max(maxSteps, 2) + 2 > maxTransitions) {
            throw new IllegalArgumentException("maxSteps " + maxSteps
                    + " cannot finish within " + maxTransitions + " transitions");
        }
        AgentState state = AgentStateFactory.createInitialState(query, maxSteps, maxTools);
        RunContext runCtx = new RunContext();

        log.info("Lineage run started [query='{}', maxSteps={}, maxTools={}]", query, maxSteps, maxTools);

        int transitions = 0;
        while (!state.isDone()) {
            if (++transitions > maxTransitions) {
                log.error("Safety net tripped [query='{}', phase={}, steps={}, tools={}]",
                        query, state.getPhase(), state.getStepCount(), state.getToolsInvoked());
                throw new IterationLimitExceededException(query, maxTransitions);
            }
            if (cancellation.isCancelled()) {
                log.info("Lineage run cancelled before {} [query='{}']", state.getPhase(), query);
                throw new QueryCancelledException(state.getPhase().name());
            }

            switch (state.getPhase()) {
                case PLAN -> plan(state, runCtx);
                case INVESTIGATE -> investigate(state, runCtx);
                case ACT -> act(state, runCtx);
                case SYNTHESIZE -> synthesize(state, runCtx);
                default -> throw new IllegalStateException("Unhandled phase " + state.getPhase());
            }
        }

        log.info("Lineage run complete [steps={}, tools={}, confidence={}, latency={}ms, toolLatency={}ms, "
                        + "decisionCalls={}, decisionFailures={}, decisionLatency={}ms]",
                state.getStepCount(), state.getToolsInvoked(), state.getConfidence(), runCtx.elapsedMs(),
                runCtx.toolLatencyMs(), runCtx.getDecisionCalls(), runCtx.getFailedDecisionCalls(),
                runCtx.getDecisionLatencyMs());

        return FinalResult.from(state, runCtx.elapsedMs());
    }

    // ─── Phases ──────────────────────────────────────────────────────────────

    void plan(AgentState state, RunContext runCtx) {
        String plan = ask(state, runCtx, "plan",
                prompts.plan(state.getQuery()), agentProperties.getTokens().getPlan());
        state.recordPlan(plan.trim());
        state.advanceTo(AgentPhase.INVESTIGATE);
        log.debug("Plan: {}", state.getPlan());
    }

    void investigate(AgentState state, RunContext runCtx) {
        String choice = ask(state, runCtx, "tool choice",
                prompts.toolChoice(state.getPlan(), state.getQuery()), agentProperties.getTokens().getToolChoice());
        String tool = toolSelector.select(choice);
        state.selectTool(tool);
        state.advanceTo(AgentPhase.ACT);
        log.info("Investigate selected [{}] from '{}'", tool, choice.trim());
    }

    void act(AgentState state, RunContext runCtx) {
        String tool = state.takePendingTool();
        if (tool == null || tool.isBlank()) {
            tool = ToolNames.DEFAULT_TOOL;
        }
        Map<String, Object> input = toolInputBuilder.build(tool, state.getQuery());

        long start = System.currentTimeMillis();
        ToolResult result = toolDispatcher.execute(tool, input);
        runCtx.recordToolCall(tool, System.currentTimeMillis() - start, result.isSuccess());

        state.recordToolCall(tool, result);
        if (!result.isSuccess()) {
            log.warn("Tool [{}] failed: {}", tool, result.getError());
        }
        state.incrementStep();

        StoppingDecision decision = stoppingPolicy.decide(state);
        log.info("Act [{}] success={} -> {} ({}) [step={}/{}, tools={}/{}, confidence={}]",
                tool, result.isSuccess(), decision.next(), decision.rule(),
                state.getStepCount(), state.getMaxSteps(), state.distinctToolCount(), state.getMaxTools(),
                state.getConfidence());
        state.transitionTo(decision.next());
    }

    void synthesize(AgentState state, RunContext runCtx) {
        String answer = ask(state, runCtx, "synthesis",
                prompts.synthesis(state.getQuery(), state.getToolResults()), agentProperties.getTokens().getSynthesis());
        state.complete(answer.trim());
    }

    /**
     * Calls the decision maker; any failure yields empty text and an error entry.
     */
    private String ask(AgentState state, RunContext runCtx, String purpose, String prompt, int maxTokens) {
        log.debug("Prompt ({}):\n{}", purpose, prompt);
        long start = System.currentTimeMillis();
        try {
            String text = decisionMaker.generate(prompt, maxTokens);
            runCtx.recordDecisionCall(System.currentTimeMillis() - start, false);
            return text != null ? text : "";
        } catch (RuntimeException e) {
            runCtx.recordDecisionCall(System.currentTimeMillis() - start, true);
            log.warn("Decision maker failed during {}: {}", purpose, e.getMessage());
            state.recordError(purpose + " failed: " + e.getMessage());
            return "";
        }
    }
}
