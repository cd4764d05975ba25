package com.deepansh.lineage.core;

/**
 * Builds the initial state of a query. Pure: no I/O, same inputs give an
 * equivalent state.
 */
public final class AgentStateFactory {

    public static final int DEFAULT_MAX_STEPS = 8;
    public static final int DEFAULT_MAX_TOOLS = 3;

    private AgentStateFactory() {
    }

    public static AgentState createInitialState(String query) {
        return createInitialState(query, DEFAULT_MAX_STEPS, DEFAULT_MAX_TOOLS);
    }

    public static AgentState createInitialState(String query, int maxSteps, int maxTools) {
        if (query == null) {
            throw new IllegalArgumentException("query must not be null");
        }
        if (maxSteps < 1) {
            throw new IllegalArgumentException("maxSteps must be >= 1, was " + maxSteps);
        }
        if (maxTools < 1) {
            throw new IllegalArgumentException("maxTools must be >= 1, was " + maxTools);
        }
        return new AgentState(query, maxSteps, maxTools);
    }
}
