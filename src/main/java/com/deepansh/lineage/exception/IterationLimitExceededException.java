package com.deepansh.lineage.exception;

import lombok.Getter;

/**
 * The transition safety net fired. This means a stopping rule let the loop run
 * past every budget; it aborts the query instead of returning a truncated answer.
 */
@Getter
public class IterationLimitExceededException extends LineageAgentException {

    private final int transitions;
    private final String query;

    public IterationLimitExceededException(String query, int transitions) {
        super("Agent exceeded " + transitions + " phase transitions without finishing");
        this.query = query;
        this.transitions = transitions;
    }
}
