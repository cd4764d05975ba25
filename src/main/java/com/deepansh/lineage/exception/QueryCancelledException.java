package com.deepansh.lineage.exception;

import lombok.Getter;

/**
 * Raised between phases when the caller cancelled the query.
 */
@Getter
public class QueryCancelledException extends LineageAgentException {

    private final String phase;

    public QueryCancelledException(String phase) {
        super("Query cancelled before phase " + phase);
        this.phase = phase;
    }
}
