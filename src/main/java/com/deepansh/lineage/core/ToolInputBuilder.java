package com.deepansh.lineage.core;

import com.deepansh.lineage.config.ToolProperties;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Builds a tool's input from keywords in its name. Checked in order:
 *
 * | name contains        | input                          |
 * |----------------------|--------------------------------|
 * | search               | {query, limit=3}               |
 * | dependencies         | {table_id, depth=3}            |
 * | validate / trace     | {source_id, target_id}         |
 * | metadata             | {node_id}                      |
 * | freshness            | {table_id}                     |
 * | anything else        | {query, limit=3}               |
 *
 * Identifiers come from {@code tools.inputs.*}.
 */
@Component
public class ToolInputBuilder {

    static final int SEARCH_LIMIT = 3;
    static final int DEPENDENCY_DEPTH = 3;

    private final ToolProperties toolProperties;

    public ToolInputBuilder(ToolProperties toolProperties) {
        this.toolProperties = toolProperties;
    }

    public Map<String, Object> build(String toolName, String query) {
        String name = toolName.toLowerCase(Locale.ROOT);
        ToolProperties.Inputs ids = toolProperties.getInputs();
        Map<String, Object> input = new LinkedHashMap<>();

        if (name.contains("search")) {
            input.put("query", query);
            input.put("limit", SEARCH_LIMIT);
        } else if (name.contains("dependencies")) {
            input.put("table_id", ids.getDefaultTableId());
            input.put("depth", DEPENDENCY_DEPTH);
        } else if (name.contains("validate") || name.contains("trace")) {
            input.put("source_id", ids.getDefaultSourceId());
            input.put("target_id", ids.getDefaultTargetId());
        } else if (name.contains("metadata")) {
            input.put("node_id", ids.getDefaultNodeId());
        } else if (name.contains("freshness")) {
            input.put("table_id", ids.getDefaultFreshnessTableId());
        } else {
            input.put("query", query);
            input.put("limit", SEARCH_LIMIT);
        }
        return input;
    }
}
