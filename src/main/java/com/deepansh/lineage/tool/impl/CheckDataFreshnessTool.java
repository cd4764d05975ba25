package com.deepansh.lineage.tool.impl;

import com.deepansh.lineage.store.GraphStore;
import com.deepansh.lineage.tool.LineageTool;
import com.deepansh.lineage.tool.ToolArguments;
import com.deepansh.lineage.tool.ToolNames;
import com.deepansh.lineage.tool.ToolResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Freshness and reliability of a table.
 *
 * Scores are fixed until update logs are wired into the graph store; the only
 * observed value is the node's creation timestamp.
 */
@Component
@Slf4j
public class CheckDataFreshnessTool implements LineageTool {

    private static final double FRESHNESS_SCORE = 0.85;
    private static final double RELIABILITY = 0.9;
    private static final double CONFIDENCE = 0.8;

    private final GraphStore graphStore;

    public CheckDataFreshnessTool(GraphStore graphStore) {
        this.graphStore = graphStore;
    }

    @Override
    public String getName() {
        return ToolNames.CHECK_DATA_FRESHNESS;
    }

    @Override
    public String getDescription() {
        return "Check data quality/freshness";
    }

    @Override
    public ToolResult invoke(Map<String, Object> input) {
        String tableId = ToolArguments.string(input, "table_id");
        if (tableId == null) {
            return ToolResult.failure("'table_id' is required");
        }

        try {
            Optional<Instant> createdAt = graphStore.findCreatedAt(tableId);

            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("table_id", tableId);
            payload.put("freshness_score", FRESHNESS_SCORE);
            payload.put("reliability", RELIABILITY);
            payload.put("confidence", CONFIDENCE);
            payload.put("last_update", createdAt.map(Instant::toString).orElse(null));
            return ToolResult.success(payload);

        } catch (Exception e) {
            log.error("Freshness check failed for table_id={}", tableId, e);
            return ToolResult.failure(e.getMessage(), Map.of("table_id", tableId, "freshness_score", 0.5));
        }
    }
}
