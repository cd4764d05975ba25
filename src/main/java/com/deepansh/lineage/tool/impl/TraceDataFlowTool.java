package com.deepansh.lineage.tool.impl;

import com.deepansh.lineage.config.ToolProperties;
import com.deepansh.lineage.store.GraphStore;
import com.deepansh.lineage.tool.LineageTool;
import com.deepansh.lineage.tool.ToolArguments;
import com.deepansh.lineage.tool.ToolNames;
import com.deepansh.lineage.tool.ToolResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Traces the flow from a start node to an end node.
 *
 * The path is built from the end node's upstream set in depth order. When the
 * start node is in it, the path is cut at the start and reversed so it reads
 * source first ({@code orders -> order_clean -> ... -> dashboard}).
 *
 * Accepts {@code source_id}/{@code target_id} as well as {@code start_node}/{@code end_node}.
 */
@Component
@Slf4j
public class TraceDataFlowTool implements LineageTool {

    private static final double FOUND_CONFIDENCE = 0.95;
    private static final double NOT_FOUND_CONFIDENCE = 0.3;

    private final GraphStore graphStore;
    private final ToolProperties toolProperties;

    public TraceDataFlowTool(GraphStore graphStore, ToolProperties toolProperties) {
        this.graphStore = graphStore;
        this.toolProperties = toolProperties;
    }

    @Override
    public String getName() {
        return ToolNames.TRACE_DATA_FLOW;
    }

    @Override
    public String getDescription() {
        return "Trace complete flow from source to destination";
    }

    @Override
    public ToolResult invoke(Map<String, Object> input) {
        String start = ToolArguments.string(input, "source_id", "start_node");
        String end = ToolArguments.string(input, "target_id", "end_node");
        if (start == null || end == null) {
            return ToolResult.failure("'source_id' and 'target_id' are required",
                    Map.of("path", List.of()));
        }

        try {
            List<String> path = new ArrayList<>();
            path.add(end);
            for (String id : graphStore.getDependencies(end, toolProperties.getTraversalDepth()).dependencyIds()) {
                if (!path.contains(id)) path.add(id);
            }

            double confidence;
            if (path.contains(start)) {
                path = new ArrayList<>(path.subList(0, path.indexOf(start) + 1));
                Collections.reverse(path);
                confidence = FOUND_CONFIDENCE;
            } else {
                confidence = NOT_FOUND_CONFIDENCE;
            }

            log.info("Traced {} -> {}: {}", start, end, path);

            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("start", start);
            payload.put("end", end);
            payload.put("path", path);
            payload.put("path_length", path.size());
            payload.put("confidence", confidence);
            return ToolResult.success(payload);

        } catch (Exception e) {
            log.error("Flow trace failed for {} -> {}", start, end, e);
            return ToolResult.failure(e.getMessage(), Map.of(
                    "start", start, "end", end, "path", List.of()));
        }
    }
}
