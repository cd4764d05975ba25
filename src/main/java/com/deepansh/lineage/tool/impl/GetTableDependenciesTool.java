package com.deepansh.lineage.tool.impl;

import com.deepansh.lineage.config.ToolProperties;
import com.deepansh.lineage.store.DependencyGraph;
import com.deepansh.lineage.store.DependencyRecord;
import com.deepansh.lineage.store.GraphStore;
import com.deepansh.lineage.tool.LineageTool;
import com.deepansh.lineage.tool.ToolArguments;
import com.deepansh.lineage.tool.ToolNames;
import com.deepansh.lineage.tool.ToolResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Upstream dependencies of a table (recursive graph traversal).
 *
 * Input: {@code table_id} (required), {@code depth} (default 3, clamped to
 * 1..tools.traversal-depth).
 */
@Component
@Slf4j
public class GetTableDependenciesTool implements LineageTool {

    private static final int DEFAULT_DEPTH = 3;

    private final GraphStore graphStore;
    private final ToolProperties toolProperties;

    public GetTableDependenciesTool(GraphStore graphStore, ToolProperties toolProperties) {
        this.graphStore = graphStore;
        this.toolProperties = toolProperties;
    }

    @Override
    public String getName() {
        return ToolNames.GET_TABLE_DEPENDENCIES;
    }

    @Override
    public String getDescription() {
        return "Get upstream dependencies of a table";
    }

    @Override
    public ToolResult invoke(Map<String, Object> input) {
        String tableId = ToolArguments.string(input, "table_id");
        if (tableId == null) {
            return failure("'table_id' is required", "");
        }
        int depth = Math.min(Math.max(ToolArguments.integer(input, "depth", DEFAULT_DEPTH), 1),
                toolProperties.getTraversalDepth());

        try {
            DependencyGraph graph = graphStore.getDependencies(tableId, depth);
            log.info("Dependencies of [{}] depth={}: {}", tableId, depth, graph.dependencyNames());

            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("root", graph.root());
            payload.put("dependency_count", graph.dependencies().size());
            payload.put("dependencies", graph.dependencies().stream().map(DependencyRecord::toMap).toList());
            payload.put("dependency_names", graph.dependencyNames());
            payload.put("depth_used", depth);
            return ToolResult.success(payload);

        } catch (Exception e) {
            log.error("Dependency lookup failed for table_id={}", tableId, e);
            return failure(e.getMessage(), tableId);
        }
    }

    private ToolResult failure(String error, String root) {
        return ToolResult.failure(error, Map.of(
                "root", root,
                "dependency_count", 0,
                "dependencies", List.of()));
    }
}
