package com.deepansh.lineage.tool.impl;

import com.deepansh.lineage.config.ToolProperties;
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
 * Confirms that data can flow from {@code source_id} into {@code target_id}.
 *
 * A path is valid when the source is upstream of the target, or is the target.
 * An optional {@code proposed_path} is checked node by node against the same
 * upstream set.
 */
@Component
@Slf4j
public class ValidateLineagePathTool implements LineageTool {

    private static final double VALID_CONFIDENCE = 0.95;
    private static final double INVALID_CONFIDENCE = 0.2;

    private final GraphStore graphStore;
    private final ToolProperties toolProperties;

    public ValidateLineagePathTool(GraphStore graphStore, ToolProperties toolProperties) {
        this.graphStore = graphStore;
        this.toolProperties = toolProperties;
    }

    @Override
    public String getName() {
        return ToolNames.VALIDATE_LINEAGE_PATH;
    }

    @Override
    public String getDescription() {
        return "Confirm a data path exists";
    }

    @Override
    public ToolResult invoke(Map<String, Object> input) {
        String sourceId = ToolArguments.string(input, "source_id");
        String targetId = ToolArguments.string(input, "target_id");
        if (sourceId == null || targetId == null) {
            return failure("'source_id' and 'target_id' are required");
        }
        List<String> proposedPath = ToolArguments.stringList(input, "proposed_path");

        try {
            List<String> upstreamIds = graphStore
                    .getDependencies(targetId, toolProperties.getTraversalDepth())
                    .dependencyIds();

            boolean valid = upstreamIds.contains(sourceId) || sourceId.equals(targetId);

            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("is_valid", valid);
            payload.put("source", sourceId);
            payload.put("target", targetId);
            payload.put("path_exists", valid);
            payload.put("confidence", valid ? VALID_CONFIDENCE : INVALID_CONFIDENCE);
            payload.put("upstream_nodes", upstreamIds);

            if (!proposedPath.isEmpty()) {
                boolean proposedValid = proposedPath.stream().allMatch(node ->
                        node.equals(sourceId) || node.equals(targetId) || upstreamIds.contains(node));
                payload.put("proposed_path_valid", proposedValid);
            }

            log.info("Path {} -> {} valid={}", sourceId, targetId, valid);
            return ToolResult.success(payload);

        } catch (Exception e) {
            log.error("Path validation failed for {} -> {}", sourceId, targetId, e);
            return failure(e.getMessage());
        }
    }

    private ToolResult failure(String error) {
        return ToolResult.failure(error, Map.of("is_valid", false, "confidence", 0.0));
    }
}
