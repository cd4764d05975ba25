package com.deepansh.lineage.tool.impl;

import com.deepansh.lineage.store.GraphStore;
import com.deepansh.lineage.store.LineageNode;
import com.deepansh.lineage.tool.LineageTool;
import com.deepansh.lineage.tool.ToolArguments;
import com.deepansh.lineage.tool.ToolNames;
import com.deepansh.lineage.tool.ToolResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

@Component
@Slf4j
public class GetNodeMetadataTool implements LineageTool {

    private final GraphStore graphStore;

    public GetNodeMetadataTool(GraphStore graphStore) {
        this.graphStore = graphStore;
    }

    @Override
    public String getName() {
        return ToolNames.GET_NODE_METADATA;
    }

    @Override
    public String getDescription() {
        return "Get details about a specific table";
    }

    @Override
    public ToolResult invoke(Map<String, Object> input) {
        String nodeId = ToolArguments.string(input, "node_id");
        if (nodeId == null) {
            return ToolResult.failure("'node_id' is required");
        }

        try {
            Optional<LineageNode> node = graphStore.findNode(nodeId);
            if (node.isEmpty()) {
                return ToolResult.failure("Node not found: " + nodeId, Map.of("id", nodeId));
            }

            LineageNode n = node.get();
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("id", n.id());
            payload.put("name", n.name());
            payload.put("type", n.type());
            payload.put("description", n.description() != null ? n.description() : "");
            payload.put("metadata", n.metadata() != null ? n.metadata() : Map.of());
            return ToolResult.success(payload);

        } catch (Exception e) {
            log.error("Metadata lookup failed for node_id={}", nodeId, e);
            return ToolResult.failure(e.getMessage(), Map.of("id", nodeId));
        }
    }
}
