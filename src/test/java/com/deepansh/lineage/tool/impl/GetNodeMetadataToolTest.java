package com.deepansh.lineage.tool.impl;

import com.deepansh.lineage.store.GraphStore;
import com.deepansh.lineage.store.LineageNode;
import com.deepansh.lineage.tool.ToolResult;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class GetNodeMetadataToolTest {

    @Mock
    private GraphStore graphStore;

    @InjectMocks
    private GetNodeMetadataTool tool;

    @Test
    void invoke_knownNode_returnsDetails() {
        when(graphStore.findNode("table_users")).thenReturn(Optional.of(new LineageNode(
                "table_users", "users", "table", "Customer accounts", Map.of("owner", "crm"), Instant.EPOCH)));

        ToolResult result = tool.invoke(Map.of("node_id", "table_users"));

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.get("name")).isEqualTo("users");
        assertThat(result.get("type")).isEqualTo("table");
        assertThat(result.get("metadata")).isEqualTo(Map.of("owner", "crm"));
    }

    @Test
    void invoke_nullDescriptionAndMetadata_becomeEmpty() {
        when(graphStore.findNode("t")).thenReturn(Optional.of(new LineageNode("t", "t", "table", null, null, null)));

        ToolResult result = tool.invoke(Map.of("node_id", "t"));

        assertThat(result.get("description")).isEqualTo("");
        assertThat(result.get("metadata")).isEqualTo(Map.of());
    }

    @Test
    void invoke_unknownNode_failsWithNotFound() {
        when(graphStore.findNode("table_ghost")).thenReturn(Optional.empty());

        ToolResult result = tool.invoke(Map.of("node_id", "table_ghost"));

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getError()).isEqualTo("Node not found: table_ghost");
        assertThat(result.get("id")).isEqualTo("table_ghost");
    }
}
