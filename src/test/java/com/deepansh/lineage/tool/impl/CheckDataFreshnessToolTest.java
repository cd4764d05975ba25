package com.deepansh.lineage.tool.impl;

import com.deepansh.lineage.store.GraphStore;
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
class CheckDataFreshnessToolTest {

    @Mock
    private GraphStore graphStore;

    @InjectMocks
    private CheckDataFreshnessTool tool;

    @Test
    void invoke_reportsFixedScoresAndCreationTime() {
        when(graphStore.findCreatedAt("table_users")).thenReturn(Optional.of(Instant.parse("2024-01-15T10:00:00Z")));

        ToolResult result = tool.invoke(Map.of("table_id", "table_users"));

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.get("freshness_score")).isEqualTo(0.85);
        assertThat(result.get("reliability")).isEqualTo(0.9);
        assertThat(result.get("confidence")).isEqualTo(0.8);
        assertThat(result.get("last_update")).isEqualTo("2024-01-15T10:00:00Z");
    }

    @Test
    void invoke_unknownTable_hasNullLastUpdate() {
        when(graphStore.findCreatedAt("table_ghost")).thenReturn(Optional.empty());

        ToolResult result = tool.invoke(Map.of("table_id", "table_ghost"));

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.asMap()).containsEntry("last_update", null);
    }

    @Test
    void invoke_missingTableId_fails() {
        assertThat(tool.invoke(Map.of()).isSuccess()).isFalse();
    }
}
