package com.deepansh.lineage.tool.impl;

import com.deepansh.lineage.config.ToolProperties;
import com.deepansh.lineage.store.DependencyGraph;
import com.deepansh.lineage.store.DependencyRecord;
import com.deepansh.lineage.store.GraphStore;
import com.deepansh.lineage.tool.ToolResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class TraceDataFlowToolTest {

    private GraphStore graphStore;
    private TraceDataFlowTool tool;

    @BeforeEach
    void setUp() {
        graphStore = mock(GraphStore.class);
        tool = new TraceDataFlowTool(graphStore, new ToolProperties());
        when(graphStore.getDependencies("dashboard_revenue", 10)).thenReturn(new DependencyGraph("dashboard_revenue", List.of(
                new DependencyRecord("table_revenue_daily", "revenue_daily", "table", 0),
                new DependencyRecord("table_order_clean", "order_clean", "table", 1),
                new DependencyRecord("table_orders", "orders", "table", 2),
                new DependencyRecord("table_users", "users", "table", 2))));
    }

    @Test
    void invoke_startFound_pathIsCutAndReadsSourceFirst() {
        ToolResult result = tool.invoke(Map.of("start_node", "table_orders", "end_node", "dashboard_revenue"));

        assertThat(result.get("path")).isEqualTo(List.of(
                "table_orders", "table_order_clean", "table_revenue_daily", "dashboard_revenue"));
        assertThat(result.get("path_length")).isEqualTo(4);
        assertThat(result.get("confidence")).isEqualTo(0.95);
    }

    @Test
    void invoke_acceptsSourceAndTargetKeys() {
        ToolResult result = tool.invoke(Map.of("source_id", "table_orders", "target_id", "dashboard_revenue"));

        assertThat(result.get("start")).isEqualTo("table_orders");
        assertThat(result.get("end")).isEqualTo("dashboard_revenue");
        assertThat(result.get("confidence")).isEqualTo(0.95);
    }

    @Test
    void invoke_startNotUpstream_returnsWholeUpstreamWithLowConfidence() {
        ToolResult result = tool.invoke(Map.of("source_id", "table_products", "target_id", "dashboard_revenue"));

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.get("confidence")).isEqualTo(0.3);
        assertThat(result.get("path")).isEqualTo(List.of(
                "dashboard_revenue", "table_revenue_daily", "table_order_clean", "table_orders", "table_users"));
    }

    @Test
    void invoke_missingEnd_fails() {
        ToolResult result = tool.invoke(Map.of("source_id", "table_orders"));

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.get("path")).isEqualTo(List.of());
    }
}
