package com.deepansh.lineage.tool;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ToolResultTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void success_payloadCannotOverrideSuccessFlag() {
        ToolResult result = ToolResult.success(Map.of("success", false, "count", 2));

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.get("count")).isEqualTo(2);
    }

    @Test
    void failure_keepsErrorAndExtras() {
        ToolResult result = ToolResult.failure("Node not found: table_x", Map.of("id", "table_x", "error", "ignored"));

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getError()).isEqualTo("Node not found: table_x");
        assertThat(result.get("id")).isEqualTo("table_x");
    }

    @Test
    void getList_wrongType_isEmpty() {
        ToolResult result = ToolResult.success(Map.of("items", "not a list"));

        assertThat(result.getList("items")).isEmpty();
        assertThat(result.getList("absent")).isEmpty();
    }

    @Test
    void json_isFlatObject() throws Exception {
        ToolResult result = ToolResult.failure("boom", Map.of("count", 0));

        String json = objectMapper.writeValueAsString(result);

        assertThat(json).isEqualTo("{\"success\":false,\"error\":\"boom\",\"count\":0}");
    }
}
