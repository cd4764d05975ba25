package com.deepansh.lineage.tool.impl;

import com.deepansh.lineage.exception.LineageAgentException;
import com.deepansh.lineage.store.EmbeddingService;
import com.deepansh.lineage.store.SearchHit;
import com.deepansh.lineage.store.VectorStore;
import com.deepansh.lineage.tool.ToolResult;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SearchVectorDbToolTest {

    @Mock
    private EmbeddingService embeddingService;

    @Mock
    private VectorStore vectorStore;

    @InjectMocks
    private SearchVectorDbTool tool;

    @Test
    void invoke_returnsRankedItemsAndScores() {
        float[] embedding = {0.1f, 0.2f, 0.3f};
        when(embeddingService.embed("what feeds revenue?")).thenReturn(embedding);
        when(vectorStore.search(embedding, 3)).thenReturn(List.of(
                new SearchHit("e1", "revenue_daily", "Daily revenue rollup", "table", 0.91),
                new SearchHit("e2", "orders", "Raw orders", "table", 0.74)));

        ToolResult result = tool.invoke(Map.of("query", "what feeds revenue?", "limit", 3));

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.get("count")).isEqualTo(2);
        assertThat(result.get("relevance_scores")).isEqualTo(List.of(0.91, 0.74));
        assertThat(result.get("query_embedding_dim")).isEqualTo(3);
        assertThat(result.getList("items")).extracting(m -> m.get("entity_name"))
                .containsExactly("revenue_daily", "orders");
    }

    @Test
    void invoke_limitDefaultsToThreeAndIsClamped() {
        when(embeddingService.embed(any())).thenReturn(new float[]{1f});
        when(vectorStore.search(any(), anyInt())).thenReturn(List.of());

        tool.invoke(Map.of("query", "q"));
        tool.invoke(Map.of("query", "q", "limit", "500"));

        verify(vectorStore).search(any(), eq(3));
        verify(vectorStore).search(any(), eq(20));
    }

    @Test
    void invoke_missingQuery_failsWithEmptyItems() {
        ToolResult result = tool.invoke(Map.of("limit", 3));

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getError()).contains("query");
        assertThat(result.get("items")).isEqualTo(List.of());
        assertThat(result.get("count")).isEqualTo(0);
        verifyNoInteractions(embeddingService, vectorStore);
    }

    @Test
    void invoke_embeddingFails_returnsFailureShape() {
        when(embeddingService.embed("q")).thenThrow(new LineageAgentException("embedding server down"));

        ToolResult result = tool.invoke(Map.of("query", "q"));

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getError()).isEqualTo("embedding server down");
        assertThat(result.get("count")).isEqualTo(0);
    }
}
