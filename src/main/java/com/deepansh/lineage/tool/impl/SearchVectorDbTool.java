package com.deepansh.lineage.tool.impl;

import com.deepansh.lineage.store.EmbeddingService;
import com.deepansh.lineage.store.SearchHit;
import com.deepansh.lineage.store.VectorStore;
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
 * Finds tables and dashboards whose descriptions are semantically close to a
 * natural-language query.
 *
 * Input: {@code query} (required), {@code limit} (default 3, clamped to 1-20).
 * Output: {@code items} ranked by similarity, {@code count}, {@code relevance_scores}.
 */
@Component
@Slf4j
public class SearchVectorDbTool implements LineageTool {

    private static final int DEFAULT_LIMIT = 3;
    private static final int MAX_LIMIT = 20;

    private final EmbeddingService embeddingService;
    private final VectorStore vectorStore;

    public SearchVectorDbTool(EmbeddingService embeddingService, VectorStore vectorStore) {
        this.embeddingService = embeddingService;
        this.vectorStore = vectorStore;
    }

    @Override
    public String getName() {
        return ToolNames.SEARCH_VECTOR_DB;
    }

    @Override
    public String getDescription() {
        return "Search for relevant tables using natural language";
    }

    @Override
    public ToolResult invoke(Map<String, Object> input) {
        String query = ToolArguments.string(input, "query");
        if (query == null) {
            return failure("'query' is required");
        }
        int limit = Math.min(Math.max(ToolArguments.integer(input, "limit", DEFAULT_LIMIT), 1), MAX_LIMIT);

        try {
            float[] queryEmbedding = embeddingService.embed(query);
            List<SearchHit> hits = vectorStore.search(queryEmbedding, limit);

            log.info("Vector search: query='{}' limit={} hits={}", query, limit, hits.size());

            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("items", hits.stream().map(SearchHit::toMap).toList());
            payload.put("count", hits.size());
            payload.put("relevance_scores", hits.stream().map(SearchHit::similarity).toList());
            payload.put("query_embedding_dim", queryEmbedding.length);
            return ToolResult.success(payload);

        } catch (Exception e) {
            log.error("Vector search failed for query='{}'", query, e);
            return failure(e.getMessage());
        }
    }

    private ToolResult failure(String error) {
        return ToolResult.failure(error, Map.of("items", List.of(), "count", 0));
    }
}
