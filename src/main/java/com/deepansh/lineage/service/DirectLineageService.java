package com.deepansh.lineage.service;

import com.deepansh.lineage.config.AgentProperties;
import com.deepansh.lineage.exception.LineageAgentException;
import com.deepansh.lineage.llm.DecisionMaker;
import com.deepansh.lineage.model.DirectQueryResponse;
import com.deepansh.lineage.store.DependencyGraph;
import com.deepansh.lineage.store.EmbeddingService;
import com.deepansh.lineage.store.GraphStore;
import com.deepansh.lineage.store.SearchHit;
import com.deepansh.lineage.store.VectorStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Single-shot answer without the agent loop: embed, search, expand the top hit's
 * upstream graph, ask once.
 *
 * Unlike the agent path this one does not degrade: any collaborator failure
 * surfaces as {@link LineageAgentException}, so it uses the raw decision maker
 * rather than the circuit-breaker decorator.
 */
@Service
@Slf4j
public class DirectLineageService {

    static final int CONTEXT_LIMIT = 3;
    static final String NODE_ID_PREFIX = "table_";

    private final EmbeddingService embeddingService;
    private final VectorStore vectorStore;
    private final GraphStore graphStore;
    private final DecisionMaker decisionMaker;
    private final AgentProperties agentProperties;

    public DirectLineageService(EmbeddingService embeddingService,
                                VectorStore vectorStore,
                                GraphStore graphStore,
                                @Qualifier("ollamaDecisionMaker") DecisionMaker decisionMaker,
                                AgentProperties agentProperties) {
        this.embeddingService = embeddingService;
        this.vectorStore = vectorStore;
        this.graphStore = graphStore;
        this.decisionMaker = decisionMaker;
        this.agentProperties = agentProperties;
    }

    public DirectQueryResponse answer(String query, int depth) {
        try {
            float[] embedding = embeddingService.embed(query);
            List<SearchHit> hits = vectorStore.search(embedding, CONTEXT_LIMIT);

            DependencyGraph lineage = hits.isEmpty()
                    ? DependencyGraph.empty("")
                    : graphStore.getDependencies(NODE_ID_PREFIX + hits.get(0).entityName(), depth);

            String answer = decisionMaker.generate(buildPrompt(query, hits, lineage),
                    agentProperties.getTokens().getSynthesis());

            double confidence = hits.isEmpty() ? 0.0 : hits.get(0).similarity();
            log.info("Direct query answered [hits={}, root={}, dependencies={}, confidence={}]",
                    hits.size(), lineage.root(), lineage.dependencies().size(), confidence);

            return DirectQueryResponse.builder()
                    .query(query)
                    .answer(answer != null ? answer.trim() : "")
                    .contextDocs(hits.stream().map(SearchHit::toMap).toList())
                    .lineagePath(lineage.toMap())
                    .confidence(confidence)
                    .build();

        } catch (LineageAgentException e) {
            throw e;
        } catch (Exception e) {
            throw new LineageAgentException("Direct lineage query failed: " + e.getMessage(), e);
        }
    }

    private String buildPrompt(String query, List<SearchHit> hits, DependencyGraph lineage) {
        String context = hits.stream()
                .map(h -> "- " + h.entityName() + ": " + h.text())
                .collect(Collectors.joining("\n"));

        return """
                You are a data lineage expert. Answer the user's question about data dependencies.

                Query: %s

                Related data:
                %s

                Lineage context (what feeds into the target):
                %s

                Based on this information, answer the query concisely:
                """.formatted(query, context, lineage.toMap());
    }
}
