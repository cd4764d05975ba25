package com.deepansh.lineage.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.sql.Array;
import java.sql.SQLException;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Semantic search over lineage descriptions.
 *
 * Loads every stored vector and scores it by cosine similarity in-process.
 * Fine for catalog scale (hundreds of tables); swap for an indexed vector
 * search if the catalog grows past that.
 */
@Repository
@Slf4j
public class VectorStore {

    private static final String CANDIDATES_SQL = """
            SELECT e.id, e.text, e.table_name, e.source_type, v.embedding
            FROM vectors v
            JOIN embeddings e ON v.id = e.id
            """;

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    public VectorStore(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
    }

    public List<SearchHit> search(float[] queryEmbedding, int limit) {
        List<Map<String, Object>> rows = jdbcTemplate.queryForList(CANDIDATES_SQL);

        List<SearchHit> hits = rows.stream()
                .map(r -> score(r, queryEmbedding))
                .filter(Objects::nonNull)
                .sorted(Comparator.comparingDouble(SearchHit::similarity).reversed())
                .limit(Math.max(limit, 0))
                .toList();

        log.debug("Vector search scored {} candidates, returning {}", rows.size(), hits.size());
        return hits;
    }

    private SearchHit score(Map<String, Object> row, float[] query) {
        double[] stored = decode(row.get("embedding"));
        if (stored == null || stored.length != query.length) {
            return null;
        }
        return new SearchHit(
                (String) row.get("id"),
                (String) row.get("table_name"),
                (String) row.get("text"),
                (String) row.get("source_type"),
                cosineSimilarity(query, stored));
    }

    static double cosineSimilarity(float[] a, double[] b) {
        double dot = 0, normA = 0, normB = 0;
        for (int i = 0; i < a.length; i++) {
            dot   += a[i] * b[i];
            normA += a[i] * a[i];
            normB += b[i] * b[i];
        }
        if (normA == 0 || normB == 0) {
            return 0.0;
        }
        // opposed vectors count as unrelated, similarity stays in [0, 1]
        return Math.max(0.0, dot / (Math.sqrt(normA) * Math.sqrt(normB)));
    }

    /**
     * Stored vectors come back as a DOUBLE PRECISION[] (java.sql.Array), or as
     * JSON text when the column was written by an older loader.
     */
    private double[] decode(Object raw) {
        try {
            if (raw instanceof Array sqlArray) {
                raw = sqlArray.getArray();
            }
            if (raw instanceof double[] doubles) {
                return doubles;
            }
            if (raw instanceof Object[] boxed) {
                double[] out = new double[boxed.length];
                for (int i = 0; i < boxed.length; i++) out[i] = ((Number) boxed[i]).doubleValue();
                return out;
            }
            if (raw instanceof List<?> list) {
                double[] out = new double[list.size()];
                for (int i = 0; i < list.size(); i++) out[i] = ((Number) list.get(i)).doubleValue();
                return out;
            }
            if (raw instanceof String json && !json.isBlank()) {
                return objectMapper.readValue(json, double[].class);
            }
        } catch (SQLException | IOException | ClassCastException e) {
            log.warn("Skipping undecodable embedding: {}", e.getMessage());
        }
        return null;
    }
}
