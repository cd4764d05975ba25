package com.deepansh.lineage.store;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only access to the lineage graph stored in PostgreSQL.
 *
 * Tables: nodes(id, name, node_type, description, metadata jsonb, created_at)
 * and edges(source_id, target_id, edge_type). An edge source -> target means
 * "source feeds into target", so upstream traversal follows edges backwards.
 */
@Repository
@Slf4j
public class GraphStore {

    // The first hop only follows FEEDS_INTO; deeper hops follow any edge, as the
    // loader only ever writes FEEDS_INTO edges.
    private static final String UPSTREAM_SQL = """
            WITH RECURSIVE upstream AS (
                SELECT source_id AS id, 0 AS depth
                FROM edges
                WHERE target_id = ? AND edge_type = 'FEEDS_INTO'

                UNION ALL

                SELECT e.source_id, u.depth + 1
                FROM edges e
                JOIN upstream u ON e.target_id = u.id
                WHERE u.depth < ?
            )
            SELECT DISTINCT n.id, n.name, n.node_type, u.depth
            FROM upstream u
            JOIN nodes n ON u.id = n.id
            ORDER BY u.depth
            """;

    private static final String NODE_SQL =
            "SELECT id, name, node_type, description, metadata, created_at FROM nodes WHERE id = ?";

    private static final String CREATED_AT_SQL = "SELECT created_at FROM nodes WHERE id = ?";

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    public GraphStore(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
    }

    /**
     * All upstream nodes of {@code nodeId}, up to {@code depth} hops past the direct feeders.
     */
    public DependencyGraph getDependencies(String nodeId, int depth) {
        List<Map<String, Object>> rows = jdbcTemplate.queryForList(UPSTREAM_SQL, nodeId, depth);

        List<DependencyRecord> deps = rows.stream()
                .map(r -> new DependencyRecord(
                        asString(r.get("id")),
                        asString(r.get("name")),
                        asString(r.get("node_type")),
                        ((Number) r.get("depth")).intValue()))
                .toList();

        log.debug("Upstream of [{}] to depth {}: {} nodes", nodeId, depth, deps.size());
        return new DependencyGraph(nodeId, deps);
    }

    public Optional<LineageNode> findNode(String nodeId) {
        List<Map<String, Object>> rows = jdbcTemplate.queryForList(NODE_SQL, nodeId);
        if (rows.isEmpty()) {
            return Optional.empty();
        }
        Map<String, Object> r = rows.get(0);
        return Optional.of(new LineageNode(
                asString(r.get("id")),
                asString(r.get("name")),
                asString(r.get("node_type")),
                r.get("description") != null ? r.get("description").toString() : "",
                parseMetadata(r.get("metadata")),
                toInstant(r.get("created_at"))));
    }

    public Optional<Instant> findCreatedAt(String nodeId) {
        List<Map<String, Object>> rows = jdbcTemplate.queryForList(CREATED_AT_SQL, nodeId);
        if (rows.isEmpty()) {
            return Optional.empty();
        }
        return Optional.ofNullable(toInstant(rows.get(0).get("created_at")));
    }

    private Map<String, Object> parseMetadata(Object raw) {
        // jsonb arrives as PGobject; its toString() is the JSON text
        if (raw == null) return Map.of();
        String json = raw.toString();
        if (json.isBlank()) return Map.of();
        try {
            return objectMapper.readValue(json, new TypeReference<>() {});
        } catch (Exception e) {
            log.warn("Unparseable node metadata, ignoring: {}", e.getMessage());
            return Map.of();
        }
    }

    private static Instant toInstant(Object raw) {
        if (raw instanceof Timestamp ts) return ts.toInstant();
        if (raw instanceof Instant instant) return instant;
        return null;
    }

    private static String asString(Object raw) {
        return raw != null ? raw.toString() : null;
    }
}
