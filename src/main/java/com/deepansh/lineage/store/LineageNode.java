package com.deepansh.lineage.store;

import java.time.Instant;
import java.util.Map;

/**
 * A table, dashboard or metric in the lineage graph.
 */
public record LineageNode(String id,
                          String name,
                          String type,
                          String description,
                          Map<String, Object> metadata,
                          Instant createdAt) {
}
