package com.deepansh.lineage.store;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A semantic search match; similarity is the cosine score in [0,1] for
 * non-negative embeddings.
 */
public record SearchHit(String id, String entityName, String text, String sourceType, double similarity) {

    public Map<String, Object> toMap() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("id", id);
        m.put("entity_name", entityName);
        m.put("text", text);
        m.put("source_type", sourceType);
        m.put("similarity", similarity);
        return m;
    }
}
