package com.deepansh.lineage.store;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One upstream node reached by a dependency traversal. Depth 0 is a direct feeder.
 */
public record DependencyRecord(String id, String name, String type, int depth) {

    public Map<String, Object> toMap() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("id", id);
        m.put("name", name);
        m.put("type", type);
        m.put("depth", depth);
        return m;
    }
}
