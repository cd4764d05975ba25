package com.deepansh.lineage.store;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of an upstream traversal from {@code root}, ordered by depth.
 */
public record DependencyGraph(String root, List<DependencyRecord> dependencies) {

    public static DependencyGraph empty(String root) {
        return new DependencyGraph(root, List.of());
    }

    public List<String> dependencyIds() {
        return dependencies.stream().map(DependencyRecord::id).toList();
    }

    public List<String> dependencyNames() {
        return dependencies.stream().map(DependencyRecord::name).toList();
    }

    public Map<String, Object> toMap() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("root", root);
        m.put("dependencies", dependencies.stream().map(DependencyRecord::toMap).toList());
        return m;
    }
}
