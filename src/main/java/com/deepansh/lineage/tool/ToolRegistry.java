package com.deepansh.lineage.tool;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Central registry for all LineageTool implementations.
 *
 * Spring injects every @Component implementing LineageTool; they are indexed by
 * lower-cased name so lookups are case-insensitive. The registry is built once
 * and only read afterwards, so it is safe to share across concurrent queries.
 */
@Component
@Slf4j
public class ToolRegistry {

    private final Map<String, LineageTool> tools = new ConcurrentHashMap<>();

    public ToolRegistry(List<LineageTool> toolBeans) {
        toolBeans.forEach(tool -> {
            LineageTool previous = tools.put(key(tool.getName()), tool);
            if (previous != null) {
                throw new IllegalStateException("Duplicate tool name: " + tool.getName());
            }
            log.info("Registered tool: [{}] - {}", tool.getName(), tool.getDescription());
        });
        log.info("Total tools registered: {}", tools.size());
    }

    public Optional<LineageTool> find(String name) {
        if (name == null) return Optional.empty();
        return Optional.ofNullable(tools.get(key(name)));
    }

    /** Registered tools, fixed-vocabulary tools first in matching order. */
    public List<LineageTool> getTools() {
        return tools.values().stream()
                .sorted(Comparator.comparingInt(ToolRegistry::vocabularyIndex)
                        .thenComparing(LineageTool::getName))
                .toList();
    }

    private static int vocabularyIndex(LineageTool tool) {
        int idx = ToolNames.ALL.indexOf(tool.getName());
        return idx >= 0 ? idx : Integer.MAX_VALUE;
    }

    private static String key(String name) {
        return name.trim().toLowerCase(Locale.ROOT);
    }
}
