package com.deepansh.lineage.core;

import com.deepansh.lineage.tool.ToolNames;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Maps the decision maker's free-text tool choice onto the fixed tool vocabulary.
 *
 * Matching is case-insensitive substring containment in either direction,
 * tried in {@link ToolNames#ALL} order; first match wins. Anything unmatched,
 * including blank text, falls back to {@link ToolNames#DEFAULT_TOOL}.
 */
@Component
public class ToolSelector {

    public String select(String rawChoice) {
        if (rawChoice == null || rawChoice.isBlank()) {
            return ToolNames.DEFAULT_TOOL;
        }
        String choice = rawChoice.trim().toLowerCase(Locale.ROOT);

        for (String tool : ToolNames.ALL) {
            if (choice.contains(tool) || tool.contains(choice)) {
                return tool;
            }
        }
        return ToolNames.DEFAULT_TOOL;
    }
}
