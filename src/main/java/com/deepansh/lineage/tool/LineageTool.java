package com.deepansh.lineage.tool;

import java.util.Map;

/**
 * Contract every registry tool must implement.
 *
 * Tools are read-only queries against a backing store. Collaborator failures
 * should be caught inside the tool and returned as {@link ToolResult#failure};
 * {@link ToolDispatcher} still guards against anything that escapes.
 */
public interface LineageTool {

    /** Unique snake_case name the decision maker uses to pick this tool */
    String getName();

    /** One-line description shown in the planning prompt */
    String getDescription();

    ToolResult invoke(Map<String, Object> input);
}
