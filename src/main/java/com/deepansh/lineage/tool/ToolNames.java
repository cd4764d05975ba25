package com.deepansh.lineage.tool;

import java.util.List;

/**
 * The fixed tool vocabulary. {@link #ALL} order is the matching order used
 * when resolving a decision-maker answer to a tool name.
 */
public final class ToolNames {

    public static final String SEARCH_VECTOR_DB = "search_vector_db";
    public static final String GET_TABLE_DEPENDENCIES = "get_table_dependencies";
    public static final String VALIDATE_LINEAGE_PATH = "validate_lineage_path";
    public static final String GET_NODE_METADATA = "get_node_metadata";
    public static final String TRACE_DATA_FLOW = "trace_data_flow";
    public static final String CHECK_DATA_FRESHNESS = "check_data_freshness";

    public static final String DEFAULT_TOOL = SEARCH_VECTOR_DB;

    public static final List<String> ALL = List.of(
            SEARCH_VECTOR_DB,
            GET_TABLE_DEPENDENCIES,
            VALIDATE_LINEAGE_PATH,
            GET_NODE_METADATA,
            TRACE_DATA_FLOW,
            CHECK_DATA_FRESHNESS
    );

    private ToolNames() {
    }
}
