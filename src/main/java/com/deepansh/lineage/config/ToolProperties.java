package com.deepansh.lineage.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Strongly-typed configuration for the tool layer.
 * Bound from application.yml under the "tools" prefix.
 */
@ConfigurationProperties(prefix = "tools")
@Data
public class ToolProperties {

    /** Upper bound for a single tool call, enforced by the dispatcher */
    private long timeoutMs = 10_000;

    /** Depth used by path validation and flow tracing */
    private int traversalDepth = 10;

    private Inputs inputs = new Inputs();

    private Executor executor = new Executor();

    /**
     * Identifiers the Act phase plugs into tool inputs.
     * The agent does not extract entities from the question, so these name the
     * investigation target.
     */
    @Data
    public static class Inputs {
        private String defaultTableId = "dashboard_revenue";
        private String defaultSourceId = "table_orders";
        private String defaultTargetId = "dashboard_revenue";
        private String defaultNodeId = "table_users";
        private String defaultFreshnessTableId = "table_users";
    }

    @Data
    public static class Executor {
        private int corePoolSize = 4;
        private int maxPoolSize = 16;
        private int queueCapacity = 100;
    }
}
