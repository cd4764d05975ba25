package com.deepansh.lineage.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Orchestration loop settings, bound from the "agent" prefix.
 */
@ConfigurationProperties(prefix = "agent")
@Data
public class AgentProperties {

    private int defaultMaxSteps = 8;
    private int defaultMaxTools = 3;

    /**
     * Hard ceiling on phase transitions per query. Only a broken stopping rule
     * can reach it; runs whose step budget could exceed it are rejected up front.
     */
    private int maxTransitions = 40;

    /** Entity vocabulary the synthesized answer may reference */
    private List<String> knownEntities = new ArrayList<>(List.of(
            "users", "orders", "order_clean", "revenue_daily", "revenue_dashboard"));

    private Tokens tokens = new Tokens();

    @Data
    public static class Tokens {
        private int plan = 300;
        private int toolChoice = 50;
        private int synthesis = 500;
    }
}
