package com.deepansh.lineage.core;

import com.deepansh.lineage.config.AgentProperties;
import com.deepansh.lineage.tool.LineageTool;
import com.deepansh.lineage.tool.ToolRegistry;
import com.deepansh.lineage.tool.ToolResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Prompt texts for the three decision-maker calls of a query.
 *
 * The synthesis prompt fixes the answer layout (Lineage / Tables / Path) and
 * restricts table names to {@code agent.known-entities}.
 */
@Component
@Slf4j
public class LineagePrompts {

    private final ToolRegistry toolRegistry;
    private final AgentProperties agentProperties;
    private final ObjectMapper objectMapper;

    public LineagePrompts(ToolRegistry toolRegistry, AgentProperties agentProperties, ObjectMapper objectMapper) {
        this.toolRegistry = toolRegistry;
        this.agentProperties = agentProperties;
        this.objectMapper = objectMapper;
    }

    public String plan(String query) {
        List<LineageTool> tools = toolRegistry.getTools();
        String toolList = IntStream.range(0, tools.size())
                .mapToObj(i -> (i + 1) + ". " + tools.get(i).getName() + " - " + tools.get(i).getDescription())
                .collect(Collectors.joining("\n"));

        return """
                You are a data lineage investigator. A user is asking:

                "%s"

                Your job is to plan which tools you'll use to answer this question.

                Available tools:
                %s

                Create a concise investigation plan (2-3 steps):

                PLAN:
                """.formatted(query, toolList);
    }

    public String toolChoice(String plan, String query) {
        return """
                Given the investigation plan:
                %s

                And the original query: "%s"

                Which tool should we call FIRST to make progress?

                Respond with ONLY the tool name, like:
                search_vector_db
                """.formatted(plan != null ? plan : "", query);
    }

    public String synthesis(String query, Map<String, ToolResult> toolResults) {
        String knownEntities = String.join(", ", agentProperties.getKnownEntities());

        return """
                You are a data lineage assistant.

                You MUST:
                1. Answer the question in a short sentence.
                2. Then explicitly list ALL relevant table names taken from this set:
                   %s
                3. When describing a path, use the format:
                   orders -> order_clean -> revenue_daily -> revenue_dashboard

                Question:
                %s

                Tool results (JSON):
                %s

                Answer using this template:

                Lineage:
                <one sentence answer>

                Tables:
                <comma-separated list of table names>

                Path:
                <optional arrow-separated path if applicable>

                ANSWER:
                """.formatted(knownEntities, query, toJson(toolResults));
    }

    private String toJson(Map<String, ToolResult> toolResults) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(toolResults);
        } catch (JsonProcessingException e) {
            log.warn("Could not serialize tool results, using toString: {}", e.getMessage());
            return toolResults.toString();
        }
    }
}
