package com.deepansh.lineage.api;

import com.deepansh.lineage.config.AgentProperties;
import com.deepansh.lineage.core.LineageAgentLoop;
import com.deepansh.lineage.model.DirectQueryRequest;
import com.deepansh.lineage.model.DirectQueryResponse;
import com.deepansh.lineage.model.FinalResult;
import com.deepansh.lineage.model.LineageQueryRequest;
import com.deepansh.lineage.service.DirectLineageService;
import com.deepansh.lineage.tool.ToolRegistry;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Lineage question endpoints.
 *
 * POST /api/v1/lineage/query   agent loop (plan, tools, synthesis)
 * POST /api/v1/lineage/direct  single retrieval + one generation call
 * GET  /api/v1/lineage/tools
 * GET  /api/v1/lineage/health
 */
@RestController
@RequestMapping("/api/v1/lineage")
@RequiredArgsConstructor
@Slf4j
public class LineageController {

    private final LineageAgentLoop agentLoop;
    private final DirectLineageService directLineageService;
    private final ToolRegistry toolRegistry;
    private final AgentProperties agentProperties;

    @PostMapping("/query")
    public ResponseEntity<FinalResult> query(@Valid @RequestBody LineageQueryRequest request) {
        int maxSteps = request.getMaxSteps() != null ? request.getMaxSteps() : agentProperties.getDefaultMaxSteps();
        int maxTools = request.getMaxTools() != null ? request.getMaxTools() : agentProperties.getDefaultMaxTools();

        log.info("Lineage query request [query='{}', maxSteps={}, maxTools={}]",
                request.getQuery(), maxSteps, maxTools);

        return ResponseEntity.ok(agentLoop.run(request.getQuery(), maxSteps, maxTools));
    }

    @PostMapping("/direct")
    public ResponseEntity<DirectQueryResponse> direct(@Valid @RequestBody DirectQueryRequest request) {
        log.info("Direct lineage request [query='{}', depth={}]", request.getQuery(), request.getDepth());
        return ResponseEntity.ok(directLineageService.answer(request.getQuery(), request.getDepth()));
    }

    @GetMapping("/tools")
    public ResponseEntity<List<Map<String, String>>> tools() {
        List<Map<String, String>> tools = toolRegistry.getTools().stream()
                .map(t -> {
                    Map<String, String> entry = new LinkedHashMap<>();
                    entry.put("name", t.getName());
                    entry.put("description", t.getDescription());
                    return entry;
                })
                .toList();
        return ResponseEntity.ok(tools);
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, String>> health() {
        return ResponseEntity.ok(Map.of("status", "UP"));
    }
}
