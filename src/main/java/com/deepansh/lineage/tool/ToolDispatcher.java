package com.deepansh.lineage.tool;

import com.deepansh.lineage.config.ToolProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Resolves a tool name, invokes the tool and normalizes every failure into a
 * {@link ToolResult}. Never throws: unknown tools, tool exceptions and timeouts
 * all come back as {@code success=false} so the agent loop keeps going.
 *
 * Each call runs on the tool executor so a hanging store query is bounded by
 * {@code tools.timeout-ms}.
 */
@Component
@Slf4j
public class ToolDispatcher {

    private final ToolRegistry toolRegistry;
    private final AsyncTaskExecutor toolTaskExecutor;
    private final ToolProperties toolProperties;

    public ToolDispatcher(ToolRegistry toolRegistry,
                          @Qualifier("toolTaskExecutor") AsyncTaskExecutor toolTaskExecutor,
                          ToolProperties toolProperties) {
        this.toolRegistry = toolRegistry;
        this.toolTaskExecutor = toolTaskExecutor;
        this.toolProperties = toolProperties;
    }

    public ToolResult execute(String toolName, Map<String, Object> input) {
        Optional<LineageTool> tool = toolRegistry.find(toolName);

        if (tool.isEmpty()) {
            log.warn("Unknown tool requested: [{}]", toolName);
            return ToolResult.failure("Tool not found: " + toolName);
        }

        log.info("Executing tool: [{}] with input: {}", toolName, input);
        long timeoutMs = toolProperties.getTimeoutMs();
        Future<ToolResult> future = null;

        try {
            future = toolTaskExecutor.submit(() -> tool.get().invoke(input));
            ToolResult result = future.get(timeoutMs, TimeUnit.MILLISECONDS);
            if (result == null) {
                return ToolResult.failure("Tool returned no result: " + toolName);
            }
            log.debug("Tool [{}] returned: {}", toolName, result);
            return result;

        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Tool [{}] timed out after {}ms", toolName, timeoutMs);
            return ToolResult.failure("Tool timed out after " + timeoutMs + "ms: " + toolName);

        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("Tool [{}] failed", toolName, cause);
            return ToolResult.failure(messageOf(cause));

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            if (future != null) future.cancel(true);
            log.warn("Interrupted while waiting for tool [{}]", toolName);
            return ToolResult.failure("Interrupted while executing " + toolName);

        } catch (RuntimeException e) {
            // submit() rejected by a saturated pool
            log.error("Could not schedule tool [{}]", toolName, e);
            return ToolResult.failure(messageOf(e));
        }
    }

    private static String messageOf(Throwable t) {
        return t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();
    }
}
