package com.deepansh.lineage.tool;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Scriptable tool for loop and dispatcher tests. Records every input it receives.
 */
public class FakeTool implements LineageTool {

    private final String name;
    private final Function<Map<String, Object>, ToolResult> behaviour;
    private final List<Map<String, Object>> inputs = Collections.synchronizedList(new ArrayList<>());

    public FakeTool(String name, Function<Map<String, Object>, ToolResult> behaviour) {
        this.name = name;
        this.behaviour = behaviour;
    }

    public static FakeTool succeeding(String name) {
        return new FakeTool(name, in -> ToolResult.success(Map.of(
                "items", List.of(Map.of("entity_name", "orders", "similarity", 0.9)),
                "count", 1)));
    }

    public static FakeTool failing(String name) {
        return new FakeTool(name, in -> ToolResult.failure(name + " backend down"));
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public String getDescription() {
        return "fake " + name;
    }

    @Override
    public ToolResult invoke(Map<String, Object> input) {
        inputs.add(input);
        return behaviour.apply(input);
    }

    public int invocationCount() {
        return inputs.size();
    }

    public List<Map<String, Object>> getInputs() {
        return inputs;
    }
}
