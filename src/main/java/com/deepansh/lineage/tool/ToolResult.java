package com.deepansh.lineage.tool;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.EqualsAndHashCode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Structured outcome of a single tool call.
 *
 * Always carries {@code success}; every other field is tool-specific and opaque
 * to the dispatcher. Serializes as a flat JSON object.
 */
@EqualsAndHashCode
public final class ToolResult {

    public static final String SUCCESS = "success";
    public static final String ERROR = "error";

    private final Map<String, Object> fields;

    private ToolResult(Map<String, Object> fields) {
        this.fields = Collections.unmodifiableMap(fields);
    }

    public static ToolResult success(Map<String, Object> payload) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put(SUCCESS, true);
        payload.forEach((k, v) -> {
            if (!SUCCESS.equals(k)) fields.put(k, v);
        });
        return new ToolResult(fields);
    }

    public static ToolResult failure(String error) {
        return failure(error, Map.of());
    }

    /** Failure with extra tool-specific fields (e.g. empty {@code items}). */
    public static ToolResult failure(String error, Map<String, Object> extra) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put(SUCCESS, false);
        fields.put(ERROR, error);
        extra.forEach((k, v) -> {
            if (!SUCCESS.equals(k) && !ERROR.equals(k)) fields.put(k, v);
        });
        return new ToolResult(fields);
    }

    public boolean isSuccess() {
        return Boolean.TRUE.equals(fields.get(SUCCESS));
    }

    public String getError() {
        Object error = fields.get(ERROR);
        return error != null ? error.toString() : null;
    }

    public Object get(String key) {
        return fields.get(key);
    }

    @SuppressWarnings("unchecked")
    public List<Map<String, Object>> getList(String key) {
        Object value = fields.get(key);
        return value instanceof List<?> list ? (List<Map<String, Object>>) list : List.of();
    }

    @JsonValue
    public Map<String, Object> asMap() {
        return fields;
    }

    @Override
    public String toString() {
        return fields.toString();
    }
}
