package io.mnemo.mcp.server.model;

import io.mnemo.core.result.StoreError;
import java.util.Map;

public record ToolCallResponse(
    boolean ok,
    String message,
    Map<String, Object> data
) {
    public static ToolCallResponse ok(String message, Map<String, Object> data) {
        return new ToolCallResponse(true, message, data == null ? Map.of() : data);
    }

    public static ToolCallResponse error(String message) {
        return new ToolCallResponse(false, message, Map.of());
    }

    public static ToolCallResponse error(StoreError error) {
        return new ToolCallResponse(false, error.message(), Map.of("errorKind", error.kind().wireName()));
    }
}
