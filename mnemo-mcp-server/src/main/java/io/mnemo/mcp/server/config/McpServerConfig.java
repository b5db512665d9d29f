package io.mnemo.mcp.server.config;

public record McpServerConfig(
    String host,
    int port
) {
    public static McpServerConfig fromEnv() {
        return new McpServerConfig(
            env("MNEMO_MCP_HOST", "0.0.0.0"),
            intEnv("MNEMO_MCP_PORT", 8791)
        );
    }

    public McpServerConfig withPort(int updated) {
        return new McpServerConfig(host, updated);
    }

    private static String env(String key, String fallback) {
        String value = System.getenv(key);
        return value == null || value.isBlank() ? fallback : value;
    }

    private static int intEnv(String key, int fallback) {
        String value = System.getenv(key);
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return fallback;
        }
    }
}
