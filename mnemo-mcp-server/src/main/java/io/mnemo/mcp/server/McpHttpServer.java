package io.mnemo.mcp.server;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.mnemo.core.graph.KnowledgeGraphStore;
import io.mnemo.core.observability.HealthReport;
import io.mnemo.mcp.server.model.ToolCallResponse;
import io.undertow.Undertow;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.server.handlers.BlockingHandler;
import io.undertow.util.Headers;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JSON over HTTP front end. Handlers run on worker threads because every route may block on
 * the storage pool.
 */
public final class McpHttpServer {
    private static final Logger LOG = LoggerFactory.getLogger(McpHttpServer.class);

    private final Undertow undertow;

    public McpHttpServer(String host, int port, ToolRouter router, KnowledgeGraphStore store, ObjectMapper mapper) {
        HttpHandler handler = exchange -> route(exchange, router, store, mapper);
        this.undertow = Undertow.builder()
            .addHttpListener(port, host)
            .setHandler(new BlockingHandler(handler))
            .build();
    }

    public void start() {
        undertow.start();
    }

    public void stop() {
        undertow.stop();
    }

    public int port() {
        return ((InetSocketAddress) undertow.getListenerInfo().get(0).getAddress()).getPort();
    }

    private void route(HttpServerExchange exchange, ToolRouter router, KnowledgeGraphStore store, ObjectMapper mapper) throws Exception {
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json");
        boolean get = exchange.getRequestMethod().equalToString("GET");
        boolean post = exchange.getRequestMethod().equalToString("POST");
        String path = exchange.getRequestPath();

        if (get && path.equals("/healthz")) {
            HealthReport report = store.health();
            exchange.setStatusCode("ok".equals(report.status()) ? 200 : 503);
            writeJson(exchange, mapper, report);
            return;
        }

        if (get && path.equals("/metrics")) {
            writeJson(exchange, mapper, store.metrics());
            return;
        }

        if (get && path.equals("/mcp/tools")) {
            writeJson(exchange, mapper, Map.of("tools", router.listTools()));
            return;
        }

        if (post && path.equals("/mcp/call")) {
            Map<String, Object> request;
            try {
                request = mapper.readValue(exchange.getInputStream(), new TypeReference<>() {});
            } catch (JsonProcessingException e) {
                LOG.debug("Rejected malformed tool call: {}", e.getOriginalMessage());
                exchange.setStatusCode(400);
                writeJson(exchange, mapper, ToolCallResponse.error("Malformed JSON request"));
                return;
            }
            String name = String.valueOf(request.getOrDefault("name", ""));
            @SuppressWarnings("unchecked")
            Map<String, Object> args = request.get("arguments") instanceof Map<?, ?> m ? (Map<String, Object>) m : Map.of();
            ToolCallResponse response = router.callTool(name, args);
            exchange.setStatusCode(response.ok() ? 200 : 400);
            writeJson(exchange, mapper, response);
            return;
        }

        exchange.setStatusCode(404);
        writeJson(exchange, mapper, Map.of("error", "Not found"));
    }

    private void writeJson(HttpServerExchange exchange, ObjectMapper mapper, Object payload) throws IOException {
        exchange.getResponseSender().send(mapper.writeValueAsString(payload));
    }
}
