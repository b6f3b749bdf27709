package io.tabletalk.core.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.tabletalk.core.dataset.DatasetCache;
import io.tabletalk.core.model.Exchange;
import io.tabletalk.core.observability.ObservabilityService;
import io.tabletalk.core.query.QueryExecutor;
import io.tabletalk.core.session.UnknownSessionException;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.UndertowOptions;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.server.RoutingHandler;
import io.undertow.server.handlers.BlockingHandler;
import io.undertow.server.handlers.ExceptionHandler;
import io.undertow.util.Headers;
import io.undertow.util.PathTemplateMatch;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.ByteBuffer;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP front of the query engine. Every handler runs on an Undertow worker thread in blocking mode.
 *
 * <pre>
 * GET  /healthz
 * GET  /stats
 * GET  /sessions/{id}/exchanges
 * POST /sessions/{id}/queries   {"prompt": "..."}
 * </pre>
 *
 * An analysis that fails upstream is still a 200 carrying an {@code ERROR} exchange; 4xx codes are
 * reserved for requests the engine refused to accept.
 */
public final class GatewayServer implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(GatewayServer.class);
    public static final Duration IDLE_TIMEOUT = Duration.ofSeconds(120);

    private final ObjectMapper mapper;
    private final String host;
    private final int requestedPort;
    private final QueryExecutor queryExecutor;
    private final DatasetCache datasetCache;
    private final ObservabilityService observabilityService;
    private Undertow server;
    private int boundPort;

    public GatewayServer(int port, String host, QueryExecutor queryExecutor) {
        this(port, host, queryExecutor, null, null);
    }

    public GatewayServer(
        int port,
        String host,
        QueryExecutor queryExecutor,
        DatasetCache datasetCache,
        ObservabilityService observabilityService
    ) {
        this.requestedPort = port;
        this.host = host == null || host.isBlank() ? "0.0.0.0" : host;
        this.queryExecutor = Objects.requireNonNull(queryExecutor, "queryExecutor must not be null");
        this.datasetCache = datasetCache;
        this.observabilityService = observabilityService;
        this.mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public synchronized void start() {
        if (server != null) {
            return;
        }
        RoutingHandler routes = Handlers.routing()
            .get("/healthz", exchange -> sendJson(exchange, 200, Map.of("status", "ok")))
            .get("/stats", this::handleStats)
            .get("/sessions/{id}/exchanges", this::handleHistory)
            .post("/sessions/{id}/queries", this::handleQuery)
            .setInvalidMethodHandler(exchange -> sendError(exchange, 405, "method_not_allowed"))
            .setFallbackHandler(exchange -> sendError(exchange, 404, "not_found"));

        HttpHandler guarded = Handlers.exceptionHandler(routes)
            .addExceptionHandler(Throwable.class, this::handleUnexpected);

        server = Undertow.builder()
            .addHttpListener(requestedPort, host)
            .setServerOption(UndertowOptions.IDLE_TIMEOUT, (int) IDLE_TIMEOUT.toMillis())
            .setServerOption(UndertowOptions.NO_REQUEST_TIMEOUT, (int) IDLE_TIMEOUT.toMillis())
            .setHandler(new BlockingHandler(guarded))
            .build();
        server.start();
        boundPort = boundPort(server, requestedPort);
        LOG.info("Gateway listening on {}:{}", host, boundPort);
    }

    public int port() {
        return boundPort;
    }

    @Override
    public synchronized void close() {
        if (server != null) {
            server.stop();
            server = null;
            LOG.info("Gateway on port {} stopped", boundPort);
        }
    }

    private void handleHistory(HttpServerExchange exchange) throws IOException {
        String sessionId = sessionId(exchange);
        List<Exchange> history;
        try {
            history = queryExecutor.getHistory(sessionId);
        } catch (UnknownSessionException e) {
            sendError(exchange, 404, "unknown_session");
            return;
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("sessionId", sessionId);
        payload.put("exchanges", history);
        sendJson(exchange, 200, payload);
    }

    private void handleQuery(HttpServerExchange exchange) throws IOException {
        String sessionId = sessionId(exchange);
        String prompt;
        try {
            prompt = promptOf(exchange.getInputStream().readAllBytes());
        } catch (JsonProcessingException e) {
            sendError(exchange, 400, "invalid_json");
            return;
        }
        try {
            sendJson(exchange, 200, queryExecutor.submitQuery(sessionId, prompt));
        } catch (UnknownSessionException e) {
            sendError(exchange, 404, "unknown_session");
        } catch (IllegalArgumentException e) {
            sendError(exchange, 400, e.getMessage());
        }
    }

    private void handleStats(HttpServerExchange exchange) throws IOException {
        Map<String, Object> payload = new LinkedHashMap<>();
        if (observabilityService != null) {
            payload.put("queries", observabilityService.summary());
        }
        if (datasetCache != null) {
            payload.put("cache", datasetCache.stats());
        }
        sendJson(exchange, 200, payload);
    }

    private void handleUnexpected(HttpServerExchange exchange) throws IOException {
        Throwable error = exchange.getAttachment(ExceptionHandler.THROWABLE);
        LOG.error("Request {} {} failed", exchange.getRequestMethod(), exchange.getRequestPath(), error);
        if (!exchange.isResponseStarted()) {
            sendError(exchange, 500, "internal_error");
        }
    }

    private String promptOf(byte[] body) throws IOException {
        if (body.length == 0) {
            return "";
        }
        JsonNode node = mapper.readTree(body);
        return node == null ? "" : node.path("prompt").asText("");
    }

    private static String sessionId(HttpServerExchange exchange) {
        return exchange.getAttachment(PathTemplateMatch.ATTACHMENT_KEY).getParameters().get("id");
    }

    private void sendError(HttpServerExchange exchange, int status, String error) throws IOException {
        sendJson(exchange, status, Map.of("error", error));
    }

    private void sendJson(HttpServerExchange exchange, int status, Object payload) throws IOException {
        byte[] body = mapper.writeValueAsBytes(payload);
        exchange.setStatusCode(status);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json; charset=utf-8");
        exchange.getResponseHeaders().put(Headers.CONTENT_LENGTH, String.valueOf(body.length));
        exchange.getResponseSender().send(ByteBuffer.wrap(body));
    }

    private static int boundPort(Undertow undertow, int fallback) {
        for (Undertow.ListenerInfo listener : undertow.getListenerInfo()) {
            if (listener.getAddress() instanceof InetSocketAddress address) {
                return address.getPort();
            }
        }
        return fallback;
    }
}
