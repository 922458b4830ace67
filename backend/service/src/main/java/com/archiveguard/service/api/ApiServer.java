package com.archiveguard.service.api;

import com.archiveguard.core.model.OperationResult;
import com.archiveguard.core.util.JsonUtils;
import com.archiveguard.service.frequency.FrequencyController;
import com.archiveguard.service.runtime.CollectionScheduler;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * JSON endpoints for the collection controller and scheduler under {@code /api/collection}.
 * Operations that fail answer 400 with the {@link OperationResult} body.
 */
public class ApiServer {
    private static final Logger LOGGER = Logger.getLogger(ApiServer.class.getName());
    private static final String PREFIX = "/api/collection";
    private static final String DEFAULT_ACTOR = "api_user";
    private static final int WORKER_THREADS = 8;

    private final int port;
    private final FrequencyController controller;
    private final CollectionScheduler scheduler;
    private final Map<String, Map<String, HttpHandler>> routes = new LinkedHashMap<>();

    private HttpServer server;
    private ExecutorService executor;

    public ApiServer(int port, FrequencyController controller, CollectionScheduler scheduler) {
        this.port = port;
        this.controller = controller;
        this.scheduler = scheduler;
        registerRoutes();
    }

    public void start() {
        try {
            server = HttpServer.create(new InetSocketAddress(port), 0);
            executor = Executors.newFixedThreadPool(WORKER_THREADS);
            server.setExecutor(executor);
            server.createContext("/api/health", this::handleHealth);
            server.createContext(PREFIX, this::dispatch);
            server.start();
            LOGGER.info("API server listening on port " + actualPort());
        } catch (IOException e) {
            throw new IllegalStateException("Failed starting API server", e);
        }
    }

    public void stop() {
        if (server != null) {
            server.stop(0);
        }
        if (executor != null) {
            executor.shutdown();
        }
    }

    public int actualPort() {
        if (server == null) {
            return port;
        }
        return server.getAddress().getPort();
    }

    private void registerRoutes() {
        route("GET", "/config", exchange -> writeJson(exchange, 200, controller.currentConfig()));
        route("POST", "/config", this::handleUpdateConfig);
        route("POST", "/control", this::handleControl);
        route("POST", "/config/validate", this::handleValidate);
        route("POST", "/config/reset", this::handleReset);
        route("GET", "/config/history", this::handleHistory);
        route("GET", "/config/export", exchange -> writeRaw(exchange, 200, controller.exportConfig()));
        route("POST", "/config/import", this::handleImport);
        route("GET", "/performance", exchange -> writeJson(exchange, 200, controller.performanceMetrics()));
        route("GET", "/status", exchange -> writeJson(exchange, 200, scheduler.status()));
        route("GET", "/status/history", this::handleStatusHistory);
        route("GET", "/statistics", exchange -> writeJson(exchange, 200, scheduler.statistics()));
        route("POST", "/scheduler/start", exchange -> writeResult(exchange, scheduler.startCollection()));
        route("POST", "/scheduler/stop", exchange -> writeResult(exchange, scheduler.stopCollection()));
        route("PUT", "/scheduler/intervals", this::handleIntervals);
        route("POST", "/test/sensor", exchange -> writeResult(exchange, scheduler.forceCollectSensorData()));
        route("POST", "/test/rfid", exchange -> writeResult(exchange, scheduler.forceScanRfidDevices()));
    }

    private void route(String method, String path, HttpHandler handler) {
        routes.computeIfAbsent(path, ignored -> new HashMap<>()).put(method, handler);
    }

    private void dispatch(HttpExchange exchange) throws IOException {
        try {
            String path = exchange.getRequestURI().getPath().substring(PREFIX.length());
            if (path.endsWith("/") && path.length() > 1) {
                path = path.substring(0, path.length() - 1);
            }
            Map<String, HttpHandler> byMethod = routes.get(path);
            if (byMethod == null) {
                writeJson(exchange, 404, Map.of("error", "not_found"));
                return;
            }
            String method = exchange.getRequestMethod().toUpperCase();
            if ("OPTIONS".equals(method)) {
                exchange.getResponseHeaders().set("Access-Control-Allow-Origin", "*");
                exchange.getResponseHeaders().set("Access-Control-Allow-Methods", String.join(",", byMethod.keySet()) + ",OPTIONS");
                exchange.getResponseHeaders().set("Access-Control-Allow-Headers", "Content-Type");
                exchange.sendResponseHeaders(204, -1);
                exchange.close();
                return;
            }
            HttpHandler handler = byMethod.get(method);
            if (handler == null) {
                exchange.sendResponseHeaders(405, -1);
                exchange.close();
                return;
            }
            handler.handle(exchange);
        } catch (RuntimeException e) {
            LOGGER.log(Level.SEVERE, "Unhandled error serving " + exchange.getRequestURI(), e);
            writeJson(exchange, 500, Map.of("error", "internal_error"));
        }
    }

    private void handleHealth(HttpExchange exchange) throws IOException {
        if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
            exchange.sendResponseHeaders(405, -1);
            exchange.close();
            return;
        }
        writeJson(exchange, 200, Map.of("status", "ok", "collectionRunning", scheduler.isRunning()));
    }

    private void handleUpdateConfig(HttpExchange exchange) throws IOException {
        Map<String, Object> body = readJsonBody(exchange);
        if (body == null) {
            return;
        }
        String actor = actorFrom(body);
        body.remove("updatedBy");
        writeResult(exchange, controller.updateConfig(body, actor));
    }

    private void handleControl(HttpExchange exchange) throws IOException {
        Map<String, Object> body = readJsonBody(exchange);
        if (body == null) {
            return;
        }
        String actor = actorFrom(body);
        Object action = body.get("action");
        if ("pause".equals(action)) {
            writeResult(exchange, controller.pauseCollection(actor));
        } else if ("resume".equals(action)) {
            writeResult(exchange, controller.resumeCollection(actor));
        } else {
            writeResult(exchange, OperationResult.failure("action must be pause or resume"));
        }
    }

    private void handleValidate(HttpExchange exchange) throws IOException {
        Map<String, Object> body = readJsonBody(exchange);
        if (body == null) {
            return;
        }
        writeJson(exchange, 200, controller.validateConfig(body));
    }

    private void handleReset(HttpExchange exchange) throws IOException {
        String raw = readBody(exchange);
        String actor = DEFAULT_ACTOR;
        if (!raw.isBlank()) {
            Map<String, Object> body = parseOrReject(exchange, raw);
            if (body == null) {
                return;
            }
            actor = actorFrom(body);
        }
        writeResult(exchange, controller.resetToDefault(actor));
    }

    private void handleHistory(HttpExchange exchange) throws IOException {
        int limit;
        try {
            limit = intParam(queryParams(exchange.getRequestURI()), "limit", 10);
        } catch (NumberFormatException invalidParamError) {
            writeJson(exchange, 400, Map.of("error", "invalid_query_params"));
            return;
        }
        writeJson(exchange, 200, controller.configHistory(limit));
    }

    private void handleImport(HttpExchange exchange) throws IOException {
        String raw = readBody(exchange);
        String actor = queryParams(exchange.getRequestURI()).getOrDefault("updatedBy", DEFAULT_ACTOR);
        writeResult(exchange, controller.importConfig(raw, actor.isBlank() ? DEFAULT_ACTOR : actor));
    }

    private void handleStatusHistory(HttpExchange exchange) throws IOException {
        int hours;
        int limit;
        try {
            Map<String, String> query = queryParams(exchange.getRequestURI());
            hours = intParam(query, "hours", 24);
            limit = intParam(query, "limit", 100);
        } catch (NumberFormatException invalidParamError) {
            writeJson(exchange, 400, Map.of("error", "invalid_query_params"));
            return;
        }
        writeJson(exchange, 200, scheduler.statusHistory(hours, limit));
    }

    private void handleIntervals(HttpExchange exchange) throws IOException {
        Map<String, Object> body = readJsonBody(exchange);
        if (body == null) {
            return;
        }
        writeResult(exchange, scheduler.updateIntervals(body));
    }

    // Writes the 400 itself and returns null when the body is not a JSON object.
    private Map<String, Object> readJsonBody(HttpExchange exchange) throws IOException {
        return parseOrReject(exchange, readBody(exchange));
    }

    private Map<String, Object> parseOrReject(HttpExchange exchange, String raw) throws IOException {
        try {
            return new LinkedHashMap<>(JsonUtils.readObject(raw));
        } catch (JsonProcessingException | IllegalArgumentException e) {
            writeJson(exchange, 400, Map.of("error", "invalid_json"));
            return null;
        }
    }

    private String readBody(HttpExchange exchange) throws IOException {
        try (InputStream in = exchange.getRequestBody()) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    private static String actorFrom(Map<String, Object> body) {
        Object actor = body.get("updatedBy");
        if (actor instanceof String value && !value.isBlank()) {
            return value;
        }
        return DEFAULT_ACTOR;
    }

    private static int intParam(Map<String, String> query, String name, int fallback) {
        String value = query.get(name);
        return value == null || value.isBlank() ? fallback : Integer.parseInt(value.trim());
    }

    private void writeResult(HttpExchange exchange, OperationResult result) throws IOException {
        writeJson(exchange, result.success() ? 200 : 400, result);
    }

    private void writeJson(HttpExchange exchange, int status, Object body) throws IOException {
        writeBytes(exchange, status, JsonUtils.objectMapper().writeValueAsBytes(body));
    }

    private void writeRaw(HttpExchange exchange, int status, String json) throws IOException {
        writeBytes(exchange, status, json.getBytes(StandardCharsets.UTF_8));
    }

    private void writeBytes(HttpExchange exchange, int status, byte[] payload) throws IOException {
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.getResponseHeaders().set("Access-Control-Allow-Origin", "*");
        exchange.sendResponseHeaders(status, payload.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(payload);
        }
    }

    private Map<String, String> queryParams(URI uri) {
        Map<String, String> query = new HashMap<>();
        String raw = uri.getRawQuery();
        if (raw == null || raw.isBlank()) {
            return query;
        }
        for (String entry : raw.split("&")) {
            String[] pair = entry.split("=", 2);
            String key = URLDecoder.decode(pair[0], StandardCharsets.UTF_8);
            String value = pair.length > 1 ? URLDecoder.decode(pair[1], StandardCharsets.UTF_8) : "";
            query.put(key, value);
        }
        return query;
    }
}
