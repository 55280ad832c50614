package net.spookly.tierline.server;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import net.spookly.tierline.call.CallOutcome;
import net.spookly.tierline.call.CallProcessor;
import net.spookly.tierline.config.TierlineConfig;
import net.spookly.tierline.outcome.AnalyticsSnapshot;
import net.spookly.tierline.outcome.CallRecord;
import net.spookly.tierline.routing.HourlyRateLimiter;
import net.spookly.tierline.routing.RoutingDecision;
import net.spookly.tierline.routing.RoutingEngine;
import net.spookly.tierline.routing.ZipDirectory;
import net.spookly.tierline.routing.ZipLoadResult;
import net.spookly.tierline.routing.ZipSource;
import net.spookly.tierline.tier.TierId;

/**
 * HTTP front for call events, analytics and ZIP reloads.
 */
public final class CallEventServer {
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    private static final int DEFAULT_MAX_REQUEST_BYTES = 16 * 1024;
    private static final int DEFAULT_MAX_HISTORY_RESULTS = 500;
    private static final int DEFAULT_HISTORY_LIMIT = 50;
    private static final int DEFAULT_WORKER_THREADS = 8;

    private final CallProcessor processor;
    private final RoutingEngine engine;
    private final ZipSource zipSource;
    private final Clock clock;
    private final int maxRequestBytes;
    private final int maxHistoryResults;
    private final HttpServer server;
    private final ExecutorService executor;

    public CallEventServer(InetSocketAddress address,
                           int workerThreads,
                           int maxRequestBytes,
                           int maxHistoryResults,
                           CallProcessor processor,
                           RoutingEngine engine,
                           ZipSource zipSource,
                           Clock clock) {
        this.processor = Objects.requireNonNull(processor, "processor");
        this.engine = Objects.requireNonNull(engine, "engine");
        this.zipSource = zipSource;
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.maxRequestBytes = maxRequestBytes > 0 ? maxRequestBytes : DEFAULT_MAX_REQUEST_BYTES;
        this.maxHistoryResults = maxHistoryResults > 0 ? maxHistoryResults : DEFAULT_MAX_HISTORY_RESULTS;
        try {
            this.server = HttpServer.create(address, 0);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to bind call event listener", e);
        }
        this.executor = Executors.newFixedThreadPool(workerThreads > 0 ? workerThreads : DEFAULT_WORKER_THREADS);
        this.server.setExecutor(executor);
        this.server.createContext("/", new HealthHandler());
        this.server.createContext("/call-event", new CallEventHandler());
        this.server.createContext("/v1/analytics", new AnalyticsHandler());
        this.server.createContext("/v1/history", new HistoryHandler());
        this.server.createContext("/v1/zips/reload", new ReloadHandler());
    }

    public static CallEventServer fromConfig(TierlineConfig config,
                                             CallProcessor processor,
                                             RoutingEngine engine,
                                             ZipSource zipSource) {
        TierlineConfig.ServerConfig server = config.server;
        return new CallEventServer(
                new InetSocketAddress(server.host, server.port),
                server.workerThreads != null ? server.workerThreads : DEFAULT_WORKER_THREADS,
                server.maxRequestBytes != null ? server.maxRequestBytes : DEFAULT_MAX_REQUEST_BYTES,
                server.maxHistoryResults != null ? server.maxHistoryResults : DEFAULT_MAX_HISTORY_RESULTS,
                processor,
                engine,
                zipSource,
                Clock.systemUTC()
        );
    }

    public void start() {
        server.start();
        System.out.println("Call webhook listening on " + server.getAddress().getHostString() + ":" + port());
    }

    public void stop() {
        server.stop(0);
        executor.shutdownNow();
    }

    /**
     * Bound port, useful when the server was created on port 0.
     */
    public int port() {
        return server.getAddress().getPort();
    }

    private abstract class BaseHandler implements HttpHandler {
        private final String method;

        private BaseHandler(String method) {
            this.method = method;
        }

        @Override
        public final void handle(HttpExchange exchange) throws IOException {
            try {
                if (!method.equalsIgnoreCase(exchange.getRequestMethod())) {
                    writeResponse(exchange, 405, ApiResponse.error("method not allowed"));
                    return;
                }
                byte[] body = readBodyBytes(exchange);
                handleRequest(exchange, body);
            } catch (RequestTooLargeException e) {
                writeResponse(exchange, 413, ApiResponse.error("request too large"));
            } catch (IllegalArgumentException e) {
                writeResponse(exchange, 400, ApiResponse.error(e.getMessage()));
            } catch (Exception e) {
                System.err.println("Request to " + exchange.getRequestURI().getPath() + " failed: " + e);
                writeResponse(exchange, 500, ApiResponse.error("internal error"));
            } finally {
                exchange.close();
            }
        }

        protected abstract void handleRequest(HttpExchange exchange, byte[] body) throws IOException;

        protected byte[] readBodyBytes(HttpExchange exchange) throws IOException {
            try (InputStream input = exchange.getRequestBody()) {
                if (input == null) {
                    return new byte[0];
                }
                ByteArrayOutputStream output = new ByteArrayOutputStream();
                byte[] buffer = new byte[8192];
                int total = 0;
                int read;
                while ((read = input.read(buffer)) != -1) {
                    total += read;
                    if (total > maxRequestBytes) {
                        throw new RequestTooLargeException();
                    }
                    output.write(buffer, 0, read);
                }
                return output.toByteArray();
            }
        }
    }

    private final class HealthHandler extends BaseHandler {
        private HealthHandler() {
            super("GET");
        }

        @Override
        protected void handleRequest(HttpExchange exchange, byte[] body) throws IOException {
            if (!"/".equals(exchange.getRequestURI().getPath())) {
                writeResponse(exchange, 404, ApiResponse.error("not found"));
                return;
            }
            ZipDirectory.Status status = engine.state().zipDirectory().status();
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("zipCount", status.zipCount());
            data.put("lastSuccessfulLoad", status.lastSuccessfulLoad() == null ? null : status.lastSuccessfulLoad().toString());
            data.put("lastLoadError", status.lastResult() == null ? null : status.lastResult().error());
            data.put("zipDataDegraded", status.degraded());
            data.put("businessHoursFailOpen", engine.businessHoursFailOpenCount());
            writeResponse(exchange, 200, ApiResponse.ok("Webhook is running", data));
        }
    }

    private final class CallEventHandler extends BaseHandler {
        private CallEventHandler() {
            super("POST");
        }

        @Override
        protected void handleRequest(HttpExchange exchange, byte[] body) throws IOException {
            CallEventRequest request = readJson(body, CallEventRequest.class);
            CallOutcome outcome = processor.handle(request.callerId, request.zipCode);
            RoutingDecision decision = outcome.decision();
            CallRecord record = outcome.record();
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("record", toView(record));
            if (outcome.bidResult() != null) {
                data.put("bidStatus", outcome.bidResult().httpStatus());
                data.put("bidResponse", outcome.bidResult().body());
            }
            if (decision != null && !decision.routed()) {
                writeResponse(exchange, 200, ApiResponse.ok("ZIP code not in any tier, no ping sent", data));
                return;
            }
            if (outcome.error() != null) {
                data.put("error", outcome.error());
                writeResponse(exchange, 502, ApiResponse.error("bid request failed", data));
                return;
            }
            String message = "ZIP matched " + decision.chosenTier().label().toUpperCase() + " -> Offer " + decision.offerId();
            writeResponse(exchange, 200, ApiResponse.ok(message, data));
        }
    }

    private final class AnalyticsHandler extends BaseHandler {
        private AnalyticsHandler() {
            super("GET");
        }

        @Override
        protected void handleRequest(HttpExchange exchange, byte[] body) throws IOException {
            AnalyticsSnapshot snapshot = engine.state().outcomeRecorder().snapshotAnalytics();
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("total", snapshot.total());
            data.put("success", snapshot.success());
            data.put("failure", snapshot.failure());
            data.put("unrouted", snapshot.unrouted());
            data.put("fallbackCount", snapshot.fallbackCount());
            data.put("successRate", snapshot.successRate());
            data.put("averageResponseTimeMs", snapshot.averageResponseTimeMs());
            data.put("historySize", snapshot.historySize());
            data.put("byStatus", stringKeys(snapshot.byStatus()));
            data.put("byTier", stringKeys(snapshot.byTier()));
            data.put("byHour", stringKeys(snapshot.byHour()));
            data.put("byZip", snapshot.byZip());
            data.put("currentHour", currentHourUsage());
            writeResponse(exchange, 200, ApiResponse.ok("ok", data));
        }
    }

    private final class HistoryHandler extends BaseHandler {
        private HistoryHandler() {
            super("GET");
        }

        @Override
        protected void handleRequest(HttpExchange exchange, byte[] body) throws IOException {
            Map<String, String> params = parseQueryParams(exchange.getRequestURI());
            int limit = parsePositiveInt(params.get("limit"), DEFAULT_HISTORY_LIMIT);
            if (limit > maxHistoryResults) {
                limit = maxHistoryResults;
            }
            List<CallRecord> records = engine.state().outcomeRecorder().recentHistory(limit);
            List<Map<String, Object>> view = new ArrayList<>(records.size());
            for (CallRecord record : records) {
                view.add(toView(record));
            }
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("count", view.size());
            data.put("limit", limit);
            data.put("records", view);
            writeResponse(exchange, 200, ApiResponse.ok("ok", data));
        }
    }

    private final class ReloadHandler extends BaseHandler {
        private ReloadHandler() {
            super("POST");
        }

        @Override
        protected void handleRequest(HttpExchange exchange, byte[] body) throws IOException {
            if (zipSource == null) {
                writeResponse(exchange, 503, ApiResponse.error("no ZIP source configured"));
                return;
            }
            ZipLoadResult result = engine.state().zipDirectory().reload(zipSource);
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("zipCount", result.zipCount());
            data.put("skippedRows", result.skippedRows());
            data.put("conflicts", result.conflicts());
            data.put("attemptedAt", result.attemptedAt().toString());
            if (!result.ok()) {
                data.put("error", result.error());
                writeResponse(exchange, 503, ApiResponse.error("ZIP data unavailable, previous snapshot kept", data));
                return;
            }
            writeResponse(exchange, 200, ApiResponse.ok("reloaded", data));
        }
    }

    private <T> T readJson(byte[] payload, Class<T> type) throws IOException {
        if (payload == null || payload.length == 0) {
            throw new IllegalArgumentException("request body required");
        }
        try {
            T value = MAPPER.readValue(payload, type);
            if (value == null) {
                throw new IllegalArgumentException("request body required");
            }
            return value;
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("invalid json");
        }
    }

    private void writeResponse(HttpExchange exchange, int status, ApiResponse response) throws IOException {
        byte[] payload = MAPPER.writeValueAsBytes(response);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, payload.length);
        try (OutputStream output = exchange.getResponseBody()) {
            output.write(payload);
        }
    }

    private Map<String, Object> currentHourUsage() {
        HourlyRateLimiter limiter = engine.state().rateLimiter();
        Instant now = clock.instant();
        Map<String, Object> usage = new LinkedHashMap<>();
        for (TierId tier : engine.registry().tierIds()) {
            Map<String, Object> item = new LinkedHashMap<>();
            item.put("count", limiter.currentCount(tier, now));
            item.put("cap", limiter.capFor(tier));
            usage.put(tier.label(), item);
        }
        return usage;
    }

    private Map<String, Object> toView(CallRecord record) {
        Map<String, Object> item = new LinkedHashMap<>();
        item.put("timestamp", record.timestamp().toString());
        item.put("callerId", record.callerId());
        item.put("zipCode", record.zipCode());
        item.put("originalTier", record.originalTier() == null ? null : record.originalTier().label());
        item.put("chosenTier", record.chosenTier() == null ? null : record.chosenTier().label());
        item.put("fallbackUsed", record.fallbackUsed());
        item.put("businessHoursOk", record.businessHoursOk());
        item.put("rateLimitOk", record.rateLimitOk());
        item.put("status", record.status().wireName());
        item.put("responseTimeMs", record.responseTimeMs());
        item.put("externalCallId", record.externalCallId());
        return item;
    }

    private <K> Map<String, Long> stringKeys(Map<K, Long> counts) {
        Map<String, Long> view = new LinkedHashMap<>();
        for (Map.Entry<K, Long> entry : counts.entrySet()) {
            view.put(String.valueOf(entry.getKey()), entry.getValue());
        }
        return view;
    }

    private Map<String, String> parseQueryParams(URI uri) {
        String raw = uri.getRawQuery();
        if (raw == null || raw.isEmpty()) {
            return Map.of();
        }
        Map<String, String> params = new HashMap<>();
        for (String pair : raw.split("&")) {
            if (pair.isEmpty()) {
                continue;
            }
            String[] parts = pair.split("=", 2);
            String key = URLDecoder.decode(parts[0], StandardCharsets.UTF_8);
            String value = parts.length > 1 ? URLDecoder.decode(parts[1], StandardCharsets.UTF_8) : "";
            params.put(key, value);
        }
        return params;
    }

    private int parsePositiveInt(String raw, int defaultValue) {
        if (raw == null || raw.isEmpty()) {
            return defaultValue;
        }
        try {
            int value = Integer.parseInt(raw);
            if (value <= 0) {
                throw new IllegalArgumentException("limit must be greater than 0");
            }
            return value;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("limit must be an integer");
        }
    }

    private static final class RequestTooLargeException extends RuntimeException {
        private RequestTooLargeException() {
            super("request too large");
        }
    }
}
