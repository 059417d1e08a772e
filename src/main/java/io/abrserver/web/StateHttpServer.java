package io.abrserver.web;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import io.abrserver.asset.AssetPipeline;
import io.abrserver.model.NotificationTarget;
import io.abrserver.model.StatePath;
import io.abrserver.runtime.AbrServerRuntime;
import io.abrserver.state.EmptyHistoryException;
import io.abrserver.state.SchemaValidationException;
import io.abrserver.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

public final class StateHttpServer implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(StateHttpServer.class);
    static final long KEEP_ALIVE_SECONDS = 15L;

    private final AbrServerRuntime runtime;
    private final HttpServer server;
    private final ExecutorService executor;

    public StateHttpServer(AbrServerRuntime runtime, InetSocketAddress address) throws IOException {
        this.runtime = runtime;
        this.server = HttpServer.create(address, 0);
        AtomicInteger threadSeq = new AtomicInteger();
        // Event streams hold their thread for the whole connection.
        this.executor = Executors.newCachedThreadPool(runnable -> {
            Thread t = new Thread(runnable, "abr-http-" + threadSeq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        registerRoutes();
        server.setExecutor(executor);
    }

    public void start() {
        server.start();
        LOG.info("State server listening on port {}", port());
    }

    public int port() {
        return server.getAddress().getPort();
    }

    @Override
    public void close() {
        server.stop(0);
        executor.shutdownNow();
    }

    private void registerRoutes() {
        route("/api/state", exchange -> {
            if (!allowMethods(exchange, "GET", "PUT")) return;
            StatePath path = StatePathParser.parse("/api/state", exchange.getRequestURI().getPath());
            if ("GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                ObjectNode body = Jsons.mapper().createObjectNode();
                body.set("state", runtime.state().get(path).orElse(null));
                writeJson(exchange, body, 200);
                return;
            }
            runtime.state().set(path, Jsons.parse(readBody(exchange)));
            writeText(exchange, "", 200);
        });
        route("/api/remove-path", exchange -> {
            if (!allowMethods(exchange, "DELETE")) return;
            runtime.state().remove(StatePathParser.parse("/api/remove-path", exchange.getRequestURI().getPath()));
            writeText(exchange, "OK", 200);
        });
        route("/api/remove/", exchange -> {
            if (!allowMethods(exchange, "DELETE")) return;
            String key = tail(exchange, "/api/remove/");
            if (key.isEmpty()) {
                writeText(exchange, "Missing key to remove", 400);
                return;
            }
            runtime.state().removeAll(key);
            writeText(exchange, "OK", 200);
        });
        route("/api/undo", exchange -> {
            if (!allowMethods(exchange, "POST")) return;
            runtime.state().undo();
            writeText(exchange, "", 200);
        });
        route("/api/redo", exchange -> {
            if (!allowMethods(exchange, "POST")) return;
            runtime.state().redo();
            writeText(exchange, "", 200);
        });
        route("/api/visassets", exchange -> {
            if (!allowMethods(exchange, "GET")) return;
            writeJson(exchange, runtime.assets().listAssets(), 200);
        });
        route("/api/download-visasset/", exchange -> {
            if (!allowMethods(exchange, "POST")) return;
            String assetId = tail(exchange, "/api/download-visasset/");
            List<String> failed = runtime.assets().resolve(assetId, hostPath(readBody(exchange)));
            if (!failed.isEmpty()) {
                writeText(exchange, "Failed to download files: " + failed, 500);
                return;
            }
            runtime.notifier().broadcast(NotificationTarget.ASSET_CACHE);
            writeText(exchange, "Downloaded files", 200);
        });
        route("/api/save-local-visasset/", exchange -> {
            if (!allowMethods(exchange, "POST")) return;
            String assetId = tail(exchange, "/api/save-local-visasset/");
            Optional<JsonNode> payload = runtime.state().get(StatePath.of("localVisAssets", assetId));
            if (payload.isEmpty()) {
                writeText(exchange, "Unable to save Local VisAsset", 400);
                return;
            }
            AssetPipeline.SavedAsset saved = runtime.assets().saveLocal(payload.get());
            runtime.notifier().broadcast(NotificationTarget.ASSET_CACHE);
            writeJson(exchange, saved, 200);
        });
        route("/api/remove-visasset/", exchange -> {
            if (!allowMethods(exchange, "DELETE")) return;
            runtime.assets().removeAsset(tail(exchange, "/api/remove-visasset/"));
            runtime.notifier().broadcast(NotificationTarget.ASSET_CACHE);
            writeText(exchange, "", 200);
        });
        route("/api/schemas/", exchange -> {
            if (!allowMethods(exchange, "GET")) return;
            String name = tail(exchange, "/api/schemas/");
            byte[] schema = name.isEmpty() || name.contains("/") || name.contains("..")
                    ? null
                    : readResource(AbrServerRuntime.SCHEMA_RESOURCE_DIR + name);
            if (schema == null) {
                writeJson(exchange, Map.of("error", "unknown schema", "name", name), 404);
                return;
            }
            exchange.getResponseHeaders().set("Content-Type", "application/json; charset=utf-8");
            exchange.sendResponseHeaders(200, schema.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(schema);
            }
        });
        route("/api/messages", exchange -> {
            if (!allowMethods(exchange, "POST")) return;
            String subscriberId = parseQuery(exchange.getRequestURI()).get("subscriber");
            if (subscriberId == null || subscriberId.isBlank()) {
                writeText(exchange, "Missing subscriber id", 400);
                return;
            }
            boolean dispatched = runtime.inbound().receive(readBody(exchange), subscriberId);
            writeText(exchange, dispatched ? "" : "Message rejected", dispatched ? 202 : 400);
        });
        server.createContext("/events", this::streamEvents);
    }

    private void streamEvents(HttpExchange exchange) throws IOException {
        if (!ownsPath(exchange, "/events")) {
            writeJson(exchange, Map.of("error", "not_found", "path", exchange.getRequestURI().getPath()), 404);
            exchange.close();
            return;
        }
        if (!allowMethods(exchange, "GET")) return;
        SseChannel channel = new SseChannel();
        String subscriberId = runtime.notifier().subscribe(channel);
        exchange.getResponseHeaders().set("Content-Type", "text/event-stream; charset=utf-8");
        exchange.getResponseHeaders().set("Cache-Control", "no-cache");
        exchange.getResponseHeaders().set("Connection", "keep-alive");
        exchange.sendResponseHeaders(200, 0);
        try (OutputStream os = exchange.getResponseBody()) {
            ObjectNode hello = Jsons.mapper().createObjectNode().put("subscriberId", subscriberId);
            os.write(SseChannel.frame("subscribed", Jsons.toCompactJson(hello)).getBytes(StandardCharsets.UTF_8));
            os.flush();
            while (!Thread.currentThread().isInterrupted()) {
                String frame = channel.next(KEEP_ALIVE_SECONDS, TimeUnit.SECONDS);
                os.write((frame == null ? ": keep-alive\n\n" : frame).getBytes(StandardCharsets.UTF_8));
                os.flush();
            }
        } catch (IOException e) {
            LOG.debug("Event stream for subscriber {} closed: {}", subscriberId, e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            channel.close();
            runtime.notifier().unsubscribe(subscriberId);
        }
    }

    private void route(String path, Route handler) {
        server.createContext(path, exchange -> {
            try {
                if (!ownsPath(exchange, path)) {
                    writeJson(exchange, Map.of("error", "not_found", "path", exchange.getRequestURI().getPath()), 404);
                    return;
                }
                handler.handle(exchange);
            } catch (SchemaValidationException | EmptyHistoryException | IllegalArgumentException e) {
                writeText(exchange, e.getMessage(), 400);
            } catch (RuntimeException e) {
                LOG.error("Request {} {} failed", exchange.getRequestMethod(), exchange.getRequestURI(), e);
                writeJson(exchange, Map.of("error", String.valueOf(e.getMessage())), 500);
            } finally {
                exchange.close();
            }
        });
    }

    // Contexts match by plain string prefix; "/api/state" must not answer "/api/stateful".
    private static boolean ownsPath(HttpExchange exchange, String context) {
        String requestPath = exchange.getRequestURI().getPath();
        return context.endsWith("/")
                || requestPath.length() == context.length()
                || requestPath.charAt(context.length()) == '/';
    }

    private static String tail(HttpExchange exchange, String prefix) {
        String path = exchange.getRequestURI().getPath();
        String rest = path.length() > prefix.length() ? path.substring(prefix.length()) : "";
        while (rest.endsWith("/")) {
            rest = rest.substring(0, rest.length() - 1);
        }
        return rest;
    }

    // A missing or unreadable body falls back to the known libraries.
    private static String hostPath(String body) {
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            JsonNode host = Jsons.parse(body).get("hostPath");
            return host != null && host.isTextual() ? host.textValue() : null;
        } catch (IllegalArgumentException e) {
            LOG.debug("Ignoring unreadable download request body: {}", e.getMessage());
            return null;
        }
    }

    private static byte[] readResource(String resource) throws IOException {
        try (InputStream in = StateHttpServer.class.getClassLoader().getResourceAsStream(resource)) {
            return in == null ? null : in.readAllBytes();
        }
    }

    private static String readBody(HttpExchange exchange) throws IOException {
        return new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8);
    }

    private static boolean allowMethods(HttpExchange exchange, String... methods) throws IOException {
        String method = exchange.getRequestMethod();
        for (String allowed : methods) {
            if (allowed.equalsIgnoreCase(method)) {
                return true;
            }
        }
        exchange.getResponseHeaders().set("Allow", String.join(",", methods));
        writeJson(exchange, Map.of("error", "method_not_allowed", "method", String.valueOf(method)), 405);
        return false;
    }

    private static Map<String, String> parseQuery(URI uri) {
        Map<String, String> out = new LinkedHashMap<>();
        String query = uri.getRawQuery();
        if (query == null || query.isBlank()) {
            return out;
        }
        for (String pair : query.split("&")) {
            if (pair.isBlank()) {
                continue;
            }
            int idx = pair.indexOf('=');
            if (idx < 0) {
                out.put(URLDecoder.decode(pair, StandardCharsets.UTF_8), "");
            } else {
                out.put(URLDecoder.decode(pair.substring(0, idx), StandardCharsets.UTF_8),
                        URLDecoder.decode(pair.substring(idx + 1), StandardCharsets.UTF_8));
            }
        }
        return out;
    }

    private static void writeJson(HttpExchange exchange, Object body, int status) throws IOException {
        byte[] bytes = Jsons.toJson(body).getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "application/json; charset=utf-8");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    private static void writeText(HttpExchange exchange, String body, int status) throws IOException {
        byte[] bytes = (body == null ? "" : body).getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "text/plain; charset=utf-8");
        exchange.sendResponseHeaders(status, bytes.length == 0 ? -1 : bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    @FunctionalInterface
    private interface Route {
        void handle(HttpExchange exchange) throws IOException;
    }
}
