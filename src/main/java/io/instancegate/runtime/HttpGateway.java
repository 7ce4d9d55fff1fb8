package io.instancegate.runtime;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import io.instancegate.model.InstanceView;
import io.instancegate.util.Jsons;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

public final class HttpGateway {
    public static final String TOKEN_HEADER = "x-token";
    public static final String SIGNATURE_HEADER = "x-signature";
    private static final String INSTANCE_PREFIX = "/instance/";

    private final InstanceGateRuntime runtime;
    private final HttpServer server;
    private final ExecutorService executor;
    private final int maxRequestBytes;

    public HttpGateway(InstanceGateRuntime runtime, String host, int port) throws IOException {
        this.runtime = runtime;
        this.maxRequestBytes = runtime.settings().maxRequestBytes();
        this.server = HttpServer.create(new InetSocketAddress(host, port), 0);
        AtomicInteger threadIds = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(
                Math.max(2, Runtime.getRuntime().availableProcessors()),
                r -> {
                    Thread t = new Thread(r, "instancegate-http-" + threadIds.incrementAndGet());
                    t.setDaemon(true);
                    return t;
                }
        );
        server.createContext("/", this::dispatch);
        server.setExecutor(executor);
    }

    public void start() {
        server.start();
    }

    public int port() {
        return server.getAddress().getPort();
    }

    public void stop() {
        server.stop(0);
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private void dispatch(HttpExchange exchange) throws IOException {
        try {
            String path = exchange.getRequestURI().getPath();
            try {
                switch (path) {
                    case "/instance/pubkey" -> {
                        if (!allowMethods(exchange, "GET")) return;
                        writeJson(exchange, Map.of("pubkey", runtime.instancePubkeyHex()), 200);
                    }
                    case "/operator/register" -> {
                        if (!allowMethods(exchange, "POST")) return;
                        JsonNode body = readJsonBody(exchange);
                        String ownerToken = runtime.registerOperator(
                                textField(body, "pubkey"), textField(body, "signature"));
                        Map<String, Object> out = new LinkedHashMap<>();
                        out.put("status", "success");
                        out.put("owner_token", ownerToken);
                        writeJson(exchange, out, 200);
                    }
                    case "/owner/register" -> {
                        if (!allowMethods(exchange, "POST")) return;
                        JsonNode body = readJsonBody(exchange);
                        runtime.registerOwner(
                                textField(body, "pubkey"),
                                textField(body, "signature"),
                                exchange.getRequestHeaders().getFirst(TOKEN_HEADER)
                        );
                        writeJson(exchange, Map.of("status", "success"), 200);
                    }
                    case "/workload/configure" -> {
                        if (!allowMethods(exchange, "POST")) return;
                        JsonNode body = readJsonBody(exchange);
                        runtime.configureWorkload(body, exchange.getRequestHeaders().getFirst(SIGNATURE_HEADER));
                        writeJson(exchange, Map.of("status", "success"), 200);
                    }
                    case "/workload/expose" -> {
                        if (!allowMethods(exchange, "POST")) return;
                        JsonNode body = readJsonBody(exchange);
                        runtime.exposeWorkload(body, exchange.getRequestHeaders().getFirst(SIGNATURE_HEADER));
                        writeJson(exchange, Map.of("status", "success"), 200);
                    }
                    default -> {
                        if (path.startsWith(INSTANCE_PREFIX) && path.indexOf('/', INSTANCE_PREFIX.length()) < 0) {
                            if (!allowMethods(exchange, "GET")) return;
                            InstanceView view = runtime.getInstance(path.substring(INSTANCE_PREFIX.length()));
                            writeJson(exchange, view, 200);
                            return;
                        }
                        writeJson(exchange, Map.of("error", "not_found"), 404);
                    }
                }
            } catch (GatewayException e) {
                writeJson(exchange, Map.of("error", e.getMessage()), e.kind().httpStatus());
            } catch (RequestTooLargeException e) {
                writeJson(exchange, Map.of("error", "Request body too large"), 413);
            } catch (RuntimeException e) {
                System.err.println("ERROR " + path + " failed: " + e);
                writeJson(exchange, Map.of("error", "Internal error"), 500);
            }
        } finally {
            exchange.close();
        }
    }

    private JsonNode readJsonBody(HttpExchange exchange) throws IOException {
        byte[] raw;
        try (InputStream in = exchange.getRequestBody()) {
            raw = in.readNBytes(maxRequestBytes + 1);
        }
        if (raw.length > maxRequestBytes) {
            throw new RequestTooLargeException();
        }
        String body = new String(raw, StandardCharsets.UTF_8).trim();
        if (body.isEmpty()) {
            throw GatewayException.badRequest("Missing request body");
        }
        JsonNode node;
        try {
            node = Jsons.mapper().readTree(body);
        } catch (JsonProcessingException e) {
            throw GatewayException.badRequest("Invalid JSON body");
        }
        if (node == null || !node.isObject()) {
            throw GatewayException.badRequest("Invalid payload");
        }
        return node;
    }

    private static String textField(JsonNode body, String field) {
        JsonNode node = body.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isTextual()) {
            throw GatewayException.badRequest("Invalid field: " + field + " must be a hex string");
        }
        return node.asText();
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

    private static void writeJson(HttpExchange exchange, Object body, int status) throws IOException {
        byte[] bytes = Jsons.toJson(body).getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "application/json; charset=utf-8");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    private static final class RequestTooLargeException extends RuntimeException {
        RequestTooLargeException() {
            super("request body too large");
        }
    }
}
