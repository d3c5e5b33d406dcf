package me.internalizable.lodestone.daemon.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import me.internalizable.lodestone.api.LodestoneAPI;
import me.internalizable.lodestone.api.error.ErrorKind;
import me.internalizable.lodestone.api.error.LodestoneException;
import me.internalizable.lodestone.api.instance.GameType;
import me.internalizable.lodestone.api.instance.InstanceUuid;
import me.internalizable.lodestone.daemon.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * HTTP front end of the daemon.
 *
 * <p>Maps the REST routes onto {@link LodestoneAPI}. The bearer token is read
 * from the {@code Authorization} header. Errors are rendered as
 * {@code {"kind": ..., "detail": ...}} with a status derived from the kind.</p>
 */
public class LodestoneHttpServer {

    private static final Logger LOGGER = LoggerFactory.getLogger(LodestoneHttpServer.class);

    private static final String BEARER_PREFIX = "Bearer ";
    private static final TypeReference<Map<String, Object>> MANIFEST_TYPE = new TypeReference<>() {
    };

    private final LodestoneAPI api;
    private final String host;
    private final int port;
    private final List<Route> routes = new ArrayList<>();

    private HttpServer server;
    private ExecutorService executor;

    /**
     * Create an HTTP server.
     *
     * @param api API to serve
     * @param host bind address
     * @param port bind port, 0 for an ephemeral port
     */
    public LodestoneHttpServer(@Nonnull LodestoneAPI api, @Nonnull String host, int port) {
        this.api = Objects.requireNonNull(api, "api");
        this.host = Objects.requireNonNull(host, "host");
        this.port = port;
        registerRoutes();
    }

    // ==================== Routes ====================

    private void registerRoutes() {
        route("GET", "/instance/list", (exchange, m, token) ->
                writeJson(exchange, api.listInstances(token), 200));

        route("GET", "/instance/([^/]+)/info", (exchange, m, token) ->
                writeJson(exchange, api.getInstanceInfo(token, uuid(m)), 200));

        route("POST", "/instance/create/([^/]+)", (exchange, m, token) -> {
            GameType gameType = GameType.fromString(m.group(1));
            Map<String, Object> manifest = readManifest(exchange);
            writeJson(exchange, api.createInstance(token, gameType, manifest), 200);
        });

        route("DELETE", "/instance/([^/]+)", (exchange, m, token) -> {
            api.deleteInstance(token, uuid(m));
            writeJson(exchange, null, 200);
        });

        route("PUT", "/instance/([^/]+)/start", (exchange, m, token) -> {
            api.startInstance(token, uuid(m));
            writeJson(exchange, null, 200);
        });

        route("PUT", "/instance/([^/]+)/stop", (exchange, m, token) -> {
            api.stopInstance(token, uuid(m));
            writeJson(exchange, null, 200);
        });

        route("GET", "/instance/([^/]+)/fs/ls(?:/(.*))?", (exchange, m, token) ->
                writeJson(exchange, api.listInstanceFiles(token, uuid(m), relativePath(m)), 200));

        route("GET", "/instance/([^/]+)/fs/read/(.+)", (exchange, m, token) ->
                writeText(exchange, api.readInstanceFile(token, uuid(m), relativePath(m))));

        route("PUT", "/instance/([^/]+)/fs/write/(.+)", (exchange, m, token) -> {
            byte[] body;
            try (InputStream is = exchange.getRequestBody()) {
                body = is.readAllBytes();
            }
            api.writeInstanceFile(token, uuid(m), relativePath(m), body);
            writeJson(exchange, null, 200);
        });

        route("PUT", "/instance/([^/]+)/fs/mkdir/(.+)", (exchange, m, token) -> {
            api.makeInstanceDirectory(token, uuid(m), relativePath(m));
            writeJson(exchange, null, 200);
        });

        route("DELETE", "/instance/([^/]+)/fs/rm/(.+)", (exchange, m, token) -> {
            api.removeInstanceFile(token, uuid(m), relativePath(m));
            writeJson(exchange, null, 200);
        });
    }

    private void route(String method, String pattern, RouteHandler handler) {
        routes.add(new Route(method, Pattern.compile(pattern), handler));
    }

    private static InstanceUuid uuid(Matcher matcher) {
        return InstanceUuid.of(matcher.group(1));
    }

    private static String relativePath(Matcher matcher) {
        String path = matcher.group(2);
        return path != null ? path : "";
    }

    private static Map<String, Object> readManifest(HttpExchange exchange) throws IOException {
        byte[] body;
        try (InputStream is = exchange.getRequestBody()) {
            body = is.readAllBytes();
        }
        try {
            Map<String, Object> manifest = Jsons.mapper().readValue(body, MANIFEST_TYPE);
            if (manifest == null) {
                throw LodestoneException.badRequest("Manifest must be a JSON object");
            }
            return manifest;
        } catch (JsonProcessingException e) {
            throw new LodestoneException(ErrorKind.BAD_REQUEST, "Malformed manifest", e);
        }
    }

    // ==================== Lifecycle ====================

    /**
     * Bind and start serving.
     *
     * @throws IOException if the address cannot be bound
     */
    public void start() throws IOException {
        server = HttpServer.create(new InetSocketAddress(host, port), 0);
        executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "Lodestone-Http");
            t.setDaemon(true);
            return t;
        });
        server.setExecutor(executor);
        server.createContext("/", this::dispatch);
        server.start();
        LOGGER.info("HTTP server listening on {}:{}", host, getPort());
    }

    /**
     * Get the bound port.
     *
     * @return bound port, or the configured port if not started
     */
    public int getPort() {
        return server != null ? server.getAddress().getPort() : port;
    }

    /**
     * Stop serving.
     */
    public void stop() {
        if (server != null) {
            server.stop(0);
            server = null;
        }
        if (executor != null) {
            executor.shutdown();
            try {
                executor.awaitTermination(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            executor = null;
        }
        LOGGER.info("HTTP server stopped");
    }

    // ==================== Dispatch ====================

    private void dispatch(HttpExchange exchange) throws IOException {
        try {
            String path = exchange.getRequestURI().getPath();
            String method = exchange.getRequestMethod();
            String token = bearerToken(exchange);
            boolean pathMatched = false;

            for (Route route : routes) {
                Matcher matcher = route.pattern().matcher(path);
                if (!matcher.matches()) {
                    continue;
                }
                pathMatched = true;
                if (route.method().equalsIgnoreCase(method)) {
                    // before any path segment or body is parsed
                    api.authenticate(token);
                    route.handler().handle(exchange, matcher, token);
                    return;
                }
            }

            if (pathMatched) {
                writeError(exchange, 405, ErrorKind.BAD_REQUEST, "Method not allowed");
            } else {
                writeError(exchange, 404, ErrorKind.NOT_FOUND, "No such route");
            }
        } catch (LodestoneException e) {
            writeError(exchange, statusOf(e.getKind()), e.getKind(), e.getDetail());
        } catch (IllegalArgumentException e) {
            writeError(exchange, 400, ErrorKind.BAD_REQUEST, e.getMessage() != null ? e.getMessage() : "Bad request");
        } catch (Exception e) {
            LOGGER.error("Unhandled error serving {} {}", exchange.getRequestMethod(), exchange.getRequestURI(), e);
            writeError(exchange, 500, ErrorKind.IO_FAILURE, "Internal error");
        } finally {
            exchange.close();
        }
    }

    private static String bearerToken(HttpExchange exchange) {
        String header = exchange.getRequestHeaders().getFirst("Authorization");
        if (header == null || !header.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            return "";
        }
        return header.substring(BEARER_PREFIX.length()).trim();
    }

    /**
     * HTTP status for an error kind.
     *
     * @param kind error kind
     * @return status code
     */
    static int statusOf(@Nonnull ErrorKind kind) {
        return switch (kind) {
            case UNAUTHORIZED -> 401;
            case FORBIDDEN, PROTECTED_RESOURCE -> 403;
            case NOT_FOUND -> 404;
            case BAD_REQUEST, MALFORMED_PATH -> 400;
            case IO_FAILURE -> 500;
        };
    }

    private static void writeError(HttpExchange exchange, int status, ErrorKind kind, String detail) throws IOException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("kind", kind.name());
        body.put("detail", detail);
        writeJson(exchange, body, status);
    }

    private static void writeJson(HttpExchange exchange, Object body, int status) throws IOException {
        byte[] bytes = Jsons.toJson(body).getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "application/json; charset=utf-8");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    private static void writeText(HttpExchange exchange, String text) throws IOException {
        byte[] bytes = text.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "text/plain; charset=utf-8");
        exchange.sendResponseHeaders(200, bytes.length == 0 ? -1 : bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    @FunctionalInterface
    private interface RouteHandler {
        void handle(HttpExchange exchange, Matcher matcher, String token) throws IOException;
    }

    private record Route(String method, Pattern pattern, RouteHandler handler) {
    }
}
