package io.torotator.observability;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import io.torotator.util.Jsons;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.function.Supplier;

/**
 * Read-only HTTP view of the pool: {@code /status} as JSON, {@code /metrics} in Prometheus text format.
 */
public final class StatusServer implements AutoCloseable {
    private static final Logger LOG = LogManager.getLogger(StatusServer.class);

    private final HttpServer server;

    private StatusServer(HttpServer server) {
        this.server = server;
    }

    public static StatusServer start(int port, Supplier<PoolStatus> status) throws IOException {
        HttpServer server = HttpServer.create(new InetSocketAddress(port), 0);
        server.createContext("/status", exchange ->
                respond(exchange, "application/json; charset=utf-8", Jsons.toJson(status.get())));
        server.createContext("/metrics", exchange ->
                respond(exchange, "text/plain; version=0.0.4; charset=utf-8", PoolMetricsFormatter.format(status.get())));
        server.setExecutor(null);
        server.start();
        LOG.info("Status server listening on http://127.0.0.1:{}/status", server.getAddress().getPort());
        return new StatusServer(server);
    }

    public int port() {
        return server.getAddress().getPort();
    }

    private static void respond(HttpExchange exchange, String contentType, String body) throws IOException {
        if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
            exchange.sendResponseHeaders(405, -1);
            exchange.close();
            return;
        }
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", contentType);
        exchange.sendResponseHeaders(200, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    @Override
    public void close() {
        server.stop(0);
    }
}
