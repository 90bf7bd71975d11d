package io.valuation.marketdata;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import io.valuation.error.NoDataException;
import io.valuation.retry.ExponentialBackoffRetryPolicy;
import io.valuation.retry.RetryPolicy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

public class HttpYahooClientTest {
    HttpServer server;
    final Deque<Integer> statuses = new ArrayDeque<>();
    final List<String> queries = new CopyOnWriteArrayList<>();

    @BeforeEach
    void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress(0), 0);
        server.createContext("/v8/finance/chart/", this::handle);
        server.start();
    }

    @AfterEach
    void stopServer() { server.stop(0); }

    private String baseUrl() {
        return "http://127.0.0.1:" + server.getAddress().getPort();
    }

    private void handle(HttpExchange exchange) throws IOException {
        queries.add(exchange.getRequestURI().getRawPath() + "?" + exchange.getRequestURI().getRawQuery());
        Integer queued;
        synchronized (statuses) { queued = statuses.poll(); }
        int status = queued == null ? 200 : queued;
        byte[] body = (status == 200 ? "{\"chart\":{\"result\":[],\"error\":null}}" : "{}").getBytes(StandardCharsets.UTF_8);
        exchange.sendResponseHeaders(status, body.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(body);
        }
    }

    @Test
    void builds_chart_request() throws Exception {
        HttpYahooClient client = new HttpYahooClient(baseUrl(), RetryPolicy.none());

        String body = client.fetch("^TNX", 1577836800L, 1577923200L, "1d");

        assertTrue(body.contains("\"chart\""));
        String q = queries.get(0);
        assertTrue(q.startsWith("/v8/finance/chart/%5ETNX?"), q);
        assertTrue(q.contains("interval=1d"));
        assertTrue(q.contains("period1=1577836800"));
        assertTrue(q.contains("period2=1577923200"));
        assertTrue(q.contains("includeAdjustedClose=true"));
    }

    @Test
    void retries_server_errors_then_succeeds() throws Exception {
        statuses.add(500);
        statuses.add(503);
        HttpYahooClient client = new HttpYahooClient(baseUrl(), new ExponentialBackoffRetryPolicy(3, 1, 5));

        String body = client.fetch("AAPL", 0L, 86400L, "1d");

        assertTrue(body.contains("\"chart\""));
        assertEquals(3, queries.size());
    }

    @Test
    void gives_up_after_max_attempts() {
        statuses.add(500);
        statuses.add(500);
        HttpYahooClient client = new HttpYahooClient(baseUrl(), new ExponentialBackoffRetryPolicy(2, 1, 5));

        IOException e = assertThrows(IOException.class, () -> client.fetch("AAPL", 0L, 86400L, "1d"));

        assertTrue(e.getMessage().contains("HTTP 500"));
        assertEquals(2, queries.size());
    }

    @Test
    void not_found_is_no_data_without_retry() {
        statuses.add(404);
        HttpYahooClient client = new HttpYahooClient(baseUrl(), new ExponentialBackoffRetryPolicy(3, 1, 5));

        assertThrows(NoDataException.class, () -> client.fetch("NOPE", 0L, 86400L, "1d"));
        assertEquals(1, queries.size());
    }
}
