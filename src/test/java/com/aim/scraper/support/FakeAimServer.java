package com.aim.scraper.support;

import com.sun.net.httpserver.Headers;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Local stand-in for the model site: serves a configurable page on GET and a
 * configurable result on POST, recording every request it sees.
 */
public class FakeAimServer implements AutoCloseable {

    public static final String PAGE_PATH = "/aim/model2/model2a.php";

    public record Recorded(String method, String path, Headers headers, Map<String, String> form) {
    }

    private record Redirect(int status, String location, String setCookie) {
    }

    private final HttpServer server;

    private final List<Recorded> requests = new CopyOnWriteArrayList<>();

    private final Map<String, Redirect> redirects = new ConcurrentHashMap<>();

    private final AtomicBoolean stopped = new AtomicBoolean();

    private volatile String pageHtml = "<html><body></body></html>";
    private volatile int pageStatus = 200;
    private volatile String resultHtml = "<html><body><pre></pre></body></html>";
    private volatile int resultStatus = 200;
    private volatile String setCookie;
    private volatile long responseDelayMillis;

    public FakeAimServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/", this::handle);
        server.start();
    }

    public URI pageUri() {
        return uri(PAGE_PATH);
    }

    public URI uri(final String path) {
        return URI.create("http://127.0.0.1:" + server.getAddress().getPort() + path);
    }

    public FakeAimServer page(final String html) {
        this.pageHtml = html;
        return this;
    }

    public FakeAimServer pageStatus(final int status) {
        this.pageStatus = status;
        return this;
    }

    public FakeAimServer result(final String html) {
        this.resultHtml = html;
        return this;
    }

    public FakeAimServer resultStatus(final int status) {
        this.resultStatus = status;
        return this;
    }

    public FakeAimServer setCookieOnGet(final String cookie) {
        this.setCookie = cookie;
        return this;
    }

    /**
     * Answers any request to {@code fromPath} with a redirect to
     * {@code toPath}, optionally setting a cookie on the redirect itself.
     */
    public FakeAimServer redirect(final String fromPath, final int status,
                                  final String toPath, final String cookie) {
        redirects.put(fromPath, new Redirect(status, toPath, cookie));
        return this;
    }

    public FakeAimServer delay(final long millis) {
        this.responseDelayMillis = millis;
        return this;
    }

    public List<Recorded> requests() {
        return List.copyOf(requests);
    }

    public Recorded lastPost() {
        return requests.stream()
                .filter(r -> "POST".equals(r.method()))
                .reduce((a, b) -> b)
                .orElseThrow(() -> new AssertionError("no POST received"));
    }

    private void handle(final HttpExchange exchange) throws IOException {
        String method = exchange.getRequestMethod().toUpperCase();
        String body = new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8);
        requests.add(new Recorded(method, exchange.getRequestURI().getPath(),
                exchange.getRequestHeaders(), readForm(body)));

        if (responseDelayMillis > 0) {
            try {
                Thread.sleep(responseDelayMillis);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }

        Redirect redirect = redirects.get(exchange.getRequestURI().getPath());
        if (redirect != null) {
            if (redirect.setCookie() != null) {
                exchange.getResponseHeaders().add("Set-Cookie", redirect.setCookie());
            }
            exchange.getResponseHeaders().set("Location", redirect.location());
            write(exchange, redirect.status(), "");
            return;
        }

        boolean get = "GET".equals(method);
        if (get && setCookie != null) {
            exchange.getResponseHeaders().add("Set-Cookie", setCookie);
        }
        write(exchange, get ? pageStatus : resultStatus, get ? pageHtml : resultHtml);
    }

    private static Map<String, String> readForm(final String body) {
        Map<String, String> form = new LinkedHashMap<>();
        if (body.isEmpty()) {
            return form;
        }
        for (String pair : body.split("&")) {
            if (pair.isEmpty()) {
                continue;
            }
            String[] kv = pair.split("=", 2);
            form.put(URLDecoder.decode(kv[0], StandardCharsets.UTF_8),
                    kv.length > 1 ? URLDecoder.decode(kv[1], StandardCharsets.UTF_8) : "");
        }
        return form;
    }

    private static void write(final HttpExchange exchange, final int status, final String html) throws IOException {
        byte[] data = html.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "text/html; charset=utf-8");
        exchange.sendResponseHeaders(status, data.length == 0 ? -1 : data.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(data);
        }
    }

    @Override
    public void close() {
        if (stopped.compareAndSet(false, true)) {
            server.stop(0);
        }
    }
}
