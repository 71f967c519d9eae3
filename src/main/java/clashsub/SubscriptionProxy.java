package clashsub;

import java.io.IOException;
import java.net.URI;
import java.net.URLDecoder;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;

/**
 * HTTP front end of the converter. {@code GET /convert?url=<subscription>}
 * retrieves the subscription, converts it and returns the client
 * configuration along with the provider's usage headers.
 */
public class SubscriptionProxy implements HttpHandler {

    /**
     * Retrieves the subscription text from its provider.
     */
    public interface SubscriptionFetcher {
        /**
         * @param source The subscription URL
         * @return The provider's response
         * @throws IOException If the provider cannot be reached
         */
        FetchedSubscription fetch(URI source) throws IOException;
    }

    /**
     * A provider response.
     *
     * @param statusCode HTTP status of the response
     * @param body Response body
     * @param headers Response headers (lowercase keys, first value)
     */
    public record FetchedSubscription(int statusCode, String body, Map<String, String> headers) {}

    private static final ObjectMapper JSON_MAPPER = new ObjectMapper();

    private final HttpServerWrapper serverWrapper;
    private final SubscriptionFetcher fetcher;
    private final SubscriptionConverter converter;
    private final List<String> forwardHeaders;

    /**
     * Creates a new conversion server.
     *
     * @param port The port to bind the server to
     * @param fetcher Retrieves subscriptions
     * @param converter Converts retrieved subscriptions
     * @param forwardHeaders Provider response headers copied to the reply (lowercase)
     */
    public SubscriptionProxy(int port, SubscriptionFetcher fetcher, SubscriptionConverter converter, List<String> forwardHeaders) {
        this.serverWrapper = new HttpServerWrapper(port);
        this.fetcher = fetcher;
        this.converter = converter;
        this.forwardHeaders = List.copyOf(forwardHeaders);
    }

    /**
     * Creates a fetcher that retrieves subscriptions over HTTP.
     */
    public static SubscriptionFetcher httpFetcher(RuntimeConfig.FetchSettings settings) {
        HttpClientWrapper client = new HttpClientWrapper(settings.connectTimeout, settings.requestTimeout);
        return source -> {
            HttpResponse<String> response = client.get(source, settings.userAgent);
            Map<String, String> headers = new LinkedHashMap<>();
            response.headers().map().forEach((name, values) -> {
                if (!values.isEmpty()) headers.putIfAbsent(name.toLowerCase(), values.get(0));
            });
            return new FetchedSubscription(response.statusCode(), response.body(), headers);
        };
    }

    public void start() throws IOException {
        serverWrapper.start(this);
    }

    public void stop() throws IOException {
        serverWrapper.stop();
    }

    public int getPort() {
        return serverWrapper.getPort();
    }

    @Override
    public void handle(HttpExchange exchange) throws IOException {
        try {
            String path = exchange.getRequestURI().getPath();
            if (!Constants.CONVERT_ENDPOINT.equals(path)) {
                sendError(exchange, 404, "Not Found", "not_found");
                return;
            }
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                exchange.getResponseHeaders().set("Allow", "GET");
                sendError(exchange, 405, "Method Not Allowed", "invalid_request_error");
                return;
            }

            String target = parseQuery(exchange.getRequestURI().getRawQuery()).get(Constants.URL_PARAM);
            if (target == null || target.isBlank()) {
                sendError(exchange, 400, "Missing 'url' parameter", "invalid_request_error");
                return;
            }

            URI source;
            try {
                source = parseSource(target);
            } catch (IllegalArgumentException e) {
                sendError(exchange, 400, "Invalid URL: " + e.getMessage(), "invalid_request_error");
                return;
            }

            convert(exchange, source);

        } catch (Exception e) {
            Logger.error("Failed to handle " + exchange.getRequestURI().getPath(), e);
            sendError(exchange, 500, "Internal Server Error", "server_error");
        }
    }

    private void convert(HttpExchange exchange, URI source) throws IOException {
        Logger.debug("Fetching subscription from " + source);

        FetchedSubscription fetched;
        try {
            fetched = fetcher.fetch(source);
        } catch (IOException e) {
            Logger.warning("Fetch from " + source.getHost() + " failed", e);
            sendError(exchange, 502, "Fetch failed: " + e.getMessage(), "upstream_error");
            return;
        }

        if (fetched.statusCode() < 200 || fetched.statusCode() > 299) {
            Logger.warning("Provider " + source.getHost() + " returned HTTP " + fetched.statusCode());
            sendError(exchange, 502, "Upstream returned HTTP " + fetched.statusCode(), "upstream_error");
            return;
        }

        String converted;
        try {
            converted = converter.convert(fetched.body());
        } catch (ConversionException e) {
            Logger.warning("Conversion of subscription from " + source.getHost() + " failed", e);
            sendError(exchange, 500, "Conversion failed: " + e.getMessage(), "conversion_error");
            return;
        }

        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("Content-Disposition", Constants.CONTENT_DISPOSITION);
        for (String name : forwardHeaders) {
            String value = fetched.headers().get(name);
            if (value != null) headers.put(name, value);
        }

        HttpServerWrapper.sendResponse(exchange, 200, Constants.CONTENT_TYPE_YAML, converted, headers);
        Logger.info("Converted subscription from " + source.getHost());
    }

    /**
     * Accepts absolute http(s) URLs only.
     */
    static URI parseSource(String target) {
        URI uri = URI.create(target.trim());
        String scheme = uri.getScheme();
        if (scheme == null || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))) {
            throw new IllegalArgumentException("unsupported scheme in " + target);
        }
        if (uri.getHost() == null) {
            throw new IllegalArgumentException("missing host in " + target);
        }
        return uri;
    }

    /**
     * Decodes a raw query string; the first occurrence of a parameter wins.
     */
    static Map<String, String> parseQuery(String rawQuery) {
        Map<String, String> params = new LinkedHashMap<>();
        if (rawQuery == null || rawQuery.isEmpty()) return params;
        for (String pair : rawQuery.split("&")) {
            if (pair.isEmpty()) continue;
            int eq = pair.indexOf('=');
            String key = eq >= 0 ? pair.substring(0, eq) : pair;
            String value = eq >= 0 ? pair.substring(eq + 1) : "";
            params.putIfAbsent(
                URLDecoder.decode(key, StandardCharsets.UTF_8),
                URLDecoder.decode(value, StandardCharsets.UTF_8)
            );
        }
        return params;
    }

    private static void sendError(HttpExchange exchange, int statusCode, String message, String type) throws IOException {
        ObjectNode error = JSON_MAPPER.createObjectNode();
        error.putObject("error")
            .put("message", message)
            .put("type", type);
        HttpServerWrapper.sendResponse(exchange, statusCode, Constants.CONTENT_TYPE_JSON, JSON_MAPPER.writeValueAsString(error));
    }
}
