package clashsub;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;

/**
 * A wrapper around {@link HttpServer} that manages the server lifecycle and
 * writes complete responses.
 *
 * @see com.sun.net.httpserver.HttpServer
 */
public class HttpServerWrapper {

    private HttpServer httpServer;
    private ExecutorService executor;
    private final int port;

    /**
     * Creates a new HTTP server wrapper.
     *
     * @param port The port to bind the server to, 0 for any free port
     */
    public HttpServerWrapper(int port) {
        this.port = port;
    }

    /**
     * Starts the HTTP server and registers the provided handler for all requests.
     *
     * @param handler The handler to process all incoming requests
     * @throws IOException If the server fails to start
     */
    public void start(HttpHandler handler) throws IOException {
        try {
            httpServer = HttpServer.create(new InetSocketAddress(port), 0); // 0 = Use system default backlog
            httpServer.createContext("/", handler);

            // Each conversion runs on its own worker; conversions share no state
            executor = Executors.newCachedThreadPool(r -> {
                Thread t = new Thread(r);
                t.setDaemon(true);
                t.setName("HttpServer-Worker");
                return t;
            });
            httpServer.setExecutor(executor);

            httpServer.start();
        } catch (Exception e) {
            throw new IOException("Failed to start server on port " + port, e);
        }
    }

    /**
     * Stops the HTTP server without waiting for open exchanges.
     *
     * @throws IOException If the server fails to stop
     */
    public void stop() throws IOException {
        if (httpServer != null) {
            try {
                httpServer.stop(0);
                httpServer = null;
            } catch (Exception e) {
                throw new IOException("Failed to stop server", e);
            }
        }

        if (executor != null) {
            executor.shutdown();
            executor = null;
        }
    }

    /**
     * Returns the port the server is bound to, which differs from the configured one when that was 0.
     */
    public int getPort() {
        return httpServer != null ? httpServer.getAddress().getPort() : port;
    }

    /**
     * Sends a response with the specified status code, content type, and body.
     *
     * @param exchange The HTTP exchange
     * @param statusCode The HTTP status code
     * @param contentType The content type header value
     * @param responseBody The response body
     * @throws IOException If sending the response fails
     */
    public static void sendResponse(HttpExchange exchange, int statusCode, String contentType, String responseBody) throws IOException {
        sendResponse(exchange, statusCode, contentType, responseBody, Map.of());
    }

    /**
     * Sends a response with additional headers.
     *
     * @param exchange The HTTP exchange
     * @param statusCode The HTTP status code
     * @param contentType The content type header value
     * @param responseBody The response body
     * @param headers Extra response headers, set after the content type
     * @throws IOException If sending the response fails
     */
    public static void sendResponse(HttpExchange exchange, int statusCode, String contentType, String responseBody,
                                    Map<String, String> headers) throws IOException {
        try {
            exchange.getResponseHeaders().set("Content-Type", contentType);
            headers.forEach((name, value) -> exchange.getResponseHeaders().set(name, value));
            byte[] responseBytes = responseBody.getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(statusCode, responseBytes.length);

            try (OutputStream output = exchange.getResponseBody()) {
                output.write(responseBytes);
            }
        } catch (Exception e) {
            throw new IOException("Failed to send response", e);
        }
    }
}
