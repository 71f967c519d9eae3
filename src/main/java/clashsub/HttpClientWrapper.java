package clashsub;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * A wrapper around {@link HttpClient} for retrieving subscription documents.
 */
public class HttpClientWrapper {

    private final HttpClient httpClient;
    private final Duration requestTimeout;

    /**
     * @param connectionTimeout Timeout for establishing the connection
     * @param requestTimeout Timeout for the complete request/response cycle
     */
    public HttpClientWrapper(Duration connectionTimeout, Duration requestTimeout) {
        this.httpClient = HttpClient.newBuilder()
            .connectTimeout(connectionTimeout)
            .followRedirects(HttpClient.Redirect.NORMAL)
            .build();
        this.requestTimeout = requestTimeout;
    }

    /**
     * Sends a GET request and reads the whole body as UTF-8 text.
     *
     * @param uri The resource to retrieve
     * @param userAgent The User-Agent header to send
     * @return The response, whatever its status code
     * @throws IOException If the request fails or is interrupted
     */
    public HttpResponse<String> get(URI uri, String userAgent) throws IOException {
        HttpRequest request = HttpRequest.newBuilder(uri)
            .timeout(requestTimeout)
            .header("User-Agent", userAgent)
            .GET()
            .build();

        try {
            return httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Request to " + uri.getHost() + " interrupted", e);
        }
    }
}
