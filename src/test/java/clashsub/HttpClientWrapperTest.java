package clashsub;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.URI;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HttpClientWrapperTest {

    private HttpServer upstream;
    private HttpClientWrapper client;

    @BeforeEach
    void setUp() throws IOException {
        upstream = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        upstream.createContext("/sub", exchange -> {
            exchange.getResponseHeaders().set("X-Seen-Agent", exchange.getRequestHeaders().getFirst("User-Agent"));
            respond(exchange, 200, "proxies:\n  - name: \"香港-01\"\n    type: ss\n");
        });
        upstream.createContext("/moved", exchange -> {
            exchange.getResponseHeaders().set("Location", "/sub");
            respond(exchange, 302, "");
        });
        upstream.createContext("/expired", exchange -> respond(exchange, 403, "subscription expired"));
        upstream.start();

        client = new HttpClientWrapper(Duration.ofSeconds(5), Duration.ofSeconds(5));
    }

    @AfterEach
    void tearDown() {
        upstream.stop(0);
    }

    @Test
    void get_shouldSendUserAgent_andDecodeBodyAsUtf8() throws Exception {
        // Act
        HttpResponse<String> response = client.get(uri("/sub"), "clash.meta");

        // Assert
        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(response.headers().firstValue("X-Seen-Agent")).contains("clash.meta");
        assertThat(response.body()).contains("香港-01");
    }

    @Test
    void get_shouldFollowRedirects() throws Exception {
        HttpResponse<String> response = client.get(uri("/moved"), "clash.meta");

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(response.uri().getPath()).isEqualTo("/sub");
    }

    @Test
    void get_shouldReturnErrorResponsesWithoutThrowing() throws Exception {
        HttpResponse<String> response = client.get(uri("/expired"), "clash.meta");

        assertThat(response.statusCode()).isEqualTo(403);
        assertThat(response.body()).isEqualTo("subscription expired");
    }

    @Test
    void get_shouldThrowIOException_whenHostIsUnreachable() throws Exception {
        // Arrange
        int closedPort;
        try (ServerSocket socket = new ServerSocket(0)) {
            closedPort = socket.getLocalPort();
        }

        // Act + Assert
        assertThatThrownBy(() -> client.get(URI.create("http://127.0.0.1:" + closedPort + "/sub"), "clash.meta"))
            .isInstanceOf(IOException.class);
    }

    private URI uri(String path) {
        return URI.create("http://127.0.0.1:" + upstream.getAddress().getPort() + path);
    }

    private static void respond(HttpExchange exchange, int status, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.sendResponseHeaders(status, bytes.length == 0 ? -1 : bytes.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(bytes);
        }
    }
}
