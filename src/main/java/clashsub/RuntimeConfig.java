package clashsub;

import java.time.Duration;
import java.util.List;

/**
 * Compiled, validated, immutable runtime configuration of the server.
 */
public class RuntimeConfig {

    /**
     * How subscriptions are retrieved from their providers.
     */
    public static final class FetchSettings {
        public final Duration connectTimeout;
        public final Duration requestTimeout;
        public final String userAgent;
        public final List<String> forwardHeaders;   // lowercase header names, never null

        public FetchSettings(Duration connectTimeout, Duration requestTimeout, String userAgent, List<String> forwardHeaders) {
            this.connectTimeout = connectTimeout;
            this.requestTimeout = requestTimeout;
            this.userAgent = userAgent;
            this.forwardHeaders = forwardHeaders.stream().map(String::toLowerCase).toList();
        }

        public static FetchSettings defaults() {
            return new FetchSettings(
                Constants.CONNECTION_TIMEOUT,
                Constants.REQUEST_TIMEOUT,
                Constants.USER_AGENT,
                Constants.FORWARDED_HEADERS
            );
        }
    }

    public final int port;
    public final FetchSettings fetch;
    public final ConverterOptions converter;

    public RuntimeConfig(int port, FetchSettings fetch, ConverterOptions converter) {
        this.port = port;
        this.fetch = fetch;
        this.converter = converter;
    }

    public static RuntimeConfig defaults() {
        return new RuntimeConfig(Constants.SERVER_PORT, FetchSettings.defaults(), ConverterOptions.defaults());
    }
}
