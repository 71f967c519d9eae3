package clashsub;

import java.time.Duration;
import java.util.List;

/**
 * Constants for the subscription conversion server.
 */
public final class Constants {

    /**
     * Private constructor to prevent instantiation of the class.
     */
    private Constants() {
    }

    // Debug Flags
    public static final boolean DEBUG_REQUEST = false;     // Controls logging of every fetched subscription URL
    public static final boolean DEBUG_LOG_TO_FILE = false; // Controls whether to write logs to file

    // Configuration Constants
    public static final int SERVER_PORT = 8787;
    public static final String CONFIG_FILE = "config.toml";
    public static final String LOG_FILE = "clash-sub.log";

    // Upstream fetch defaults
    public static final Duration CONNECTION_TIMEOUT = Duration.ofSeconds(10);
    public static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(30);
    // Providers serve Clash YAML rather than base64 link lists to Clash-like clients.
    public static final String USER_AGENT = "clash.meta";
    public static final List<String> FORWARDED_HEADERS = List.of(
        "subscription-userinfo",
        "profile-update-interval",
        "profile-web-page-url"
    );

    // API Constants
    public static final String CONVERT_ENDPOINT = "/convert";
    public static final String URL_PARAM = "url";

    // HTTP Constants
    public static final String CONTENT_TYPE_YAML = "text/yaml; charset=utf-8";
    public static final String CONTENT_TYPE_JSON = "application/json";
    public static final String CONTENT_DISPOSITION = "attachment; filename=clash.yaml";
}
