package clashsub;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.toml.TomlFactory;

/**
 * Loads, validates and compiles the TOML configuration into RuntimeConfig.
 * Every section and key is optional:
 *
 * [server]
 * port = 8787
 *
 * [fetch]
 * connect_timeout_seconds = 10
 * request_timeout_seconds = 30
 * user_agent = "clash.meta"
 * forward_headers = ["subscription-userinfo"]     # copied from the provider's response
 *
 * [conversion]
 * policy = "heuristic"                            # "heuristic" | "pattern"
 * compaction = "native"                           # "native" | "text" | "none"
 *
 * [probe]
 * url = "http://www.gstatic.com/generate_204"
 * interval = 180
 * strategy = "consistent-hashing"
 *
 * [settings]                                      # heuristic policy: replaces/extends the fixed client settings
 * mixed-port = 7890
 *
 * [regions]                                       # pattern policy: ordered label = filter table
 * "香港负载组" = "(?i)港|hk"
 */
public class ConfigLoader {

    private static final ObjectMapper TOML = new ObjectMapper(new TomlFactory());

    private static final Set<String> SECTIONS = Set.of(
        "server", "fetch", "conversion", "probe", "settings", "regions"
    );

    /**
     * Loads the configuration file, falling back to the built-in defaults when it does not exist.
     *
     * @return the compiled configuration, or null if the file is unreadable or invalid
     */
    public static RuntimeConfig load(String tomlPath) {
        Path path = Path.of(tomlPath);
        if (!Files.exists(path)) {
            Logger.warning("Configuration file not found: " + tomlPath + ", using defaults");
            return RuntimeConfig.defaults();
        }

        try {
            RuntimeConfig compiled = parse(Files.readString(path, StandardCharsets.UTF_8));
            Logger.info("Configuration loaded successfully");
            return compiled;
        } catch (IOException e) {
            Logger.error("Failed to read configuration: " + tomlPath, e);
            return null;
        } catch (Exception e) {
            Logger.error("Invalid configuration", e);
            return null;
        }
    }

    /**
     * Compiles TOML text.
     *
     * @throws IOException if the text is not TOML
     * @throws IllegalArgumentException if a value is out of place
     */
    public static RuntimeConfig parse(String content) throws IOException {
        JsonNode root = TOML.readTree(content);
        if (root == null || root.isMissingNode()) {
            return RuntimeConfig.defaults();
        }
        if (!root.isObject()) {
            throw new IllegalArgumentException("Configuration must be a table");
        }
        return compile((ObjectNode) root);
    }

    private static RuntimeConfig compile(ObjectNode root) {
        root.fieldNames().forEachRemaining(name -> {
            if (!SECTIONS.contains(name)) {
                Logger.warning("Ignoring unknown configuration section [" + name + "]");
            }
        });

        ObjectNode server = section(root, "server");
        int port = getInt(server, "port", Constants.SERVER_PORT);
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("[server] port out of range: " + port);
        }

        ObjectNode fetch = section(root, "fetch");
        RuntimeConfig.FetchSettings fetchSettings = new RuntimeConfig.FetchSettings(
            getSeconds(fetch, "connect_timeout_seconds", Constants.CONNECTION_TIMEOUT),
            getSeconds(fetch, "request_timeout_seconds", Constants.REQUEST_TIMEOUT),
            getText(fetch, "user_agent", Constants.USER_AGENT),
            getStringArray(fetch, "forward_headers", Constants.FORWARDED_HEADERS)
        );

        ObjectNode conversion = section(root, "conversion");
        GroupingPolicy policy = getEnum(conversion, "policy", GroupingPolicy.class, GroupingPolicy.HEURISTIC);
        CompactionMode compaction = getEnum(conversion, "compaction", CompactionMode.class, CompactionMode.NATIVE);

        ObjectNode probe = section(root, "probe");
        ProbePolicy probePolicy = new ProbePolicy(
            getText(probe, "url", ProbePolicy.DEFAULT.url()),
            getInt(probe, "interval", ProbePolicy.DEFAULT.interval()),
            getText(probe, "strategy", ProbePolicy.DEFAULT.strategy())
        );

        ObjectNode settings = section(root, "settings");
        for (String key : SubscriptionDocument.GENERATED_KEYS) {
            if (settings.has(key)) {
                Logger.warning("Ignoring [settings] entry '" + key + "': generated by the converter");
                settings.remove(key);
            }
        }
        List<RegionPattern> regions = compileRegions(root.get("regions"));

        ConverterOptions options = new ConverterOptions(policy, compaction, probePolicy, settings, regions);
        Logger.info("Conversion policy: " + policy.name().toLowerCase() + " (compaction: " + compaction.name().toLowerCase() + ")");
        return new RuntimeConfig(port, fetchSettings, options);
    }

    private static List<RegionPattern> compileRegions(JsonNode node) {
        if (node == null || node.isNull()) return null;
        if (!node.isObject()) throw new IllegalArgumentException("[regions] must be a table of label = filter");

        List<RegionPattern> regions = new ArrayList<>();
        node.fields().forEachRemaining(entry -> {
            if (!entry.getValue().isTextual()) {
                throw new IllegalArgumentException("Region '" + entry.getKey() + "' filter must be a string");
            }
            regions.add(new RegionPattern(entry.getKey(), entry.getValue().asText()));
        });
        return regions;
    }

    private static ObjectNode section(ObjectNode root, String name) {
        JsonNode node = root.get(name);
        if (node == null || node.isNull()) return JsonNodeFactory.instance.objectNode();
        if (node.isObject()) return (ObjectNode) node;
        throw new IllegalArgumentException("Section [" + name + "] must be a table/object");
    }

    private static String getText(ObjectNode obj, String field, String defaultVal) {
        JsonNode n = obj.get(field);
        if (n == null || n.isNull()) return defaultVal;
        if (!n.isTextual() || n.asText().isEmpty()) {
            throw new IllegalArgumentException("Expected non-empty string for '" + field + "' but got: " + n);
        }
        return n.asText();
    }

    private static int getInt(ObjectNode obj, String field, int defaultVal) {
        JsonNode n = obj.get(field);
        if (n == null || n.isNull()) return defaultVal;
        if (!n.isIntegralNumber() || !n.canConvertToInt()) {
            throw new IllegalArgumentException("Expected integer for '" + field + "' but got: " + n.getNodeType());
        }
        return n.asInt();
    }

    private static Duration getSeconds(ObjectNode obj, String field, Duration defaultVal) {
        JsonNode n = obj.get(field);
        if (n == null || n.isNull()) return defaultVal;
        int seconds = getInt(obj, field, 0);
        if (seconds <= 0) throw new IllegalArgumentException("'" + field + "' must be positive: " + seconds);
        return Duration.ofSeconds(seconds);
    }

    private static List<String> getStringArray(ObjectNode obj, String field, List<String> defaultVal) {
        JsonNode node = obj.get(field);
        if (node == null || node.isNull()) return defaultVal;
        if (!node.isArray()) throw new IllegalArgumentException("Expected array of strings: " + node);
        List<String> out = new ArrayList<>();
        for (JsonNode el : node) {
            if (!el.isTextual()) throw new IllegalArgumentException("Expected array of strings, got: " + el);
            out.add(el.asText());
        }
        return out;
    }

    private static <E extends Enum<E>> E getEnum(ObjectNode obj, String field, Class<E> type, E defaultVal) {
        String text = getText(obj, field, null);
        if (text == null) return defaultVal;
        try {
            return Enum.valueOf(type, text.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown " + field + " '" + text + "', expected one of "
                + Arrays.toString(type.getEnumConstants()).toLowerCase(Locale.ROOT));
        }
    }
}
