package clashsub;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * One entry of the subscription's {@code proxies} sequence.
 * The content is kept as-is; only the {@code name} field is ever read.
 *
 * @param name    the node's name, or null when it has no string name
 * @param content the untouched YAML value of the entry
 */
public record ProxyNode(String name, JsonNode content) {

    public static ProxyNode of(JsonNode content) {
        return new ProxyNode(nameOf(content), content);
    }

    public boolean hasName() {
        return name != null;
    }

    /**
     * Returns the {@code name} field when it is a string. Missing, null and
     * non-string values (e.g. {@code name: 12345}) all count as no name.
     */
    public static String nameOf(JsonNode content) {
        if (content == null || !content.isObject()) return null;
        JsonNode n = content.get("name");
        return (n != null && n.isTextual()) ? n.asText() : null;
    }
}
