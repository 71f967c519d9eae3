package clashsub;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

/**
 * Typed view over a decoded Clash subscription. Exposes the node list and
 * the top-level fields that are not part of the routing sections.
 */
public final class SubscriptionDocument {

    static final String PROXIES = "proxies";

    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());

    /** Top-level keys written by the converter itself; never taken from input or overrides. */
    static final Set<String> GENERATED_KEYS = Set.of(
        PROXIES, "proxy-groups", "rules", "rule-providers", DocumentSerializer.ANCHOR_KEY
    );

    private final ObjectNode root;
    private final List<ProxyNode> nodes;

    private SubscriptionDocument(ObjectNode root, List<ProxyNode> nodes) {
        this.root = root;
        this.nodes = Collections.unmodifiableList(nodes);
    }

    /**
     * Decodes subscription text.
     *
     * @param text YAML text of the subscription
     * @return the decoded document
     * @throws ConversionException with {@link ConversionException.Failure#PARSE} if the text is not
     *         YAML, is not a mapping, or lacks a {@code proxies} sequence
     */
    public static SubscriptionDocument decode(String text) throws ConversionException {
        JsonNode parsed;
        try {
            parsed = YAML.readTree(text == null ? "" : text);
        } catch (IOException | RuntimeException e) {
            throw new ConversionException(ConversionException.Failure.PARSE,
                "Failed to parse YAML: " + e.getMessage(), e);
        }

        if (parsed == null || !parsed.isObject()) {
            throw new ConversionException(ConversionException.Failure.PARSE,
                "Failed to parse YAML: expected a mapping at the document root");
        }

        JsonNode proxies = parsed.get(PROXIES);
        if (proxies == null) {
            throw new ConversionException(ConversionException.Failure.PARSE,
                "Failed to parse YAML: missing field `" + PROXIES + "`");
        }
        if (!proxies.isArray()) {
            throw new ConversionException(ConversionException.Failure.PARSE,
                "Failed to parse YAML: `" + PROXIES + "` must be a sequence but got " + proxies.getNodeType());
        }

        List<ProxyNode> nodes = new ArrayList<>(proxies.size());
        for (JsonNode entry : proxies) {
            nodes.add(ProxyNode.of(entry));
        }
        return new SubscriptionDocument((ObjectNode) parsed, nodes);
    }

    public List<ProxyNode> nodes() {
        return nodes;
    }

    /**
     * Names of the named nodes, in input order.
     */
    public List<String> names() {
        List<String> out = new ArrayList<>();
        for (ProxyNode node : nodes) {
            if (node.hasName()) out.add(node.name());
        }
        return out;
    }

    /**
     * Top-level fields other than the generated sections, in document order.
     */
    public ObjectNode passthroughSettings() {
        ObjectNode out = JsonNodeFactory.instance.objectNode();
        root.fields().forEachRemaining(entry -> {
            if (!GENERATED_KEYS.contains(entry.getKey())) {
                out.set(entry.getKey(), entry.getValue().deepCopy());
            }
        });
        return out;
    }
}
