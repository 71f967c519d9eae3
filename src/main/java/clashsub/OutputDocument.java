package clashsub;

import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * The assembled client configuration, in output section order.
 */
public record OutputDocument(
        ObjectNode settings,
        List<JsonNode> proxies,
        List<ProxyGroup> groups,
        List<String> rules
) {
    public OutputDocument {
        proxies = List.copyOf(proxies);
        groups = List.copyOf(groups);
        rules = List.copyOf(rules);
    }
}
