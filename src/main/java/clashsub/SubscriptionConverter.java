package clashsub;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Converts a Clash subscription into a grouped client configuration:
 * decode, classify, build groups and rules, serialize, optionally compact.
 *
 * <p>Instances hold only immutable state and may be shared between threads.
 */
public class SubscriptionConverter {

    private final ConverterOptions options;
    private final NodeClassifier classifier;
    private final GroupSynthesizer synthesizer;
    private final AnchorCompactor compactor;

    public SubscriptionConverter() {
        this(ConverterOptions.defaults());
    }

    public SubscriptionConverter(ConverterOptions options) {
        this.options = options;
        if (options.policy() == GroupingPolicy.PATTERN) {
            PatternClassifier patterns = new PatternClassifier(options.regions());
            this.classifier = patterns;
            this.synthesizer = new PatternGroupSynthesizer(patterns, options.probe());
        } else {
            this.classifier = new HeuristicClassifier();
            this.synthesizer = new HeuristicGroupSynthesizer(options.probe());
        }
        this.compactor = new AnchorCompactor(options.probe());
    }

    public ConverterOptions options() {
        return options;
    }

    /**
     * Converts subscription text.
     *
     * @param content YAML text of the subscription
     * @return the client configuration as YAML
     * @throws ConversionException if the input cannot be decoded or the result cannot be rendered
     */
    public String convert(String content) throws ConversionException {
        SubscriptionDocument document = SubscriptionDocument.decode(content);
        OutputDocument output = assemble(document);

        String yaml = DocumentSerializer.serialize(output, options.compaction() == CompactionMode.NATIVE);
        if (options.compaction() == CompactionMode.TEXT) {
            yaml = compactor.compact(yaml);
        }
        return yaml;
    }

    OutputDocument assemble(SubscriptionDocument document) {
        List<ClassifiedNode> classified = classifier.classify(document.nodes());
        List<ProxyGroup> groups = synthesizer.synthesize(classified);
        List<String> rules = RuleListBuilder.build(synthesizer.directTarget(), synthesizer.defaultGroup());

        if (options.policy() == GroupingPolicy.PATTERN) {
            return new OutputDocument(document.passthroughSettings(), contents(document.nodes()), groups, rules);
        }
        ObjectNode settings = fixedSettings();
        ObjectNode override = options.settingsOverride();
        override.remove(SubscriptionDocument.GENERATED_KEYS);
        settings.setAll(override);
        return new OutputDocument(settings, infoFirst(document.nodes(), classified), groups, rules);
    }

    /**
     * Client settings written by the heuristic policy.
     */
    static ObjectNode fixedSettings() {
        ObjectNode settings = JsonNodeFactory.instance.objectNode();
        settings.put("port", 7890);
        settings.put("socks-port", 7891);
        settings.put("allow-lan", true);
        settings.put("mode", "rule");
        settings.put("log-level", "info");
        settings.put("external-controller", "127.0.0.1:9090");
        return settings;
    }

    // Info nodes first, then every other node (unnamed ones included) in input order.
    private static List<JsonNode> infoFirst(List<ProxyNode> nodes, List<ClassifiedNode> classified) {
        Set<ProxyNode> info = Collections.newSetFromMap(new IdentityHashMap<>());
        for (ClassifiedNode c : classified) {
            if (c.classification().kind() == Classification.Kind.INFO) info.add(c.node());
        }

        List<JsonNode> out = new ArrayList<>(nodes.size());
        for (ProxyNode node : nodes) {
            if (info.contains(node)) out.add(node.content());
        }
        for (ProxyNode node : nodes) {
            if (!info.contains(node)) out.add(node.content());
        }
        return out;
    }

    private static List<JsonNode> contents(List<ProxyNode> nodes) {
        List<JsonNode> out = new ArrayList<>(nodes.size());
        for (ProxyNode node : nodes) {
            out.add(node.content());
        }
        return out;
    }
}
