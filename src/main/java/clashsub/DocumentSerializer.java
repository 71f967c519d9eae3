package clashsub;

import java.io.IOException;
import java.io.StringWriter;
import java.util.Iterator;
import java.util.Map;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import com.fasterxml.jackson.dataformat.yaml.util.StringQuotingChecker;

/**
 * Renders an {@link OutputDocument} as Clash YAML.
 *
 * <p>When anchoring is requested, the probe settings shared by the load-balance
 * groups are written once under {@code .lb_common: &lb_common} and every group
 * refers to them with a {@code <<: *lb_common} merge key. Anchor and alias are
 * emitted through the generator's native object-id support.
 */
public final class DocumentSerializer {

    static final String ANCHOR = "lb_common";
    static final String ANCHOR_KEY = "." + ANCHOR;
    static final String MERGE_KEY = "<<";

    static final ObjectMapper YAML = new ObjectMapper(YAMLFactory.builder()
        .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
        .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES)
        .enable(YAMLGenerator.Feature.ALWAYS_QUOTE_NUMBERS_AS_STRINGS)
        .stringQuotingChecker(new AnchorKeyQuoting())
        .build());

    private DocumentSerializer() {
    }

    /**
     * @param document the configuration to render
     * @param anchored whether shared probe settings are written once and merged by reference
     * @return YAML text ending with a newline
     * @throws ConversionException with {@link ConversionException.Failure#SERIALIZE} if rendering fails
     */
    public static String serialize(OutputDocument document, boolean anchored) throws ConversionException {
        ProbePolicy shared = anchored ? sharedProbe(document) : null;
        StringWriter out = new StringWriter();

        try (JsonGenerator gen = YAML.getFactory().createGenerator(out)) {
            gen.writeStartObject();

            if (shared != null) {
                gen.writeFieldName(ANCHOR_KEY);
                gen.writeObjectId(ANCHOR);
                writeProbe(gen, shared);
            }

            Iterator<Map.Entry<String, JsonNode>> settings = document.settings().fields();
            while (settings.hasNext()) {
                Map.Entry<String, JsonNode> entry = settings.next();
                gen.writeFieldName(entry.getKey());
                gen.writeTree(entry.getValue());
            }

            gen.writeFieldName(SubscriptionDocument.PROXIES);
            gen.writeStartArray();
            for (JsonNode proxy : document.proxies()) {
                gen.writeTree(proxy);
            }
            gen.writeEndArray();

            gen.writeFieldName("proxy-groups");
            gen.writeStartArray();
            for (ProxyGroup group : document.groups()) {
                writeGroup(gen, group, shared);
            }
            gen.writeEndArray();

            gen.writeFieldName("rules");
            gen.writeStartArray();
            for (String rule : document.rules()) {
                gen.writeString(rule);
            }
            gen.writeEndArray();

            gen.writeEndObject();
        } catch (IOException | RuntimeException e) {
            throw new ConversionException(ConversionException.Failure.SERIALIZE,
                "Failed to serialize YAML: " + e.getMessage(), e);
        }

        String yaml = out.toString();
        return yaml.endsWith("\n") ? yaml : yaml + "\n";
    }

    private static void writeGroup(JsonGenerator gen, ProxyGroup group, ProbePolicy shared) throws IOException {
        ObjectNode fields = YAML.valueToTree(group);
        boolean merge = shared != null && shared.equals(group.probe());

        gen.writeStartObject();
        Iterator<Map.Entry<String, JsonNode>> it = fields.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            String key = entry.getKey();
            if (merge && isProbeField(key)) {
                if ("url".equals(key)) {
                    gen.writeFieldName(MERGE_KEY);
                    gen.writeObjectRef(ANCHOR);
                }
                continue;
            }
            gen.writeFieldName(key);
            gen.writeTree(entry.getValue());
        }
        gen.writeEndObject();
    }

    private static void writeProbe(JsonGenerator gen, ProbePolicy probe) throws IOException {
        gen.writeStartObject();
        gen.writeStringField("url", probe.url());
        gen.writeNumberField("interval", probe.interval());
        gen.writeStringField("strategy", probe.strategy());
        gen.writeEndObject();
    }

    private static boolean isProbeField(String key) {
        return "url".equals(key) || "interval".equals(key) || "strategy".equals(key);
    }

    // Leading dots look numeric to the default checker; the anchor key stays plain.
    private static final class AnchorKeyQuoting extends StringQuotingChecker {
        private static final long serialVersionUID = 1L;

        private final StringQuotingChecker defaults = StringQuotingChecker.Default.instance();

        @Override
        public boolean needToQuoteName(String name) {
            return !ANCHOR_KEY.equals(name) && defaults.needToQuoteName(name);
        }

        @Override
        public boolean needToQuoteValue(String value) {
            return defaults.needToQuoteValue(value);
        }
    }

    // The first load-balance group's probe settings; groups with other settings keep them inline.
    private static ProbePolicy sharedProbe(OutputDocument document) {
        for (ProxyGroup group : document.groups()) {
            ProbePolicy probe = group.probe();
            if (probe != null) return probe;
        }
        return null;
    }
}
