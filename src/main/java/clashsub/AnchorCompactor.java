package clashsub;

import java.util.ArrayList;
import java.util.List;

/**
 * Line-based rewrite of already serialized YAML that replaces the probe
 * settings of each load-balance group with a {@code <<: *lb_common} merge key
 * and prepends the shared {@code .lb_common} definition once.
 *
 * <p>Only a block of the exact shape
 * <pre>
 *   url: &lt;probe url&gt;
 *   interval: &lt;probe interval&gt;
 *   strategy: &lt;probe strategy&gt;
 * </pre>
 * at the group's field indentation is replaced; any other block is left as it is.
 * Compacting already compacted text returns it unchanged.
 */
public class AnchorCompactor {

    private static final String MERGE_LINE = DocumentSerializer.MERGE_KEY + ": *" + DocumentSerializer.ANCHOR;
    private static final String DEFINITION_PREFIX = DocumentSerializer.ANCHOR_KEY + ":";
    private static final String QUOTED_DEFINITION_PREFIX = "\"" + DocumentSerializer.ANCHOR_KEY + "\":";
    private static final String SINGLE_QUOTED_DEFINITION_PREFIX = "'" + DocumentSerializer.ANCHOR_KEY + "':";

    private final ProbePolicy probe;

    public AnchorCompactor() {
        this(ProbePolicy.DEFAULT);
    }

    public AnchorCompactor(ProbePolicy probe) {
        this.probe = probe;
    }

    public String compact(String yaml) {
        if (yaml == null || yaml.isEmpty()) return yaml;

        String[] lines = yaml.split("\n", -1);
        List<String> out = new ArrayList<>(lines.length + 5);
        int replaced = 0;

        int i = 0;
        while (i < lines.length) {
            String line = lines[i++];
            out.add(line);
            if (!"load-balance".equals(valueOf(line, "type"))) {
                continue;
            }

            int fieldIndent = keyColumn(line);
            while (i < lines.length) {
                String current = lines[i];
                if (current.isBlank()) {
                    out.add(current);
                    i++;
                    continue;
                }

                int indent = indentOf(current);
                // a dedent is the next group's list item or the next top-level section
                if (indent < fieldIndent) break;

                if (indent == fieldIndent && isProbeBlock(lines, i, fieldIndent)) {
                    out.add(" ".repeat(fieldIndent) + MERGE_LINE);
                    replaced++;
                    i += 3;
                    break;
                }

                out.add(current);
                i++;
            }
        }

        String result = String.join("\n", out);
        if (replaced > 0 && !hasDefinition(lines)) {
            result = definition() + result;
        }
        return result.endsWith("\n") ? result : result + "\n";
    }

    private boolean isProbeBlock(String[] lines, int start, int indent) {
        if (start + 2 >= lines.length) return false;
        for (int k = 0; k < 3; k++) {
            if (indentOf(lines[start + k]) != indent) return false;
        }
        return probe.url().equals(valueOf(lines[start], "url"))
            && String.valueOf(probe.interval()).equals(valueOf(lines[start + 1], "interval"))
            && probe.strategy().equals(valueOf(lines[start + 2], "strategy"));
    }

    private String definition() {
        return DEFINITION_PREFIX + " &" + DocumentSerializer.ANCHOR + "\n"
            + "  url: " + scalar(probe.url()) + "\n"
            + "  interval: " + probe.interval() + "\n"
            + "  strategy: " + scalar(probe.strategy()) + "\n"
            + "\n";
    }

    private static boolean hasDefinition(String[] lines) {
        for (String line : lines) {
            if (line.startsWith(DEFINITION_PREFIX)
                || line.startsWith(QUOTED_DEFINITION_PREFIX)
                || line.startsWith(SINGLE_QUOTED_DEFINITION_PREFIX)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Returns the unquoted value if the line is {@code key: value} (optionally
     * behind a list marker), otherwise null.
     */
    static String valueOf(String line, String key) {
        int column = keyColumn(line);
        String prefix = key + ":";
        if (!line.startsWith(prefix, column)) return null;
        String rest = line.substring(column + prefix.length());
        if (!rest.isEmpty() && rest.charAt(0) != ' ') return null;
        return unquote(rest.trim());
    }

    /**
     * Column of the first key on the line, past indentation and any {@code "- "} markers.
     */
    static int keyColumn(String line) {
        int pos = indentOf(line);
        while (line.startsWith("- ", pos)) {
            pos += 2;
            while (pos < line.length() && line.charAt(pos) == ' ') pos++;
        }
        return pos;
    }

    static int indentOf(String line) {
        int n = 0;
        while (n < line.length() && line.charAt(n) == ' ') n++;
        return n;
    }

    private static String unquote(String value) {
        if (value.length() >= 2) {
            char first = value.charAt(0);
            char last = value.charAt(value.length() - 1);
            if ((first == '"' || first == '\'') && first == last) {
                return value.substring(1, value.length() - 1);
            }
        }
        return value;
    }

    private static String scalar(String value) {
        boolean plain = !value.isEmpty()
            && "!&*{}[]|>'\"%@`#,?-".indexOf(value.charAt(0)) < 0
            && !value.contains(": ")
            && !value.contains(" #")
            && !value.endsWith(":");
        return plain ? value : "\"" + value.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
    }
}
