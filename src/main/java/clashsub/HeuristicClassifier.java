package clashsub;

import java.util.ArrayList;
import java.util.List;

/**
 * Classifies nodes from their names alone: informational placeholders are
 * recognised by marker words, regions are derived by cutting a trailing
 * number off the name.
 */
public class HeuristicClassifier implements NodeClassifier {

    // traffic, expiry, official site, subscription/plan, remaining, reset, time, group/channel, update
    private static final List<String> INFO_MARKERS = List.of(
        "官网", "网址", "流量", "过期", "到期", "订阅", "套餐",
        "剩余", "重置", "时间", "群", "频道", "更新"
    );

    // hyphen, underscore, space, ASCII bar, middle dot, full-width bar, hash, at-sign
    private static final String DELIMITERS = "-_ |·｜#@";

    @Override
    public List<ClassifiedNode> classify(List<ProxyNode> nodes) {
        List<ClassifiedNode> out = new ArrayList<>();
        for (ProxyNode node : nodes) {
            if (!node.hasName()) continue;
            out.add(new ClassifiedNode(node, classify(node.name())));
        }
        return out;
    }

    static Classification classify(String name) {
        if (isInfoNode(name)) {
            return Classification.info();
        }
        String region = extractRegion(name);
        return region != null ? Classification.region(region) : Classification.unclassified();
    }

    /**
     * Returns true if the name carries any informational marker. Plain,
     * case-sensitive substring matching.
     */
    public static boolean isInfoNode(String name) {
        if (name == null || name.isEmpty()) return false;
        for (String marker : INFO_MARKERS) {
            if (name.contains(marker)) return true;
        }
        return false;
    }

    /**
     * Derives the region tag from a node name.
     * <ol>
     *   <li>At the last delimiter: a non-empty, all-digit suffix after a non-empty prefix
     *       yields the prefix ({@code "US-West-01" -> "US-West"}).</li>
     *   <li>Otherwise a trailing run of digits is stripped ({@code "香港01" -> "香港"}).</li>
     * </ol>
     *
     * @return the tag, or null if neither rule applies
     */
    public static String extractRegion(String name) {
        if (name == null || name.isEmpty()) return null;

        int delimiter = lastDelimiter(name);
        if (delimiter > 0) {
            String suffix = name.substring(delimiter + 1);
            if (isAsciiDigits(suffix)) {
                return name.substring(0, delimiter);
            }
        }

        int end = name.length();
        while (end > 0 && isAsciiDigit(name.charAt(end - 1))) {
            end--;
        }
        if (end > 0 && end < name.length()) {
            return name.substring(0, end);
        }
        return null;
    }

    private static int lastDelimiter(String name) {
        for (int i = name.length() - 1; i >= 0; i--) {
            if (DELIMITERS.indexOf(name.charAt(i)) >= 0) return i;
        }
        return -1;
    }

    private static boolean isAsciiDigits(String s) {
        if (s.isEmpty()) return false;
        for (int i = 0; i < s.length(); i++) {
            if (!isAsciiDigit(s.charAt(i))) return false;
        }
        return true;
    }

    private static boolean isAsciiDigit(char c) {
        return c >= '0' && c <= '9';
    }
}
