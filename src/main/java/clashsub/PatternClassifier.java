package clashsub;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Classifies nodes against an ordered table of region patterns. The last
 * row of the table is always a catch-all, so every named node lands in some region.
 */
public class PatternClassifier implements NodeClassifier {

    public static final String CATCH_ALL_LABEL = "其他负载组";

    public static final List<RegionPattern> DEFAULT_REGIONS = List.of(
        new RegionPattern("香港负载组", "(?i)港|hk|hongkong|hong kong"),
        new RegionPattern("台湾负载组", "(?i)台|tw|taiwan"),
        new RegionPattern("日本负载组", "(?i)日|jp|japan"),
        new RegionPattern("新加坡负载组", "(?i)新|sg|singapore"),
        new RegionPattern("美国负载组", "(?i)美|us|usa|united states|america"),
        new RegionPattern("韩国负载组", "(?i)韩|kr|korea"),
        new RegionPattern("英国负载组", "(?i)英|uk|britain|united kingdom"),
        new RegionPattern("德国负载组", "(?i)德|de|germany"),
        new RegionPattern("法国负载组", "(?i)法|fr|france"),
        new RegionPattern("加拿大负载组", "(?i)加|ca|canada"),
        new RegionPattern("澳大利亚负载组", "(?i)澳|au|australia"),
        new RegionPattern("马来西亚负载组", "(?i)马来|my|malaysia"),
        new RegionPattern("土耳其负载组", "(?i)土耳其|tr|turkey"),
        new RegionPattern("阿根廷负载组", "(?i)阿根廷|ar|argentina"),
        new RegionPattern(CATCH_ALL_LABEL, RegionPattern.UNIVERSAL)
    );

    private final List<RegionPattern> regions;
    private final List<Pattern> compiled;

    public PatternClassifier() {
        this(DEFAULT_REGIONS);
    }

    /**
     * @param regions region table in priority order; a catch-all row is appended if none is present
     */
    public PatternClassifier(List<RegionPattern> regions) {
        this.regions = withCatchAll(regions);
        this.compiled = new ArrayList<>(this.regions.size());
        for (RegionPattern region : this.regions) {
            compiled.add(region.compile()); // null for a malformed filter
        }
    }

    public List<RegionPattern> regions() {
        return regions;
    }

    @Override
    public List<ClassifiedNode> classify(List<ProxyNode> nodes) {
        List<ClassifiedNode> out = new ArrayList<>();
        for (ProxyNode node : nodes) {
            if (!node.hasName()) continue;
            out.add(new ClassifiedNode(node, Classification.region(firstMatch(node.name()).label())));
        }
        return out;
    }

    /**
     * Regions that at least one name matches, in table order. The catch-all is always included.
     */
    public List<RegionPattern> activeRegions(List<String> names) {
        List<RegionPattern> active = new ArrayList<>();
        for (int i = 0; i < regions.size(); i++) {
            RegionPattern region = regions.get(i);
            if (region.isUniversal() || anyMatches(compiled.get(i), names)) {
                active.add(region);
            }
        }
        return active;
    }

    private RegionPattern firstMatch(String name) {
        RegionPattern fallback = null;
        for (int i = 0; i < regions.size(); i++) {
            RegionPattern region = regions.get(i);
            if (region.isUniversal()) {
                if (fallback == null) fallback = region;
                continue;
            }
            if (matches(compiled.get(i), name)) return region;
        }
        return fallback;
    }

    private static boolean anyMatches(Pattern pattern, List<String> names) {
        if (pattern == null) return false;
        for (String name : names) {
            if (pattern.matcher(name).find()) return true;
        }
        return false;
    }

    private static boolean matches(Pattern pattern, String name) {
        return pattern != null && pattern.matcher(name).find();
    }

    private static List<RegionPattern> withCatchAll(List<RegionPattern> regions) {
        List<RegionPattern> out = new ArrayList<>(regions);
        if (out.stream().noneMatch(RegionPattern::isUniversal)) {
            out.add(new RegionPattern(CATCH_ALL_LABEL, RegionPattern.UNIVERSAL));
        }
        return List.copyOf(out);
    }
}
