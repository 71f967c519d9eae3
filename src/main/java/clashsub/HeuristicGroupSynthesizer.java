package clashsub;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Group layout for name-derived regions:
 * {@code [默认代理, 订阅信息?, <regions in first-seen order>, 其他?]}.
 * Region members are sorted; info members keep input order. Tags that clash with
 * a reserved group name or with a node name go to {@code 其他}.
 */
public class HeuristicGroupSynthesizer implements GroupSynthesizer {

    public static final String MAIN_GROUP = "默认代理";
    public static final String INFO_GROUP = "订阅信息";
    public static final String OTHER_GROUP = "其他";
    public static final String DIRECT = "DIRECT";

    private static final Set<String> RESERVED_NAMES = Set.of(MAIN_GROUP, INFO_GROUP, OTHER_GROUP, DIRECT);

    /**
     * Orders strings by Unicode code point, i.e. the byte order of their UTF-8 form.
     * Plain {@link String#compareTo} orders by UTF-16 unit and puts emoji before
     * full-width characters.
     */
    static final Comparator<String> CODE_POINT_ORDER = (a, b) -> {
        int i = 0;
        int j = 0;
        while (i < a.length() && j < b.length()) {
            int ca = a.codePointAt(i);
            int cb = b.codePointAt(j);
            if (ca != cb) return Integer.compare(ca, cb);
            i += Character.charCount(ca);
            j += Character.charCount(cb);
        }
        return Integer.compare(a.length() - i, b.length() - j);
    };

    private final ProbePolicy probe;

    public HeuristicGroupSynthesizer(ProbePolicy probe) {
        this.probe = probe;
    }

    @Override
    public List<ProxyGroup> synthesize(List<ClassifiedNode> nodes) {
        List<String> infoMembers = new ArrayList<>();
        Map<String, List<String>> regions = new LinkedHashMap<>();
        List<String> otherMembers = new ArrayList<>();

        // a tag that is already a node name would put a group and a proxy under one name
        Set<String> nodeNames = new HashSet<>();
        for (ClassifiedNode node : nodes) {
            nodeNames.add(node.name());
        }

        for (ClassifiedNode node : nodes) {
            Classification c = node.classification();
            switch (c.kind()) {
                case INFO -> infoMembers.add(node.name());
                case REGION -> {
                    if (RESERVED_NAMES.contains(c.tag()) || nodeNames.contains(c.tag())) {
                        otherMembers.add(node.name());
                    } else {
                        regions.computeIfAbsent(c.tag(), k -> new ArrayList<>()).add(node.name());
                    }
                }
                case UNCLASSIFIED -> otherMembers.add(node.name());
            }
        }

        List<String> mainMembers = new ArrayList<>();
        if (!infoMembers.isEmpty()) mainMembers.add(INFO_GROUP);
        mainMembers.addAll(regions.keySet());
        if (!otherMembers.isEmpty()) mainMembers.add(OTHER_GROUP);
        mainMembers.add(DIRECT);

        List<ProxyGroup> groups = new ArrayList<>();
        groups.add(ProxyGroup.select(MAIN_GROUP, mainMembers));
        if (!infoMembers.isEmpty()) {
            groups.add(ProxyGroup.select(INFO_GROUP, infoMembers));
        }
        regions.forEach((tag, members) -> groups.add(ProxyGroup.loadBalance(tag, sorted(members), probe)));
        if (!otherMembers.isEmpty()) {
            groups.add(ProxyGroup.loadBalance(OTHER_GROUP, sorted(otherMembers), probe));
        }
        return groups;
    }

    @Override
    public String defaultGroup() {
        return MAIN_GROUP;
    }

    @Override
    public String directTarget() {
        return DIRECT;
    }

    private static List<String> sorted(List<String> members) {
        List<String> copy = new ArrayList<>(members);
        copy.sort(CODE_POINT_ORDER);
        return copy;
    }
}
